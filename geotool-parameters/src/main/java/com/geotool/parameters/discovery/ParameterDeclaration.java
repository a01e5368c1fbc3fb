package com.geotool.parameters.discovery;

import com.geotool.parameters.ToolParameter;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * One row of a tool's parameter table: slot id, how to create the parameter, and its metadata.
 *
 * @param slotId       name of the slot; unique within a tool
 * @param factory      creates a fresh, unbound parameter of the slot's variant
 * @param index        declared position (for UI ordering)
 * @param displayName  label shown to the user
 * @param required     true for required slots, false for optional ones
 * @param range        numeric bounds, or null; ignored for non-numeric variants
 * @param defaultValue declared default, or null
 */
public record ParameterDeclaration(
        String slotId,
        Supplier<? extends ToolParameter> factory,
        int index,
        String displayName,
        boolean required,
        RangeSpec range,
        Object defaultValue
) {
    public ParameterDeclaration {
        Objects.requireNonNull(slotId, "slotId");
        if (slotId.isBlank()) {
            throw new IllegalArgumentException("Slot id must be non-blank");
        }
        Objects.requireNonNull(factory, "factory");
        displayName = displayName != null ? displayName : "";
    }

    public static ParameterDeclaration required(String slotId, Supplier<? extends ToolParameter> factory,
                                                int index, String displayName) {
        return new ParameterDeclaration(slotId, factory, index, displayName, true, null, null);
    }

    public static ParameterDeclaration optional(String slotId, Supplier<? extends ToolParameter> factory,
                                                int index, String displayName) {
        return new ParameterDeclaration(slotId, factory, index, displayName, false, null, null);
    }

    public ParameterDeclaration withRange(double minimum, double maximum) {
        return new ParameterDeclaration(slotId, factory, index, displayName, required,
                new RangeSpec(minimum, maximum), defaultValue);
    }

    public ParameterDeclaration withDefault(Object value) {
        return new ParameterDeclaration(slotId, factory, index, displayName, required, range, value);
    }
}
