package com.geotool.parameters.discovery;

import com.geotool.parameters.ToolParameter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Creates and binds the parameters of a tool from its declaration table.
 * <p>
 * For each declaration, in table order: create the parameter, bind slot id, index, label and
 * required flag, apply the range if the parameter is numeric, apply the default. A slot whose
 * parameter cannot be created or whose default cannot be converted is a tool-authoring defect:
 * it is logged at error level and left out of the result; the remaining slots are still built.
 */
public final class ParameterDiscovery {

    private static final Logger log = LoggerFactory.getLogger(ParameterDiscovery.class);

    private ParameterDiscovery() {
    }

    /**
     * Builds the parameters declared in the table.
     *
     * @param declarations declaration table, in slot order
     * @return parameters in declaration order (not sorted by index)
     * @throws IllegalArgumentException if two declarations use the same slot id
     */
    public static ParameterSet discover(List<ParameterDeclaration> declarations) {
        Objects.requireNonNull(declarations, "declarations");
        Set<String> seen = new HashSet<>();
        Map<String, ToolParameter> bySlot = new LinkedHashMap<>();
        for (ParameterDeclaration declaration : declarations) {
            if (!seen.add(declaration.slotId())) {
                throw new IllegalArgumentException("Duplicate parameter slot: " + declaration.slotId());
            }
            ToolParameter parameter = create(declaration);
            if (parameter != null) {
                bySlot.put(declaration.slotId(), parameter);
            }
        }
        return new ParameterSet(bySlot);
    }

    private static ToolParameter create(ParameterDeclaration declaration) {
        String slot = declaration.slotId();
        ToolParameter parameter;
        try {
            parameter = declaration.factory().get();
        } catch (RuntimeException e) {
            log.error("Skipping parameter slot {}: cannot create parameter: {}", slot, e.getMessage(), e);
            return null;
        }
        if (parameter == null) {
            log.error("Skipping parameter slot {}: factory returned null", slot);
            return null;
        }

        try {
            parameter.bind(slot, declaration.index(), declaration.displayName(), declaration.required());
            if (declaration.range() != null) {
                boolean applied = parameter.accept(new NumericRangeBinder(declaration.range()));
                if (!applied) {
                    log.debug("Range on non-numeric parameter slot {} ignored", slot);
                }
            }
            if (declaration.defaultValue() != null) {
                parameter.setDefaultValue(declaration.defaultValue());
            }
        } catch (IllegalArgumentException | IllegalStateException e) {
            log.error("Skipping parameter slot {}: invalid metadata: {}", slot, e.getMessage());
            return null;
        }
        return parameter;
    }
}
