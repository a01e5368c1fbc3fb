package com.geotool.parameters;

import java.util.Objects;

/**
 * Base of all tool parameters: one named slot of a tool with its declared position, label and
 * required flag. Name, index, label and required flag are bound once, at discovery, and never change.
 */
public abstract class ToolParameter {

    private String name;
    private int index = -1;
    private String displayName;
    private boolean required;
    private boolean bound;

    /** Variant tag of this parameter. */
    public abstract ParameterKind getKind();

    public abstract <R> R accept(ParameterVisitor<R> visitor);

    /** Checks the current value; never throws for bad values. */
    public abstract ValidationResult validate();

    /**
     * Applies a declared default value, converting it to the parameter's own type.
     *
     * @throws IllegalArgumentException if the value cannot be converted or the variant has no default
     */
    public abstract void setDefaultValue(Object value);

    /**
     * Binds the declaration metadata of this parameter.
     *
     * @throws IllegalStateException if the parameter was already bound
     */
    public final void bind(String name, int index, String displayName, boolean required) {
        if (bound) {
            throw new IllegalStateException("Parameter already bound: " + this.name);
        }
        this.name = Objects.requireNonNull(name, "name");
        this.index = index;
        this.displayName = displayName != null ? displayName : "";
        this.required = required;
        this.bound = true;
    }

    public boolean isBound() {
        return bound;
    }

    /** Slot id of the parameter in its tool. */
    public String getName() {
        return name;
    }

    /** Declared position; -1 until bound. */
    public int getIndex() {
        return index;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isRequired() {
        return required;
    }

    /** Display name if there is one, else the slot id. Used in messages. */
    protected String label() {
        if (displayName != null && !displayName.isBlank()) return displayName;
        return name != null ? name : getKind().name();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{name=" + name + ", index=" + index + ", required=" + required + "}";
    }
}
