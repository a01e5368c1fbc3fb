package com.geotool.parameters;

/**
 * Discriminant of the parameter variants.
 */
public enum ParameterKind {

    INTEGER(true, true),
    DOUBLE(true, true),
    STRING(true, false),
    BOOLEAN(true, false),
    /** Selection of an existing map layer. */
    LAYER(false, false),
    /** Destination of the dataset a tool produces. */
    OUTPUT_LAYER(false, false);

    private final boolean value;
    private final boolean numeric;

    ParameterKind(boolean value, boolean numeric) {
        this.value = value;
        this.numeric = numeric;
    }

    /** True for variants backed by {@link ValueParameter}. */
    public boolean isValue() {
        return value;
    }

    /** True for variants that carry min/max bounds. */
    public boolean isNumeric() {
        return numeric;
    }
}
