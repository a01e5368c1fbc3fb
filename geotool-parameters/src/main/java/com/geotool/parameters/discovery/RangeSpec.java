package com.geotool.parameters.discovery;

/**
 * Declared inclusive [minimum, maximum] of a numeric slot. Integer parameters truncate the bounds
 * toward zero; double parameters keep them as declared.
 */
public record RangeSpec(double minimum, double maximum) {

    public RangeSpec {
        if (Double.isNaN(minimum) || Double.isNaN(maximum) || minimum > maximum) {
            throw new IllegalArgumentException("Invalid range [" + minimum + ", " + maximum + "]");
        }
    }
}
