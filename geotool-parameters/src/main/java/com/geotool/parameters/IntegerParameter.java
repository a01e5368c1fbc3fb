package com.geotool.parameters;

/**
 * Integer value with optional inclusive bounds.
 */
public class IntegerParameter extends ValueParameter<Integer> {

    private Integer minValue;
    private Integer maxValue;

    @Override
    public ParameterKind getKind() {
        return ParameterKind.INTEGER;
    }

    @Override
    public <R> R accept(ParameterVisitor<R> visitor) {
        return visitor.visitInteger(this);
    }

    /**
     * Sets inclusive bounds.
     *
     * @throws IllegalArgumentException if min is greater than max
     */
    public void setRange(int minValue, int maxValue) {
        if (minValue > maxValue) {
            throw new IllegalArgumentException("min " + minValue + " > max " + maxValue);
        }
        this.minValue = minValue;
        this.maxValue = maxValue;
    }

    /** Lower bound, or null when no range was declared. */
    public Integer getMinValue() {
        return minValue;
    }

    /** Upper bound, or null when no range was declared. */
    public Integer getMaxValue() {
        return maxValue;
    }

    @Override
    protected Integer convert(Object raw) {
        if (raw instanceof Integer) return (Integer) raw;
        if (raw instanceof Number) {
            double d = ((Number) raw).doubleValue();
            if (d != Math.rint(d) || d < Integer.MIN_VALUE || d > Integer.MAX_VALUE) {
                throw new IllegalArgumentException("Not an integer: " + raw);
            }
            return (int) d;
        }
        if (raw instanceof String) {
            return Integer.parseInt(((String) raw).trim());
        }
        throw new IllegalArgumentException("Cannot convert " + raw.getClass().getSimpleName() + " to integer");
    }

    @Override
    protected ValidationResult validateValue(Integer value) {
        if (minValue != null && (value < minValue || value > maxValue)) {
            return ValidationResult.error(label() + " must be between " + minValue + " and " + maxValue + ".");
        }
        return ValidationResult.ok();
    }
}
