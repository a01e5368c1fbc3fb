package com.geotool.parameters;

/**
 * Floating point value with optional inclusive bounds.
 */
public class DoubleParameter extends ValueParameter<Double> {

    private Double minValue;
    private Double maxValue;

    @Override
    public ParameterKind getKind() {
        return ParameterKind.DOUBLE;
    }

    @Override
    public <R> R accept(ParameterVisitor<R> visitor) {
        return visitor.visitDouble(this);
    }

    /**
     * Sets inclusive bounds.
     *
     * @throws IllegalArgumentException if min is greater than max or either bound is NaN
     */
    public void setRange(double minValue, double maxValue) {
        if (Double.isNaN(minValue) || Double.isNaN(maxValue) || minValue > maxValue) {
            throw new IllegalArgumentException("Invalid range [" + minValue + ", " + maxValue + "]");
        }
        this.minValue = minValue;
        this.maxValue = maxValue;
    }

    public Double getMinValue() {
        return minValue;
    }

    public Double getMaxValue() {
        return maxValue;
    }

    @Override
    protected Double convert(Object raw) {
        if (raw instanceof Number) return ((Number) raw).doubleValue();
        if (raw instanceof String) {
            return Double.parseDouble(((String) raw).trim());
        }
        throw new IllegalArgumentException("Cannot convert " + raw.getClass().getSimpleName() + " to double");
    }

    @Override
    protected ValidationResult validateValue(Double value) {
        if (value.isNaN()) {
            return ValidationResult.error(label() + " is not a number.");
        }
        if (minValue != null && (value < minValue || value > maxValue)) {
            return ValidationResult.error(label() + " must be between " + minValue + " and " + maxValue + ".");
        }
        return ValidationResult.ok();
    }
}
