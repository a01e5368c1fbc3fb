package com.geotool.parameters;

/**
 * Parameter holding a single typed value and an optional default.
 *
 * @param <T> value type
 */
public abstract class ValueParameter<T> extends ToolParameter {

    private T value;
    private T defaultValue;

    public T getValue() {
        return value;
    }

    public void setValue(T value) {
        this.value = value;
    }

    public T getDefaultValue() {
        return defaultValue;
    }

    public boolean hasValue() {
        return value != null;
    }

    /** Restores the default value (null when none was declared). */
    public void reset() {
        this.value = defaultValue;
    }

    /**
     * Sets both the default and the current value.
     */
    @Override
    public void setDefaultValue(Object raw) {
        T converted = raw != null ? convert(raw) : null;
        this.defaultValue = converted;
        this.value = converted;
    }

    @Override
    public ValidationResult validate() {
        if (value == null) {
            return isRequired() ? ValidationResult.error(label() + " is required.") : ValidationResult.ok();
        }
        return validateValue(value);
    }

    /**
     * Converts a declared or user-supplied raw value.
     *
     * @throws IllegalArgumentException if the value has the wrong type or format
     */
    protected abstract T convert(Object raw);

    /** Variant-specific checks of a non-null value. */
    protected ValidationResult validateValue(T value) {
        return ValidationResult.ok();
    }
}
