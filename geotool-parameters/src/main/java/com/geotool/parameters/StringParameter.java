package com.geotool.parameters;

/**
 * Free text value. A required string must not be blank.
 */
public class StringParameter extends ValueParameter<String> {

    @Override
    public ParameterKind getKind() {
        return ParameterKind.STRING;
    }

    @Override
    public <R> R accept(ParameterVisitor<R> visitor) {
        return visitor.visitString(this);
    }

    @Override
    protected String convert(Object raw) {
        return raw.toString();
    }

    @Override
    protected ValidationResult validateValue(String value) {
        if (isRequired() && value.isBlank()) {
            return ValidationResult.error(label() + " is required.");
        }
        return ValidationResult.ok();
    }
}
