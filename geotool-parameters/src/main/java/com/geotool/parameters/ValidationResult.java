package com.geotool.parameters;

/**
 * Outcome of validating a parameter: valid, or invalid with a message for the user.
 */
public record ValidationResult(boolean valid, String message) {

    private static final ValidationResult OK = new ValidationResult(true, "");

    public ValidationResult {
        message = message != null ? message : "";
    }

    public static ValidationResult ok() {
        return OK;
    }

    public static ValidationResult error(String message) {
        return new ValidationResult(false, message);
    }
}
