package com.flagship.tax_submission.exception;

/**
 * Raised when caller-supplied input is invalid. Names the offending field,
 * e.g. {@code items[1].quantity}.
 */
public class InputValidationException extends RuntimeException {

    private final String field;

    public InputValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public InputValidationException(String field, String message, Throwable cause) {
        super(message, cause);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
