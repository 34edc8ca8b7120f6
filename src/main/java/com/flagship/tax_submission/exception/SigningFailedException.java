package com.flagship.tax_submission.exception;

/**
 * Unexpected cryptographic or XML processing failure while signing.
 */
public class SigningFailedException extends RuntimeException {

    public SigningFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
