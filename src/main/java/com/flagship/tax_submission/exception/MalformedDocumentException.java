package com.flagship.tax_submission.exception;

/**
 * Raised when XML handed to the signer is empty or not well-formed.
 */
public class MalformedDocumentException extends InputValidationException {

    public MalformedDocumentException(String message) {
        super("rawXml", message);
    }

    public MalformedDocumentException(String message, Throwable cause) {
        super("rawXml", message, cause);
    }
}
