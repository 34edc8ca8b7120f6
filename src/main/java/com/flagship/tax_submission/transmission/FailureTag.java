package com.flagship.tax_submission.transmission;

/**
 * Structured reason attached to a failure raised by an {@link AuthorityClient}.
 *
 * Tags take precedence over message matching when a failure is classified.
 */
public enum FailureTag {
    TIMEOUT(ErrorClass.RECOVERABLE),
    CONNECTION_FAILURE(ErrorClass.RECOVERABLE),
    SERVICE_UNAVAILABLE(ErrorClass.RECOVERABLE),
    AUTHORIZATION(ErrorClass.NON_RECOVERABLE),
    INVALID_REQUEST(ErrorClass.NON_RECOVERABLE),
    DUPLICATE_SUBMISSION(ErrorClass.NON_RECOVERABLE),
    UNKNOWN(ErrorClass.UNCLASSIFIED);

    private final ErrorClass errorClass;

    FailureTag(ErrorClass errorClass) {
        this.errorClass = errorClass;
    }

    public ErrorClass getErrorClass() {
        return errorClass;
    }
}
