package com.flagship.tax_submission.exception;

import com.flagship.tax_submission.transmission.FailureTag;
import com.flagship.tax_submission.transmission.TaggedFailure;

/**
 * The tax authority answered, but refused the request at the protocol level
 * (bad credentials, malformed payload, duplicate submission).
 */
public class AuthorityProtocolException extends RuntimeException implements TaggedFailure {

    private final FailureTag tag;

    public AuthorityProtocolException(FailureTag tag, String message) {
        super(message);
        this.tag = tag;
    }

    public AuthorityProtocolException(FailureTag tag, String message, Throwable cause) {
        super(message, cause);
        this.tag = tag;
    }

    @Override
    public FailureTag getTag() {
        return tag;
    }
}
