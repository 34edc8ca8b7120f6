package com.flagship.tax_submission.exception;

import com.flagship.tax_submission.transmission.FailureTag;
import com.flagship.tax_submission.transmission.TaggedFailure;

/**
 * The tax authority could not be reached or did not answer in time.
 */
public class TransientTransportException extends RuntimeException implements TaggedFailure {

    private final FailureTag tag;

    public TransientTransportException(FailureTag tag, String message, Throwable cause) {
        super(message, cause);
        this.tag = tag;
    }

    @Override
    public FailureTag getTag() {
        return tag;
    }

    public boolean isTimeout() {
        return tag == FailureTag.TIMEOUT;
    }
}
