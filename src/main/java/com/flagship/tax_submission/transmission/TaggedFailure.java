package com.flagship.tax_submission.transmission;

/**
 * Implemented by exceptions that know why they happened.
 */
public interface TaggedFailure {

    FailureTag getTag();
}
