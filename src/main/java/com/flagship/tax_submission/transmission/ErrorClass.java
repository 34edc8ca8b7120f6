package com.flagship.tax_submission.transmission;

/**
 * Advisory classification of a failed transmission attempt.
 */
public enum ErrorClass {
    RECOVERABLE,
    NON_RECOVERABLE,
    UNCLASSIFIED
}
