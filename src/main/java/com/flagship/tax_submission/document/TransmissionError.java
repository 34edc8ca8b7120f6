package com.flagship.tax_submission.document;

import lombok.Value;

import java.time.Instant;

/**
 * One failed transmission attempt.
 *
 * delayBeforeNextMs is the wait scheduled before the following attempt, and
 * is 0 on the final failure.
 */
@Value
public class TransmissionError {
    Instant timestamp;
    int attemptIndex;
    String message;
    long delayBeforeNextMs;
    String errorClass;
}
