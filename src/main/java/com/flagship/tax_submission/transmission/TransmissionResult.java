package com.flagship.tax_submission.transmission;

import com.flagship.tax_submission.document.TransmissionError;
import lombok.ToString;
import lombok.Value;

import java.util.List;

/**
 * Outcome of a retried transmission.
 *
 * On success at attempt k, totalAttempts is k and errorLog holds k-1 entries.
 */
@Value
public class TransmissionResult<T> {
    boolean success;
    T result;
    int totalAttempts;
    List<TransmissionError> errorLog;
    boolean shortCircuited;
    @ToString.Exclude
    Exception lastFailure;

    static <T> TransmissionResult<T> succeeded(T result, int attempts, List<TransmissionError> errorLog) {
        return new TransmissionResult<>(true, result, attempts, List.copyOf(errorLog), false, null);
    }

    static <T> TransmissionResult<T> failed(int attempts, List<TransmissionError> errorLog,
                                            boolean shortCircuited, Exception lastFailure) {
        return new TransmissionResult<>(false, null, attempts, List.copyOf(errorLog), shortCircuited, lastFailure);
    }
}
