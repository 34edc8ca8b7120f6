package com.flagship.tax_submission.transmission;

import com.flagship.tax_submission.document.TransmissionError;
import com.flagship.tax_submission.observability.SubmissionMetrics;
import com.flagship.tax_submission.store.TenantIsolatedStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs an authority call with bounded retries and exponential backoff.
 *
 * Attempt 1 runs immediately. After failed attempt i the engine waits
 * initialDelay * multiplier^(i-1) ms, up to maxRetries + 1 attempts in total.
 * Every failure is logged with its classification. When the attempts are used
 * up the document goes back to PENDING with the full error log.
 *
 * Classification does not stop retries unless
 * transmission.retry.short-circuit-non-recoverable is set.
 */
@Component
@Slf4j
public class TransmissionRetryEngine {

    private final ErrorClassifier classifier;
    private final Sleeper sleeper;
    private final TenantIsolatedStore store;
    private final SubmissionMetrics metrics;
    private final Clock clock;

    private final int maxRetries;
    private final long initialDelayMs;
    private final double multiplier;
    private final boolean shortCircuitNonRecoverable;

    public TransmissionRetryEngine(ErrorClassifier classifier,
                                   Sleeper sleeper,
                                   TenantIsolatedStore store,
                                   SubmissionMetrics metrics,
                                   Clock clock,
                                   @Value("${transmission.retry.max-retries:3}") int maxRetries,
                                   @Value("${transmission.retry.initial-delay-ms:1000}") long initialDelayMs,
                                   @Value("${transmission.retry.multiplier:2}") double multiplier,
                                   @Value("${transmission.retry.short-circuit-non-recoverable:false}")
                                   boolean shortCircuitNonRecoverable) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("transmission.retry.max-retries must not be negative");
        }
        if (initialDelayMs < 0 || multiplier < 1) {
            throw new IllegalArgumentException("Retry delay must be >= 0 and multiplier >= 1");
        }
        this.classifier = classifier;
        this.sleeper = sleeper;
        this.store = store;
        this.metrics = metrics;
        this.clock = clock;
        this.maxRetries = maxRetries;
        this.initialDelayMs = initialDelayMs;
        this.multiplier = multiplier;
        this.shortCircuitNonRecoverable = shortCircuitNonRecoverable;
    }

    public <T> TransmissionResult<T> executeWithRetry(TransmissionOperation<T> operation,
                                                      String tenantId, String documentNumber) {
        int maxAttempts = maxRetries + 1;
        List<TransmissionError> errorLog = new ArrayList<>();
        long startNanos = System.nanoTime();

        try {
            for (int attempt = 1; attempt <= maxAttempts; attempt++) {
                try {
                    T result = operation.execute(attempt);
                    if (attempt > 1) {
                        log.info("Document {} transmitted on attempt {}/{} (tenant {})",
                            documentNumber, attempt, maxAttempts, tenantId);
                    }
                    return TransmissionResult.succeeded(result, attempt, errorLog);

                } catch (Exception e) {
                    ErrorClass errorClass = classifier.classify(e);
                    boolean lastAttempt = attempt == maxAttempts;
                    boolean stopEarly = shortCircuitNonRecoverable && errorClass == ErrorClass.NON_RECOVERABLE;
                    boolean interrupted = e instanceof InterruptedException;
                    long delay = lastAttempt || stopEarly || interrupted ? 0 : delayAfterAttempt(attempt);

                    errorLog.add(new TransmissionError(clock.instant(), attempt, describe(e), delay, errorClass.name()));
                    metrics.recordTransmissionFailure(errorClass.name());
                    log.warn("Transmission attempt {}/{} failed for document {} (tenant {}) [{}]: {}",
                        attempt, maxAttempts, documentNumber, tenantId, errorClass, describe(e));

                    if (interrupted) {
                        Thread.currentThread().interrupt();
                        return giveUp(tenantId, documentNumber, attempt, errorLog, false, e);
                    }
                    if (stopEarly) {
                        log.error("Non-recoverable failure for document {} (tenant {}); not retrying",
                            documentNumber, tenantId);
                        return giveUp(tenantId, documentNumber, attempt, errorLog, true, e);
                    }
                    if (lastAttempt) {
                        metrics.recordRetryExhausted();
                        log.error("Transmission of document {} exhausted {} attempts (tenant {})",
                            documentNumber, maxAttempts, tenantId);
                        return giveUp(tenantId, documentNumber, attempt, errorLog, false, e);
                    }

                    try {
                        sleeper.sleep(delay);
                    } catch (InterruptedException sleepInterrupted) {
                        Thread.currentThread().interrupt();
                        log.warn("Retry wait interrupted for document {} (tenant {})", documentNumber, tenantId);
                        return giveUp(tenantId, documentNumber, attempt, errorLog, false, sleepInterrupted);
                    }
                }
            }
            throw new IllegalStateException("Retry loop ended without an outcome");

        } finally {
            metrics.recordTransmissionDuration(Duration.ofNanos(System.nanoTime() - startNanos));
        }
    }

    /**
     * Wait scheduled after the given failed attempt.
     */
    long delayAfterAttempt(int attempt) {
        return (long) (initialDelayMs * Math.pow(multiplier, attempt - 1));
    }

    private <T> TransmissionResult<T> giveUp(String tenantId, String documentNumber, int attempts,
                                             List<TransmissionError> errorLog, boolean shortCircuited,
                                             Exception lastFailure) {
        store.recordTransmissionFailure(tenantId, store.getDocument(tenantId, documentNumber), errorLog);
        return TransmissionResult.failed(attempts, errorLog, shortCircuited, lastFailure);
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
