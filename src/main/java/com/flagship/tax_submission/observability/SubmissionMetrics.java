package com.flagship.tax_submission.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Centralized metrics for the document pipeline.
 *
 * Metrics exposed:
 * - documents.issued: documents generated, by kind and status
 * - documents.signed: signing outcomes
 * - submissions.completed: submission outcomes (accepted, rejected, submitted, exhausted, ...)
 * - transmission.attempts.failed: failed authority calls, by error class
 * - transmission.retries.exhausted: submissions left PENDING after the last retry
 * - tenant.ownership.violations: cross-tenant write attempts, by resource
 * - pipeline.latency: operation latency
 * - certificates.expiring: certificates inside the expiry warning window
 * - documents.in_state: documents currently PENDING or SUBMITTED, across tenants
 */
@Component
public class SubmissionMetrics {

    private final MeterRegistry registry;

    private final Counter retriesExhausted;
    private final Timer transmissionTimer;
    private final AtomicLong expiringCertificates = new AtomicLong(0);
    private final AtomicLong pendingDocuments = new AtomicLong(0);
    private final AtomicLong submittedDocuments = new AtomicLong(0);

    public SubmissionMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.retriesExhausted = Counter.builder("transmission.retries.exhausted")
                .description("Submissions that failed every attempt and were left PENDING")
                .register(registry);

        this.transmissionTimer = Timer.builder("transmission.duration")
                .description("Time spent transmitting a document, retries included")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);

        Gauge.builder("certificates.expiring", expiringCertificates, AtomicLong::get)
                .description("Signing certificates expiring within the warning window")
                .register(registry);

        Gauge.builder("documents.in_state", pendingDocuments, AtomicLong::get)
                .description("Documents not yet transmitted or waiting for re-drive")
                .tag("state", "PENDING")
                .register(registry);

        Gauge.builder("documents.in_state", submittedDocuments, AtomicLong::get)
                .description("Documents transmitted and waiting for a final answer")
                .tag("state", "SUBMITTED")
                .register(registry);
    }

    public void recordDocumentIssued(String kind, String status) {
        registry.counter("documents.issued",
                "kind", sanitizeTag(kind),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordSigning(String status) {
        registry.counter("documents.signed", "status", sanitizeTag(status)).increment();
    }

    public void recordSubmissionOutcome(String outcome) {
        registry.counter("submissions.completed", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordTransmissionFailure(String errorClass) {
        registry.counter("transmission.attempts.failed", "error_class", sanitizeTag(errorClass)).increment();
    }

    public void recordRetryExhausted() {
        retriesExhausted.increment();
    }

    public void recordTransmissionDuration(Duration duration) {
        transmissionTimer.record(duration);
    }

    public void recordOwnershipViolation(String resource) {
        registry.counter("tenant.ownership.violations", "resource", sanitizeTag(resource)).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("pipeline.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    public void setExpiringCertificates(long count) {
        expiringCertificates.set(count);
    }

    public void setOpenDocuments(long pending, long submitted) {
        pendingDocuments.set(pending);
        submittedDocuments.set(submitted);
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
