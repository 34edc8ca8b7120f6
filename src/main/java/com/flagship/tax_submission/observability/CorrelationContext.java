package com.flagship.tax_submission.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Request-scoped logging context for the document pipeline.
 *
 * Holds the correlation id of the current thread and owns the MDC keys the
 * log pattern prints: correlationId, tenantId and documentNumber. The
 * correlation id is also copied into outbox events and from there into the
 * X-Correlation-ID header of every Kafka record.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String TENANT_ID_MDC_KEY = "tenantId";
    public static final String DOCUMENT_NUMBER_MDC_KEY = "documentNumber";

    private static final ThreadLocal<String> CURRENT = new ThreadLocal<>();

    private CorrelationContext() {
    }

    /**
     * Starts a context for the given id, or a fresh one when it is blank.
     *
     * @return the id now in effect
     */
    public static String begin(String requestedId) {
        String id = requestedId == null || requestedId.isBlank() ? newCorrelationId() : requestedId.trim();
        CURRENT.set(id);
        MDC.put(CORRELATION_ID_MDC_KEY, id);
        return id;
    }

    public static String getCorrelationId() {
        String id = CURRENT.get();
        return id != null ? id : begin(null);
    }

    public static boolean hasCorrelationId() {
        return CURRENT.get() != null;
    }

    public static void putTenant(String tenantId) {
        if (tenantId != null) {
            MDC.put(TENANT_ID_MDC_KEY, tenantId);
        }
    }

    public static void putDocument(String tenantId, String documentNumber) {
        putTenant(tenantId);
        if (documentNumber != null) {
            MDC.put(DOCUMENT_NUMBER_MDC_KEY, documentNumber);
        }
    }

    public static void clearDocument() {
        MDC.remove(DOCUMENT_NUMBER_MDC_KEY);
    }

    /**
     * Drops the correlation id and every pipeline MDC key of this thread.
     */
    public static void end() {
        CURRENT.remove();
        MDC.remove(CORRELATION_ID_MDC_KEY);
        MDC.remove(TENANT_ID_MDC_KEY);
        MDC.remove(DOCUMENT_NUMBER_MDC_KEY);
    }

    static String newCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
