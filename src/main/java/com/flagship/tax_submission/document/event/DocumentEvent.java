package com.flagship.tax_submission.document.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for document lifecycle events.
 *
 * Events are written to the outbox in the same transaction as the change
 * they describe and published to Kafka afterwards.
 */
public interface DocumentEvent {

    /**
     * Unique identifier for this event instance.
     * Used for deduplication in consumers.
     */
    UUID getEventId();

    /**
     * The document this event is about.
     */
    UUID getDocumentId();

    String getTenantId();

    String getDocumentNumber();

    Instant getOccurredAt();

    String getEventType();
}
