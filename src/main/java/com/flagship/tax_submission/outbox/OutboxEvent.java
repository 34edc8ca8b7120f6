package com.flagship.tax_submission.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A document lifecycle event waiting in the outbox.
 *
 * Written in the same transaction as the document change it describes and
 * published to Kafka later by {@link OutboxPublisher}.
 */
@Value
public class OutboxEvent {
    UUID id;
    String tenantId;
    String aggregateType;      // "Document"
    UUID aggregateId;          // document id
    String eventType;          // e.g. "DocumentStateChanged"
    String payload;            // JSON
    String correlationId;
    Instant createdAt;
    Instant publishedAt;       // null until published
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(String tenantId, String aggregateType, UUID aggregateId,
                                     String eventType, String payload, String correlationId) {
        return new OutboxEvent(
            UUID.randomUUID(),
            tenantId,
            aggregateType,
            aggregateId,
            eventType,
            payload,
            correlationId,
            Instant.now(),
            null,
            0,
            null,
            null   // assigned by database
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    public boolean isDeadLetter(int maxRetries) {
        return !isPublished() && retryCount >= maxRetries;
    }
}
