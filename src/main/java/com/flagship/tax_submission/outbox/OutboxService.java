package com.flagship.tax_submission.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.tax_submission.document.event.DocumentEvent;
import com.flagship.tax_submission.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Writes document lifecycle events to the outbox.
 *
 * Events are saved inside the caller's transaction: if the document change
 * commits, the event is guaranteed to exist; if it rolls back, so does the
 * event. Publishing to Kafka happens later in {@link OutboxPublisher}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    public static final String AGGREGATE_TYPE = "Document";

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;

    /**
     * Saves a document event within the current transaction.
     *
     * MANDATORY propagation: calling this outside a transaction is a bug.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveEvent(DocumentEvent event) {
        OutboxEvent outboxEvent = OutboxEvent.create(
            event.getTenantId(),
            AGGREGATE_TYPE,
            event.getDocumentId(),
            event.getEventType(),
            serializePayload(event),
            CorrelationContext.hasCorrelationId() ? CorrelationContext.getCorrelationId() : null
        );

        OutboxEventEntity saved = repository.save(OutboxEventEntity.fromDomain(outboxEvent));

        log.debug("Saved outbox event: type={}, documentNumber={}, documentId={}",
                event.getEventType(), event.getDocumentNumber(), event.getDocumentId());

        return saved.toDomain();
    }

    /**
     * Claims a batch of events for publishing.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> findPublishableEvents(int limit, int maxRetries) {
        return repository.findPublishableEventsForUpdate(limit, maxRetries)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markPublished();
            repository.save(entity);
            log.debug("Marked event {} as published", eventId);
        });
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(UUID eventId, String errorMessage) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markFailed(errorMessage);
            repository.save(entity);
            log.warn("Marked event {} as failed (retry #{}): {}",
                    eventId, entity.getRetryCount(), errorMessage);
        });
    }

    /**
     * Events of one document in the order they were written.
     */
    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForDocument(UUID documentId) {
        return repository.findByAggregateIdOrderBySequenceNumberAsc(documentId)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional
    public int purgePublishedBefore(Instant cutoff) {
        return repository.deletePublishedEventsBefore(cutoff);
    }

    private String serializePayload(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize event payload", e);
        }
    }
}
