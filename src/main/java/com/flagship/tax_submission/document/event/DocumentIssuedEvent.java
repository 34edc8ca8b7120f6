package com.flagship.tax_submission.document.event;

import com.flagship.tax_submission.document.Document;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Event published when a document is numbered and stored in PENDING state.
 */
@Value
public class DocumentIssuedEvent implements DocumentEvent {
    UUID eventId;
    UUID documentId;
    String tenantId;
    String documentNumber;
    String kind;
    String currency;
    BigDecimal total;
    String referencedDocumentNumber;
    Instant occurredAt;

    public static final String EVENT_TYPE = "DocumentIssued";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static DocumentIssuedEvent fromDocument(Document document) {
        return new DocumentIssuedEvent(
            UUID.randomUUID(),
            document.getId(),
            document.getTenantId(),
            document.getDocumentNumber(),
            document.getKind().name(),
            document.getCurrency().name(),
            document.getTotals().getTotal(),
            document.getReference() != null ? document.getReference().getDocumentNumber() : null,
            Instant.now()
        );
    }
}
