package com.flagship.tax_submission.document.event;

import com.flagship.tax_submission.document.Document;
import com.flagship.tax_submission.document.DocumentState;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Event published on every lifecycle transition of a document.
 *
 * Carries the authority's response code and message when the transition was
 * driven by a receipt.
 */
@Value
public class DocumentStateChangedEvent implements DocumentEvent {
    UUID eventId;
    UUID documentId;
    String tenantId;
    String documentNumber;
    DocumentState fromState;
    DocumentState toState;
    String responseCode;
    String responseMessage;
    Instant occurredAt;

    public static final String EVENT_TYPE = "DocumentStateChanged";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static DocumentStateChangedEvent fromTransition(Document document, DocumentState from, DocumentState to) {
        return new DocumentStateChangedEvent(
            UUID.randomUUID(),
            document.getId(),
            document.getTenantId(),
            document.getDocumentNumber(),
            from,
            to,
            document.getReceipt() != null ? document.getReceipt().getResponseCode() : null,
            document.getReceipt() != null ? document.getReceipt().getMessage() : null,
            Instant.now()
        );
    }
}
