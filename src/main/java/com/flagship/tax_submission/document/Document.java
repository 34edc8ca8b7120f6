package com.flagship.tax_submission.document;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Tax document domain object.
 *
 * Key principles:
 * - Lifecycle transitions are explicit and validated against {@link DocumentState}
 * - ACCEPTED and REJECTED are reached only from SUBMITTED
 * - Issued content (number, parties, items, totals, raw XML) never changes
 * - State changes are immutable (a new Document is returned)
 */
@Value
@Builder(toBuilder = true)
public class Document {
    UUID id;
    String tenantId;
    String documentNumber;
    DocumentKind kind;
    String series;
    long sequence;
    Instant issuedAt;
    CurrencyCode currency;
    Party issuer;
    Party recipient;
    List<LineItem> items;
    Totals totals;
    DocumentReference reference;
    DocumentState state;
    String rawXml;
    String signedXmlKey;
    DocumentReceipt receipt;
    List<TransmissionError> transmissionErrors;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Creates a freshly numbered document in PENDING state.
     */
    public static Document issue(String tenantId, DocumentKind kind, String series, long sequence,
                                 String documentNumber, Instant issuedAt, CurrencyCode currency,
                                 Party issuer, Party recipient, List<LineItem> items,
                                 DocumentReference reference, String rawXml) {
        return Document.builder()
            .id(UUID.randomUUID())
            .tenantId(tenantId)
            .documentNumber(documentNumber)
            .kind(kind)
            .series(series)
            .sequence(sequence)
            .issuedAt(issuedAt)
            .currency(currency)
            .issuer(issuer)
            .recipient(recipient)
            .items(List.copyOf(items))
            .totals(Totals.of(items))
            .reference(reference)
            .state(DocumentState.PENDING)
            .rawXml(rawXml)
            .transmissionErrors(List.of())
            .createdAt(issuedAt)
            .updatedAt(issuedAt)
            .build();
    }

    /**
     * Records the key of the signed XML blob. A document is signed once.
     */
    public Document withSignedXml(String blobKey) {
        if (signedXmlKey != null && !signedXmlKey.equals(blobKey)) {
            throw new IllegalStateException(
                String.format("Document %s is already signed (%s).", documentNumber, signedXmlKey));
        }
        return toBuilder().signedXmlKey(blobKey).updatedAt(Instant.now()).build();
    }

    public Document withReceipt(DocumentReceipt receipt) {
        return toBuilder().receipt(receipt).updatedAt(Instant.now()).build();
    }

    public Document withTransmissionErrors(List<TransmissionError> errors) {
        return toBuilder().transmissionErrors(List.copyOf(errors)).updatedAt(Instant.now()).build();
    }

    public boolean isSigned() {
        return signedXmlKey != null;
    }

    /**
     * A PENDING document with a recorded transmission failure may be re-driven.
     */
    public boolean isAwaitingRedrive() {
        return state == DocumentState.PENDING
            && transmissionErrors != null
            && !transmissionErrors.isEmpty();
    }

    /**
     * Rejection reason, present only for REJECTED documents.
     */
    public String rejectionReason() {
        if (state != DocumentState.REJECTED || receipt == null) {
            return null;
        }
        return receipt.getMessage();
    }
}
