package com.flagship.tax_submission.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.tax_submission.document.Document;
import com.flagship.tax_submission.document.DocumentReceipt;
import com.flagship.tax_submission.document.DocumentReference;
import com.flagship.tax_submission.document.LineItem;
import com.flagship.tax_submission.document.Party;
import com.flagship.tax_submission.document.Totals;
import com.flagship.tax_submission.document.TransmissionError;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Converts between {@link Document} and {@link DocumentEntity}, including the
 * JSON columns.
 */
@Component
@RequiredArgsConstructor
class DocumentMapper {

    private static final TypeReference<List<LineItem>> ITEM_LIST = new TypeReference<>() {};
    private static final TypeReference<List<TransmissionError>> ERROR_LIST = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    DocumentEntity toEntity(Document document, String idempotencyKey) {
        DocumentReference reference = document.getReference();
        return DocumentEntity.builder()
            .id(document.getId())
            .tenantId(document.getTenantId())
            .documentNumber(document.getDocumentNumber())
            .kind(document.getKind())
            .series(document.getSeries())
            .sequenceNumber(document.getSequence())
            .issuedAt(document.getIssuedAt())
            .currency(document.getCurrency())
            .issuer(write(document.getIssuer()))
            .recipient(write(document.getRecipient()))
            .items(write(document.getItems()))
            .subtotal(document.getTotals().getSubtotal())
            .taxAmount(document.getTotals().getTax())
            .total(document.getTotals().getTotal())
            .referencedNumber(reference != null ? reference.getDocumentNumber() : null)
            .referencedKind(reference != null ? reference.getKind() : null)
            .referenceReasonCode(reference != null ? reference.getReasonCode() : null)
            .referenceDescription(reference != null ? reference.getDescription() : null)
            .state(document.getState())
            .rawXml(document.getRawXml())
            .signedXmlKey(document.getSignedXmlKey())
            .transmissionErrors(writeErrors(document.getTransmissionErrors()))
            .idempotencyKey(idempotencyKey)
            .build();
    }

    Document toDomain(DocumentEntity entity) {
        DocumentReference reference = entity.getReferencedNumber() == null ? null
            : new DocumentReference(entity.getReferencedNumber(), entity.getReferencedKind(),
                entity.getReferenceReasonCode(), entity.getReferenceDescription());
        DocumentReceipt receipt = entity.getReceiptCode() == null ? null
            : new DocumentReceipt(entity.getReceiptCode(), entity.getReceiptMessage(), entity.getReceiptTicket(),
                entity.getReceiptReceivedAt(), entity.getReceiptBodyKey());

        return Document.builder()
            .id(entity.getId())
            .tenantId(entity.getTenantId())
            .documentNumber(entity.getDocumentNumber())
            .kind(entity.getKind())
            .series(entity.getSeries())
            .sequence(entity.getSequenceNumber())
            .issuedAt(entity.getIssuedAt())
            .currency(entity.getCurrency())
            .issuer(read(entity.getIssuer(), Party.class))
            .recipient(read(entity.getRecipient(), Party.class))
            .items(readList(entity.getItems(), ITEM_LIST))
            .totals(new Totals(entity.getSubtotal(), entity.getTaxAmount(), entity.getTotal()))
            .reference(reference)
            .state(entity.getState())
            .rawXml(entity.getRawXml())
            .signedXmlKey(entity.getSignedXmlKey())
            .receipt(receipt)
            .transmissionErrors(readList(entity.getTransmissionErrors(), ERROR_LIST))
            .createdAt(entity.getCreatedAt())
            .updatedAt(entity.getUpdatedAt())
            .build();
    }

    String writeErrors(List<TransmissionError> errors) {
        return errors == null || errors.isEmpty() ? null : write(errors);
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize document column", e);
        }
    }

    private <T> T read(String json, Class<T> type) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt document column: " + type.getSimpleName(), e);
        }
    }

    private <T> List<T> readList(String json, TypeReference<List<T>> type) {
        if (json == null) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt document column", e);
        }
    }
}
