package com.flagship.tax_submission.generation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.tax_submission.document.DocumentKind;
import com.flagship.tax_submission.generation.DocumentPayload;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.List;

/**
 * Request DTO for issuing a document. Field-level rules (catalog codes,
 * decimals, id formats) are enforced by the payload validator.
 */
@Value
public class GenerateDocumentRequest {

    @NotNull(message = "Document kind is required")
    @JsonProperty("kind")
    DocumentKind kind;

    @JsonProperty("series")
    String series;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("recipient")
    PartyDto recipient;

    @JsonProperty("items")
    List<LineItemDto> items;

    @JsonProperty("reference")
    ReferenceDto reference;

    public DocumentPayload toPayload() {
        return DocumentPayload.builder()
            .series(series)
            .currency(currency)
            .recipient(recipient != null ? recipient.toDomain() : null)
            .items(items != null ? items.stream().map(i -> i != null ? i.toDomain() : null).toList() : null)
            .referencedNumber(reference != null ? reference.getDocumentNumber() : null)
            .reasonCode(reference != null ? reference.getReasonCode() : null)
            .referenceDescription(reference != null ? reference.getDescription() : null)
            .build();
    }
}
