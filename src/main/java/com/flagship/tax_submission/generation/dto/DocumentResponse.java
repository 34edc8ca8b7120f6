package com.flagship.tax_submission.generation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.tax_submission.document.CurrencyCode;
import com.flagship.tax_submission.document.Document;
import com.flagship.tax_submission.document.DocumentKind;
import com.flagship.tax_submission.document.DocumentState;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Response DTO for a single document.
 */
@Value
@Builder
public class DocumentResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("tenant_id")
    String tenantId;

    @JsonProperty("document_number")
    String documentNumber;

    @JsonProperty("kind")
    DocumentKind kind;

    @JsonProperty("series")
    String series;

    @JsonProperty("sequence")
    long sequence;

    @JsonProperty("issued_at")
    Instant issuedAt;

    @JsonProperty("currency")
    CurrencyCode currency;

    @JsonProperty("issuer")
    PartyDto issuer;

    @JsonProperty("recipient")
    PartyDto recipient;

    @JsonProperty("items")
    List<LineItemDto> items;

    @JsonProperty("subtotal")
    BigDecimal subtotal;

    @JsonProperty("tax")
    BigDecimal tax;

    @JsonProperty("total")
    BigDecimal total;

    @JsonProperty("reference")
    ReferenceDto reference;

    @JsonProperty("state")
    DocumentState state;

    @JsonProperty("signed")
    boolean signed;

    @JsonProperty("response_code")
    String responseCode;

    @JsonProperty("transmission_failures")
    int transmissionFailures;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static DocumentResponse from(Document document) {
        return DocumentResponse.builder()
            .id(document.getId())
            .tenantId(document.getTenantId())
            .documentNumber(document.getDocumentNumber())
            .kind(document.getKind())
            .series(document.getSeries())
            .sequence(document.getSequence())
            .issuedAt(document.getIssuedAt())
            .currency(document.getCurrency())
            .issuer(PartyDto.from(document.getIssuer()))
            .recipient(PartyDto.from(document.getRecipient()))
            .items(document.getItems().stream().map(LineItemDto::from).toList())
            .subtotal(document.getTotals().getSubtotal())
            .tax(document.getTotals().getTax())
            .total(document.getTotals().getTotal())
            .reference(ReferenceDto.from(document.getReference()))
            .state(document.getState())
            .signed(document.isSigned())
            .responseCode(document.getReceipt() != null ? document.getReceipt().getResponseCode() : null)
            .transmissionFailures(document.getTransmissionErrors() != null ? document.getTransmissionErrors().size() : 0)
            .createdAt(document.getCreatedAt())
            .updatedAt(document.getUpdatedAt())
            .build();
    }
}
