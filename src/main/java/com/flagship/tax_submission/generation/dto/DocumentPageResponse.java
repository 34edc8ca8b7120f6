package com.flagship.tax_submission.generation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.tax_submission.document.Document;
import com.flagship.tax_submission.document.DocumentKind;
import com.flagship.tax_submission.document.DocumentState;
import lombok.Value;
import org.springframework.data.domain.Page;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * One page of a tenant's documents, newest first.
 */
@Value
public class DocumentPageResponse {

    @JsonProperty("content")
    List<Summary> content;

    @JsonProperty("page")
    int page;

    @JsonProperty("size")
    int size;

    @JsonProperty("total_elements")
    long totalElements;

    @JsonProperty("total_pages")
    int totalPages;

    @Value
    public static class Summary {
        @JsonProperty("document_number")
        String documentNumber;

        @JsonProperty("kind")
        DocumentKind kind;

        @JsonProperty("state")
        DocumentState state;

        @JsonProperty("issued_at")
        Instant issuedAt;

        @JsonProperty("recipient_name")
        String recipientName;

        @JsonProperty("total")
        BigDecimal total;

        @JsonProperty("currency")
        String currency;
    }

    public static DocumentPageResponse from(Page<Document> page) {
        List<Summary> content = page.getContent().stream()
            .map(d -> new Summary(d.getDocumentNumber(), d.getKind(), d.getState(), d.getIssuedAt(),
                d.getRecipient() != null ? d.getRecipient().getName() : null,
                d.getTotals().getTotal(), d.getCurrency().name()))
            .toList();
        return new DocumentPageResponse(content, page.getNumber(), page.getSize(),
            page.getTotalElements(), page.getTotalPages());
    }
}
