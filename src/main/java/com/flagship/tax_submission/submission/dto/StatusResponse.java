package com.flagship.tax_submission.submission.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.tax_submission.document.DocumentState;
import com.flagship.tax_submission.submission.DocumentStatus;
import lombok.Value;

import java.time.Instant;

/**
 * Response DTO for the status query. Optional parts are omitted when absent.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StatusResponse {

    @JsonProperty("document_number")
    String documentNumber;

    @JsonProperty("state")
    DocumentState state;

    @JsonProperty("receipt")
    Receipt receipt;

    @JsonProperty("rejection_reason")
    String rejectionReason;

    @JsonProperty("issued_at")
    Instant issuedAt;

    @Value
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Receipt {
        @JsonProperty("code")
        String code;

        @JsonProperty("message")
        String message;

        @JsonProperty("ticket")
        String ticket;

        @JsonProperty("received_at")
        Instant receivedAt;

        @JsonProperty("download_url")
        String downloadUrl;
    }

    public static StatusResponse from(DocumentStatus status) {
        DocumentStatus.ReceiptSummary summary = status.getReceipt();
        Receipt receipt = summary == null ? null
            : new Receipt(summary.getCode(), summary.getMessage(), summary.getTicket(),
                summary.getReceivedAt(), summary.getDownloadUrl());
        return new StatusResponse(status.getDocumentNumber(), status.getState(), receipt,
            status.getRejectionReason(), status.getIssuedAt());
    }
}
