package com.flagship.tax_submission.submission.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.tax_submission.document.DocumentReceipt;
import lombok.Value;

import java.time.Instant;

@Value
public class ReceiptResponse {

    @JsonProperty("code")
    String code;

    @JsonProperty("message")
    String message;

    @JsonProperty("ticket")
    String ticket;

    @JsonProperty("received_at")
    Instant receivedAt;

    public static ReceiptResponse from(DocumentReceipt receipt) {
        return receipt == null ? null
            : new ReceiptResponse(receipt.getResponseCode(), receipt.getMessage(), receipt.getTicket(),
                receipt.getReceivedAt());
    }
}
