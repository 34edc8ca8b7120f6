package com.flagship.tax_submission.submission.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.tax_submission.document.DocumentState;
import com.flagship.tax_submission.submission.SubmissionOutcome;
import lombok.Value;

/**
 * Response DTO for submit, re-drive and ticket refresh.
 */
@Value
public class SubmissionResponse {

    @JsonProperty("document_number")
    String documentNumber;

    @JsonProperty("state")
    DocumentState state;

    @JsonProperty("receipt")
    ReceiptResponse receipt;

    @JsonProperty("attempts")
    int attempts;

    public static SubmissionResponse from(SubmissionOutcome outcome) {
        return new SubmissionResponse(outcome.getDocumentNumber(), outcome.getState(),
            ReceiptResponse.from(outcome.getReceipt()), outcome.getAttempts());
    }
}
