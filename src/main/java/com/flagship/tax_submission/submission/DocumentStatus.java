package com.flagship.tax_submission.submission;

import com.flagship.tax_submission.document.DocumentState;
import lombok.Value;

import java.time.Instant;

/**
 * Read-only view of where a document stands with the authority.
 */
@Value
public class DocumentStatus {
    String documentNumber;
    DocumentState state;
    ReceiptSummary receipt;
    String rejectionReason;
    Instant issuedAt;

    @Value
    public static class ReceiptSummary {
        String code;
        String message;
        String ticket;
        Instant receivedAt;
        String downloadUrl;
    }
}
