package com.flagship.tax_submission.document;

import lombok.Value;

import java.time.Instant;

/**
 * Receipt metadata as recorded on a document.
 *
 * The raw body itself lives in the tenant's blob space under bodyKey.
 */
@Value
public class DocumentReceipt {
    String responseCode;
    String message;
    String ticket;
    Instant receivedAt;
    String bodyKey;

    public static DocumentReceipt from(Receipt receipt, String bodyKey) {
        return new DocumentReceipt(
            receipt.getResponseCode(),
            receipt.getMessage(),
            receipt.getTicket(),
            receipt.getReceivedAt(),
            bodyKey
        );
    }

    /**
     * True while the authority is still processing a ticketed submission.
     */
    public boolean awaitsTicketResolution() {
        return ticket != null
            && (Receipt.TICKET.equalsIgnoreCase(responseCode) || Receipt.PROCESSING.equalsIgnoreCase(responseCode));
    }
}
