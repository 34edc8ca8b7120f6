package com.flagship.tax_submission.voiding;

import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Daily communication voiding one or more accepted receipts.
 */
@Value
public class VoidCommunication {
    String tenantId;
    String communicationNumber;
    LocalDate voidDate;
    Instant issuedAt;
    List<String> documentNumbers;
    String reason;
    String blobKey;
}
