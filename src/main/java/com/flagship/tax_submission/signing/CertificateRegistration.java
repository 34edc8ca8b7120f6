package com.flagship.tax_submission.signing;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Summary of a registered certificate, returned on upload and on status reads.
 */
@Value
public class CertificateRegistration {
    String tenantId;
    String subject;
    String issuer;
    String serialNumber;
    Instant notBefore;
    Instant notAfter;
    Instant uploadedAt;
    long daysToExpiry;
    boolean expiringSoon;

    public static CertificateRegistration of(String tenantId, String subject, String issuer, String serialNumber,
                                             Instant notBefore, Instant notAfter, Instant uploadedAt,
                                             Instant now, int warningDays) {
        long days = Duration.between(now, notAfter).toDays();
        return new CertificateRegistration(tenantId, subject, issuer, serialNumber, notBefore, notAfter,
            uploadedAt, days, days <= warningDays);
    }
}
