package com.flagship.tax_submission.tenant.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.tax_submission.signing.CertificateRegistration;
import lombok.Value;

import java.time.Instant;

@Value
public class CertificateResponse {

    @JsonProperty("subject")
    String subject;

    @JsonProperty("issuer")
    String issuer;

    @JsonProperty("serial_number")
    String serialNumber;

    @JsonProperty("not_before")
    Instant notBefore;

    @JsonProperty("not_after")
    Instant notAfter;

    @JsonProperty("uploaded_at")
    Instant uploadedAt;

    @JsonProperty("days_to_expiry")
    long daysToExpiry;

    @JsonProperty("expiring_soon")
    boolean expiringSoon;

    public static CertificateResponse from(CertificateRegistration registration) {
        return new CertificateResponse(registration.getSubject(), registration.getIssuer(),
            registration.getSerialNumber(), registration.getNotBefore(), registration.getNotAfter(),
            registration.getUploadedAt(), registration.getDaysToExpiry(), registration.isExpiringSoon());
    }
}
