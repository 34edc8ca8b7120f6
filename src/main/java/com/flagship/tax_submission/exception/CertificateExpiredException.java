package com.flagship.tax_submission.exception;

import java.time.Instant;

/**
 * Raised when the certificate's validity window does not cover the current
 * instant. Covers both expired and not-yet-valid certificates.
 */
public class CertificateExpiredException extends SigningCertificateException {

    private final Instant notBefore;
    private final Instant notAfter;

    public CertificateExpiredException(String tenantId, Instant notBefore, Instant notAfter) {
        super(tenantId, String.format("Certificate for tenant %s is outside its validity window [%s, %s]",
            tenantId, notBefore, notAfter));
        this.notBefore = notBefore;
        this.notAfter = notAfter;
    }

    public Instant getNotBefore() {
        return notBefore;
    }

    public Instant getNotAfter() {
        return notAfter;
    }

    @Override
    public String getReason() {
        return "certificate_expired";
    }
}
