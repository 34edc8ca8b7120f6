package com.flagship.tax_submission.signing;

import lombok.ToString;
import lombok.Value;

import java.security.PrivateKey;
import java.security.cert.X509Certificate;
import java.time.Instant;

/**
 * A tenant's signing certificate together with its private key.
 */
@Value
public class StoredCertificate {
    String tenantId;
    X509Certificate certificate;
    @ToString.Exclude
    PrivateKey privateKey;

    public Instant getNotBefore() {
        return certificate.getNotBefore().toInstant();
    }

    public Instant getNotAfter() {
        return certificate.getNotAfter().toInstant();
    }

    /**
     * True when {@code instant} lies inside [notBefore, notAfter].
     */
    public boolean isValidAt(Instant instant) {
        return !instant.isBefore(getNotBefore()) && !instant.isAfter(getNotAfter());
    }
}
