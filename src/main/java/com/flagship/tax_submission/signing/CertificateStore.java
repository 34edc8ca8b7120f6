package com.flagship.tax_submission.signing;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Access to tenants' signing certificates.
 *
 * The signer never reads key material any other way.
 */
public interface CertificateStore {

    /**
     * Loads the tenant's certificate and private key, if one is registered.
     */
    Optional<StoredCertificate> find(String tenantId);

    /**
     * Validates and stores a PKCS#12 keystore for the tenant, replacing any previous one.
     */
    CertificateRegistration register(String tenantId, byte[] pkcs12, String passphrase);

    Optional<CertificateRegistration> status(String tenantId);

    /**
     * Certificates whose notAfter falls before {@code cutoff}, soonest first.
     */
    List<CertificateRegistration> findExpiringBefore(Instant cutoff);
}
