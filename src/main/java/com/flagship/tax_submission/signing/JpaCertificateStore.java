package com.flagship.tax_submission.signing;

import com.flagship.tax_submission.crypto.SecretCipher;
import com.flagship.tax_submission.exception.CertificateExpiredException;
import com.flagship.tax_submission.exception.CertificateOwnershipMismatchException;
import com.flagship.tax_submission.exception.InputValidationException;
import com.flagship.tax_submission.exception.SigningFailedException;
import com.flagship.tax_submission.store.BlobKeys;
import com.flagship.tax_submission.store.TenantIsolatedStore;
import com.flagship.tax_submission.tenant.Tenant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.security.GeneralSecurityException;
import java.security.Key;
import java.security.KeyStore;
import java.security.PrivateKey;
import java.security.cert.Certificate;
import java.security.cert.X509Certificate;
import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Certificate store backed by the certificates table and the tenant blob space.
 *
 * The PKCS#12 file is kept as {tenantId}/certificates/{tenantId}.p12 and its
 * passphrase is stored AES-GCM encrypted.
 */
@Component
@Slf4j
public class JpaCertificateStore implements CertificateStore {

    static final String PKCS12_CONTENT_TYPE = "application/x-pkcs12";

    private final CertificateRepository certificateRepository;
    private final TenantIsolatedStore store;
    private final SecretCipher secretCipher;
    private final Clock clock;
    private final int warningDays;

    public JpaCertificateStore(CertificateRepository certificateRepository,
                               TenantIsolatedStore store,
                               SecretCipher secretCipher,
                               Clock clock,
                               @Value("${certificates.expiry-warning-days:30}") int warningDays) {
        this.certificateRepository = certificateRepository;
        this.store = store;
        this.secretCipher = secretCipher;
        this.clock = clock;
        this.warningDays = warningDays;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<StoredCertificate> find(String tenantId) {
        Optional<CertificateEntity> entity = certificateRepository.findById(tenantId);
        if (entity.isEmpty()) {
            return Optional.empty();
        }

        Optional<byte[]> pkcs12 = store.getBlob(tenantId, entity.get().getBlobKey());
        if (pkcs12.isEmpty()) {
            log.warn("Certificate metadata for tenant {} points to missing blob {}",
                tenantId, entity.get().getBlobKey());
            return Optional.empty();
        }

        String passphrase = secretCipher.decrypt(entity.get().getEncryptedPassphrase());
        try {
            return Optional.of(readKeyStore(tenantId, pkcs12.get(), passphrase));
        } catch (GeneralSecurityException | IOException e) {
            throw new SigningFailedException("Stored certificate for tenant " + tenantId + " cannot be opened", e);
        }
    }

    /**
     * @throws InputValidationException if the file, passphrase or tenant id is unusable
     * @throws CertificateExpiredException if the certificate is outside its validity window
     * @throws CertificateOwnershipMismatchException if the certificate names another fiscal id
     */
    @Override
    @Transactional
    public CertificateRegistration register(String tenantId, byte[] pkcs12, String passphrase) {
        if (!Tenant.isValidFiscalId(tenantId)) {
            throw new InputValidationException("tenantId", "Tenant id must be exactly 11 digits");
        }
        if (pkcs12 == null || pkcs12.length == 0) {
            throw new InputValidationException("certificate", "Certificate file is empty");
        }
        if (passphrase == null || passphrase.isBlank()) {
            throw new InputValidationException("passphrase", "Certificate passphrase is required");
        }

        StoredCertificate loaded;
        try {
            loaded = readKeyStore(tenantId, pkcs12, passphrase);
        } catch (GeneralSecurityException | IOException e) {
            throw new InputValidationException("certificate",
                "Unable to open PKCS#12 keystore (wrong passphrase or corrupt file)", e);
        }

        Instant now = clock.instant();
        if (!loaded.isValidAt(now)) {
            throw new CertificateExpiredException(tenantId, loaded.getNotBefore(), loaded.getNotAfter());
        }

        String owner = CertificateIdentity.fiscalId(loaded.getCertificate()).orElse(null);
        if (!tenantId.equals(owner)) {
            throw new CertificateOwnershipMismatchException(tenantId, owner);
        }

        X509Certificate certificate = loaded.getCertificate();
        String blobKey = BlobKeys.certificate(tenantId);
        String subject = certificate.getSubjectX500Principal().getName();
        String issuer = certificate.getIssuerX500Principal().getName();
        String serial = certificate.getSerialNumber().toString(16);
        String encryptedPassphrase = secretCipher.encrypt(passphrase);

        store.putBlob(tenantId, blobKey, pkcs12, PKCS12_CONTENT_TYPE);

        CertificateEntity entity = certificateRepository.findById(tenantId)
            .map(existing -> {
                existing.replace(blobKey, encryptedPassphrase, subject, issuer, serial,
                    loaded.getNotBefore(), loaded.getNotAfter(), now);
                return existing;
            })
            .orElseGet(() -> CertificateEntity.create(tenantId, blobKey, encryptedPassphrase, subject, issuer,
                serial, loaded.getNotBefore(), loaded.getNotAfter(), now));
        CertificateRegistration registration = toRegistration(certificateRepository.save(entity), now);

        log.info("Registered certificate for tenant {}: subject={}, notAfter={}, daysToExpiry={}",
            tenantId, subject, registration.getNotAfter(), registration.getDaysToExpiry());
        if (registration.isExpiringSoon()) {
            log.warn("Certificate for tenant {} expires in {} days", tenantId, registration.getDaysToExpiry());
        }
        return registration;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<CertificateRegistration> status(String tenantId) {
        Instant now = clock.instant();
        return certificateRepository.findById(tenantId).map(entity -> toRegistration(entity, now));
    }

    @Override
    @Transactional(readOnly = true)
    public List<CertificateRegistration> findExpiringBefore(Instant cutoff) {
        Instant now = clock.instant();
        return certificateRepository.findByNotAfterBeforeOrderByNotAfterAsc(cutoff).stream()
            .map(entity -> toRegistration(entity, now))
            .toList();
    }

    private CertificateRegistration toRegistration(CertificateEntity entity, Instant now) {
        return CertificateRegistration.of(entity.getTenantId(), entity.getSubject(), entity.getIssuer(),
            entity.getSerialNumber(), entity.getNotBefore(), entity.getNotAfter(), entity.getUploadedAt(),
            now, warningDays);
    }

    /**
     * Opens a PKCS#12 keystore and returns its first private-key entry.
     */
    static StoredCertificate readKeyStore(String tenantId, byte[] pkcs12, String passphrase)
            throws GeneralSecurityException, IOException {
        char[] password = passphrase.toCharArray();
        KeyStore keyStore = KeyStore.getInstance("PKCS12");
        keyStore.load(new ByteArrayInputStream(pkcs12), password);

        for (String alias : Collections.list(keyStore.aliases())) {
            if (!keyStore.isKeyEntry(alias)) {
                continue;
            }
            Key key = keyStore.getKey(alias, password);
            Certificate certificate = keyStore.getCertificate(alias);
            if (key instanceof PrivateKey && certificate instanceof X509Certificate) {
                return new StoredCertificate(tenantId, (X509Certificate) certificate, (PrivateKey) key);
            }
        }
        throw new KeyStoreEntryMissingException("Keystore holds no private key with an X.509 certificate");
    }

    static class KeyStoreEntryMissingException extends GeneralSecurityException {
        KeyStoreEntryMissingException(String message) {
            super(message);
        }
    }
}
