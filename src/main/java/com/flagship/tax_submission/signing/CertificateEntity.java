package com.flagship.tax_submission.signing;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Certificate metadata. The PKCS#12 itself lives in the tenant's blob space.
 */
@Entity
@Table(
    name = "certificates",
    indexes = @Index(name = "idx_certificates_not_after", columnList = "not_after")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CertificateEntity {

    @Id
    @Column(name = "tenant_id", nullable = false, updatable = false, length = 11)
    private String tenantId;

    @Column(name = "blob_key", nullable = false, length = 300)
    private String blobKey;

    @Column(name = "passphrase_enc", nullable = false, length = 500)
    private String encryptedPassphrase;

    @Column(nullable = false, length = 500)
    private String subject;

    @Column(nullable = false, length = 500)
    private String issuer;

    @Column(name = "serial_number", nullable = false, length = 100)
    private String serialNumber;

    @Column(name = "not_before", nullable = false)
    private Instant notBefore;

    @Column(name = "not_after", nullable = false)
    private Instant notAfter;

    @Column(name = "uploaded_at", nullable = false)
    private Instant uploadedAt;

    static CertificateEntity create(String tenantId, String blobKey, String encryptedPassphrase,
                                    String subject, String issuer, String serialNumber,
                                    Instant notBefore, Instant notAfter, Instant uploadedAt) {
        return new CertificateEntity(tenantId, blobKey, encryptedPassphrase, subject, issuer, serialNumber,
            notBefore, notAfter, uploadedAt);
    }

    void replace(String blobKey, String encryptedPassphrase, String subject, String issuer, String serialNumber,
                 Instant notBefore, Instant notAfter, Instant uploadedAt) {
        this.blobKey = blobKey;
        this.encryptedPassphrase = encryptedPassphrase;
        this.subject = subject;
        this.issuer = issuer;
        this.serialNumber = serialNumber;
        this.notBefore = notBefore;
        this.notAfter = notAfter;
        this.uploadedAt = uploadedAt;
    }
}
