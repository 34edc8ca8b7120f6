package com.flagship.tax_submission.store;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Binary content in a tenant's blob space: signed XML, authority receipts,
 * certificates and void communications.
 */
@Entity
@Table(
    name = "blobs",
    indexes = @Index(name = "idx_blobs_tenant_id", columnList = "tenant_id")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class BlobEntity {

    @Id
    @Column(name = "blob_key", nullable = false, updatable = false, length = 300)
    private String blobKey;

    @Column(name = "tenant_id", nullable = false, updatable = false, length = 11)
    private String tenantId;

    @Column(nullable = false)
    private byte[] content;

    @Column(name = "content_type", nullable = false, length = 100)
    private String contentType;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    @PreUpdate
    void onWrite() {
        this.createdAt = Instant.now();
    }

    static BlobEntity create(String tenantId, String blobKey, byte[] content, String contentType) {
        return new BlobEntity(blobKey, tenantId, content, contentType, null);
    }

    void replaceContent(byte[] content, String contentType) {
        this.content = content;
        this.contentType = contentType;
    }
}
