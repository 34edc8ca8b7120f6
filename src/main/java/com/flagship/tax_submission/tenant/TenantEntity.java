package com.flagship.tax_submission.tenant;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JPA entity for tenants.
 *
 * No setters: the active flag is the only mutable field and changes through
 * updateFromDomain().
 */
@Entity
@Table(name = "tenants")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TenantEntity {

    @Id
    @Column(name = "tenant_id", nullable = false, updatable = false, length = 11)
    private String tenantId;

    @Column(name = "legal_name", nullable = false, length = 200)
    private String legalName;

    @Column(name = "trade_name", length = 200)
    private String tradeName;

    @Column(length = 300)
    private String address;

    @Column(name = "authority_username", nullable = false, length = 100)
    private String authorityUsername;

    @Column(name = "authority_password_enc", nullable = false, columnDefinition = "TEXT")
    private String encryptedAuthorityPassword;

    @Column(nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static TenantEntity fromDomain(Tenant tenant) {
        return new TenantEntity(
            tenant.getTenantId(),
            tenant.getLegalName(),
            tenant.getTradeName(),
            tenant.getAddress(),
            tenant.getAuthorityUsername(),
            tenant.getEncryptedAuthorityPassword(),
            tenant.isActive(),
            null, // set by @PrePersist
            null
        );
    }

    public Tenant toDomain() {
        return new Tenant(
            tenantId,
            legalName,
            tradeName,
            address,
            authorityUsername,
            encryptedAuthorityPassword,
            active,
            createdAt,
            updatedAt
        );
    }

    void updateFromDomain(Tenant tenant) {
        this.active = tenant.isActive();
    }
}
