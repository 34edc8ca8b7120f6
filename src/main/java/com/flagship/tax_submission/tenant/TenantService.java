package com.flagship.tax_submission.tenant;

import com.flagship.tax_submission.crypto.SecretCipher;
import com.flagship.tax_submission.exception.InputValidationException;
import com.flagship.tax_submission.exception.NotFoundException;
import com.flagship.tax_submission.exception.TenantInactiveException;
import com.flagship.tax_submission.transmission.AuthorityCredentials;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Tenant registration and lookup.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TenantService {

    private final TenantRepository tenantRepository;
    private final SecretCipher secretCipher;

    /**
     * Registers a new tenant. The authority password is encrypted before it is stored.
     *
     * @throws InputValidationException if a field is missing or the fiscal id is malformed
     * @throws IllegalStateException if the tenant is already registered
     */
    @Transactional
    public Tenant register(String tenantId, String legalName, String tradeName, String address,
                           String authorityUsername, String authorityPassword) {
        requireFiscalId(tenantId);
        requireText("legalName", legalName);
        requireText("authorityUsername", authorityUsername);
        requireText("authorityPassword", authorityPassword);

        if (tenantRepository.existsById(tenantId)) {
            throw new IllegalStateException("Tenant " + tenantId + " is already registered");
        }

        Tenant tenant = Tenant.register(tenantId, legalName.trim(), tradeName, address,
            authorityUsername.trim(), secretCipher.encrypt(authorityPassword));
        Tenant saved = tenantRepository.save(TenantEntity.fromDomain(tenant)).toDomain();

        log.info("Registered tenant {} ({})", tenantId, saved.getLegalName());
        return saved;
    }

    @Transactional(readOnly = true)
    public Tenant getTenant(String tenantId) {
        requireFiscalId(tenantId);
        return tenantRepository.findById(tenantId)
            .map(TenantEntity::toDomain)
            .orElseThrow(() -> new NotFoundException("Tenant", tenantId));
    }

    /**
     * Loads a tenant that is allowed to issue and submit documents.
     *
     * @throws NotFoundException if the tenant does not exist
     * @throws TenantInactiveException if the tenant is deactivated
     */
    @Transactional(readOnly = true)
    public Tenant requireActive(String tenantId) {
        Tenant tenant = getTenant(tenantId);
        if (!tenant.isActive()) {
            throw new TenantInactiveException(tenantId);
        }
        return tenant;
    }

    @Transactional
    public Tenant setActive(String tenantId, boolean active) {
        TenantEntity entity = tenantRepository.findById(tenantId)
            .orElseThrow(() -> new NotFoundException("Tenant", tenantId));

        Tenant updated = entity.toDomain().withActive(active);
        entity.updateFromDomain(updated);
        Tenant saved = tenantRepository.save(entity).toDomain();

        log.info("Tenant {} is now {}", tenantId, active ? "active" : "inactive");
        return saved;
    }

    public AuthorityCredentials credentialsFor(Tenant tenant) {
        return new AuthorityCredentials(
            tenant.getAuthorityUsername(),
            secretCipher.decrypt(tenant.getEncryptedAuthorityPassword())
        );
    }

    static void requireFiscalId(String tenantId) {
        if (!Tenant.isValidFiscalId(tenantId)) {
            throw new InputValidationException("tenantId", "Tenant id must be exactly 11 digits");
        }
    }

    private static void requireText(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new InputValidationException(field, field + " is required");
        }
    }
}
