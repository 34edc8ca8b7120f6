package com.flagship.tax_submission.exception;

/**
 * Raised when a write names a record that belongs to a different tenant.
 *
 * This is always a programming or security error, never a user mistake.
 */
public class OwnershipViolationException extends RuntimeException {

    private final String requestingTenantId;
    private final String owningTenantId;
    private final String resource;

    public OwnershipViolationException(String requestingTenantId, String owningTenantId, String resource) {
        super(String.format("Tenant %s may not modify %s owned by %s",
            requestingTenantId, resource, owningTenantId));
        this.requestingTenantId = requestingTenantId;
        this.owningTenantId = owningTenantId;
        this.resource = resource;
    }

    public String getRequestingTenantId() {
        return requestingTenantId;
    }

    public String getOwningTenantId() {
        return owningTenantId;
    }

    public String getResource() {
        return resource;
    }
}
