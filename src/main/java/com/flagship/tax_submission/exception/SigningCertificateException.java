package com.flagship.tax_submission.exception;

/**
 * Base type for problems with a tenant's signing certificate.
 */
public abstract class SigningCertificateException extends RuntimeException {

    private final String tenantId;

    protected SigningCertificateException(String tenantId, String message) {
        super(message);
        this.tenantId = tenantId;
    }

    public String getTenantId() {
        return tenantId;
    }

    public abstract String getReason();
}
