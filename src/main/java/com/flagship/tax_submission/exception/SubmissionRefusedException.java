package com.flagship.tax_submission.exception;

/**
 * Base type for requests that are well-formed but refused in the current
 * state of the tenant or document.
 */
public abstract class SubmissionRefusedException extends RuntimeException {

    private final String tenantId;

    protected SubmissionRefusedException(String tenantId, String message) {
        super(message);
        this.tenantId = tenantId;
    }

    public String getTenantId() {
        return tenantId;
    }

    /**
     * Short machine-readable reason used in error responses and metrics.
     */
    public abstract String getReason();
}
