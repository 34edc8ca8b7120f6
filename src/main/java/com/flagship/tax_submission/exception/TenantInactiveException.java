package com.flagship.tax_submission.exception;

public class TenantInactiveException extends SubmissionRefusedException {

    public TenantInactiveException(String tenantId) {
        super(tenantId, "Tenant " + tenantId + " is not active");
    }

    @Override
    public String getReason() {
        return "tenant_inactive";
    }
}
