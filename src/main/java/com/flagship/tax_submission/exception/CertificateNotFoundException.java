package com.flagship.tax_submission.exception;

public class CertificateNotFoundException extends SigningCertificateException {

    public CertificateNotFoundException(String tenantId) {
        super(tenantId, "No signing certificate registered for tenant " + tenantId);
    }

    @Override
    public String getReason() {
        return "certificate_not_found";
    }
}
