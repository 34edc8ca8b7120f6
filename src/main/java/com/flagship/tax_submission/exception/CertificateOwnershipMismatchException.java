package com.flagship.tax_submission.exception;

public class CertificateOwnershipMismatchException extends SigningCertificateException {

    private final String certificateOwner;

    public CertificateOwnershipMismatchException(String tenantId, String certificateOwner) {
        super(tenantId, String.format("Certificate belongs to %s, not to tenant %s",
            certificateOwner != null ? certificateOwner : "an unidentified holder", tenantId));
        this.certificateOwner = certificateOwner;
    }

    public String getCertificateOwner() {
        return certificateOwner;
    }

    @Override
    public String getReason() {
        return "certificate_owner_mismatch";
    }
}
