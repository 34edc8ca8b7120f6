package com.flagship.tax_submission.exception;

public class DocumentAlreadyAcceptedException extends SubmissionRefusedException {

    public DocumentAlreadyAcceptedException(String tenantId, String documentNumber) {
        super(tenantId, "Document " + documentNumber + " has already been accepted by the tax authority");
    }

    @Override
    public String getReason() {
        return "already_accepted";
    }
}
