package com.flagship.tax_submission.exception;

/**
 * Raised when a document cannot be voided the requested way: it is not yet
 * ACCEPTED, or it is the wrong kind (receipts are voided by communication,
 * invoices by credit note).
 */
public class DocumentNotVoidableException extends SubmissionRefusedException {

    public DocumentNotVoidableException(String tenantId, String documentNumber, String detail) {
        super(tenantId, "Document " + documentNumber + " cannot be voided: " + detail);
    }

    @Override
    public String getReason() {
        return "not_voidable";
    }
}
