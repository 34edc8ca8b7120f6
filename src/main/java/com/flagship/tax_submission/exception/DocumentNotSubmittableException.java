package com.flagship.tax_submission.exception;

import com.flagship.tax_submission.document.DocumentState;

/**
 * Raised when a document is in a state the requested operation does not
 * accept, e.g. submitting a REJECTED document or re-driving one that never
 * failed.
 */
public class DocumentNotSubmittableException extends SubmissionRefusedException {

    private final DocumentState state;

    public DocumentNotSubmittableException(String tenantId, String documentNumber,
                                           DocumentState state, String detail) {
        super(tenantId, String.format("Document %s in %s state %s", documentNumber, state, detail));
        this.state = state;
    }

    public DocumentState getState() {
        return state;
    }

    @Override
    public String getReason() {
        return "not_submittable";
    }
}
