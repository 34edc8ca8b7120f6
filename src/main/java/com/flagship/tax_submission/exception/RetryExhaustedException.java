package com.flagship.tax_submission.exception;

import com.flagship.tax_submission.document.TransmissionError;

import java.util.List;

/**
 * Raised when every transmission attempt failed. The document has been put
 * back to PENDING with the error log recorded, ready for re-drive.
 */
public class RetryExhaustedException extends RuntimeException {

    private final String tenantId;
    private final String documentNumber;
    private final int attempts;
    private final List<TransmissionError> errorLog;

    public RetryExhaustedException(String tenantId, String documentNumber, int attempts,
                                   List<TransmissionError> errorLog) {
        super(String.format("Transmission of document %s failed after %d attempts", documentNumber, attempts));
        this.tenantId = tenantId;
        this.documentNumber = documentNumber;
        this.attempts = attempts;
        this.errorLog = List.copyOf(errorLog);
    }

    public String getTenantId() {
        return tenantId;
    }

    public String getDocumentNumber() {
        return documentNumber;
    }

    public int getAttempts() {
        return attempts;
    }

    public List<TransmissionError> getErrorLog() {
        return errorLog;
    }
}
