package com.flagship.tax_submission.submission;

import com.flagship.tax_submission.document.DocumentReceipt;
import com.flagship.tax_submission.document.DocumentState;
import lombok.Value;

/**
 * Result of a transmission that reached the authority and got an answer.
 */
@Value
public class SubmissionOutcome {
    String documentNumber;
    DocumentState state;
    DocumentReceipt receipt;
    int attempts;
}
