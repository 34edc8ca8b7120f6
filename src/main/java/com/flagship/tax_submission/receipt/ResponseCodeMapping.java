package com.flagship.tax_submission.receipt;

import com.flagship.tax_submission.document.DocumentState;
import com.flagship.tax_submission.document.Receipt;

/**
 * Authority response code to lifecycle state.
 *
 * | code                  | state                             |
 * |-----------------------|-----------------------------------|
 * | 0                     | ACCEPTED                          |
 * | 1-999                 | ACCEPTED (with exceptions)        |
 * | 2000-2999             | REJECTED                          |
 * | 4000-4999             | ACCEPTED (with observations)      |
 * | TICKET, PROCESSING    | SUBMITTED                         |
 * | anything else         | REJECTED                          |
 */
public enum ResponseCodeMapping {

    ACCEPTED(DocumentState.ACCEPTED),
    ACCEPTED_WITH_EXCEPTIONS(DocumentState.ACCEPTED),
    ACCEPTED_WITH_OBSERVATIONS(DocumentState.ACCEPTED),
    IN_PROGRESS(DocumentState.SUBMITTED),
    REJECTED(DocumentState.REJECTED),
    UNKNOWN(DocumentState.REJECTED);

    private final DocumentState state;

    ResponseCodeMapping(DocumentState state) {
        this.state = state;
    }

    public DocumentState getState() {
        return state;
    }

    public static ResponseCodeMapping of(String responseCode) {
        if (responseCode == null || responseCode.isBlank()) {
            return UNKNOWN;
        }
        String code = responseCode.trim();
        if (Receipt.TICKET.equalsIgnoreCase(code) || Receipt.PROCESSING.equalsIgnoreCase(code)) {
            return IN_PROGRESS;
        }
        if (!code.chars().allMatch(Character::isDigit) || code.length() > 9) {
            return UNKNOWN;
        }

        int value = Integer.parseInt(code);
        if (value == 0) {
            return ACCEPTED;
        }
        if (value <= 999) {
            return ACCEPTED_WITH_EXCEPTIONS;
        }
        if (value >= 2000 && value <= 2999) {
            return REJECTED;
        }
        if (value >= 4000 && value <= 4999) {
            return ACCEPTED_WITH_OBSERVATIONS;
        }
        return UNKNOWN;
    }

    public static DocumentState stateFor(String responseCode) {
        return of(responseCode).getState();
    }
}
