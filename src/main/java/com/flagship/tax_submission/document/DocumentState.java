package com.flagship.tax_submission.document;

/**
 * Lifecycle state of an issued tax document.
 *
 * Allowed transitions:
 * - PENDING -> SUBMITTED
 * - SUBMITTED -> ACCEPTED | REJECTED | PENDING
 *
 * ACCEPTED and REJECTED are terminal. A document is never deleted; it is
 * cancelled by issuing a new document that references it.
 */
public enum DocumentState {
    PENDING,
    SUBMITTED,
    ACCEPTED,
    REJECTED;

    /**
     * Checks if a transition from this state to the target state is allowed.
     * Staying in the same state is always allowed.
     */
    public boolean canTransitionTo(DocumentState target) {
        if (this == target) {
            return true;
        }

        return switch (this) {
            case PENDING -> target == SUBMITTED;
            case SUBMITTED -> target == ACCEPTED || target == REJECTED || target == PENDING;
            case ACCEPTED, REJECTED -> false;
        };
    }

    public boolean isTerminal() {
        return this == ACCEPTED || this == REJECTED;
    }
}
