package com.ivamare.crosschain.confirmation;

/**
 * Outcome of assessing an action-required step.
 */
public enum ConfirmationStage {
    /** The engine has not produced the transaction payload yet */
    DETAILS_PENDING,

    /** Payload ready, confirmation is automatic */
    AUTO_CONFIRM,

    /** Payload ready, waiting on the confirmation handler */
    AWAITING_CONFIRMATION,

    /** Payload ready, but nobody can confirm it */
    STALLED
}
