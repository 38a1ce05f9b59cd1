package com.ivamare.crosschain.model;

/**
 * Overall status of a tracked cross-chain operation.
 */
public enum OperationStatus {
    /** Submitted to the engine, steps not finished yet */
    PENDING,

    /** A step is waiting for a transaction to be confirmed by the user */
    ACTION_REQUIRED,

    /** Every step finished successfully */
    COMPLETED,

    /** A step failed, or the operation was rejected, canceled or timed out */
    FAILED,

    /** Status could not be determined, or the operation is not tracked */
    UNKNOWN;

    /**
     * Check if this is a terminal status (operation will not change status again).
     * Terminal statuses are: COMPLETED, FAILED.
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
