package com.ivamare.crosschain.model;

/**
 * Why an operation ended up FAILED.
 */
public enum FailureCode {
    /** A step or process reported failure */
    STEP_EXECUTION_FAILED,

    /** The confirmation handler did not answer within the configured timeout */
    CONFIRMATION_TIMEOUT,

    /** The user declined the transaction */
    CONFIRMATION_REJECTED,

    /** A transaction needed confirmation but nobody could confirm it */
    NO_HANDLER_CONFIGURED,

    /** The confirmation handler itself failed */
    CONFIRMATION_HANDLER_ERROR,

    /** Canceled on request */
    CANCELED,

    /** Canceled by the timeout sweeper */
    TIMED_OUT,

    /** The engine's stop call failed while canceling */
    CANCELLATION_DOWNSTREAM_FAILURE,

    /** The engine refused the route on submission */
    SUBMISSION_FAILED,

    /** The engine failed to resume a paused execution */
    RESUME_FAILED
}
