package com.ivamare.crosschain.exception;

import com.ivamare.crosschain.model.FailureCode;

import java.time.Duration;

/**
 * The confirmation handler did not answer in time.
 */
public class ConfirmationTimeoutException extends OperationFailureException {

    private final Duration timeout;

    public ConfirmationTimeoutException(Duration timeout) {
        super(FailureCode.CONFIRMATION_TIMEOUT, "Confirmation timed out after " + timeout.toMillis() + "ms");
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
