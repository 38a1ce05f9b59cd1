package com.ivamare.crosschain.exception;

import com.ivamare.crosschain.model.FailureCode;

/**
 * Base class for the reasons an operation can end up FAILED.
 *
 * <p>These are recorded on the tracking record rather than thrown to callers;
 * the message becomes the operation's {@code error}.
 */
public abstract class OperationFailureException extends CrossChainException {

    private final FailureCode code;

    protected OperationFailureException(FailureCode code, String message) {
        super(message);
        this.code = code;
    }

    protected OperationFailureException(FailureCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public FailureCode getCode() {
        return code;
    }

    /**
     * Status message shown alongside the error.
     */
    public String statusMessage() {
        return getMessage();
    }
}
