package com.ivamare.crosschain.exception;

import com.ivamare.crosschain.model.CancelReason;
import com.ivamare.crosschain.model.FailureCode;

/**
 * The engine's stop call failed while canceling. The operation is failed regardless.
 */
public class CancellationDownstreamException extends OperationFailureException {

    private final CancelReason reason;

    public CancellationDownstreamException(CancelReason reason, Throwable cause) {
        super(FailureCode.CANCELLATION_DOWNSTREAM_FAILURE, reason.stopFailedMessage(String.valueOf(cause.getMessage())), cause);
        this.reason = reason;
    }

    public CancelReason getReason() {
        return reason;
    }
}
