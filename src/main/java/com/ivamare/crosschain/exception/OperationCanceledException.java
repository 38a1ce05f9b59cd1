package com.ivamare.crosschain.exception;

import com.ivamare.crosschain.model.CancelReason;
import com.ivamare.crosschain.model.FailureCode;

/**
 * The operation was canceled, on request or by the timeout sweeper.
 */
public class OperationCanceledException extends OperationFailureException {

    private final CancelReason reason;

    public OperationCanceledException(CancelReason reason) {
        super(reason == CancelReason.TIMEOUT ? FailureCode.TIMED_OUT : FailureCode.CANCELED,
            reason.canceledMessage());
        this.reason = reason;
    }

    public CancelReason getReason() {
        return reason;
    }
}
