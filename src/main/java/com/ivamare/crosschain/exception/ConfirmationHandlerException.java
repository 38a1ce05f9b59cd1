package com.ivamare.crosschain.exception;

import com.ivamare.crosschain.model.FailureCode;

/**
 * The confirmation handler failed instead of answering.
 */
public class ConfirmationHandlerException extends OperationFailureException {

    public ConfirmationHandlerException(Throwable cause) {
        super(FailureCode.CONFIRMATION_HANDLER_ERROR, "Confirmation handler error: " + describe(cause), cause);
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
