package com.ivamare.crosschain.exception;

import com.ivamare.crosschain.model.FailureCode;

/**
 * A transaction is ready for confirmation but neither auto-confirm nor a handler is configured.
 */
public class NoHandlerConfiguredException extends OperationFailureException {

    public NoHandlerConfiguredException() {
        super(FailureCode.NO_HANDLER_CONFIGURED, "Operation requires confirmation but no handler is configured.");
    }
}
