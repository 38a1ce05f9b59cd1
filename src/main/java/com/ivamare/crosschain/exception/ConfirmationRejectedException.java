package com.ivamare.crosschain.exception;

import com.ivamare.crosschain.model.FailureCode;

/**
 * The user declined the transaction.
 */
public class ConfirmationRejectedException extends OperationFailureException {

    public ConfirmationRejectedException() {
        super(FailureCode.CONFIRMATION_REJECTED, "Transaction rejected by user.");
    }
}
