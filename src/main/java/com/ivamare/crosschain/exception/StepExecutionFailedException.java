package com.ivamare.crosschain.exception;

import com.ivamare.crosschain.model.FailureCode;

/**
 * A step or process reported failure.
 */
public class StepExecutionFailedException extends OperationFailureException {

    public StepExecutionFailedException(String message) {
        super(FailureCode.STEP_EXECUTION_FAILED, message);
    }

    @Override
    public String statusMessage() {
        return "Operation failed: " + getMessage();
    }
}
