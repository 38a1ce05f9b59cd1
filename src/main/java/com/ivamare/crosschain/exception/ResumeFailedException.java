package com.ivamare.crosschain.exception;

import com.ivamare.crosschain.model.FailureCode;

/**
 * The engine failed to resume a paused execution.
 */
public class ResumeFailedException extends OperationFailureException {

    public ResumeFailedException(Throwable cause) {
        super(FailureCode.RESUME_FAILED, "Failed to resume: " + cause.getMessage(), cause);
    }
}
