package com.ivamare.crosschain.exception;

import com.ivamare.crosschain.model.FailureCode;

/**
 * The engine refused to start executing a route.
 */
public class SubmissionFailedException extends OperationFailureException {

    public SubmissionFailedException(String message) {
        super(FailureCode.SUBMISSION_FAILED, message);
    }

    public SubmissionFailedException(String message, Throwable cause) {
        super(FailureCode.SUBMISSION_FAILED, message, cause);
    }

    @Override
    public String statusMessage() {
        return "Operation failed: " + getMessage();
    }
}
