package com.ivamare.crosschain.exception;

/**
 * Raised when registering an operation ID that is already tracked.
 */
public class DuplicateOperationException extends CrossChainException {

    private final String operationId;

    public DuplicateOperationException(String operationId) {
        super("Operation " + operationId + " is already tracked");
        this.operationId = operationId;
    }

    public String getOperationId() {
        return operationId;
    }
}
