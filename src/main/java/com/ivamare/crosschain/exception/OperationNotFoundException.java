package com.ivamare.crosschain.exception;

/**
 * Raised when an operation ID has no tracking record.
 */
public class OperationNotFoundException extends CrossChainException {

    private final String operationId;

    public OperationNotFoundException(String operationId) {
        super("Operation " + operationId + " not found");
        this.operationId = operationId;
    }

    public String getOperationId() {
        return operationId;
    }
}
