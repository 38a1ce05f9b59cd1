package com.ivamare.crosschain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Read-only view of an operation returned to callers.
 *
 * @param operationId Engine-assigned operation ID
 * @param status Current overall status
 * @param sourceTx Source chain transaction (nullable)
 * @param destinationTx Destination chain transaction (nullable)
 * @param receivedAmount Amount received, set once COMPLETED (nullable)
 * @param errorCode Failure classification, set once FAILED (nullable)
 * @param error Error message (nullable)
 * @param statusMessage Human-readable status description (nullable)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OperationResult(
    String operationId,
    OperationStatus status,
    TransactionDetails sourceTx,
    TransactionDetails destinationTx,
    String receivedAmount,
    FailureCode errorCode,
    String error,
    String statusMessage
) {

    public static final String NOT_FOUND_MESSAGE = "Operation not found or tracking lost.";

    /**
     * Result for an operation that is not tracked.
     */
    public static OperationResult notFound(String operationId) {
        return new OperationResult(operationId, OperationStatus.UNKNOWN, null, null, null,
            null, null, NOT_FOUND_MESSAGE);
    }

    /**
     * Result for an operation that could not be tracked or executed at all.
     */
    public static OperationResult unknown(String operationId, String statusMessage) {
        return new OperationResult(operationId, OperationStatus.UNKNOWN, null, null, null,
            null, null, statusMessage);
    }

    /**
     * Result for an operation that failed before the engine took it over.
     */
    public static OperationResult failed(String operationId, OperationIntent intent,
                                         FailureCode code, String error) {
        return new OperationResult(
            operationId,
            OperationStatus.FAILED,
            intent != null ? TransactionDetails.onChain(intent.sourceAsset().chainId()) : null,
            intent != null ? TransactionDetails.onChain(intent.destinationAsset().chainId()) : null,
            null,
            code,
            error,
            "Operation failed: " + error
        );
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status.isTerminal();
    }
}
