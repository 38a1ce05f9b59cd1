package com.ivamare.crosschain.confirmation;

import com.ivamare.crosschain.engine.ProcessSnapshot;
import com.ivamare.crosschain.engine.StepSnapshot;

import java.util.Map;

/**
 * Transaction awaiting confirmation.
 *
 * @param operationId Operation the transaction belongs to
 * @param stepId Step waiting for action
 * @param tool Bridge or exchange of the step
 * @param processType Process that produced the payload
 * @param chainId Chain the transaction will be sent on
 * @param fromAmount Amount the step sends
 * @param toAmount Amount the step is expected to deliver
 * @param txRequest Unsigned transaction payload
 */
public record ConfirmationRequest(
    String operationId,
    String stepId,
    String tool,
    String processType,
    Long chainId,
    String fromAmount,
    String toAmount,
    Map<String, Object> txRequest
) {

    public ConfirmationRequest {
        txRequest = txRequest != null ? Map.copyOf(txRequest) : Map.of();
    }

    /**
     * Build a request from the step and the process carrying the payload.
     */
    public static ConfirmationRequest of(String operationId, StepSnapshot step, ProcessSnapshot process) {
        Long chainId = process.chainId();
        if (chainId == null && step.action() != null) {
            chainId = step.action().fromChainId();
        }
        String fromAmount = step.hasExecution() && step.execution().fromAmount() != null
            ? step.execution().fromAmount()
            : step.action() != null ? step.action().fromAmount() : null;
        String toAmount = step.hasExecution() ? step.execution().toAmount() : null;
        return new ConfirmationRequest(
            operationId,
            step.id(),
            step.tool(),
            process.type(),
            chainId,
            fromAmount,
            toAmount,
            process.txRequest()
        );
    }
}
