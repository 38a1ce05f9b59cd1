package com.ivamare.crosschain.tracking;

import com.ivamare.crosschain.engine.ProcessSnapshot;
import com.ivamare.crosschain.engine.RouteSnapshot;
import com.ivamare.crosschain.engine.StepSnapshot;
import com.ivamare.crosschain.model.TransactionDetails;

import java.util.List;
import java.util.Objects;

/**
 * Picks source and destination transactions, received amount and failure message out
 * of a route snapshot.
 */
public class TransactionLocator {

    static final String UNKNOWN_STEP_ERROR = "Unknown error in failed step";

    /**
     * First broadcast transaction of the first step, or a hash-less reference to the source chain.
     */
    public TransactionDetails sourceTx(RouteSnapshot route) {
        StepSnapshot first = route.firstStep();
        if (first != null) {
            for (ProcessSnapshot process : first.processes()) {
                if (process.hasTxHash()) {
                    return new TransactionDetails(process.txHash(), route.fromChainId(), process.txLink());
                }
            }
        }
        return TransactionDetails.onChain(route.fromChainId());
    }

    /**
     * Transaction that landed on the destination chain.
     *
     * <p>Searches the latest step touching the destination chain first, then the last step.
     * Without a transaction clearly on the destination chain the hash stays empty.
     */
    public TransactionDetails destinationTx(RouteSnapshot route) {
        Long toChainId = route.toChainId();
        List<StepSnapshot> steps = route.steps();

        for (int i = steps.size() - 1; i >= 0; i--) {
            StepSnapshot step = steps.get(i);
            if (!step.touchesChain(toChainId)) {
                continue;
            }
            for (ProcessSnapshot process : step.processes()) {
                if (process.hasTxHash() && Objects.equals(process.chainId(), toChainId)) {
                    return new TransactionDetails(process.txHash(), toChainId, process.txLink());
                }
            }
            break;
        }

        StepSnapshot last = route.lastStep();
        if (last != null) {
            List<ProcessSnapshot> processes = last.processes();
            for (int i = processes.size() - 1; i >= 0; i--) {
                ProcessSnapshot process = processes.get(i);
                if (process.hasTxHash() && Objects.equals(process.chainId(), toChainId)) {
                    return new TransactionDetails(process.txHash(), toChainId, process.txLink());
                }
            }
        }
        return TransactionDetails.onChain(toChainId);
    }

    /**
     * Amount credited to the recipient; the last RECEIVING process wins over the step total.
     */
    public String receivedAmount(RouteSnapshot route) {
        StepSnapshot last = route.lastStep();
        String amount = null;
        if (last != null && last.hasExecution()) {
            amount = last.execution().toAmount();
            for (ProcessSnapshot process : last.processes()) {
                if (process.isReceiving() && process.outputAmount() != null) {
                    amount = process.outputAmount();
                }
            }
        }
        return amount != null ? amount : route.toAmount();
    }

    /**
     * Error message of a failed step.
     */
    public String failureMessage(StepSnapshot failedStep) {
        if (failedStep == null) {
            return UNKNOWN_STEP_ERROR;
        }
        List<ProcessSnapshot> processes = failedStep.processes();
        for (ProcessSnapshot process : processes) {
            if ("FAILED".equals(process.status()) && hasErrorMessage(process)) {
                return process.error().message();
            }
        }
        if (!processes.isEmpty() && hasErrorMessage(processes.get(0))) {
            return processes.get(0).error().message();
        }
        return UNKNOWN_STEP_ERROR;
    }

    private static boolean hasErrorMessage(ProcessSnapshot process) {
        return process.error() != null && process.error().message() != null && !process.error().message().isBlank();
    }
}
