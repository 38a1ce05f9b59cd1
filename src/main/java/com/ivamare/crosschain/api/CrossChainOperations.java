package com.ivamare.crosschain.api;

import com.ivamare.crosschain.exception.CrossChainException;
import com.ivamare.crosschain.model.CancelReason;
import com.ivamare.crosschain.model.ChainAsset;
import com.ivamare.crosschain.model.ChainInfo;
import com.ivamare.crosschain.model.GasEstimate;
import com.ivamare.crosschain.model.OperationIntent;
import com.ivamare.crosschain.model.OperationQuote;
import com.ivamare.crosschain.model.OperationResult;
import com.ivamare.crosschain.tracking.OperationStatusListener;

import java.util.List;

/**
 * Entry point for quoting, executing and tracking cross-chain operations.
 *
 * <p>Everything after quoting reports through {@link OperationResult}: failures while
 * preparing or tracking an operation come back as FAILED or UNKNOWN results instead of
 * exceptions, so callers can poll one uniform surface.
 */
public interface CrossChainOperations {

    /**
     * Ask the engine for quotes.
     *
     * @param intent What to move and where
     * @return Quotes, best first as ordered by the engine
     * @throws IllegalArgumentException if the intent is incomplete
     * @throws CrossChainException if the engine fails
     */
    List<OperationQuote> getOperationQuote(OperationIntent intent);

    /**
     * List the chains the engine can route through.
     *
     * @throws CrossChainException if the engine fails
     */
    List<ChainInfo> getSupportedChains();

    /**
     * List the tokens the engine knows on a chain.
     *
     * @param chainId Chain ID
     * @throws CrossChainException if the engine fails
     */
    List<ChainAsset> getSupportedTokens(long chainId);

    /**
     * Recommended gas top-up on the destination chain.
     *
     * @param intent What to move and where
     * @return the engine's recommendation; "0"/"0" if it has none or the lookup fails
     * @throws IllegalArgumentException if the intent is incomplete
     */
    GasEstimate getGasOnDestination(OperationIntent intent);

    /**
     * Submit a quote for execution and start tracking it.
     *
     * @param quote Quote returned by {@link #getOperationQuote}
     * @return PENDING result, an immediate FAILED result, or UNKNOWN if no signer is attached
     */
    OperationResult executeOperation(OperationQuote quote);

    /**
     * Get the current status of an operation.
     *
     * @param operationId Operation ID
     * @return Current result; UNKNOWN if the operation is not tracked
     */
    OperationResult getOperationStatus(String operationId);

    /**
     * Cancel an operation on behalf of the user.
     */
    OperationResult cancelOperation(String operationId);

    /**
     * Cancel an operation.
     *
     * @param operationId Operation ID
     * @param reason Why the operation is canceled
     * @return Result after cancellation; terminal operations are returned unchanged
     */
    OperationResult cancelOperation(String operationId, CancelReason reason);

    /**
     * Cancel an operation with a free-form reason; "timeout" selects {@link CancelReason#TIMEOUT}.
     */
    OperationResult cancelOperation(String operationId, String reason);

    /**
     * Resume a paused execution.
     *
     * @param operationId Operation ID
     * @return Result after the resume request
     */
    OperationResult resumeOperation(String operationId);

    /**
     * Run one timeout sweep.
     *
     * @return Number of operations that timed out
     */
    int checkForTimedOutOperations();

    /**
     * Register a listener notified on every visible status change.
     */
    void addStatusListener(OperationStatusListener listener);

    void removeStatusListener(OperationStatusListener listener);
}
