package com.ivamare.crosschain.engine;

import com.ivamare.crosschain.model.ChainAsset;
import com.ivamare.crosschain.model.ChainInfo;
import com.ivamare.crosschain.model.GasEstimate;
import com.ivamare.crosschain.model.OperationIntent;
import com.ivamare.crosschain.model.OperationQuote;

import java.util.List;
import java.util.Optional;

/**
 * External routing and execution engine.
 *
 * <p>The engine owns route computation, signing and broadcasting. This library only
 * submits routes, listens to their progress and asks the engine to resume or stop.
 */
public interface ExecutionEngine {

    /**
     * Compute quotes for an intent.
     */
    List<OperationQuote> getQuotes(OperationIntent intent);

    /**
     * Chains the engine can route through.
     */
    List<ChainInfo> getSupportedChains();

    /**
     * Tokens the engine knows on a chain.
     */
    List<ChainAsset> getSupportedTokens(long chainId);

    /**
     * Recommended gas top-up on the destination chain of an intent.
     *
     * @return the recommendation, or null if the engine has none
     */
    GasEstimate getGasOnDestination(OperationIntent intent);

    /**
     * Start executing a route asynchronously.
     *
     * @param route Route to execute; its ID becomes the operation ID
     * @param listener Invoked with the latest route on every state change
     */
    void submitForExecution(RouteSnapshot route, RouteUpdateListener listener);

    /**
     * Get the route of an execution the engine is still running or holding paused.
     */
    Optional<RouteSnapshot> getActiveExecution(String operationId);

    /**
     * Resume a paused execution (e.g. one waiting for confirmation).
     */
    void resumeExecution(RouteSnapshot route, RouteUpdateListener listener);

    /**
     * Halt an execution. Best effort; a no-op if it already stopped.
     *
     * <p>Called while the tracker holds the operation's lock. Implementations may deliver
     * a route update on the calling thread, but must not block waiting for an update
     * delivered from another thread, or for any other tracker call on this operation
     * to finish; doing so deadlocks.
     */
    void stopExecution(RouteSnapshot route);

    /**
     * Whether a signer is attached and routes can be executed.
     */
    default boolean isExecutionReady() {
        return true;
    }
}
