package com.ivamare.crosschain.api.impl;

import com.ivamare.crosschain.api.CrossChainOperations;
import com.ivamare.crosschain.engine.ExecutionEngine;
import com.ivamare.crosschain.engine.RouteSnapshot;
import com.ivamare.crosschain.exception.CrossChainException;
import com.ivamare.crosschain.exception.DuplicateOperationException;
import com.ivamare.crosschain.exception.OperationNotFoundException;
import com.ivamare.crosschain.exception.ResumeFailedException;
import com.ivamare.crosschain.exception.SubmissionFailedException;
import com.ivamare.crosschain.model.CancelReason;
import com.ivamare.crosschain.model.ChainAsset;
import com.ivamare.crosschain.model.ChainInfo;
import com.ivamare.crosschain.model.FailureCode;
import com.ivamare.crosschain.model.GasEstimate;
import com.ivamare.crosschain.model.OperationIntent;
import com.ivamare.crosschain.model.OperationQuote;
import com.ivamare.crosschain.model.OperationResult;
import com.ivamare.crosschain.tracking.OperationCanceller;
import com.ivamare.crosschain.tracking.OperationRegistry;
import com.ivamare.crosschain.tracking.OperationStatusListener;
import com.ivamare.crosschain.tracking.OperationTracking;
import com.ivamare.crosschain.tracking.RouteUpdateObserver;
import com.ivamare.crosschain.tracking.TimeoutSweeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Default implementation of CrossChainOperations.
 */
public class DefaultCrossChainOperations implements CrossChainOperations {

    private static final Logger log = LoggerFactory.getLogger(DefaultCrossChainOperations.class);

    static final String EXECUTION_INITIATED_MESSAGE = "Execution initiated";
    static final String RESUME_INITIATED_MESSAGE = "Resumption initiated";
    static final String ENGINE_NOT_READY_MESSAGE = "Execution provider required for transaction execution";

    private final ExecutionEngine engine;
    private final OperationRegistry registry;
    private final RouteUpdateObserver observer;
    private final OperationCanceller canceller;
    private final TimeoutSweeper sweeper;

    /**
     * Creates a new DefaultCrossChainOperations.
     *
     * @param engine The execution engine
     * @param registry The operation registry
     * @param observer The route update observer handed to the engine
     * @param canceller The shared cancellation path
     * @param sweeper The timeout sweeper
     */
    public DefaultCrossChainOperations(
            ExecutionEngine engine,
            OperationRegistry registry,
            RouteUpdateObserver observer,
            OperationCanceller canceller,
            TimeoutSweeper sweeper) {
        this.engine = engine;
        this.registry = registry;
        this.observer = observer;
        this.canceller = canceller;
        this.sweeper = sweeper;
    }

    // --- Quoting ---

    @Override
    public List<OperationQuote> getOperationQuote(OperationIntent intent) {
        validate(intent);
        try {
            List<OperationQuote> quotes = engine.getQuotes(intent);
            log.debug("Engine returned {} quotes for {} -> {}", quotes.size(),
                intent.sourceAsset().chainId(), intent.destinationAsset().chainId());
            return quotes;
        } catch (RuntimeException e) {
            throw new CrossChainException("Failed to get quotes: " + e.getMessage(), e);
        }
    }

    @Override
    public List<ChainInfo> getSupportedChains() {
        try {
            return engine.getSupportedChains();
        } catch (RuntimeException e) {
            throw new CrossChainException("Failed to get supported chains: " + e.getMessage(), e);
        }
    }

    @Override
    public List<ChainAsset> getSupportedTokens(long chainId) {
        try {
            return engine.getSupportedTokens(chainId);
        } catch (RuntimeException e) {
            throw new CrossChainException("Failed to get tokens for chain " + chainId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public GasEstimate getGasOnDestination(OperationIntent intent) {
        validate(intent);
        try {
            GasEstimate estimate = engine.getGasOnDestination(intent);
            return estimate != null ? estimate : GasEstimate.none();
        } catch (RuntimeException e) {
            log.warn("Gas recommendation for chain {} unavailable: {}",
                intent.destinationAsset().chainId(), e.getMessage());
            return GasEstimate.none();
        }
    }

    // --- Execution ---

    @Override
    public OperationResult executeOperation(OperationQuote quote) {
        RouteSnapshot route = quote != null ? quote.route() : null;
        String operationId = route != null ? route.id() : quote != null ? quote.id() : null;
        OperationIntent intent = quote != null ? quote.intent() : null;

        if (!engine.isExecutionReady()) {
            log.warn("Cannot execute operation {}: no execution provider attached", operationId);
            return OperationResult.unknown(operationId, ENGINE_NOT_READY_MESSAGE);
        }
        if (route == null || operationId == null || operationId.isBlank()) {
            return OperationResult.failed(operationId, intent, FailureCode.SUBMISSION_FAILED,
                "Invalid quote: no executable route");
        }

        try {
            registry.create(operationId, intent);
        } catch (DuplicateOperationException e) {
            log.warn("Operation {} is already tracked", operationId);
            return OperationResult.failed(operationId, intent, FailureCode.SUBMISSION_FAILED, e.getMessage());
        }
        apply(operationId, tracking -> tracking.setStatusMessage(EXECUTION_INITIATED_MESSAGE));

        try {
            engine.submitForExecution(route, observer.listenerFor(operationId));
            log.info("Submitted operation {} for execution", operationId);
        } catch (RuntimeException e) {
            log.error("Failed to submit operation {} for execution", operationId, e);
            apply(operationId, tracking -> tracking.fail(new SubmissionFailedException(e.getMessage(), e)));
        }
        return registry.toPublicResult(operationId);
    }

    // --- Status ---

    @Override
    public OperationResult getOperationStatus(String operationId) {
        return registry.toPublicResult(operationId);
    }

    // --- Cancellation and resumption ---

    @Override
    public OperationResult cancelOperation(String operationId) {
        return cancelOperation(operationId, CancelReason.USER);
    }

    @Override
    public OperationResult cancelOperation(String operationId, CancelReason reason) {
        return canceller.cancel(operationId, reason != null ? reason : CancelReason.USER);
    }

    @Override
    public OperationResult cancelOperation(String operationId, String reason) {
        return cancelOperation(operationId, CancelReason.fromValue(reason));
    }

    @Override
    public OperationResult resumeOperation(String operationId) {
        Optional<OperationTracking> tracking = registry.get(operationId);
        if (tracking.isEmpty()) {
            return OperationResult.notFound(operationId);
        }
        if (tracking.get().isTerminal()) {
            return tracking.get().toResult();
        }

        Optional<RouteSnapshot> active = engine.getActiveExecution(operationId);
        if (active.isEmpty()) {
            log.info("No active execution to resume for operation {}", operationId);
            return registry.toPublicResult(operationId);
        }

        try {
            engine.resumeExecution(active.get(), observer.listenerFor(operationId));
            apply(operationId, t -> t.setStatusMessage(RESUME_INITIATED_MESSAGE));
            log.info("Resumed operation {}", operationId);
        } catch (RuntimeException e) {
            log.error("Failed to resume operation {}", operationId, e);
            apply(operationId, t -> t.fail(new ResumeFailedException(e)));
        }
        return registry.toPublicResult(operationId);
    }

    // --- Timeouts ---

    @Override
    public int checkForTimedOutOperations() {
        return sweeper.sweep();
    }

    // --- Listeners ---

    @Override
    public void addStatusListener(OperationStatusListener listener) {
        registry.addListener(listener);
    }

    @Override
    public void removeStatusListener(OperationStatusListener listener) {
        registry.removeListener(listener);
    }

    private void apply(String operationId, Consumer<OperationTracking> mutator) {
        try {
            registry.update(operationId, mutator);
        } catch (OperationNotFoundException e) {
            log.warn("Operation {} no longer tracked", operationId);
        }
    }

    private static void validate(OperationIntent intent) {
        if (intent == null) {
            throw new IllegalArgumentException("Operation intent is required");
        }
        if (intent.sourceAsset() == null || intent.destinationAsset() == null) {
            throw new IllegalArgumentException("Source and destination assets are required");
        }
        if (intent.amount() == null || intent.amount().isBlank()) {
            throw new IllegalArgumentException("Amount is required");
        }
        if (intent.userAddress() == null || intent.userAddress().isBlank()) {
            throw new IllegalArgumentException("User address is required");
        }
    }
}
