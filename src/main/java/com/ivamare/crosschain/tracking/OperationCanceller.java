package com.ivamare.crosschain.tracking;

import com.ivamare.crosschain.engine.ExecutionEngine;
import com.ivamare.crosschain.exception.CancellationDownstreamException;
import com.ivamare.crosschain.exception.OperationCanceledException;
import com.ivamare.crosschain.exception.OperationNotFoundException;
import com.ivamare.crosschain.model.CancelReason;
import com.ivamare.crosschain.model.OperationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Predicate;

/**
 * Shared cancellation path for explicit cancel requests and the timeout sweeper.
 *
 * <p>The engine's stop call and the FAILED write happen together under the operation's
 * lock. A failing stop call does not keep the operation alive.
 */
public class OperationCanceller {

    private static final Logger log = LoggerFactory.getLogger(OperationCanceller.class);

    private final OperationRegistry registry;
    private final ExecutionEngine engine;

    public OperationCanceller(OperationRegistry registry, ExecutionEngine engine) {
        this.registry = registry;
        this.engine = engine;
    }

    /**
     * Cancel an operation.
     *
     * @return the operation's projection after the call; UNKNOWN if it is not tracked
     */
    public OperationResult cancel(String operationId, CancelReason reason) {
        if (!isTracked(operationId)) {
            return OperationResult.notFound(operationId);
        }
        tryCancel(operationId, reason, tracking -> true);
        return registry.toPublicResult(operationId);
    }

    /**
     * Cancel an operation if it is not terminal and the precondition holds under its lock.
     *
     * @return true if this call canceled the operation
     */
    public boolean tryCancel(String operationId, CancelReason reason, Predicate<OperationTracking> precondition) {
        AtomicBoolean canceled = new AtomicBoolean(false);
        try {
            registry.update(operationId, tracking -> {
                if (precondition.test(tracking)) {
                    stopAndFail(tracking, reason);
                    canceled.set(true);
                }
            });
        } catch (OperationNotFoundException e) {
            log.warn("Cannot cancel untracked operation {}", operationId);
            return false;
        }
        return canceled.get();
    }

    private void stopAndFail(OperationTracking tracking, CancelReason reason) {
        String operationId = tracking.getOperationId();
        try {
            engine.getActiveExecution(operationId).ifPresent(engine::stopExecution);
            tracking.fail(new OperationCanceledException(reason));
            log.info("Canceled operation {} ({})", operationId, reason);
        } catch (RuntimeException e) {
            CancellationDownstreamException failure = new CancellationDownstreamException(reason, e);
            log.error("Failed to stop execution of operation {} while canceling", operationId, failure);
            tracking.fail(failure);
        }
    }

    private boolean isTracked(String operationId) {
        return registry.get(operationId).isPresent();
    }
}
