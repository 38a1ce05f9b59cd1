package com.ivamare.crosschain.confirmation;

import com.ivamare.crosschain.engine.ExecutionEngine;
import com.ivamare.crosschain.engine.ProcessSnapshot;
import com.ivamare.crosschain.engine.RouteSnapshot;
import com.ivamare.crosschain.engine.RouteUpdateListener;
import com.ivamare.crosschain.engine.StepSnapshot;
import com.ivamare.crosschain.exception.ConfirmationHandlerException;
import com.ivamare.crosschain.exception.ConfirmationRejectedException;
import com.ivamare.crosschain.exception.ConfirmationTimeoutException;
import com.ivamare.crosschain.exception.NoHandlerConfiguredException;
import com.ivamare.crosschain.exception.OperationFailureException;
import com.ivamare.crosschain.exception.OperationNotFoundException;
import com.ivamare.crosschain.tracking.OperationRegistry;
import com.ivamare.crosschain.tracking.OperationTracking;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Consumer;

/**
 * Decides what to do with a step waiting for user action and drives the confirmation.
 *
 * <p>{@link #assess} runs inside {@link OperationRegistry#update} and only touches the
 * tracking record it is given. {@link #proceed} runs after the lock is released and makes
 * the external calls: resuming the engine, or racing the confirmation handler against
 * the configured timeout.
 */
public class ConfirmationCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ConfirmationCoordinator.class);

    static final String AWAITING_DETAILS_MESSAGE = "Waiting for transaction details...";
    private static final String ACTION_REQUIRED_STATUS = "ACTION_REQUIRED";

    private final OperationRegistry registry;
    private final ExecutionEngine engine;
    private final ConfirmationHandler handler;
    private final boolean autoConfirm;
    private final Duration confirmationTimeout;
    private final ScheduledExecutorService scheduler;

    /**
     * @param registry Operation registry
     * @param engine Execution engine
     * @param handler Confirmation handler (nullable)
     * @param autoConfirm Resume immediately instead of asking the handler
     * @param confirmationTimeout Time allowed for the handler; null or zero waits indefinitely
     * @param scheduler Scheduler for confirmation timers
     */
    public ConfirmationCoordinator(
            OperationRegistry registry,
            ExecutionEngine engine,
            ConfirmationHandler handler,
            boolean autoConfirm,
            Duration confirmationTimeout,
            ScheduledExecutorService scheduler) {
        this.registry = registry;
        this.engine = engine;
        this.handler = handler;
        this.autoConfirm = autoConfirm;
        this.confirmationTimeout = confirmationTimeout;
        this.scheduler = scheduler;
    }

    /**
     * Decide the confirmation stage of an action-required step. Must be called under the
     * operation's lock.
     *
     * @return work to carry out once the lock is released, or null if there is none
     */
    public PendingConfirmation assess(OperationTracking tracking, RouteSnapshot route,
                                      StepSnapshot step, RouteUpdateListener listener) {
        String operationId = tracking.getOperationId();
        if (tracking.isConfirmationInFlight()) {
            log.debug("Confirmation already in flight for operation {}", operationId);
            return null;
        }
        if (step.id() != null && step.id().equals(tracking.getConfirmedStepId())) {
            log.debug("Step {} of operation {} already confirmed", step.id(), operationId);
            return null;
        }

        Optional<ProcessSnapshot> payload = findPayload(step);
        ConfirmationStage stage = stageFor(payload.isPresent());
        switch (stage) {
            case DETAILS_PENDING:
                tracking.setAwaitingConfirmationDetails(true);
                tracking.setStatusMessage(AWAITING_DETAILS_MESSAGE);
                log.debug("Operation {} step {} waiting for transaction details", operationId, step.id());
                return null;
            case AUTO_CONFIRM:
                tracking.setAwaitingConfirmationDetails(false);
                tracking.setConfirmedStepId(step.id());
                log.info("Auto-confirming step {} of operation {}", step.id(), operationId);
                return new PendingConfirmation(operationId, stage, route, null, listener);
            case AWAITING_CONFIRMATION:
                tracking.setAwaitingConfirmationDetails(false);
                tracking.setConfirmationInFlight(true);
                tracking.setConfirmedStepId(step.id());
                ConfirmationRequest request = ConfirmationRequest.of(operationId, step, payload.get());
                return new PendingConfirmation(operationId, stage, route, request, listener);
            default:
                log.warn("Operation {} requires confirmation but no handler is configured", operationId);
                tracking.fail(new NoHandlerConfiguredException());
                return null;
        }
    }

    /**
     * Carry out work decided by {@link #assess}. Must be called without holding the lock.
     */
    public void proceed(PendingConfirmation pending) {
        if (pending == null) {
            return;
        }
        if (pending.stage() == ConfirmationStage.AUTO_CONFIRM) {
            try {
                engine.resumeExecution(pending.route(), pending.listener());
            } catch (RuntimeException e) {
                log.error("Failed to auto-confirm operation {}", pending.operationId(), e);
            }
            return;
        }
        requestConfirmation(pending);
    }

    private void requestConfirmation(PendingConfirmation pending) {
        String operationId = pending.operationId();
        CompletableFuture<Boolean> decision;
        try {
            decision = handler.onConfirmationRequired(operationId, pending.request());
            if (decision == null) {
                decision = CompletableFuture.failedFuture(
                    new IllegalStateException("Confirmation handler returned no result"));
            }
        } catch (RuntimeException e) {
            decision = CompletableFuture.failedFuture(e);
        }

        new ConfirmationRace(operationId, confirmationTimeout, scheduler)
            .start(decision)
            .whenComplete((approved, error) -> settle(pending, approved, error));
    }

    private void settle(PendingConfirmation pending, Boolean approved, Throwable error) {
        String operationId = pending.operationId();
        if (error != null) {
            Throwable cause = ConfirmationRace.unwrap(error);
            if (cause instanceof ConfirmationTimeoutException timeout) {
                markFailed(operationId, timeout);
                stopExecution(pending);
            } else {
                OperationFailureException failure = cause instanceof OperationFailureException known
                    ? known
                    : new ConfirmationHandlerException(cause);
                log.error("Confirmation handler failed for operation {}", operationId, cause);
                stopExecution(pending);
                markFailed(operationId, failure);
            }
            return;
        }

        if (Boolean.TRUE.equals(approved)) {
            log.info("Transaction confirmed for operation {}", operationId);
            apply(operationId, tracking -> tracking.setConfirmationInFlight(false));
        } else {
            log.info("Transaction rejected for operation {}", operationId);
            stopExecution(pending);
            markFailed(operationId, new ConfirmationRejectedException());
        }
    }

    private ConfirmationStage stageFor(boolean payloadReady) {
        if (!payloadReady) {
            return ConfirmationStage.DETAILS_PENDING;
        }
        if (autoConfirm) {
            return ConfirmationStage.AUTO_CONFIRM;
        }
        if (handler != null) {
            return ConfirmationStage.AWAITING_CONFIRMATION;
        }
        return ConfirmationStage.STALLED;
    }

    private void markFailed(String operationId, OperationFailureException failure) {
        apply(operationId, tracking -> tracking.fail(failure));
    }

    private void apply(String operationId, Consumer<OperationTracking> mutator) {
        try {
            if (!registry.update(operationId, mutator)) {
                log.debug("Operation {} already terminal, confirmation outcome dropped", operationId);
            }
        } catch (OperationNotFoundException e) {
            log.warn("Operation {} no longer tracked, confirmation outcome dropped", operationId);
        }
    }

    private void stopExecution(PendingConfirmation pending) {
        String operationId = pending.operationId();
        try {
            RouteSnapshot target = engine.getActiveExecution(operationId)
                .or(() -> registry.get(operationId).map(OperationTracking::getLatestRoute))
                .orElse(pending.route());
            engine.stopExecution(target);
        } catch (RuntimeException e) {
            log.error("Failed to stop execution of operation {}", operationId, e);
        }
    }

    private static Optional<ProcessSnapshot> findPayload(StepSnapshot step) {
        return step.processes().stream()
            .filter(process -> ACTION_REQUIRED_STATUS.equals(process.status()) && process.hasTxRequest())
            .findFirst();
    }
}
