package com.ivamare.crosschain.tracking;

import com.ivamare.crosschain.confirmation.ConfirmationCoordinator;
import com.ivamare.crosschain.confirmation.PendingConfirmation;
import com.ivamare.crosschain.engine.RouteSnapshot;
import com.ivamare.crosschain.engine.RouteUpdateListener;
import com.ivamare.crosschain.engine.StepSnapshot;
import com.ivamare.crosschain.exception.OperationNotFoundException;
import com.ivamare.crosschain.exception.StepExecutionFailedException;
import com.ivamare.crosschain.model.OperationStatus;
import com.ivamare.crosschain.model.TransactionDetails;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Applies engine route updates to the registry.
 *
 * <p>Each update is applied in one {@link OperationRegistry#update} call: status derivation,
 * transaction details, messages and the confirmation assessment. Confirmation work that
 * calls out to the engine or the handler runs after the lock is released.
 */
public class RouteUpdateObserver {

    private static final Logger log = LoggerFactory.getLogger(RouteUpdateObserver.class);

    static final String COMPLETED_MESSAGE = "Operation completed successfully.";
    static final String ACTION_REQUIRED_MESSAGE = "Action required by user.";
    static final String AWAITING_DETAILS_MESSAGE = "Waiting for transaction details...";
    static final String IN_PROGRESS_MESSAGE = "Operation in progress...";
    static final String UNKNOWN_MESSAGE = "Operation status is unknown.";

    private final OperationRegistry registry;
    private final StatusDeriver deriver;
    private final TransactionLocator locator;
    private final ConfirmationCoordinator coordinator;

    public RouteUpdateObserver(OperationRegistry registry, StatusDeriver deriver,
                               TransactionLocator locator, ConfirmationCoordinator coordinator) {
        this.registry = registry;
        this.deriver = deriver;
        this.locator = locator;
        this.coordinator = coordinator;
    }

    /**
     * Listener to hand to the engine for an operation.
     */
    public RouteUpdateListener listenerFor(String operationId) {
        return route -> onUpdate(operationId, route);
    }

    /**
     * Apply one route update.
     */
    public void onUpdate(String operationId, RouteSnapshot route) {
        if (route == null) {
            log.debug("Ignoring empty route update for operation {}", operationId);
            return;
        }
        RouteUpdateListener listener = listenerFor(operationId);
        AtomicReference<PendingConfirmation> pending = new AtomicReference<>();
        try {
            boolean applied = registry.update(operationId,
                tracking -> pending.set(apply(tracking, route, listener)));
            if (!applied) {
                log.debug("Dropped route update for terminal operation {}", operationId);
                return;
            }
        } catch (OperationNotFoundException e) {
            log.warn("Received route update for untracked operation {}", operationId);
            return;
        }
        coordinator.proceed(pending.get());
    }

    private PendingConfirmation apply(OperationTracking tracking, RouteSnapshot route,
                                      RouteUpdateListener listener) {
        tracking.setLatestRoute(route);

        OperationStatus previous = tracking.getStatus();
        OperationStatus derived = deriver.derive(route);
        tracking.setStatus(derived);
        log.debug("Operation {} derived {} (was {})", tracking.getOperationId(), derived, previous);

        tracking.setSourceTx(merge(tracking.getSourceTx(), locator.sourceTx(route)));
        tracking.setDestinationTx(merge(tracking.getDestinationTx(), locator.destinationTx(route)));

        PendingConfirmation pending = null;
        if (derived == OperationStatus.ACTION_REQUIRED) {
            Optional<StepSnapshot> step = deriver.findActionRequiredStep(route);
            if (step.isPresent()) {
                pending = coordinator.assess(tracking, route, step.get(), listener);
            }
        }

        switch (tracking.getStatus()) {
            case FAILED:
                if (tracking.getErrorCode() == null) {
                    StepSnapshot failedStep = deriver.findFailedStep(route).orElse(null);
                    tracking.fail(new StepExecutionFailedException(locator.failureMessage(failedStep)));
                }
                break;
            case COMPLETED:
                tracking.setReceivedAmount(locator.receivedAmount(route));
                tracking.setStatusMessage(COMPLETED_MESSAGE);
                break;
            case ACTION_REQUIRED:
                tracking.setStatusMessage(tracking.isAwaitingConfirmationDetails()
                    ? AWAITING_DETAILS_MESSAGE
                    : ACTION_REQUIRED_MESSAGE);
                break;
            case PENDING:
                tracking.setStatusMessage(IN_PROGRESS_MESSAGE);
                break;
            default:
                tracking.setStatusMessage(UNKNOWN_MESSAGE);
                tracking.setAwaitingConfirmationDetails(false);
                break;
        }
        return pending;
    }

    // A located hash always wins; otherwise keep whatever was found before.
    private static TransactionDetails merge(TransactionDetails current, TransactionDetails located) {
        if (current == null) {
            return located;
        }
        if (located.hasHash()) {
            Long chainId = located.chainId() != null ? located.chainId() : current.chainId();
            return new TransactionDetails(located.hash(), chainId, located.explorerUrl());
        }
        if (current.hasHash() || located.chainId() == null) {
            return current;
        }
        return located;
    }
}
