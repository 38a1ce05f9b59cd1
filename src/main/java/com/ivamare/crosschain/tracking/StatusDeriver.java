package com.ivamare.crosschain.tracking;

import com.ivamare.crosschain.engine.RouteSnapshot;
import com.ivamare.crosschain.engine.StepSnapshot;
import com.ivamare.crosschain.model.OperationStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Derives one overall status from the per-step statuses of a route.
 *
 * <p>Stateless; safe to share.
 */
public class StatusDeriver {

    private static final Logger log = LoggerFactory.getLogger(StatusDeriver.class);

    /**
     * Map a raw engine step status to an overall status.
     * A missing status means the step has not started and counts as PENDING.
     */
    public OperationStatus map(String rawStatus) {
        if (rawStatus == null) {
            return OperationStatus.PENDING;
        }
        switch (rawStatus) {
            case "PENDING":
            case "STARTED":
                return OperationStatus.PENDING;
            case "ACTION_REQUIRED":
                return OperationStatus.ACTION_REQUIRED;
            case "DONE":
                return OperationStatus.COMPLETED;
            case "FAILED":
            case "CANCELLED":
            case "NOT_FOUND":
                return OperationStatus.FAILED;
            default:
                log.warn("Unrecognized step status: {}", rawStatus);
                return OperationStatus.UNKNOWN;
        }
    }

    /**
     * Derive the overall status of a route.
     *
     * <p>Priority: FAILED, then ACTION_REQUIRED, then COMPLETED (every step executed and
     * done), then PENDING. A route without steps is PENDING.
     */
    public OperationStatus derive(RouteSnapshot route) {
        if (route == null || !route.hasSteps()) {
            return OperationStatus.PENDING;
        }

        boolean actionRequired = false;
        boolean pending = false;
        boolean allCompleted = true;

        for (StepSnapshot step : route.steps()) {
            OperationStatus stepStatus = map(step.rawStatus());
            if (stepStatus == OperationStatus.FAILED) {
                return OperationStatus.FAILED;
            }
            if (stepStatus == OperationStatus.ACTION_REQUIRED) {
                actionRequired = true;
            }
            if (stepStatus == OperationStatus.PENDING) {
                pending = true;
            }
            if (!step.hasExecution() || stepStatus != OperationStatus.COMPLETED) {
                allCompleted = false;
            }
        }

        if (actionRequired) {
            return OperationStatus.ACTION_REQUIRED;
        }
        if (allCompleted) {
            return OperationStatus.COMPLETED;
        }
        if (pending) {
            return OperationStatus.PENDING;
        }
        log.warn("Could not derive status for route {}", route.id());
        return OperationStatus.UNKNOWN;
    }

    /**
     * First step waiting for user action.
     */
    public Optional<StepSnapshot> findActionRequiredStep(RouteSnapshot route) {
        return findStep(route, OperationStatus.ACTION_REQUIRED);
    }

    /**
     * First failed step.
     */
    public Optional<StepSnapshot> findFailedStep(RouteSnapshot route) {
        return findStep(route, OperationStatus.FAILED);
    }

    private Optional<StepSnapshot> findStep(RouteSnapshot route, OperationStatus status) {
        if (route == null) {
            return Optional.empty();
        }
        return route.steps().stream()
            .filter(step -> step.hasExecution() && map(step.rawStatus()) == status)
            .findFirst();
    }
}
