package com.ivamare.crosschain.engine;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Point-in-time view of a route as reported by the execution engine.
 *
 * <p>The route ID is the operation ID.
 *
 * @param id Route (operation) ID
 * @param fromChainId Source chain
 * @param toChainId Destination chain
 * @param fromAmount Amount sent
 * @param toAmount Estimated amount received
 * @param steps Ordered steps; may be empty before the engine materializes them
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RouteSnapshot(
    String id,
    Long fromChainId,
    Long toChainId,
    String fromAmount,
    String toAmount,
    List<StepSnapshot> steps
) {

    public RouteSnapshot {
        steps = steps != null ? List.copyOf(steps) : List.of();
    }

    public boolean hasSteps() {
        return !steps.isEmpty();
    }

    public StepSnapshot firstStep() {
        return steps.isEmpty() ? null : steps.get(0);
    }

    public StepSnapshot lastStep() {
        return steps.isEmpty() ? null : steps.get(steps.size() - 1);
    }
}
