package com.ivamare.crosschain.engine;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * One leg of a route.
 *
 * @param id Step ID
 * @param type Step type (swap, cross, lifi, ...)
 * @param tool Bridge or exchange used
 * @param action What the step moves
 * @param execution Execution progress, null until the engine starts the step
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StepSnapshot(
    String id,
    String type,
    String tool,
    StepAction action,
    StepExecution execution
) {

    public boolean hasExecution() {
        return execution != null;
    }

    /**
     * Raw execution status, or null if the step has not started.
     */
    public String rawStatus() {
        return execution != null ? execution.status() : null;
    }

    public List<ProcessSnapshot> processes() {
        return execution != null ? execution.process() : List.of();
    }

    /**
     * Whether this step starts or ends on the given chain.
     */
    public boolean touchesChain(Long chainId) {
        return action != null && chainId != null
            && (chainId.equals(action.toChainId()) || chainId.equals(action.fromChainId()));
    }
}
