package com.ivamare.crosschain.engine;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Execution progress of a step.
 *
 * @param status Raw engine status (PENDING, STARTED, ACTION_REQUIRED, DONE, FAILED, ...)
 * @param process Sub-units of work in execution order
 * @param fromAmount Amount actually sent (nullable)
 * @param toAmount Amount actually received (nullable)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StepExecution(
    String status,
    List<ProcessSnapshot> process,
    String fromAmount,
    String toAmount
) {

    public StepExecution {
        process = process != null ? List.copyOf(process) : List.of();
    }
}
