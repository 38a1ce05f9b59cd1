package com.ivamare.crosschain.engine;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Chains and amount a step moves between.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StepAction(
    Long fromChainId,
    Long toChainId,
    String fromAmount
) {
}
