package com.ivamare.crosschain.model;

/**
 * Engine estimate attached to a quote.
 *
 * @param fromAmount Input amount in source asset units
 * @param toAmount Estimated output in destination asset units
 * @param toAmountMin Minimum output after slippage
 * @param routeDescription Tool or bridge names involved
 * @param executionDurationSeconds Estimated duration in seconds
 * @param feeUsd Estimated fees in USD
 */
public record QuoteEstimate(
    String fromAmount,
    String toAmount,
    String toAmountMin,
    String routeDescription,
    long executionDurationSeconds,
    String feeUsd
) {
}
