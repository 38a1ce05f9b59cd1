package com.ivamare.crosschain.model;

/**
 * Recommended native-token amount to deliver on the destination chain for gas.
 *
 * @param amount Amount in the destination chain's native units
 * @param usdValue Value in USD
 */
public record GasEstimate(
    String amount,
    String usdValue
) {

    private static final GasEstimate NONE = new GasEstimate("0", "0");

    /**
     * Estimate used when the engine has no recommendation.
     */
    public static GasEstimate none() {
        return NONE;
    }
}
