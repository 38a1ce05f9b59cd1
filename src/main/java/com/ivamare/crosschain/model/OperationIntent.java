package com.ivamare.crosschain.model;

import java.util.Map;

/**
 * What the user asked for: move {@code amount} of the source asset to the destination asset.
 *
 * <p>Intents are immutable; the options map is copied on construction.
 *
 * @param sourceAsset Asset debited on the source chain
 * @param destinationAsset Asset credited on the destination chain
 * @param amount Amount in source asset units
 * @param userAddress Address initiating the operation
 * @param recipientAddress Receiving address (nullable, defaults to userAddress)
 * @param slippageBps Slippage tolerance in basis points (nullable)
 * @param referrer Referral identifier (nullable)
 * @param options Engine-specific routing options
 */
public record OperationIntent(
    ChainAsset sourceAsset,
    ChainAsset destinationAsset,
    String amount,
    String userAddress,
    String recipientAddress,
    Integer slippageBps,
    String referrer,
    Map<String, Object> options
) {

    public OperationIntent {
        options = options != null ? Map.copyOf(options) : Map.of();
    }

    /**
     * Create an intent without slippage, referrer or options.
     */
    public static OperationIntent of(ChainAsset sourceAsset, ChainAsset destinationAsset,
                                     String amount, String userAddress, String recipientAddress) {
        return new OperationIntent(sourceAsset, destinationAsset, amount, userAddress, recipientAddress,
            null, null, Map.of());
    }

    /**
     * Address that receives the destination asset.
     */
    public String effectiveRecipient() {
        return recipientAddress != null && !recipientAddress.isBlank() ? recipientAddress : userAddress;
    }
}
