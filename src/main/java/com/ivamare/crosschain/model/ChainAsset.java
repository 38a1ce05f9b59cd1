package com.ivamare.crosschain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * An asset on a specific chain.
 *
 * @param chainId Chain where the asset lives
 * @param address Token contract address (null for the native asset)
 * @param symbol Asset symbol
 * @param decimals Asset decimals
 * @param name Display name (nullable)
 */
public record ChainAsset(
    long chainId,
    String address,
    String symbol,
    int decimals,
    String name
) {

    /**
     * Create the native asset of a chain.
     */
    public static ChainAsset nativeAsset(long chainId, String symbol) {
        return new ChainAsset(chainId, null, symbol, 18, null);
    }

    @JsonIgnore
    public boolean isNative() {
        return address == null || address.isBlank();
    }
}
