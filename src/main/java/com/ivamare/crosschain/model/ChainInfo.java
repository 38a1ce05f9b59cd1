package com.ivamare.crosschain.model;

/**
 * A chain the engine can route through.
 *
 * @param chainId Chain ID
 * @param name Display name
 * @param nativeSymbol Symbol of the chain's native token
 */
public record ChainInfo(
    long chainId,
    String name,
    String nativeSymbol
) {
}
