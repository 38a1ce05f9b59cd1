package com.ivamare.crosschain.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * On-chain transaction reference.
 *
 * @param hash Transaction hash (nullable until the transaction is broadcast)
 * @param chainId Chain the transaction belongs to (nullable)
 * @param explorerUrl Block explorer link (nullable)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TransactionDetails(
    String hash,
    Long chainId,
    String explorerUrl
) {

    /**
     * Reference to a chain with no transaction yet.
     */
    public static TransactionDetails onChain(Long chainId) {
        return new TransactionDetails(null, chainId, null);
    }

    public boolean hasHash() {
        return hash != null && !hash.isBlank();
    }
}
