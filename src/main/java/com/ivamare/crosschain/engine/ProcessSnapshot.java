package com.ivamare.crosschain.engine;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Map;

/**
 * Sub-unit of work inside a step: an approval, a swap, a bridge transfer, a receiving leg.
 *
 * @param type Process type (TOKEN_ALLOWANCE, SWAP, CROSS_CHAIN, RECEIVING_CHAIN, ...)
 * @param status Raw process status
 * @param txHash Transaction hash once broadcast (nullable)
 * @param txLink Explorer link (nullable)
 * @param chainId Chain the transaction is sent on (nullable)
 * @param error Failure details (nullable)
 * @param txRequest Unsigned transaction payload, present once the engine is ready for signing
 * @param outputAmount Amount credited by a receiving process (nullable)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProcessSnapshot(
    String type,
    String status,
    String txHash,
    String txLink,
    Long chainId,
    ProcessError error,
    Map<String, Object> txRequest,
    String outputAmount
) {

    public boolean hasTxHash() {
        return txHash != null && !txHash.isBlank();
    }

    public boolean hasTxRequest() {
        return txRequest != null && !txRequest.isEmpty();
    }

    @JsonIgnore
    public boolean isReceiving() {
        return type != null && type.startsWith("RECEIVING");
    }

    /**
     * Error details reported by the engine for a failed process.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ProcessError(String code, String message) {
    }
}
