package com.ivamare.crosschain.exception;

/**
 * Base exception for all cross-chain tracker errors.
 */
public class CrossChainException extends RuntimeException {

    public CrossChainException(String message) {
        super(message);
    }

    public CrossChainException(String message, Throwable cause) {
        super(message, cause);
    }
}
