package com.ivamare.crosschain.confirmation;

import java.util.concurrent.CompletableFuture;

/**
 * Asks a human (or an automated policy) to approve a transaction before it is signed.
 *
 * <p>Implementations must not block the calling thread; the answer is delivered
 * through the returned future. Completing it with {@code true} approves the transaction,
 * {@code false} rejects it, and completing it exceptionally fails the operation.
 */
@FunctionalInterface
public interface ConfirmationHandler {

    CompletableFuture<Boolean> onConfirmationRequired(String operationId, ConfirmationRequest request);
}
