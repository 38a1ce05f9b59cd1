package com.ivamare.crosschain.confirmation;

import com.ivamare.crosschain.exception.ConfirmationHandlerException;
import com.ivamare.crosschain.exception.ConfirmationTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Races a confirmation decision against an optional timer. Settles exactly once.
 *
 * <p>The outcome completes with the decision ({@code null} counts as a rejection), or
 * exceptionally with {@link ConfirmationTimeoutException} when the timer fires first, or
 * {@link ConfirmationHandlerException} when the decision itself fails. Whatever loses
 * the race is ignored.
 */
public class ConfirmationRace {

    private static final Logger log = LoggerFactory.getLogger(ConfirmationRace.class);

    private final String operationId;
    private final Duration timeout;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean settled = new AtomicBoolean(false);
    private final CompletableFuture<Boolean> outcome = new CompletableFuture<>();
    private volatile ScheduledFuture<?> timer;

    /**
     * @param operationId Operation being confirmed, for logging
     * @param timeout Time allowed for the decision; null or zero waits indefinitely
     * @param scheduler Scheduler running the timer
     */
    public ConfirmationRace(String operationId, Duration timeout, ScheduledExecutorService scheduler) {
        this.operationId = operationId;
        this.timeout = timeout;
        this.scheduler = scheduler;
    }

    /**
     * Start the race. Call once.
     */
    public CompletableFuture<Boolean> start(CompletableFuture<Boolean> decision) {
        if (isTimed()) {
            timer = scheduler.schedule(this::onTimeout, timeout.toMillis(), TimeUnit.MILLISECONDS);
        }
        decision.whenComplete(this::onDecision);
        return outcome;
    }

    public boolean isSettled() {
        return settled.get();
    }

    private boolean isTimed() {
        return timeout != null && !timeout.isZero() && !timeout.isNegative();
    }

    private void onTimeout() {
        if (settled.compareAndSet(false, true)) {
            log.warn("Confirmation for operation {} timed out after {}ms", operationId, timeout.toMillis());
            outcome.completeExceptionally(new ConfirmationTimeoutException(timeout));
        }
    }

    private void onDecision(Boolean approved, Throwable error) {
        if (!settled.compareAndSet(false, true)) {
            log.debug("Ignoring late confirmation decision for operation {}", operationId);
            return;
        }
        ScheduledFuture<?> pending = timer;
        if (pending != null) {
            pending.cancel(false);
        }
        if (error != null) {
            outcome.completeExceptionally(new ConfirmationHandlerException(unwrap(error)));
        } else {
            outcome.complete(Boolean.TRUE.equals(approved));
        }
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
