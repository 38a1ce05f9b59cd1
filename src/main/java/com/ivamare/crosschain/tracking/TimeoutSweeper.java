package com.ivamare.crosschain.tracking;

import com.ivamare.crosschain.model.CancelReason;
import com.ivamare.crosschain.model.OperationStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Cancels operations that stayed PENDING longer than the configured timeout.
 *
 * <p>{@link #sweep()} can be called directly; {@link #start()} runs it on a fixed delay.
 */
public class TimeoutSweeper {

    private static final Logger log = LoggerFactory.getLogger(TimeoutSweeper.class);

    private final OperationRegistry registry;
    private final OperationCanceller canceller;
    private final Clock clock;
    private final Duration pendingTimeout;
    private final Duration interval;

    private volatile boolean running = false;
    private ScheduledExecutorService scheduler;

    /**
     * @param registry Operation registry
     * @param canceller Shared cancellation path
     * @param clock Time source
     * @param pendingTimeout Maximum PENDING age; null or zero disables sweeping
     * @param interval Delay between scheduled passes
     */
    public TimeoutSweeper(OperationRegistry registry, OperationCanceller canceller, Clock clock,
                          Duration pendingTimeout, Duration interval) {
        this.registry = registry;
        this.canceller = canceller;
        this.clock = clock;
        this.pendingTimeout = pendingTimeout;
        this.interval = interval;
    }

    /**
     * Run one pass.
     *
     * @return number of operations canceled
     */
    public int sweep() {
        if (!isEnabled()) {
            return 0;
        }

        Instant now = clock.instant();
        List<OperationTracking> pending = registry.findByStatus(OperationStatus.PENDING);
        log.trace("Checking {} pending operations for timeout at {}", pending.size(), now);

        int reclaimed = 0;
        for (OperationTracking tracking : pending) {
            if (!isExpired(tracking, now)) {
                continue;
            }
            String operationId = tracking.getOperationId();
            try {
                boolean canceled = canceller.tryCancel(operationId, CancelReason.TIMEOUT,
                    current -> current.getStatus() == OperationStatus.PENDING);
                if (canceled) {
                    log.warn("Operation {} timed out after {}ms in PENDING",
                        operationId, pendingTimeout.toMillis());
                    reclaimed++;
                }
            } catch (RuntimeException e) {
                log.error("Failed to time out operation {}: {}", operationId, e.getMessage(), e);
            }
        }

        if (reclaimed > 0) {
            log.info("Timed out {} pending operations", reclaimed);
        }
        return reclaimed;
    }

    /**
     * Start sweeping on a fixed delay.
     */
    public synchronized void start() {
        if (running) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "crosschain-timeout-sweeper");
            thread.setDaemon(true);
            return thread;
        });
        long delayMs = interval.toMillis();
        scheduler.scheduleWithFixedDelay(this::safeSweep, delayMs, delayMs, TimeUnit.MILLISECONDS);
        running = true;
        log.info("TimeoutSweeper started (timeout={}ms, interval={}ms)",
            isEnabled() ? pendingTimeout.toMillis() : 0, delayMs);
    }

    /**
     * Stop sweeping.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            scheduler.shutdownNow();
        }
        log.info("TimeoutSweeper stopped");
    }

    /**
     * Check if scheduled sweeping is running.
     */
    public boolean isRunning() {
        return running;
    }

    public boolean isEnabled() {
        return pendingTimeout != null && !pendingTimeout.isZero() && !pendingTimeout.isNegative();
    }

    private boolean isExpired(OperationTracking tracking, Instant now) {
        return Duration.between(tracking.getStartTime(), now).compareTo(pendingTimeout) > 0;
    }

    // An exception escaping scheduleWithFixedDelay cancels the schedule.
    private void safeSweep() {
        try {
            sweep();
        } catch (RuntimeException e) {
            log.error("Timeout sweep failed: {}", e.getMessage(), e);
        }
    }
}
