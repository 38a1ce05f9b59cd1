package com.ivamare.crosschain;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the cross-chain operation tracker.
 *
 * <p>Example configuration:
 * <pre>
 * crosschain:
 *   enabled: true
 *   auto-confirm-transactions: false
 *   confirmation-timeout-ms: 120000
 *   pending-operation-timeout-ms: 3600000
 *   sweeper:
 *     auto-start: true
 *     interval-ms: 60000
 * </pre>
 */
@ConfigurationProperties(prefix = "crosschain")
public class CrossChainProperties {

    /**
     * Enable/disable cross-chain tracker auto-configuration.
     */
    private boolean enabled = true;

    /**
     * Resume executions waiting for confirmation without asking the handler.
     * Meant for tests and automation only.
     */
    private boolean autoConfirmTransactions = false;

    /**
     * Time allowed for the confirmation handler to answer. 0 waits indefinitely.
     */
    private long confirmationTimeoutMs = 0;

    /**
     * Maximum time an operation may stay PENDING before the sweeper cancels it. 0 disables sweeping.
     */
    private long pendingOperationTimeoutMs = 0;

    /**
     * Timeout sweeper configuration.
     */
    private SweeperProperties sweeper = new SweeperProperties();

    // Getters and setters

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isAutoConfirmTransactions() {
        return autoConfirmTransactions;
    }

    public void setAutoConfirmTransactions(boolean autoConfirmTransactions) {
        this.autoConfirmTransactions = autoConfirmTransactions;
    }

    public long getConfirmationTimeoutMs() {
        return confirmationTimeoutMs;
    }

    public void setConfirmationTimeoutMs(long confirmationTimeoutMs) {
        this.confirmationTimeoutMs = confirmationTimeoutMs;
    }

    public long getPendingOperationTimeoutMs() {
        return pendingOperationTimeoutMs;
    }

    public void setPendingOperationTimeoutMs(long pendingOperationTimeoutMs) {
        this.pendingOperationTimeoutMs = pendingOperationTimeoutMs;
    }

    public SweeperProperties getSweeper() {
        return sweeper;
    }

    public void setSweeper(SweeperProperties sweeper) {
        this.sweeper = sweeper;
    }

    /**
     * Confirmation timeout as a Duration.
     */
    public Duration getConfirmationTimeout() {
        return Duration.ofMillis(confirmationTimeoutMs);
    }

    /**
     * Pending operation timeout as a Duration.
     */
    public Duration getPendingOperationTimeout() {
        return Duration.ofMillis(pendingOperationTimeoutMs);
    }

    /**
     * Timeout sweeper configuration.
     */
    public static class SweeperProperties {

        /**
         * Start the sweeper when the application is ready.
         */
        private boolean autoStart = false;

        /**
         * Delay between sweeps in milliseconds.
         */
        private long intervalMs = 60000;

        public boolean isAutoStart() {
            return autoStart;
        }

        public void setAutoStart(boolean autoStart) {
            this.autoStart = autoStart;
        }

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }

        public Duration getInterval() {
            return Duration.ofMillis(intervalMs);
        }
    }
}
