package com.ivamare.crosschain;

import com.ivamare.crosschain.tracking.TimeoutSweeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;

import jakarta.annotation.PreDestroy;

/**
 * Auto-start configuration for the timeout sweeper.
 *
 * <p>Enable with:
 * <pre>
 * crosschain:
 *   pending-operation-timeout-ms: 3600000
 *   sweeper:
 *     auto-start: true
 * </pre>
 */
@Configuration
@ConditionalOnProperty(prefix = "crosschain.sweeper", name = "auto-start", havingValue = "true")
public class SweeperAutoStartConfiguration {

    private static final Logger log = LoggerFactory.getLogger(SweeperAutoStartConfiguration.class);

    private final ObjectProvider<TimeoutSweeper> sweeper;

    public SweeperAutoStartConfiguration(ObjectProvider<TimeoutSweeper> sweeper) {
        this.sweeper = sweeper;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startSweeper() {
        TimeoutSweeper timeoutSweeper = sweeper.getIfAvailable();
        if (timeoutSweeper == null) {
            log.warn("Sweeper auto-start requested but no ExecutionEngine is configured");
            return;
        }
        if (!timeoutSweeper.isEnabled()) {
            log.warn("Sweeper auto-start requested but crosschain.pending-operation-timeout-ms is 0");
        }
        timeoutSweeper.start();
    }

    @PreDestroy
    public void stopSweeper() {
        TimeoutSweeper timeoutSweeper = sweeper.getIfAvailable();
        if (timeoutSweeper != null && timeoutSweeper.isRunning()) {
            timeoutSweeper.stop();
        }
    }
}
