package com.ivamare.crosschain.health;

import com.ivamare.crosschain.model.OperationStatus;
import com.ivamare.crosschain.tracking.OperationRegistry;
import com.ivamare.crosschain.tracking.TimeoutSweeper;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.Map;

/**
 * Health indicator for the operation tracker.
 *
 * <p>Reports:
 * <ul>
 *   <li>Operation counts per status</li>
 *   <li>Whether the timeout sweeper is running</li>
 * </ul>
 * Reports DOWN when sweeper auto-start was requested but the sweeper is not running.
 */
public class OperationTrackerHealthIndicator implements HealthIndicator {

    private final OperationRegistry registry;
    private final TimeoutSweeper sweeper;
    private final boolean sweeperExpected;

    /**
     * @param registry Operation registry
     * @param sweeper Timeout sweeper (nullable when no engine is configured)
     * @param sweeperExpected Whether sweeper auto-start was requested
     */
    public OperationTrackerHealthIndicator(OperationRegistry registry, TimeoutSweeper sweeper,
                                           boolean sweeperExpected) {
        this.registry = registry;
        this.sweeper = sweeper;
        this.sweeperExpected = sweeperExpected;
    }

    @Override
    public Health health() {
        try {
            Map<OperationStatus, Long> counts = registry.countByStatus();
            boolean sweeperRunning = sweeper != null && sweeper.isRunning();

            Health.Builder builder = sweeperExpected && !sweeperRunning ? Health.down() : Health.up();
            long total = 0;
            for (Map.Entry<OperationStatus, Long> entry : counts.entrySet()) {
                builder.withDetail(detailKey(entry.getKey()), entry.getValue());
                total += entry.getValue();
            }
            return builder
                .withDetail("totalOperations", total)
                .withDetail("sweeperRunning", sweeperRunning)
                .build();
        } catch (Exception e) {
            return Health.down()
                .withDetail("error", e.getMessage())
                .build();
        }
    }

    private static String detailKey(OperationStatus status) {
        return switch (status) {
            case PENDING -> "pendingOperations";
            case ACTION_REQUIRED -> "actionRequiredOperations";
            case COMPLETED -> "completedOperations";
            case FAILED -> "failedOperations";
            case UNKNOWN -> "unknownOperations";
        };
    }
}
