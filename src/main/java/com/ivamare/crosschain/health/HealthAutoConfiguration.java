package com.ivamare.crosschain.health;

import com.ivamare.crosschain.CrossChainAutoConfiguration;
import com.ivamare.crosschain.CrossChainProperties;
import com.ivamare.crosschain.tracking.OperationRegistry;
import com.ivamare.crosschain.tracking.TimeoutSweeper;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for the operation tracker health indicator.
 */
@AutoConfiguration(after = CrossChainAutoConfiguration.class)
@ConditionalOnClass(HealthIndicator.class)
@ConditionalOnProperty(prefix = "crosschain", name = "enabled", havingValue = "true", matchIfMissing = true)
public class HealthAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(OperationTrackerHealthIndicator.class)
    @ConditionalOnBean(OperationRegistry.class)
    public OperationTrackerHealthIndicator operationTrackerHealthIndicator(
            OperationRegistry registry,
            ObjectProvider<TimeoutSweeper> sweeper,
            CrossChainProperties properties) {
        return new OperationTrackerHealthIndicator(
            registry,
            sweeper.getIfAvailable(),
            properties.getSweeper().isAutoStart()
        );
    }
}
