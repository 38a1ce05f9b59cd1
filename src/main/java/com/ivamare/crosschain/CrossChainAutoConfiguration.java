package com.ivamare.crosschain;

import com.ivamare.crosschain.api.CrossChainOperations;
import com.ivamare.crosschain.api.impl.DefaultCrossChainOperations;
import com.ivamare.crosschain.confirmation.ConfirmationCoordinator;
import com.ivamare.crosschain.confirmation.ConfirmationHandler;
import com.ivamare.crosschain.engine.ExecutionEngine;
import com.ivamare.crosschain.tracking.InMemoryOperationRegistry;
import com.ivamare.crosschain.tracking.OperationCanceller;
import com.ivamare.crosschain.tracking.OperationRegistry;
import com.ivamare.crosschain.tracking.RouteUpdateObserver;
import com.ivamare.crosschain.tracking.StatusDeriver;
import com.ivamare.crosschain.tracking.TimeoutSweeper;
import com.ivamare.crosschain.tracking.TransactionLocator;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Auto-configuration for the cross-chain operation tracker.
 *
 * <p>Always configures the registry and the status deriver. When the application provides
 * an {@link ExecutionEngine} bean it also configures:
 * <ul>
 *   <li>Confirmation Coordinator (with any {@link ConfirmationHandler} bean)</li>
 *   <li>Route Update Observer</li>
 *   <li>Operation Canceller and Timeout Sweeper</li>
 *   <li>CrossChainOperations facade</li>
 * </ul>
 *
 * <p>To disable auto-configuration:
 * <pre>
 * crosschain.enabled=false
 * </pre>
 */
@AutoConfiguration
@ConditionalOnProperty(prefix = "crosschain", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(CrossChainProperties.class)
@Import(SweeperAutoStartConfiguration.class)
public class CrossChainAutoConfiguration {

    public static final String CONFIRMATION_SCHEDULER_BEAN = "crossChainConfirmationScheduler";

    // --- Infrastructure ---

    @Bean
    @ConditionalOnMissingBean
    public Clock crossChainClock() {
        return Clock.systemUTC();
    }

    // --- Tracking ---

    @Bean
    @ConditionalOnMissingBean
    public OperationRegistry operationRegistry(Clock clock) {
        return new InMemoryOperationRegistry(clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public StatusDeriver statusDeriver() {
        return new StatusDeriver();
    }

    @Bean
    @ConditionalOnMissingBean
    public TransactionLocator transactionLocator() {
        return new TransactionLocator();
    }

    // --- Confirmation ---

    @Bean(name = CONFIRMATION_SCHEDULER_BEAN, destroyMethod = "shutdownNow")
    @ConditionalOnMissingBean(name = CONFIRMATION_SCHEDULER_BEAN)
    public ScheduledExecutorService crossChainConfirmationScheduler() {
        return Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "crosschain-confirmation-timer");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(ExecutionEngine.class)
    public ConfirmationCoordinator confirmationCoordinator(
            OperationRegistry registry,
            ExecutionEngine engine,
            ObjectProvider<ConfirmationHandler> handler,
            CrossChainProperties properties,
            @Qualifier(CONFIRMATION_SCHEDULER_BEAN) ScheduledExecutorService scheduler) {
        return new ConfirmationCoordinator(
            registry,
            engine,
            handler.getIfAvailable(),
            properties.isAutoConfirmTransactions(),
            properties.getConfirmationTimeout(),
            scheduler
        );
    }

    // --- Engine callbacks and cancellation ---

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(ExecutionEngine.class)
    public RouteUpdateObserver routeUpdateObserver(
            OperationRegistry registry,
            StatusDeriver deriver,
            TransactionLocator locator,
            ConfirmationCoordinator coordinator) {
        return new RouteUpdateObserver(registry, deriver, locator, coordinator);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(ExecutionEngine.class)
    public OperationCanceller operationCanceller(OperationRegistry registry, ExecutionEngine engine) {
        return new OperationCanceller(registry, engine);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(ExecutionEngine.class)
    public TimeoutSweeper timeoutSweeper(
            OperationRegistry registry,
            OperationCanceller canceller,
            Clock clock,
            CrossChainProperties properties) {
        return new TimeoutSweeper(
            registry,
            canceller,
            clock,
            properties.getPendingOperationTimeout(),
            properties.getSweeper().getInterval()
        );
    }

    // --- Facade ---

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(ExecutionEngine.class)
    public CrossChainOperations crossChainOperations(
            ExecutionEngine engine,
            OperationRegistry registry,
            RouteUpdateObserver observer,
            OperationCanceller canceller,
            TimeoutSweeper sweeper) {
        return new DefaultCrossChainOperations(engine, registry, observer, canceller, sweeper);
    }
}
