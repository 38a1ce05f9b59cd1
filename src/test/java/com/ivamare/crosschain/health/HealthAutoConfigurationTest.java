package com.ivamare.crosschain.health;

import com.ivamare.crosschain.CrossChainAutoConfiguration;
import com.ivamare.crosschain.engine.ExecutionEngine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

@DisplayName("HealthAutoConfiguration")
class HealthAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(CrossChainAutoConfiguration.class, HealthAutoConfiguration.class))
        .withBean(ExecutionEngine.class, () -> mock(ExecutionEngine.class));

    @Test
    @DisplayName("should register the health indicator")
    void shouldRegisterHealthIndicator() {
        contextRunner.run(context ->
            assertThat(context).hasSingleBean(OperationTrackerHealthIndicator.class));
    }

    @Test
    @DisplayName("should not register the health indicator when disabled")
    void shouldNotRegisterWhenDisabled() {
        contextRunner
            .withPropertyValues("crosschain.enabled=false")
            .run(context -> assertThat(context).doesNotHaveBean(OperationTrackerHealthIndicator.class));
    }
}
