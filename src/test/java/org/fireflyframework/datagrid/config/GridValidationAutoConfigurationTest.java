/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.fireflyframework.datagrid.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.fireflyframework.datagrid.performance.InMemoryPerformanceSink;
import org.fireflyframework.datagrid.performance.MicrometerPerformanceSink;
import org.fireflyframework.datagrid.performance.PerformanceSink;
import org.fireflyframework.datagrid.validation.ExecutionMode;
import org.fireflyframework.datagrid.validation.ValidationOptions;
import org.fireflyframework.datagrid.validation.ValidationOrchestrator;
import org.fireflyframework.datagrid.validation.ValidationSeverity;
import org.fireflyframework.datagrid.validation.ValidationVerdict;
import org.fireflyframework.datagrid.validation.debounce.DebouncedValidatorFactory;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.fireflyframework.datagrid.validation.RuleFixtures.failing;

/**
 * Unit tests for {@link GridValidationAutoConfiguration}.
 */
class GridValidationAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(GridValidationAutoConfiguration.class));

    @Test
    void autoConfiguration_defaults_shouldRegisterEngineBeans() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(ValidationOrchestrator.class);
            assertThat(context).hasSingleBean(ValidationOptions.class);
            assertThat(context).hasSingleBean(DebouncedValidatorFactory.class);
            assertThat(context.getBean(PerformanceSink.class)).isInstanceOf(InMemoryPerformanceSink.class);

            assertThat(context.getBean(ValidationOrchestrator.class).getDefaultTimeout())
                    .isEqualTo(Duration.ofSeconds(2));
            ValidationOptions options = context.getBean(ValidationOptions.class);
            assertThat(options.getMode()).isEqualTo(ExecutionMode.RUN_ALL);
            assertThat(options.getMaxConcurrency()).isEqualTo(8);
            assertThat(options.getBatchSize()).isEqualTo(500);
            assertThat(context.getBean(DebouncedValidatorFactory.class).getDelay())
                    .isEqualTo(Duration.ofMillis(500));
        });
    }

    @Test
    void autoConfiguration_properties_shouldBeApplied() {
        contextRunner
                .withPropertyValues(
                        "firefly.grid.validation.default-timeout=750ms",
                        "firefly.grid.validation.mode=STOP_ON_FIRST_ERROR",
                        "firefly.grid.validation.fail-on=WARNING",
                        "firefly.grid.validation.batch-size=50",
                        "firefly.grid.validation.debounce-delay=250ms")
                .run(context -> {
                    assertThat(context.getBean(ValidationOrchestrator.class).getDefaultTimeout())
                            .isEqualTo(Duration.ofMillis(750));
                    ValidationOptions options = context.getBean(ValidationOptions.class);
                    assertThat(options.getMode()).isEqualTo(ExecutionMode.STOP_ON_FIRST_ERROR);
                    assertThat(options.getFailOn()).isEqualTo(ValidationSeverity.WARNING);
                    assertThat(options.getBatchSize()).isEqualTo(50);
                    assertThat(context.getBean(DebouncedValidatorFactory.class).getDelay())
                            .isEqualTo(Duration.ofMillis(250));
                });
    }

    @Test
    void autoConfiguration_failOnProperty_shouldApplyToValidateWithoutOptions() {
        contextRunner
                .withPropertyValues("firefly.grid.validation.fail-on=WARNING")
                .run(context -> {
                    ValidationOrchestrator orchestrator = context.getBean(ValidationOrchestrator.class);
                    assertThat(orchestrator.getDefaultOptions()).isSameAs(context.getBean(ValidationOptions.class));

                    ValidationVerdict verdict = orchestrator.validate("value",
                            List.of(failing("soft", ValidationSeverity.WARNING)));

                    assertThat(verdict.isValid()).isFalse();
                    assertThat(verdict.getFailOn()).isEqualTo(ValidationSeverity.WARNING);
                });
    }

    @Test
    void autoConfiguration_userOptions_shouldBeUsedByOrchestrator() {
        ValidationOptions custom = ValidationOptions.builder()
                .mode(ExecutionMode.STOP_ON_FIRST_ERROR)
                .build();

        contextRunner
                .withBean(ValidationOptions.class, () -> custom)
                .run(context -> assertThat(context.getBean(ValidationOrchestrator.class).getDefaultOptions())
                        .isSameAs(custom));
    }

    @Test
    void autoConfiguration_disabled_shouldNotRegisterBeans() {
        contextRunner
                .withPropertyValues("firefly.grid.validation.enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(ValidationOrchestrator.class);
                    assertThat(context).doesNotHaveBean(PerformanceSink.class);
                });
    }

    @Test
    void autoConfiguration_withMeterRegistry_shouldUseMicrometerSink() {
        contextRunner
                .withBean(MeterRegistry.class, SimpleMeterRegistry::new)
                .run(context -> assertThat(context.getBean(PerformanceSink.class))
                        .isInstanceOf(MicrometerPerformanceSink.class));
    }

    @Test
    void autoConfiguration_userSink_shouldBackOff() {
        PerformanceSink custom = PerformanceSink.noop();
        contextRunner
                .withBean(PerformanceSink.class, () -> custom)
                .run(context -> {
                    assertThat(context).hasSingleBean(PerformanceSink.class);
                    assertThat(context.getBean(PerformanceSink.class)).isSameAs(custom);
                });
    }
}
