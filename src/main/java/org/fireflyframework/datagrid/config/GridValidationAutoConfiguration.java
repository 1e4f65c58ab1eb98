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
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.datagrid.performance.InMemoryPerformanceSink;
import org.fireflyframework.datagrid.performance.MicrometerPerformanceSink;
import org.fireflyframework.datagrid.performance.PerformanceSink;
import org.fireflyframework.datagrid.validation.ValidationOptions;
import org.fireflyframework.datagrid.validation.ValidationOrchestrator;
import org.fireflyframework.datagrid.validation.debounce.DebouncedValidatorFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Auto-configuration for the grid validation engine.
 *
 * <p>This configuration automatically sets up:</p>
 * <ul>
 *   <li>A {@link PerformanceSink}: Micrometer-backed when a {@link MeterRegistry} bean is
 *       present, in-memory otherwise</li>
 *   <li>The default {@link ValidationOptions} built from {@link GridValidationProperties}</li>
 *   <li>{@link ValidationOrchestrator}, applying those options to calls that pass none
 *       and publishing completion events when an {@link ApplicationEventPublisher} is
 *       available</li>
 *   <li>{@link DebouncedValidatorFactory} using the configured debounce delay</li>
 * </ul>
 *
 * <p>The configuration is active unless {@code firefly.grid.validation.enabled} is set
 * to {@code false}. Every bean backs off when the application defines its own.</p>
 */
@Slf4j
@AutoConfiguration(afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@EnableConfigurationProperties(GridValidationProperties.class)
@ConditionalOnProperty(
    prefix = "firefly.grid.validation",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true
)
public class GridValidationAutoConfiguration {

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(name = "io.micrometer.core.instrument.MeterRegistry")
    @ConditionalOnBean(MeterRegistry.class)
    static class MicrometerSinkConfiguration {

        @Bean
        @ConditionalOnMissingBean(PerformanceSink.class)
        public PerformanceSink micrometerPerformanceSink(MeterRegistry meterRegistry) {
            log.info("Reporting grid validation timings to Micrometer");
            return new MicrometerPerformanceSink(meterRegistry);
        }
    }

    @Bean
    @ConditionalOnMissingBean(PerformanceSink.class)
    public PerformanceSink inMemoryPerformanceSink() {
        return new InMemoryPerformanceSink();
    }

    @Bean
    @ConditionalOnMissingBean
    public ValidationOptions gridValidationOptions(GridValidationProperties properties) {
        return properties.toOptions();
    }

    /**
     * Creates the validation orchestrator bean.
     *
     * @param properties      the bound properties
     * @param options         the options used by calls that pass none
     * @param performanceSink the sink receiving timing samples
     * @param eventPublisher  the event publisher, or {@code null} if unavailable
     * @return the configured orchestrator
     */
    @Bean
    @ConditionalOnMissingBean
    public ValidationOrchestrator validationOrchestrator(
            GridValidationProperties properties,
            ValidationOptions options,
            PerformanceSink performanceSink,
            @Autowired(required = false) ApplicationEventPublisher eventPublisher) {
        log.info("Configuring grid validation engine: defaultTimeout={}, mode={}, parallel={}, failOn={}",
                properties.getDefaultTimeout(), options.getMode(), options.isParallel(), options.getFailOn());
        return new ValidationOrchestrator(properties.getDefaultTimeout(), performanceSink, eventPublisher, options);
    }

    @Bean
    @ConditionalOnMissingBean
    public DebouncedValidatorFactory debouncedValidatorFactory(ValidationOrchestrator orchestrator,
                                                               ValidationOptions options,
                                                               GridValidationProperties properties) {
        return new DebouncedValidatorFactory(orchestrator, options, properties.getDebounceDelay());
    }
}
