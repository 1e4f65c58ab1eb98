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

import lombok.Data;
import org.fireflyframework.datagrid.validation.CancellationPolicy;
import org.fireflyframework.datagrid.validation.ExecutionMode;
import org.fireflyframework.datagrid.validation.ValidationOptions;
import org.fireflyframework.datagrid.validation.ValidationSeverity;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the grid validation engine.
 *
 * <p><b>Example Configuration:</b></p>
 * <pre>{@code
 * firefly:
 *   grid:
 *     validation:
 *       default-timeout: 2s
 *       fail-on: ERROR
 *       mode: RUN_ALL
 *       parallel: true
 *       max-concurrency: 8
 *       batch-size: 500
 *       debounce-delay: 500ms
 *       cancellation-policy: RETURN_CANCELLED_VERDICT
 * }</pre>
 */
@Data
@ConfigurationProperties(prefix = "firefly.grid.validation")
public class GridValidationProperties {

    /**
     * Whether the validation engine is auto-configured.
     */
    private boolean enabled = true;

    /**
     * Timeout applied to rules that do not declare their own.
     */
    private Duration defaultTimeout = Duration.ofSeconds(2);

    /**
     * Minimum severity that makes a verdict invalid.
     */
    private ValidationSeverity failOn = ValidationSeverity.ERROR;

    private ExecutionMode mode = ExecutionMode.RUN_ALL;

    /**
     * Whether independent rules may run concurrently.
     */
    private boolean parallel = true;

    private int maxConcurrency = 8;

    /**
     * Rows per batch for dataset validation.
     */
    private int batchSize = 500;

    /**
     * Quiet period used by debounced validators.
     */
    private Duration debounceDelay = Duration.ofMillis(500);

    private CancellationPolicy cancellationPolicy = CancellationPolicy.RETURN_CANCELLED_VERDICT;

    /**
     * Builds the default {@link ValidationOptions} from these properties.
     *
     * @return the options
     */
    public ValidationOptions toOptions() {
        return ValidationOptions.builder()
                .failOn(failOn)
                .mode(mode)
                .parallel(parallel)
                .maxConcurrency(maxConcurrency)
                .batchSize(batchSize)
                .cancellationPolicy(cancellationPolicy)
                .build();
    }
}
