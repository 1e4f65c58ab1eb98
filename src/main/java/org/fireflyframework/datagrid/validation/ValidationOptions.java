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

package org.fireflyframework.datagrid.validation;

import lombok.Builder;
import lombok.Value;

/**
 * Per-call options for a validation pass.
 */
@Value
@Builder(toBuilder = true)
public class ValidationOptions {

    private static final ValidationOptions DEFAULTS = ValidationOptions.builder().build();

    @Builder.Default
    ExecutionMode mode = ExecutionMode.RUN_ALL;

    /**
     * Whether independent rule lanes run concurrently in {@link ExecutionMode#RUN_ALL}.
     */
    @Builder.Default
    boolean parallel = true;

    /**
     * Upper bound on lanes (or rows, for batch validation) in flight at once.
     */
    @Builder.Default
    int maxConcurrency = 8;

    /**
     * Rows per batch for {@link ValidationOrchestrator#validateRows}.
     */
    @Builder.Default
    int batchSize = 500;

    /**
     * Minimum severity that makes a verdict invalid.
     */
    @Builder.Default
    ValidationSeverity failOn = ValidationSeverity.ERROR;

    @Builder.Default
    CancellationPolicy cancellationPolicy = CancellationPolicy.RETURN_CANCELLED_VERDICT;

    @Builder.Default
    ValidationTrigger trigger = ValidationTrigger.MANUAL;

    public static ValidationOptions defaults() {
        return DEFAULTS;
    }
}
