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

package org.fireflyframework.datagrid.validation.debounce;

import org.fireflyframework.datagrid.validation.ValidationOptions;
import org.fireflyframework.datagrid.validation.ValidationOrchestrator;
import org.fireflyframework.datagrid.validation.ValidationRule;

import java.time.Duration;
import java.util.List;

/**
 * Creates {@link DebouncedValidator} instances sharing one orchestrator, one set of
 * options and one quiet period. Typically one validator is created per edited cell or
 * row.
 */
public class DebouncedValidatorFactory {

    private final ValidationOrchestrator orchestrator;
    private final ValidationOptions options;
    private final Duration delay;

    public DebouncedValidatorFactory(ValidationOrchestrator orchestrator, ValidationOptions options, Duration delay) {
        this.orchestrator = orchestrator;
        this.options = options;
        this.delay = delay;
    }

    public <T> DebouncedValidator<T> create(List<? extends ValidationRule<T>> rules) {
        return new DebouncedValidator<>(orchestrator, rules, options, delay);
    }

    public Duration getDelay() {
        return delay;
    }
}
