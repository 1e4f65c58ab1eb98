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

package org.fireflyframework.datagrid.performance;

import org.fireflyframework.datagrid.validation.OutcomeKind;

import java.time.Duration;

/**
 * Receives timing samples from the validation engine.
 *
 * <p>Implementations are called on the validation path, possibly from several threads
 * at once. They must be thread-safe, must return quickly, and should not throw; the
 * engine logs and discards any exception they raise.</p>
 */
public interface PerformanceSink {

    /**
     * Records one timing sample.
     *
     * @param ruleName the rule name, or a positional label for anonymous rules
     * @param elapsed  time spent
     * @param kind     the outcome of the timed execution
     */
    void report(String ruleName, Duration elapsed, OutcomeKind kind);

    /**
     * Returns a sink that discards every sample.
     *
     * @return the no-op sink
     */
    static PerformanceSink noop() {
        return (ruleName, elapsed, kind) -> { };
    }
}
