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

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Aggregated result of one validation pass, produced by the
 * {@link ValidationOrchestrator}.
 *
 * <p>Failures are ordered by severity (most severe first), then priority (absent
 * last), then declaration order. The ordering is stable across repeated runs on the
 * same input.</p>
 */
@Value
@Builder(toBuilder = true)
public class ValidationVerdict {

    boolean valid;
    boolean cancelled;
    ValidationSeverity overallSeverity;
    ValidationSeverity failOn;
    int evaluatedRules;
    List<ValidationFailure> failures;

    @Builder.Default
    Duration elapsed = Duration.ZERO;

    Instant timestamp;

    /**
     * Returns the most severe failure severity, or empty when there are no failures.
     *
     * @return the overall severity
     */
    public Optional<ValidationSeverity> getOverallSeverity() {
        return Optional.ofNullable(overallSeverity);
    }

    /**
     * Returns failures with the given effective severity.
     *
     * @param severity the severity to filter by
     * @return matching failures in verdict order
     */
    public List<ValidationFailure> getBySeverity(ValidationSeverity severity) {
        return failures.stream()
                .filter(failure -> failure.getSeverity() == severity)
                .toList();
    }

    /**
     * Returns failures of the given kind.
     *
     * @param kind the outcome kind to filter by
     * @return matching failures in verdict order
     */
    public List<ValidationFailure> getByKind(OutcomeKind kind) {
        return failures.stream()
                .filter(failure -> failure.getKind() == kind)
                .toList();
    }

    /**
     * Returns whether any failure was caused by a timeout or fault rather than by
     * invalid data.
     */
    public boolean hasInfrastructureFailures() {
        return failures.stream().anyMatch(ValidationFailure::isInfrastructureFailure);
    }
}
