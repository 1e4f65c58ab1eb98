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

/**
 * Result of running a single rule against a single target within one validation pass.
 *
 * <p>Timeouts and faults are escalated to at least {@link ValidationSeverity#ERROR};
 * a declared {@link ValidationSeverity#CRITICAL} is kept. Plain failures keep the
 * declared severity.</p>
 */
@Value
@Builder
public class RuleOutcome {

    OutcomeKind kind;
    ValidationSeverity severity;
    String message;

    /**
     * Infrastructure detail for timeouts and faults, {@code null} otherwise.
     */
    String detail;

    Throwable cause;

    @Builder.Default
    Duration elapsed = Duration.ZERO;

    public static RuleOutcome passed(Duration elapsed) {
        return RuleOutcome.builder()
                .kind(OutcomeKind.PASSED)
                .severity(ValidationSeverity.INFO)
                .elapsed(elapsed)
                .build();
    }

    /**
     * Creates a failed outcome with the descriptor's severity.
     *
     * @param descriptor the rule that failed
     * @param message    a message specific to this evaluation, or {@code null} to use
     *                   the descriptor's message
     * @param elapsed    time spent in the check
     * @return a failed {@link RuleOutcome}
     */
    public static RuleOutcome failed(RuleDescriptor descriptor, String message, Duration elapsed) {
        return RuleOutcome.builder()
                .kind(OutcomeKind.FAILED)
                .severity(descriptor.getSeverity())
                .message(message != null ? message : descriptor.getMessage())
                .elapsed(elapsed)
                .build();
    }

    public static RuleOutcome timedOut(RuleDescriptor descriptor, Duration budget, Duration elapsed) {
        return RuleOutcome.builder()
                .kind(OutcomeKind.TIMED_OUT)
                .severity(escalate(descriptor.getSeverity()))
                .message(descriptor.getMessage())
                .detail("Validation did not complete within " + budget.toMillis() + "ms")
                .elapsed(elapsed)
                .build();
    }

    public static RuleOutcome faulted(RuleDescriptor descriptor, Throwable cause, Duration elapsed) {
        return RuleOutcome.builder()
                .kind(OutcomeKind.FAULTED)
                .severity(escalate(descriptor.getSeverity()))
                .message(descriptor.getMessage())
                .detail("Validation error: " + cause)
                .cause(cause)
                .elapsed(elapsed)
                .build();
    }

    public static RuleOutcome cancelled(Duration elapsed) {
        return RuleOutcome.builder()
                .kind(OutcomeKind.CANCELLED)
                .severity(ValidationSeverity.INFO)
                .elapsed(elapsed)
                .build();
    }

    /**
     * Severity applied to infrastructure failures: never lower than
     * {@link ValidationSeverity#ERROR} and never lower than declared.
     *
     * @param declared the rule's declared severity
     * @return the escalated severity
     */
    public static ValidationSeverity escalate(ValidationSeverity declared) {
        return ValidationSeverity.max(declared, ValidationSeverity.ERROR);
    }
}
