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

package org.fireflyframework.datagrid.validation.engine;

import org.fireflyframework.datagrid.validation.OutcomeKind;
import org.fireflyframework.datagrid.validation.RuleDescriptor;
import org.fireflyframework.datagrid.validation.RuleOutcome;
import org.fireflyframework.datagrid.validation.ValidationFailure;
import org.fireflyframework.datagrid.validation.ValidationSeverity;
import org.fireflyframework.datagrid.validation.ValidationVerdict;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Folds per-rule outcomes into a single {@link ValidationVerdict}.
 *
 * <p>Passed and cancelled outcomes are dropped. Every other outcome becomes its own
 * {@link ValidationFailure}; rules sharing a name are never merged. The aggregator holds
 * no state and is safe to share.</p>
 */
public class ResultAggregator {

    static final Comparator<ValidationFailure> FAILURE_ORDER = Comparator
            .comparing(ValidationFailure::getSeverity, Comparator.reverseOrder())
            .thenComparing(ValidationFailure::getPriority, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparingInt(ValidationFailure::getDeclarationIndex);

    /**
     * Aggregates outcomes with the default {@link ValidationSeverity#ERROR} threshold.
     *
     * @param executed the executed rules of one pass
     * @return the verdict
     */
    public ValidationVerdict aggregate(List<? extends ExecutedRule<?>> executed) {
        return aggregate(executed, ValidationSeverity.ERROR, false);
    }

    /**
     * Aggregates outcomes into a verdict.
     *
     * @param executed  the executed rules of one pass, in any order
     * @param failOn    minimum severity that makes the verdict invalid
     * @param cancelled whether the pass was cut short by the caller; a cancelled verdict
     *                  is never valid
     * @return the verdict
     */
    public ValidationVerdict aggregate(List<? extends ExecutedRule<?>> executed, ValidationSeverity failOn,
                                       boolean cancelled) {
        List<ValidationFailure> failures = executed.stream()
                .filter(rule -> rule.getOutcome().getKind().isFailure())
                .map(this::toFailure)
                .sorted(FAILURE_ORDER)
                .toList();

        ValidationSeverity overallSeverity = failures.stream()
                .map(ValidationFailure::getSeverity)
                .max(Comparator.naturalOrder())
                .orElse(null);

        boolean blocking = failures.stream()
                .anyMatch(failure -> failure.getSeverity().isAtLeast(failOn));

        int evaluated = (int) executed.stream()
                .filter(rule -> rule.getOutcome().getKind() != OutcomeKind.CANCELLED)
                .count();

        return ValidationVerdict.builder()
                .valid(!cancelled && !blocking)
                .cancelled(cancelled)
                .overallSeverity(overallSeverity)
                .failOn(failOn)
                .evaluatedRules(evaluated)
                .failures(failures)
                .timestamp(Instant.now())
                .build();
    }

    private ValidationFailure toFailure(ExecutedRule<?> executed) {
        PlannedRule<?> planned = executed.getPlanned();
        RuleDescriptor descriptor = planned.getDescriptor();
        RuleOutcome outcome = executed.getOutcome();
        return ValidationFailure.builder()
                .ruleName(descriptor.getName())
                .message(outcome.getMessage())
                .kind(outcome.getKind())
                .severity(outcome.getSeverity())
                .declaredSeverity(descriptor.getSeverity())
                .priority(descriptor.getPriority())
                .declarationIndex(planned.getDeclarationIndex())
                .detail(outcome.getDetail())
                .build();
    }
}
