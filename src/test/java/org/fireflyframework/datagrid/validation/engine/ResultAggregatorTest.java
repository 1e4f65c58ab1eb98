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
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.fireflyframework.datagrid.validation.RuleFixtures.descriptor;

/**
 * Unit tests for {@link ResultAggregator}.
 */
class ResultAggregatorTest {

    private final ResultAggregator aggregator = new ResultAggregator();

    @Test
    void aggregate_allPassed_shouldBeValidWithoutFailures() {
        // Given
        List<ExecutedRule<Object>> executed = List.of(
                passed(descriptor("a", ValidationSeverity.CRITICAL).build(), 0),
                passed(descriptor("b", ValidationSeverity.ERROR).build(), 1));

        // When
        ValidationVerdict verdict = aggregator.aggregate(executed);

        // Then
        assertThat(verdict.isValid()).isTrue();
        assertThat(verdict.isCancelled()).isFalse();
        assertThat(verdict.getFailures()).isEmpty();
        assertThat(verdict.getOverallSeverity()).isEmpty();
        assertThat(verdict.getEvaluatedRules()).isEqualTo(2);
    }

    @Test
    void aggregate_failureAtThreshold_shouldBeInvalid() {
        // Given
        List<ExecutedRule<Object>> executed = List.of(
                failed(descriptor("warn", ValidationSeverity.WARNING).build(), 0),
                failed(descriptor("err", ValidationSeverity.ERROR).build(), 1));

        // When
        ValidationVerdict verdict = aggregator.aggregate(executed);

        // Then
        assertThat(verdict.isValid()).isFalse();
        assertThat(verdict.getOverallSeverity()).contains(ValidationSeverity.ERROR);
        assertThat(verdict.getFailures()).hasSize(2);
    }

    @Test
    void aggregate_onlyWarnings_shouldStayValidButReportSeverity() {
        // Given
        List<ExecutedRule<Object>> executed = List.of(
                failed(descriptor("warn", ValidationSeverity.WARNING).build(), 0),
                passed(descriptor("ok", ValidationSeverity.ERROR).build(), 1));

        // When
        ValidationVerdict verdict = aggregator.aggregate(executed);

        // Then
        assertThat(verdict.isValid()).isTrue();
        assertThat(verdict.getOverallSeverity()).contains(ValidationSeverity.WARNING);
        assertThat(verdict.getBySeverity(ValidationSeverity.WARNING)).hasSize(1);
    }

    @Test
    void aggregate_loweredThreshold_shouldTreatWarningsAsBlocking() {
        // Given
        List<ExecutedRule<Object>> executed = List.of(
                failed(descriptor("warn", ValidationSeverity.WARNING).build(), 0));

        // When
        ValidationVerdict verdict = aggregator.aggregate(executed, ValidationSeverity.WARNING, false);

        // Then
        assertThat(verdict.isValid()).isFalse();
        assertThat(verdict.getFailOn()).isEqualTo(ValidationSeverity.WARNING);
    }

    @Test
    void aggregate_duplicateNames_shouldKeepOnlyTheFailingEntry() {
        // Given
        List<ExecutedRule<Object>> executed = List.of(
                passed(descriptor("Required", ValidationSeverity.ERROR).build(), 0),
                failed(descriptor("Required", ValidationSeverity.ERROR).build(), 1));

        // When
        ValidationVerdict verdict = aggregator.aggregate(executed);

        // Then
        assertThat(verdict.getFailures()).hasSize(1);
        assertThat(verdict.getFailures().get(0).getDeclarationIndex()).isEqualTo(1);
    }

    @Test
    void aggregate_mixedFailures_shouldOrderBySeverityThenPriorityThenDeclaration() {
        // Given
        List<ExecutedRule<Object>> executed = List.of(
                failed(descriptor("warn", ValidationSeverity.WARNING).priority(1).build(), 0),
                failed(descriptor("err-late", ValidationSeverity.ERROR).build(), 1),
                failed(descriptor("err-p2", ValidationSeverity.ERROR).priority(2).build(), 2),
                failed(descriptor("crit", ValidationSeverity.CRITICAL).build(), 3),
                failed(descriptor("err-tie", ValidationSeverity.ERROR).build(), 4));

        // When
        ValidationVerdict verdict = aggregator.aggregate(executed);

        // Then
        assertThat(verdict.getFailures())
                .extracting(ValidationFailure::getRuleName)
                .containsExactly("crit", "err-p2", "err-late", "err-tie", "warn");
        assertThat(verdict.getOverallSeverity()).contains(ValidationSeverity.CRITICAL);
    }

    @Test
    void aggregate_timeoutOfWarningRule_shouldBeEscalatedAndMarkedAsInfrastructure() {
        // Given
        RuleDescriptor slow = descriptor("slow", ValidationSeverity.WARNING).build();
        ExecutedRule<Object> timedOut = executed(slow, 0,
                RuleOutcome.timedOut(slow, Duration.ofMillis(10), Duration.ofMillis(11)));

        // When
        ValidationVerdict verdict = aggregator.aggregate(List.of(timedOut));

        // Then
        assertThat(verdict.isValid()).isFalse();
        assertThat(verdict.hasInfrastructureFailures()).isTrue();
        ValidationFailure failure = verdict.getFailures().get(0);
        assertThat(failure.getKind()).isEqualTo(OutcomeKind.TIMED_OUT);
        assertThat(failure.getSeverity()).isEqualTo(ValidationSeverity.ERROR);
        assertThat(failure.getDeclaredSeverity()).isEqualTo(ValidationSeverity.WARNING);
        assertThat(failure.getDetail()).isEqualTo("Validation did not complete within 10ms");
    }

    @Test
    void aggregate_cancelledPass_shouldNeverBeValid() {
        // Given
        RuleDescriptor first = descriptor("first", ValidationSeverity.ERROR).build();
        RuleDescriptor second = descriptor("second", ValidationSeverity.ERROR).build();
        List<ExecutedRule<Object>> executed = List.of(
                passed(first, 0),
                executed(second, 1, RuleOutcome.cancelled(Duration.ZERO)));

        // When
        ValidationVerdict verdict = aggregator.aggregate(executed, ValidationSeverity.ERROR, true);

        // Then
        assertThat(verdict.isCancelled()).isTrue();
        assertThat(verdict.isValid()).isFalse();
        assertThat(verdict.getFailures()).isEmpty();
        assertThat(verdict.getEvaluatedRules()).isEqualTo(1);
    }

    private static ExecutedRule<Object> passed(RuleDescriptor descriptor, int index) {
        return executed(descriptor, index, RuleOutcome.passed(Duration.ofMillis(1)));
    }

    private static ExecutedRule<Object> failed(RuleDescriptor descriptor, int index) {
        return executed(descriptor, index, RuleOutcome.failed(descriptor, null, Duration.ofMillis(1)));
    }

    private static ExecutedRule<Object> executed(RuleDescriptor descriptor, int index, RuleOutcome outcome) {
        PlannedRule<Object> planned = PlannedRule.<Object>builder()
                .descriptor(descriptor)
                .declarationIndex(index)
                .planIndex(index)
                .build();
        return new ExecutedRule<>(planned, outcome);
    }
}
