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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.datagrid.performance.PerformanceSink;
import org.fireflyframework.datagrid.validation.CancellationToken;
import org.fireflyframework.datagrid.validation.CheckResult;
import org.fireflyframework.datagrid.validation.RuleDescriptor;
import org.fireflyframework.datagrid.validation.RuleOutcome;
import org.fireflyframework.datagrid.validation.ValidationRule;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;

/**
 * Runs a single planned rule against a target within the rule's effective timeout.
 *
 * <p>Every execution yields exactly one {@link RuleOutcome}; errors raised by a check
 * never propagate past this class. When the budget expires the check's subscription is
 * cancelled and its linked {@link CancellationToken} is signalled. A check that ignores
 * both keeps running in the background, but its result is discarded.</p>
 *
 * <p>Blocking checks are subscribed on a worker scheduler so the timeout gate does not
 * depend on the check returning control.</p>
 */
@Slf4j
public class RuleExecutor {

    private final Duration defaultTimeout;
    private final PerformanceSink performanceSink;
    private final Scheduler blockingScheduler;

    /**
     * Creates an executor that runs blocking checks on {@link Schedulers#boundedElastic()}.
     *
     * @param defaultTimeout  budget for rules that do not declare one
     * @param performanceSink the sink receiving one timing sample per executed rule
     */
    public RuleExecutor(Duration defaultTimeout, PerformanceSink performanceSink) {
        this(defaultTimeout, performanceSink, Schedulers.boundedElastic());
    }

    /**
     * Creates an executor.
     *
     * @param defaultTimeout    budget for rules that do not declare one
     * @param performanceSink   the sink receiving one timing sample per executed rule
     * @param blockingScheduler the scheduler blocking checks are subscribed on
     */
    public RuleExecutor(Duration defaultTimeout, PerformanceSink performanceSink, Scheduler blockingScheduler) {
        this.defaultTimeout = defaultTimeout;
        this.performanceSink = performanceSink;
        this.blockingScheduler = blockingScheduler;
    }

    /**
     * Executes the given rule.
     *
     * <p>If cancellation has already been requested when the returned {@link Mono} is
     * subscribed, the check is not started and the outcome is
     * {@link org.fireflyframework.datagrid.validation.OutcomeKind#CANCELLED}.</p>
     *
     * @param planned      the rule to run
     * @param target       the value passed through to the check
     * @param cancellation the caller's cancellation token
     * @param <T>          the type of target
     * @return a {@link Mono} emitting the executed rule; never errors
     */
    public <T> Mono<ExecutedRule<T>> execute(PlannedRule<T> planned, T target, CancellationToken cancellation) {
        return Mono.defer(() -> {
            if (cancellation.isCancellationRequested()) {
                log.debug("Skipping rule '{}': validation already cancelled", planned.getDisplayName());
                return Mono.just(new ExecutedRule<>(planned, RuleOutcome.cancelled(Duration.ZERO)));
            }

            RuleDescriptor descriptor = planned.getDescriptor();
            Duration budget = descriptor.effectiveTimeout(defaultTimeout);
            CancellationToken ruleToken = cancellation.createLinked();
            long startNanos = System.nanoTime();

            return runCheck(planned.getRule(), target, ruleToken)
                    .timeout(budget, Mono.error(BudgetExceededException::new))
                    .map(result -> toOutcome(descriptor, result, elapsedSince(startNanos)))
                    .takeUntilOther(cancellation.whenCancelled())
                    .switchIfEmpty(Mono.fromSupplier(() -> emptyOutcome(planned, cancellation, startNanos)))
                    .onErrorResume(BudgetExceededException.class, ex -> {
                        ruleToken.cancel();
                        log.warn("Rule '{}' timed out after {}ms", planned.getDisplayName(), budget.toMillis());
                        return Mono.just(RuleOutcome.timedOut(descriptor, budget, elapsedSince(startNanos)));
                    })
                    .onErrorResume(ex -> Mono.just(errorOutcome(planned, cancellation, ex, startNanos)))
                    .doFinally(signal -> ruleToken.release())
                    .map(outcome -> {
                        report(planned, outcome);
                        return new ExecutedRule<>(planned, outcome);
                    });
        });
    }

    private <T> Mono<CheckResult> runCheck(ValidationRule<T> rule, T target, CancellationToken ruleToken) {
        Mono<CheckResult> check = Mono.defer(() -> rule.check(target, ruleToken));
        return rule.isBlocking() ? check.subscribeOn(blockingScheduler) : check;
    }

    private RuleOutcome toOutcome(RuleDescriptor descriptor, CheckResult result, Duration elapsed) {
        if (result.isPassed()) {
            return RuleOutcome.passed(elapsed);
        }
        return RuleOutcome.failed(descriptor, result.getMessage(), elapsed);
    }

    private RuleOutcome emptyOutcome(PlannedRule<?> planned, CancellationToken cancellation, long startNanos) {
        if (cancellation.isCancellationRequested()) {
            log.debug("Rule '{}' aborted by cancellation", planned.getDisplayName());
            return RuleOutcome.cancelled(elapsedSince(startNanos));
        }
        log.warn("Rule '{}' completed without a result", planned.getDisplayName());
        return RuleOutcome.faulted(planned.getDescriptor(),
                new IllegalStateException("Check completed without a result"), elapsedSince(startNanos));
    }

    private RuleOutcome errorOutcome(PlannedRule<?> planned, CancellationToken cancellation, Throwable error,
                                     long startNanos) {
        if (cancellation.isCancellationRequested()) {
            log.debug("Rule '{}' unwound after cancellation: {}", planned.getDisplayName(), error.toString());
            return RuleOutcome.cancelled(elapsedSince(startNanos));
        }
        log.warn("Rule '{}' faulted: {}", planned.getDisplayName(), error.toString(), error);
        return RuleOutcome.faulted(planned.getDescriptor(), error, elapsedSince(startNanos));
    }

    private void report(PlannedRule<?> planned, RuleOutcome outcome) {
        try {
            performanceSink.report(planned.getDisplayName(), outcome.getElapsed(), outcome.getKind());
        } catch (RuntimeException ex) {
            log.warn("Performance sink rejected sample for rule '{}': {}", planned.getDisplayName(), ex.toString());
        }
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    /**
     * Raised only by this executor's own timeout gate, so a check that itself fails with a
     * {@link java.util.concurrent.TimeoutException} is reported as faulted.
     */
    private static final class BudgetExceededException extends RuntimeException {

        private static final long serialVersionUID = 1L;

        BudgetExceededException() {
            super("Rule budget exceeded", null, false, false);
        }
    }
}
