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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.datagrid.event.ValidationCompletedEvent;
import org.fireflyframework.datagrid.performance.PerformanceSink;
import org.fireflyframework.datagrid.validation.batch.BatchValidationResult;
import org.fireflyframework.datagrid.validation.batch.ValidationProgress;
import org.fireflyframework.datagrid.validation.engine.ExecutedRule;
import org.fireflyframework.datagrid.validation.engine.ExecutionPlan;
import org.fireflyframework.datagrid.validation.engine.PlannedRule;
import org.fireflyframework.datagrid.validation.engine.ResultAggregator;
import org.fireflyframework.datagrid.validation.engine.RuleExecutor;
import org.fireflyframework.datagrid.validation.engine.RuleScheduler;
import org.springframework.context.ApplicationEventPublisher;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * Public entry point of the grid validation engine.
 *
 * <p>A validation pass plans the rule set with the {@link RuleScheduler}, runs each rule
 * through the {@link RuleExecutor}, re-orders the outcomes into plan order and folds them
 * into a {@link ValidationVerdict} with the {@link ResultAggregator}.</p>
 *
 * <p>Two execution modes are supported via {@link ExecutionMode}:</p>
 * <ul>
 *   <li>{@link ExecutionMode#RUN_ALL} - every rule runs; independent lanes run
 *       concurrently when {@link ValidationOptions#isParallel()} is set</li>
 *   <li>{@link ExecutionMode#STOP_ON_FIRST_ERROR} - rules run one at a time in plan order
 *       and the pass stops after the first ERROR or CRITICAL outcome</li>
 * </ul>
 *
 * <p>Rule-level problems (failures, timeouts, faults) are always reported in the verdict.
 * Only malformed input raises {@link ValidationConfigurationException}.</p>
 *
 * <p>When an {@link ApplicationEventPublisher} is provided, a
 * {@link ValidationCompletedEvent} is published after each single-target pass.</p>
 */
@Slf4j
public class ValidationOrchestrator {

    /**
     * Name under which pass-level timing samples are reported.
     */
    public static final String PASS_SAMPLE_NAME = "validation-pass";

    private final Duration defaultTimeout;
    private final RuleScheduler scheduler;
    private final RuleExecutor executor;
    private final ResultAggregator aggregator;
    private final PerformanceSink performanceSink;
    private final ApplicationEventPublisher eventPublisher;
    private final ValidationOptions defaultOptions;

    /**
     * Creates an orchestrator without timing samples or event publishing.
     *
     * @param defaultTimeout budget for rules that do not declare one
     */
    public ValidationOrchestrator(Duration defaultTimeout) {
        this(defaultTimeout, PerformanceSink.noop(), null);
    }

    /**
     * Creates an orchestrator.
     *
     * @param defaultTimeout  budget for rules that do not declare one
     * @param performanceSink the sink receiving timing samples
     * @param eventPublisher  the event publisher, or {@code null} to disable event publishing
     */
    public ValidationOrchestrator(Duration defaultTimeout, PerformanceSink performanceSink,
                                  ApplicationEventPublisher eventPublisher) {
        this(defaultTimeout, performanceSink, eventPublisher, ValidationOptions.defaults());
    }

    /**
     * Creates an orchestrator whose overloads without explicit options use the given ones.
     *
     * @param defaultTimeout  budget for rules that do not declare one
     * @param performanceSink the sink receiving timing samples
     * @param eventPublisher  the event publisher, or {@code null} to disable event publishing
     * @param defaultOptions  options applied when a caller passes none; {@code null} means
     *                        {@link ValidationOptions#defaults()}
     */
    public ValidationOrchestrator(Duration defaultTimeout, PerformanceSink performanceSink,
                                  ApplicationEventPublisher eventPublisher, ValidationOptions defaultOptions) {
        this(defaultTimeout, performanceSink, eventPublisher, defaultOptions, Schedulers.boundedElastic());
    }

    /**
     * Creates an orchestrator with a dedicated scheduler for blocking checks.
     *
     * @param defaultTimeout    budget for rules that do not declare one; must be positive
     * @param performanceSink   the sink receiving timing samples
     * @param eventPublisher    the event publisher, or {@code null} to disable event publishing
     * @param blockingScheduler the scheduler blocking checks are subscribed on
     */
    public ValidationOrchestrator(Duration defaultTimeout, PerformanceSink performanceSink,
                                  ApplicationEventPublisher eventPublisher, Scheduler blockingScheduler) {
        this(defaultTimeout, performanceSink, eventPublisher, ValidationOptions.defaults(), blockingScheduler);
    }

    /**
     * Creates an orchestrator with default options and a dedicated scheduler for blocking checks.
     *
     * @param defaultTimeout    budget for rules that do not declare one; must be positive
     * @param performanceSink   the sink receiving timing samples
     * @param eventPublisher    the event publisher, or {@code null} to disable event publishing
     * @param defaultOptions    options applied when a caller passes none; {@code null} means
     *                          {@link ValidationOptions#defaults()}
     * @param blockingScheduler the scheduler blocking checks are subscribed on
     */
    public ValidationOrchestrator(Duration defaultTimeout, PerformanceSink performanceSink,
                                  ApplicationEventPublisher eventPublisher, ValidationOptions defaultOptions,
                                  Scheduler blockingScheduler) {
        if (defaultTimeout == null || defaultTimeout.isZero() || defaultTimeout.isNegative()) {
            throw new ValidationConfigurationException("Default rule timeout must be positive, got " + defaultTimeout);
        }
        this.defaultTimeout = defaultTimeout;
        this.performanceSink = performanceSink != null ? performanceSink : PerformanceSink.noop();
        this.eventPublisher = eventPublisher;
        this.defaultOptions = defaultOptions != null ? defaultOptions : ValidationOptions.defaults();
        this.scheduler = new RuleScheduler();
        this.executor = new RuleExecutor(defaultTimeout, this.performanceSink, blockingScheduler);
        this.aggregator = new ResultAggregator();
    }

    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }

    public ValidationOptions getDefaultOptions() {
        return defaultOptions;
    }

    public <T> Mono<ValidationVerdict> validateAsync(T target, List<? extends ValidationRule<T>> rules) {
        return validateAsync(target, rules, defaultOptions, CancellationToken.none());
    }

    public <T> Mono<ValidationVerdict> validateAsync(T target, List<? extends ValidationRule<T>> rules,
                                                     ValidationOptions options) {
        return validateAsync(target, rules, options, CancellationToken.none());
    }

    /**
     * Validates a target against a rule set without blocking the calling thread.
     *
     * @param target       the cell value, row or dataset; passed through to every check
     * @param rules        the active rule set, in declaration order; may be empty
     * @param options      execution options
     * @param cancellation the caller's cancellation token
     * @param <T>          the type of target
     * @return a {@link Mono} emitting the verdict, or erroring with
     *         {@link ValidationConfigurationException} on malformed input and with
     *         {@link ValidationCancelledException} when cancelled under
     *         {@link CancellationPolicy#FAIL_WITH_ERROR}
     */
    public <T> Mono<ValidationVerdict> validateAsync(T target, List<? extends ValidationRule<T>> rules,
                                                     ValidationOptions options, CancellationToken cancellation) {
        return Mono.defer(() -> {
            checkArguments(options, cancellation);
            ExecutionPlan<T> plan = scheduler.plan(rules);
            long startNanos = System.nanoTime();

            return runPass(plan, target, options, cancellation)
                    .map(verdict -> verdict.toBuilder().elapsed(elapsedSince(startNanos)).build())
                    .doOnNext(verdict -> {
                        log.debug("Validated {} of {} rules in {}ms: valid={}, failures={}, cancelled={}",
                                verdict.getEvaluatedRules(), plan.size(), verdict.getElapsed().toMillis(),
                                verdict.isValid(), verdict.getFailures().size(), verdict.isCancelled());
                        reportPass(verdict);
                        publishEvent(verdict, options.getTrigger());
                    })
                    .flatMap(verdict -> applyCancellationPolicy(verdict, options));
        });
    }

    public <T> ValidationVerdict validate(T target, List<? extends ValidationRule<T>> rules) {
        return validate(target, rules, defaultOptions, CancellationToken.none());
    }

    public <T> ValidationVerdict validate(T target, List<? extends ValidationRule<T>> rules,
                                          ValidationOptions options) {
        return validate(target, rules, options, CancellationToken.none());
    }

    /**
     * Blocking variant of {@link #validateAsync(Object, List, ValidationOptions, CancellationToken)}.
     * Must not be called from a non-blocking Reactor thread.
     *
     * @throws ValidationConfigurationException on malformed input
     * @throws ValidationCancelledException     when cancelled under {@link CancellationPolicy#FAIL_WITH_ERROR}
     */
    public <T> ValidationVerdict validate(T target, List<? extends ValidationRule<T>> rules,
                                          ValidationOptions options, CancellationToken cancellation) {
        return validateAsync(target, rules, options, cancellation).block();
    }

    /**
     * Validates a dataset row by row.
     *
     * <p>Rows are processed in batches of {@link ValidationOptions#getBatchSize()}; rows
     * inside a batch are validated concurrently up to
     * {@link ValidationOptions#getMaxConcurrency()}. The progress listener is invoked after
     * every batch. Once cancellation is requested no further row starts and the remaining
     * rows are reported as cancelled.</p>
     *
     * @param rows             the rows to validate
     * @param rules            the rule set applied to every row
     * @param options          execution options applied to each row
     * @param progressListener receives progress after each batch, may be {@code null}
     * @param cancellation     the caller's cancellation token
     * @param <T>              the row type
     * @return a {@link Mono} emitting the batch result
     */
    public <T> Mono<BatchValidationResult> validateRows(List<T> rows, List<? extends ValidationRule<T>> rules,
                                                        ValidationOptions options,
                                                        Consumer<ValidationProgress> progressListener,
                                                        CancellationToken cancellation) {
        return Mono.defer(() -> {
            if (rows == null) {
                throw new ValidationConfigurationException("Rows must not be null");
            }
            checkArguments(options, cancellation);
            ExecutionPlan<T> plan = scheduler.plan(rules);
            ValidationOptions rowOptions = options.toBuilder()
                    .cancellationPolicy(CancellationPolicy.RETURN_CANCELLED_VERDICT)
                    .build();

            int totalRows = rows.size();
            AtomicInteger processed = new AtomicInteger();
            AtomicInteger invalid = new AtomicInteger();
            long startNanos = System.nanoTime();
            log.debug("Starting batch validation of {} rows with {} rules", totalRows, plan.size());

            return Flux.range(0, batchCount(totalRows, options.getBatchSize()))
                    .concatMap(batch -> Flux.fromStream(batchIndexes(batch, options.getBatchSize(), totalRows))
                            .flatMapSequential(index -> runPass(plan, rows.get(index), rowOptions, cancellation),
                                    options.getMaxConcurrency())
                            .collectList()
                            .doOnNext(verdicts -> {
                                int invalidInBatch = (int) verdicts.stream()
                                        .filter(verdict -> !verdict.isValid() && !verdict.isCancelled())
                                        .count();
                                ValidationProgress progress = ValidationProgress.builder()
                                        .processedRows(processed.addAndGet(verdicts.size()))
                                        .totalRows(totalRows)
                                        .invalidRows(invalid.addAndGet(invalidInBatch))
                                        .build();
                                log.debug("Validated {}/{} rows, {} invalid",
                                        progress.getProcessedRows(), totalRows, progress.getInvalidRows());
                                if (progressListener != null) {
                                    progressListener.accept(progress);
                                }
                            }))
                    .flatMapIterable(verdicts -> verdicts)
                    .collectList()
                    .map(verdicts -> summarize(verdicts, elapsedSince(startNanos)));
        });
    }

    private <T> Mono<ValidationVerdict> runPass(ExecutionPlan<T> plan, T target, ValidationOptions options,
                                                CancellationToken cancellation) {
        return Mono.defer(() -> {
            // Covers empty plans too, which never reach a rule's own cancellation check.
            if (cancellation.isCancellationRequested()) {
                return Mono.just(aggregator.aggregate(List.of(), options.getFailOn(), true));
            }
            return executeAll(plan, target, options, cancellation)
                    .map(executed -> aggregator.aggregate(executed, options.getFailOn(), wasCancelled(executed)));
        });
    }

    private <T> Mono<List<ExecutedRule<T>>> executeAll(ExecutionPlan<T> plan, T target, ValidationOptions options,
                                                       CancellationToken cancellation) {
        if (plan.isEmpty()) {
            return Mono.just(List.of());
        }

        Flux<ExecutedRule<T>> executed;
        if (options.getMode() == ExecutionMode.STOP_ON_FIRST_ERROR) {
            executed = Flux.fromIterable(plan.getOrdered())
                    .concatMap(rule -> executor.execute(rule, target, cancellation))
                    .takeUntil(ValidationOrchestrator::stopsPass);
        } else if (options.isParallel() && plan.getLanes().size() > 1) {
            executed = Flux.fromIterable(plan.getLanes())
                    .flatMap(lane -> runSequentially(lane, target, cancellation), options.getMaxConcurrency());
        } else {
            executed = runSequentially(plan.getOrdered(), target, cancellation);
        }

        // Lanes finish in any order; aggregation works on plan order.
        return executed.collectSortedList(
                Comparator.comparingInt((ExecutedRule<T> rule) -> rule.getPlanned().getPlanIndex()));
    }

    private <T> Flux<ExecutedRule<T>> runSequentially(List<PlannedRule<T>> rules, T target,
                                                      CancellationToken cancellation) {
        return Flux.fromIterable(rules).concatMap(rule -> executor.execute(rule, target, cancellation));
    }

    private static boolean stopsPass(ExecutedRule<?> executed) {
        RuleOutcome outcome = executed.getOutcome();
        return outcome.getKind().isFailure() && outcome.getSeverity().isAtLeast(ValidationSeverity.ERROR);
    }

    private static boolean wasCancelled(List<? extends ExecutedRule<?>> executed) {
        return executed.stream().anyMatch(rule -> rule.getOutcome().getKind() == OutcomeKind.CANCELLED);
    }

    private Mono<ValidationVerdict> applyCancellationPolicy(ValidationVerdict verdict, ValidationOptions options) {
        if (verdict.isCancelled()) {
            log.info("Validation cancelled after {} rule(s)", verdict.getEvaluatedRules());
            if (options.getCancellationPolicy() == CancellationPolicy.FAIL_WITH_ERROR) {
                return Mono.error(new ValidationCancelledException(verdict));
            }
        }
        return Mono.just(verdict);
    }

    private BatchValidationResult summarize(List<ValidationVerdict> verdicts, Duration elapsed) {
        int valid = 0;
        int invalid = 0;
        int cancelled = 0;
        for (ValidationVerdict verdict : verdicts) {
            if (verdict.isCancelled()) {
                cancelled++;
            } else if (verdict.isValid()) {
                valid++;
            } else {
                invalid++;
            }
        }

        log.info("Batch validation finished in {}ms: {} rows, {} valid, {} invalid, {} cancelled",
                elapsed.toMillis(), verdicts.size(), valid, invalid, cancelled);

        return BatchValidationResult.builder()
                .totalRows(verdicts.size())
                .validRows(valid)
                .invalidRows(invalid)
                .cancelledRows(cancelled)
                .cancelled(cancelled > 0)
                .verdicts(List.copyOf(verdicts))
                .elapsed(elapsed)
                .timestamp(Instant.now())
                .build();
    }

    private void checkArguments(ValidationOptions options, CancellationToken cancellation) {
        if (options == null) {
            throw new ValidationConfigurationException("Validation options must not be null");
        }
        if (cancellation == null) {
            throw new ValidationConfigurationException("Cancellation token must not be null, use CancellationToken.none()");
        }
        if (options.getMaxConcurrency() < 1 || options.getBatchSize() < 1) {
            throw new ValidationConfigurationException("maxConcurrency and batchSize must be at least 1");
        }
    }

    private void reportPass(ValidationVerdict verdict) {
        OutcomeKind kind = verdict.isCancelled() ? OutcomeKind.CANCELLED
                : verdict.isValid() ? OutcomeKind.PASSED : OutcomeKind.FAILED;
        try {
            performanceSink.report(PASS_SAMPLE_NAME, verdict.getElapsed(), kind);
        } catch (RuntimeException ex) {
            log.warn("Performance sink rejected pass sample: {}", ex.toString());
        }
    }

    private void publishEvent(ValidationVerdict verdict, ValidationTrigger trigger) {
        if (eventPublisher != null) {
            eventPublisher.publishEvent(new ValidationCompletedEvent(verdict, trigger));
        }
    }

    private static int batchCount(int totalRows, int batchSize) {
        return (totalRows + batchSize - 1) / batchSize;
    }

    private static Stream<Integer> batchIndexes(int batch, int batchSize, int totalRows) {
        int from = batch * batchSize;
        return IntStream.range(from, Math.min(from + batchSize, totalRows)).boxed();
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
