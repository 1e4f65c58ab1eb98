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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.datagrid.validation.CancellationPolicy;
import org.fireflyframework.datagrid.validation.CancellationToken;
import org.fireflyframework.datagrid.validation.ValidationConfigurationException;
import org.fireflyframework.datagrid.validation.ValidationOptions;
import org.fireflyframework.datagrid.validation.ValidationOrchestrator;
import org.fireflyframework.datagrid.validation.ValidationRule;
import org.fireflyframework.datagrid.validation.ValidationVerdict;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Coalesces bursts of validation requests for one target, such as a cell being edited.
 *
 * <p>Each call to {@link #schedule(Object)} restarts the quiet period. When the quiet
 * period elapses without a newer request, the last scheduled target is validated and
 * its verdict is emitted on {@link #verdicts()}. A newer request cancels the pending
 * timer and any validation still in flight for the previous target, so stale verdicts
 * are never emitted.</p>
 *
 * <p><b>Usage:</b></p>
 * <pre>{@code
 * DebouncedValidator<String> cell = new DebouncedValidator<>(orchestrator, emailRules,
 *         ValidationOptions.defaults(), Duration.ofMillis(300));
 * cell.verdicts().subscribe(grid::render);
 *
 * cell.schedule("j");
 * cell.schedule("jo");
 * cell.schedule("john@example.com"); // only this one is validated
 * }</pre>
 *
 * @param <T> the type of target being validated
 */
@Slf4j
public class DebouncedValidator<T> implements Disposable {

    public static final Duration DEFAULT_DELAY = Duration.ofMillis(500);

    private final ValidationOrchestrator orchestrator;
    private final List<? extends ValidationRule<T>> rules;
    private final ValidationOptions options;
    private final Duration delay;
    private final Sinks.Many<ValidationVerdict> verdicts = Sinks.many().replay().latest();
    private final AtomicInteger pending = new AtomicInteger();

    private CancellationToken current;
    private boolean disposed;

    public DebouncedValidator(ValidationOrchestrator orchestrator, List<? extends ValidationRule<T>> rules,
                              ValidationOptions options) {
        this(orchestrator, rules, options, DEFAULT_DELAY);
    }

    /**
     * Creates a debounced validator.
     *
     * @param orchestrator the orchestrator running each validation pass
     * @param rules        the rule set applied to every scheduled target
     * @param options      execution options; cancelled passes are always dropped, never raised
     * @param delay        the quiet period; must not be negative
     */
    public DebouncedValidator(ValidationOrchestrator orchestrator, List<? extends ValidationRule<T>> rules,
                              ValidationOptions options, Duration delay) {
        if (delay == null || delay.isNegative()) {
            throw new ValidationConfigurationException("Debounce delay must not be negative, got " + delay);
        }
        if (options == null) {
            throw new ValidationConfigurationException("Validation options must not be null");
        }
        this.orchestrator = orchestrator;
        this.rules = rules;
        this.options = options.toBuilder()
                .cancellationPolicy(CancellationPolicy.RETURN_CANCELLED_VERDICT)
                .build();
        this.delay = delay;
    }

    /**
     * Schedules validation of the given target, superseding any earlier request.
     *
     * @param target the latest value
     * @throws IllegalStateException if this validator has been disposed
     */
    public void schedule(T target) {
        CancellationToken token;
        synchronized (this) {
            if (disposed) {
                throw new IllegalStateException("DebouncedValidator has been disposed");
            }
            if (current != null) {
                current.cancel();
            }
            token = CancellationToken.create();
            current = token;
        }

        pending.incrementAndGet();
        Mono.delay(delay)
                .takeUntilOther(token.whenCancelled())
                .flatMap(tick -> orchestrator.validateAsync(target, rules, options, token))
                .filter(verdict -> !verdict.isCancelled())
                .doFinally(signal -> pending.decrementAndGet())
                .subscribe(
                        verdict -> emit(verdict, token),
                        error -> log.error("Debounced validation failed: {}", error.getMessage(), error));
    }

    /**
     * Returns the stream of verdicts. Late subscribers receive the most recent verdict.
     */
    public Flux<ValidationVerdict> verdicts() {
        return verdicts.asFlux();
    }

    /**
     * Returns the number of scheduled requests whose timer or validation has not
     * finished yet, superseded ones included until they unwind.
     */
    public int getPendingCount() {
        return pending.get();
    }

    public Duration getDelay() {
        return delay;
    }

    @Override
    public void dispose() {
        synchronized (this) {
            if (disposed) {
                return;
            }
            disposed = true;
            if (current != null) {
                current.cancel();
                current = null;
            }
        }
        verdicts.tryEmitComplete();
        log.debug("Debounced validator disposed");
    }

    @Override
    public synchronized boolean isDisposed() {
        return disposed;
    }

    private void emit(ValidationVerdict verdict, CancellationToken token) {
        synchronized (this) {
            // A newer request may have started after this pass completed.
            if (token != current || disposed) {
                return;
            }
            verdicts.tryEmitNext(verdict);
        }
    }
}
