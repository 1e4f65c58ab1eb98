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

package org.fireflyframework.datagrid.validation.rules;

import org.fireflyframework.datagrid.validation.CancellationToken;
import org.fireflyframework.datagrid.validation.CheckResult;
import org.fireflyframework.datagrid.validation.RuleDescriptor;
import org.fireflyframework.datagrid.validation.ValidationRule;
import reactor.core.publisher.Mono;

import java.util.function.Predicate;

/**
 * Custom rule backed by a synchronous predicate.
 *
 * <p>Use {@link #blocking(RuleDescriptor, Predicate)} for predicates that do I/O or heavy
 * computation; the engine then runs them on a worker scheduler so their timeout is
 * enforced.</p>
 *
 * @param <T> the type of target being validated
 */
public class PredicateRule<T> implements ValidationRule<T> {

    private final RuleDescriptor descriptor;
    private final Predicate<T> predicate;
    private final boolean blocking;

    public PredicateRule(RuleDescriptor descriptor, Predicate<T> predicate, boolean blocking) {
        this.descriptor = descriptor;
        this.predicate = predicate;
        this.blocking = blocking;
    }

    public static <T> PredicateRule<T> of(RuleDescriptor descriptor, Predicate<T> predicate) {
        return new PredicateRule<>(descriptor, predicate, false);
    }

    public static <T> PredicateRule<T> blocking(RuleDescriptor descriptor, Predicate<T> predicate) {
        return new PredicateRule<>(descriptor, predicate, true);
    }

    @Override
    public RuleDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public Mono<CheckResult> check(T target, CancellationToken cancellation) {
        return Mono.fromCallable(() -> CheckResult.of(predicate.test(target)));
    }

    @Override
    public boolean isBlocking() {
        return blocking;
    }
}
