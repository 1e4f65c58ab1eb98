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

import java.util.function.BiFunction;

/**
 * Custom rule backed by a non-blocking check, typically a remote lookup.
 *
 * <p>The check function receives the rule's {@link CancellationToken} and should stop
 * its work when it is signalled.</p>
 *
 * <pre>{@code
 * new AsyncPredicateRule<Row>(descriptor,
 *         (row, cancellation) -> inventoryClient.exists(row.sku())
 *                 .takeUntilOther(cancellation.whenCancelled()));
 * }</pre>
 *
 * @param <T> the type of target being validated
 */
public class AsyncPredicateRule<T> implements ValidationRule<T> {

    private final RuleDescriptor descriptor;
    private final BiFunction<T, CancellationToken, Mono<Boolean>> check;

    public AsyncPredicateRule(RuleDescriptor descriptor, BiFunction<T, CancellationToken, Mono<Boolean>> check) {
        this.descriptor = descriptor;
        this.check = check;
    }

    @Override
    public RuleDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public Mono<CheckResult> check(T target, CancellationToken cancellation) {
        return check.apply(target, cancellation).map(CheckResult::of);
    }
}
