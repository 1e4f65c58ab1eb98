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

import reactor.core.publisher.Mono;

/**
 * Port interface for pluggable grid validation rules.
 *
 * <p>A rule pairs an immutable {@link RuleDescriptor} with an executable check. Checks
 * that wait on I/O should return a non-blocking {@link Mono}; checks that block the
 * calling thread must report {@link #isBlocking()} so the engine moves them to a
 * worker scheduler where the timeout gate can still fire.</p>
 *
 * <p>Checks must observe the supplied {@link CancellationToken}. A check that ignores
 * it is only bounded by the rule's timeout, after which its result is abandoned but
 * the work itself is not stopped.</p>
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * public class UniqueSkuRule implements ValidationRule<Row> {
 *
 *     @Override
 *     public RuleDescriptor descriptor() {
 *         return RuleDescriptor.builder()
 *                 .name("unique-sku")
 *                 .message("SKU already exists")
 *                 .column("sku")
 *                 .timeout(Duration.ofMillis(500))
 *                 .build();
 *     }
 *
 *     @Override
 *     public Mono<CheckResult> check(Row row, CancellationToken cancellation) {
 *         return catalogClient.exists(row.sku())
 *                 .map(exists -> CheckResult.of(!exists));
 *     }
 * }
 * }</pre>
 *
 * @param <T> the type of target this rule validates
 */
public interface ValidationRule<T> {

    /**
     * Returns the descriptor of this rule. Must return the same value on every call.
     *
     * @return the rule descriptor
     */
    RuleDescriptor descriptor();

    /**
     * Evaluates this rule against the given target.
     *
     * @param target       the cell value, row or dataset under validation
     * @param cancellation signalled when the caller cancels or the rule's budget expires
     * @return a {@link Mono} emitting the check result
     */
    Mono<CheckResult> check(T target, CancellationToken cancellation);

    /**
     * Returns whether the check blocks its calling thread.
     * Defaults to {@code false}.
     *
     * @return {@code true} if the check must run on a worker scheduler
     */
    default boolean isBlocking() {
        return false;
    }
}
