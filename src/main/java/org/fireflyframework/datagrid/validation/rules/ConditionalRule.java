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
import org.fireflyframework.datagrid.validation.ValidationConfigurationException;
import org.fireflyframework.datagrid.validation.ValidationRule;
import reactor.core.publisher.Mono;

import java.util.function.Predicate;

/**
 * Rule that applies another rule only when a condition on the target holds.
 *
 * <p>When the condition is false the rule passes without running the wrapped rule. A
 * condition that throws faults the rule like any other check error.</p>
 *
 * <pre>{@code
 * ValidationRule<Row> vatId = new ConditionalRule<>(
 *         row -> "EU".equals(row.region()),
 *         new RequiredRule<>("vatId", Row::vatId));
 * }</pre>
 *
 * @param <T> the type of target being validated
 */
public class ConditionalRule<T> implements ValidationRule<T> {

    private final RuleDescriptor descriptor;
    private final Predicate<T> condition;
    private final ValidationRule<T> rule;

    /**
     * Creates a conditional rule reported under the wrapped rule's descriptor.
     */
    public ConditionalRule(Predicate<T> condition, ValidationRule<T> rule) {
        this(rule != null ? rule.descriptor() : null, condition, rule);
    }

    public ConditionalRule(RuleDescriptor descriptor, Predicate<T> condition, ValidationRule<T> rule) {
        if (condition == null || rule == null) {
            throw new ValidationConfigurationException("Conditional rule requires a condition and a rule");
        }
        this.descriptor = descriptor;
        this.condition = condition;
        this.rule = rule;
    }

    @Override
    public RuleDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public Mono<CheckResult> check(T target, CancellationToken cancellation) {
        return Mono.defer(() -> condition.test(target)
                ? rule.check(target, cancellation)
                : Mono.just(CheckResult.pass()));
    }

    @Override
    public boolean isBlocking() {
        return rule.isBlocking();
    }

    public ValidationRule<T> getRule() {
        return rule;
    }
}
