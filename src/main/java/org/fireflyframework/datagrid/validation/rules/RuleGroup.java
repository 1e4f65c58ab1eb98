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
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Composite rule combining child rules with {@link GroupLogic}.
 *
 * <p>The group is scheduled, timed and reported as a single rule under its own
 * descriptor; children's timeouts and severities are not applied individually. Children
 * run one after another in priority order (unprioritized last, ties in declaration
 * order) and evaluation short-circuits as described by {@link GroupLogic}. A child that
 * errors fails the whole group with that error. Groups may be nested.</p>
 *
 * <pre>{@code
 * RuleGroup<Row> contact = new RuleGroup<>(
 *         RuleDescriptor.builder().name("contact").message("Email or phone is required").build(),
 *         GroupLogic.ANY_OF,
 *         List.of(new RequiredRule<>("email", Row::email), new RequiredRule<>("phone", Row::phone)));
 * }</pre>
 *
 * @param <T> the type of target being validated
 */
public class RuleGroup<T> implements ValidationRule<T> {

    private final RuleDescriptor descriptor;
    private final GroupLogic logic;
    private final List<ValidationRule<T>> children;
    private final boolean blocking;

    public RuleGroup(RuleDescriptor descriptor, GroupLogic logic, List<? extends ValidationRule<T>> children) {
        if (children == null || children.isEmpty()) {
            throw new ValidationConfigurationException("Rule group must contain at least one rule");
        }
        if (logic == null) {
            throw new ValidationConfigurationException("Rule group must declare its logic");
        }
        this.descriptor = descriptor;
        this.logic = logic;
        this.children = orderByPriority(children);
        this.blocking = this.children.stream().anyMatch(ValidationRule::isBlocking);
    }

    @Override
    public RuleDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public Mono<CheckResult> check(T target, CancellationToken cancellation) {
        return Flux.fromIterable(children)
                .concatMap(child -> Mono.defer(() -> child.check(target, cancellation)))
                .takeUntil(result -> logic == GroupLogic.ALL_OF ? !result.isPassed() : result.isPassed())
                .last()
                .map(result -> CheckResult.of(result.isPassed()));
    }

    /**
     * Returns {@code true} when any child blocks, so the whole group runs on a worker
     * scheduler.
     */
    @Override
    public boolean isBlocking() {
        return blocking;
    }

    public GroupLogic getLogic() {
        return logic;
    }

    public List<ValidationRule<T>> getChildren() {
        return children;
    }

    private static <T> List<ValidationRule<T>> orderByPriority(List<? extends ValidationRule<T>> children) {
        List<ValidationRule<T>> ordered = new ArrayList<>(children);
        // List.sort is stable, so equal priorities keep declaration order.
        ordered.sort(Comparator.comparing(
                (ValidationRule<T> rule) -> rule.descriptor().getPriority(),
                Comparator.nullsLast(Comparator.naturalOrder())));
        return List.copyOf(ordered);
    }
}
