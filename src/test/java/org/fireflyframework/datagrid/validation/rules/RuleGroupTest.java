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
import org.fireflyframework.datagrid.validation.RuleDescriptor;
import org.fireflyframework.datagrid.validation.ValidationConfigurationException;
import org.fireflyframework.datagrid.validation.ValidationRule;
import org.fireflyframework.datagrid.validation.ValidationSeverity;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RuleGroup}, {@link PredicateRule} and {@link AsyncPredicateRule}.
 */
class RuleGroupTest {

    private static final RuleDescriptor GROUP = RuleDescriptor.builder()
            .name("contact")
            .message("Email or phone is required")
            .build();

    private final List<String> evaluated = new CopyOnWriteArrayList<>();

    @Test
    void check_allOf_shouldStopAtFirstFailingChild() {
        // Given
        RuleGroup<String> group = new RuleGroup<>(GROUP, GroupLogic.ALL_OF, List.of(
                tracked("first", null, true),
                tracked("second", null, false),
                tracked("third", null, true)));

        // When & Then
        StepVerifier.create(group.check("value", CancellationToken.none()))
                .assertNext(result -> assertThat(result.isPassed()).isFalse())
                .verifyComplete();
        assertThat(evaluated).containsExactly("first", "second");
    }

    @Test
    void check_anyOf_shouldStopAtFirstPassingChild() {
        // Given
        RuleGroup<String> group = new RuleGroup<>(GROUP, GroupLogic.ANY_OF, List.of(
                tracked("email", null, false),
                tracked("phone", null, true),
                tracked("fax", null, true)));

        // When & Then
        StepVerifier.create(group.check("value", CancellationToken.none()))
                .assertNext(result -> assertThat(result.isPassed()).isTrue())
                .verifyComplete();
        assertThat(evaluated).containsExactly("email", "phone");
    }

    @Test
    void check_anyOf_allFailing_shouldFail() {
        // Given
        RuleGroup<String> group = new RuleGroup<>(GROUP, GroupLogic.ANY_OF, List.of(
                tracked("email", null, false),
                tracked("phone", null, false)));

        // When & Then
        StepVerifier.create(group.check("value", CancellationToken.none()))
                .assertNext(result -> assertThat(result.isPassed()).isFalse())
                .verifyComplete();
        assertThat(evaluated).containsExactly("email", "phone");
    }

    @Test
    void check_children_shouldRunInPriorityOrder() {
        // Given
        RuleGroup<String> group = new RuleGroup<>(GROUP, GroupLogic.ALL_OF, List.of(
                tracked("unprioritized", null, true),
                tracked("second", 2, true),
                tracked("first", 1, true)));

        // When & Then
        StepVerifier.create(group.check("value", CancellationToken.none()))
                .assertNext(result -> assertThat(result.isPassed()).isTrue())
                .verifyComplete();
        assertThat(evaluated).containsExactly("first", "second", "unprioritized");
    }

    @Test
    void check_childError_shouldPropagate() {
        // Given
        AsyncPredicateRule<String> broken = new AsyncPredicateRule<>(child("broken", null),
                (value, cancellation) -> Mono.error(new IllegalStateException("boom")));
        RuleGroup<String> group = new RuleGroup<>(GROUP, GroupLogic.ALL_OF, List.of(broken));

        // When & Then
        StepVerifier.create(group.check("value", CancellationToken.none()))
                .expectError(IllegalStateException.class)
                .verify();
    }

    @Test
    void isBlocking_anyBlockingChild_shouldMakeGroupBlocking() {
        // Given
        RuleGroup<String> group = new RuleGroup<>(GROUP, GroupLogic.ALL_OF, List.of(
                PredicateRule.<String>of(child("cheap", null), value -> true),
                PredicateRule.<String>blocking(child("lookup", null), value -> true)));

        // Then
        assertThat(group.isBlocking()).isTrue();
        assertThat(group.descriptor()).isSameAs(GROUP);
    }

    @Test
    void nestedGroups_shouldCombine() {
        // Given
        RuleGroup<String> inner = new RuleGroup<>(child("inner", null), GroupLogic.ANY_OF, List.of(
                tracked("a", null, false),
                tracked("b", null, true)));
        RuleGroup<String> outer = new RuleGroup<>(GROUP, GroupLogic.ALL_OF, List.of(
                inner,
                tracked("c", null, true)));

        // When & Then
        StepVerifier.create(outer.check("value", CancellationToken.none()))
                .assertNext(result -> assertThat(result.isPassed()).isTrue())
                .verifyComplete();
        assertThat(evaluated).containsExactly("a", "b", "c");
    }

    @Test
    void constructor_emptyChildren_shouldThrowConfigurationError() {
        assertThatThrownBy(() -> new RuleGroup<String>(GROUP, GroupLogic.ALL_OF, List.of()))
                .isInstanceOf(ValidationConfigurationException.class);
    }

    @Test
    void predicateRule_shouldEvaluatePredicate() {
        // Given
        PredicateRule<String> rule = PredicateRule.of(child("short", null), value -> value.length() <= 3);

        // When & Then
        StepVerifier.create(rule.check("abcd", CancellationToken.none()))
                .assertNext(result -> assertThat(result.isPassed()).isFalse())
                .verifyComplete();
        assertThat(rule.isBlocking()).isFalse();
    }

    @Test
    void asyncPredicateRule_shouldReceiveCancellationToken() {
        // Given
        CancellationToken cancellation = CancellationToken.create();
        AsyncPredicateRule<String> rule = new AsyncPredicateRule<>(child("remote", null),
                (value, token) -> Mono.just(token == cancellation));

        // When & Then
        StepVerifier.create(rule.check("value", cancellation))
                .assertNext(result -> assertThat(result.isPassed()).isTrue())
                .verifyComplete();
    }

    private ValidationRule<String> tracked(String name, Integer priority, boolean passes) {
        return new AsyncPredicateRule<>(child(name, priority), (value, cancellation) -> Mono.fromSupplier(() -> {
            evaluated.add(name);
            return passes;
        }));
    }

    private static RuleDescriptor child(String name, Integer priority) {
        return RuleDescriptor.builder()
                .name(name)
                .message(name + " failed")
                .severity(ValidationSeverity.ERROR)
                .priority(priority)
                .build();
    }
}
