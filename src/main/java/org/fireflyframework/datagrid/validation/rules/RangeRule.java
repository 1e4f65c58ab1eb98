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
import org.fireflyframework.datagrid.validation.ValidationSeverity;
import reactor.core.publisher.Mono;

import java.util.function.Function;

/**
 * Built-in rule that validates a comparable column falls within an inclusive range.
 * Either bound may be {@code null} for an open range.
 *
 * @param <T> the type of target being validated
 */
public class RangeRule<T> implements ValidationRule<T> {

    private final RuleDescriptor descriptor;
    private final Comparable<?> min;
    private final Comparable<?> max;
    private final Function<T, Comparable<?>> extractor;

    public RangeRule(String column, Comparable<?> min, Comparable<?> max,
                     Function<T, Comparable<?>> extractor) {
        this(column, min, max, extractor, ValidationSeverity.ERROR);
    }

    public RangeRule(String column, Comparable<?> min, Comparable<?> max,
                     Function<T, Comparable<?>> extractor, ValidationSeverity severity) {
        this(RuleDescriptor.builder()
                .name("range:" + column)
                .message(column + " must be within [" + min + ", " + max + "]")
                .severity(severity)
                .column(column)
                .build(), min, max, extractor);
    }

    public RangeRule(RuleDescriptor descriptor, Comparable<?> min, Comparable<?> max,
                     Function<T, Comparable<?>> extractor) {
        this.descriptor = descriptor;
        this.min = min;
        this.max = max;
        this.extractor = extractor;
    }

    @Override
    public RuleDescriptor descriptor() {
        return descriptor;
    }

    @Override
    @SuppressWarnings({"unchecked", "rawtypes"})
    public Mono<CheckResult> check(T target, CancellationToken cancellation) {
        Comparable value = extractor.apply(target);
        if (value == null) {
            return Mono.just(CheckResult.fail(descriptor.getMessage() + ", got null"));
        }

        boolean belowMin = min != null && value.compareTo(min) < 0;
        boolean aboveMax = max != null && value.compareTo(max) > 0;

        if (!belowMin && !aboveMax) {
            return Mono.just(CheckResult.pass());
        }
        return Mono.just(CheckResult.fail(descriptor.getMessage() + ", got " + value));
    }
}
