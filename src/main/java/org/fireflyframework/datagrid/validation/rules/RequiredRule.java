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
 * Built-in rule that requires a column value to be present. Strings must also be
 * non-blank.
 *
 * @param <T> the type of target being validated
 */
public class RequiredRule<T> implements ValidationRule<T> {

    private final RuleDescriptor descriptor;
    private final Function<T, Object> extractor;

    public RequiredRule(String column, Function<T, Object> extractor) {
        this(column, extractor, ValidationSeverity.ERROR);
    }

    public RequiredRule(String column, Function<T, Object> extractor, ValidationSeverity severity) {
        this(RuleDescriptor.builder()
                .name("required:" + column)
                .message(column + " is required")
                .severity(severity)
                .column(column)
                .build(), extractor);
    }

    public RequiredRule(RuleDescriptor descriptor, Function<T, Object> extractor) {
        this.descriptor = descriptor;
        this.extractor = extractor;
    }

    @Override
    public RuleDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public Mono<CheckResult> check(T target, CancellationToken cancellation) {
        Object value = extractor.apply(target);
        boolean present = value != null && !(value instanceof CharSequence && value.toString().isBlank());
        return Mono.just(CheckResult.of(present));
    }
}
