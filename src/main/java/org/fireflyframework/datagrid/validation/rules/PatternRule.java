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
import java.util.regex.Pattern;

/**
 * Built-in rule that validates a string column matches a regular expression.
 * A {@code null} value does not match.
 *
 * @param <T> the type of target being validated
 */
public class PatternRule<T> implements ValidationRule<T> {

    private final RuleDescriptor descriptor;
    private final Pattern pattern;
    private final Function<T, String> extractor;

    public PatternRule(String column, Pattern pattern, Function<T, String> extractor) {
        this(column, pattern, extractor, ValidationSeverity.ERROR);
    }

    public PatternRule(String column, Pattern pattern, Function<T, String> extractor,
                       ValidationSeverity severity) {
        this(RuleDescriptor.builder()
                .name("pattern:" + column)
                .message(column + " does not match pattern: " + pattern.pattern())
                .severity(severity)
                .column(column)
                .build(), pattern, extractor);
    }

    public PatternRule(RuleDescriptor descriptor, Pattern pattern, Function<T, String> extractor) {
        this.descriptor = descriptor;
        this.pattern = pattern;
        this.extractor = extractor;
    }

    @Override
    public RuleDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public Mono<CheckResult> check(T target, CancellationToken cancellation) {
        String value = extractor.apply(target);
        return Mono.just(CheckResult.of(value != null && pattern.matcher(value).matches()));
    }
}
