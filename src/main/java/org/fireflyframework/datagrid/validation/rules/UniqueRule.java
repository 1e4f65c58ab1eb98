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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Dataset-level rule that requires a column's values to be unique across all rows.
 *
 * <p>The target is the whole dataset. Missing values (null or blank strings) are not
 * compared. On failure the message lists each duplicated value with the zero-based
 * indexes of the rows holding it, in first-occurrence order.</p>
 *
 * @param <R> the row type
 */
public class UniqueRule<R> implements ValidationRule<List<R>> {

    private final RuleDescriptor descriptor;
    private final String column;
    private final Function<R, Object> extractor;

    public UniqueRule(String column, Function<R, Object> extractor) {
        this(column, extractor, ValidationSeverity.ERROR);
    }

    public UniqueRule(String column, Function<R, Object> extractor, ValidationSeverity severity) {
        this(RuleDescriptor.builder()
                .name("unique:" + column)
                .message(column + " must be unique")
                .severity(severity)
                .column(column)
                .build(), column, extractor);
    }

    public UniqueRule(RuleDescriptor descriptor, String column, Function<R, Object> extractor) {
        this.descriptor = descriptor;
        this.column = column;
        this.extractor = extractor;
    }

    @Override
    public RuleDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public Mono<CheckResult> check(List<R> rows, CancellationToken cancellation) {
        return Mono.fromCallable(() -> {
            Map<Object, List<Integer>> rowsByValue = new LinkedHashMap<>();
            for (int i = 0; i < rows.size(); i++) {
                cancellation.throwIfCancellationRequested();
                Object value = extractor.apply(rows.get(i));
                if (value == null || (value instanceof CharSequence && value.toString().isBlank())) {
                    continue;
                }
                rowsByValue.computeIfAbsent(value, v -> new ArrayList<>()).add(i);
            }

            String duplicates = rowsByValue.entrySet().stream()
                    .filter(entry -> entry.getValue().size() > 1)
                    .map(entry -> "'" + entry.getKey() + "' at rows " + entry.getValue())
                    .collect(Collectors.joining(", "));
            if (duplicates.isEmpty()) {
                return CheckResult.pass();
            }
            return CheckResult.fail(column + " must be unique; duplicates: " + duplicates);
        });
    }

    public String getColumn() {
        return column;
    }
}
