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

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.Set;

/**
 * Immutable description of a single validation rule.
 *
 * <p>Rule names are optional and deliberately not unique: two rules may share a name
 * and are still reported separately. Unnamed rules are identified by their position
 * in the rule set.</p>
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * RuleDescriptor descriptor = RuleDescriptor.builder()
 *         .name("Required")
 *         .message("Email is required")
 *         .severity(ValidationSeverity.ERROR)
 *         .priority(1)
 *         .timeout(Duration.ofMillis(250))
 *         .column("email")
 *         .build();
 * }</pre>
 */
@Value
@Builder(toBuilder = true)
public class RuleDescriptor {

    /**
     * Optional rule name; {@code null} for anonymous rules.
     */
    String name;

    /**
     * User-facing text shown when the rule fails.
     */
    String message;

    @Builder.Default
    ValidationSeverity severity = ValidationSeverity.ERROR;

    /**
     * Execution priority, lower runs earlier. {@code null} sorts after all prioritized rules.
     */
    Integer priority;

    /**
     * Per-rule time budget. {@code null} falls back to the orchestrator default.
     */
    Duration timeout;

    /**
     * Columns this rule reads. An empty set means the rule reads the whole target.
     */
    @Singular
    Set<String> columns;

    /**
     * Resolves the time budget for this rule.
     *
     * @param defaultTimeout the process-wide default configured on the orchestrator
     * @return the declared timeout, or {@code defaultTimeout} when none is declared
     */
    public Duration effectiveTimeout(Duration defaultTimeout) {
        return timeout != null ? timeout : defaultTimeout;
    }

    /**
     * Returns whether this rule declares no column dependency and therefore reads
     * the whole target.
     */
    public boolean readsWholeTarget() {
        return columns.isEmpty();
    }

    /**
     * Returns a stable label for logs and timing samples.
     *
     * @param declarationIndex the rule's position in its rule set
     * @return the rule name, or {@code rule#<index>} for anonymous rules
     */
    public String displayName(int declarationIndex) {
        return name != null ? name : "rule#" + declarationIndex;
    }
}
