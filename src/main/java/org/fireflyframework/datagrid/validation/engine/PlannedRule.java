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

package org.fireflyframework.datagrid.validation.engine;

import lombok.Builder;
import lombok.Value;
import org.fireflyframework.datagrid.validation.RuleDescriptor;
import org.fireflyframework.datagrid.validation.ValidationRule;

/**
 * A rule positioned within an {@link ExecutionPlan}.
 *
 * @param <T> the type of target the rule validates
 */
@Value
@Builder
public class PlannedRule<T> {

    ValidationRule<T> rule;

    /**
     * Descriptor captured once at planning time.
     */
    RuleDescriptor descriptor;

    /**
     * Position in the caller's rule list.
     */
    int declarationIndex;

    /**
     * Position in the priority-sorted execution order.
     */
    int planIndex;

    int lane;

    /**
     * {@code true} when no other rule in the plan shares a data dependency with this one.
     */
    boolean parallelSafe;

    public String getDisplayName() {
        return descriptor.displayName(declarationIndex);
    }
}
