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
import lombok.Value;

/**
 * A single failure entry of a {@link ValidationVerdict}.
 *
 * <p>{@link #getKind()} lets the grid tell data failures ({@link OutcomeKind#FAILED})
 * apart from infrastructure failures ({@link OutcomeKind#TIMED_OUT},
 * {@link OutcomeKind#FAULTED}).</p>
 */
@Value
@Builder
public class ValidationFailure {

    String ruleName;
    String message;
    OutcomeKind kind;
    ValidationSeverity severity;
    ValidationSeverity declaredSeverity;
    Integer priority;
    int declarationIndex;
    String detail;

    public boolean isInfrastructureFailure() {
        return kind.isInfrastructureFailure();
    }
}
