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

/**
 * Kind of outcome produced by running one rule against one target.
 *
 * <ul>
 *   <li>{@link #PASSED} - the check accepted the target</li>
 *   <li>{@link #FAILED} - the check rejected the target (data is invalid)</li>
 *   <li>{@link #TIMED_OUT} - the check exceeded its time budget</li>
 *   <li>{@link #FAULTED} - the check raised an unexpected error</li>
 *   <li>{@link #CANCELLED} - the caller cancelled before the check produced a result</li>
 * </ul>
 */
public enum OutcomeKind {

    PASSED,
    FAILED,
    TIMED_OUT,
    FAULTED,
    CANCELLED;

    /**
     * Returns whether this outcome reflects a problem in the validation
     * infrastructure rather than in the validated data.
     */
    public boolean isInfrastructureFailure() {
        return this == TIMED_OUT || this == FAULTED;
    }

    /**
     * Returns whether this outcome is reported as a failure in the verdict.
     */
    public boolean isFailure() {
        return this == FAILED || isInfrastructureFailure();
    }
}
