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

import lombok.Getter;

/**
 * Raised when the caller cancels a validation pass that was started with
 * {@link CancellationPolicy#FAIL_WITH_ERROR}. Carries the partial verdict built from
 * the outcomes collected before cancellation.
 */
@Getter
public class ValidationCancelledException extends GridValidationException {

    private final transient ValidationVerdict partialVerdict;

    public ValidationCancelledException(ValidationVerdict partialVerdict) {
        super("Validation was cancelled after " + partialVerdict.getEvaluatedRules() + " rule(s)");
        this.partialVerdict = partialVerdict;
    }
}
