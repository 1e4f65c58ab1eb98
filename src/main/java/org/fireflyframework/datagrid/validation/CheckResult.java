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

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Result returned by a rule check: either a pass or a failure with an optional
 * message overriding the descriptor's message.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CheckResult {

    private static final CheckResult PASS = new CheckResult(true, null);
    private static final CheckResult FAIL = new CheckResult(false, null);

    boolean passed;
    String message;

    public static CheckResult pass() {
        return PASS;
    }

    public static CheckResult fail() {
        return FAIL;
    }

    /**
     * Creates a failing result with a message specific to this evaluation.
     *
     * @param message the failure message shown instead of the descriptor's message
     * @return a failing {@link CheckResult}
     */
    public static CheckResult fail(String message) {
        return new CheckResult(false, message);
    }

    public static CheckResult of(boolean passed) {
        return passed ? PASS : FAIL;
    }
}
