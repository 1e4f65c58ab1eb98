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
 * Severity levels for grid validation failures, ordered from least to most severe.
 *
 * <ul>
 *   <li>{@link #INFO} - Informational, surfaced to the user but never blocks</li>
 *   <li>{@link #WARNING} - A potential issue the user should be aware of</li>
 *   <li>{@link #ERROR} - Invalid data; blocks commits under the default threshold</li>
 *   <li>{@link #CRITICAL} - A severe violation</li>
 * </ul>
 */
public enum ValidationSeverity {

    INFO,
    WARNING,
    ERROR,
    CRITICAL;

    /**
     * Returns whether this severity is equal to or more severe than the given one.
     *
     * @param other the severity to compare against
     * @return {@code true} if this severity is at least {@code other}
     */
    public boolean isAtLeast(ValidationSeverity other) {
        return compareTo(other) >= 0;
    }

    /**
     * Returns the more severe of the two given severities.
     *
     * @param a the first severity
     * @param b the second severity
     * @return the maximum of {@code a} and {@code b}
     */
    public static ValidationSeverity max(ValidationSeverity a, ValidationSeverity b) {
        return a.compareTo(b) >= 0 ? a : b;
    }
}
