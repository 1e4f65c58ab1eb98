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

package org.fireflyframework.datagrid.performance;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import org.fireflyframework.datagrid.validation.OutcomeKind;

import java.time.Duration;
import java.util.Locale;

/**
 * Publishes timing samples as a Micrometer {@link Timer} named
 * {@value #METRIC_NAME}, tagged with {@value #TAG_RULE} and {@value #TAG_OUTCOME}.
 */
public class MicrometerPerformanceSink implements PerformanceSink {

    public static final String METRIC_NAME = "grid.validation.rule.duration";
    public static final String TAG_RULE = "rule";
    public static final String TAG_OUTCOME = "outcome";

    private final MeterRegistry registry;

    public MicrometerPerformanceSink(MeterRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        this.registry = registry;
    }

    @Override
    public void report(String ruleName, Duration elapsed, OutcomeKind kind) {
        Timer.builder(METRIC_NAME)
                .description("Time spent evaluating grid validation rules")
                .tags(Tags.of(TAG_RULE, ruleName, TAG_OUTCOME, kind.name().toLowerCase(Locale.ROOT)))
                .register(registry)
                .record(elapsed);
    }
}
