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

import lombok.Builder;
import lombok.Value;
import org.fireflyframework.datagrid.validation.OutcomeKind;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Point-in-time view of the samples collected by an {@link InMemoryPerformanceSink}.
 */
@Value
@Builder
public class PerformanceSnapshot {

    /**
     * Timings keyed by rule name.
     */
    Map<String, RuleTiming> timings;

    Instant generatedAt;

    public Optional<RuleTiming> getTiming(String ruleName) {
        return Optional.ofNullable(timings.get(ruleName));
    }

    public long getTotalSamples() {
        return timings.values().stream().mapToLong(RuleTiming::getSampleCount).sum();
    }

    /**
     * Aggregated timing for a single rule.
     */
    @Value
    @Builder
    public static class RuleTiming {
        String ruleName;
        long sampleCount;
        Duration totalTime;
        Duration maxTime;
        Map<OutcomeKind, Long> outcomeCounts;

        public Duration getAverageTime() {
            return sampleCount == 0 ? Duration.ZERO : totalTime.dividedBy(sampleCount);
        }

        public long getCount(OutcomeKind kind) {
            return outcomeCounts.getOrDefault(kind, 0L);
        }
    }
}
