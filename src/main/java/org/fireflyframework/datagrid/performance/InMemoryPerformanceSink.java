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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.datagrid.validation.OutcomeKind;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;
import java.util.stream.Collectors;

/**
 * Thread-safe sink that keeps per-rule timing statistics in memory.
 *
 * <p>Used when no metrics registry is available, and handy in tests and diagnostics
 * screens. Recording is lock-free.</p>
 *
 * <p><b>Usage:</b></p>
 * <pre>{@code
 * InMemoryPerformanceSink sink = new InMemoryPerformanceSink();
 * ValidationOrchestrator orchestrator = new ValidationOrchestrator(Duration.ofSeconds(2), sink, null);
 * orchestrator.validate(row, rules);
 *
 * PerformanceSnapshot snapshot = sink.getSnapshot();
 * snapshot.getTiming("required:email").ifPresent(timing -> log.info("avg {}", timing.getAverageTime()));
 * }</pre>
 */
@Slf4j
public class InMemoryPerformanceSink implements PerformanceSink {

    private final Map<String, Stats> statsByRule = new ConcurrentHashMap<>();

    @Override
    public void report(String ruleName, Duration elapsed, OutcomeKind kind) {
        statsByRule.computeIfAbsent(ruleName, name -> new Stats()).record(elapsed.toNanos(), kind);
    }

    /**
     * Returns the statistics collected so far.
     *
     * @return the snapshot
     */
    public PerformanceSnapshot getSnapshot() {
        Map<String, PerformanceSnapshot.RuleTiming> timings = statsByRule.entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(
                        Map.Entry::getKey,
                        entry -> entry.getValue().toTiming(entry.getKey())));

        return PerformanceSnapshot.builder()
                .timings(timings)
                .generatedAt(Instant.now())
                .build();
    }

    /**
     * Discards all collected samples.
     */
    public void reset() {
        statsByRule.clear();
        log.debug("Performance statistics reset");
    }

    private static final class Stats {
        private final LongAdder count = new LongAdder();
        private final LongAdder totalNanos = new LongAdder();
        private final AtomicLong maxNanos = new AtomicLong();
        private final Map<OutcomeKind, LongAdder> kinds = new ConcurrentHashMap<>();

        void record(long nanos, OutcomeKind kind) {
            count.increment();
            totalNanos.add(nanos);
            maxNanos.accumulateAndGet(nanos, Math::max);
            kinds.computeIfAbsent(kind, k -> new LongAdder()).increment();
        }

        PerformanceSnapshot.RuleTiming toTiming(String ruleName) {
            Map<OutcomeKind, Long> outcomeCounts = new EnumMap<>(OutcomeKind.class);
            kinds.forEach((kind, adder) -> outcomeCounts.put(kind, adder.sum()));
            return PerformanceSnapshot.RuleTiming.builder()
                    .ruleName(ruleName)
                    .sampleCount(count.sum())
                    .totalTime(Duration.ofNanos(totalNanos.sum()))
                    .maxTime(Duration.ofNanos(maxNanos.get()))
                    .outcomeCounts(Map.copyOf(outcomeCounts))
                    .build();
        }
    }
}
