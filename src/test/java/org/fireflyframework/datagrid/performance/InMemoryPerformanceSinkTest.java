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

import org.fireflyframework.datagrid.validation.OutcomeKind;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link InMemoryPerformanceSink}.
 */
class InMemoryPerformanceSinkTest {

    @Test
    void report_shouldAggregatePerRule() {
        // Given
        InMemoryPerformanceSink sink = new InMemoryPerformanceSink();

        // When
        sink.report("email", Duration.ofMillis(10), OutcomeKind.PASSED);
        sink.report("email", Duration.ofMillis(30), OutcomeKind.FAILED);
        sink.report("email", Duration.ofMillis(20), OutcomeKind.PASSED);
        sink.report("age", Duration.ofMillis(5), OutcomeKind.TIMED_OUT);

        // Then
        PerformanceSnapshot snapshot = sink.getSnapshot();
        assertThat(snapshot.getTotalSamples()).isEqualTo(4);
        assertThat(snapshot.getTiming("email")).hasValueSatisfying(timing -> {
            assertThat(timing.getSampleCount()).isEqualTo(3);
            assertThat(timing.getTotalTime()).isEqualTo(Duration.ofMillis(60));
            assertThat(timing.getMaxTime()).isEqualTo(Duration.ofMillis(30));
            assertThat(timing.getAverageTime()).isEqualTo(Duration.ofMillis(20));
            assertThat(timing.getCount(OutcomeKind.PASSED)).isEqualTo(2);
            assertThat(timing.getCount(OutcomeKind.FAILED)).isEqualTo(1);
            assertThat(timing.getCount(OutcomeKind.FAULTED)).isZero();
        });
        assertThat(snapshot.getTiming("age").map(timing -> timing.getCount(OutcomeKind.TIMED_OUT))).contains(1L);
        assertThat(snapshot.getTiming("unknown")).isEmpty();
    }

    @Test
    void report_concurrentWriters_shouldNotLoseSamples() throws InterruptedException {
        // Given
        InMemoryPerformanceSink sink = new InMemoryPerformanceSink();
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch done = new CountDownLatch(8);

        // When
        for (int t = 0; t < 8; t++) {
            executor.submit(() -> {
                for (int i = 0; i < 1000; i++) {
                    sink.report("hot", Duration.ofNanos(i), OutcomeKind.PASSED);
                }
                done.countDown();
            });
        }
        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        // Then
        assertThat(sink.getSnapshot().getTiming("hot"))
                .hasValueSatisfying(timing -> assertThat(timing.getSampleCount()).isEqualTo(8000));
    }

    @Test
    void getSnapshot_shouldBeUnmodifiableAndDetachedFromLaterSamples() {
        // Given
        InMemoryPerformanceSink sink = new InMemoryPerformanceSink();
        sink.report("email", Duration.ofMillis(10), OutcomeKind.PASSED);
        PerformanceSnapshot snapshot = sink.getSnapshot();
        PerformanceSnapshot.RuleTiming timing = snapshot.getTiming("email").orElseThrow();

        // When
        sink.report("email", Duration.ofMillis(10), OutcomeKind.FAILED);
        sink.report("age", Duration.ofMillis(10), OutcomeKind.PASSED);

        // Then
        assertThatThrownBy(() -> snapshot.getTimings().put("age", timing))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> timing.getOutcomeCounts().put(OutcomeKind.FAILED, 1L))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThat(snapshot.getTimings()).containsOnlyKeys("email");
        assertThat(timing.getSampleCount()).isEqualTo(1);
        assertThat(timing.getCount(OutcomeKind.FAILED)).isZero();
    }

    @Test
    void reset_shouldDiscardSamples() {
        // Given
        InMemoryPerformanceSink sink = new InMemoryPerformanceSink();
        sink.report("email", Duration.ofMillis(1), OutcomeKind.PASSED);

        // When
        sink.reset();

        // Then
        assertThat(sink.getSnapshot().getTimings()).isEmpty();
    }
}
