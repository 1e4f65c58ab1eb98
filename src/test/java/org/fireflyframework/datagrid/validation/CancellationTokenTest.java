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

import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.concurrent.CancellationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link CancellationToken}.
 */
class CancellationTokenTest {

    @Test
    void cancel_shouldPropagateToLinkedTokens() {
        // Given
        CancellationToken parent = CancellationToken.create();
        CancellationToken child = parent.createLinked();
        CancellationToken grandChild = child.createLinked();

        // When
        boolean transitioned = parent.cancel();

        // Then
        assertThat(transitioned).isTrue();
        assertThat(child.isCancellationRequested()).isTrue();
        assertThat(grandChild.isCancellationRequested()).isTrue();
        assertThat(parent.cancel()).isFalse();
    }

    @Test
    void cancel_linkedToken_shouldNotAffectParent() {
        // Given
        CancellationToken parent = CancellationToken.create();
        CancellationToken child = parent.createLinked();

        // When
        child.cancel();

        // Then
        assertThat(child.isCancellationRequested()).isTrue();
        assertThat(parent.isCancellationRequested()).isFalse();
    }

    @Test
    void createLinked_fromCancelledParent_shouldStartCancelled() {
        // Given
        CancellationToken parent = CancellationToken.create();
        parent.cancel();

        // When
        CancellationToken child = parent.createLinked();

        // Then
        assertThat(child.isCancellationRequested()).isTrue();
    }

    @Test
    void release_shouldDetachFromParent() {
        // Given
        CancellationToken parent = CancellationToken.create();
        CancellationToken child = parent.createLinked();

        // When
        child.release();
        parent.cancel();

        // Then
        assertThat(child.isCancellationRequested()).isFalse();
    }

    @Test
    void whenCancelled_shouldEmitOnCancel() {
        // Given
        CancellationToken token = CancellationToken.create();

        // When & Then
        StepVerifier.create(token.whenCancelled())
                .then(token::cancel)
                .expectNext(Boolean.TRUE)
                .verifyComplete();
    }

    @Test
    void none_shouldNeverBeCancelled() {
        // Given
        CancellationToken none = CancellationToken.none();

        // When
        boolean transitioned = none.cancel();

        // Then
        assertThat(transitioned).isFalse();
        assertThat(none.isCancellationRequested()).isFalse();
        assertThat(none.createLinked().isCancellationRequested()).isFalse();
        StepVerifier.create(none.whenCancelled())
                .expectSubscription()
                .expectNoEvent(Duration.ofMillis(50))
                .thenCancel()
                .verify();
    }

    @Test
    void throwIfCancellationRequested_shouldThrowOnlyAfterCancel() {
        // Given
        CancellationToken token = CancellationToken.create();

        // When & Then
        assertThatCode(token::throwIfCancellationRequested).doesNotThrowAnyException();
        token.cancel();
        assertThatThrownBy(token::throwIfCancellationRequested).isInstanceOf(CancellationException.class);
    }
}
