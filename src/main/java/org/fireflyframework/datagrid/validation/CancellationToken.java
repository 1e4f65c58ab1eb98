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

import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal shared between a caller and the rule checks it
 * triggers.
 *
 * <p>Cancelling a token cancels every token linked to it. The engine links one child
 * token per rule execution so a timed-out rule can be told to stop without affecting
 * the rest of the validation pass.</p>
 *
 * <p>Checks either poll {@link #isCancellationRequested()} or compose
 * {@link #whenCancelled()} into their reactive pipeline.</p>
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken(null, false);

    private final CancellationToken parent;
    private final boolean cancellable;
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final Sinks.One<Boolean> signal = Sinks.one();
    private final List<CancellationToken> children = new CopyOnWriteArrayList<>();

    private CancellationToken(CancellationToken parent, boolean cancellable) {
        this.parent = parent;
        this.cancellable = cancellable;
    }

    /**
     * Creates a new, independent token.
     *
     * @return a token that is not yet cancelled
     */
    public static CancellationToken create() {
        return new CancellationToken(null, true);
    }

    /**
     * Returns the shared token that can never be cancelled.
     *
     * @return the no-op token
     */
    public static CancellationToken none() {
        return NONE;
    }

    /**
     * Requests cancellation of this token and every token linked to it.
     *
     * @return {@code true} if this call transitioned the token to cancelled
     */
    public boolean cancel() {
        if (!cancellable || !cancelled.compareAndSet(false, true)) {
            return false;
        }
        signal.tryEmitValue(Boolean.TRUE);
        children.forEach(CancellationToken::cancel);
        return true;
    }

    public boolean isCancellationRequested() {
        return cancelled.get();
    }

    /**
     * Returns a {@link Mono} that emits {@code true} once cancellation is requested
     * and never completes otherwise.
     *
     * @return the cancellation signal
     */
    public Mono<Boolean> whenCancelled() {
        return cancellable ? signal.asMono() : Mono.never();
    }

    /**
     * Throws {@link CancellationException} if cancellation has been requested.
     * Intended for blocking checks that poll between units of work.
     */
    public void throwIfCancellationRequested() {
        if (isCancellationRequested()) {
            throw new CancellationException("Validation was cancelled");
        }
    }

    /**
     * Creates a child token that is cancelled together with this one but can also be
     * cancelled on its own. Call {@link #release()} on the child once it is no longer
     * needed so this token does not retain it.
     *
     * @return the linked child token
     */
    public CancellationToken createLinked() {
        CancellationToken child = new CancellationToken(cancellable ? this : null, true);
        if (cancellable) {
            children.add(child);
            if (isCancellationRequested()) {
                child.cancel();
            }
        }
        return child;
    }

    /**
     * Detaches this token from its parent.
     */
    public void release() {
        if (parent != null) {
            parent.children.remove(this);
        }
    }
}
