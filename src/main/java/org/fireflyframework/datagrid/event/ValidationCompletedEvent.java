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

package org.fireflyframework.datagrid.event;

import lombok.Data;
import org.fireflyframework.datagrid.validation.ValidationTrigger;
import org.fireflyframework.datagrid.validation.ValidationVerdict;

import java.time.Instant;

/**
 * Spring application event published by
 * {@link org.fireflyframework.datagrid.validation.ValidationOrchestrator} after each
 * single-target validation pass, cancelled passes included.
 *
 * <p>Carries the verdict, the {@link ValidationTrigger} the caller declared in its options
 * and the time the event was created. Batch row passes do not publish events.</p>
 */
@Data
public class ValidationCompletedEvent {

    private final ValidationVerdict verdict;
    private final ValidationTrigger trigger;
    private final Instant timestamp;

    public ValidationCompletedEvent(ValidationVerdict verdict, ValidationTrigger trigger) {
        this.verdict = verdict;
        this.trigger = trigger;
        this.timestamp = Instant.now();
    }
}
