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

package org.fireflyframework.datagrid.validation.batch;

import lombok.Builder;
import lombok.Value;
import org.fireflyframework.datagrid.validation.ValidationVerdict;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Result of validating a dataset row by row.
 *
 * <p>{@link #getVerdicts()} holds one verdict per input row, in row order. Rows that were
 * not validated because the caller cancelled carry a cancelled verdict.</p>
 */
@Value
@Builder
public class BatchValidationResult {

    int totalRows;
    int validRows;
    int invalidRows;
    int cancelledRows;
    boolean cancelled;
    List<ValidationVerdict> verdicts;
    Duration elapsed;
    Instant timestamp;

    /**
     * Returns whether every row was validated and found valid.
     */
    public boolean isAllValid() {
        return !cancelled && invalidRows == 0;
    }

    /**
     * Returns the indexes of rows whose verdict is invalid, excluding cancelled rows.
     *
     * @return invalid row indexes in ascending order
     */
    public List<Integer> getInvalidRowIndexes() {
        return IntStream.range(0, verdicts.size())
                .filter(i -> !verdicts.get(i).isValid() && !verdicts.get(i).isCancelled())
                .boxed()
                .toList();
    }
}
