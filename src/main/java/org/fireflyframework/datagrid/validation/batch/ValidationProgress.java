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

/**
 * Progress of a batch validation, reported after each completed batch.
 */
@Value
@Builder
public class ValidationProgress {

    int processedRows;
    int totalRows;
    int invalidRows;

    public double getPercent() {
        return totalRows == 0 ? 100.0 : (double) processedRows / totalRows * 100.0;
    }

    public String getStatusMessage() {
        return "Validated " + processedRows + "/" + totalRows + " rows, " + invalidRows + " invalid";
    }
}
