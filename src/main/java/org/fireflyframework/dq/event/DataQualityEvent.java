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

package org.fireflyframework.dq.event;

import lombok.Data;

import java.time.Instant;

/**
 * Event published by the {@link org.fireflyframework.dq.engine.DqEngine}
 * after data quality checks have been attached to a dataset.
 */
@Data
public class DataQualityEvent {

    private final int errorRules;
    private final int warningRules;
    private final String errorsColumn;
    private final String warningsColumn;
    private final Instant timestamp;

    public DataQualityEvent(int errorRules, int warningRules, String errorsColumn, String warningsColumn) {
        this.errorRules = errorRules;
        this.warningRules = warningRules;
        this.errorsColumn = errorsColumn;
        this.warningsColumn = warningsColumn;
        this.timestamp = Instant.now();
    }

    public int getTotalRules() {
        return errorRules + warningRules;
    }
}
