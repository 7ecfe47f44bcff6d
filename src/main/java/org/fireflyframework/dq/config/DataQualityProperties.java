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

package org.fireflyframework.dq.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the data quality engine.
 *
 * <p><b>Example Configuration:</b></p>
 * <pre>{@code
 * firefly:
 *   data:
 *     quality:
 *       enabled: true
 *       errors-column: _errors
 *       warnings-column: _warnings
 *       legacy-string-maps: false
 * }</pre>
 */
@Data
@ConfigurationProperties(prefix = "firefly.data.quality")
public class DataQualityProperties {

    private boolean enabled = true;

    /** Name of the diagnostic column collecting failed {@code error} rules. */
    private String errorsColumn = DqColumns.DEFAULT_ERRORS;

    /** Name of the diagnostic column collecting failed {@code warn} rules. */
    private String warningsColumn = DqColumns.DEFAULT_WARNINGS;

    /** Decode string-encoded maps when loading rule files written by older tooling. */
    private boolean legacyStringMaps = false;

    public DqColumns toColumns() {
        return new DqColumns(errorsColumn, warningsColumn);
    }
}
