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

/**
 * Names of the reserved diagnostic columns the engine adds to checked datasets.
 *
 * @param errors   column holding, per row, the messages of failed {@code error} rules
 * @param warnings column holding, per row, the messages of failed {@code warn} rules
 */
public record DqColumns(String errors, String warnings) {

    public static final String DEFAULT_ERRORS = "_errors";
    public static final String DEFAULT_WARNINGS = "_warnings";

    public DqColumns {
        if (errors == null || errors.isBlank() || warnings == null || warnings.isBlank()) {
            throw new IllegalArgumentException("Diagnostic column names must not be blank");
        }
        if (errors.equals(warnings)) {
            throw new IllegalArgumentException("Errors and warnings columns must differ: " + errors);
        }
    }

    public static DqColumns defaults() {
        return new DqColumns(DEFAULT_ERRORS, DEFAULT_WARNINGS);
    }
}
