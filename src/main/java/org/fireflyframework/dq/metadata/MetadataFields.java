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

package org.fireflyframework.dq.metadata;

/**
 * Field names of the rule metadata schema:
 *
 * <pre>{@code
 * {
 *   "check": { "function": "is_not_null", "arguments": { "col_names": ["vendor_id"] } },
 *   "name": "optional rule name",
 *   "criticality": "warn" | "error"
 * }
 * }</pre>
 */
public final class MetadataFields {

    public static final String CHECK = "check";
    public static final String FUNCTION = "function";
    public static final String ARGUMENTS = "arguments";
    public static final String NAME = "name";
    public static final String CRITICALITY = "criticality";

    /** Expands one rule per listed column. */
    public static final String COL_NAMES = "col_names";
    public static final String COL_NAME = "col_name";

    private MetadataFields() {}
}
