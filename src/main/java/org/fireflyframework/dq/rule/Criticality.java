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

package org.fireflyframework.dq.rule;

/**
 * Criticality levels for data quality rule violations.
 *
 * <ul>
 *   <li>{@link #WARN} - A potential issue; the row stays in the valid partition</li>
 *   <li>{@link #ERROR} - A critical issue; the row is excluded from the valid partition</li>
 * </ul>
 */
public enum Criticality {

    WARN("warn"),
    ERROR("error");

    private final String value;

    Criticality(String value) {
        this.value = value;
    }

    /**
     * Returns the value used for this criticality in rule metadata.
     *
     * @return {@code warn} or {@code error}
     */
    public String getValue() {
        return value;
    }

    /**
     * Returns whether the given metadata value names a known criticality.
     * Matching is exact and case-sensitive.
     *
     * @param value the raw metadata value
     * @return true for {@code warn} and {@code error}
     */
    public static boolean isValid(Object value) {
        for (Criticality criticality : values()) {
            if (criticality.value.equals(value)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Resolves a metadata value leniently. Anything other than {@code warn}
     * resolves to {@link #ERROR}.
     *
     * @param value the raw metadata value, may be {@code null}
     * @return the resolved criticality
     */
    public static Criticality fromValue(String value) {
        return WARN.value.equals(value) ? WARN : ERROR;
    }

    @Override
    public String toString() {
        return value;
    }
}
