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

import org.apache.spark.sql.Column;

/**
 * Derives rule names from Spark column expressions.
 */
public final class ColumnNames {

    private static final String ALIAS_SEPARATOR = " AS ";

    private ColumnNames() {}

    /**
     * Returns the canonical name of a column expression: its alias when the
     * expression is aliased, otherwise its rendered SQL text.
     *
     * @param column the column expression
     * @return the column name without identifier quotes
     */
    public static String of(Column column) {
        String text = column.toString();
        int aliasStart = text.lastIndexOf(ALIAS_SEPARATOR);
        if (aliasStart >= 0) {
            text = text.substring(aliasStart + ALIAS_SEPARATOR.length());
        }
        return text.replace("`", "");
    }

    /**
     * Turns a (possibly nested) column name into a string usable as an alias.
     *
     * @param name the column name, e.g. {@code address.zip}
     * @return the name with every non-word character replaced by {@code _}
     */
    public static String toAlias(String name) {
        return name.replaceAll("\\W", "_");
    }
}
