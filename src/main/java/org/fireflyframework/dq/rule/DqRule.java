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

import lombok.Getter;
import lombok.ToString;
import org.apache.spark.sql.Column;
import org.apache.spark.sql.functions;

import java.util.Objects;

/**
 * A data quality rule: a check expression, the name it is reported under and
 * its criticality.
 *
 * <p>The check expression must evaluate to a message string for rows that
 * violate the rule and to {@code null} for rows that satisfy it.</p>
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * DqRule rule = DqRule.of(ColumnFunctions.isNotNull("vendor_id"), null, "warn");
 * rule.getName();             // "col_vendor_id_is_not_null"
 * rule.getRuleCriticality();  // Criticality.WARN
 * }</pre>
 */
@Getter
@ToString
public final class DqRule {

    static final String DEFAULT_NAME_PREFIX = "col_";

    private final Column check;
    private final String name;
    private final String criticality;
    private final Criticality ruleCriticality;

    private DqRule(Column check, String name, String criticality) {
        this.check = Objects.requireNonNull(check, "check must not be null");
        this.name = name == null || name.isEmpty() ? DEFAULT_NAME_PREFIX + ColumnNames.of(check) : name;
        this.criticality = criticality;
        this.ruleCriticality = Criticality.fromValue(criticality);
    }

    /**
     * Creates an {@code error} rule named after the check expression.
     *
     * @param check the check expression
     * @return the rule
     */
    public static DqRule of(Column check) {
        return new DqRule(check, null, Criticality.ERROR.getValue());
    }

    /**
     * Creates a rule.
     *
     * @param check       the check expression
     * @param name        the rule name, or {@code null}/empty to derive {@code col_<column>}
     * @param criticality {@code warn} or {@code error}; any other value is treated as {@code error}
     * @return the rule
     */
    public static DqRule of(Column check, String name, String criticality) {
        return new DqRule(check, name, criticality);
    }

    /**
     * Creates a rule with a typed criticality.
     *
     * @param check       the check expression
     * @param name        the rule name, or {@code null}/empty to derive {@code col_<column>}
     * @param criticality the criticality
     * @return the rule
     */
    public static DqRule of(Column check, String name, Criticality criticality) {
        return new DqRule(check, name, criticality.getValue());
    }

    /**
     * Returns the message expression for this rule: the check itself, or a
     * string-typed null where the check is null.
     *
     * @return the message column
     */
    public Column checkColumn() {
        return functions.when(check.isNull(), functions.lit(null).cast("string")).otherwise(check);
    }
}
