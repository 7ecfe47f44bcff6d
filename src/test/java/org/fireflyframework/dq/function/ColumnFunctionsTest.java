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

package org.fireflyframework.dq.function;

import org.apache.spark.sql.Column;
import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.apache.spark.sql.RowFactory;
import org.apache.spark.sql.types.DataTypes;
import org.apache.spark.sql.types.StructType;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.fireflyframework.dq.support.SparkTestSupport.dataset;

/**
 * Evaluates the built-in {@link ColumnFunctions} on a small dataset.
 */
class ColumnFunctionsTest {

    private static Dataset<Row> trips;

    @BeforeAll
    static void setUp() {
        StructType schema = new StructType()
                .add("vendor_id", DataTypes.StringType)
                .add("fare", DataTypes.IntegerType)
                .add("pickup_date", DataTypes.StringType);

        trips = dataset(schema,
                RowFactory.create("1", 10, "2024-01-01"),
                RowFactory.create("  ", 500, "2024-03-01"),
                RowFactory.create(null, -5, "not-a-date"));
    }

    private static List<String> evaluate(Column check) {
        return trips.select(check).collectAsList().stream()
                .map(row -> row.isNullAt(0) ? null : row.getString(0))
                .toList();
    }

    @Test
    void isNotNull_shouldReportNullValues() {
        assertThat(evaluate(ColumnFunctions.isNotNull("vendor_id")))
                .containsExactly(null, null, "Column vendor_id is null");
    }

    @Test
    void isNotNullAndNotEmpty_withTrim_shouldReportBlankValues() {
        assertThat(evaluate(ColumnFunctions.isNotNullAndNotEmpty("vendor_id", true)))
                .containsExactly(null, "Column vendor_id is null or empty", "Column vendor_id is null or empty");
    }

    @Test
    void isNotNullAndNotEmpty_withoutTrim_shouldKeepBlankValues() {
        assertThat(evaluate(ColumnFunctions.isNotNullAndNotEmpty("vendor_id", null)))
                .containsExactly(null, null, "Column vendor_id is null or empty");
    }

    @Test
    void valueIsInList_shouldLetNullsPass() {
        assertThat(evaluate(ColumnFunctions.valueIsInList("vendor_id", List.of("1", "2"))))
                .containsExactly(null, "Value    is not in the allowed list: [1, 2]", null);
    }

    @Test
    void valueIsNotNullAndIsInList_shouldReportNulls() {
        assertThat(evaluate(ColumnFunctions.valueIsNotNullAndIsInList("vendor_id", List.of("1", "2"))))
                .containsExactly(null,
                        "Value    is not in the allowed list: [1, 2]",
                        "Value null is not in the allowed list: [1, 2]");
    }

    @Test
    void isInRange_shouldReportValuesOutsideLimits() {
        assertThat(evaluate(ColumnFunctions.isInRange("fare", 0, 100)))
                .containsExactly(null, "Value 500 not in range: [0, 100]", "Value -5 not in range: [0, 100]");
    }

    @Test
    void isNotInRange_shouldReportValuesInsideLimits() {
        assertThat(evaluate(ColumnFunctions.isNotInRange("fare", 0, 100)))
                .containsExactly("Value 10 in range: [0, 100]", null, null);
    }

    @Test
    void limits_shouldReportValuesBeyondLimit() {
        assertThat(evaluate(ColumnFunctions.isNotLessThan("fare", 0)))
                .containsExactly(null, null, "Value -5 is less than limit: 0");
        assertThat(evaluate(ColumnFunctions.isNotGreaterThan("fare", 100)))
                .containsExactly(null, "Value 500 is greater than limit: 100", null);
    }

    @Test
    void regexMatch_shouldReportNonMatchingValues() {
        assertThat(evaluate(ColumnFunctions.regexMatch("vendor_id", "^[0-9]+$", null)))
                .containsExactly(null, "Column vendor_id is not matching regex", null);
        assertThat(evaluate(ColumnFunctions.regexMatch("vendor_id", "^[0-9]+$", true)))
                .containsExactly("Column vendor_id is matching regex", null, null);
    }

    @Test
    void isValidDate_shouldReportUnparseableValues() {
        assertThat(evaluate(ColumnFunctions.isValidDate("pickup_date", null)))
                .containsExactly(null, null, "Value not-a-date is not a valid date");
    }

    @Test
    void isOlderThanNDays_shouldCompareAgainstGivenDate() {
        assertThat(evaluate(ColumnFunctions.isOlderThanNDays("pickup_date", 30, "2024-03-15")))
                .containsExactly(
                        "Value of pickup_date: '2024-01-01', less than current date: '2024-03-15' for more than 30 days",
                        null,
                        null);
    }

    @Test
    void isNotInFuture_shouldReportLaterTimestamps() {
        List<String> results = evaluate(ColumnFunctions.isNotInFuture("pickup_date", 0, "2024-02-01 00:00:00"));

        assertThat(results.get(0)).isNull();
        assertThat(results.get(1)).startsWith("Value '2024-03-01 00:00:00' is greater than time '2024-02-01");
        assertThat(results.get(2)).isNull();
    }

    @Test
    void sqlExpression_shouldReportRowsNotMatching() {
        assertThat(evaluate(ColumnFunctions.sqlExpression("fare > 0", null, "fare_positive", null)))
                .containsExactly(null, null, "Value is not matching expression: fare > 0");
        assertThat(evaluate(ColumnFunctions.sqlExpression("fare > 100", "too expensive", null, true)))
                .containsExactly(null, "too expensive", null);
    }

    @Test
    void sqlExpression_shouldDeriveAliasFromExpression() {
        assertThat(ColumnFunctions.sqlExpression("fare > 0", null, null, null).toString())
                .endsWith("AS fare___0");
    }
}
