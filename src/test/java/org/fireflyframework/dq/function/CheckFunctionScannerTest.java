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
import org.apache.spark.sql.functions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link CheckFunctionScanner}.
 */
class CheckFunctionScannerTest {

    public static final class TaxiChecks {

        @DqCheck("is_positive")
        public static Column isPositive(@DqArg("col_name") String colName) {
            return functions.when(functions.col(colName).leq(0), functions.lit(colName + " is not positive"))
                    .alias(colName + "_is_positive");
        }

        @DqCheck("max_trips")
        public static Column maxTrips(@DqArg("col_name") String colName,
                                      @DqArg("limit") int limit,
                                      @DqArg(value = "zones", required = false) List<String> zones) {
            return functions.when(functions.col(colName).gt(limit), functions.lit("too many trips"));
        }

        public static Column notACheck(String colName) {
            return functions.col(colName);
        }
    }

    public static final class InstanceChecks {

        @DqCheck("instance")
        public Column instance(@DqArg("col_name") String colName) {
            return functions.col(colName);
        }
    }

    public static final class UnnamedChecks {

        @DqCheck("unnamed")
        public static Column unnamed(String colName) {
            return functions.col(colName);
        }
    }

    public static final class PrimitiveOptionalChecks {

        @DqCheck("primitive")
        public static Column primitive(@DqArg("col_name") String colName,
                                       @DqArg(value = "days", required = false) int days) {
            return functions.col(colName);
        }
    }

    @Test
    void scan_shouldDescribeAnnotatedMethodsOnly() {
        // When
        Map<String, CheckFunction> catalog = CheckFunctionScanner.scan(TaxiChecks.class);

        // Then
        assertThat(catalog).containsOnlyKeys("is_positive", "max_trips");
        CheckFunction maxTrips = catalog.get("max_trips");
        assertThat(maxTrips.getParameterNames()).containsExactly("col_name", "limit", "zones");
        assertThat(maxTrips.getParameters())
                .extracting(CheckParameter::type)
                .containsExactly(String.class, Integer.class, List.class);
        assertThat(maxTrips.findParameter("zones")).hasValueSatisfying(p -> assertThat(p.required()).isFalse());
    }

    @Test
    void scan_shouldCacheCatalogPerClass() {
        assertThat(CheckFunctionScanner.scan(TaxiChecks.class))
                .isSameAs(CheckFunctionScanner.scan(TaxiChecks.class));
    }

    @Test
    void scannedFunction_shouldInvokeMethodWithNamedArguments() {
        // Given
        CheckFunction isPositive = CheckFunctionScanner.scan(TaxiChecks.class).get("is_positive");

        // When
        Column check = isPositive.invoke(Map.of("col_name", "passenger_count"));

        // Then
        assertThat(check.toString()).endsWith("AS passenger_count_is_positive");
    }

    @Test
    void scannedFunction_shouldPassNullForAbsentOptionalArgument() {
        CheckFunction maxTrips = CheckFunctionScanner.scan(TaxiChecks.class).get("max_trips");

        assertThat(maxTrips.invoke(Map.of("col_name", "trips", "limit", 10))).isNotNull();
    }

    @Test
    void scan_shouldRejectInstanceMethods() {
        assertThatThrownBy(() -> CheckFunctionScanner.scan(InstanceChecks.class))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("public static method returning Column");
    }

    @Test
    void scan_shouldRejectParametersWithoutName() {
        assertThatThrownBy(() -> CheckFunctionScanner.scan(UnnamedChecks.class))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("lacks @DqArg");
    }

    @Test
    void scan_shouldRejectPrimitiveOptionalParameters() {
        assertThatThrownBy(() -> CheckFunctionScanner.scan(PrimitiveOptionalChecks.class))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must not be primitive");
    }
}
