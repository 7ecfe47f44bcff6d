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

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;
import org.apache.spark.sql.Column;
import org.fireflyframework.dq.function.CheckFunction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A check function applied uniformly to a set of columns.
 *
 * <p>{@link #getRules()} produces one {@link DqRule} per column, in column order,
 * by calling the check function with the column as its first argument followed
 * by {@code checkFuncArgs} and {@code checkFuncKwargs}.</p>
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * List<DqRule> rules = DqRuleColSet.builder()
 *         .columns(List.of("a", "b"))
 *         .checkFunc(registry.resolve("is_not_null", null))
 *         .criticality("warn")
 *         .build()
 *         .getRules();
 * }</pre>
 */
@Slf4j
@Getter
@ToString
public final class DqRuleColSet {

    private final List<String> columns;
    private final CheckFunction checkFunc;
    private final String criticality;
    private final List<Object> checkFuncArgs;
    private final Map<String, Object> checkFuncKwargs;

    @Builder
    private DqRuleColSet(List<String> columns, CheckFunction checkFunc, String criticality,
                         List<Object> checkFuncArgs, Map<String, Object> checkFuncKwargs) {
        this.columns = List.copyOf(Objects.requireNonNull(columns, "columns must not be null"));
        this.checkFunc = Objects.requireNonNull(checkFunc, "checkFunc must not be null");
        this.criticality = criticality != null ? criticality : Criticality.ERROR.getValue();
        this.checkFuncArgs = checkFuncArgs != null
                ? Collections.unmodifiableList(new ArrayList<>(checkFuncArgs))
                : List.of();
        this.checkFuncKwargs = checkFuncKwargs != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(checkFuncKwargs))
                : Map.of();
    }

    /**
     * Expands this set into one rule per column. Columns for which the check
     * function yields no expression are skipped.
     *
     * @return the rules in column order
     */
    public List<DqRule> getRules() {
        List<DqRule> rules = new ArrayList<>(columns.size());
        for (String column : columns) {
            Column check = checkFunc.invokeForColumn(column, checkFuncArgs, checkFuncKwargs);
            if (check == null) {
                log.debug("Function {} produced no check for column {}, skipping", checkFunc.getName(), column);
                continue;
            }
            rules.add(DqRule.of(check, null, criticality));
        }
        return rules;
    }
}
