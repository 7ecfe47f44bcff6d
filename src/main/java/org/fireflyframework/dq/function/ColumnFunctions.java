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
import org.fireflyframework.dq.rule.ColumnNames;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Built-in check functions.
 *
 * <p>Every function returns a string-typed expression that evaluates to a
 * violation message, or to {@code null} for rows that pass. Column-based checks
 * are aliased {@code <column>_<function name>}, which rule names default to.</p>
 */
public final class ColumnFunctions {

    private ColumnFunctions() {}

    /**
     * Wraps a failure condition into a message expression.
     *
     * @param condition the condition that is true for violating rows
     * @param message   the message for violating rows
     * @param alias     the name of the resulting expression
     * @return the aliased message expression
     */
    public static Column makeCondition(Column condition, Column message, String alias) {
        return functions.when(condition, message)
                .otherwise(functions.lit(null).cast("string"))
                .alias(ColumnNames.toAlias(alias));
    }

    @DqCheck("is_not_null")
    public static Column isNotNull(@DqArg("col_name") String colName) {
        Column column = functions.col(colName);
        return makeCondition(column.isNull(),
                functions.lit("Column " + colName + " is null"),
                colName + "_is_not_null");
    }

    @DqCheck("is_not_empty")
    public static Column isNotEmpty(@DqArg("col_name") String colName) {
        Column column = functions.col(colName);
        return makeCondition(column.cast("string").equalTo(functions.lit("")),
                functions.lit("Column " + colName + " is empty"),
                colName + "_is_not_empty");
    }

    @DqCheck("is_not_null_and_not_empty")
    public static Column isNotNullAndNotEmpty(@DqArg("col_name") String colName,
                                              @DqArg(value = "trim_strings", required = false) Boolean trimStrings) {
        Column column = functions.col(colName).cast("string");
        if (Boolean.TRUE.equals(trimStrings)) {
            column = functions.trim(column);
        }
        return makeCondition(column.isNull().or(column.equalTo(functions.lit(""))),
                functions.lit("Column " + colName + " is null or empty"),
                colName + "_is_not_null_and_not_empty");
    }

    @DqCheck("value_is_in_list")
    public static Column valueIsInList(@DqArg("col_name") String colName,
                                       @DqArg("allowed") List<?> allowed) {
        Column column = functions.col(colName);
        return makeCondition(functions.not(column.isin(allowed.toArray())),
                notInListMessage(column, allowed),
                colName + "_value_is_in_list");
    }

    @DqCheck("value_is_not_null_and_is_in_list")
    public static Column valueIsNotNullAndIsInList(@DqArg("col_name") String colName,
                                                   @DqArg("allowed") List<?> allowed) {
        Column column = functions.col(colName);
        return makeCondition(column.isNull().or(functions.not(column.isin(allowed.toArray()))),
                notInListMessage(column, allowed),
                colName + "_value_is_not_null_and_is_in_list");
    }

    @DqCheck("is_in_range")
    public static Column isInRange(@DqArg("col_name") String colName,
                                   @DqArg("min_limit") Number minLimit,
                                   @DqArg("max_limit") Number maxLimit) {
        Column column = functions.col(colName);
        return makeCondition(column.lt(minLimit).or(column.gt(maxLimit)),
                valueMessage(column, " not in range: [" + minLimit + ", " + maxLimit + "]"),
                colName + "_is_in_range");
    }

    @DqCheck("is_not_in_range")
    public static Column isNotInRange(@DqArg("col_name") String colName,
                                      @DqArg("min_limit") Number minLimit,
                                      @DqArg("max_limit") Number maxLimit) {
        Column column = functions.col(colName);
        return makeCondition(column.geq(minLimit).and(column.leq(maxLimit)),
                valueMessage(column, " in range: [" + minLimit + ", " + maxLimit + "]"),
                colName + "_is_not_in_range");
    }

    @DqCheck("is_not_less_than")
    public static Column isNotLessThan(@DqArg("col_name") String colName,
                                       @DqArg("limit") Number limit) {
        Column column = functions.col(colName);
        return makeCondition(column.lt(limit),
                valueMessage(column, " is less than limit: " + limit),
                colName + "_is_not_less_than");
    }

    @DqCheck("is_not_greater_than")
    public static Column isNotGreaterThan(@DqArg("col_name") String colName,
                                          @DqArg("limit") Number limit) {
        Column column = functions.col(colName);
        return makeCondition(column.gt(limit),
                valueMessage(column, " is greater than limit: " + limit),
                colName + "_is_not_greater_than");
    }

    @DqCheck("regex_match")
    public static Column regexMatch(@DqArg("col_name") String colName,
                                    @DqArg("regex") String regex,
                                    @DqArg(value = "negate", required = false) Boolean negate) {
        Column column = functions.col(colName);
        if (Boolean.TRUE.equals(negate)) {
            return makeCondition(column.rlike(regex),
                    functions.lit("Column " + colName + " is matching regex"),
                    colName + "_regex_match");
        }
        return makeCondition(functions.not(column.rlike(regex)),
                functions.lit("Column " + colName + " is not matching regex"),
                colName + "_regex_match");
    }

    @DqCheck("is_not_in_future")
    public static Column isNotInFuture(@DqArg("col_name") String colName,
                                       @DqArg(value = "offset", required = false) Integer offset,
                                       @DqArg(value = "curr_timestamp", required = false) String currTimestamp) {
        Column column = functions.col(colName).cast("timestamp");
        Column threshold = shiftSeconds(currentTimestamp(currTimestamp), offset);
        return makeCondition(column.gt(threshold),
                functions.concat_ws("",
                        functions.lit("Value '"), column.cast("string"),
                        functions.lit("' is greater than time '"), threshold.cast("string"),
                        functions.lit("'")),
                colName + "_is_not_in_future");
    }

    @DqCheck("is_not_in_near_future")
    public static Column isNotInNearFuture(@DqArg("col_name") String colName,
                                           @DqArg(value = "offset", required = false) Integer offset,
                                           @DqArg(value = "curr_timestamp", required = false) String currTimestamp) {
        Column column = functions.col(colName).cast("timestamp");
        Column now = currentTimestamp(currTimestamp);
        Column threshold = shiftSeconds(now, offset);
        return makeCondition(column.gt(now).and(column.lt(threshold)),
                functions.concat_ws("",
                        functions.lit("Value '"), column.cast("string"),
                        functions.lit("' is greater than '"), now.cast("string"),
                        functions.lit("' and smaller than '"), threshold.cast("string"),
                        functions.lit("'")),
                colName + "_is_not_in_near_future");
    }

    @DqCheck("is_older_than_n_days")
    public static Column isOlderThanNDays(@DqArg("col_name") String colName,
                                          @DqArg("days") int days,
                                          @DqArg(value = "curr_date", required = false) String currDate) {
        Column column = functions.col(colName);
        Column today = currDate == null ? functions.current_date() : functions.to_date(functions.lit(currDate));
        return makeCondition(functions.datediff(today, column).gt(days),
                functions.concat_ws("",
                        functions.lit("Value of " + colName + ": '"), column.cast("string"),
                        functions.lit("', less than current date: '"), today.cast("string"),
                        functions.lit("' for more than " + days + " days")),
                colName + "_is_older_than_n_days");
    }

    @DqCheck("is_valid_date")
    public static Column isValidDate(@DqArg("col_name") String colName,
                                     @DqArg(value = "date_format", required = false) String dateFormat) {
        Column column = functions.col(colName);
        Column parsed = dateFormat == null ? functions.to_date(column) : functions.to_date(column, dateFormat);
        String formatHint = dateFormat == null ? "" : " with format '" + dateFormat + "'";
        return makeCondition(column.isNotNull().and(parsed.isNull()),
                valueMessage(column, " is not a valid date" + formatHint),
                colName + "_is_valid_date");
    }

    /**
     * Checks an arbitrary SQL predicate that valid rows satisfy.
     *
     * @param expression the SQL predicate
     * @param msg        the message for violating rows; defaults to one quoting the expression
     * @param name       the alias; defaults to the expression with non-word characters replaced
     * @param negate     when true, rows satisfying the expression are the violating ones
     * @return the message expression
     */
    @DqCheck("sql_expression")
    public static Column sqlExpression(@DqArg("expression") String expression,
                                       @DqArg(value = "msg", required = false) String msg,
                                       @DqArg(value = "name", required = false) String name,
                                       @DqArg(value = "negate", required = false) Boolean negate) {
        Column predicate = functions.expr(expression);
        String alias = name != null ? name : expression;
        if (Boolean.TRUE.equals(negate)) {
            return makeCondition(predicate,
                    functions.lit(msg != null ? msg : "Value matches expression: ~(" + expression + ")"),
                    alias);
        }
        return makeCondition(functions.not(predicate),
                functions.lit(msg != null ? msg : "Value is not matching expression: " + expression),
                alias);
    }

    private static Column valueMessage(Column column, String suffix) {
        return functions.concat_ws("",
                functions.lit("Value "),
                functions.coalesce(column.cast("string"), functions.lit("null")),
                functions.lit(suffix));
    }

    private static Column notInListMessage(Column column, List<?> allowed) {
        String joined = allowed.stream().map(String::valueOf).collect(Collectors.joining(", "));
        return valueMessage(column, " is not in the allowed list: [" + joined + "]");
    }

    private static Column currentTimestamp(String currTimestamp) {
        return currTimestamp == null
                ? functions.current_timestamp()
                : functions.lit(currTimestamp).cast("timestamp");
    }

    private static Column shiftSeconds(Column timestamp, Integer offset) {
        int seconds = offset == null ? 0 : offset;
        return functions.timestamp_seconds(functions.unix_timestamp(timestamp).plus(seconds));
    }
}
