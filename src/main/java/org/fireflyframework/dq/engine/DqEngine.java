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

package org.fireflyframework.dq.engine;

import lombok.extern.slf4j.Slf4j;
import org.apache.spark.sql.Column;
import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.apache.spark.sql.functions;
import org.fireflyframework.dq.config.DqColumns;
import org.fireflyframework.dq.event.DataQualityEvent;
import org.fireflyframework.dq.function.CheckFunction;
import org.fireflyframework.dq.function.CheckFunctionRegistry;
import org.fireflyframework.dq.metadata.ChecksBuilder;
import org.fireflyframework.dq.metadata.ChecksValidationStatus;
import org.fireflyframework.dq.metadata.ChecksValidator;
import org.fireflyframework.dq.rule.Criticality;
import org.fireflyframework.dq.rule.DqRule;
import org.fireflyframework.dq.rule.DqRuleColSet;
import org.fireflyframework.dq.rule.RuleNames;
import org.springframework.context.ApplicationEventPublisher;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Engine that applies {@link DqRule}s to a Spark dataset.
 *
 * <p>Applying checks adds two diagnostic columns (see {@link DqColumns}). For
 * each row, the errors column holds a map from rule name to message for every
 * failed {@code error} rule, and the warnings column does the same for
 * {@code warn} rules. A column is {@code null} on rows where no rule of its
 * criticality failed. The engine only composes column expressions; Spark
 * evaluates them lazily and in parallel.</p>
 *
 * <p>Checked datasets can be split into a valid partition (no errors) and an
 * invalid partition (errors or warnings). Rows with warnings only appear in
 * both.</p>
 *
 * <p>When an {@link ApplicationEventPublisher} is provided, a {@link DataQualityEvent}
 * is published each time checks are applied.</p>
 */
@Slf4j
public class DqEngine {

    private static final String EMPTY_RESULTS_TYPE = "map<string,string>";

    private final DqColumns columns;
    private final ChecksValidator validator;
    private final ChecksBuilder builder;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * Creates an engine with the built-in check functions, the default diagnostic
     * columns and no event publishing.
     */
    public DqEngine() {
        this(DqColumns.defaults(), new CheckFunctionRegistry());
    }

    /**
     * Creates an engine with the given columns and registry and no event publishing.
     *
     * @param columns  the diagnostic column names
     * @param registry the check function registry
     */
    public DqEngine(DqColumns columns, CheckFunctionRegistry registry) {
        this(columns, new ChecksValidator(registry), new ChecksBuilder(registry), null);
    }

    /**
     * Creates a fully configured engine.
     *
     * @param columns        the diagnostic column names
     * @param validator      the metadata validator
     * @param builder        the metadata builder
     * @param eventPublisher the event publisher, or {@code null} to disable event publishing
     */
    public DqEngine(DqColumns columns, ChecksValidator validator, ChecksBuilder builder,
                    ApplicationEventPublisher eventPublisher) {
        this.columns = columns;
        this.validator = validator;
        this.builder = builder;
        this.eventPublisher = eventPublisher;
    }

    public DqColumns getColumns() {
        return columns;
    }

    /**
     * Applies checks to a dataset.
     *
     * @param df     the dataset to check
     * @param checks the rules to apply
     * @return the dataset with the errors and warnings columns added
     * @throws IllegalArgumentException if two rules of the same criticality share a name
     */
    public Dataset<Row> applyChecks(Dataset<Row> df, List<DqRule> checks) {
        if (checks.isEmpty()) {
            return appendEmptyChecks(df);
        }

        Map<Criticality, Set<String>> duplicates = RuleNames.findDuplicates(checks);
        if (!duplicates.isEmpty()) {
            throw new IllegalArgumentException(String.join("; ", RuleNames.describe(duplicates)));
        }

        List<DqRule> errorChecks = checksFor(checks, Criticality.ERROR);
        List<DqRule> warningChecks = checksFor(checks, Criticality.WARN);
        log.debug("Applying {} error and {} warning checks", errorChecks.size(), warningChecks.size());

        Dataset<Row> checked = createResultsMap(df, errorChecks, columns.errors());
        checked = createResultsMap(checked, warningChecks, columns.warnings());

        publishEvent(errorChecks.size(), warningChecks.size());
        return checked;
    }

    /**
     * Applies checks and splits the result into valid and invalid rows.
     *
     * @param df     the dataset to check
     * @param checks the rules to apply
     * @return the valid and invalid partitions; with no checks, the input and an empty invalid dataset
     */
    public SplitResult applyChecksAndSplit(Dataset<Row> df, List<DqRule> checks) {
        if (checks.isEmpty()) {
            return new SplitResult(df, appendEmptyChecks(df).limit(0));
        }

        Dataset<Row> checked = applyChecks(df, checks);
        return new SplitResult(getValid(checked), getInvalid(checked));
    }

    /**
     * Returns rows that violate at least one rule, errors or warnings.
     *
     * @param df a dataset returned by {@link #applyChecks(Dataset, List)}
     * @return the invalid rows with their diagnostic columns
     */
    public Dataset<Row> getInvalid(Dataset<Row> df) {
        return df.where(functions.col(columns.errors()).isNotNull()
                .or(functions.col(columns.warnings()).isNotNull()));
    }

    /**
     * Returns rows without errors. Rows with warnings only are included.
     *
     * @param df a dataset returned by {@link #applyChecks(Dataset, List)}
     * @return the valid rows without the diagnostic columns
     */
    public Dataset<Row> getValid(Dataset<Row> df) {
        return df.where(functions.col(columns.errors()).isNull())
                .drop(columns.errors(), columns.warnings());
    }

    public ChecksValidationStatus validateChecks(List<?> checks) {
        return validator.validate(checks, null);
    }

    public ChecksValidationStatus validateChecks(List<?> checks, Map<String, CheckFunction> overrides) {
        return validator.validate(checks, overrides);
    }

    public List<DqRule> buildChecksByMetadata(List<Map<String, Object>> checks) {
        return builder.build(checks, null);
    }

    public List<DqRule> buildChecksByMetadata(List<Map<String, Object>> checks,
                                              Map<String, CheckFunction> overrides) {
        return builder.build(checks, overrides);
    }

    /**
     * Builds rules from metadata and applies them.
     *
     * @param df        the dataset to check
     * @param checks    the rule metadata entries
     * @param overrides functions to resolve names against instead of the built-ins, or {@code null}
     * @return the dataset with the errors and warnings columns added
     * @throws org.fireflyframework.dq.metadata.InvalidChecksException if the metadata is invalid
     */
    public Dataset<Row> applyChecksByMetadata(Dataset<Row> df, List<Map<String, Object>> checks,
                                              Map<String, CheckFunction> overrides) {
        return applyChecks(df, builder.build(checks, overrides));
    }

    public Dataset<Row> applyChecksByMetadata(Dataset<Row> df, List<Map<String, Object>> checks) {
        return applyChecksByMetadata(df, checks, null);
    }

    /**
     * Builds rules from metadata, applies them and splits the result.
     *
     * @param df        the dataset to check
     * @param checks    the rule metadata entries
     * @param overrides functions to resolve names against instead of the built-ins, or {@code null}
     * @return the valid and invalid partitions
     * @throws org.fireflyframework.dq.metadata.InvalidChecksException if the metadata is invalid
     */
    public SplitResult applyChecksByMetadataAndSplit(Dataset<Row> df, List<Map<String, Object>> checks,
                                                     Map<String, CheckFunction> overrides) {
        return applyChecksAndSplit(df, builder.build(checks, overrides));
    }

    public SplitResult applyChecksByMetadataAndSplit(Dataset<Row> df, List<Map<String, Object>> checks) {
        return applyChecksByMetadataAndSplit(df, checks, null);
    }

    /**
     * Flattens rule sets into rules.
     *
     * @param ruleSets rule sets, each defining one check for several columns
     * @return the rules of all sets, in order
     */
    public static List<DqRule> buildChecks(DqRuleColSet... ruleSets) {
        List<DqRule> rules = new ArrayList<>();
        for (DqRuleColSet ruleSet : ruleSets) {
            rules.addAll(ruleSet.getRules());
        }
        return rules;
    }

    private Dataset<Row> appendEmptyChecks(Dataset<Row> df) {
        return df.withColumn(columns.errors(), emptyResults())
                .withColumn(columns.warnings(), emptyResults());
    }

    private static List<DqRule> checksFor(List<DqRule> checks, Criticality criticality) {
        return checks.stream()
                .filter(check -> check.getRuleCriticality() == criticality)
                .toList();
    }

    private static Dataset<Row> createResultsMap(Dataset<Row> df, List<DqRule> checks, String destination) {
        if (checks.isEmpty()) {
            return df.withColumn(destination, emptyResults());
        }

        Column[] entries = checks.stream()
                .map(check -> {
                    Column message = check.checkColumn();
                    return functions.when(message.isNotNull(), functions.struct(
                            functions.lit(check.getName()).alias("key"),
                            message.alias("value")));
                })
                .toArray(Column[]::new);

        // entries of passing rules are null and dropped before building the map
        Column results = functions.map_from_entries(functions.array_compact(functions.array(entries)));
        return df.withColumn(destination,
                functions.when(functions.size(results).gt(0), results).otherwise(emptyResults()));
    }

    private static Column emptyResults() {
        return functions.lit(null).cast(EMPTY_RESULTS_TYPE);
    }

    private void publishEvent(int errorRules, int warningRules) {
        if (eventPublisher != null) {
            eventPublisher.publishEvent(
                    new DataQualityEvent(errorRules, warningRules, columns.errors(), columns.warnings()));
        }
    }
}
