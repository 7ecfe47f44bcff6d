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

import lombok.extern.slf4j.Slf4j;
import org.apache.spark.sql.Column;
import org.fireflyframework.dq.function.CheckFunction;
import org.fireflyframework.dq.function.CheckFunctionRegistry;
import org.fireflyframework.dq.rule.Criticality;
import org.fireflyframework.dq.rule.DqRule;
import org.fireflyframework.dq.rule.DqRuleColSet;
import org.fireflyframework.dq.rule.RuleNames;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.fireflyframework.dq.metadata.MetadataFields.ARGUMENTS;
import static org.fireflyframework.dq.metadata.MetadataFields.CHECK;
import static org.fireflyframework.dq.metadata.MetadataFields.COL_NAMES;
import static org.fireflyframework.dq.metadata.MetadataFields.CRITICALITY;
import static org.fireflyframework.dq.metadata.MetadataFields.FUNCTION;
import static org.fireflyframework.dq.metadata.MetadataFields.NAME;

/**
 * Turns rule metadata into {@link DqRule}s.
 *
 * <p>The metadata is always validated first; any validation error aborts the
 * build with an {@link InvalidChecksException} listing every message. Entries
 * whose arguments contain {@code col_names} expand into one rule per column
 * through {@link DqRuleColSet}.</p>
 */
@Slf4j
public class ChecksBuilder {

    private final CheckFunctionRegistry registry;
    private final ChecksValidator validator;

    public ChecksBuilder(CheckFunctionRegistry registry) {
        this(registry, new ChecksValidator(registry));
    }

    public ChecksBuilder(CheckFunctionRegistry registry, ChecksValidator validator) {
        this.registry = registry;
        this.validator = validator;
    }

    /**
     * Builds rules from metadata using the built-in functions.
     *
     * @param checks the rule metadata entries
     * @return the rules, in metadata order
     * @throws InvalidChecksException if the metadata is invalid
     */
    public List<DqRule> build(List<Map<String, Object>> checks) {
        return build(checks, null);
    }

    /**
     * Builds rules from metadata.
     *
     * @param checks    the rule metadata entries
     * @param overrides functions to resolve names against instead of the built-ins, or {@code null}
     * @return the rules, in metadata order
     * @throws InvalidChecksException if the metadata is invalid or yields duplicate rule names
     */
    public List<DqRule> build(List<Map<String, Object>> checks, Map<String, CheckFunction> overrides) {
        ChecksValidationStatus status = validator.validate(checks, overrides);
        if (status.hasErrors()) {
            throw new InvalidChecksException(status.toString(), status.getErrors());
        }

        List<DqRule> rules = new ArrayList<>();
        for (Map<String, Object> checkDef : checks) {
            log.debug("Processing check definition: {}", checkDef);
            Map<String, Object> check = asMap(checkDef.get(CHECK));
            CheckFunction function = registry.resolve((String) check.get(FUNCTION), overrides);
            Map<String, Object> arguments = check.containsKey(ARGUMENTS) ? asMap(check.get(ARGUMENTS)) : Map.of();
            String criticality = checkDef.containsKey(CRITICALITY)
                    ? (String) checkDef.get(CRITICALITY)
                    : Criticality.ERROR.getValue();

            if (arguments.containsKey(COL_NAMES)) {
                List<String> columns = ((List<?>) arguments.get(COL_NAMES)).stream()
                        .map(String.class::cast)
                        .toList();
                log.debug("Adding DqRuleColSet with columns: {}", columns);

                Map<String, Object> sharedArguments = new LinkedHashMap<>(arguments);
                sharedArguments.remove(COL_NAMES);
                rules.addAll(DqRuleColSet.builder()
                        .columns(columns)
                        .checkFunc(function)
                        .criticality(criticality)
                        .checkFuncKwargs(sharedArguments)
                        .build()
                        .getRules());
            } else {
                Column expression = function.invoke(arguments);
                if (expression == null) {
                    log.warn("Function '{}' produced no check expression, skipping: {}", function.getName(), checkDef);
                    continue;
                }
                rules.add(DqRule.of(expression, (String) checkDef.get(NAME), criticality));
            }
        }

        Map<Criticality, Set<String>> duplicates = RuleNames.findDuplicates(rules);
        if (!duplicates.isEmpty()) {
            List<String> errors = RuleNames.describe(duplicates);
            throw new InvalidChecksException(String.join("\n", errors), errors);
        }

        log.debug("Built {} rules from {} check definitions", rules.size(), checks.size());
        return rules;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        return (Map<String, Object>) value;
    }
}
