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
import org.fireflyframework.dq.function.CheckFunction;
import org.fireflyframework.dq.function.CheckFunctionRegistry;
import org.fireflyframework.dq.function.CheckParameter;
import org.fireflyframework.dq.rule.Criticality;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.fireflyframework.dq.metadata.MetadataFields.ARGUMENTS;
import static org.fireflyframework.dq.metadata.MetadataFields.CHECK;
import static org.fireflyframework.dq.metadata.MetadataFields.COL_NAME;
import static org.fireflyframework.dq.metadata.MetadataFields.COL_NAMES;
import static org.fireflyframework.dq.metadata.MetadataFields.CRITICALITY;
import static org.fireflyframework.dq.metadata.MetadataFields.FUNCTION;
import static org.fireflyframework.dq.metadata.MetadataFields.NAME;

/**
 * Validates rule metadata against the structure of the schema and the
 * parameters of the referenced check functions.
 *
 * <p>Validation never throws. Every problem of every check is collected into
 * the returned {@link ChecksValidationStatus}, so callers see all defects at
 * once. A structural problem that prevents resolving a check's function stops
 * further checks of that one entry only.</p>
 */
@Slf4j
public class ChecksValidator {

    private final CheckFunctionRegistry registry;

    public ChecksValidator(CheckFunctionRegistry registry) {
        this.registry = registry;
    }

    /**
     * Validates checks against the built-in functions.
     *
     * @param checks the rule metadata entries
     * @return the validation status
     */
    public ChecksValidationStatus validate(List<?> checks) {
        return validate(checks, null);
    }

    /**
     * Validates checks.
     *
     * @param checks    the rule metadata entries
     * @param overrides functions to resolve names against instead of the built-ins, or {@code null}
     * @return the validation status
     */
    public ChecksValidationStatus validate(List<?> checks, Map<String, CheckFunction> overrides) {
        ChecksValidationStatus status = new ChecksValidationStatus();

        for (Object check : checks) {
            log.debug("Processing check definition: {}", check);
            if (check instanceof Map<?, ?> checkMap) {
                status.addErrors(validateCheck(checkMap, overrides));
            } else {
                status.addError("Unsupported check type: " + typeName(check));
            }
        }

        return status;
    }

    private List<String> validateCheck(Map<?, ?> check, Map<String, CheckFunction> overrides) {
        List<String> errors = new ArrayList<>();

        if (check.containsKey(CRITICALITY) && !Criticality.isValid(check.get(CRITICALITY))) {
            errors.add("Invalid value for 'criticality' field: " + check);
        }
        if (check.containsKey(NAME) && !(check.get(NAME) instanceof String)) {
            errors.add("'name' field should be a string: " + check);
        }

        if (!check.containsKey(CHECK)) {
            errors.add("'check' field is missing: " + check);
        } else if (!(check.get(CHECK) instanceof Map<?, ?> block)) {
            errors.add("'check' field should be a map: " + check);
        } else {
            errors.addAll(validateCheckBlock(block, check, overrides));
        }

        return errors;
    }

    private List<String> validateCheckBlock(Map<?, ?> block, Map<?, ?> check, Map<String, CheckFunction> overrides) {
        if (!block.containsKey(FUNCTION)) {
            return List.of("'function' field is missing in the 'check' block: " + check);
        }
        if (!(block.get(FUNCTION) instanceof String functionName)) {
            return List.of("'function' field should be a string in the 'check' block: " + check);
        }

        Optional<CheckFunction> function = registry.find(functionName, overrides);
        if (function.isEmpty()) {
            return List.of("function '" + functionName + "' is not defined: " + check);
        }

        Object arguments = block.containsKey(ARGUMENTS) ? block.get(ARGUMENTS) : Map.of();
        return validateArguments(arguments, function.get(), check);
    }

    private List<String> validateArguments(Object arguments, CheckFunction function, Map<?, ?> check) {
        if (!(arguments instanceof Map<?, ?> argumentMap)) {
            return List.of("'arguments' should be a map in the 'check' block: " + check);
        }
        if (!argumentMap.containsKey(COL_NAMES)) {
            return validateFunctionArguments(argumentMap, function, check);
        }

        if (!(argumentMap.get(COL_NAMES) instanceof List<?> columns)) {
            return List.of("'col_names' should be a list in the 'arguments' block: " + check);
        }
        if (columns.isEmpty()) {
            return List.of("'col_names' should not be empty in the 'arguments' block: " + check);
        }
        if (!columns.stream().allMatch(String.class::isInstance)) {
            return List.of("'col_names' should contain only strings in the 'arguments' block: " + check);
        }

        // every column expands with the same arguments, so the first one stands for all
        Map<Object, Object> representative = new LinkedHashMap<>();
        argumentMap.forEach((argument, value) -> {
            if (COL_NAMES.equals(argument)) {
                representative.put(COL_NAME, columns.get(0));
            } else {
                representative.put(argument, value);
            }
        });
        return validateFunctionArguments(representative, function, check);
    }

    private List<String> validateFunctionArguments(Map<?, ?> arguments, CheckFunction function, Map<?, ?> check) {
        List<String> errors = new ArrayList<>();
        List<String> expected = function.getParameterNames();

        if (arguments.isEmpty() && !expected.isEmpty()) {
            errors.add("No arguments provided for function '" + function.getName()
                    + "' in the 'arguments' block: " + check + ". Expected arguments are: " + expected);
        }

        arguments.forEach((argument, value) -> {
            Optional<CheckParameter> parameter = argument instanceof String argumentName
                    ? function.findParameter(argumentName)
                    : Optional.empty();
            if (parameter.isEmpty()) {
                errors.add("Unexpected argument '" + argument + "' for function '" + function.getName()
                        + "' in the 'arguments' block: " + check + ". Expected arguments are: " + expected);
            } else if (!parameter.get().accepts(value)) {
                errors.add("Argument '" + argument + "' should be of type '" + parameter.get().typeName()
                        + "' for function '" + function.getName() + "' in the 'arguments' block: " + check);
            }
        });

        if (!arguments.isEmpty()) {
            for (CheckParameter parameter : function.getParameters()) {
                if (parameter.required() && !arguments.containsKey(parameter.name())) {
                    errors.add("Missing argument '" + parameter.name() + "' for function '" + function.getName()
                            + "' in the 'arguments' block: " + check);
                }
            }
        }

        return errors;
    }

    private static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getName();
    }
}
