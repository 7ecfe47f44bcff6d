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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Descriptor of a check function: its metadata name, its parameters and the
 * body that builds the check expression from named arguments.
 *
 * <p>Descriptors are built once, either programmatically through
 * {@link #builder(String)} or from annotated methods by {@link CheckFunctionScanner},
 * so validating arguments against a function is a table lookup.</p>
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * CheckFunction isPositive = CheckFunction.builder("is_positive")
 *         .parameter("col_name", String.class)
 *         .build(args -> {
 *             Column column = functions.col((String) args.get("col_name"));
 *             return functions.when(column.leq(0), functions.lit("not positive"));
 *         });
 * }</pre>
 */
public final class CheckFunction {

    private final String name;
    private final List<CheckParameter> parameters;
    private final Map<String, CheckParameter> parametersByName;
    private final Function<Map<String, Object>, Column> body;

    private CheckFunction(String name, List<CheckParameter> parameters,
                          Function<Map<String, Object>, Column> body) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.parameters = List.copyOf(parameters);
        this.body = Objects.requireNonNull(body, "body must not be null");

        Map<String, CheckParameter> byName = new LinkedHashMap<>();
        for (CheckParameter parameter : this.parameters) {
            if (byName.put(parameter.name(), parameter) != null) {
                throw new IllegalArgumentException(
                        "Duplicate parameter '" + parameter.name() + "' for function '" + name + "'");
            }
        }
        this.parametersByName = Collections.unmodifiableMap(byName);
    }

    public String getName() {
        return name;
    }

    public List<CheckParameter> getParameters() {
        return parameters;
    }

    /**
     * Returns the parameter names in declaration order.
     *
     * @return the parameter names
     */
    public List<String> getParameterNames() {
        return List.copyOf(parametersByName.keySet());
    }

    public Optional<CheckParameter> findParameter(String parameterName) {
        return Optional.ofNullable(parametersByName.get(parameterName));
    }

    /**
     * Builds the check expression from named arguments.
     *
     * @param arguments the arguments by parameter name
     * @return the check expression, or {@code null} if the body produced none
     * @throws IllegalArgumentException if an argument is unknown or a required one is missing
     */
    public Column invoke(Map<String, Object> arguments) {
        for (String argument : arguments.keySet()) {
            if (!parametersByName.containsKey(argument)) {
                throw new IllegalArgumentException(
                        "Unexpected argument '" + argument + "' for function '" + name + "'");
            }
        }
        for (CheckParameter parameter : parameters) {
            if (parameter.required() && !arguments.containsKey(parameter.name())) {
                throw new IllegalArgumentException(
                        "Missing argument '" + parameter.name() + "' for function '" + name + "'");
            }
        }
        return body.apply(Collections.unmodifiableMap(new LinkedHashMap<>(arguments)));
    }

    /**
     * Builds the check expression for one column. The column is bound to the
     * first parameter, positional arguments to the parameters that follow it,
     * and keyword arguments by name.
     *
     * @param column         the column name
     * @param positionalArgs arguments following the column, in parameter order
     * @param keywordArgs    arguments by parameter name
     * @return the check expression, or {@code null} if the body produced none
     * @throws IllegalArgumentException if an argument is bound twice or cannot be bound
     */
    public Column invokeForColumn(String column, List<Object> positionalArgs, Map<String, Object> keywordArgs) {
        if (parameters.isEmpty()) {
            throw new IllegalArgumentException("Function '" + name + "' takes no column argument");
        }
        if (positionalArgs.size() + 1 > parameters.size()) {
            throw new IllegalArgumentException("Function '" + name + "' takes " + parameters.size()
                    + " arguments but " + (positionalArgs.size() + 1) + " positional arguments were given");
        }

        Map<String, Object> bound = new LinkedHashMap<>();
        bound.put(parameters.get(0).name(), column);
        for (int i = 0; i < positionalArgs.size(); i++) {
            bound.put(parameters.get(i + 1).name(), positionalArgs.get(i));
        }
        keywordArgs.forEach((argument, value) -> {
            if (bound.containsKey(argument)) {
                throw new IllegalArgumentException(
                        "Function '" + name + "' got multiple values for argument '" + argument + "'");
            }
            bound.put(argument, value);
        });
        return invoke(bound);
    }

    @Override
    public String toString() {
        return name + getParameterNames();
    }

    /**
     * Starts a programmatic function definition.
     *
     * @param name the function name used in rule metadata
     * @return a builder
     */
    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Builder for {@link CheckFunction}.
     */
    public static final class Builder {

        private final String name;
        private final List<CheckParameter> parameters = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder parameter(String parameterName, Class<?> type) {
            parameters.add(new CheckParameter(parameterName, type, true));
            return this;
        }

        public Builder optionalParameter(String parameterName, Class<?> type) {
            parameters.add(new CheckParameter(parameterName, type, false));
            return this;
        }

        public CheckFunction build(Function<Map<String, Object>, Column> body) {
            return new CheckFunction(name, parameters, body);
        }
    }
}
