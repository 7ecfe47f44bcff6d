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

import lombok.extern.slf4j.Slf4j;
import org.apache.spark.sql.Column;

import java.lang.invoke.MethodType;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Builds {@link CheckFunction} descriptors from the {@link DqCheck} methods of a class.
 *
 * <p>Each class is introspected once per process; later scans return the cached
 * catalog.</p>
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * public final class MyChecks {
 *
 *     @DqCheck("is_positive")
 *     public static Column isPositive(@DqArg("col_name") String colName) {
 *         ...
 *     }
 * }
 *
 * Map<String, CheckFunction> overrides = CheckFunctionScanner.scan(MyChecks.class);
 * }</pre>
 */
@Slf4j
public final class CheckFunctionScanner {

    private static final Map<Class<?>, Map<String, CheckFunction>> CACHE = new ConcurrentHashMap<>();

    private CheckFunctionScanner() {}

    /**
     * Returns the check functions declared by the given class, keyed by name.
     *
     * @param holder the class declaring {@link DqCheck} methods
     * @return an unmodifiable name-to-function map in method-name order
     * @throws IllegalArgumentException if an annotated method is not a valid check function
     */
    public static Map<String, CheckFunction> scan(Class<?> holder) {
        return CACHE.computeIfAbsent(holder, CheckFunctionScanner::introspect);
    }

    private static Map<String, CheckFunction> introspect(Class<?> holder) {
        Map<String, CheckFunction> catalog = new LinkedHashMap<>();
        Method[] methods = holder.getMethods();
        Arrays.sort(methods, Comparator.comparing(Method::getName));

        for (Method method : methods) {
            DqCheck check = method.getAnnotation(DqCheck.class);
            if (check == null) {
                continue;
            }
            CheckFunction function = describe(check.value(), method);
            if (catalog.put(function.getName(), function) != null) {
                throw new IllegalArgumentException(
                        "Duplicate check function '" + function.getName() + "' in " + holder.getName());
            }
        }

        log.debug("Introspected {} check functions from {}", catalog.size(), holder.getName());
        return Collections.unmodifiableMap(catalog);
    }

    private static CheckFunction describe(String name, Method method) {
        if (!Modifier.isStatic(method.getModifiers()) || !Column.class.equals(method.getReturnType())) {
            throw new IllegalArgumentException(
                    "Check function '" + name + "' must be a public static method returning Column: " + method);
        }

        CheckFunction.Builder builder = CheckFunction.builder(name);
        List<String> parameterNames = new ArrayList<>();
        for (Parameter parameter : method.getParameters()) {
            DqArg arg = parameter.getAnnotation(DqArg.class);
            if (arg == null) {
                throw new IllegalArgumentException(
                        "Parameter '" + parameter.getName() + "' of check function '" + name + "' lacks @DqArg");
            }
            if (!arg.required() && parameter.getType().isPrimitive()) {
                throw new IllegalArgumentException(
                        "Optional argument '" + arg.value() + "' of check function '" + name + "' must not be primitive");
            }
            Class<?> type = MethodType.methodType(parameter.getType()).wrap().returnType();
            if (arg.required()) {
                builder.parameter(arg.value(), type);
            } else {
                builder.optionalParameter(arg.value(), type);
            }
            parameterNames.add(arg.value());
        }

        return builder.build(arguments -> {
            Object[] values = parameterNames.stream().map(arguments::get).toArray();
            try {
                return (Column) method.invoke(null, values);
            } catch (IllegalAccessException e) {
                throw new IllegalStateException("Check function '" + name + "' is not accessible", e);
            } catch (InvocationTargetException e) {
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException runtimeException) {
                    throw runtimeException;
                }
                throw new IllegalStateException("Check function '" + name + "' failed", cause);
            }
        });
    }
}
