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

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves check function names to {@link CheckFunction} descriptors.
 *
 * <p>When a non-empty overrides map is supplied, names are looked up there only.
 * Otherwise the built-in catalog is used. Lookups have no side effects.</p>
 */
@Slf4j
public class CheckFunctionRegistry {

    private final Map<String, CheckFunction> builtIns;

    /**
     * Creates a registry backed by {@link ColumnFunctions}.
     */
    public CheckFunctionRegistry() {
        this(CheckFunctionScanner.scan(ColumnFunctions.class));
    }

    /**
     * Creates a registry backed by the given catalog.
     *
     * @param builtIns the built-in functions keyed by name
     */
    public CheckFunctionRegistry(Map<String, CheckFunction> builtIns) {
        this.builtIns = Map.copyOf(builtIns);
    }

    /**
     * Looks up a function without failing when it is missing.
     *
     * @param name      the function name
     * @param overrides caller-supplied functions, or {@code null}
     * @return the function, or empty if it is not defined
     */
    public Optional<CheckFunction> find(String name, Map<String, CheckFunction> overrides) {
        log.debug("Resolving function: {}", name);
        Map<String, CheckFunction> catalog = overrides != null && !overrides.isEmpty() ? overrides : builtIns;
        return Optional.ofNullable(name).map(catalog::get);
    }

    /**
     * Looks up a function that must exist.
     *
     * @param name      the function name
     * @param overrides caller-supplied functions, or {@code null}
     * @return the function
     * @throws UnresolvedFunctionException if the function is not defined
     */
    public CheckFunction resolve(String name, Map<String, CheckFunction> overrides) {
        CheckFunction function = find(name, overrides)
                .orElseThrow(() -> new UnresolvedFunctionException(name));
        log.debug("Function {} resolved successfully", name);
        return function;
    }

    /**
     * Returns the names of the built-in functions.
     *
     * @return the built-in function names
     */
    public Set<String> getBuiltInNames() {
        return builtIns.keySet();
    }
}
