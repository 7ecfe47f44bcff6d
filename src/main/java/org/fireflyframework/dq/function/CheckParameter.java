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

/**
 * A named, typed parameter of a {@link CheckFunction}.
 *
 * <p>A parameter declared as {@link Object} accepts any value. Any other
 * declared type must be the boxed type of the accepted values.</p>
 *
 * @param name     the argument name used in rule metadata
 * @param type     the declared type
 * @param required whether the argument must be supplied
 */
public record CheckParameter(String name, Class<?> type, boolean required) {

    /**
     * Returns whether the given value is acceptable for this parameter.
     *
     * @param value the supplied argument value
     * @return true when the parameter is untyped or the value is an instance of its type
     */
    public boolean accepts(Object value) {
        return type == Object.class || type.isInstance(value);
    }

    /**
     * Returns the simple name of the declared type, used in validation messages.
     *
     * @return the type name
     */
    public String typeName() {
        return type.getSimpleName();
    }
}
