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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Accumulated result of validating rule metadata. Created fresh for every
 * validation call.
 */
public class ChecksValidationStatus {

    private final List<String> errors = new ArrayList<>();

    public void addError(String error) {
        errors.add(error);
    }

    public void addErrors(List<String> newErrors) {
        errors.addAll(newErrors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    /**
     * Returns all messages joined by newlines, or {@code No errors found}.
     */
    @Override
    public String toString() {
        return hasErrors() ? String.join("\n", errors) : "No errors found";
    }
}
