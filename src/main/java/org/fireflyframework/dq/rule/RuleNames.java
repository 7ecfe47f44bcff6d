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

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rule name bookkeeping shared by the metadata builder and the engine.
 */
public final class RuleNames {

    private RuleNames() {}

    /**
     * Finds rule names used more than once within the same criticality.
     * The same name under different criticalities is not a duplicate.
     *
     * @param rules the rules to inspect
     * @return duplicated names per criticality; empty if all names are unique
     */
    public static Map<Criticality, Set<String>> findDuplicates(List<DqRule> rules) {
        Map<Criticality, Set<String>> seen = new EnumMap<>(Criticality.class);
        Map<Criticality, Set<String>> duplicates = new EnumMap<>(Criticality.class);
        for (DqRule rule : rules) {
            Criticality criticality = rule.getRuleCriticality();
            if (!seen.computeIfAbsent(criticality, c -> new HashSet<>()).add(rule.getName())) {
                duplicates.computeIfAbsent(criticality, c -> new LinkedHashSet<>()).add(rule.getName());
            }
        }
        return duplicates;
    }

    /**
     * Describes duplicated names as human-readable messages.
     *
     * @param duplicates the result of {@link #findDuplicates(List)}
     * @return one message per criticality with duplicates
     */
    public static List<String> describe(Map<Criticality, Set<String>> duplicates) {
        List<String> messages = new ArrayList<>();
        duplicates.forEach((criticality, names) -> messages.add(
                "Duplicate rule names for criticality '" + criticality + "': " + names));
        return messages;
    }
}
