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

package org.fireflyframework.fallback.transform;

import org.fireflyframework.fallback.exception.FallbackConfigurationException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, ordered list of {@link MappingRule}s validated when it is built.
 *
 * <p>Used both as an endpoint remap table ({@link #remapPath(String)}) and as a
 * field rename table ({@link #asMap()}). Building fails when a rule has a blank
 * side or when two rules share the same {@code from}.</p>
 */
public final class MappingTable {

    private static final MappingTable EMPTY = new MappingTable(List.of());

    private final List<MappingRule> rules;

    private MappingTable(List<MappingRule> rules) {
        this.rules = rules;
    }

    /**
     * Builds a validated table.
     *
     * @param name  table name used in error messages
     * @param rules the rules, in lookup order
     * @return the table
     * @throws FallbackConfigurationException if a rule is blank or duplicated
     */
    public static MappingTable of(String name, List<MappingRule> rules) {
        if (rules == null || rules.isEmpty()) {
            return EMPTY;
        }

        List<String> errors = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (MappingRule rule : rules) {
            if (rule == null || isBlank(rule.from()) || isBlank(rule.to())) {
                errors.add(name + " contains a rule with a blank side: " + rule);
            } else if (!seen.add(rule.from())) {
                errors.add(name + " maps '" + rule.from() + "' more than once");
            }
        }
        if (!errors.isEmpty()) {
            throw new FallbackConfigurationException(errors);
        }
        return new MappingTable(List.copyOf(rules));
    }

    public static MappingTable empty() {
        return EMPTY;
    }

    public Optional<String> lookup(String from) {
        return rules.stream()
                .filter(rule -> rule.from().equals(from))
                .map(MappingRule::to)
                .findFirst();
    }

    /**
     * Remaps an endpoint path. An exact match wins; otherwise the longest rule
     * whose {@code from} is a path prefix of the endpoint is applied and the
     * remainder of the path is kept. Unmatched paths are returned unchanged.
     *
     * @param path the logical endpoint path
     * @return the remapped path
     */
    public String remapPath(String path) {
        Optional<String> exact = lookup(path);
        if (exact.isPresent()) {
            return exact.get();
        }

        MappingRule best = null;
        for (MappingRule rule : rules) {
            if (path.startsWith(rule.from() + "/")
                    && (best == null || rule.from().length() > best.from().length())) {
                best = rule;
            }
        }
        return best == null ? path : best.to() + path.substring(best.from().length());
    }

    /**
     * Returns the rules as an insertion-ordered map.
     *
     * @return {@code from -> to} map
     */
    public Map<String, String> asMap() {
        Map<String, String> map = new LinkedHashMap<>();
        rules.forEach(rule -> map.put(rule.from(), rule.to()));
        return map;
    }

    public List<MappingRule> getRules() {
        return rules;
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
