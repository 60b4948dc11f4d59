/*
 * JBoss, Home of Professional Open Source.
 * Copyright 2025 Red Hat, Inc., and individual contributors
 * as indicated by the @author tags.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */

package io.waymark.routing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Observes the generation keys of every registered route and reports which keys best discriminate between them.
 * <p>
 * The report is a histogram of how many routes constrain each key. Keys whose count reaches the mean plus one
 * standard deviation are kept, ordered by count, then by how many distinct values routes give them, then by the order
 * in which they were first registered. The ordering is fully deterministic, which matters because the shape of the
 * {@link GenerationGraph} depends on it.
 * <p>
 * Observations are indexed by registration order, so the n-th observed route is route n of the route set.
 *
 * @author Waymark Contributors
 */
public class KeyFrequencyAnalyzer {

    private static final String METACHARACTERS = "\\.[]{}()*+?^$|";

    private final List<Map<String, Object>> observations = new ArrayList<>();

    private List<Map<String, String>> possibleValues;
    private List<String> report;

    public void observe(final Route route) {
        observations.add(route.getGenerationKeys());
        expire();
    }

    public int size() {
        return observations.size();
    }

    /**
     * Discards the cached report and possible value tables. Observations are kept.
     */
    public void expire() {
        possibleValues = null;
        report = null;
    }

    /**
     * @return For each observed route, each of its keys mapped to the value it requires, or to null if the value is
     * not statically known
     */
    public List<Map<String, String>> getPossibleValues() {
        if (possibleValues == null) {
            final List<Map<String, String>> values = new ArrayList<>(observations.size());
            for (Map<String, Object> keys : observations) {
                final Map<String, String> routeValues = new LinkedHashMap<>();
                for (Map.Entry<String, Object> entry : keys.entrySet()) {
                    routeValues.put(entry.getKey(), possibleValue(entry.getValue()));
                }
                values.add(Collections.unmodifiableMap(routeValues));
            }
            possibleValues = Collections.unmodifiableList(values);
        }
        return possibleValues;
    }

    /**
     * @return The value route {@code routeIndex} requires for {@code key}, or null if it is unknown or unconstrained
     */
    public String possibleValue(final int routeIndex, final String key) {
        return getPossibleValues().get(routeIndex).get(key);
    }

    public List<String> report() {
        if (report == null) {
            report = Collections.unmodifiableList(computeReport());
        }
        return report;
    }

    private List<String> computeReport() {
        final Map<String, Integer> frequency = new LinkedHashMap<>();
        final Map<String, Set<String>> distinctValues = new LinkedHashMap<>();
        int total = 0;
        for (Map<String, String> routeValues : getPossibleValues()) {
            for (Map.Entry<String, String> entry : routeValues.entrySet()) {
                ++total;
                frequency.merge(entry.getKey(), 1, Integer::sum);
                final Set<String> distinct = distinctValues.computeIfAbsent(entry.getKey(), k -> new HashSet<>());
                if (entry.getValue() != null) {
                    distinct.add(entry.getValue());
                }
            }
        }
        if (total <= 1) {
            return Collections.emptyList();
        }
        final double mean = (double) total / frequency.size();
        double variance = 0;
        for (int count : frequency.values()) {
            variance += (count - mean) * (count - mean);
        }
        variance /= total;
        final double limit = mean + Math.sqrt(variance);

        final List<String> keys = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : frequency.entrySet()) {
            if (entry.getValue() + 1e-9 >= limit) {
                keys.add(entry.getKey());
            }
        }
        // List.sort is stable, so equal keys keep their registration order
        keys.sort(Comparator.<String>comparingInt(frequency::get).reversed()
                .thenComparing(Comparator.<String>comparingInt(k -> distinctValues.get(k).size()).reversed()));
        return keys;
    }

    /**
     * Strings are taken as is, patterns only if they match a single literal string.
     */
    static String possibleValue(final Object requirement) {
        if (requirement instanceof Pattern) {
            final Pattern pattern = (Pattern) requirement;
            return pattern.flags() == 0 ? literal(pattern.pattern()) : null;
        }
        return requirement == null ? null : requirement.toString();
    }

    private static String literal(final String source) {
        final StringBuilder sb = new StringBuilder(source.length());
        for (int i = 0; i < source.length(); ++i) {
            final char c = source.charAt(i);
            if (c == '\\') {
                if (i + 1 >= source.length() || Character.isLetterOrDigit(source.charAt(i + 1))) {
                    return null;
                }
                sb.append(source.charAt(++i));
            } else if (METACHARACTERS.indexOf(c) != -1) {
                return null;
            } else {
                sb.append(c);
            }
        }
        return sb.length() == 0 ? null : sb.toString();
    }
}
