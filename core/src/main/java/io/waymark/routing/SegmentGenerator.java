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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import io.waymark.util.PathSegment;
import io.waymark.util.RoutePattern;

/**
 * Generates the text of one route condition from its segment tree.
 * <p>
 * Parameters of the condition that appear outside optional groups and have no default are required. Defaults that
 * are not parameters of the condition are required too: the merged parameters must hold exactly that value for the
 * condition to generate.
 *
 * @author Waymark Contributors
 */
final class SegmentGenerator {

    private enum GroupState {
        SKIP,
        CLEAR,
        INCLUDE
    }

    private final RoutePattern pattern;
    private final Map<String, String> defaults;
    private final List<String> requiredParams;
    private final Map<String, String> requiredDefaults;

    SegmentGenerator(final RoutePattern pattern, final Map<String, String> defaults) {
        this.pattern = pattern;
        this.defaults = defaults;
        final List<String> required = new ArrayList<>();
        for (PathSegment.Parameter parameter : PathSegment.parameters(pattern.getSegments())) {
            if (!defaults.containsKey(parameter.getName()) && !required.contains(parameter.getName())) {
                required.add(parameter.getName());
            }
        }
        this.requiredParams = Collections.unmodifiableList(required);
        final Map<String, String> requiredDefaults = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : defaults.entrySet()) {
            if (!pattern.getParameterNames().contains(entry.getKey())) {
                requiredDefaults.put(entry.getKey(), entry.getValue());
            }
        }
        this.requiredDefaults = Collections.unmodifiableMap(requiredDefaults);
    }

    List<String> getRequiredParams() {
        return requiredParams;
    }

    Map<String, String> getRequiredDefaults() {
        return requiredDefaults;
    }

    /**
     * @return The generated text, or null if the parameters do not satisfy this condition
     */
    String generate(final Map<String, Object> params, final Map<String, Object> recall, final Parameterizer parameterizer) {
        final Map<String, Object> merged = new LinkedHashMap<>(recall);
        merged.putAll(params);
        for (String required : requiredParams) {
            if (!isPresent(merged.get(required))) {
                return null;
            }
        }
        for (Map.Entry<String, String> required : requiredDefaults.entrySet()) {
            if (!Objects.equals(required.getValue(), stringValue(merged.get(required.getKey())))) {
                return null;
            }
        }
        return generateSegments(pattern.getSegments(), params, merged, parameterizer);
    }

    private String generateSegments(final List<PathSegment> segments, final Map<String, Object> params,
                                    final Map<String, Object> merged, final Parameterizer parameterizer) {
        final StringBuilder sb = new StringBuilder();
        for (PathSegment segment : segments) {
            if (segment instanceof PathSegment.Literal) {
                sb.append(((PathSegment.Literal) segment).getText());
            } else if (segment instanceof PathSegment.Parameter) {
                final PathSegment.Parameter parameter = (PathSegment.Parameter) segment;
                final String name = parameter.getName();
                Object raw = params.get(name);
                if (!isPresent(raw)) {
                    raw = merged.get(name);
                }
                if (!isPresent(raw)) {
                    raw = defaults.get(name);
                }
                final String value = parameterize(parameterizer, name, raw);
                if (value == null || !parameter.matches(value)) {
                    return null;
                }
                sb.append(value);
            } else {
                final PathSegment.OptionalGroup group = (PathSegment.OptionalGroup) segment;
                switch (groupState(group, params, merged, parameterizer)) {
                    case CLEAR:
                        for (PathSegment.Parameter parameter : PathSegment.parameters(group.getSegments())) {
                            params.remove(parameter.getName());
                        }
                        break;
                    case INCLUDE:
                        final String value = generateSegments(group.getSegments(), params, merged, parameterizer);
                        if (value != null) {
                            sb.append(value);
                        }
                        break;
                    default:
                        break;
                }
            }
        }
        for (PathSegment.Parameter parameter : PathSegment.parameters(segments)) {
            params.remove(parameter.getName());
        }
        return sb.toString();
    }

    /**
     * An optional group is generated only if the caller mentions one of its parameters, all of its own parameters
     * have valid values, and it would not merely restate a default. A group that restates a default is cleared: left
     * out, with its parameters consumed.
     */
    private GroupState groupState(final PathSegment.OptionalGroup group, final Map<String, Object> params,
                                  final Map<String, Object> merged, final Parameterizer parameterizer) {
        if (group.isStatic()) {
            return GroupState.SKIP;
        }
        boolean mentioned = false;
        for (PathSegment.Parameter parameter : PathSegment.allParameters(group.getSegments())) {
            if (params.containsKey(parameter.getName())) {
                mentioned = true;
                break;
            }
        }
        if (!mentioned) {
            return GroupState.SKIP;
        }
        for (PathSegment.Parameter parameter : PathSegment.parameters(group.getSegments())) {
            final String name = parameter.getName();
            final Object mergedValue = merged.get(name);
            final String value = parameterize(parameterizer, name, isPresent(mergedValue) ? mergedValue : defaults.get(name));
            if (value == null || !parameter.matches(value)) {
                return GroupState.SKIP;
            }
            if (Objects.equals(parameterize(parameterizer, name, mergedValue), parameterize(parameterizer, name, defaults.get(name)))) {
                return GroupState.CLEAR;
            }
        }
        return GroupState.INCLUDE;
    }

    private static String parameterize(final Parameterizer parameterizer, final String name, final Object value) {
        return isPresent(value) ? parameterizer.parameterize(name, value) : null;
    }

    static boolean isPresent(final Object value) {
        return value != null && !Boolean.FALSE.equals(value);
    }

    static String stringValue(final Object value) {
        return isPresent(value) ? value.toString() : null;
    }
}
