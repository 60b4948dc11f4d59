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
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

import io.waymark.util.RoutePattern;

/**
 * A route compiled from a {@link RouteDefinition}.
 *
 * @author Waymark Contributors
 */
final class CompiledRoute implements Route {

    private final String name;
    private final Map<UrlPart, RoutePattern> conditions;
    private final Map<UrlPart, SegmentGenerator> generators;
    private final Map<String, String> defaults;
    private final Map<String, Pattern> requirements;
    private final Map<String, Object> generationKeys;
    private final boolean significantParams;

    private CompiledRoute(final String name, final Map<UrlPart, RoutePattern> conditions, final Map<String, String> defaults,
                          final Map<String, Pattern> requirements) {
        this.name = name;
        this.conditions = Collections.unmodifiableMap(conditions);
        this.defaults = defaults;
        this.requirements = requirements;

        final Map<UrlPart, SegmentGenerator> generators = new EnumMap<>(UrlPart.class);
        final Map<String, Object> generationKeys = new LinkedHashMap<>();
        boolean significant = false;
        for (Map.Entry<UrlPart, RoutePattern> entry : conditions.entrySet()) {
            if (!entry.getValue().isGeneratable()) {
                continue;
            }
            final SegmentGenerator generator = new SegmentGenerator(entry.getValue(), defaults);
            generators.put(entry.getKey(), generator);
            significant |= !generator.getRequiredParams().isEmpty() || !generator.getRequiredDefaults().isEmpty();
            generationKeys.putAll(generator.getRequiredDefaults());
            for (String required : generator.getRequiredParams()) {
                final Pattern requirement = requirements.get(required);
                if (requirement != null) {
                    generationKeys.putIfAbsent(required, requirement);
                }
            }
        }
        this.generators = Collections.unmodifiableMap(generators);
        this.generationKeys = Collections.unmodifiableMap(generationKeys);
        this.significantParams = significant;
    }

    /**
     * @throws io.waymark.util.RoutePatternException If a definition string is malformed
     */
    static CompiledRoute compile(final RouteDefinition definition) {
        final Map<UrlPart, RoutePattern> conditions = new EnumMap<>(UrlPart.class);
        if (definition.getPath() != null) {
            conditions.put(UrlPart.PATH_INFO, RoutePattern.compile(definition.getPath(), definition.getRequirements()));
        } else {
            conditions.put(UrlPart.PATH_INFO, RoutePattern.of(definition.getPathPattern(), definition.getPathNames()));
        }
        if (definition.getHost() != null) {
            conditions.put(UrlPart.HOST, RoutePattern.compile(definition.getHost(), definition.getRequirements()));
        }
        return new CompiledRoute(definition.getName(), conditions, definition.getDefaults(), definition.getRequirements());
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Map<UrlPart, RoutePattern> getConditions() {
        return conditions;
    }

    @Override
    public Map<String, String> getDefaults() {
        return defaults;
    }

    @Override
    public Map<String, Pattern> getRequirements() {
        return requirements;
    }

    @Override
    public boolean hasSignificantParams() {
        return significantParams;
    }

    @Override
    public Map<String, Object> getGenerationKeys() {
        return generationKeys;
    }

    boolean isGeneratable() {
        return !generators.isEmpty();
    }

    @Override
    public List<String> generate(final List<UrlPart> parts, final Map<String, Object> params, final Map<String, Object> recall,
                                 final Parameterizer parameterizer) {
        final List<String> result = new ArrayList<>(parts.size());
        boolean generated = false;
        for (UrlPart part : parts) {
            final SegmentGenerator generator = generators.get(part);
            if (generator == null) {
                result.add(null);
                continue;
            }
            final String value = generator.generate(params, recall, parameterizer);
            if (value == null) {
                return null;
            }
            result.add(value);
            generated = true;
        }
        if (!generated) {
            return null;
        }
        final Iterator<Map.Entry<String, Object>> it = params.entrySet().iterator();
        while (it.hasNext()) {
            final Map.Entry<String, Object> entry = it.next();
            final String defaultValue = defaults.get(entry.getKey());
            if (defaultValue != null && Objects.equals(defaultValue, SegmentGenerator.stringValue(entry.getValue()))) {
                it.remove();
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return "Route{name=" + name + ", conditions=" + conditions + ", defaults=" + defaults + '}';
    }
}
