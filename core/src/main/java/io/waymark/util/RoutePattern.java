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

package io.waymark.util;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A compiled route condition: the anchored pattern, its capture index and, for patterns compiled from a definition
 * string, the segments that URL generation walks.
 * <p>
 * Patterns built from a raw regular expression can be matched, but cannot generate.
 *
 * @author Waymark Contributors
 */
public final class RoutePattern {

    private final String definition;
    private final NamedCaptureIndex index;
    private final List<PathSegment> segments;
    private final List<String> staticSegments;

    RoutePattern(final String definition, final NamedCaptureIndex index, final List<PathSegment> segments) {
        this.definition = definition;
        this.index = index;
        this.segments = segments == null ? null : Collections.unmodifiableList(segments);
        this.staticSegments = StaticPrefixExtractor.extractStaticSegments(index.toPattern());
    }

    public static RoutePattern compile(final String definition) {
        return SegmentPatternCompiler.compile(definition);
    }

    public static RoutePattern compile(final String definition, final Map<String, Pattern> requirements) {
        return SegmentPatternCompiler.compile(definition, requirements);
    }

    public static RoutePattern of(final Pattern pattern) {
        final NamedCaptureIndex index = NamedCaptureIndex.of(pattern);
        return new RoutePattern(index.toPattern().pattern(), index, null);
    }

    public static RoutePattern of(final Pattern pattern, final List<String> names) {
        final NamedCaptureIndex index = NamedCaptureIndex.of(pattern, names);
        return new RoutePattern(index.toPattern().pattern(), index, null);
    }

    /**
     * @return The definition string, or the regular expression source for raw patterns
     */
    public String getDefinition() {
        return definition;
    }

    public NamedCaptureIndex getIndex() {
        return index;
    }

    public Pattern toPattern() {
        return index.toPattern();
    }

    public boolean isGeneratable() {
        return segments != null;
    }

    /**
     * @return The segment tree, or null if this pattern is not generatable
     */
    public List<PathSegment> getSegments() {
        return segments;
    }

    /**
     * @return The literal path segments every match starts with
     * @see StaticPrefixExtractor
     */
    public List<String> getStaticSegments() {
        return staticSegments;
    }

    /**
     * @return Every parameter name this pattern can capture
     */
    public Set<String> getParameterNames() {
        if (segments == null) {
            return index.getNamedCaptures().keySet();
        }
        final Set<String> names = new LinkedHashSet<>();
        for (PathSegment.Parameter parameter : PathSegment.allParameters(segments)) {
            names.add(parameter.getName());
        }
        return names;
    }

    /**
     * Matches a whole value against this pattern.
     *
     * @param value The value, typically a request path
     * @return The captured parameters, or null if the value does not match
     */
    public Map<String, String> match(final String value) {
        final Matcher matcher = index.toPattern().matcher(value);
        if (!matcher.matches()) {
            return null;
        }
        return index.captures(matcher);
    }

    @Override
    public String toString() {
        return definition;
    }
}
