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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import io.waymark.WaymarkMessages;

/**
 * Compiles route definition strings into anchored patterns.
 * <p>
 * A definition is read left to right and may contain:
 * <ul>
 * <li>Literal text, matched verbatim. Regular expression metacharacters are escaped, {@code /} is a plain separator and
 * {@code .} always matches a literal period, which gives the format suffix convention {@code /people/:id.:format}.</li>
 * <li>{@code :name} dynamic segments. They capture the requirement given for the name, or {@value #DEFAULT_SEGMENT} if
 * there is none.</li>
 * <li>{@code *name} glob segments. They capture {@value #GLOB_SEGMENT} and so may span several path segments.</li>
 * <li>{@code ( ... )} optional groups, which may nest to any depth. A group compiles to {@code ( ... )?}, and the group
 * itself is recorded as an anonymous capture.</li>
 * <li>{@code \x}, which escapes the next character, for example to match a literal {@code (} or {@code :}.</li>
 * </ul>
 * <p>
 * The resulting pattern is anchored with {@code ^} and {@code $}. Requirement patterns are embedded by source, their
 * flags are not carried over. If a requirement contains capture groups of its own, they become anonymous positions
 * following the position of the parameter that uses it.
 *
 * @author Waymark Contributors
 */
public final class SegmentPatternCompiler {

    public static final String DEFAULT_SEGMENT = "[^/.?]+";
    public static final String GLOB_SEGMENT = ".*";

    private static final Pattern DEFAULT_REQUIREMENT = Pattern.compile(DEFAULT_SEGMENT);
    private static final Pattern GLOB_REQUIREMENT = Pattern.compile(GLOB_SEGMENT);
    private static final String METACHARACTERS = "\\.[]{}()*+?^$|";

    private final String definition;
    private final Map<String, Pattern> requirements;
    private final StringBuilder regex = new StringBuilder();
    private final List<String> names = new ArrayList<>();
    private int pos;

    private SegmentPatternCompiler(final String definition, final Map<String, Pattern> requirements) {
        this.definition = definition;
        this.requirements = requirements;
    }

    public static RoutePattern compile(final String definition) {
        return compile(definition, Collections.emptyMap());
    }

    /**
     * @param definition   The route definition string
     * @param requirements The requirement for each dynamic segment that should not use the default
     * @return The compiled pattern
     * @throws RoutePatternException If the definition is malformed
     */
    public static RoutePattern compile(final String definition, final Map<String, Pattern> requirements) {
        if (definition == null) {
            throw WaymarkMessages.MESSAGES.argumentCannotBeNull("definition");
        }
        final SegmentPatternCompiler compiler = new SegmentPatternCompiler(definition,
                requirements == null ? Collections.emptyMap() : requirements);
        final List<PathSegment> segments = compiler.parseSequence(-1);
        final Pattern pattern = Pattern.compile("^" + compiler.regex + "$");
        return new RoutePattern(definition, NamedCaptureIndex.of(pattern, compiler.names), segments);
    }

    /**
     * Parses up to the end of the definition, or up to the {@code )} closing the group opened at {@code openedAt}.
     */
    private List<PathSegment> parseSequence(final int openedAt) {
        final List<PathSegment> segments = new ArrayList<>();
        final StringBuilder literal = new StringBuilder();
        while (pos < definition.length()) {
            final char c = definition.charAt(pos);
            switch (c) {
                case '\\':
                    if (pos + 1 >= definition.length()) {
                        throw WaymarkMessages.MESSAGES.danglingEscape(definition);
                    }
                    appendLiteral(literal, definition.charAt(pos + 1));
                    pos += 2;
                    break;
                case '(': {
                    flushLiteral(literal, segments);
                    final int start = pos++;
                    regex.append('(');
                    names.add(null);
                    final List<PathSegment> group = parseSequence(start);
                    regex.append(")?");
                    segments.add(new PathSegment.OptionalGroup(group));
                    break;
                }
                case ')':
                    if (openedAt == -1) {
                        throw WaymarkMessages.MESSAGES.unmatchedGroupClose(pos, definition);
                    }
                    flushLiteral(literal, segments);
                    ++pos;
                    return segments;
                case ':':
                case '*':
                    flushLiteral(literal, segments);
                    segments.add(parseParameter(c == '*'));
                    break;
                default:
                    appendLiteral(literal, c);
                    ++pos;
            }
        }
        if (openedAt != -1) {
            throw WaymarkMessages.MESSAGES.unterminatedOptionalGroup(openedAt, definition);
        }
        flushLiteral(literal, segments);
        return segments;
    }

    private PathSegment.Parameter parseParameter(final boolean glob) {
        final int start = pos++;
        while (pos < definition.length() && isIdentifierPart(definition.charAt(pos))) {
            ++pos;
        }
        if (pos == start + 1) {
            throw WaymarkMessages.MESSAGES.missingParameterName(definition.charAt(start), start, definition);
        }
        final String name = definition.substring(start + 1, pos);
        Pattern requirement = requirements.get(name);
        if (requirement == null) {
            requirement = glob ? GLOB_REQUIREMENT : DEFAULT_REQUIREMENT;
        }
        regex.append('(').append(requirement.pattern()).append(')');
        names.add(name);
        final int nested = requirement.matcher("").groupCount();
        for (int i = 0; i < nested; ++i) {
            names.add(null);
        }
        return new PathSegment.Parameter(name, requirement, glob);
    }

    private void appendLiteral(final StringBuilder literal, final char c) {
        literal.append(c);
        if (METACHARACTERS.indexOf(c) != -1) {
            regex.append('\\');
        }
        regex.append(c);
    }

    private static void flushLiteral(final StringBuilder literal, final List<PathSegment> segments) {
        if (literal.length() > 0) {
            segments.add(new PathSegment.Literal(literal.toString()));
            literal.setLength(0);
        }
    }

    private static boolean isIdentifierPart(final char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_';
    }
}
