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
import java.util.regex.Pattern;

import io.waymark.WaymarkMessages;

/**
 * Extracts the leading literal path segments of a compiled pattern, for building static dispatch indexes.
 * <p>
 * The pattern source is walked rather than executed. Anchors are stripped, the source is split on {@code /}
 * and on escaped slashes and periods, and segments are collected until the first one that contains a group, alternation,
 * character class, quantifier or escape class. So {@code ^/foo/(bar|baz)/([a-z0-9]+)} yields {@code ["foo"]}, and a
 * pattern with a dynamic first segment yields an empty list. A pattern with an alternation outside of any group, such
 * as {@code ^/foo|/bar}, has no prefix common to all of its matches and also yields an empty list.
 *
 * @author Waymark Contributors
 */
public final class StaticPrefixExtractor {

    private static final String QUANTIFIERS = "?*+{";

    private StaticPrefixExtractor() {

    }

    public static List<String> extractStaticSegments(final Pattern pattern) {
        if (pattern == null) {
            throw WaymarkMessages.MESSAGES.argumentCannotBeNull("pattern");
        }
        final String source = pattern.pattern();
        int start = 0;
        int end = source.length();
        if (source.startsWith("^")) {
            start = 1;
        } else if (source.startsWith("\\A")) {
            start = 2;
        }
        if (source.endsWith("\\z") || source.endsWith("\\Z")) {
            end -= 2;
        } else if (end > start && source.endsWith("$") && !isEscaped(source, end - 1)) {
            end -= 1;
        }

        if (hasTopLevelAlternation(source, start, end)) {
            return Collections.emptyList();
        }

        final List<String> segments = new ArrayList<>();
        final StringBuilder current = new StringBuilder();
        boolean literalToEnd = true;
        int i = start;
        scan:
        while (i < end) {
            final char c = source.charAt(i);
            if (c == '/') {
                commit(current, segments);
                ++i;
            } else if (c == '\\') {
                final char next = i + 1 < end ? source.charAt(i + 1) : 'A';
                if (next == '.' || next == '/') {
                    commit(current, segments);
                    if (isQuantified(source, i + 2, end)) {
                        literalToEnd = false;
                        break scan;
                    }
                    i += 2;
                } else if (Character.isLetterOrDigit(next) || isQuantified(source, i + 2, end)) {
                    literalToEnd = false;
                    break scan;
                } else {
                    current.append(next);
                    i += 2;
                }
            } else if (isLiteral(c) && !isQuantified(source, i + 1, end)) {
                current.append(c);
                ++i;
            } else {
                // a group that opens with a separator closes the segment before it
                if (c == '(' && startsWithSeparator(source, i + 1)) {
                    commit(current, segments);
                }
                literalToEnd = false;
                break scan;
            }
        }
        if (literalToEnd) {
            commit(current, segments);
        }
        return Collections.unmodifiableList(segments);
    }

    private static void commit(final StringBuilder current, final List<String> segments) {
        if (current.length() > 0) {
            segments.add(current.toString());
            current.setLength(0);
        }
    }

    private static boolean isLiteral(final char c) {
        return "$^.|?*+()[]{}".indexOf(c) == -1;
    }

    private static boolean isQuantified(final String source, final int next, final int end) {
        return next < end && QUANTIFIERS.indexOf(source.charAt(next)) != -1;
    }

    private static boolean startsWithSeparator(final String source, int pos) {
        if (source.startsWith("?:", pos)) {
            pos += 2;
        }
        return source.startsWith("/", pos) || source.startsWith("\\.", pos) || source.startsWith("\\/", pos);
    }

    /**
     * @return true if a {@code |} appears between {@code start} and {@code end} outside of every group, character
     * class and escape
     */
    private static boolean hasTopLevelAlternation(final String source, final int start, final int end) {
        int depth = 0;
        int classDepth = 0;
        int i = start;
        while (i < end) {
            final char c = source.charAt(i);
            if (c == '\\') {
                if (i + 1 < end && source.charAt(i + 1) == 'Q') {
                    final int quoteEnd = source.indexOf("\\E", i + 2);
                    i = quoteEnd == -1 ? end : quoteEnd + 2;
                } else {
                    i += 2;
                }
                continue;
            }
            if (classDepth > 0) {
                if (c == '[') {
                    ++classDepth;
                } else if (c == ']') {
                    --classDepth;
                }
            } else if (c == '[') {
                ++classDepth;
            } else if (c == '(') {
                ++depth;
            } else if (c == ')') {
                --depth;
            } else if (c == '|' && depth == 0) {
                return true;
            }
            ++i;
        }
        return false;
    }

    private static boolean isEscaped(final String source, final int pos) {
        int backslashes = 0;
        for (int i = pos - 1; i >= 0 && source.charAt(i) == '\\'; --i) {
            ++backslashes;
        }
        return backslashes % 2 == 1;
    }
}
