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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import io.waymark.WaymarkMessages;

/**
 * A compiled pattern together with a canonical record of which capture groups hold which logical names.
 * <p>
 * Names can be declared in several ways, all of which are normalized into the same index:
 * <ol>
 * <li>As an ordered list, with {@code null} entries for anonymous captures. Entry {@code i} names group {@code i + 1}.</li>
 * <li>As a mapping of name to 1-based group position.</li>
 * <li>Inline, with markers of the form {@code (?:<name>...)}. The markers are rewritten into plain capture groups.</li>
 * <li>Natively, with {@code (?<name>...)} groups. The pattern is kept as is and the names are read back from its
 * source.</li>
 * </ol>
 * <p>
 * Java numbers every capture group, named or not, so anonymous groups that sit between named groups always take a
 * position and appear as {@code null} in {@link #getNames()}.
 * <p>
 * A name may map to several positions when it is declared in mutually exclusive branches of the pattern. Only one of
 * them will hold a value for any single match, {@link #group(Matcher, String)} picks it.
 *
 * @author Waymark Contributors
 */
public final class NamedCaptureIndex {

    private static final String INLINE_MARKER = "(?:<";
    private static final String NATIVE_GROUP = "(?<";

    private final Pattern pattern;
    private final List<String> names;
    private final Map<String, List<Integer>> namedCaptures;

    private NamedCaptureIndex(final Pattern pattern, final List<String> names) {
        this.pattern = pattern;
        this.names = Collections.unmodifiableList(new ArrayList<>(names));
        final int groupCount = pattern.matcher("").groupCount();
        final Map<String, List<Integer>> captures = new LinkedHashMap<>();
        for (int i = 0; i < names.size(); ++i) {
            final String name = names.get(i);
            if (name == null) {
                continue;
            }
            final int position = i + 1;
            if (position > groupCount) {
                throw WaymarkMessages.MESSAGES.capturePositionOutOfRange(name, position, pattern.pattern(), groupCount);
            }
            captures.computeIfAbsent(name, k -> new ArrayList<>()).add(position);
        }
        for (Map.Entry<String, List<Integer>> entry : captures.entrySet()) {
            entry.setValue(Collections.unmodifiableList(entry.getValue()));
        }
        this.namedCaptures = Collections.unmodifiableMap(captures);
    }

    /**
     * Indexes a pattern that declares its names inline or natively, or not at all.
     *
     * @param pattern The pattern
     * @return The index
     */
    public static NamedCaptureIndex of(final Pattern pattern) {
        if (pattern == null) {
            throw WaymarkMessages.MESSAGES.argumentCannotBeNull("pattern");
        }
        final GroupScan scan = GroupScan.scan(pattern.pattern());
        if (scan.inlineMarkers) {
            return new NamedCaptureIndex(Pattern.compile(scan.source, pattern.flags()), scan.names);
        } else if (scan.nativeNames) {
            return new NamedCaptureIndex(pattern, scan.names);
        }
        return new NamedCaptureIndex(pattern, Collections.emptyList());
    }

    /**
     * Indexes a pattern using an ordered list of names. {@code null} entries mark anonymous groups.
     *
     * @param pattern The pattern
     * @param names   The names, or null to read them from the pattern
     * @return The index
     */
    public static NamedCaptureIndex of(final Pattern pattern, final List<String> names) {
        if (names == null) {
            return of(pattern);
        }
        if (pattern == null) {
            throw WaymarkMessages.MESSAGES.argumentCannotBeNull("pattern");
        }
        return new NamedCaptureIndex(pattern, names);
    }

    /**
     * Indexes a pattern using a mapping of name to 1-based group position.
     *
     * @param pattern   The pattern
     * @param positions The positions of each name
     * @return The index
     */
    public static NamedCaptureIndex of(final Pattern pattern, final Map<String, Integer> positions) {
        if (positions == null) {
            return of(pattern);
        }
        if (pattern == null) {
            throw WaymarkMessages.MESSAGES.argumentCannotBeNull("pattern");
        }
        int highest = 0;
        for (Map.Entry<String, Integer> entry : positions.entrySet()) {
            final Integer position = entry.getValue();
            if (position == null || position < 1) {
                throw WaymarkMessages.MESSAGES.invalidCapturePosition(entry.getKey(), position == null ? 0 : position);
            }
            highest = Math.max(highest, position);
        }
        final List<String> names = new ArrayList<>(Collections.nCopies(highest, (String) null));
        for (Map.Entry<String, Integer> entry : positions.entrySet()) {
            final int index = entry.getValue() - 1;
            if (names.get(index) != null) {
                throw WaymarkMessages.MESSAGES.invalidCapturePosition(entry.getKey(), entry.getValue());
            }
            names.set(index, entry.getKey());
        }
        return new NamedCaptureIndex(pattern, names);
    }

    public Pattern toPattern() {
        return pattern;
    }

    /**
     * @return The name of each capture group in order, {@code null} for anonymous groups
     */
    public List<String> getNames() {
        return names;
    }

    /**
     * @return Each name mapped to its capture group positions in ascending order
     */
    public Map<String, List<Integer>> getNamedCaptures() {
        return namedCaptures;
    }

    public List<Integer> getPositions(final String name) {
        final List<Integer> positions = namedCaptures.get(name);
        return positions == null ? Collections.emptyList() : positions;
    }

    /**
     * Returns the value captured for a name, taking the first non-empty group among its positions.
     *
     * @param matcher A matcher for this pattern that has successfully matched
     * @param name    The name
     * @return The captured value, or null if no group for the name participated in the match
     */
    public String group(final Matcher matcher, final String name) {
        String empty = null;
        for (int position : getPositions(name)) {
            final String value = matcher.group(position);
            if (value == null) {
                continue;
            }
            if (!value.isEmpty()) {
                return value;
            }
            if (empty == null) {
                empty = value;
            }
        }
        return empty;
    }

    /**
     * @param matcher A matcher for this pattern that has successfully matched
     * @return Every name that participated in the match, mapped to its value
     */
    public Map<String, String> captures(final Matcher matcher) {
        final Map<String, String> result = new LinkedHashMap<>();
        for (String name : namedCaptures.keySet()) {
            final String value = group(matcher, name);
            if (value != null) {
                result.put(name, value);
            }
        }
        return result;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final NamedCaptureIndex that = (NamedCaptureIndex) o;
        return pattern.pattern().equals(that.pattern.pattern())
                && pattern.flags() == that.pattern.flags()
                && names.equals(that.names);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pattern.pattern(), pattern.flags(), names);
    }

    @Override
    public String toString() {
        return "NamedCaptureIndex{pattern=" + pattern.pattern() + ", names=" + names + '}';
    }

    /**
     * A single pass over a pattern source that records one entry per capture group and rewrites inline name markers.
     */
    private static final class GroupScan {

        private final String source;
        private final List<String> names;
        private final boolean inlineMarkers;
        private final boolean nativeNames;

        private GroupScan(final String source, final List<String> names, final boolean inlineMarkers, final boolean nativeNames) {
            this.source = source;
            this.names = names;
            this.inlineMarkers = inlineMarkers;
            this.nativeNames = nativeNames;
        }

        static GroupScan scan(final String source) {
            final StringBuilder rewritten = new StringBuilder(source.length());
            final List<String> names = new ArrayList<>();
            boolean inlineMarkers = false;
            boolean nativeNames = false;
            int classDepth = 0;
            int i = 0;
            final int length = source.length();
            while (i < length) {
                final char c = source.charAt(i);
                if (c == '\\') {
                    int end;
                    if (i + 1 < length && source.charAt(i + 1) == 'Q') {
                        final int quoteEnd = source.indexOf("\\E", i + 2);
                        end = quoteEnd == -1 ? length : quoteEnd + 2;
                    } else {
                        end = Math.min(i + 2, length);
                    }
                    rewritten.append(source, i, end);
                    i = end;
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
                    if (source.startsWith(INLINE_MARKER, i)) {
                        final int close = identifierEnd(source, i + INLINE_MARKER.length());
                        if (close != -1) {
                            names.add(source.substring(i + INLINE_MARKER.length(), close));
                            rewritten.append('(');
                            inlineMarkers = true;
                            i = close + 1;
                            continue;
                        }
                    } else if (source.startsWith(NATIVE_GROUP, i)) {
                        final int close = identifierEnd(source, i + NATIVE_GROUP.length());
                        if (close != -1) {
                            names.add(source.substring(i + NATIVE_GROUP.length(), close));
                            nativeNames = true;
                        }
                    } else if (i + 1 >= length || source.charAt(i + 1) != '?') {
                        names.add(null);
                    }
                }
                rewritten.append(c);
                ++i;
            }
            return new GroupScan(rewritten.toString(), names, inlineMarkers, nativeNames);
        }

        /**
         * @return the index of the closing {@code >} if an identifier starts at {@code start}, otherwise -1
         */
        private static int identifierEnd(final String source, final int start) {
            if (start >= source.length() || !Character.isLetter(source.charAt(start))) {
                return -1;
            }
            int i = start + 1;
            while (i < source.length()) {
                final char c = source.charAt(i);
                if (c == '>') {
                    return i;
                }
                if (!Character.isLetterOrDigit(c) && c != '_') {
                    return -1;
                }
                ++i;
            }
            return -1;
        }
    }
}
