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
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * The parts of a compiled route definition, in the order they appear in the definition string. The segment tree is
 * what URL generation walks, the compiled regular expression is what recognition runs.
 * <p>
 * This class is not meant to be extended outside of this file, the three nested types are the only segment types.
 *
 * @author Waymark Contributors
 */
public abstract class PathSegment {

    private PathSegment() {
    }

    /**
     * Literal text, emitted verbatim during generation.
     */
    public static final class Literal extends PathSegment {

        private final String text;

        Literal(final String text) {
            this.text = Objects.requireNonNull(text);
        }

        public String getText() {
            return text;
        }

        @Override
        public boolean equals(final Object o) {
            return o instanceof Literal && text.equals(((Literal) o).text);
        }

        @Override
        public int hashCode() {
            return text.hashCode();
        }

        @Override
        public String toString() {
            return text;
        }
    }

    /**
     * A dynamic ({@code :name}) or glob ({@code *name}) parameter.
     */
    public static final class Parameter extends PathSegment {

        private final String name;
        private final Pattern requirement;
        private final boolean glob;

        Parameter(final String name, final Pattern requirement, final boolean glob) {
            this.name = Objects.requireNonNull(name);
            this.requirement = Objects.requireNonNull(requirement);
            this.glob = glob;
        }

        public String getName() {
            return name;
        }

        public Pattern getRequirement() {
            return requirement;
        }

        public boolean isGlob() {
            return glob;
        }

        /**
         * @param value A candidate value, already escaped
         * @return True if the whole value satisfies the requirement of this parameter
         */
        public boolean matches(final String value) {
            return requirement.matcher(value).matches();
        }

        @Override
        public boolean equals(final Object o) {
            if (this == o) return true;
            if (!(o instanceof Parameter)) return false;
            final Parameter that = (Parameter) o;
            return glob == that.glob && name.equals(that.name) && requirement.pattern().equals(that.requirement.pattern());
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, requirement.pattern(), glob);
        }

        @Override
        public String toString() {
            return (glob ? "*" : ":") + name;
        }
    }

    /**
     * A parenthesized group that may be left out.
     */
    public static final class OptionalGroup extends PathSegment {

        private final List<PathSegment> segments;

        OptionalGroup(final List<PathSegment> segments) {
            this.segments = Collections.unmodifiableList(new ArrayList<>(segments));
        }

        public List<PathSegment> getSegments() {
            return segments;
        }

        /**
         * @return True if this group holds literal text only
         */
        public boolean isStatic() {
            for (PathSegment segment : segments) {
                if (!(segment instanceof Literal)) {
                    return false;
                }
            }
            return true;
        }

        @Override
        public boolean equals(final Object o) {
            return o instanceof OptionalGroup && segments.equals(((OptionalGroup) o).segments);
        }

        @Override
        public int hashCode() {
            return segments.hashCode();
        }

        @Override
        public String toString() {
            final StringBuilder sb = new StringBuilder("(");
            for (PathSegment segment : segments) {
                sb.append(segment);
            }
            return sb.append(')').toString();
        }
    }

    /**
     * @param segments A segment list
     * @return The parameters directly in the list, not descending into optional groups
     */
    public static List<Parameter> parameters(final List<PathSegment> segments) {
        final List<Parameter> result = new ArrayList<>();
        for (PathSegment segment : segments) {
            if (segment instanceof Parameter) {
                result.add((Parameter) segment);
            }
        }
        return result;
    }

    /**
     * @param segments A segment list
     * @return Every parameter in the list, including the ones nested in optional groups, in definition order
     */
    public static List<Parameter> allParameters(final List<PathSegment> segments) {
        final List<Parameter> result = new ArrayList<>();
        collectParameters(segments, result);
        return result;
    }

    private static void collectParameters(final List<PathSegment> segments, final List<Parameter> result) {
        for (PathSegment segment : segments) {
            if (segment instanceof Parameter) {
                result.add((Parameter) segment);
            } else if (segment instanceof OptionalGroup) {
                collectParameters(((OptionalGroup) segment).getSegments(), result);
            }
        }
    }
}
