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
import java.util.regex.Pattern;

import io.waymark.WaymarkMessages;

/**
 * The declaration of a route, as passed to {@link RouteSet#addRoute(RouteDefinition)}.
 * <p>
 * The path is either a definition string, which can both recognize and generate, or a raw regular expression, which
 * can only recognize.
 *
 * @author Waymark Contributors
 */
public class RouteDefinition {

    private final String name;
    private final String path;
    private final Pattern pathPattern;
    private final List<String> pathNames;
    private final String host;
    private final Map<String, String> defaults;
    private final Map<String, Pattern> requirements;

    private RouteDefinition(final Builder builder) {
        this.name = builder.name;
        this.path = builder.path;
        this.pathPattern = builder.pathPattern;
        this.pathNames = builder.pathNames == null ? null : Collections.unmodifiableList(new ArrayList<>(builder.pathNames));
        this.host = builder.host;
        this.defaults = Collections.unmodifiableMap(new LinkedHashMap<>(builder.defaults));
        this.requirements = Collections.unmodifiableMap(new LinkedHashMap<>(builder.requirements));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(final String path) {
        return new Builder().path(path);
    }

    public String getName() {
        return name;
    }

    /**
     * @return The path definition string, or null if the path is a raw pattern
     */
    public String getPath() {
        return path;
    }

    public Pattern getPathPattern() {
        return pathPattern;
    }

    public List<String> getPathNames() {
        return pathNames;
    }

    public String getHost() {
        return host;
    }

    public Map<String, String> getDefaults() {
        return defaults;
    }

    public Map<String, Pattern> getRequirements() {
        return requirements;
    }

    @Override
    public String toString() {
        return "RouteDefinition{name=" + name + ", path=" + (path != null ? path : pathPattern) + ", host=" + host
                + ", defaults=" + defaults + ", requirements=" + requirements + '}';
    }

    public static final class Builder {

        private String name;
        private String path;
        private Pattern pathPattern;
        private List<String> pathNames;
        private String host;
        private final Map<String, String> defaults = new LinkedHashMap<>();
        private final Map<String, Pattern> requirements = new LinkedHashMap<>();

        Builder() {
        }

        public Builder name(final String name) {
            this.name = name;
            return this;
        }

        public Builder path(final String path) {
            this.path = path;
            this.pathPattern = null;
            this.pathNames = null;
            return this;
        }

        public Builder path(final Pattern pattern) {
            return path(pattern, null);
        }

        /**
         * @param pattern A raw pattern
         * @param names   The capture group names, see {@link io.waymark.util.NamedCaptureIndex}
         */
        public Builder path(final Pattern pattern, final List<String> names) {
            this.pathPattern = pattern;
            this.pathNames = names;
            this.path = null;
            return this;
        }

        public Builder host(final String host) {
            this.host = host;
            return this;
        }

        public Builder addDefault(final String key, final String value) {
            if (key == null) {
                throw WaymarkMessages.MESSAGES.argumentCannotBeNull("key");
            }
            defaults.put(key, value);
            return this;
        }

        public Builder defaults(final Map<String, String> defaults) {
            for (Map.Entry<String, String> entry : defaults.entrySet()) {
                addDefault(entry.getKey(), entry.getValue());
            }
            return this;
        }

        public Builder addRequirement(final String key, final String regex) {
            return addRequirement(key, Pattern.compile(regex));
        }

        public Builder addRequirement(final String key, final Pattern requirement) {
            if (key == null) {
                throw WaymarkMessages.MESSAGES.argumentCannotBeNull("key");
            }
            if (requirement == null) {
                throw WaymarkMessages.MESSAGES.argumentCannotBeNull("requirement");
            }
            requirements.put(key, requirement);
            return this;
        }

        public RouteDefinition build() {
            if (path == null && pathPattern == null) {
                throw WaymarkMessages.MESSAGES.routeDefinitionWithoutPath();
            }
            return new RouteDefinition(this);
        }
    }
}
