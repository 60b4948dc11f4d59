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

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import io.waymark.util.RoutePattern;

/**
 * A route registered in a {@link RouteSet}. Routes are immutable once registered.
 * <p>
 * Every route exposes the same generation contract, whatever its shape: a static route simply never has significant
 * parameters and is reached by name only, and a route defined by a raw regular expression never generates.
 *
 * @author Waymark Contributors
 */
public interface Route {

    /**
     * @return The unique name of this route, or null if it is unnamed
     */
    String getName();

    /**
     * @return The compiled condition for each part of the request this route is constrained on
     */
    Map<UrlPart, RoutePattern> getConditions();

    default RoutePattern getPath() {
        return getConditions().get(UrlPart.PATH_INFO);
    }

    Map<String, String> getDefaults();

    Map<String, Pattern> getRequirements();

    /**
     * @return True if this route has a parameter that must be supplied for it to generate, either a required
     * dynamic segment or a default that is not part of any segment. Only such routes take part in generation by
     * parameters.
     */
    boolean hasSignificantParams();

    /**
     * The keys that discriminate this route from others when generating by parameters. Values are either the
     * {@code String} the key must have, or the {@link Pattern} the key must satisfy.
     *
     * @return The generation keys
     */
    Map<String, Object> getGenerationKeys();

    /**
     * Generates the requested url parts.
     * <p>
     * Parameters consumed by this route, and parameters equal to its defaults, are removed from {@code params}.
     *
     * @param parts         The parts to generate
     * @param params        The parameters given for this URL, modified on success
     * @param recall        The parameters carried over from the current request
     * @param parameterizer Converts parameter values into URL text
     * @return One value per requested part, null for parts this route does not constrain, or null if this route
     * cannot generate from the given parameters
     */
    List<String> generate(List<UrlPart> parts, Map<String, Object> params, Map<String, Object> recall, Parameterizer parameterizer);
}
