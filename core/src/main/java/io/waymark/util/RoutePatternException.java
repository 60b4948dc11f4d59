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

/**
 * Thrown when a route definition string cannot be compiled, for example because an optional group is never closed
 * or a {@code :} is not followed by a parameter name.
 * <p>
 * Definitions are compiled when the route is added, so this exception never surfaces while generating URLs.
 *
 * @author Waymark Contributors
 */
public class RoutePatternException extends IllegalArgumentException {

    private static final long serialVersionUID = 2412377196745390826L;

    public RoutePatternException(String message) {
        super(message);
    }

    public RoutePatternException(String message, Throwable cause) {
        super(message, cause);
    }
}
