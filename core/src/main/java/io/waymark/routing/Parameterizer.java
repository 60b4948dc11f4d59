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

/**
 * Converts a parameter value into the text substituted into a generated URL, for example by percent-encoding it.
 * The converted value is what the route requirements are checked against.
 *
 * @author Waymark Contributors
 */
@FunctionalInterface
public interface Parameterizer {

    Parameterizer TO_STRING = (name, value) -> value == null ? null : value.toString();

    /**
     * @param name  The parameter name
     * @param value The parameter value, never null
     * @return The text to substitute
     */
    String parameterize(String name, Object value);
}
