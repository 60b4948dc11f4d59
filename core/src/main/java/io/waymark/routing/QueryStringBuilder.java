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

import java.util.Map;

/**
 * Builds the query string of a generated URL from the parameters no route segment consumed.
 *
 * @author Waymark Contributors
 */
@FunctionalInterface
public interface QueryStringBuilder {

    /**
     * @param params The leftover parameters, in order
     * @return The query string without the leading {@code ?}, empty if there are no parameters
     */
    String build(Map<String, Object> params);
}
