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

import java.util.Collections;
import java.util.Map;

/**
 * The view of the current request that URL generation reads. Implemented by the HTTP layer that hosts the route set.
 *
 * @author Waymark Contributors
 */
public interface RequestContext {

    String getScheme();

    String getHost();

    int getPort();

    /**
     * @return The path the application is mounted on, empty if it is mounted at the root
     */
    String getScriptName();

    String getPathInfo();

    /**
     * @return The query string without the leading {@code ?}, empty if there is none
     */
    String getQueryString();

    /**
     * The parameters recognized for the current request. They are recalled when generating new URLs, so that
     * parameters such as a locale do not have to be repeated for every link.
     *
     * @return The recognized parameters
     */
    default Map<String, Object> getParameters() {
        return Collections.emptyMap();
    }
}
