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

package io.waymark;

import java.nio.charset.StandardCharsets;

import org.xnio.Option;

/**
 * Options understood by {@link io.waymark.routing.RouteSet}.
 *
 * @author Waymark Contributors
 */
public class WaymarkOptions {

    /**
     * The charset used to percent-encode generated path segments and query string values.
     * <p>
     * Defaults to UTF-8.
     */
    public static final Option<String> URL_CHARSET = Option.simple(WaymarkOptions.class, "URL_CHARSET", String.class);

    public static final String DEFAULT_URL_CHARSET = StandardCharsets.UTF_8.name();

    /**
     * If generated URLs should consist of the path only when the caller does not pass an {@code only_path} parameter.
     * When false the scheme, host and port of the request context are prepended.
     * <p>
     * Defaults to true.
     */
    public static final Option<Boolean> ONLY_PATH = Option.simple(WaymarkOptions.class, "ONLY_PATH", Boolean.class);

    /**
     * If the parameters recognized for the current request should be recalled when generating a new URL, so that
     * for example a {@code locale} parameter is carried over to every generated link.
     * <p>
     * Defaults to true.
     */
    public static final Option<Boolean> RECALL_PARAMETERS = Option.simple(WaymarkOptions.class, "RECALL_PARAMETERS", Boolean.class);

    private WaymarkOptions() {

    }
}
