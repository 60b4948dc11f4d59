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
 * A request context with the generated host, path and query string laid over it. Used for a single URL
 * reconstruction and then discarded.
 *
 * @author Waymark Contributors
 */
final class RequestProxy implements RequestContext {

    private final RequestContext request;
    private final String host;
    private final String pathInfo;
    private final String queryString;

    RequestProxy(final RequestContext request, final String host, final String pathInfo, final String queryString) {
        this.request = request;
        this.host = host;
        this.pathInfo = pathInfo;
        this.queryString = queryString;
    }

    @Override
    public String getScheme() {
        return request.getScheme();
    }

    @Override
    public String getHost() {
        return host != null ? host : request.getHost();
    }

    @Override
    public int getPort() {
        return request.getPort();
    }

    @Override
    public String getScriptName() {
        final String scriptName = request.getScriptName();
        return scriptName == null ? "" : scriptName;
    }

    @Override
    public String getPathInfo() {
        if (pathInfo != null) {
            return pathInfo;
        }
        final String requestPath = request.getPathInfo();
        return requestPath == null ? "" : requestPath;
    }

    @Override
    public String getQueryString() {
        if (queryString != null) {
            return queryString;
        }
        final String requestQuery = request.getQueryString();
        return requestQuery == null ? "" : requestQuery;
    }

    @Override
    public Map<String, Object> getParameters() {
        return request.getParameters();
    }
}
