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

import io.waymark.WaymarkLogger;
import io.waymark.WaymarkMessages;
import io.waymark.WaymarkOptions;
import io.waymark.util.URLUtils;
import org.xnio.OptionMap;

/**
 * A catalogue of routes that generates URLs, either from a route name or from a set of parameters.
 * <p>
 * Routes are registered during setup with {@link #addRoute(RouteDefinition)}. {@link #rehash()} then analyzes the
 * catalogue and builds the generation graph; it must be called before any URL is generated, and again after routes
 * are added. Generation reads an immutable snapshot of the built state, so any number of threads may generate URLs
 * while a single writer adds routes and rehashes.
 * <p>
 * Generating by name looks the route up directly. Generating by parameters computes the value of each generation key
 * from the parameters, descends the {@link GenerationGraph} and tries the candidate routes in registration order; the
 * first one that accepts the parameters wins.
 *
 * @author Waymark Contributors
 */
public class RouteSet {

    /**
     * The parameter that selects a path only URL ({@code true}) or a fully qualified URL ({@code false}).
     */
    public static final String ONLY_PATH_PARAMETER = "only_path";

    private static final List<UrlPart> URL_PARTS = List.of(UrlPart.HOST, UrlPart.PATH_INFO);

    //<editor-fold defaultstate="collapsed" desc="Generation inner class">
    /**
     * The built state, published as a whole on rehash.
     */
    private static final class Generation {

        private final Map<String, Route> namedRoutes;
        private final GenerationGraph graph;

        private Generation(final Map<String, Route> namedRoutes, final GenerationGraph graph) {
            this.namedRoutes = namedRoutes;
            this.graph = graph;
        }
    }
    //</editor-fold>

    private final List<Route> routes = new ArrayList<>();
    private final Map<String, Route> namedRoutes = new LinkedHashMap<>();
    private KeyFrequencyAnalyzer generationKeyAnalyzer = new KeyFrequencyAnalyzer();
    private boolean frozen;

    // null until rehash, and again whenever a route is added
    private volatile Generation generation;

    private final String urlCharset;
    private final boolean onlyPathByDefault;
    private final boolean recallParameters;
    private final Parameterizer uriEscaper;
    private volatile QueryStringBuilder queryStringBuilder;

    public RouteSet() {
        this(OptionMap.EMPTY);
    }

    public RouteSet(final OptionMap options) {
        this.urlCharset = options.get(WaymarkOptions.URL_CHARSET, WaymarkOptions.DEFAULT_URL_CHARSET);
        this.onlyPathByDefault = options.get(WaymarkOptions.ONLY_PATH, true);
        this.recallParameters = options.get(WaymarkOptions.RECALL_PARAMETERS, true);
        this.uriEscaper = (name, value) -> URLUtils.escapeUri(value, urlCharset);
        this.queryStringBuilder = params -> URLUtils.buildNestedQuery(params, urlCharset);
    }

    /**
     * Compiles and registers a route. The route set becomes stale until the next {@link #rehash()}.
     *
     * @param definition The route definition
     * @return The registered route
     * @throws io.waymark.util.RoutePatternException If the definition is malformed
     */
    public synchronized Route addRoute(final RouteDefinition definition) {
        if (definition == null) {
            throw WaymarkMessages.MESSAGES.argumentCannotBeNull("definition");
        }
        if (frozen) {
            throw WaymarkMessages.MESSAGES.routeSetFrozen();
        }
        final String name = definition.getName();
        if (name != null && namedRoutes.containsKey(name)) {
            throw WaymarkMessages.MESSAGES.duplicateRouteName(name);
        }
        final CompiledRoute route = CompiledRoute.compile(definition);
        if (!route.isGeneratable()) {
            WaymarkLogger.ROOT_LOGGER.routeNotGeneratable(name, route.getPath().getDefinition());
        }
        routes.add(route);
        if (name != null) {
            namedRoutes.put(name, route);
        }
        generationKeyAnalyzer.observe(route);
        expire();
        WaymarkLogger.ROOT_LOGGER.routeAdded(name, route.getPath().getDefinition());
        return route;
    }

    /**
     * Builds the generation keys and graph from the routes registered so far.
     *
     * @return this route set
     */
    public synchronized RouteSet rehash() {
        if (frozen) {
            return this;
        }
        final List<String> keys = generationKeyAnalyzer.report();
        final GenerationGraph graph = GenerationGraph.build(keys, routes, generationKeyAnalyzer);
        generation = new Generation(Collections.unmodifiableMap(new LinkedHashMap<>(namedRoutes)), graph);
        WaymarkLogger.ROOT_LOGGER.generationGraphRebuilt(routes.size(), keys);
        return this;
    }

    /**
     * Rehashes one last time and releases the key analysis. No routes can be added afterwards.
     *
     * @return this route set
     */
    public synchronized RouteSet freeze() {
        if (!frozen) {
            rehash();
            frozen = true;
            generationKeyAnalyzer = null;
            WaymarkLogger.ROOT_LOGGER.routeSetFrozen(routes.size());
        }
        return this;
    }

    public synchronized boolean isFrozen() {
        return frozen;
    }

    /**
     * @return True if the generation graph is built and current
     */
    public boolean isBuilt() {
        return generation != null;
    }

    public synchronized List<Route> getRoutes() {
        return List.copyOf(routes);
    }

    public synchronized Route getNamedRoute(final String name) {
        return namedRoutes.get(name);
    }

    /**
     * @return The generation keys of the current graph
     * @throws IllegalStateException If the route set has not been rehashed since the last route was added
     */
    public List<String> getGenerationKeys() {
        return built().graph.getKeys();
    }

    GenerationGraph getGenerationGraph() {
        return built().graph;
    }

    public RouteSet setQueryStringBuilder(final QueryStringBuilder queryStringBuilder) {
        if (queryStringBuilder == null) {
            throw WaymarkMessages.MESSAGES.argumentCannotBeNull("queryStringBuilder");
        }
        this.queryStringBuilder = queryStringBuilder;
        return this;
    }

    private void expire() {
        generation = null;
        generationKeyAnalyzer.expire();
    }

    private Generation built() {
        final Generation generation = this.generation;
        if (generation == null) {
            throw WaymarkMessages.MESSAGES.routeSetNotFinalized();
        }
        return generation;
    }

    /**
     * Generates a URL from a route name.
     *
     * @see #url(RequestContext, String, Map)
     */
    public String url(final RequestContext context, final String name) throws RoutingException {
        return url(context, name, Collections.emptyMap());
    }

    /**
     * Generates a URL by searching for the route that matches the parameters.
     *
     * @see #url(RequestContext, String, Map)
     */
    public String url(final RequestContext context, final Map<String, ?> params) throws RoutingException {
        return url(context, null, params);
    }

    /**
     * Generates a URL.
     * <p>
     * The {@value #ONLY_PATH_PARAMETER} parameter selects between a path and a fully qualified URL. Parameters of the
     * current request are recalled, parameters the route does not consume are appended as the query string. The port
     * is left out of fully qualified URLs when it is the default port of the scheme.
     *
     * @param context The current request
     * @param name    The route name, or null to search by parameters
     * @param params  The parameters
     * @return The URL
     * @throws RoutingException If no route can generate a URL from the parameters
     */
    public String url(final RequestContext context, final String name, final Map<String, ?> params) throws RoutingException {
        if (context == null) {
            throw WaymarkMessages.MESSAGES.argumentCannotBeNull("context");
        }
        final Map<String, Object> working = params == null ? new LinkedHashMap<>() : new LinkedHashMap<>(params);
        final Object onlyPathParam = working.remove(ONLY_PATH_PARAMETER);
        final boolean onlyPath = onlyPathParam == null ? onlyPathByDefault : Boolean.parseBoolean(onlyPathParam.toString());

        Map<String, Object> recall = recallParameters ? context.getParameters() : null;
        if (recall == null) {
            recall = Collections.emptyMap();
        }
        final GenerationResult result = generate(URL_PARTS, name, working, recall, uriEscaper);

        final Map<String, Object> query = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : result.getParams().entrySet()) {
            if (SegmentGenerator.isPresent(entry.getValue())) {
                query.put(entry.getKey(), entry.getValue());
            }
        }
        final RequestProxy request = new RequestProxy(context, result.get(UrlPart.HOST), result.get(UrlPart.PATH_INFO),
                queryStringBuilder.build(query));
        return onlyPath ? reconstructPath(request) : reconstructUrl(request);
    }

    public GenerationResult generate(final List<UrlPart> parts, final String name, final Map<String, ?> params) throws RoutingException {
        return generate(parts, name, params, Collections.emptyMap(), Parameterizer.TO_STRING);
    }

    public GenerationResult generate(final List<UrlPart> parts, final Map<String, ?> params, final Map<String, ?> recall) throws RoutingException {
        return generate(parts, null, params, recall, Parameterizer.TO_STRING);
    }

    /**
     * Generates the raw url parts for a route name or a set of parameters.
     *
     * @param parts         The parts to generate
     * @param name          The route name, or null to search by parameters
     * @param params        The parameters given for this URL
     * @param recall        The parameters carried over from the current request
     * @param parameterizer Converts parameter values into URL text, null to use their string form
     * @return The generated parts and the parameters the route did not consume
     * @throws RoutingException      If the named route does not exist or cannot generate, or no route matches
     * @throws IllegalStateException If the route set has not been rehashed since the last route was added
     */
    public GenerationResult generate(final List<UrlPart> parts, final String name, final Map<String, ?> params,
                                     final Map<String, ?> recall, final Parameterizer parameterizer) throws RoutingException {
        final Generation generation = built();
        if (parts == null || parts.isEmpty()) {
            throw WaymarkMessages.MESSAGES.noUrlPartsRequested();
        }
        final List<UrlPart> requested = List.copyOf(parts);
        final Map<String, Object> givenParams = params == null ? new LinkedHashMap<>() : new LinkedHashMap<>(params);
        final Map<String, Object> recalled = recall == null ? new LinkedHashMap<>() : new LinkedHashMap<>(recall);
        final Parameterizer parameterize = parameterizer == null ? Parameterizer.TO_STRING : parameterizer;

        if (name != null) {
            final Route route = generation.namedRoutes.get(name);
            if (route == null) {
                throw WaymarkMessages.MESSAGES.namedRouteNotFound(name, givenParams);
            }
            final Map<String, Object> namedRecall = new LinkedHashMap<>(route.getDefaults());
            namedRecall.putAll(recalled);
            final Map<String, Object> leftover = new LinkedHashMap<>(givenParams);
            final List<String> url = route.generate(requested, leftover, namedRecall, parameterize);
            if (url == null) {
                throw WaymarkMessages.MESSAGES.namedRouteFailedToGenerate(name, givenParams);
            }
            return new GenerationResult(requested, url, leftover);
        }

        final Map<String, Object> merged = new LinkedHashMap<>(recalled);
        merged.putAll(givenParams);
        final List<String> keyValues = new ArrayList<>(generation.graph.getKeys().size());
        for (String key : generation.graph.getKeys()) {
            keyValues.add(SegmentGenerator.stringValue(merged.get(key)));
        }
        for (Route candidate : generation.graph.lookup(keyValues)) {
            if (!candidate.hasSignificantParams()) {
                continue;
            }
            final Map<String, Object> leftover = new LinkedHashMap<>(givenParams);
            final List<String> url = candidate.generate(requested, leftover, recalled, parameterize);
            if (url != null) {
                WaymarkLogger.GENERATION_LOGGER.tracef("Generated %s from %s using route %s", url, givenParams, candidate);
                return new GenerationResult(requested, url, leftover);
            }
            WaymarkLogger.GENERATION_LOGGER.tracef("Route %s rejected %s", candidate, givenParams);
        }
        throw WaymarkMessages.MESSAGES.noRouteMatches(givenParams);
    }

    private static String reconstructPath(final RequestContext request) {
        final StringBuilder url = new StringBuilder(request.getScriptName());
        url.append(request.getPathInfo());
        if (!request.getQueryString().isEmpty()) {
            url.append('?').append(request.getQueryString());
        }
        return url.toString();
    }

    private static String reconstructUrl(final RequestContext request) {
        final String scheme = request.getScheme();
        final int port = request.getPort();
        final StringBuilder url = new StringBuilder(scheme);
        url.append("://").append(request.getHost());
        if (port > 0 && !isDefaultPort(scheme, port)) {
            url.append(':').append(port);
        }
        url.append(request.getScriptName());
        url.append(request.getPathInfo());
        if (!request.getQueryString().isEmpty()) {
            url.append('?').append(request.getQueryString());
        }
        return url.toString();
    }

    private static boolean isDefaultPort(final String scheme, final int port) {
        return ("http".equalsIgnoreCase(scheme) && port == 80) || ("https".equalsIgnoreCase(scheme) && port == 443);
    }
}
