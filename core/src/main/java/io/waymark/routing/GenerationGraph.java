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
import java.util.Objects;

import io.waymark.WaymarkMessages;

/**
 * An index of the significant routes of a route set, keyed by the values of the generation keys.
 * <p>
 * Each level of the tree corresponds to one generation key. A route that requires a known value for a key is stored
 * under that value; a route that does not is stored under the wildcard edge and under every concrete edge of that
 * level, so it stays reachable whatever value is supplied. Leaves list routes in registration order.
 * <p>
 * Instances are immutable once built and safe to share between threads.
 *
 * @author Waymark Contributors
 */
public final class GenerationGraph {

    private final List<String> keys;
    private final Node root;

    private GenerationGraph(final List<String> keys, final Node root) {
        this.keys = keys;
        this.root = root;
    }

    /**
     * @param keys     The generation keys, in order
     * @param routes   The routes, in registration order
     * @param analyzer The analyzer that observed the routes, for their possible key values
     * @return The graph
     */
    public static GenerationGraph build(final List<String> keys, final List<? extends Route> routes, final KeyFrequencyAnalyzer analyzer) {
        final List<String> keyList = Collections.unmodifiableList(new ArrayList<>(keys));
        final Node root = new Node();
        final String[] values = new String[keyList.size()];
        for (int i = 0; i < routes.size(); ++i) {
            final Route route = routes.get(i);
            if (!route.hasSignificantParams()) {
                continue;
            }
            for (int j = 0; j < values.length; ++j) {
                values[j] = analyzer.possibleValue(i, keyList.get(j));
            }
            root.insert(values, 0, route);
        }
        return new GenerationGraph(keyList, root);
    }

    public List<String> getKeys() {
        return keys;
    }

    /**
     * Finds the candidate routes for a set of key values.
     *
     * @param values One value per generation key, null for an unknown value
     * @return The candidates in registration order, empty if there are none
     */
    public List<Route> lookup(final List<String> values) {
        if (values == null) {
            throw WaymarkMessages.MESSAGES.argumentCannotBeNull("values");
        }
        Node node = root;
        for (int depth = 0; depth < keys.size() && node != null; ++depth) {
            final String value = depth < values.size() ? values.get(depth) : null;
            final Node child = value == null ? null : node.children.get(value);
            node = child != null ? child : node.wildcard;
        }
        if (node == null) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(node.routes);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final GenerationGraph that = (GenerationGraph) o;
        return keys.equals(that.keys) && root.equals(that.root);
    }

    @Override
    public int hashCode() {
        return Objects.hash(keys, root);
    }

    @Override
    public String toString() {
        return "GenerationGraph{keys=" + keys + ", root=" + root + '}';
    }

    private static final class Node {

        private final Map<String, Node> children = new LinkedHashMap<>();
        private final List<Route> routes = new ArrayList<>();
        private Node wildcard;

        void insert(final String[] values, final int depth, final Route route) {
            if (depth == values.length) {
                routes.add(route);
                return;
            }
            final String value = values[depth];
            if (value == null) {
                if (wildcard == null) {
                    wildcard = new Node();
                }
                wildcard.insert(values, depth + 1, route);
                for (Node child : children.values()) {
                    child.insert(values, depth + 1, route);
                }
            } else {
                Node child = children.get(value);
                if (child == null) {
                    // a new edge must still reach every route already stored under the wildcard
                    child = wildcard == null ? new Node() : wildcard.copy();
                    children.put(value, child);
                }
                child.insert(values, depth + 1, route);
            }
        }

        Node copy() {
            final Node copy = new Node();
            copy.routes.addAll(routes);
            for (Map.Entry<String, Node> entry : children.entrySet()) {
                copy.children.put(entry.getKey(), entry.getValue().copy());
            }
            if (wildcard != null) {
                copy.wildcard = wildcard.copy();
            }
            return copy;
        }

        @Override
        public boolean equals(final Object o) {
            if (this == o) return true;
            if (!(o instanceof Node)) return false;
            final Node that = (Node) o;
            return routes.equals(that.routes) && children.equals(that.children) && Objects.equals(wildcard, that.wildcard);
        }

        @Override
        public int hashCode() {
            return Objects.hash(routes, children, wildcard);
        }

        @Override
        public String toString() {
            final StringBuilder sb = new StringBuilder("{");
            if (!routes.isEmpty()) {
                sb.append("routes=").append(routes.size());
            }
            for (Map.Entry<String, Node> entry : children.entrySet()) {
                if (sb.length() > 1) {
                    sb.append(", ");
                }
                sb.append(entry.getKey()).append('=').append(entry.getValue());
            }
            if (wildcard != null) {
                if (sb.length() > 1) {
                    sb.append(", ");
                }
                sb.append("*=").append(wildcard);
            }
            return sb.append('}').toString();
        }
    }
}
