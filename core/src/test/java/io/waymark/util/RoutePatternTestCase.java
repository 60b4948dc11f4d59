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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.regex.Pattern;

import org.junit.Test;
import org.junit.experimental.categories.Category;

import io.waymark.testutils.category.UnitTest;

/**
 * @author Waymark Contributors
 */
@Category(UnitTest.class)
public class RoutePatternTestCase {

    @Test
    public void testMatch() {
        RoutePattern pattern = RoutePattern.compile("/people/:id(.:format)");
        Map<String, String> params = pattern.match("/people/1.json");
        assertEquals("1", params.get("id"));
        assertEquals("json", params.get("format"));

        params = pattern.match("/people/1");
        assertEquals(Collections.singletonMap("id", "1"), params);

        assertNull(pattern.match("/people"));
        assertNull(pattern.match("/people/1/edit"));
    }

    @Test
    public void testRawPatternCannotGenerate() {
        RoutePattern pattern = RoutePattern.of(Pattern.compile("^/legacy/(\\d+)$"), Collections.singletonList("id"));
        assertFalse(pattern.isGeneratable());
        assertNull(pattern.getSegments());
        assertEquals("^/legacy/(\\d+)$", pattern.getDefinition());
        assertEquals(Collections.singleton("id"), pattern.getParameterNames());
        assertEquals("7", pattern.match("/legacy/7").get("id"));
        assertEquals(Collections.singletonList("legacy"), pattern.getStaticSegments());
    }

    @Test
    public void testRawPatternWithInlineNames() {
        RoutePattern pattern = RoutePattern.of(Pattern.compile("^/(?:<year>\\d{4})/(?:<slug>[a-z-]+)$"));
        Map<String, String> params = pattern.match("/2024/hello-world");
        assertEquals("2024", params.get("year"));
        assertEquals("hello-world", params.get("slug"));
    }

    @Test
    public void testDefinitionAndStaticSegments() {
        RoutePattern pattern = RoutePattern.compile("/admin/users/:id");
        assertTrue(pattern.isGeneratable());
        assertEquals("/admin/users/:id", pattern.getDefinition());
        assertEquals("/admin/users/:id", pattern.toString());
        assertEquals(Arrays.asList("admin", "users"), pattern.getStaticSegments());
        assertEquals(Collections.singleton("id"), pattern.getParameterNames());
    }
}
