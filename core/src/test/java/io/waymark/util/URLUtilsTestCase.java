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
import static org.junit.Assert.assertNull;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.Test;
import org.junit.experimental.categories.Category;

import io.waymark.testutils.category.UnitTest;

/**
 * @author Waymark Contributors
 */
@Category(UnitTest.class)
public class URLUtilsTestCase {

    private static final String UTF_8 = StandardCharsets.UTF_8.name();

    @Test
    public void testEscapeUriLeavesPathCharacters() {
        assertEquals("a/b:c@d;e=f+g,h", URLUtils.escapeUri("a/b:c@d;e=f+g,h", UTF_8));
        assertEquals("42", URLUtils.escapeUri(42, UTF_8));
        assertNull(URLUtils.escapeUri(null, UTF_8));
    }

    @Test
    public void testEscapeUriEncodesUnsafeCharacters() {
        assertEquals("hello%20world", URLUtils.escapeUri("hello world", UTF_8));
        assertEquals("what%3F%23", URLUtils.escapeUri("what?#", UTF_8));
        assertEquals("100%25", URLUtils.escapeUri("100%", UTF_8));
        assertEquals("caf%C3%A9", URLUtils.escapeUri("caf\u00e9", UTF_8));
        assertEquals("caf%E9", URLUtils.escapeUri("caf\u00e9", StandardCharsets.ISO_8859_1.name()));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownCharset() {
        URLUtils.escapeUri("a b", "no-such-charset");
    }

    @Test
    public void testEscape() {
        assertEquals("a+b%26c%3Dd", URLUtils.escape("a b&c=d", UTF_8));
    }

    @Test
    public void testBuildNestedQuery() {
        Map<String, Object> user = new LinkedHashMap<>();
        user.put("name", "bob smith");
        user.put("roles", Arrays.asList("admin", "dev"));

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("q", "a b");
        params.put("tags", Arrays.asList("x", "y"));
        params.put("ids", new Object[]{1, 2});
        params.put("user", user);
        params.put("flag", null);

        assertEquals("q=a+b&tags[]=x&tags[]=y&ids[]=1&ids[]=2&user[name]=bob+smith&user[roles][]=admin&user[roles][]=dev&flag",
                URLUtils.buildNestedQuery(params, UTF_8));
    }

    @Test
    public void testBuildEmptyQuery() {
        assertEquals("", URLUtils.buildNestedQuery(Collections.emptyMap(), UTF_8));
    }
}
