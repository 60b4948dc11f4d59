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
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.junit.Test;
import org.junit.experimental.categories.Category;

import io.waymark.testutils.category.UnitTest;

/**
 * @author Waymark Contributors
 */
@Category(UnitTest.class)
public class NamedCaptureIndexTestCase {

    @Test
    public void testNamesFromList() {
        NamedCaptureIndex index = NamedCaptureIndex.of(Pattern.compile("^/people/([^/]+)(\\.([a-z]+))?$"),
                Arrays.asList("id", null, "format"));
        assertEquals(Arrays.asList("id", null, "format"), index.getNames());
        assertEquals(Collections.singletonList(1), index.getPositions("id"));
        assertEquals(Collections.singletonList(3), index.getPositions("format"));
        assertEquals(2, index.getNamedCaptures().size());
        assertTrue(index.getPositions("missing").isEmpty());
    }

    @Test
    public void testNamesFromPositions() {
        Map<String, Integer> positions = new LinkedHashMap<>();
        positions.put("format", 3);
        positions.put("id", 1);
        NamedCaptureIndex index = NamedCaptureIndex.of(Pattern.compile("^/people/([^/]+)(\\.([a-z]+))?$"), positions);
        assertEquals(Arrays.asList("id", null, "format"), index.getNames());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testPositionZeroRejected() {
        NamedCaptureIndex.of(Pattern.compile("(a)"), Collections.singletonMap("a", 0));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testPositionBeyondGroupCountRejected() {
        NamedCaptureIndex.of(Pattern.compile("(a)"), Arrays.asList(null, "b"));
    }

    @Test
    public void testInlineMarkersAreRewritten() {
        NamedCaptureIndex index = NamedCaptureIndex.of(Pattern.compile("^/(?:<controller>[a-z_]+)/(?:<action>[a-z]+)(\\.(?:<format>[a-z]+))?$"));
        assertEquals("^/([a-z_]+)/([a-z]+)(\\.([a-z]+))?$", index.toPattern().pattern());
        assertEquals(Arrays.asList("controller", "action", null, "format"), index.getNames());

        Matcher matcher = index.toPattern().matcher("/user_accounts/show.json");
        assertTrue(matcher.matches());
        Map<String, String> captures = index.captures(matcher);
        assertEquals("user_accounts", captures.get("controller"));
        assertEquals("show", captures.get("action"));
        assertEquals("json", captures.get("format"));
    }

    @Test
    public void testInlineMarkersKeepFlags() {
        NamedCaptureIndex index = NamedCaptureIndex.of(Pattern.compile("^/(?:<page>[a-z]+)$", Pattern.CASE_INSENSITIVE));
        assertEquals(Pattern.CASE_INSENSITIVE, index.toPattern().flags());
        Matcher matcher = index.toPattern().matcher("/ABOUT");
        assertTrue(matcher.matches());
        assertEquals("ABOUT", index.group(matcher, "page"));
    }

    @Test
    public void testNativeNamedGroups() {
        Pattern pattern = Pattern.compile("^/(?<name>[a-z]+)/(\\d+)/(?<id>\\d+)$");
        NamedCaptureIndex index = NamedCaptureIndex.of(pattern);
        assertEquals(pattern, index.toPattern());
        assertEquals(Arrays.asList("name", null, "id"), index.getNames());
    }

    @Test
    public void testEscapesAndClassesAreNotGroups() {
        NamedCaptureIndex index = NamedCaptureIndex.of(Pattern.compile("^\\(x\\)[(]\\Q(\\E/(?:<id>\\d+)(?:/more)?$"));
        assertEquals(Collections.singletonList("id"), index.getNames());
        assertEquals("^\\(x\\)[(]\\Q(\\E/(\\d+)(?:/more)?$", index.toPattern().pattern());
    }

    @Test
    public void testNoNames() {
        NamedCaptureIndex index = NamedCaptureIndex.of(Pattern.compile("^/foo/(bar|baz)$"));
        assertTrue(index.getNames().isEmpty());
        assertTrue(index.getNamedCaptures().isEmpty());
    }

    @Test
    public void testNameInExclusiveBranches() {
        NamedCaptureIndex index = NamedCaptureIndex.of(Pattern.compile("^/(?:(?:<id>\\d+)|x(?:<id>[a-z]+))$"));
        List<Integer> positions = index.getPositions("id");
        assertEquals(Arrays.asList(1, 2), positions);

        Matcher numeric = index.toPattern().matcher("/42");
        assertTrue(numeric.matches());
        assertEquals("42", index.group(numeric, "id"));
        assertNull(numeric.group(2));

        Matcher alpha = index.toPattern().matcher("/xabc");
        assertTrue(alpha.matches());
        assertEquals("abc", index.group(alpha, "id"));
        assertNull(alpha.group(1));
    }

    @Test
    public void testEmptyGroupIsUsedWhenNothingElseMatched() {
        NamedCaptureIndex index = NamedCaptureIndex.of(Pattern.compile("^/a(b*)$"), Collections.singletonList("b"));
        Matcher matcher = index.toPattern().matcher("/a");
        assertTrue(matcher.matches());
        assertEquals("", index.group(matcher, "b"));
    }

    @Test
    public void testEquality() {
        NamedCaptureIndex inline = NamedCaptureIndex.of(Pattern.compile("^/(?:<id>\\d+)$"));
        NamedCaptureIndex listed = NamedCaptureIndex.of(Pattern.compile("^/(\\d+)$"), Collections.singletonList("id"));
        assertEquals(inline, listed);
        assertEquals(inline.hashCode(), listed.hashCode());
    }
}
