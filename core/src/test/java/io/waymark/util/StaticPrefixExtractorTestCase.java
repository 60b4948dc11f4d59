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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

import org.junit.Test;
import org.junit.experimental.categories.Category;

import io.waymark.testutils.category.UnitTest;

/**
 * @author Waymark Contributors
 */
@Category(UnitTest.class)
public class StaticPrefixExtractorTestCase {

    @Test
    public void testLiteralPath() {
        assertEquals(Arrays.asList("people", "show", "1"), extract("^/people/show/1$"));
    }

    @Test
    public void testEscapedPeriodSeparates() {
        assertEquals(Collections.singletonList("foo"), extract("^/foo\\.([a-z]+)$"));
        assertEquals(Arrays.asList("foo", "json"), extract("^/foo\\.json$"));
    }

    @Test
    public void testStopsAtGroup() {
        assertEquals(Collections.singletonList("foo"), extract("^/foo/(bar|baz)/([a-z0-9]+)"));
    }

    @Test
    public void testDynamicFirstSegment() {
        assertEquals(Collections.emptyList(), extract("^/([^/.?]+)/edit$"));
        assertEquals(Collections.emptyList(), extract("^/(?<name>[a-z]+)$"));
    }

    @Test
    public void testSegmentFollowedByOptionalGroup() {
        assertEquals(Collections.singletonList("people"), extract("^/people(\\.([^/.?]+))?$"));
        assertEquals(Collections.singletonList("people"), extract("^/people(?:/([^/.?]+))?$"));
    }

    @Test
    public void testSegmentRunningIntoGroupIsIncomplete() {
        assertEquals(Collections.singletonList("people"), extract("^/people/page([0-9]+)$"));
    }

    @Test
    public void testQuantifiedCharacterEndsPrefix() {
        assertEquals(Collections.singletonList("foo"), extract("^/foo/bars?$"));
        assertEquals(Collections.emptyList(), extract("^/\\d+/edit$"));
    }

    @Test
    public void testTopLevelAlternationHasNoPrefix() {
        assertEquals(Collections.emptyList(), extract("^/foo/bar|/baz$"));
        assertEquals(Collections.emptyList(), extract("^/foo/bar|baz"));
        assertEquals(Arrays.asList("foo", "bar"), extract("^/foo/bar/(?:a|b)$"));
        assertEquals(Arrays.asList("foo", "bar"), extract("^/foo/bar/[|]$"));
        assertEquals(Arrays.asList("foo", "bar", "a|b"), extract("^/foo/bar/a\\|b$"));
    }

    @Test
    public void testEscapedSlashSeparates() {
        assertEquals(Arrays.asList("foo", "bar"), extract("^\\/foo\\/bar$"));
        assertEquals(Collections.singletonList("foo"), extract("^\\/foo\\/([0-9]+)$"));
        assertEquals(Collections.singletonList("foo"), extract("^\\/foo(\\/bar)?$"));
        assertEquals(Collections.singletonList("foo"), extract("^/foo\\/?$"));
    }

    @Test
    public void testEscapedLiterals() {
        assertEquals(Arrays.asList("a-b", "c+d"), extract("\\A/a\\-b/c\\+d\\z"));
    }

    @Test
    public void testCompiledRoutes() {
        assertEquals(Collections.singletonList("people"), RoutePattern.compile("/people/:id(.:format)").getStaticSegments());
        assertEquals(Collections.emptyList(), RoutePattern.compile("/:controller/:action").getStaticSegments());
    }

    private static List<String> extract(final String regex) {
        return StaticPrefixExtractor.extractStaticSegments(Pattern.compile(regex));
    }
}
