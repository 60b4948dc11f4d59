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

import java.net.URLEncoder;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Map;

import io.waymark.WaymarkMessages;

/**
 * Utilities for escaping generated URLs
 *
 * @author Waymark Contributors
 */
public class URLUtils {

    /**
     * Characters that can appear unescaped in a generated path. {@code ?} and {@code #} are escaped, as are {@code %}
     * and spaces.
     */
    private static final String PATH_SAFE = "-_.!~*'();/:@&=+$,[]";

    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private URLUtils() {

    }

    /**
     * Percent-encodes every character of the value that is not safe to appear in a URL path.
     *
     * @param value   The value
     * @param charset The charset used to encode non ASCII characters
     * @return The escaped value, or null if the value is null
     */
    public static String escapeUri(final Object value, final String charset) {
        if (value == null) {
            return null;
        }
        final String s = value.toString();
        int i = 0;
        while (i < s.length() && isPathSafe(s.charAt(i))) {
            ++i;
        }
        if (i == s.length()) {
            return s;
        }
        final Charset cs = charset(s, charset);
        final StringBuilder sb = new StringBuilder(s.length() + 16);
        sb.append(s, 0, i);
        while (i < s.length()) {
            final int cp = s.codePointAt(i);
            if (cp < 0x80 && isPathSafe((char) cp)) {
                sb.append((char) cp);
            } else {
                for (byte b : new String(Character.toChars(cp)).getBytes(cs)) {
                    sb.append('%');
                    sb.append(HEX[(b >> 4) & 0x0F]);
                    sb.append(HEX[b & 0x0F]);
                }
            }
            i += Character.charCount(cp);
        }
        return sb.toString();
    }

    /**
     * Form-encodes a value for use as a query string key or value.
     */
    public static String escape(final String value, final String charset) {
        return URLEncoder.encode(value, charset(value, charset));
    }

    /**
     * Builds a query string from a map of parameters. Values may be nested: a {@link Map} value produces
     * {@code key[nested]=value} pairs and an {@link Iterable} or array value produces {@code key[]=value} pairs. A null
     * value produces the bare key.
     *
     * @param params  The parameters, in the order they should appear
     * @param charset The charset used to encode keys and values
     * @return The query string, without a leading {@code ?}
     */
    public static String buildNestedQuery(final Map<String, ?> params, final String charset) {
        final StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, ?> entry : params.entrySet()) {
            appendNested(sb, entry.getValue(), escape(entry.getKey(), charset), charset);
        }
        return sb.toString();
    }

    private static void appendNested(final StringBuilder sb, final Object value, final String prefix, final String charset) {
        if (value instanceof Map) {
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                appendNested(sb, entry.getValue(), prefix + "[" + escape(String.valueOf(entry.getKey()), charset) + "]", charset);
            }
        } else if (value instanceof Iterable) {
            for (Object item : (Iterable<?>) value) {
                appendNested(sb, item, prefix + "[]", charset);
            }
        } else if (value instanceof Object[]) {
            for (Object item : (Object[]) value) {
                appendNested(sb, item, prefix + "[]", charset);
            }
        } else {
            if (sb.length() > 0) {
                sb.append('&');
            }
            sb.append(prefix);
            if (value != null) {
                sb.append('=');
                sb.append(escape(value.toString(), charset));
            }
        }
    }

    private static boolean isPathSafe(final char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || PATH_SAFE.indexOf(c) != -1;
    }

    private static Charset charset(final String value, final String charset) {
        try {
            return Charset.forName(charset);
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            throw WaymarkMessages.MESSAGES.failedToEncode(value, charset);
        }
    }
}
