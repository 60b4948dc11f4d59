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
import java.util.List;
import java.util.Map;

/**
 * The raw result of generating a URL: one generated value per requested {@link UrlPart}, and the parameters that were
 * not consumed by the route.
 *
 * @author Waymark Contributors
 */
public class GenerationResult {

    private final List<UrlPart> requestedParts;
    private final List<String> parts;
    private final Map<String, Object> params;

    GenerationResult(final List<UrlPart> requestedParts, final List<String> parts, final Map<String, Object> params) {
        this.requestedParts = requestedParts;
        this.parts = Collections.unmodifiableList(parts);
        this.params = Collections.unmodifiableMap(params);
    }

    /**
     * @return The generated values, in the order the parts were requested. A value is null if the route does not
     * constrain that part.
     */
    public List<String> getParts() {
        return parts;
    }

    /**
     * @param part A requested part
     * @return The generated value, or null if the part was not requested or the route does not constrain it
     */
    public String get(final UrlPart part) {
        final int index = requestedParts.indexOf(part);
        return index == -1 ? null : parts.get(index);
    }

    /**
     * @return The parameters that no segment consumed and that differ from the route defaults
     */
    public Map<String, Object> getParams() {
        return params;
    }

    @Override
    public String toString() {
        return "GenerationResult{parts=" + parts + ", params=" + params + '}';
    }
}
