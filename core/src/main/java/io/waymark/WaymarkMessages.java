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

import java.util.Map;

import io.waymark.routing.RoutingException;
import io.waymark.util.RoutePatternException;
import org.jboss.logging.Messages;
import org.jboss.logging.annotations.Message;
import org.jboss.logging.annotations.MessageBundle;

/**
 * Exception messages. Log messages live in {@link WaymarkLogger} and start at 5000.
 *
 * @author Waymark Contributors
 */
@MessageBundle(projectCode = "WM")
public interface WaymarkMessages {

    WaymarkMessages MESSAGES = Messages.getBundle(WaymarkMessages.class);

    @Message(id = 1, value = "Argument %s cannot be null")
    IllegalArgumentException argumentCannotBeNull(final String argument);

    @Message(id = 2, value = "Unterminated optional group opened at position %s in route definition '%s'")
    RoutePatternException unterminatedOptionalGroup(int position, String definition);

    @Message(id = 3, value = "Unexpected ')' at position %s in route definition '%s'")
    RoutePatternException unmatchedGroupClose(int position, String definition);

    @Message(id = 4, value = "Expected a parameter name after '%s' at position %s in route definition '%s'")
    RoutePatternException missingParameterName(char token, int position, String definition);

    @Message(id = 5, value = "Dangling escape character at the end of route definition '%s'")
    RoutePatternException danglingEscape(String definition);

    @Message(id = 6, value = "Capture name '%s' declared at position %s but pattern %s only has %s capture groups")
    IllegalArgumentException capturePositionOutOfRange(String name, int position, String pattern, int groupCount);

    @Message(id = 7, value = "Capture name '%s' declared at invalid position %s")
    IllegalArgumentException invalidCapturePosition(String name, int position);

    // id = 8

    @Message(id = 9, value = "Route definition must specify a path")
    IllegalArgumentException routeDefinitionWithoutPath();

    @Message(id = 10, value = "A route named '%s' has already been added")
    IllegalArgumentException duplicateRouteName(String name);

    @Message(id = 11, value = "Route set is frozen, no more routes can be added")
    IllegalStateException routeSetFrozen();

    @Message(id = 12, value = "Route set not finalized, rehash() must be called before generating URLs")
    IllegalStateException routeSetNotFinalized();

    @Message(id = 13, value = "No route named %s, failed to generate from %s")
    RoutingException namedRouteNotFound(String name, Map<String, ?> params);

    @Message(id = 14, value = "Route %s failed to generate from %s")
    RoutingException namedRouteFailedToGenerate(String name, Map<String, ?> params);

    @Message(id = 15, value = "No route matches %s")
    RoutingException noRouteMatches(Map<String, ?> params);

    @Message(id = 16, value = "Url parts to generate must not be empty")
    IllegalArgumentException noUrlPartsRequested();

    @Message(id = 17, value = "Failed to encode '%s' using charset %s")
    IllegalArgumentException failedToEncode(String value, String charset);
}
