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

import java.util.List;

import org.jboss.logging.BasicLogger;
import org.jboss.logging.Logger;
import org.jboss.logging.annotations.LogMessage;
import org.jboss.logging.annotations.Message;
import org.jboss.logging.annotations.MessageLogger;

import static org.jboss.logging.Logger.Level.DEBUG;
import static org.jboss.logging.Logger.Level.WARN;

/**
 * log messages start at 5000
 *
 * @author Waymark Contributors
 */
@MessageLogger(projectCode = "WM")
public interface WaymarkLogger extends BasicLogger {

    WaymarkLogger ROOT_LOGGER = Logger.getMessageLogger(WaymarkLogger.class, WaymarkLogger.class.getPackage().getName());

    /**
     * Logger used on the URL generation path. Lookups run once per generated link, so everything logged here is
     * debug or trace level.
     */
    WaymarkLogger GENERATION_LOGGER = Logger.getMessageLogger(WaymarkLogger.class, WaymarkLogger.class.getPackage().getName() + ".generation");

    @LogMessage(level = DEBUG)
    @Message(id = 5001, value = "Added route %s for path %s")
    void routeAdded(String route, String path);

    @LogMessage(level = DEBUG)
    @Message(id = 5002, value = "Rebuilt generation graph for %s routes using generation keys %s")
    void generationGraphRebuilt(int routes, List<String> generationKeys);

    @LogMessage(level = DEBUG)
    @Message(id = 5003, value = "Route set frozen with %s routes")
    void routeSetFrozen(int routes);

    @LogMessage(level = WARN)
    @Message(id = 5004, value = "Route %s was defined from a raw regular expression %s and can only be used for recognition, it will never generate URLs")
    void routeNotGeneratable(String route, String pattern);
}
