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

package io.signpost;

import org.jboss.logging.BasicLogger;
import org.jboss.logging.Logger;
import org.jboss.logging.annotations.LogMessage;
import org.jboss.logging.annotations.Message;
import org.jboss.logging.annotations.MessageLogger;

import static org.jboss.logging.Logger.Level.DEBUG;
import static org.jboss.logging.Logger.Level.WARN;

/**
 * log messages start at 5000
 */
@MessageLogger(projectCode = "SIGNPOST")
public interface SignpostLogger extends BasicLogger {

    SignpostLogger ROOT_LOGGER = Logger.getMessageLogger(SignpostLogger.class, SignpostLogger.class.getPackage().getName());

    /**
     * Logger for the per request match and build operations. Only trace and debug output is written here, routing misses
     * are ordinary events and are reported to the caller instead.
     */
    SignpostLogger REQUEST_LOGGER = Logger.getMessageLogger(SignpostLogger.class, SignpostLogger.class.getPackage().getName() + ".request");

    @LogMessage(level = DEBUG)
    @Message(id = 5001, value = "Bound %d rule(s), the map now holds %d rule(s) for %d endpoint(s)")
    void rulesBound(int added, int total, int endpoints);

    @LogMessage(level = DEBUG)
    @Message(id = 5002, value = "Rebuilt state machine matcher with %d state(s)")
    void matcherRebuilt(int states);

    @LogMessage(level = WARN)
    @Message(id = 5003, value = "Current server name %s doesn't match configured server name %s")
    void serverNameMismatch(String requestHost, String serverName);

    @LogMessage(level = DEBUG)
    @Message(id = 5004, value = "Rule %s of endpoint %s is build only and will not take part in matching")
    void buildOnlyRule(String rule, String endpoint);
}
