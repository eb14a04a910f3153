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

package io.signpost.routing;

import io.signpost.SignpostMessages;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Thrown when no rule of an endpoint can build a URL from the given values.
 */
public class BuildException extends RoutingException {

    private final String endpoint;
    private final Map<String, Object> values;
    private final String method;
    private final Rule suggested;

    public BuildException(final String endpoint, final Map<String, ?> values, final String method, final Rule suggested) {
        super(message(endpoint, values, method, suggested));
        this.endpoint = endpoint;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        this.method = method;
        this.suggested = suggested;
    }

    private static String message(final String endpoint, final Map<String, ?> values, final String method, final Rule suggested) {
        final SignpostMessages messages = SignpostMessages.MESSAGES;
        final String message;
        if (method == null) {
            message = values.isEmpty() ? messages.couldNotBuildUrl(endpoint) : messages.couldNotBuildUrlWithValues(endpoint, values.keySet());
        } else {
            message = values.isEmpty() ? messages.couldNotBuildUrlWithMethod(endpoint, method)
                    : messages.couldNotBuildUrlWithMethodAndValues(endpoint, method, values.keySet());
        }
        if (suggested == null) {
            return message;
        }
        if (!Objects.equals(endpoint, suggested.getEndpoint())) {
            return message + ' ' + messages.suggestEndpoint(suggested.getEndpoint());
        }
        if (method != null && suggested.getMethods() != null && !suggested.getMethods().contains(method)) {
            return message + ' ' + messages.suggestMethods(suggested.getMethods());
        }
        return message + ' ' + messages.suggestMissingValues(missingArguments(suggested, values));
    }

    private static List<String> missingArguments(final Rule rule, final Map<String, ?> values) {
        final List<String> missing = new ArrayList<>();
        for (String argument : rule.getArguments()) {
            if (!values.containsKey(argument) && !rule.getDefaults().containsKey(argument)) {
                missing.add(argument);
            }
        }
        return missing;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public Map<String, Object> getValues() {
        return values;
    }

    public String getMethod() {
        return method;
    }

    /**
     * @return The rule that comes closest to what was asked for, or null if there is none
     */
    public Rule getSuggestedRule() {
        return suggested;
    }
}
