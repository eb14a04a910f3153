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
package io.signpost.util;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * HTTP method names as used by routing rules.
 */
public final class Methods {

    private Methods() {
    }

    public static final String OPTIONS = "OPTIONS";
    public static final String GET = "GET";
    public static final String HEAD = "HEAD";
    public static final String POST = "POST";
    public static final String PUT = "PUT";
    public static final String DELETE = "DELETE";
    public static final String PATCH = "PATCH";
    public static final String TRACE = "TRACE";
    public static final String CONNECT = "CONNECT";

    /**
     * Methods a websocket rule may accept.
     */
    public static final Set<String> WEBSOCKET_METHODS = Set.of(GET, HEAD, OPTIONS);

    /**
     * Methods for which the router is allowed to answer with a slash redirect.
     */
    public static final Set<String> SAFE_METHODS = Set.of(GET, HEAD);

    public static boolean isSafe(final String method) {
        return SAFE_METHODS.contains(method);
    }

    /**
     * Upper cases the given method names and adds {@code HEAD} when {@code GET} is present.
     *
     * @param methods The method names, may be null
     * @return An unmodifiable, ordered set, or null if the given collection was null or empty
     */
    public static Set<String> normalize(final Collection<String> methods) {
        if (methods == null || methods.isEmpty()) {
            return null;
        }
        final Set<String> result = new LinkedHashSet<>();
        for (String method : methods) {
            result.add(method.toUpperCase(Locale.ENGLISH));
        }
        if (result.contains(GET)) {
            result.add(HEAD);
        }
        return Collections.unmodifiableSet(result);
    }
}
