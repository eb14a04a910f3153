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

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Thrown when a path matches but not for the requested method.
 */
public class MethodNotAllowedException extends RoutingException {

    private final Set<String> allowedMethods;

    public MethodNotAllowedException(final Set<String> allowedMethods) {
        super(SignpostMessages.MESSAGES.methodNotAllowed(allowedMethods));
        this.allowedMethods = Collections.unmodifiableSet(new LinkedHashSet<>(allowedMethods));
    }

    /**
     * @return The methods that would have matched, for an {@code Allow} header
     */
    public Set<String> getAllowedMethods() {
        return allowedMethods;
    }
}
