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

/**
 * Thrown when the request should be redirected to another URL, for example to add a missing trailing slash.
 */
public class RequestRedirectException extends RoutingException {

    private final String newUrl;

    public RequestRedirectException(final String newUrl) {
        super(SignpostMessages.MESSAGES.redirectRequired(newUrl));
        this.newUrl = newUrl;
    }

    public String getNewUrl() {
        return newUrl;
    }
}
