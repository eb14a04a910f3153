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
import java.util.Map;
import java.util.Set;

/**
 * The outcome of {@link UrlMapAdapter#match}. Routing misses are ordinary results rather than exceptions;
 * {@link #getOrThrow()} converts them for callers that prefer exceptions.
 */
public abstract class MatchResult {

    public enum Type {
        MATCHED,
        REDIRECT,
        NOT_FOUND,
        METHOD_NOT_ALLOWED,
        WEBSOCKET_MISMATCH
    }

    private static final NotFound NOT_FOUND = new NotFound();
    private static final WebsocketMismatch WEBSOCKET_MISMATCH = new WebsocketMismatch();

    MatchResult() {
    }

    public abstract Type getType();

    public boolean isMatched() {
        return getType() == Type.MATCHED;
    }

    /**
     * @return The match
     * @throws NotFoundException          if no rule matched
     * @throws MethodNotAllowedException  if rules matched but not for the method
     * @throws RequestRedirectException   if the request should be redirected
     * @throws WebsocketMismatchException if rules matched but not for the kind of request
     */
    public abstract Matched getOrThrow();

    public static Matched matched(final String endpoint, final Map<String, Object> values, final Rule rule) {
        return new Matched(endpoint, values, rule);
    }

    public static Redirect redirect(final String newUrl) {
        return new Redirect(newUrl);
    }

    public static NotFound notFound() {
        return NOT_FOUND;
    }

    public static MethodNotAllowed methodNotAllowed(final Set<String> allowedMethods) {
        return new MethodNotAllowed(allowedMethods);
    }

    public static WebsocketMismatch websocketMismatch() {
        return WEBSOCKET_MISMATCH;
    }

    public static final class Matched extends MatchResult {

        private final String endpoint;
        private final Map<String, Object> values;
        private final Rule rule;

        private Matched(final String endpoint, final Map<String, Object> values, final Rule rule) {
            this.endpoint = endpoint;
            this.values = Collections.unmodifiableMap(values);
            this.rule = rule;
        }

        @Override
        public Type getType() {
            return Type.MATCHED;
        }

        @Override
        public Matched getOrThrow() {
            return this;
        }

        public String getEndpoint() {
            return endpoint;
        }

        /**
         * @return The converted values of the variables, and the defaults of the rule
         */
        public Map<String, Object> getValues() {
            return values;
        }

        public Rule getRule() {
            return rule;
        }

        @Override
        public String toString() {
            return "Matched{" + endpoint + ", " + values + '}';
        }
    }

    public static final class Redirect extends MatchResult {

        private final String newUrl;

        private Redirect(final String newUrl) {
            this.newUrl = newUrl;
        }

        @Override
        public Type getType() {
            return Type.REDIRECT;
        }

        @Override
        public Matched getOrThrow() {
            throw new RequestRedirectException(newUrl);
        }

        public String getNewUrl() {
            return newUrl;
        }

        @Override
        public String toString() {
            return "Redirect{" + newUrl + '}';
        }
    }

    public static final class NotFound extends MatchResult {

        private NotFound() {
        }

        @Override
        public Type getType() {
            return Type.NOT_FOUND;
        }

        @Override
        public Matched getOrThrow() {
            throw SignpostMessages.MESSAGES.notFound();
        }

        @Override
        public String toString() {
            return "NotFound";
        }
    }

    public static final class MethodNotAllowed extends MatchResult {

        private final Set<String> allowedMethods;

        private MethodNotAllowed(final Set<String> allowedMethods) {
            this.allowedMethods = Collections.unmodifiableSet(new LinkedHashSet<>(allowedMethods));
        }

        @Override
        public Type getType() {
            return Type.METHOD_NOT_ALLOWED;
        }

        @Override
        public Matched getOrThrow() {
            throw new MethodNotAllowedException(allowedMethods);
        }

        public Set<String> getAllowedMethods() {
            return allowedMethods;
        }

        @Override
        public String toString() {
            return "MethodNotAllowed" + allowedMethods;
        }
    }

    public static final class WebsocketMismatch extends MatchResult {

        private WebsocketMismatch() {
        }

        @Override
        public Type getType() {
            return Type.WEBSOCKET_MISMATCH;
        }

        @Override
        public Matched getOrThrow() {
            throw SignpostMessages.MESSAGES.websocketMismatch();
        }

        @Override
        public String toString() {
            return "WebsocketMismatch";
        }
    }
}
