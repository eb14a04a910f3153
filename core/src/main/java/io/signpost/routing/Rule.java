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
import io.signpost.util.Methods;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A URL rule: a path template, and optionally a subdomain or host template, that maps requests to an endpoint.
 * <p>
 * Templates are normal URL paths with placeholders of the form {@code <converter(arguments):name>}, where the converter
 * and its arguments are optional:
 * <pre>
 * Rule.builder("/").endpoint("index").build();
 * Rule.builder("/pages/&lt;int:page&gt;").endpoint("pages").methods("GET", "POST").build();
 * Rule.builder("/&lt;path:wikipage&gt;/edit").endpoint("wiki.edit").build();
 * </pre>
 * A template ending with a slash is a branch URL, others are leaves. With strict slashes a request for a branch URL
 * without the slash is redirected to the URL with the slash, and a request for a leaf URL with a trailing slash is
 * redirected to the URL without it.
 * <p>
 * Rules are immutable. A rule is compiled against the configuration of the map it is added to, so the same rule can be
 * added to several maps.
 */
public final class Rule implements RuleFactory {

    /**
     * Computes the target of a redirecting rule for a matched request.
     */
    @FunctionalInterface
    public interface RedirectTarget {

        /**
         * @param adapter The adapter the request was matched with
         * @param values  The converted values of the request, including defaults
         * @return A URL, resolved against the bound scheme, host and script name if it is relative
         */
        String getRedirectUrl(UrlMapAdapter adapter, Map<String, Object> values);
    }

    private final String template;
    private final String endpoint;
    private final Set<String> methods;
    private final Map<String, Object> defaults;
    private final String subdomain;
    private final String host;
    private final Boolean strictSlashes;
    private final Boolean mergeSlashes;
    private final boolean websocket;
    private final boolean alias;
    private final boolean buildOnly;
    private final Object redirectTo;
    private final Set<String> arguments;

    private Rule(final Builder builder) {
        this.template = builder.template;
        this.endpoint = builder.endpoint;
        this.methods = Methods.normalize(builder.methods);
        this.defaults = Collections.unmodifiableMap(new LinkedHashMap<>(builder.defaults));
        this.subdomain = builder.subdomain;
        this.host = builder.host;
        this.strictSlashes = builder.strictSlashes;
        this.mergeSlashes = builder.mergeSlashes;
        this.websocket = builder.websocket;
        this.alias = builder.alias;
        this.buildOnly = builder.buildOnly;
        this.redirectTo = builder.redirectTo;

        if (template == null || !template.startsWith("/")) {
            throw SignpostMessages.MESSAGES.ruleMustStartWithSlash(template);
        }
        if (endpoint == null && redirectTo == null) {
            throw SignpostMessages.MESSAGES.ruleWithoutEndpoint(template);
        }
        if (websocket && methods != null && !Methods.WEBSOCKET_METHODS.containsAll(methods)) {
            throw SignpostMessages.MESSAGES.websocketRuleMethods(template);
        }
        final Set<String> arguments = new LinkedHashSet<>();
        if (host != null) {
            arguments.addAll(RuleCompiler.variableNames(host));
        } else if (subdomain != null) {
            arguments.addAll(RuleCompiler.variableNames(subdomain));
        }
        arguments.addAll(RuleCompiler.variableNames(template));
        arguments.addAll(defaults.keySet());
        this.arguments = Collections.unmodifiableSet(arguments);
    }

    public static Builder builder(final String template) {
        return new Builder(template);
    }

    /**
     * @return A builder initialised with the attributes of this rule, for deriving rules from it
     */
    public Builder toBuilder() {
        final Builder builder = new Builder(template);
        builder.endpoint = endpoint;
        builder.methods = methods;
        builder.defaults.putAll(defaults);
        builder.subdomain = subdomain;
        builder.host = host;
        builder.strictSlashes = strictSlashes;
        builder.mergeSlashes = mergeSlashes;
        builder.websocket = websocket;
        builder.alias = alias;
        builder.buildOnly = buildOnly;
        builder.redirectTo = redirectTo;
        return builder;
    }

    @Override
    public List<Rule> getRules() {
        return Collections.singletonList(this);
    }

    public String getTemplate() {
        return template;
    }

    public String getEndpoint() {
        return endpoint;
    }

    /**
     * @return The accepted methods, upper case, or null if every method is accepted
     */
    public Set<String> getMethods() {
        return methods;
    }

    public Map<String, Object> getDefaults() {
        return defaults;
    }

    public String getSubdomain() {
        return subdomain;
    }

    public String getHost() {
        return host;
    }

    /**
     * @return The strict slashes setting, or null if the map setting applies
     */
    public Boolean getStrictSlashes() {
        return strictSlashes;
    }

    /**
     * @return The merge slashes setting, or null if the map setting applies
     */
    public Boolean getMergeSlashes() {
        return mergeSlashes;
    }

    public boolean isWebsocket() {
        return websocket;
    }

    public boolean isAlias() {
        return alias;
    }

    public boolean isBuildOnly() {
        return buildOnly;
    }

    /**
     * @return The redirect target, a {@link String} template or a {@link RedirectTarget}, or null
     */
    public Object getRedirectTo() {
        return redirectTo;
    }

    /**
     * @return The names of the variables of the templates and the defaults
     */
    public Set<String> getArguments() {
        return arguments;
    }

    public boolean isLeaf() {
        return !template.endsWith("/");
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final Rule rule = (Rule) o;
        return websocket == rule.websocket
                && alias == rule.alias
                && buildOnly == rule.buildOnly
                && template.equals(rule.template)
                && Objects.equals(endpoint, rule.endpoint)
                && Objects.equals(methods, rule.methods)
                && defaults.equals(rule.defaults)
                && Objects.equals(subdomain, rule.subdomain)
                && Objects.equals(host, rule.host)
                && Objects.equals(strictSlashes, rule.strictSlashes)
                && Objects.equals(mergeSlashes, rule.mergeSlashes)
                && Objects.equals(redirectTo, rule.redirectTo);
    }

    @Override
    public int hashCode() {
        return Objects.hash(template, endpoint, methods, subdomain, host, websocket);
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder();
        if (host != null) {
            sb.append(host);
        } else if (subdomain != null) {
            sb.append(subdomain).append('.');
        }
        sb.append(template);
        if (methods != null) {
            sb.append(' ').append(methods);
        }
        sb.append(" -> ").append(endpoint);
        return sb.toString();
    }

    public static final class Builder {

        private String template;
        private String endpoint;
        private Collection<String> methods;
        private final Map<String, Object> defaults = new LinkedHashMap<>();
        private String subdomain;
        private String host;
        private Boolean strictSlashes;
        private Boolean mergeSlashes;
        private boolean websocket;
        private boolean alias;
        private boolean buildOnly;
        private Object redirectTo;

        private Builder(final String template) {
            this.template = template;
        }

        public Builder template(final String template) {
            this.template = template;
            return this;
        }

        public Builder endpoint(final String endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder methods(final String... methods) {
            this.methods = methods == null ? null : Arrays.asList(methods);
            return this;
        }

        public Builder methods(final Collection<String> methods) {
            this.methods = methods;
            return this;
        }

        public Builder defaults(final Map<String, ?> defaults) {
            this.defaults.clear();
            if (defaults != null) {
                this.defaults.putAll(defaults);
            }
            return this;
        }

        public Builder defaultValue(final String name, final Object value) {
            this.defaults.put(name, value);
            return this;
        }

        public Builder subdomain(final String subdomain) {
            this.subdomain = subdomain;
            return this;
        }

        public Builder host(final String host) {
            this.host = host;
            return this;
        }

        public Builder strictSlashes(final Boolean strictSlashes) {
            this.strictSlashes = strictSlashes;
            return this;
        }

        public Builder mergeSlashes(final Boolean mergeSlashes) {
            this.mergeSlashes = mergeSlashes;
            return this;
        }

        public Builder websocket(final boolean websocket) {
            this.websocket = websocket;
            return this;
        }

        /**
         * Marks the rule as an alias of the other rules of the endpoint. Requests matched by an alias are redirected to
         * the URL built for the endpoint if the map redirects defaults.
         */
        public Builder alias(final boolean alias) {
            this.alias = alias;
            return this;
        }

        /**
         * Marks the rule as only usable for building URLs, it never matches a request.
         */
        public Builder buildOnly(final boolean buildOnly) {
            this.buildOnly = buildOnly;
            return this;
        }

        /**
         * Redirects matched requests. {@code <name>} placeholders in the target are replaced with the converted values of
         * the request.
         */
        public Builder redirectTo(final String redirectTo) {
            this.redirectTo = redirectTo;
            return this;
        }

        public Builder redirectTo(final RedirectTarget redirectTo) {
            this.redirectTo = redirectTo;
            return this;
        }

        public Rule build() {
            return new Rule(this);
        }
    }
}
