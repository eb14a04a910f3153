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

import io.signpost.SignpostLogger;
import io.signpost.SignpostMessages;
import io.signpost.SignpostOptions;
import io.signpost.routing.converter.ConverterFactory;
import io.signpost.routing.converter.Converters;
import io.signpost.util.Methods;
import io.signpost.util.URLUtils;
import org.xnio.Option;
import org.xnio.OptionMap;

import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Holds the rules of an application and binds them to requests.
 * <pre>
 * UrlMap map = UrlMap.builder()
 *         .addRule(Rule.builder("/").endpoint("index").build())
 *         .addRule(Rule.builder("/downloads/&lt;int:id&gt;").endpoint("downloads.show").build())
 *         .build();
 * UrlMapAdapter adapter = map.bind("example.com");
 * MatchResult result = adapter.match("/downloads/42");
 * </pre>
 * Rules can be added while requests are routed. Every mutation compiles the new rules and publishes a new immutable
 * snapshot of all rules and the matcher built from them, so routing threads never wait for writers and never see a
 * partially applied mutation. Mutations are serialized; a mutation that fails leaves the map as it was.
 */
public class UrlMap {

    /**
     * The rules of the map at one point in time, with the structures derived from them.
     */
    static final class Snapshot {

        private final List<CompiledRule> rules;
        private final Map<String, List<CompiledRule>> rulesByEndpoint;
        private final Map<List<RulePart>, List<CompiledRule>> rulesBySignature;
        private final StateMachineMatcher matcher;

        private Snapshot(final List<CompiledRule> rules) {
            this.rules = Collections.unmodifiableList(rules);
            final Map<String, List<CompiledRule>> byEndpoint = new HashMap<>();
            final Map<List<RulePart>, List<CompiledRule>> bySignature = new HashMap<>();
            for (CompiledRule rule : rules) {
                if (rule.getEndpoint() != null) {
                    byEndpoint.computeIfAbsent(rule.getEndpoint(), k -> new ArrayList<>()).add(rule);
                }
                if (!rule.isBuildOnly()) {
                    bySignature.computeIfAbsent(rule.getParts(), k -> new ArrayList<>()).add(rule);
                }
            }
            for (Map.Entry<String, List<CompiledRule>> entry : byEndpoint.entrySet()) {
                // aliases last, otherwise in the order the rules were added
                entry.getValue().sort(Comparator.comparing(CompiledRule::isAlias).thenComparing(CompiledRule::getId));
                entry.setValue(Collections.unmodifiableList(entry.getValue()));
            }
            this.rulesByEndpoint = byEndpoint;
            this.rulesBySignature = bySignature;
            this.matcher = StateMachineMatcher.create(rules);
        }

        List<CompiledRule> getRules() {
            return rules;
        }

        /**
         * @return The rules of the endpoint in the order they are tried when building
         */
        List<CompiledRule> getRules(final String endpoint) {
            final List<CompiledRule> result = rulesByEndpoint.get(endpoint);
            return result == null ? Collections.emptyList() : result;
        }

        int getEndpointCount() {
            return rulesByEndpoint.size();
        }

        StateMachineMatcher getMatcher() {
            return matcher;
        }

        private CompiledRule findDuplicate(final CompiledRule rule) {
            if (rule.isBuildOnly()) {
                return null;
            }
            final List<CompiledRule> candidates = rulesBySignature.get(rule.getParts());
            if (candidates == null) {
                return null;
            }
            for (CompiledRule candidate : candidates) {
                if (candidate.hasSameSignature(rule) && candidate.methodsOverlap(rule)) {
                    return candidate;
                }
            }
            return null;
        }
    }

    private final OptionMap options;
    private final boolean strictSlashes;
    private final boolean mergeSlashes;
    private final boolean redirectDefaults;
    private final boolean hostMatching;
    private final boolean subdomainMatching;
    private final String defaultSubdomain;
    private final Charset charset;
    private final Comparator<String> sortKey;
    private final Map<String, ConverterFactory> converters;
    private final RuleCompiler compiler;

    private final ReentrantLock lock = new ReentrantLock();
    private volatile Snapshot snapshot = new Snapshot(new ArrayList<>());

    private UrlMap(final Builder builder) {
        this.options = builder.options.getMap();
        this.strictSlashes = options.get(SignpostOptions.STRICT_SLASHES, SignpostOptions.DEFAULT_STRICT_SLASHES);
        this.mergeSlashes = options.get(SignpostOptions.MERGE_SLASHES, SignpostOptions.DEFAULT_MERGE_SLASHES);
        this.redirectDefaults = options.get(SignpostOptions.REDIRECT_DEFAULTS, SignpostOptions.DEFAULT_REDIRECT_DEFAULTS);
        this.hostMatching = options.get(SignpostOptions.HOST_MATCHING, false);
        this.subdomainMatching = options.get(SignpostOptions.SUBDOMAIN_MATCHING, false);
        if (hostMatching && subdomainMatching) {
            throw SignpostMessages.MESSAGES.hostAndSubdomainMatching();
        }
        this.defaultSubdomain = options.get(SignpostOptions.DEFAULT_SUBDOMAIN, "");
        this.charset = URLUtils.charset(options.get(SignpostOptions.URL_CHARSET, SignpostOptions.DEFAULT_URL_CHARSET));
        if (options.get(SignpostOptions.SORT_PARAMETERS, false)) {
            this.sortKey = builder.sortKey == null ? Comparator.naturalOrder() : builder.sortKey;
        } else {
            this.sortKey = null;
        }
        this.converters = Collections.unmodifiableMap(new LinkedHashMap<>(builder.converters));
        this.compiler = new RuleCompiler(converters, charset, strictSlashes, mergeSlashes, hostMatching, subdomainMatching, defaultSubdomain);
        if (!builder.rules.isEmpty()) {
            addAll(builder.rules);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Adds the rules of a factory.
     *
     * @throws RuleSyntaxException    if a rule cannot be compiled
     * @throws DuplicateRuleException if a rule has the same pattern as an existing one
     */
    public void add(final RuleFactory factory) {
        addAll(Collections.singletonList(factory));
    }

    public void addAll(final RuleFactory... factories) {
        addAll(Arrays.asList(factories));
    }

    /**
     * Adds the rules of several factories. Either all of the rules are added or none are.
     */
    public void addAll(final Collection<? extends RuleFactory> factories) {
        lock.lock();
        try {
            final Snapshot current = snapshot;
            final List<CompiledRule> rules = new ArrayList<>(current.getRules());
            final List<CompiledRule> added = new ArrayList<>();
            for (RuleFactory factory : factories) {
                for (Rule rule : factory.getRules()) {
                    final CompiledRule compiled = compiler.compile(rule, rules.size());
                    checkDuplicate(current, added, compiled);
                    rules.add(compiled);
                    added.add(compiled);
                    if (rule.isBuildOnly()) {
                        SignpostLogger.ROOT_LOGGER.buildOnlyRule(rule.getTemplate(), rule.getEndpoint());
                    }
                }
            }
            final Snapshot next = new Snapshot(rules);
            snapshot = next;
            SignpostLogger.ROOT_LOGGER.rulesBound(added.size(), rules.size(), next.getEndpointCount());
            SignpostLogger.ROOT_LOGGER.matcherRebuilt(next.getMatcher().getStateCount());
        } finally {
            lock.unlock();
        }
    }

    private static void checkDuplicate(final Snapshot current, final List<CompiledRule> added, final CompiledRule rule) {
        CompiledRule existing = current.findDuplicate(rule);
        if (existing == null && !rule.isBuildOnly()) {
            for (CompiledRule other : added) {
                if (!other.isBuildOnly() && other.hasSameSignature(rule) && other.methodsOverlap(rule)) {
                    existing = other;
                    break;
                }
            }
        }
        if (existing != null) {
            throw SignpostMessages.MESSAGES.duplicateRule(rule.getRule().toString(), rule.getEndpoint(),
                    existing.getRule().toString(), existing.getEndpoint());
        }
    }

    Snapshot getSnapshot() {
        return snapshot;
    }

    /**
     * @return All rules in the order they were added
     */
    public List<Rule> getRules() {
        final List<CompiledRule> compiled = snapshot.getRules();
        final List<Rule> rules = new ArrayList<>(compiled.size());
        for (CompiledRule rule : compiled) {
            rules.add(rule.getRule());
        }
        return rules;
    }

    /**
     * @param endpoint The endpoint, or null for all rules
     * @return The rules of the endpoint in the order they are tried when building URLs
     */
    public List<Rule> iterRules(final String endpoint) {
        if (endpoint == null) {
            return getRules();
        }
        final List<Rule> rules = new ArrayList<>();
        for (CompiledRule rule : snapshot.getRules(endpoint)) {
            rules.add(rule.getRule());
        }
        return rules;
    }

    /**
     * Checks if a rule of an endpoint has all the given arguments, for example to find out if a language code should be
     * supplied when building.
     *
     * @param endpoint  The endpoint
     * @param arguments The argument names
     * @return True if any rule of the endpoint has all of the arguments
     */
    public boolean isEndpointExpecting(final String endpoint, final String... arguments) {
        final Set<String> expected = new HashSet<>(Arrays.asList(arguments));
        for (CompiledRule rule : snapshot.getRules(endpoint)) {
            if (rule.getArguments().containsAll(expected)) {
                return true;
            }
        }
        return false;
    }

    public UrlMapAdapter bind(final String serverName) {
        return bind(serverName, null, null, null, null, null, null);
    }

    public UrlMapAdapter bind(final String serverName, final String urlScheme) {
        return bind(serverName, null, null, urlScheme, null, null, null);
    }

    /**
     * Binds the map to the attributes of a request.
     *
     * @param serverName    The server name, for example {@code example.com}. Lower cased.
     * @param scriptName    The path the application is mounted at, defaults to {@code /}
     * @param subdomain     The subdomain, defaults to the default subdomain. Must be null with host matching.
     * @param urlScheme     The scheme, defaults to {@code http}
     * @param defaultMethod The method used when none is given, defaults to {@code GET}
     * @param pathInfo      The path used when none is given, defaults to {@code /}
     * @param queryArgs     The query arguments of the request, added to redirects
     * @return The adapter
     */
    public UrlMapAdapter bind(final String serverName, final String scriptName, final String subdomain, final String urlScheme,
                              final String defaultMethod, final String pathInfo, final Map<String, Deque<String>> queryArgs) {
        if (hostMatching && subdomain != null) {
            throw SignpostMessages.MESSAGES.subdomainWithHostMatching();
        }
        return new UrlMapAdapter(this,
                serverName.toLowerCase(Locale.ENGLISH),
                scriptName == null ? "/" : scriptName,
                subdomain == null ? defaultSubdomain : subdomain,
                urlScheme == null ? "http" : urlScheme,
                defaultMethod == null ? Methods.GET : defaultMethod.toUpperCase(Locale.ENGLISH),
                pathInfo == null ? "/" : pathInfo,
                queryArgs == null ? Collections.emptyMap() : queryArgs);
    }

    public UrlMapAdapter bindToHost(final String requestHost, final String serverName) {
        return bindToHost(requestHost, serverName, null, null, null, null, null);
    }

    /**
     * Binds the map to a request, taking the subdomain from the host the request was sent to. If the host does not end
     * with the configured server name, which can happen when the server is accessed by IP address, a warning is logged
     * and the subdomain is set to an invalid value so that no rule with a subdomain matches.
     *
     * @param requestHost The host the request was sent to, with an optional port
     * @param serverName  The configured server name, or null to use the request host
     */
    public UrlMapAdapter bindToHost(final String requestHost, final String serverName, final String scriptName,
                                    final String urlScheme, final String method, final String pathInfo,
                                    final Map<String, Deque<String>> queryArgs) {
        final String scheme = urlScheme == null ? "http" : urlScheme;
        final String host = stripDefaultPort(requestHost.toLowerCase(Locale.ENGLISH), scheme);
        final String name = serverName == null ? host : stripDefaultPort(serverName.toLowerCase(Locale.ENGLISH), scheme);
        String subdomain = null;
        if (!hostMatching) {
            final String[] current = host.split("\\.");
            final String[] real = name.split("\\.");
            final int offset = current.length - real.length;
            if (offset < 0 || !Arrays.equals(current, offset, current.length, real, 0, real.length)) {
                SignpostLogger.ROOT_LOGGER.serverNameMismatch(host, name);
                subdomain = "<invalid>";
            } else {
                final StringBuilder sb = new StringBuilder();
                for (int i = 0; i < offset; ++i) {
                    if (current[i].isEmpty()) {
                        continue;
                    }
                    if (sb.length() > 0) {
                        sb.append('.');
                    }
                    sb.append(current[i]);
                }
                subdomain = sb.toString();
            }
        }
        return bind(name, scriptName, subdomain, scheme, method, pathInfo, queryArgs);
    }

    private static String stripDefaultPort(final String host, final String scheme) {
        if (("http".equals(scheme) || "ws".equals(scheme)) && host.endsWith(":80")) {
            return host.substring(0, host.length() - 3);
        } else if (("https".equals(scheme) || "wss".equals(scheme)) && host.endsWith(":443")) {
            return host.substring(0, host.length() - 4);
        }
        return host;
    }

    public OptionMap getOptions() {
        return options;
    }

    public boolean isStrictSlashes() {
        return strictSlashes;
    }

    public boolean isMergeSlashes() {
        return mergeSlashes;
    }

    public boolean isRedirectDefaults() {
        return redirectDefaults;
    }

    public boolean isHostMatching() {
        return hostMatching;
    }

    public boolean isSubdomainMatching() {
        return subdomainMatching;
    }

    public String getDefaultSubdomain() {
        return defaultSubdomain;
    }

    public Charset getCharset() {
        return charset;
    }

    /**
     * @return The order of the query parameters of built URLs, or null if they are not sorted
     */
    public Comparator<String> getSortKey() {
        return sortKey;
    }

    public Map<String, ConverterFactory> getConverters() {
        return converters;
    }

    public static final class Builder {

        private final List<RuleFactory> rules = new ArrayList<>();
        private final OptionMap.Builder options = OptionMap.builder();
        private final Map<String, ConverterFactory> converters = new LinkedHashMap<>(Converters.DEFAULT_CONVERTERS);
        private Comparator<String> sortKey;

        private Builder() {
        }

        public Builder addRule(final RuleFactory rule) {
            rules.add(rule);
            return this;
        }

        public Builder addRules(final Collection<? extends RuleFactory> rules) {
            this.rules.addAll(rules);
            return this;
        }

        public <T> Builder setOption(final Option<T> option, final T value) {
            options.set(option, value);
            return this;
        }

        /**
         * Registers a converter, replacing a built in one with the same name.
         */
        public Builder addConverter(final String name, final ConverterFactory factory) {
            converters.put(name, factory);
            return this;
        }

        /**
         * Sets the order of query parameters when {@link SignpostOptions#SORT_PARAMETERS} is enabled. Defaults to the
         * natural order of the names.
         */
        public Builder setSortKey(final Comparator<String> sortKey) {
            this.sortKey = sortKey;
            return this;
        }

        public UrlMap build() {
            return new UrlMap(this);
        }
    }
}
