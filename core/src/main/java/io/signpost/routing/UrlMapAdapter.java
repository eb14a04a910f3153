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
import io.signpost.routing.CompiledRule.BuiltUrl;
import io.signpost.routing.converter.Converter;
import io.signpost.routing.converter.ValidationException;
import io.signpost.util.QueryParameterUtils;
import io.signpost.util.URLUtils;

import java.net.URI;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A {@link UrlMap} bound to the attributes of one request, created by {@link UrlMap#bind}. Matches paths and builds URLs
 * relative to the bound server name, script name, subdomain and scheme.
 * <p>
 * Adapters hold no mutable state. Each call works on the rules of the map at the time of the call.
 */
public class UrlMapAdapter {

    private static final Pattern REDIRECT_VARIABLE = Pattern.compile("<([^>]+)>");
    private static final String NO_METHOD = "--";

    private final UrlMap map;
    private final String serverName;
    private final String scriptName;
    private final String subdomain;
    private final String urlScheme;
    private final String defaultMethod;
    private final String pathInfo;
    private final Map<String, Deque<String>> queryArgs;

    UrlMapAdapter(final UrlMap map, final String serverName, final String scriptName, final String subdomain,
                  final String urlScheme, final String defaultMethod, final String pathInfo,
                  final Map<String, Deque<String>> queryArgs) {
        this.map = map;
        this.serverName = serverName;
        this.scriptName = scriptName.endsWith("/") ? scriptName : scriptName + "/";
        this.subdomain = subdomain;
        this.urlScheme = urlScheme;
        this.defaultMethod = defaultMethod;
        this.pathInfo = pathInfo;
        this.queryArgs = queryArgs;
    }

    //<editor-fold defaultstate="collapsed" desc="Matching">
    /**
     * Matches the bound path with the bound method.
     */
    public MatchResult match() {
        return match(null, null, null, null);
    }

    public MatchResult match(final String path) {
        return match(path, null, null, null);
    }

    public MatchResult match(final String path, final String method) {
        return match(path, method, null, null);
    }

    public MatchResult match(final String path, final String method, final Map<String, Deque<String>> queryArgs) {
        return match(path, method, queryArgs, null);
    }

    /**
     * Matches a request.
     *
     * @param path      The decoded path, defaults to the bound path
     * @param method    The method, defaults to the bound method
     * @param queryArgs The query arguments, added to redirect URLs. Default to the bound ones.
     * @param websocket If the request is a websocket request, defaults to true for the {@code ws} and {@code wss} schemes
     * @return The result
     */
    public MatchResult match(final String path, final String method, final Map<String, Deque<String>> queryArgs, final Boolean websocket) {
        final UrlMap.Snapshot snapshot = map.getSnapshot();
        final String requestPath = URLUtils.singleLeadingSlash(path == null ? pathInfo : path);
        final String requestMethod = (method == null ? defaultMethod : method).toUpperCase(Locale.ENGLISH);
        final Map<String, Deque<String>> args = queryArgs == null ? this.queryArgs : queryArgs;
        final boolean ws = websocket == null ? isWebsocketScheme(urlScheme) : websocket;

        final StateMachineMatcher.Result result = snapshot.getMatcher().match(getDomain(), requestPath, requestMethod, ws);
        switch (result.getType()) {
            case REDIRECT: {
                final String url = makeRedirectUrl(URLUtils.quote(result.getRedirectPath(), map.getCharset(), URLUtils.PATH_SAFE), args);
                SignpostLogger.REQUEST_LOGGER.debugf("Redirecting %s %s to %s", requestMethod, requestPath, url);
                return MatchResult.redirect(url);
            }
            case MATCH:
                return matched(snapshot, result, requestPath, requestMethod, args);
            default:
                break;
        }
        if (!result.getAllowedMethods().isEmpty()) {
            SignpostLogger.REQUEST_LOGGER.tracef("Method %s not allowed for %s, allowed %s", requestMethod, requestPath, result.getAllowedMethods());
            return MatchResult.methodNotAllowed(result.getAllowedMethods());
        } else if (result.isWebsocketMismatch()) {
            SignpostLogger.REQUEST_LOGGER.tracef("Websocket mismatch for %s", requestPath);
            return MatchResult.websocketMismatch();
        }
        SignpostLogger.REQUEST_LOGGER.tracef("No rule matches %s %s", requestMethod, requestPath);
        return MatchResult.notFound();
    }

    private MatchResult matched(final UrlMap.Snapshot snapshot, final StateMachineMatcher.Result result, final String path,
                                final String method, final Map<String, Deque<String>> args) {
        final CompiledRule rule = result.getRule();
        final Map<String, Object> values = new LinkedHashMap<>();
        final Iterator<Object> converted = result.getValues().iterator();
        for (String name : rule.getConverters().keySet()) {
            values.put(name, converted.next());
        }
        values.putAll(rule.getDefaults());

        if (map.isRedirectDefaults()) {
            if (rule.isAlias()) {
                return MatchResult.redirect(aliasRedirectUrl(rule, values, path, method, args));
            }
            final String url = defaultRedirectUrl(snapshot, rule, values, method, args);
            if (url != null) {
                SignpostLogger.REQUEST_LOGGER.debugf("Redirecting %s to %s, a rule with defaults for %s", path, url, rule.getEndpoint());
                return MatchResult.redirect(url);
            }
        }
        if (rule.getRule().getRedirectTo() != null) {
            final String url = redirectToUrl(rule, values);
            SignpostLogger.REQUEST_LOGGER.debugf("Redirecting %s to %s", path, url);
            return MatchResult.redirect(url);
        }
        SignpostLogger.REQUEST_LOGGER.tracef("Matched %s %s to %s with %s", method, path, rule.getEndpoint(), values);
        return MatchResult.matched(rule.getEndpoint(), values, rule.getRule());
    }

    private String aliasRedirectUrl(final CompiledRule rule, final Map<String, Object> values, final String path,
                                    final String method, final Map<String, Deque<String>> args) {
        String url = build(rule.getEndpoint(), values, method, true, false, null);
        if (!args.isEmpty()) {
            url += "?" + QueryParameterUtils.buildQueryString(args, map.getCharset());
        }
        if (url.equals(makeRedirectUrl(URLUtils.quote(path, map.getCharset(), URLUtils.PATH_SAFE), args))) {
            throw SignpostMessages.MESSAGES.noCanonicalUrlForAlias(url);
        }
        return url;
    }

    /**
     * Finds a rule of the same endpoint with the same arguments that comes before the matched rule and has defaults that
     * agree with the matched values. The URL of that rule is the canonical one.
     */
    private String defaultRedirectUrl(final UrlMap.Snapshot snapshot, final CompiledRule rule, final Map<String, Object> values,
                                      final String method, final Map<String, Deque<String>> args) {
        for (CompiledRule candidate : snapshot.getRules(rule.getEndpoint())) {
            if (candidate == rule) {
                break;
            }
            if (candidate.isBuildOnly()
                    || candidate.getDefaults().isEmpty()
                    || !candidate.getArguments().equals(rule.getArguments())
                    || !candidate.suitableFor(values, method)) {
                continue;
            }
            final Map<String, Object> merged = new LinkedHashMap<>(values);
            merged.putAll(candidate.getDefaults());
            final BuiltUrl built = candidate.build(merged, true, map.getSortKey());
            if (built != null) {
                return makeRedirectUrl(built.path, args, built.domain);
            }
        }
        return null;
    }

    private String redirectToUrl(final CompiledRule rule, final Map<String, Object> values) {
        final Object redirectTo = rule.getRule().getRedirectTo();
        final String target;
        if (redirectTo instanceof Rule.RedirectTarget) {
            target = ((Rule.RedirectTarget) redirectTo).getRedirectUrl(this, Collections.unmodifiableMap(values));
        } else {
            final String template = (String) redirectTo;
            final Matcher matcher = REDIRECT_VARIABLE.matcher(template);
            final StringBuilder sb = new StringBuilder();
            int last = 0;
            while (matcher.find()) {
                final String name = matcher.group(1);
                if (!values.containsKey(name)) {
                    throw SignpostMessages.MESSAGES.missingRedirectVariable(name, template);
                }
                final Converter converter = rule.getConverters().get(name);
                sb.append(template, last, matcher.start());
                try {
                    sb.append(converter == null
                            ? URLUtils.quote(String.valueOf(values.get(name)), map.getCharset(), URLUtils.PATH_SAFE)
                            : converter.toUrl(values.get(name)));
                } catch (ValidationException e) {
                    throw SignpostMessages.MESSAGES.invalidRedirectValue(name, template, e);
                }
                last = matcher.end();
            }
            sb.append(template, last, template.length());
            target = sb.toString();
        }
        return URI.create(urlScheme + "://" + getHost(null) + scriptName).resolve(target).toString();
    }

    /**
     * @return True if the path matches a rule for the method, or would be redirected
     */
    public boolean test(final String path, final String method) {
        final MatchResult.Type type = match(path, method).getType();
        return type == MatchResult.Type.MATCHED || type == MatchResult.Type.REDIRECT;
    }

    public boolean test(final String path) {
        return test(path, null);
    }

    /**
     * @return The methods rules for the path accept, empty if no rule matches the path
     */
    public Set<String> allowedMethods(final String path) {
        final MatchResult result = match(path, NO_METHOD);
        if (result instanceof MatchResult.MethodNotAllowed) {
            return ((MatchResult.MethodNotAllowed) result).getAllowedMethods();
        }
        return Collections.emptySet();
    }
    //</editor-fold>

    //<editor-fold defaultstate="collapsed" desc="Building">
    public String build(final String endpoint) {
        return build(endpoint, Collections.emptyMap(), null, false, true, null);
    }

    public String build(final String endpoint, final Map<String, ?> values) {
        return build(endpoint, values, null, false, true, null);
    }

    public String build(final String endpoint, final Map<String, ?> values, final String method) {
        return build(endpoint, values, method, false, true, null);
    }

    public String build(final String endpoint, final Map<String, ?> values, final boolean forceExternal) {
        return build(endpoint, values, null, forceExternal, true, null);
    }

    /**
     * Builds a URL for an endpoint.
     * <p>
     * The rules of the endpoint are tried in order. A rule is used if it accepts the method, every one of its variables
     * has a value or a default, every default agrees with the given value and its converters accept the values. Values
     * that are not variables of the rule are appended as the query string when {@code appendUnknown} is set.
     * <p>
     * The URL is relative to the server unless {@code forceExternal} is set, the rule is for a different host or
     * subdomain, or the rule is a websocket rule.
     *
     * @param endpoint      The endpoint
     * @param values        The values. Null values are ignored, collections with one element stand for that element.
     * @param method        The method, or null to prefer the bound method and then accept any
     * @param forceExternal If the URL should include the scheme and host
     * @param appendUnknown If values that are not variables should be appended as the query string
     * @param urlScheme     The scheme, defaults to the bound scheme
     * @return The URL
     * @throws BuildException if no rule can build a URL from the values
     */
    public String build(final String endpoint, final Map<String, ?> values, final String method, final boolean forceExternal,
                        final boolean appendUnknown, final String urlScheme) {
        final UrlMap.Snapshot snapshot = map.getSnapshot();
        final Map<String, Object> buildValues = normalizeValues(values);
        final String buildMethod = method == null ? null : method.toUpperCase(Locale.ENGLISH);
        final Candidate candidate = partialBuild(snapshot, endpoint, buildValues, buildMethod, appendUnknown);
        if (candidate == null) {
            throw new BuildException(endpoint, buildValues, buildMethod, closestRule(snapshot, endpoint, buildValues, buildMethod));
        }

        String scheme = urlScheme == null ? this.urlScheme : urlScheme;
        final boolean secure = "https".equals(scheme) || "wss".equals(scheme);
        boolean external = forceExternal;
        if (candidate.rule.isWebsocket()) {
            external = true;
            scheme = secure ? "wss" : "ws";
        } else if (scheme != null) {
            scheme = secure ? "https" : "http";
        }

        final String host = getHost(candidate.url.domain);
        final String path = URLUtils.joinPath(scriptName, candidate.url.path);
        if (!external && (map.isHostMatching() ? host.equals(serverName) : candidate.url.domain.equals(getDomain()))) {
            return path;
        }
        return (scheme == null ? "" : scheme + ":") + "//" + host + path;
    }

    private Candidate partialBuild(final UrlMap.Snapshot snapshot, final String endpoint, final Map<String, Object> values,
                                   final String method, final boolean appendUnknown) {
        if (method == null) {
            final Candidate candidate = partialBuild(snapshot, endpoint, values, defaultMethod, appendUnknown);
            if (candidate != null) {
                return candidate;
            }
        }
        Candidate first = null;
        for (CompiledRule rule : snapshot.getRules(endpoint)) {
            if (!rule.suitableFor(values, method)) {
                continue;
            }
            final BuiltUrl url = rule.build(values, appendUnknown, map.getSortKey());
            if (url == null) {
                continue;
            }
            if (!map.isHostMatching() || url.domain.equals(serverName)) {
                return new Candidate(rule, url);
            } else if (first == null) {
                first = new Candidate(rule, url);
            }
        }
        return first;
    }

    private static Map<String, Object> normalizeValues(final Map<String, ?> values) {
        final Map<String, Object> result = new LinkedHashMap<>();
        if (values == null) {
            return result;
        }
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            Object value = entry.getValue();
            if (value instanceof Collection) {
                final Collection<?> collection = (Collection<?>) value;
                if (collection.isEmpty()) {
                    continue;
                } else if (collection.size() == 1) {
                    value = collection.iterator().next();
                }
            }
            if (value != null) {
                result.put(entry.getKey(), value);
            }
        }
        return result;
    }

    /**
     * Picks the rule that comes closest to what was asked for: the most similar endpoint, then a rule that has all the
     * given values as arguments, then a rule that accepts the method.
     */
    private static Rule closestRule(final UrlMap.Snapshot snapshot, final String endpoint, final Map<String, Object> values, final String method) {
        Rule closest = null;
        double best = -1;
        for (CompiledRule rule : snapshot.getRules()) {
            if (rule.getEndpoint() == null) {
                continue;
            }
            double score = endpoint == null ? 0 : 0.98 * similarity(rule.getEndpoint(), endpoint);
            if (rule.getArguments().containsAll(values.keySet())) {
                score += 0.01;
            }
            if (method != null && rule.getMethods() != null && rule.getMethods().contains(method)) {
                score += 0.01;
            }
            if (score > best) {
                best = score;
                closest = rule.getRule();
            }
        }
        return closest;
    }

    private static double similarity(final String a, final String b) {
        if (a.equals(b)) {
            return 1.0;
        }
        final int max = Math.min(a.length(), b.length());
        int prefix = 0;
        while (prefix < max && a.charAt(prefix) == b.charAt(prefix)) {
            ++prefix;
        }
        int suffix = 0;
        while (suffix < max - prefix && a.charAt(a.length() - 1 - suffix) == b.charAt(b.length() - 1 - suffix)) {
            ++suffix;
        }
        return 2.0 * (prefix + suffix) / (a.length() + b.length());
    }

    private static final class Candidate {

        private final CompiledRule rule;
        private final BuiltUrl url;

        private Candidate(final CompiledRule rule, final BuiltUrl url) {
            this.rule = rule;
            this.url = url;
        }
    }
    //</editor-fold>

    /**
     * @param domainPart The host, with host matching, or the subdomain of a built URL. Null for the bound one.
     * @return The host name of URLs built for the domain part
     */
    public String getHost(final String domainPart) {
        if (map.isHostMatching()) {
            return domainPart == null ? serverName : domainPart;
        }
        final String sub = domainPart == null || !map.isSubdomainMatching() ? subdomain : domainPart;
        return sub.isEmpty() ? serverName : sub + "." + serverName;
    }

    public String makeRedirectUrl(final String path, final Map<String, Deque<String>> queryArgs) {
        return makeRedirectUrl(path, queryArgs, null);
    }

    /**
     * @param path       The percent encoded path, relative to the script name
     * @param queryArgs  The query arguments to append
     * @param domainPart The host or subdomain, or null for the bound one
     * @return The absolute URL
     */
    public String makeRedirectUrl(final String path, final Map<String, Deque<String>> queryArgs, final String domainPart) {
        final StringBuilder sb = new StringBuilder();
        sb.append(urlScheme).append("://").append(getHost(domainPart)).append(URLUtils.joinPath(scriptName, path));
        if (queryArgs != null && !queryArgs.isEmpty()) {
            sb.append('?').append(QueryParameterUtils.buildQueryString(queryArgs, map.getCharset()));
        }
        return sb.toString();
    }

    /**
     * @return The part of the request matched against the domain part of the rules
     */
    private String getDomain() {
        if (map.isHostMatching()) {
            return serverName;
        }
        return map.isSubdomainMatching() ? subdomain : "";
    }

    private static boolean isWebsocketScheme(final String scheme) {
        return "ws".equals(scheme) || "wss".equals(scheme);
    }

    public UrlMap getMap() {
        return map;
    }

    public String getServerName() {
        return serverName;
    }

    public String getScriptName() {
        return scriptName;
    }

    public String getSubdomain() {
        return subdomain;
    }

    public String getUrlScheme() {
        return urlScheme;
    }

    public String getDefaultMethod() {
        return defaultMethod;
    }

    public String getPathInfo() {
        return pathInfo;
    }

    public Map<String, Deque<String>> getQueryArgs() {
        return queryArgs;
    }
}
