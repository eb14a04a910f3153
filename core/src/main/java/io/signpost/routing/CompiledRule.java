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

import io.signpost.routing.converter.Converter;
import io.signpost.routing.converter.ValidationException;
import io.signpost.util.QueryParameterUtils;
import io.signpost.util.URLUtils;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A {@link Rule} compiled against the configuration of a map. Instances are created by {@link RuleCompiler} and never
 * change afterwards.
 */
public final class CompiledRule {

    private static final String STATIC_SAFE = "/:|+";

    private final int id;
    private final Rule rule;
    private final Set<String> methods;
    private final boolean strictSlashes;
    private final boolean mergeSlashes;
    private final boolean leaf;
    private final String domainTemplate;
    private final String pathTemplate;
    private final List<RulePart> parts;
    private final Map<String, Converter> converters;
    private final List<BuildStep> domainSteps;
    private final List<BuildStep> pathSteps;
    private final Charset charset;

    CompiledRule(final int id, final Rule rule, final boolean strictSlashes, final boolean mergeSlashes,
                 final String domainTemplate, final String pathTemplate, final List<RulePart> parts,
                 final Map<String, Converter> converters, final List<BuildStep> domainSteps, final List<BuildStep> pathSteps,
                 final Charset charset) {
        this.id = id;
        this.rule = rule;
        this.methods = rule.getMethods();
        this.strictSlashes = strictSlashes;
        this.mergeSlashes = mergeSlashes;
        this.leaf = !pathTemplate.endsWith("/");
        this.domainTemplate = domainTemplate;
        this.pathTemplate = pathTemplate;
        this.parts = Collections.unmodifiableList(new ArrayList<>(parts));
        this.converters = Collections.unmodifiableMap(new LinkedHashMap<>(converters));
        this.domainSteps = domainSteps;
        this.pathSteps = pathSteps;
        this.charset = charset;
    }

    /**
     * @return The position of the rule in the map, used to order rules that are otherwise equal
     */
    public int getId() {
        return id;
    }

    public Rule getRule() {
        return rule;
    }

    public String getEndpoint() {
        return rule.getEndpoint();
    }

    public Set<String> getMethods() {
        return methods;
    }

    public Map<String, Object> getDefaults() {
        return rule.getDefaults();
    }

    public Set<String> getArguments() {
        return rule.getArguments();
    }

    public boolean isStrictSlashes() {
        return strictSlashes;
    }

    public boolean isMergeSlashes() {
        return mergeSlashes;
    }

    public boolean isWebsocket() {
        return rule.isWebsocket();
    }

    public boolean isAlias() {
        return rule.isAlias();
    }

    public boolean isBuildOnly() {
        return rule.isBuildOnly();
    }

    /**
     * @return True if the path template does not end with a '/'
     */
    public boolean isLeaf() {
        return leaf;
    }

    public String getDomainTemplate() {
        return domainTemplate;
    }

    /**
     * @return The path template, with runs of slashes collapsed if the rule merges slashes
     */
    public String getPathTemplate() {
        return pathTemplate;
    }

    public List<RulePart> getParts() {
        return parts;
    }

    /**
     * @return The converters by variable name, in the order the variables appear in the domain and path templates
     */
    public Map<String, Converter> getConverters() {
        return converters;
    }

    public boolean acceptsMethod(final String method) {
        return methods == null || methods.contains(method);
    }

    boolean hasSameSignature(final CompiledRule other) {
        return isWebsocket() == other.isWebsocket() && parts.equals(other.parts);
    }

    boolean methodsOverlap(final CompiledRule other) {
        if (methods == null || other.methods == null) {
            return true;
        }
        for (String method : methods) {
            if (other.methods.contains(method)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Decides if this rule can build a URL from the given values: the method is accepted, every argument has a value or
     * a default and every default agrees with the given value.
     *
     * @param values The values
     * @param method The method, or null for any
     * @return True if the rule is suitable
     */
    boolean suitableFor(final Map<String, Object> values, final String method) {
        if (method != null && !acceptsMethod(method)) {
            return false;
        }
        final Map<String, Object> defaults = rule.getDefaults();
        for (String argument : rule.getArguments()) {
            if (!defaults.containsKey(argument) && !values.containsKey(argument)) {
                return false;
            }
        }
        for (Map.Entry<String, Object> entry : defaults.entrySet()) {
            if (values.containsKey(entry.getKey()) && !valuesEqual(entry.getValue(), values.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Builds the domain and path of a URL.
     *
     * @param values        The values, may contain keys that are not arguments of this rule
     * @param appendUnknown If values that are not arguments should be appended as a query string
     * @param sortKey       If not null, the order of the query parameters
     * @return The built URL, or null if a converter rejected a value
     */
    BuiltUrl build(final Map<String, Object> values, final boolean appendUnknown, final Comparator<String> sortKey) {
        final String domain;
        final StringBuilder path = new StringBuilder();
        try {
            domain = join(domainSteps, values, new StringBuilder()).toString();
            join(pathSteps, values, path);
        } catch (ValidationException e) {
            return null;
        }
        if (appendUnknown) {
            final Map<String, Object> unknown = new LinkedHashMap<>();
            for (Map.Entry<String, Object> entry : values.entrySet()) {
                if (!rule.getArguments().contains(entry.getKey())) {
                    unknown.put(entry.getKey(), entry.getValue());
                }
            }
            if (!unknown.isEmpty()) {
                final String query = QueryParameterUtils.encodeValues(unknown, charset, sortKey);
                if (!query.isEmpty()) {
                    path.append('?').append(query);
                }
            }
        }
        return new BuiltUrl(domain, path.toString());
    }

    private StringBuilder join(final List<BuildStep> steps, final Map<String, Object> values, final StringBuilder sb) throws ValidationException {
        for (BuildStep step : steps) {
            if (!step.variable) {
                sb.append(step.text);
            } else if (!values.containsKey(step.text) && step.converted != null) {
                sb.append(step.converted);
            } else {
                final Object value = values.containsKey(step.text) ? values.get(step.text) : rule.getDefaults().get(step.text);
                sb.append(converters.get(step.text).toUrl(value));
            }
        }
        return sb;
    }

    /**
     * Compares a default with a given value. Numbers are compared by value, so that a default of {@code 1} equals a given
     * {@code 1L} or {@code 1.0}.
     */
    static boolean valuesEqual(final Object a, final Object b) {
        if (Objects.equals(a, b)) {
            return true;
        }
        if (a instanceof Number && b instanceof Number) {
            return toBigDecimal((Number) a).compareTo(toBigDecimal((Number) b)) == 0;
        }
        return false;
    }

    private static BigDecimal toBigDecimal(final Number number) {
        if (number instanceof BigDecimal) {
            return (BigDecimal) number;
        }
        if (number instanceof BigInteger) {
            return new BigDecimal((BigInteger) number);
        }
        if (number instanceof Double || number instanceof Float) {
            return BigDecimal.valueOf(number.doubleValue());
        }
        return BigDecimal.valueOf(number.longValue());
    }

    @Override
    public String toString() {
        return "CompiledRule{" + id + ": " + rule + '}';
    }

    /**
     * A literal piece of text or a variable of a template, in the order they are concatenated when building.
     */
    static final class BuildStep {

        final boolean variable;
        final String text;
        // the URL text of the default value of a variable, if it has one
        final String converted;

        private BuildStep(final boolean variable, final String text, final String converted) {
            this.variable = variable;
            this.text = text;
            this.converted = converted;
        }

        static BuildStep literal(final String text, final Charset charset) {
            return new BuildStep(false, URLUtils.quote(text, charset, STATIC_SAFE), null);
        }

        static BuildStep variable(final String name, final String converted) {
            return new BuildStep(true, name, converted);
        }
    }

    /**
     * The domain part and the path, including any query string, of a built URL.
     */
    static final class BuiltUrl {

        final String domain;
        final String path;

        BuiltUrl(final String domain, final String path) {
            this.domain = domain;
            this.path = path;
        }
    }
}
