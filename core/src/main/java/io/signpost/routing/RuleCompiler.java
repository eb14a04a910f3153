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
import io.signpost.routing.CompiledRule.BuildStep;
import io.signpost.routing.converter.Converter;
import io.signpost.routing.converter.ConverterArguments;
import io.signpost.routing.converter.ConverterFactory;
import io.signpost.routing.converter.Converters;
import io.signpost.routing.converter.ValidationException;
import io.signpost.util.URLUtils;

import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Compiles {@link Rule}s into {@link CompiledRule}s for the configuration of one map.
 * <p>
 * A template is split into tokens: slashes, runs of static text and {@code <converter(arguments):name>} placeholders.
 * Slashes delimit parts, except after a converter that can match a slash, which turns the rest of the template into one
 * final part. Instances are immutable and can be shared.
 */
final class RuleCompiler {

    private static final Pattern TOKEN = Pattern.compile(
            "(?<slash>/)"
            + "|(?<static>[^</]+)"
            + "|<(?:(?<converter>[a-zA-Z_][a-zA-Z0-9_]*)(?:\\((?<arguments>.*?)\\))?:)?(?<variable>[a-zA-Z_][a-zA-Z0-9_]*)>");

    private final Map<String, ConverterFactory> converters;
    private final Charset charset;
    private final boolean strictSlashes;
    private final boolean mergeSlashes;
    private final boolean hostMatching;
    private final boolean subdomainMatching;
    private final String defaultSubdomain;

    RuleCompiler(final Map<String, ConverterFactory> converters, final Charset charset, final boolean strictSlashes,
                 final boolean mergeSlashes, final boolean hostMatching, final boolean subdomainMatching,
                 final String defaultSubdomain) {
        this.converters = converters;
        this.charset = charset;
        this.strictSlashes = strictSlashes;
        this.mergeSlashes = mergeSlashes;
        this.hostMatching = hostMatching;
        this.subdomainMatching = subdomainMatching;
        this.defaultSubdomain = defaultSubdomain;
    }

    /**
     * @param template A path, host or subdomain template
     * @return The names of the variables of the template, in order
     * @throws RuleSyntaxException if the template is malformed
     */
    static Set<String> variableNames(final String template) {
        final Set<String> names = new LinkedHashSet<>();
        final Matcher matcher = TOKEN.matcher(template);
        int pos = 0;
        while (pos < template.length()) {
            matcher.region(pos, template.length());
            if (!matcher.lookingAt()) {
                throw SignpostMessages.MESSAGES.malformedRule(template, pos);
            }
            if (matcher.group("variable") != null) {
                names.add(matcher.group("variable"));
            }
            pos = matcher.end();
        }
        return names;
    }

    CompiledRule compile(final Rule rule, final int id) {
        final boolean strict = rule.getStrictSlashes() == null ? strictSlashes : rule.getStrictSlashes();
        final boolean merge = rule.getMergeSlashes() == null ? mergeSlashes : rule.getMergeSlashes();
        final String domainTemplate = domainTemplate(rule);
        final String pathTemplate = merge ? URLUtils.mergeSlashes(rule.getTemplate()) : rule.getTemplate();

        final Map<String, Converter> ruleConverters = new LinkedHashMap<>();
        final List<BuildStep> domainSteps = new ArrayList<>();
        final List<BuildStep> pathSteps = new ArrayList<>();
        final List<RulePart> domainParts = parse(rule, domainTemplate, ruleConverters, domainSteps);
        if (domainParts.size() != 1) {
            throw SignpostMessages.MESSAGES.malformedRule(domainTemplate, Math.max(0, domainTemplate.indexOf('/')));
        }
        final List<RulePart> parts = new ArrayList<>(domainParts);
        parts.addAll(parse(rule, pathTemplate, ruleConverters, pathSteps));
        return new CompiledRule(id, rule, strict, merge, domainTemplate, pathTemplate, parts, ruleConverters,
                List.copyOf(domainSteps), List.copyOf(pathSteps), charset);
    }

    private String domainTemplate(final Rule rule) {
        if (rule.getSubdomain() != null && !subdomainMatching) {
            throw SignpostMessages.MESSAGES.subdomainMatchingDisabled(rule.getTemplate(), rule.getSubdomain());
        }
        if (rule.getHost() != null && !hostMatching) {
            throw SignpostMessages.MESSAGES.hostMatchingDisabled(rule.getTemplate(), rule.getHost());
        }
        if (hostMatching) {
            return rule.getHost() == null ? "" : rule.getHost();
        } else if (subdomainMatching) {
            return rule.getSubdomain() == null ? defaultSubdomain : rule.getSubdomain();
        }
        return "";
    }

    private List<RulePart> parse(final Rule rule, final String template, final Map<String, Converter> ruleConverters, final List<BuildStep> steps) {
        final List<RulePart> parts = new ArrayList<>();
        final Matcher matcher = TOKEN.matcher(template);
        PartBuilder part = new PartBuilder();
        int pos = 0;
        int index = 0;
        while (pos < template.length()) {
            matcher.region(pos, template.length());
            if (!matcher.lookingAt()) {
                throw SignpostMessages.MESSAGES.malformedRule(template, pos);
            }
            final String variable = matcher.group("variable");
            if (matcher.group("static") != null) {
                final String text = matcher.group("static");
                part.addStatic(text, index);
                steps.add(BuildStep.literal(text, charset));
            } else if (variable != null) {
                if (ruleConverters.containsKey(variable)) {
                    throw SignpostMessages.MESSAGES.variableUsedTwice(variable, rule.getTemplate());
                }
                final String name = matcher.group("converter") == null ? Converters.DEFAULT : matcher.group("converter");
                final Converter converter = createConverter(rule, name, matcher.group("arguments"));
                ruleConverters.put(variable, converter);
                part.addConverter(converter);
                steps.add(BuildStep.variable(variable, convertDefault(rule, variable, converter)));
            } else {
                steps.add(BuildStep.literal("/", charset));
                if (part.isFinal) {
                    part.addSlash();
                } else {
                    parts.add(part.toPart());
                    part = new PartBuilder();
                }
            }
            ++index;
            pos = matcher.end();
        }
        part.finish(parts);
        return parts;
    }

    private Converter createConverter(final Rule rule, final String name, final String arguments) {
        final ConverterFactory factory = converters.get(name);
        if (factory == null) {
            throw SignpostMessages.MESSAGES.unknownConverter(name, rule.getTemplate());
        }
        final Converter converter;
        try {
            converter = factory.create(ConverterArguments.parse(arguments, charset));
        } catch (IllegalArgumentException e) {
            throw SignpostMessages.MESSAGES.invalidConverterArguments(name, rule.getTemplate(), e);
        }
        try {
            Pattern.compile(converter.getRegex());
        } catch (PatternSyntaxException e) {
            throw SignpostMessages.MESSAGES.invalidConverterRegex(name, rule.getTemplate(), e);
        }
        return converter;
    }

    private static String convertDefault(final Rule rule, final String variable, final Converter converter) {
        if (!rule.getDefaults().containsKey(variable)) {
            return null;
        }
        try {
            return converter.toUrl(rule.getDefaults().get(variable));
        } catch (ValidationException e) {
            // converted again when building, where the rejection makes the rule unsuitable
            return null;
        }
    }

    /**
     * Collects the tokens of one part.
     */
    private static final class PartBuilder {

        private final StringBuilder text = new StringBuilder();
        private final StringBuilder regex = new StringBuilder();
        private final List<int[]> staticWeights = new ArrayList<>();
        private final List<Integer> converterWeights = new ArrayList<>();
        private final List<Converter> converters = new ArrayList<>();
        private boolean isStatic = true;
        private boolean isFinal;

        void addStatic(final String value, final int index) {
            staticWeights.add(new int[]{index, value.length()});
            if (isStatic) {
                text.append(value);
            } else {
                regex.append(Pattern.quote(value));
            }
        }

        void addConverter(final Converter converter) {
            if (isStatic) {
                if (text.length() > 0) {
                    regex.append(Pattern.quote(text.toString()));
                }
                isStatic = false;
            }
            regex.append("(?<").append(RulePart.GROUP_PREFIX).append(converters.size()).append('>')
                    .append(converter.getRegex()).append(')');
            converters.add(converter);
            converterWeights.add(converter.getWeight());
            if (!converter.isPartIsolating()) {
                isFinal = true;
            }
        }

        void addSlash() {
            regex.append('/');
        }

        RulePart toPart() {
            final RulePart.Weighting weight = new RulePart.Weighting(staticWeights, converterWeights);
            if (isStatic) {
                return RulePart.staticPart(text.toString(), weight);
            }
            return new RulePart(regex.toString(), false, isFinal, false, converters, weight);
        }

        void finish(final List<RulePart> parts) {
            if (!isFinal || regex.charAt(regex.length() - 1) != '/') {
                parts.add(toPart());
                return;
            }
            regex.setLength(regex.length() - 1);
            regex.append("(?<!/)(?<").append(RulePart.SUFFIX_GROUP).append(">/?)");
            final RulePart.Weighting weight = new RulePart.Weighting(staticWeights, converterWeights);
            parts.add(new RulePart(regex.toString(), false, true, true, converters, weight));
            parts.add(RulePart.staticPart("", weight));
        }
    }
}
