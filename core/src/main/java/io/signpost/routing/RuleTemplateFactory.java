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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The rules of a {@link RuleTemplate} with placeholders replaced from a context.
 */
public class RuleTemplateFactory implements RuleFactory {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$(?:(?<escaped>\\$)|(?<named>[_a-zA-Z][_a-zA-Z0-9]*)|\\{(?<braced>[_a-zA-Z][_a-zA-Z0-9]*)})");

    private final List<RuleFactory> factories;
    private final Map<String, Object> context;

    RuleTemplateFactory(final List<RuleFactory> factories, final Map<String, ?> context) {
        this.factories = factories;
        this.context = new LinkedHashMap<>(context);
    }

    @Override
    public List<Rule> getRules() {
        final List<Rule> rules = new ArrayList<>();
        for (RuleFactory factory : factories) {
            for (Rule rule : factory.getRules()) {
                final Map<String, Object> defaults = new LinkedHashMap<>();
                for (Map.Entry<String, Object> entry : rule.getDefaults().entrySet()) {
                    final Object value = entry.getValue();
                    defaults.put(entry.getKey(), value instanceof String ? substitute((String) value) : value);
                }
                final Rule.Builder builder = rule.toBuilder()
                        .template(substitute(rule.getTemplate()))
                        .endpoint(substitute(rule.getEndpoint()))
                        .subdomain(substitute(rule.getSubdomain()))
                        .defaults(defaults);
                if (rule.getRedirectTo() instanceof String) {
                    builder.redirectTo(substitute((String) rule.getRedirectTo()));
                }
                rules.add(builder.build());
            }
        }
        return rules;
    }

    String substitute(final String text) {
        if (text == null || text.indexOf('$') == -1) {
            return text;
        }
        final Matcher matcher = PLACEHOLDER.matcher(text);
        final StringBuilder sb = new StringBuilder();
        int last = 0;
        while (matcher.find()) {
            sb.append(text, last, matcher.start());
            if (matcher.group("escaped") != null) {
                sb.append('$');
            } else {
                final String name = matcher.group("named") != null ? matcher.group("named") : matcher.group("braced");
                if (!context.containsKey(name)) {
                    throw SignpostMessages.MESSAGES.missingTemplateVariable(name, text);
                }
                sb.append(context.get(name));
            }
            last = matcher.end();
        }
        sb.append(text, last, text.length());
        return sb.toString();
    }
}
