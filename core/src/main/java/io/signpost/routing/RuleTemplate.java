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

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * A group of rules with {@code $name} or {@code ${name}} placeholders, filled in by {@link #apply(Map)}:
 * <pre>
 * RuleTemplate resource = new RuleTemplate(
 *         Rule.builder("/$name/").endpoint("${name}.list").build(),
 *         Rule.builder("/$name/&lt;int:id&gt;").endpoint("${name}.show").build());
 * UrlMap map = UrlMap.builder()
 *         .addRule(resource.apply(Map.of("name", "user")))
 *         .addRule(resource.apply(Map.of("name", "page")))
 *         .build();
 * </pre>
 * Placeholders are replaced in templates, endpoints, subdomains and string defaults. {@code $$} stands for a single
 * {@code $}.
 */
public class RuleTemplate {

    private final List<RuleFactory> factories;

    public RuleTemplate(final RuleFactory... factories) {
        this(Arrays.asList(factories));
    }

    public RuleTemplate(final List<? extends RuleFactory> factories) {
        this.factories = List.copyOf(factories);
    }

    /**
     * @param context The placeholder values
     * @return A factory for the rules with the placeholders replaced
     */
    public RuleFactory apply(final Map<String, ?> context) {
        return new RuleTemplateFactory(factories, context);
    }
}
