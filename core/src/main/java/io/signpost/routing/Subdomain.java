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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Sets the subdomain of a group of rules. Only useful on maps with subdomain matching enabled.
 * <pre>
 * new Subdomain("&lt;user&gt;", Rule.builder("/").endpoint("user.homepage").build());
 * </pre>
 */
public class Subdomain implements RuleFactory {

    private final String subdomain;
    private final List<RuleFactory> factories;

    public Subdomain(final String subdomain, final RuleFactory... factories) {
        this(subdomain, Arrays.asList(factories));
    }

    public Subdomain(final String subdomain, final List<? extends RuleFactory> factories) {
        this.subdomain = subdomain;
        this.factories = List.copyOf(factories);
    }

    @Override
    public List<Rule> getRules() {
        final List<Rule> rules = new ArrayList<>();
        for (RuleFactory factory : factories) {
            for (Rule rule : factory.getRules()) {
                rules.add(rule.toBuilder().subdomain(subdomain).build());
            }
        }
        return rules;
    }
}
