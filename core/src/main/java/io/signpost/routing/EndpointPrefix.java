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
 * Prefixes the endpoints of a group of rules.
 */
public class EndpointPrefix implements RuleFactory {

    private final String prefix;
    private final List<RuleFactory> factories;

    public EndpointPrefix(final String prefix, final RuleFactory... factories) {
        this(prefix, Arrays.asList(factories));
    }

    public EndpointPrefix(final String prefix, final List<? extends RuleFactory> factories) {
        this.prefix = prefix;
        this.factories = List.copyOf(factories);
    }

    @Override
    public List<Rule> getRules() {
        final List<Rule> rules = new ArrayList<>();
        for (RuleFactory factory : factories) {
            for (Rule rule : factory.getRules()) {
                if (rule.getEndpoint() == null) {
                    rules.add(rule);
                } else {
                    rules.add(rule.toBuilder().endpoint(prefix + rule.getEndpoint()).build());
                }
            }
        }
        return rules;
    }
}
