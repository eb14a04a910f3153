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
 * Prefixes the templates of a group of rules with a path:
 * <pre>
 * new Submount("/blog", Rule.builder("/").endpoint("blog.index").build(),
 *         Rule.builder("/entry/&lt;entry_slug&gt;").endpoint("blog.show").build());
 * </pre>
 */
public class Submount implements RuleFactory {

    private final String path;
    private final List<RuleFactory> factories;

    public Submount(final String path, final RuleFactory... factories) {
        this(path, Arrays.asList(factories));
    }

    public Submount(final String path, final List<? extends RuleFactory> factories) {
        String p = path;
        while (p.endsWith("/")) {
            p = p.substring(0, p.length() - 1);
        }
        this.path = p;
        this.factories = List.copyOf(factories);
    }

    @Override
    public List<Rule> getRules() {
        final List<Rule> rules = new ArrayList<>();
        for (RuleFactory factory : factories) {
            for (Rule rule : factory.getRules()) {
                rules.add(rule.toBuilder().template(path + rule.getTemplate()).build());
            }
        }
        return rules;
    }
}
