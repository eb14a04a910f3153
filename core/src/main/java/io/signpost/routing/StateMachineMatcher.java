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
import io.signpost.util.Methods;
import io.signpost.util.URLUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * Matches requests against the compiled rules of a map.
 * <br><br>
 *
 * Two phases are distinguished:
 * <ol>
 * <li>The <i>setup phase</i>, in which {@link #create(List)} arranges the rules in a tree of states. Every rule contributes
 * a path of transitions, one per {@link RulePart}, and is attached to the state its last part leads to. Rules with equal
 * parts share transitions.</li>
 * <li>The <i>routing phase</i>, in which {@link #match(String, String, String, boolean)} walks the tree for the parts of a
 * request: {@code [domain, "", segment1, segment2, ...]}.</li>
 * </ol>
 * Each state has static transitions, keyed by the exact text of a part, and dynamic transitions ordered by
 * {@link RulePart.Weighting}, with ties kept in the order the rules were added. Static transitions are tried first. When a
 * dynamic transition matches, the values are converted straight away; a converter that rejects its value with a
 * {@link ValidationException} rejects only that transition and the next one is tried. The walk backtracks until a rule
 * is found or every alternative is exhausted.
 * <br><br>
 *
 * Instances are created in the setup phase and are immutable afterwards, so any number of threads can route with them.
 */
final class StateMachineMatcher {

    //<editor-fold defaultstate="collapsed" desc="State inner classes">
    /**
     * A node of the tree. Mutable during the setup phase only.
     */
    private static final class State {

        private Map<String, State> staticTransitions = new HashMap<>();
        private List<Transition> dynamicTransitions = new ArrayList<>();
        private List<CompiledRule> rules = new ArrayList<>();

        private State next(final RulePart part) {
            if (part.isStatic()) {
                return staticTransitions.computeIfAbsent(part.getContent(), k -> new State());
            }
            for (Transition transition : dynamicTransitions) {
                if (transition.part.equals(part)) {
                    return transition.target;
                }
            }
            final Transition transition = new Transition(part, new State());
            dynamicTransitions.add(transition);
            return transition.target;
        }

        private int freeze() {
            int count = 1;
            dynamicTransitions.sort(Comparator.comparing(t -> t.part.getWeight()));
            for (State state : staticTransitions.values()) {
                count += state.freeze();
            }
            for (Transition transition : dynamicTransitions) {
                count += transition.target.freeze();
            }
            staticTransitions = Collections.unmodifiableMap(staticTransitions);
            dynamicTransitions = Collections.unmodifiableList(dynamicTransitions);
            rules = Collections.unmodifiableList(rules);
            return count;
        }
    }

    private static final class Transition {

        private final RulePart part;
        private final State target;

        private Transition(final RulePart part, final State target) {
            this.part = part;
            this.target = target;
        }
    }
    //</editor-fold>

    //<editor-fold defaultstate="collapsed" desc="Result inner classes">
    /**
     * The outcome of matching a path.
     */
    static final class Result {

        enum Type {
            MATCH,
            REDIRECT,
            NO_MATCH
        }

        private final Type type;
        private final CompiledRule rule;
        private final List<Object> values;
        private final String redirectPath;
        private final Set<String> allowedMethods;
        private final boolean websocketMismatch;

        private Result(final Type type, final CompiledRule rule, final List<Object> values, final String redirectPath,
                       final Set<String> allowedMethods, final boolean websocketMismatch) {
            this.type = type;
            this.rule = rule;
            this.values = values;
            this.redirectPath = redirectPath;
            this.allowedMethods = allowedMethods;
            this.websocketMismatch = websocketMismatch;
        }

        Type getType() {
            return type;
        }

        CompiledRule getRule() {
            return rule;
        }

        /**
         * @return The converted values in the order of the converters of the rule
         */
        List<Object> getValues() {
            return values;
        }

        /**
         * @return The unquoted path to redirect to
         */
        String getRedirectPath() {
            return redirectPath;
        }

        Set<String> getAllowedMethods() {
            return allowedMethods;
        }

        boolean isWebsocketMismatch() {
            return websocketMismatch;
        }
    }

    /**
     * Per call state of the routing phase. Used by a single thread only.
     */
    private static final class Walk {

        private final String method;
        private final boolean websocket;
        private final Set<String> allowedMethods = new LinkedHashSet<>();
        private boolean websocketMismatch;
        private boolean slashRemovable;

        private Walk(final String method, final boolean websocket) {
            this.method = method;
            this.websocket = websocket;
        }

        private boolean accepts(final CompiledRule rule) {
            return rule.isWebsocket() == websocket && rule.acceptsMethod(method);
        }
    }

    private static final class Found {

        private final CompiledRule rule;
        private final List<Object> values;

        private Found(final CompiledRule rule, final List<Object> values) {
            this.rule = rule;
            this.values = values;
        }
    }

    private static final Found SLASH_REQUIRED = new Found(null, Collections.emptyList());
    //</editor-fold>

    private final State root;
    private final boolean mergeSlashes;
    private final int stateCount;

    private StateMachineMatcher(final State root, final boolean mergeSlashes, final int stateCount) {
        this.root = root;
        this.mergeSlashes = mergeSlashes;
        this.stateCount = stateCount;
    }

    /**
     * Setup phase.
     *
     * @param rules The rules in the order they were added to the map. Build only rules are skipped.
     * @return The matcher
     */
    static StateMachineMatcher create(final List<CompiledRule> rules) {
        final State root = new State();
        boolean mergeSlashes = false;
        for (CompiledRule rule : rules) {
            if (rule.isBuildOnly()) {
                continue;
            }
            State state = root;
            for (RulePart part : rule.getParts()) {
                state = state.next(part);
            }
            state.rules.add(rule);
            mergeSlashes |= rule.isMergeSlashes();
        }
        final int count = root.freeze();
        return new StateMachineMatcher(root, mergeSlashes, count);
    }

    int getStateCount() {
        return stateCount;
    }

    /**
     * Routing phase.
     *
     * @param domain    The host or subdomain, or the empty string when neither is matched
     * @param path      The path, empty or starting with a single '/'
     * @param method    The upper case method
     * @param websocket If the request is a websocket request
     * @return The result
     */
    Result match(final String domain, final String path, final String method, final boolean websocket) {
        final Walk walk = new Walk(method, websocket);
        Found found = walk(root, parts(domain, path), 0, new ArrayList<>(), walk);
        if (found == SLASH_REQUIRED) {
            return redirect(path + "/");
        } else if (found != null) {
            return new Result(Result.Type.MATCH, found.rule, found.values, null, null, false);
        } else if (walk.slashRemovable) {
            return redirect(path.substring(0, path.length() - 1));
        }

        if (mergeSlashes && path.contains("//")) {
            final String merged = URLUtils.mergeSlashes(path);
            walk.slashRemovable = false;
            found = walk(root, parts(domain, merged), 0, new ArrayList<>(), walk);
            if (found == SLASH_REQUIRED) {
                return redirect(merged + "/");
            } else if (found != null && found.rule.isMergeSlashes()) {
                return redirect(merged);
            } else if (found == null && walk.slashRemovable) {
                return redirect(merged.substring(0, merged.length() - 1));
            }
        }

        final Set<String> allowed = walk.allowedMethods;
        if (allowed.contains(Methods.GET)) {
            allowed.add(Methods.HEAD);
        }
        return new Result(Result.Type.NO_MATCH, null, null, null, Collections.unmodifiableSet(allowed), walk.websocketMismatch);
    }

    private static Result redirect(final String path) {
        return new Result(Result.Type.REDIRECT, null, null, path, null, false);
    }

    private static String[] parts(final String domain, final String path) {
        final String[] segments = path.split("/", -1);
        final String[] parts = new String[segments.length + 1];
        parts[0] = domain;
        System.arraycopy(segments, 0, parts, 1, segments.length);
        return parts;
    }

    private static Found walk(final State state, final String[] parts, final int index, final List<Object> values, final Walk walk) {
        if (index == parts.length) {
            for (CompiledRule rule : state.rules) {
                if (!rule.acceptsMethod(walk.method)) {
                    walk.allowedMethods.addAll(rule.getMethods());
                } else if (rule.isWebsocket() != walk.websocket) {
                    walk.websocketMismatch = true;
                } else {
                    return new Found(rule, values);
                }
            }
            // a branch URL requested without its trailing slash
            final State branch = state.staticTransitions.get("");
            if (branch != null) {
                for (CompiledRule rule : branch.rules) {
                    if (!walk.accepts(rule)) {
                        continue;
                    }
                    if (!rule.isStrictSlashes()) {
                        return new Found(rule, values);
                    } else if (Methods.isSafe(walk.method)) {
                        return SLASH_REQUIRED;
                    }
                }
            }
            return null;
        }

        final String part = parts[index];
        final State next = state.staticTransitions.get(part);
        if (next != null) {
            final Found found = walk(next, parts, index + 1, values, walk);
            if (found != null) {
                return found;
            }
        }

        for (Transition transition : state.dynamicTransitions) {
            final RulePart rulePart = transition.part;
            final String target = rulePart.isFinal() ? String.join("/", Arrays.asList(parts).subList(index, parts.length)) : part;
            final Matcher matcher = rulePart.getPattern().matcher(target);
            if (!matcher.matches()) {
                continue;
            }
            final List<Object> converted = convert(rulePart, matcher, values);
            if (converted == null) {
                continue;
            }
            final Found found;
            if (rulePart.isFinal()) {
                final boolean suffix = rulePart.isSuffixed() && "/".equals(matcher.group(RulePart.SUFFIX_GROUP));
                found = suffix ? walk(transition.target, new String[]{""}, 0, converted, walk)
                        : walk(transition.target, parts, parts.length, converted, walk);
            } else {
                found = walk(transition.target, parts, index + 1, converted, walk);
            }
            if (found != null) {
                return found;
            }
        }

        // a leaf URL requested with a trailing slash
        if (index == parts.length - 1 && part.isEmpty()) {
            for (CompiledRule rule : state.rules) {
                if (!walk.accepts(rule)) {
                    continue;
                }
                if (!rule.isStrictSlashes()) {
                    return new Found(rule, values);
                } else if (rule.isLeaf() && Methods.isSafe(walk.method)) {
                    walk.slashRemovable = true;
                }
            }
        }
        return null;
    }

    private static List<Object> convert(final RulePart part, final Matcher matcher, final List<Object> values) {
        final List<Converter> converters = part.getConverters();
        final List<Object> result = new ArrayList<>(values.size() + converters.size());
        result.addAll(values);
        for (int i = 0; i < converters.size(); ++i) {
            try {
                result.add(converters.get(i).fromUrl(matcher.group(RulePart.GROUP_PREFIX + i)));
            } catch (ValidationException e) {
                return null;
            }
        }
        return result;
    }
}
