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

package io.signpost.routing.converter;

import io.signpost.SignpostMessages;

import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The arguments of a converter in a rule template, for example {@code 4} and {@code max=9999} in
 * {@code <int(4, max=9999):year>}.
 * <p>
 * Arguments are separated by commas. Each is either positional or {@code name=value}. Values can be single or double quoted
 * strings, integers, decimals, {@code true}/{@code True}, {@code false}/{@code False}, {@code null}/{@code None}, or bare
 * words which are taken as strings.
 */
public final class ConverterArguments {

    private static final Pattern ARGUMENT = Pattern.compile(
            "\\s*(?:(?<name>[A-Za-z_][A-Za-z0-9_]*)\\s*=\\s*)?"
            + "(?<value>\"[^\"]*\"|'[^']*'|[^,\\s\"'=]+)"
            + "\\s*(?<end>,|$)");
    private static final Pattern INTEGER = Pattern.compile("-?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("-?\\d+\\.\\d*");
    private static final Pattern WORD = Pattern.compile("[\\w.\\-]+");

    private final List<Object> positional;
    private final Map<String, Object> keywords;
    private final Charset charset;

    public ConverterArguments(final List<Object> positional, final Map<String, Object> keywords, final Charset charset) {
        this.positional = Collections.unmodifiableList(new ArrayList<>(positional));
        this.keywords = Collections.unmodifiableMap(new LinkedHashMap<>(keywords));
        this.charset = charset;
    }

    /**
     * Parses the text between the parentheses of a converter.
     *
     * @param arguments The argument text, may be null or empty
     * @param charset   The URL charset of the map the rule is bound to
     * @return The parsed arguments
     * @throws IllegalArgumentException if the text is not valid argument syntax
     */
    public static ConverterArguments parse(final String arguments, final Charset charset) {
        final List<Object> positional = new ArrayList<>();
        final Map<String, Object> keywords = new LinkedHashMap<>();
        if (arguments == null || arguments.trim().isEmpty()) {
            return new ConverterArguments(positional, keywords, charset);
        }
        final Matcher matcher = ARGUMENT.matcher(arguments);
        int pos = 0;
        final int len = arguments.length();
        while (pos < len) {
            matcher.region(pos, len);
            if (!matcher.lookingAt()) {
                if (arguments.substring(pos).trim().isEmpty()) {
                    break;
                }
                throw SignpostMessages.MESSAGES.invalidConverterArgumentSyntax(arguments, pos);
            }
            final Object value = toValue(matcher.group("value"), arguments, matcher.start("value"));
            final String name = matcher.group("name");
            if (name == null) {
                if (!keywords.isEmpty()) {
                    throw SignpostMessages.MESSAGES.invalidConverterArgumentSyntax(arguments, matcher.start());
                }
                positional.add(value);
            } else {
                if (keywords.containsKey(name)) {
                    throw SignpostMessages.MESSAGES.invalidConverterArgumentSyntax(arguments, matcher.start("name"));
                }
                keywords.put(name, value);
            }
            pos = matcher.end();
        }
        return new ConverterArguments(positional, keywords, charset);
    }

    private static Object toValue(final String value, final String arguments, final int position) {
        final char first = value.charAt(0);
        if (first == '"' || first == '\'') {
            return value.substring(1, value.length() - 1);
        }
        switch (value) {
            case "True":
            case "true":
                return Boolean.TRUE;
            case "False":
            case "false":
                return Boolean.FALSE;
            case "None":
            case "null":
                return null;
            default:
                break;
        }
        if (INTEGER.matcher(value).matches()) {
            try {
                return Integer.valueOf(value);
            } catch (NumberFormatException e) {
                return Long.valueOf(value);
            }
        }
        if (DECIMAL.matcher(value).matches()) {
            return Double.valueOf(value);
        }
        if (WORD.matcher(value).matches()) {
            return value;
        }
        throw SignpostMessages.MESSAGES.invalidConverterArgumentSyntax(arguments, position);
    }

    public List<Object> getPositional() {
        return positional;
    }

    public Map<String, Object> getKeywords() {
        return keywords;
    }

    /**
     * @return The charset of the map that the rule is bound to, for converters that percent encode their output.
     */
    public Charset getCharset() {
        return charset;
    }

    public boolean isEmpty() {
        return positional.isEmpty() && keywords.isEmpty();
    }

    /**
     * Rejects keyword arguments that are not in {@code names}, and more positional arguments than there are names.
     *
     * @param converter The converter name, for error messages
     * @param names     The accepted argument names, in positional order
     */
    public void allowOnly(final String converter, final String... names) {
        final List<String> allowed = Arrays.asList(names);
        for (String keyword : keywords.keySet()) {
            if (!allowed.contains(keyword)) {
                throw SignpostMessages.MESSAGES.unexpectedConverterArgument(converter, keyword);
            }
        }
        if (positional.size() > names.length) {
            throw SignpostMessages.MESSAGES.unexpectedConverterArgument(converter, String.valueOf(positional.get(names.length)));
        }
        for (int i = 0; i < positional.size(); ++i) {
            if (keywords.containsKey(names[i])) {
                throw SignpostMessages.MESSAGES.unexpectedConverterArgument(converter, names[i]);
            }
        }
    }

    /**
     * @param name     The keyword name
     * @param position The position of the argument when given without a name
     * @return The value or null if it was not given
     */
    public Object get(final String name, final int position) {
        if (keywords.containsKey(name)) {
            return keywords.get(name);
        }
        if (position >= 0 && position < positional.size()) {
            return positional.get(position);
        }
        return null;
    }

    public Integer getInteger(final String name, final int position, final Integer defaultValue) {
        final Object value = get(name, position);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Integer) {
            return (Integer) value;
        }
        throw SignpostMessages.MESSAGES.converterArgumentType(name, "an integer", value);
    }

    public Number getNumber(final String name, final int position, final Number defaultValue) {
        final Object value = get(name, position);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return (Number) value;
        }
        throw SignpostMessages.MESSAGES.converterArgumentType(name, "a number", value);
    }

    public boolean getBoolean(final String name, final int position, final boolean defaultValue) {
        final Object value = get(name, position);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        throw SignpostMessages.MESSAGES.converterArgumentType(name, "a boolean", value);
    }

    @Override
    public String toString() {
        return "ConverterArguments{" + "positional=" + positional + ", keywords=" + keywords + '}';
    }
}
