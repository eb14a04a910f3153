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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Matches one of the items given as positional arguments.
 * <pre>
 * /&lt;any(about, help, imprint, "class"):page_name&gt;
 * </pre>
 */
public class AnyConverter extends AbstractConverter {

    public static final int WEIGHT = 100;

    private final List<String> items;

    public AnyConverter(final ConverterArguments arguments) {
        this(items(arguments), arguments);
    }

    private AnyConverter(final List<String> items, final ConverterArguments arguments) {
        super(regex(items), WEIGHT, arguments);
        this.items = items;
    }

    private static List<String> items(final ConverterArguments arguments) {
        if (!arguments.getKeywords().isEmpty()) {
            throw SignpostMessages.MESSAGES.unexpectedConverterArgument("any", arguments.getKeywords().keySet().iterator().next());
        }
        final List<String> items = new ArrayList<>();
        for (Object item : arguments.getPositional()) {
            items.add(String.valueOf(item));
        }
        return Collections.unmodifiableList(items);
    }

    private static String regex(final List<String> items) {
        final StringBuilder sb = new StringBuilder("(?:");
        for (int i = 0; i < items.size(); ++i) {
            if (i > 0) {
                sb.append('|');
            }
            sb.append(Pattern.quote(items.get(i)));
        }
        return sb.append(')').toString();
    }

    public List<String> getItems() {
        return items;
    }

    @Override
    public String toUrl(final Object value) throws ValidationException {
        final String text = String.valueOf(value);
        if (!items.contains(text)) {
            throw SignpostMessages.MESSAGES.valueNotAllowed(text, items);
        }
        return super.toUrl(text);
    }
}
