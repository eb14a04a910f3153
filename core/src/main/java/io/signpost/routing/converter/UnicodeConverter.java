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

/**
 * The default converter. Matches one path segment of a configurable length.
 * <pre>
 * /pages/&lt;page&gt;
 * /&lt;string(length=2):lang_code&gt;
 * </pre>
 * Arguments, in positional order: {@code minlength} (default 1), {@code maxlength} and {@code length}. A {@code length}
 * overrides the other two.
 */
public class UnicodeConverter extends AbstractConverter {

    public static final int WEIGHT = 100;

    public UnicodeConverter(final ConverterArguments arguments) {
        super(regex(arguments), WEIGHT, arguments);
    }

    private static String regex(final ConverterArguments arguments) {
        arguments.allowOnly("string", "minlength", "maxlength", "length");
        final Integer minLength = arguments.getInteger("minlength", 0, 1);
        final Integer maxLength = arguments.getInteger("maxlength", 1, null);
        final Integer length = arguments.getInteger("length", 2, null);
        if (length != null) {
            return "[^/]{" + length + "}";
        }
        return "[^/]{" + minLength + "," + (maxLength == null ? "" : maxLength.toString()) + "}";
    }
}
