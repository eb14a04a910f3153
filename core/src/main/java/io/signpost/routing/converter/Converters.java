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

import java.util.LinkedHashMap;
import java.util.Map;

import static java.util.Collections.unmodifiableMap;

/**
 * The converters known to every map unless overridden.
 */
public final class Converters {

    public static final String DEFAULT = "default";

    public static final Map<String, ConverterFactory> DEFAULT_CONVERTERS;

    static {
        final Map<String, ConverterFactory> converters = new LinkedHashMap<>();
        converters.put(DEFAULT, UnicodeConverter::new);
        converters.put("string", UnicodeConverter::new);
        converters.put("any", AnyConverter::new);
        converters.put("path", PathConverter::new);
        converters.put("int", IntegerConverter::new);
        converters.put("float", FloatConverter::new);
        converters.put("uuid", UuidConverter::new);
        DEFAULT_CONVERTERS = unmodifiableMap(converters);
    }

    private Converters() {
    }
}
