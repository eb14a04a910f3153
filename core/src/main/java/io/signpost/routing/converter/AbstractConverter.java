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

import io.signpost.util.URLUtils;

import java.nio.charset.Charset;
import java.util.Objects;

/**
 * Base class for converters. Values are turned into URL text with {@link String#valueOf(Object)} and percent encoded
 * with the charset of the map.
 * <p>
 * Subclasses with configuration that is not reflected in the regular expression must override {@link #equals(Object)}
 * and {@link #hashCode()}.
 */
public abstract class AbstractConverter implements Converter {

    private final String regex;
    private final int weight;
    private final Charset charset;

    protected AbstractConverter(final String regex, final int weight, final Charset charset) {
        this.regex = regex;
        this.weight = weight;
        this.charset = charset;
    }

    protected AbstractConverter(final String regex, final int weight, final ConverterArguments arguments) {
        this(regex, weight, arguments.getCharset());
    }

    @Override
    public String getRegex() {
        return regex;
    }

    @Override
    public int getWeight() {
        return weight;
    }

    protected Charset getCharset() {
        return charset;
    }

    @Override
    public Object fromUrl(final String value) throws ValidationException {
        return value;
    }

    @Override
    public String toUrl(final Object value) throws ValidationException {
        return URLUtils.quote(String.valueOf(value), charset, URLUtils.PATH_SAFE);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final AbstractConverter that = (AbstractConverter) o;
        return weight == that.weight && regex.equals(that.regex) && charset.equals(that.charset);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), regex, weight);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + "regex='" + regex + '\'' + '}';
    }
}
