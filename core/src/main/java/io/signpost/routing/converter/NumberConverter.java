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

import java.util.Objects;

/**
 * Base class for the numeric converters. Holds the optional range and whether negative values are accepted.
 */
public abstract class NumberConverter extends AbstractConverter {

    public static final int WEIGHT = 50;

    private final Number min;
    private final Number max;
    private final boolean signed;

    protected NumberConverter(final String regex, final Number min, final Number max, final boolean signed, final ConverterArguments arguments) {
        super(signed ? "-?" + regex : regex, WEIGHT, arguments);
        this.min = min;
        this.max = max;
        this.signed = signed;
    }

    public Number getMin() {
        return min;
    }

    public Number getMax() {
        return max;
    }

    public boolean isSigned() {
        return signed;
    }

    protected void checkRange(final double value, final String text) throws ValidationException {
        if ((min != null && value < min.doubleValue()) || (max != null && value > max.doubleValue())) {
            throw SignpostMessages.MESSAGES.valueOutOfRange(text);
        }
    }

    @Override
    public boolean equals(final Object o) {
        if (!super.equals(o)) {
            return false;
        }
        final NumberConverter that = (NumberConverter) o;
        return signed == that.signed && Objects.equals(min, that.min) && Objects.equals(max, that.max);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), min, max, signed);
    }
}
