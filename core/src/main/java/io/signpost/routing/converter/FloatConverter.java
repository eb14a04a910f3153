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

import java.math.BigDecimal;

/**
 * Matches decimal numbers with a fraction part, for example {@code 1.5}. Values are {@link Double}s.
 * <pre>
 * /probability/&lt;float:probability&gt;
 * /offset/&lt;float(signed=True):offset&gt;
 * </pre>
 * Arguments, in positional order: {@code min}, {@code max} and {@code signed}.
 */
public class FloatConverter extends NumberConverter {

    public FloatConverter(final ConverterArguments arguments) {
        this(check(arguments), arguments.getNumber("min", 0, null), arguments.getNumber("max", 1, null),
                arguments.getBoolean("signed", 2, false));
    }

    private FloatConverter(final ConverterArguments arguments, final Number min, final Number max, final boolean signed) {
        super("\\d+\\.\\d+", min, max, signed, arguments);
    }

    private static ConverterArguments check(final ConverterArguments arguments) {
        arguments.allowOnly("float", "min", "max", "signed");
        return arguments;
    }

    @Override
    public Object fromUrl(final String value) throws ValidationException {
        final double number;
        try {
            number = Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new ValidationException(e);
        }
        checkRange(number, value);
        return number;
    }

    @Override
    public String toUrl(final Object value) throws ValidationException {
        final BigDecimal number;
        try {
            if (value instanceof BigDecimal) {
                number = (BigDecimal) value;
            } else if (value instanceof Number) {
                final double d = ((Number) value).doubleValue();
                if (Double.isNaN(d) || Double.isInfinite(d)) {
                    throw SignpostMessages.MESSAGES.notAFiniteNumber(value);
                }
                number = BigDecimal.valueOf(d);
            } else if (value instanceof CharSequence) {
                number = new BigDecimal(value.toString().trim());
            } else {
                throw SignpostMessages.MESSAGES.notANumber(value);
            }
        } catch (NumberFormatException e) {
            throw new ValidationException(e);
        }
        final String text = number.toPlainString();
        return text.indexOf('.') == -1 ? text + ".0" : text;
    }
}
