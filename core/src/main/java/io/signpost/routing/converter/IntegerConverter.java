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
import java.math.BigInteger;

/**
 * Matches positive integers, and negative ones when {@code signed=True}.
 * <pre>
 * /page/&lt;int:page&gt;
 * /year/&lt;int(fixed_digits=4):year&gt;
 * /offset/&lt;int(signed=True):offset&gt;
 * </pre>
 * Arguments, in positional order: {@code fixed_digits}, {@code min}, {@code max} and {@code signed}.
 * <p>
 * Values are {@link Integer}s when they fit, {@link Long}s otherwise.
 */
public class IntegerConverter extends NumberConverter {

    private final int fixedDigits;

    public IntegerConverter(final ConverterArguments arguments) {
        this(check(arguments), arguments.getInteger("fixed_digits", 0, 0),
                arguments.getNumber("min", 1, null), arguments.getNumber("max", 2, null),
                arguments.getBoolean("signed", 3, false));
    }

    private IntegerConverter(final ConverterArguments arguments, final int fixedDigits, final Number min, final Number max, final boolean signed) {
        super("\\d+", min, max, signed, arguments);
        this.fixedDigits = fixedDigits;
    }

    private static ConverterArguments check(final ConverterArguments arguments) {
        arguments.allowOnly("int", "fixed_digits", "min", "max", "signed");
        return arguments;
    }

    public int getFixedDigits() {
        return fixedDigits;
    }

    @Override
    public Object fromUrl(final String value) throws ValidationException {
        if (fixedDigits > 0) {
            final int digits = value.startsWith("-") ? value.length() - 1 : value.length();
            if (digits != fixedDigits) {
                throw SignpostMessages.MESSAGES.wrongDigitCount(fixedDigits, value);
            }
        }
        final long number;
        try {
            number = Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new ValidationException(e);
        }
        checkRange(number, value);
        if (number >= Integer.MIN_VALUE && number <= Integer.MAX_VALUE) {
            return (int) number;
        }
        return number;
    }

    @Override
    public String toUrl(final Object value) throws ValidationException {
        final BigInteger number;
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            number = BigInteger.valueOf(((Number) value).longValue());
        } else if (value instanceof BigInteger) {
            number = (BigInteger) value;
        } else if (value instanceof BigDecimal || value instanceof CharSequence) {
            try {
                number = new BigDecimal(value.toString().trim()).toBigIntegerExact();
            } catch (ArithmeticException | NumberFormatException e) {
                throw new ValidationException(e);
            }
        } else {
            throw SignpostMessages.MESSAGES.notAnInteger(value);
        }
        String digits = number.abs().toString();
        final StringBuilder sb = new StringBuilder();
        if (number.signum() < 0) {
            sb.append('-');
        }
        for (int i = digits.length(); i < fixedDigits; ++i) {
            sb.append('0');
        }
        return sb.append(digits).toString();
    }

    @Override
    public boolean equals(final Object o) {
        return super.equals(o) && fixedDigits == ((IntegerConverter) o).fixedDigits;
    }

    @Override
    public int hashCode() {
        return 31 * super.hashCode() + fixedDigits;
    }
}
