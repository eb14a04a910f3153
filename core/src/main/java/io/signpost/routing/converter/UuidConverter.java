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

import java.util.UUID;

/**
 * Matches a UUID in its canonical form, for example {@code 7b5aa37e-3c6b-4a14-9b06-4d6c3a22c5fa}.
 */
public class UuidConverter extends AbstractConverter {

    public static final int WEIGHT = 100;

    public UuidConverter(final ConverterArguments arguments) {
        super("[A-Fa-f0-9]{8}-[A-Fa-f0-9]{4}-[A-Fa-f0-9]{4}-[A-Fa-f0-9]{4}-[A-Fa-f0-9]{12}", WEIGHT, arguments);
        arguments.allowOnly("uuid");
    }

    @Override
    public Object fromUrl(final String value) throws ValidationException {
        try {
            return UUID.fromString(value);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e);
        }
    }

    @Override
    public String toUrl(final Object value) throws ValidationException {
        if (value instanceof UUID) {
            return value.toString();
        }
        try {
            return UUID.fromString(String.valueOf(value)).toString();
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e);
        }
    }
}
