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
 * Recognises and converts one variable of a rule.
 * <p>
 * The {@link #getRegex() regular expression} decides which request text the variable can match, {@link #fromUrl(String)}
 * turns matched text into a value and {@link #toUrl(Object)} turns a value back into URL text when building. Converters
 * are immutable and shared by every request that is routed through the rule that owns them.
 * <p>
 * Two converters that are {@link Object#equals(Object) equal} must accept and produce exactly the same values, as rules
 * with equal converters in the same position share matcher transitions.
 *
 * @see AbstractConverter
 * @see Converters
 */
public interface Converter {

    /**
     * @return A regular expression fragment. It is embedded in a larger expression, so it must not be anchored and must
     * not use named groups starting with {@code sp}.
     */
    String getRegex();

    /**
     * @return True if this converter never matches a '/' character. Converters that can match a '/' consume the remainder
     * of a path and are always tried after those that don't. By default a converter is part isolating unless its regular
     * expression contains a '/' outside of a {@code [^/]} class.
     */
    default boolean isPartIsolating() {
        return getRegex().replace("[^/]", "").indexOf('/') == -1;
    }

    /**
     * @return The weight of this converter. Converters with lower weights are tried first.
     */
    int getWeight();

    /**
     * @param value The text matched by {@link #getRegex()}.
     * @return The converted value
     * @throws ValidationException if the text was matched but its value is not acceptable
     */
    Object fromUrl(String value) throws ValidationException;

    /**
     * @param value The value
     * @return The URL text for the value, percent encoded where required
     * @throws ValidationException if the value cannot be represented by this converter
     */
    String toUrl(Object value) throws ValidationException;
}
