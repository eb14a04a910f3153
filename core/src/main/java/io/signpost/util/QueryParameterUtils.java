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

package io.signpost.util;

import java.lang.reflect.Array;
import java.net.URLEncoder;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Methods for dealing with the query string
 */
public class QueryParameterUtils {

    private QueryParameterUtils() {

    }

    /**
     * Builds a form encoded query string from a multi value map, in the iteration order of the map.
     *
     * @param params  The parameters
     * @param charset The charset for percent encoding
     * @return The query string, without a leading '?'
     */
    public static String buildQueryString(final Map<String, Deque<String>> params, final Charset charset) {
        StringBuilder sb = new StringBuilder();
        boolean first = true;
        for (Map.Entry<String, Deque<String>> entry : params.entrySet()) {
            final String key = URLEncoder.encode(entry.getKey(), charset);
            if (entry.getValue().isEmpty()) {
                if (first) {
                    first = false;
                } else {
                    sb.append('&');
                }
                sb.append(key);
                sb.append('=');
            } else {
                for (String val : entry.getValue()) {
                    if (first) {
                        first = false;
                    } else {
                        sb.append('&');
                    }
                    sb.append(key);
                    sb.append('=');
                    sb.append(URLEncoder.encode(val, charset));
                }
            }
        }
        return sb.toString();
    }

    /**
     * Builds a form encoded query string from build values. Collections and arrays contribute one pair per element, null
     * values are skipped.
     *
     * @param values  The values
     * @param charset The charset for percent encoding
     * @param sortKey If not null, pairs are sorted by key with this comparator before encoding
     * @return The query string, without a leading '?'
     */
    public static String encodeValues(final Map<String, ?> values, final Charset charset, final Comparator<String> sortKey) {
        final List<Map.Entry<String, String>> pairs = new ArrayList<>();
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            final Object value = entry.getValue();
            if (value instanceof Collection) {
                for (Object v : (Collection<?>) value) {
                    if (v != null) {
                        pairs.add(Map.entry(entry.getKey(), String.valueOf(v)));
                    }
                }
            } else if (value != null && value.getClass().isArray()) {
                final int len = Array.getLength(value);
                for (int i = 0; i < len; ++i) {
                    final Object v = Array.get(value, i);
                    if (v != null) {
                        pairs.add(Map.entry(entry.getKey(), String.valueOf(v)));
                    }
                }
            } else if (value != null) {
                pairs.add(Map.entry(entry.getKey(), String.valueOf(value)));
            }
        }
        if (sortKey != null) {
            // stable, so values of the same key keep their order
            pairs.sort(Map.Entry.comparingByKey(sortKey));
        }
        final StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> pair : pairs) {
            if (sb.length() > 0) {
                sb.append('&');
            }
            sb.append(URLEncoder.encode(pair.getKey(), charset));
            sb.append('=');
            sb.append(URLEncoder.encode(pair.getValue(), charset));
        }
        return sb.toString();
    }
}
