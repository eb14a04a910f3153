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

package io.signpost.routing;

import io.signpost.routing.converter.Converter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One '/' delimited position of a compiled rule. The domain template of a rule is its first part.
 * <p>
 * A static part matches its text exactly. A dynamic part matches a regular expression built from the quoted static text
 * and the regular expressions of its converters, each converter in a group named {@code sp0}, {@code sp1} and so on. A
 * dynamic part with a converter that can match a '/' is final: it consumes the rest of the template and is matched
 * against the rest of the request path. A final part whose template ends with a '/' is suffixed: the trailing slash is
 * optional in its expression and captured in the {@code spsuffix} group, and an empty static part follows it.
 * <p>
 * Two parts are equal if they match the same text and convert it with equal converters. Rules with equal parts at the
 * same position share a transition of the matcher.
 */
public final class RulePart {

    static final String GROUP_PREFIX = "sp";
    static final String SUFFIX_GROUP = "spsuffix";

    private final String content;
    private final boolean isStatic;
    private final boolean isFinal;
    private final boolean suffixed;
    private final List<Converter> converters;
    private final Weighting weight;
    private final Pattern pattern;

    RulePart(final String content, final boolean isStatic, final boolean isFinal, final boolean suffixed, final List<Converter> converters, final Weighting weight) {
        this.content = content;
        this.isStatic = isStatic;
        this.isFinal = isFinal;
        this.suffixed = suffixed;
        this.converters = Collections.unmodifiableList(new ArrayList<>(converters));
        this.weight = weight;
        this.pattern = isStatic ? null : Pattern.compile(content);
    }

    static RulePart staticPart(final String content, final Weighting weight) {
        return new RulePart(content, true, false, false, Collections.emptyList(), weight);
    }

    /**
     * @return The exact text of a static part, or the regular expression of a dynamic one
     */
    public String getContent() {
        return content;
    }

    public boolean isStatic() {
        return isStatic;
    }

    public boolean isFinal() {
        return isFinal;
    }

    public boolean isSuffixed() {
        return suffixed;
    }

    /**
     * @return The converters of the part, in the order of their groups
     */
    public List<Converter> getConverters() {
        return converters;
    }

    public Weighting getWeight() {
        return weight;
    }

    Pattern getPattern() {
        return pattern;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final RulePart that = (RulePart) o;
        return isStatic == that.isStatic
                && isFinal == that.isFinal
                && suffixed == that.suffixed
                && content.equals(that.content)
                && converters.equals(that.converters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(content, isStatic, isFinal, suffixed, converters);
    }

    @Override
    public String toString() {
        return isStatic ? "'" + content + "'" : "/" + content + "/" + (isFinal ? " final" : "") + (suffixed ? " suffixed" : "");
    }

    /**
     * The specificity of a dynamic part. Parts that compare lower are tried first.
     * <p>
     * Compared in order: the number of static pieces (more first), the position and length of each static piece (earlier
     * and longer first), the number of converters (more first) and the weight of each converter (lower first).
     */
    public static final class Weighting implements Comparable<Weighting> {

        // {position, length}
        private final List<int[]> staticWeights;
        private final List<Integer> converterWeights;

        Weighting(final List<int[]> staticWeights, final List<Integer> converterWeights) {
            this.staticWeights = Collections.unmodifiableList(new ArrayList<>(staticWeights));
            this.converterWeights = Collections.unmodifiableList(new ArrayList<>(converterWeights));
        }

        @Override
        public int compareTo(final Weighting o) {
            int result = Integer.compare(o.staticWeights.size(), staticWeights.size());
            if (result != 0) {
                return result;
            }
            final int statics = Math.min(staticWeights.size(), o.staticWeights.size());
            for (int i = 0; i < statics; ++i) {
                final int[] a = staticWeights.get(i);
                final int[] b = o.staticWeights.get(i);
                result = Integer.compare(a[0], b[0]);
                if (result == 0) {
                    result = Integer.compare(b[1], a[1]);
                }
                if (result != 0) {
                    return result;
                }
            }
            result = Integer.compare(o.converterWeights.size(), converterWeights.size());
            if (result != 0) {
                return result;
            }
            final int converters = Math.min(converterWeights.size(), o.converterWeights.size());
            for (int i = 0; i < converters; ++i) {
                result = Integer.compare(converterWeights.get(i), o.converterWeights.get(i));
                if (result != 0) {
                    return result;
                }
            }
            return 0;
        }

        @Override
        public String toString() {
            final StringBuilder sb = new StringBuilder("Weighting{statics=[");
            for (int i = 0; i < staticWeights.size(); ++i) {
                if (i > 0) {
                    sb.append(", ");
                }
                sb.append('(').append(staticWeights.get(i)[0]).append(", ").append(staticWeights.get(i)[1]).append(')');
            }
            return sb.append("], converters=").append(converterWeights).append('}').toString();
        }
    }
}
