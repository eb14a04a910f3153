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

import io.signpost.testutils.category.UnitTest;
import org.junit.Assert;
import org.junit.Test;
import org.junit.experimental.categories.Category;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

@Category(UnitTest.class)
public class ConverterArgumentsTestCase {

    private static ConverterArguments parse(final String arguments) {
        return ConverterArguments.parse(arguments, StandardCharsets.UTF_8);
    }

    @Test
    public void testEmpty() {
        Assert.assertTrue(parse(null).isEmpty());
        Assert.assertTrue(parse("").isEmpty());
        Assert.assertTrue(parse("   ").isEmpty());
    }

    @Test
    public void testValues() {
        final ConverterArguments arguments = parse("1, -2, 3.5, 'a b', \"c,d\", True, false, None, null, word, 12345678901");
        Assert.assertEquals(Arrays.asList(1, -2, 3.5, "a b", "c,d", true, false, null, null, "word", 12345678901L),
                arguments.getPositional());
        Assert.assertTrue(arguments.getKeywords().isEmpty());
    }

    @Test
    public void testKeywords() {
        final ConverterArguments arguments = parse("4, max = 9999, signed=True");
        Assert.assertEquals(Arrays.asList(4), arguments.getPositional());
        Assert.assertEquals(9999, arguments.get("max", 5));
        Assert.assertEquals(Boolean.TRUE, arguments.get("signed", 5));
        Assert.assertEquals(4, arguments.get("fixed_digits", 0));
        Assert.assertNull(arguments.get("min", 1));
        Assert.assertEquals(Integer.valueOf(7), arguments.getInteger("min", 1, 7));
        Assert.assertTrue(arguments.getBoolean("signed", 3, false));
    }

    @Test
    public void testSyntaxErrors() {
        Assert.assertThrows(IllegalArgumentException.class, () -> parse("a b"));
        Assert.assertThrows(IllegalArgumentException.class, () -> parse("'unterminated"));
        Assert.assertThrows(IllegalArgumentException.class, () -> parse("x=1, 2"));
        Assert.assertThrows(IllegalArgumentException.class, () -> parse("x=1, x=2"));
        Assert.assertThrows(IllegalArgumentException.class, () -> parse("1,,2"));
        Assert.assertThrows(IllegalArgumentException.class, () -> parse("a$b"));
    }

    @Test
    public void testAllowOnly() {
        parse("1, max=3").allowOnly("int", "fixed_digits", "min", "max");
        Assert.assertThrows(IllegalArgumentException.class, () -> parse("foo=1").allowOnly("int", "min", "max"));
        Assert.assertThrows(IllegalArgumentException.class, () -> parse("1, 2, 3").allowOnly("string", "minlength", "maxlength"));
        Assert.assertThrows(IllegalArgumentException.class, () -> parse("1, minlength=2").allowOnly("string", "minlength", "maxlength"));
    }

    @Test
    public void testTypeErrors() {
        Assert.assertThrows(IllegalArgumentException.class, () -> parse("'x'").getInteger("minlength", 0, 1));
        Assert.assertThrows(IllegalArgumentException.class, () -> parse("signed=1").getBoolean("signed", 3, false));
        Assert.assertThrows(IllegalArgumentException.class, () -> parse("min=abc").getNumber("min", 1, null));
    }
}
