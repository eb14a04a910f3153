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

import io.signpost.routing.converter.Converters;
import io.signpost.routing.converter.IntegerConverter;
import io.signpost.routing.converter.PathConverter;
import io.signpost.testutils.category.UnitTest;
import org.junit.Assert;
import org.junit.Test;
import org.junit.experimental.categories.Category;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;

@Category(UnitTest.class)
public class RuleCompilerTestCase {

    private static final RuleCompiler COMPILER = new RuleCompiler(Converters.DEFAULT_CONVERTERS, StandardCharsets.UTF_8,
            true, true, false, false, "");

    private static CompiledRule compile(final String template) {
        return COMPILER.compile(Rule.builder(template).endpoint("test").build(), 0);
    }

    @Test
    public void testStaticParts() {
        final List<RulePart> parts = compile("/foo/bar").getParts();
        Assert.assertEquals(4, parts.size());
        Assert.assertEquals("", parts.get(0).getContent());
        Assert.assertEquals("", parts.get(1).getContent());
        Assert.assertEquals("foo", parts.get(2).getContent());
        Assert.assertEquals("bar", parts.get(3).getContent());
        for (RulePart part : parts) {
            Assert.assertTrue(part.isStatic());
        }
    }

    @Test
    public void testBranchAndLeaf() {
        final CompiledRule branch = compile("/foo/");
        Assert.assertFalse(branch.isLeaf());
        Assert.assertEquals(4, branch.getParts().size());
        Assert.assertEquals("", branch.getParts().get(3).getContent());
        Assert.assertTrue(compile("/foo").isLeaf());
        Assert.assertEquals(3, compile("/").getParts().size());
    }

    @Test
    public void testDynamicParts() {
        final CompiledRule rule = compile("/page-<int:number>.html");
        final RulePart part = rule.getParts().get(2);
        Assert.assertFalse(part.isStatic());
        Assert.assertFalse(part.isFinal());
        Assert.assertEquals("\\Qpage-\\E(?<sp0>\\d+)\\Q.html\\E", part.getContent());
        Assert.assertTrue(part.getConverters().get(0) instanceof IntegerConverter);
        Assert.assertEquals(Set.of("number"), rule.getConverters().keySet());

        final RulePart two = compile("/<a>-<int:b>").getParts().get(2);
        Assert.assertEquals("(?<sp0>[^/]{1,})\\Q-\\E(?<sp1>\\d+)", two.getContent());
        Assert.assertEquals(2, two.getConverters().size());
    }

    @Test
    public void testFinalParts() {
        final CompiledRule rule = compile("/files/<path:file>/edit");
        Assert.assertEquals(4, rule.getParts().size());
        final RulePart part = rule.getParts().get(3);
        Assert.assertTrue(part.isFinal());
        Assert.assertFalse(part.isSuffixed());
        Assert.assertEquals("(?<sp0>[^/].*?)/\\Qedit\\E", part.getContent());
        Assert.assertTrue(part.getConverters().get(0) instanceof PathConverter);

        final CompiledRule suffixed = compile("/files/<path:file>/");
        Assert.assertEquals(5, suffixed.getParts().size());
        Assert.assertTrue(suffixed.getParts().get(3).isSuffixed());
        Assert.assertEquals("(?<sp0>[^/].*?)(?<!/)(?<spsuffix>/?)", suffixed.getParts().get(3).getContent());
        Assert.assertTrue(suffixed.getParts().get(4).isStatic());
        Assert.assertEquals("", suffixed.getParts().get(4).getContent());
    }

    @Test
    public void testEqualPartsIgnoreVariableNames() {
        Assert.assertEquals(compile("/<int:a>/x").getParts(), compile("/<int:b>/x").getParts());
        Assert.assertNotEquals(compile("/<int:a>").getParts(), compile("/<int(max=3):a>").getParts());
        Assert.assertNotEquals(compile("/<int:a>").getParts(), compile("/<a>").getParts());
    }

    @Test
    public void testWeights() {
        final RulePart integer = compile("/<int:a>").getParts().get(2);
        final RulePart string = compile("/<a>").getParts().get(2);
        final RulePart path = compile("/<path:a>").getParts().get(2);
        final RulePart prefixed = compile("/x<a>").getParts().get(2);
        final RulePart longer = compile("/xyz<a>").getParts().get(2);
        final RulePart two = compile("/<a>-<b>").getParts().get(2);

        Assert.assertTrue(integer.getWeight().compareTo(string.getWeight()) < 0);
        Assert.assertTrue(string.getWeight().compareTo(path.getWeight()) < 0);
        Assert.assertTrue(prefixed.getWeight().compareTo(integer.getWeight()) < 0);
        Assert.assertTrue(longer.getWeight().compareTo(prefixed.getWeight()) < 0);
        Assert.assertTrue(two.getWeight().compareTo(string.getWeight()) < 0);
        Assert.assertEquals(0, string.getWeight().compareTo(compile("/<b>").getParts().get(2).getWeight()));
    }

    @Test
    public void testMergeSlashes() {
        Assert.assertEquals("/a/b/", compile("/a//b//").getPathTemplate());
        final CompiledRule kept = COMPILER.compile(Rule.builder("/a//b").endpoint("test").mergeSlashes(false).build(), 0);
        Assert.assertEquals("/a//b", kept.getPathTemplate());
        Assert.assertFalse(kept.isMergeSlashes());
    }

    @Test
    public void testInheritedFlags() {
        final CompiledRule rule = compile("/a");
        Assert.assertTrue(rule.isStrictSlashes());
        Assert.assertTrue(rule.isMergeSlashes());
        final CompiledRule relaxed = COMPILER.compile(Rule.builder("/a").endpoint("test").strictSlashes(false).build(), 0);
        Assert.assertFalse(relaxed.isStrictSlashes());
    }

    @Test
    public void testSyntaxErrors() {
        Assert.assertThrows(RuleSyntaxException.class, () -> Rule.builder("foo").endpoint("test").build());
        Assert.assertThrows(RuleSyntaxException.class, () -> Rule.builder("/<foo").endpoint("test").build());
        Assert.assertThrows(RuleSyntaxException.class, () -> Rule.builder("/<1a>").endpoint("test").build());
        Assert.assertThrows(RuleSyntaxException.class, () -> compile("/<a>/<int:a>"));
        Assert.assertThrows(RuleSyntaxException.class, () -> compile("/<nope:a>"));
        final RuleSyntaxException e = Assert.assertThrows(RuleSyntaxException.class, () -> compile("/<int(width=3):a>"));
        Assert.assertTrue(e.getCause() instanceof IllegalArgumentException);
        Assert.assertThrows(RuleSyntaxException.class, () -> compile("/<int(1 2):a>"));
    }

    @Test
    public void testDomainWithoutMatching() {
        Assert.assertThrows(RuleSyntaxException.class,
                () -> COMPILER.compile(Rule.builder("/").endpoint("test").subdomain("www").build(), 0));
        Assert.assertThrows(RuleSyntaxException.class,
                () -> COMPILER.compile(Rule.builder("/").endpoint("test").host("example.com").build(), 0));
    }

    @Test
    public void testDomainParts() {
        final RuleCompiler subdomains = new RuleCompiler(Converters.DEFAULT_CONVERTERS, StandardCharsets.UTF_8,
                true, true, false, true, "www");
        Assert.assertEquals("www", subdomains.compile(Rule.builder("/").endpoint("test").build(), 0).getParts().get(0).getContent());
        final CompiledRule user = subdomains.compile(Rule.builder("/<int:id>").endpoint("test").subdomain("<user>").build(), 0);
        Assert.assertFalse(user.getParts().get(0).isStatic());
        Assert.assertEquals(List.of("user", "id"), List.copyOf(user.getConverters().keySet()));
        Assert.assertEquals(Set.of("user", "id"), user.getArguments());
    }
}
