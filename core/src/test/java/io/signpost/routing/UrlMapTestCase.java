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

import io.signpost.testutils.category.UnitTest;
import org.junit.Assert;
import org.junit.Test;
import org.junit.experimental.categories.Category;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

@Category(UnitTest.class)
public class UrlMapTestCase {

    private static UrlMap createMap() {
        return UrlMap.builder()
                .addRule(Rule.builder("/a").endpoint("a").build())
                .addRule(Rule.builder("/form").endpoint("form.show").methods("GET").build())
                .build();
    }

    @Test
    public void testDuplicateRule() {
        final UrlMap map = createMap();
        final UrlMapAdapter adapter = map.bind("example.com");
        final DuplicateRuleException e = Assert.assertThrows(DuplicateRuleException.class,
                () -> map.add(Rule.builder("/a").endpoint("b").build()));
        Assert.assertTrue(e.getMessage(), e.getMessage().contains("/a"));
        Assert.assertEquals(2, map.getRules().size());
        Assert.assertEquals("a", adapter.match("/a").getOrThrow().getEndpoint());
    }

    @Test
    public void testSamePatternDifferentMethods() {
        final UrlMap map = createMap();
        map.add(Rule.builder("/form").endpoint("form.submit").methods("POST").build());
        final UrlMapAdapter adapter = map.bind("example.com");
        Assert.assertEquals("form.show", adapter.match("/form", "GET").getOrThrow().getEndpoint());
        Assert.assertEquals("form.submit", adapter.match("/form", "POST").getOrThrow().getEndpoint());
        Assert.assertThrows(DuplicateRuleException.class,
                () -> map.add(Rule.builder("/form").endpoint("form.any").build()));
        Assert.assertThrows(DuplicateRuleException.class,
                () -> map.add(Rule.builder("/form").endpoint("form.head").methods("HEAD").build()));
    }

    @Test
    public void testVariableNamesDoNotMakeRulesDistinct() {
        final UrlMap map = UrlMap.builder().addRule(Rule.builder("/<x>").endpoint("x").build()).build();
        Assert.assertThrows(DuplicateRuleException.class, () -> map.add(Rule.builder("/<y>").endpoint("y").build()));
        map.add(Rule.builder("/<int:y>").endpoint("y").build());
        map.add(Rule.builder("/<string(length=2):y>").endpoint("z").build());
        Assert.assertEquals(3, map.getRules().size());
    }

    @Test
    public void testBuildOnlyAndWebsocketRulesAreNotDuplicates() {
        final UrlMap map = createMap();
        map.add(Rule.builder("/a").endpoint("a.build").buildOnly(true).build());
        map.add(Rule.builder("/a").endpoint("a.socket").websocket(true).build());
        final UrlMapAdapter adapter = map.bind("example.com");
        Assert.assertEquals("a", adapter.match("/a").getOrThrow().getEndpoint());
        Assert.assertEquals("a.socket", adapter.match("/a", "GET", null, true).getOrThrow().getEndpoint());
        Assert.assertEquals("/a", adapter.build("a.build"));
    }

    @Test
    public void testFailedBatchAddsNothing() {
        final UrlMap map = createMap();
        Assert.assertThrows(DuplicateRuleException.class, () -> map.addAll(
                Rule.builder("/ok").endpoint("ok").build(),
                Rule.builder("/a").endpoint("again").build()));
        Assert.assertThrows(DuplicateRuleException.class, () -> map.addAll(
                Rule.builder("/p").endpoint("p1").build(),
                Rule.builder("/p").endpoint("p2").build()));
        Assert.assertThrows(RuleSyntaxException.class, () -> map.addAll(
                Rule.builder("/q").endpoint("q").build(),
                Rule.builder("/<nope:x>").endpoint("bad").build()));
        Assert.assertEquals(2, map.getRules().size());
        Assert.assertFalse(map.bind("example.com").test("/ok"));
        Assert.assertFalse(map.bind("example.com").test("/p"));
        Assert.assertFalse(map.bind("example.com").test("/q"));
    }

    @Test
    public void testRulesAddedAfterBinding() {
        final UrlMap map = createMap();
        final UrlMapAdapter adapter = map.bind("example.com");
        Assert.assertFalse(adapter.test("/late"));
        map.add(Rule.builder("/late").endpoint("late").build());
        Assert.assertEquals("late", adapter.match("/late").getOrThrow().getEndpoint());
        Assert.assertEquals("/late", adapter.build("late"));
    }

    @Test
    public void testRuleOrder() {
        final Rule alias = Rule.builder("/e.html").endpoint("e").alias(true).build();
        final Rule first = Rule.builder("/e").endpoint("e").build();
        final Rule second = Rule.builder("/e/<int:page>").endpoint("e").build();
        final UrlMap map = UrlMap.builder()
                .addRule(alias)
                .addRule(first)
                .addRule(second)
                .addRule(Rule.builder("/other").endpoint("other").build())
                .build();
        Assert.assertEquals(List.of(first, second, alias), map.iterRules("e"));
        Assert.assertEquals(4, map.getRules().size());
        Assert.assertEquals(alias, map.getRules().get(0));
        Assert.assertEquals(map.getRules(), map.iterRules(null));
        Assert.assertTrue(map.iterRules("missing").isEmpty());
    }

    @Test
    public void testConcurrentReadsDuringWrites() throws Exception {
        final UrlMap map = createMap();
        final UrlMapAdapter adapter = map.bind("example.com");
        final ExecutorService executor = Executors.newFixedThreadPool(4);
        final CountDownLatch start = new CountDownLatch(1);
        final AtomicBoolean writing = new AtomicBoolean(true);
        final AtomicReference<Throwable> failure = new AtomicReference<>();
        try {
            final List<Runnable> readers = new ArrayList<>();
            for (int i = 0; i < 3; ++i) {
                readers.add(() -> {
                    try {
                        start.await();
                        while (writing.get()) {
                            if (!"a".equals(adapter.match("/a").getOrThrow().getEndpoint())) {
                                throw new AssertionError("Unexpected match");
                            }
                            adapter.build("a");
                        }
                    } catch (Throwable t) {
                        failure.compareAndSet(null, t);
                    }
                });
            }
            readers.forEach(executor::execute);
            start.countDown();
            for (int i = 0; i < 200; ++i) {
                map.add(Rule.builder("/r" + i + "/<int:id>").endpoint("r" + i).build());
            }
            writing.set(false);
        } finally {
            executor.shutdown();
            Assert.assertTrue(executor.awaitTermination(30, TimeUnit.SECONDS));
        }
        if (failure.get() != null) {
            throw new AssertionError(failure.get());
        }
        Assert.assertEquals(202, map.getRules().size());
        Assert.assertEquals("/r199/5", adapter.build("r199", Map.of("id", 5)));
    }
}
