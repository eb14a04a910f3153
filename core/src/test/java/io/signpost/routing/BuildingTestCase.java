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

import io.signpost.SignpostOptions;
import io.signpost.testutils.category.UnitTest;
import org.junit.Assert;
import org.junit.Test;
import org.junit.experimental.categories.Category;

import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Category(UnitTest.class)
public class BuildingTestCase {

    private static UrlMap createMap() {
        return UrlMap.builder()
                .addRule(Rule.builder("/").endpoint("index").build())
                .addRule(Rule.builder("/foo").endpoint("foo").build())
                .addRule(Rule.builder("/page/<int:id>").endpoint("page").build())
                .addRule(Rule.builder("/files/<path:file>").endpoint("files").build())
                .addRule(Rule.builder("/hello world/<x>").endpoint("hello").build())
                .addRule(Rule.builder("/archive/<int(fixed_digits=4):year>/").endpoint("archive").build())
                .addRule(Rule.builder("/list/").endpoint("list").defaultValue("page", 1).build())
                .addRule(Rule.builder("/list/<int:page>").endpoint("list").build())
                .addRule(Rule.builder("/lang/<any(en, de):lang>").endpoint("lang").build())
                .addRule(Rule.builder("/users/<name>").endpoint("user").methods("POST").build())
                .addRule(Rule.builder("/user/<name>").endpoint("user").methods("GET").build())
                .addRule(Rule.builder("/ws").endpoint("socket").websocket(true).build())
                .addRule(Rule.builder("/a//b").endpoint("merged").build())
                .build();
    }

    private static Map<String, Object> values(final Object... pairs) {
        final Map<String, Object> result = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            result.put((String) pairs[i], pairs[i + 1]);
        }
        return result;
    }

    @Test
    public void testRelativeUrls() {
        final UrlMapAdapter adapter = createMap().bind("example.com");
        Assert.assertEquals("/", adapter.build("index"));
        Assert.assertEquals("/foo", adapter.build("foo"));
        Assert.assertEquals("/page/42", adapter.build("page", values("id", 42)));
        Assert.assertEquals("/page/42", adapter.build("page", values("id", 42L)));
        Assert.assertEquals("/page/42", adapter.build("page", values("id", "42")));
        Assert.assertEquals("/a/b", adapter.build("merged"));
    }

    @Test
    public void testQuoting() {
        final UrlMapAdapter adapter = createMap().bind("example.com");
        Assert.assertEquals("/files/a/b%20c.txt", adapter.build("files", values("file", "a/b c.txt")));
        Assert.assertEquals("/hello%20world/x", adapter.build("hello", values("x", "x")));
        Assert.assertEquals("/hello%20world/caf%C3%A9", adapter.build("hello", values("x", "caf\u00e9")));
    }

    @Test
    public void testFixedDigits() {
        final UrlMapAdapter adapter = createMap().bind("example.com");
        Assert.assertEquals("/archive/0024/", adapter.build("archive", values("year", 24)));
        Assert.assertEquals("/archive/2024/", adapter.build("archive", values("year", 2024)));
    }

    @Test
    public void testUnknownValuesBecomeQueryString() {
        final UrlMapAdapter adapter = createMap().bind("example.com");
        Assert.assertEquals("/foo?q=x+y", adapter.build("foo", values("q", "x y")));
        Assert.assertEquals("/foo?tag=a&tag=b", adapter.build("foo", values("tag", List.of("a", "b"))));
        Assert.assertEquals("/foo", adapter.build("foo", values("q", "x"), null, false, false, null));
    }

    @Test
    public void testSortedQueryString() {
        final UrlMap map = UrlMap.builder()
                .setOption(SignpostOptions.SORT_PARAMETERS, true)
                .addRule(Rule.builder("/").endpoint("index").build())
                .build();
        Assert.assertEquals("/?a=2&b=1", map.bind("example.com").build("index", values("b", 1, "a", 2)));

        final UrlMap reversed = UrlMap.builder()
                .setOption(SignpostOptions.SORT_PARAMETERS, true)
                .setSortKey(Comparator.reverseOrder())
                .addRule(Rule.builder("/").endpoint("index").build())
                .build();
        Assert.assertEquals("/?b=1&a=2", reversed.bind("example.com").build("index", values("a", 2, "b", 1)));
    }

    @Test
    public void testDefaults() {
        final UrlMapAdapter adapter = createMap().bind("example.com");
        Assert.assertEquals("/list/", adapter.build("list"));
        Assert.assertEquals("/list/", adapter.build("list", values("page", 1)));
        Assert.assertEquals("/list/", adapter.build("list", values("page", 1L)));
        Assert.assertEquals("/list/2", adapter.build("list", values("page", 2)));
    }

    @Test
    public void testRejectedValue() {
        final UrlMapAdapter adapter = createMap().bind("example.com");
        Assert.assertEquals("/lang/de", adapter.build("lang", values("lang", "de")));
        final BuildException e = Assert.assertThrows(BuildException.class, () -> adapter.build("lang", values("lang", "fr")));
        Assert.assertEquals("lang", e.getEndpoint());
        Assert.assertEquals(values("lang", "fr"), e.getValues());
    }

    @Test
    public void testMissingValues() {
        final UrlMapAdapter adapter = createMap().bind("example.com");
        final BuildException e = Assert.assertThrows(BuildException.class, () -> adapter.build("page"));
        Assert.assertEquals("page", e.getSuggestedRule().getEndpoint());
        Assert.assertTrue(e.getMessage(), e.getMessage().contains("[id]"));
    }

    @Test
    public void testUnknownEndpoint() {
        final UrlMapAdapter adapter = createMap().bind("example.com");
        final BuildException e = Assert.assertThrows(BuildException.class, () -> adapter.build("pages", values("id", 1)));
        Assert.assertEquals("page", e.getSuggestedRule().getEndpoint());
        Assert.assertEquals("SIGNPOST000027: Could not build url for endpoint 'pages' and values [id]. Did you mean 'page' instead?",
                e.getMessage());
    }

    @Test
    public void testNullEndpoint() {
        final UrlMapAdapter adapter = UrlMap.builder()
                .addRule(Rule.builder("/gone").redirectTo("/new").build())
                .addRule(Rule.builder("/new").endpoint("new").build())
                .build()
                .bind("example.com");
        final BuildException e = Assert.assertThrows(BuildException.class, () -> adapter.build(null));
        Assert.assertNull(e.getEndpoint());
        Assert.assertEquals("new", e.getSuggestedRule().getEndpoint());
    }

    @Test
    public void testExternalUrls() {
        final UrlMap map = createMap();
        Assert.assertEquals("http://example.com/foo", map.bind("example.com").build("foo", Collections.emptyMap(), true));
        Assert.assertEquals("https://example.com/foo", map.bind("example.com", "https").build("foo", Collections.emptyMap(), true));
        Assert.assertEquals("https://example.com/foo", map.bind("example.com").build("foo", Collections.emptyMap(), null, true, true, "https"));
        Assert.assertEquals("http://example.com/foo", map.bind("Example.COM").build("foo", Collections.emptyMap(), true));
    }

    @Test
    public void testScriptName() {
        final UrlMapAdapter adapter = createMap().bind("example.com", "/app", null, null, null, null, null);
        Assert.assertEquals("/app/foo", adapter.build("foo"));
        Assert.assertEquals("/app/", adapter.build("index"));
        Assert.assertEquals("http://example.com/app/page/1", adapter.build("page", values("id", 1), true));
    }

    @Test
    public void testWebsocketUrls() {
        final UrlMap map = createMap();
        Assert.assertEquals("ws://example.com/ws", map.bind("example.com").build("socket"));
        Assert.assertEquals("wss://example.com/ws", map.bind("example.com", "https").build("socket"));
        Assert.assertEquals("wss://example.com/ws", map.bind("example.com", "wss").build("socket"));
        Assert.assertEquals("https://example.com/foo", map.bind("example.com", "wss").build("foo", Collections.emptyMap(), true));
        Assert.assertEquals("http://example.com/foo", map.bind("example.com", "ws").build("foo", Collections.emptyMap(), true));
    }

    @Test
    public void testMethodSelection() {
        final UrlMap map = createMap();
        final UrlMapAdapter adapter = map.bind("example.com");
        Assert.assertEquals("/user/bob", adapter.build("user", values("name", "bob")));
        Assert.assertEquals("/users/bob", adapter.build("user", values("name", "bob"), "POST"));
        Assert.assertEquals("/users/bob", adapter.build("user", values("name", "bob"), "post"));
        Assert.assertEquals("/users/bob", map.bind("example.com", null, null, null, "POST", null, null).build("user", values("name", "bob")));

        final BuildException e = Assert.assertThrows(BuildException.class, () -> adapter.build("user", values("name", "bob"), "PUT"));
        Assert.assertEquals("PUT", e.getMethod());
        Assert.assertTrue(e.getMessage(), e.getMessage().contains("methods"));
    }

    @Test
    public void testValueNormalization() {
        final UrlMapAdapter adapter = createMap().bind("example.com");
        Assert.assertEquals("/page/7", adapter.build("page", values("id", List.of(7))));
        Assert.assertEquals("/page/7", adapter.build("page", values("id", 7, "x", null)));
        Assert.assertEquals("/page/7", adapter.build("page", values("id", 7, "x", List.of())));
        final Map<String, Object> nullId = new HashMap<>();
        nullId.put("id", null);
        Assert.assertThrows(BuildException.class, () -> adapter.build("page", nullId));
    }

    @Test
    public void testRoundTrip() {
        final UrlMapAdapter adapter = createMap().bind("example.com");
        final String url = adapter.build("files", values("file", "a/b c.txt"));
        final MatchResult.Matched matched = adapter.match("/files/a/b c.txt").getOrThrow();
        Assert.assertEquals("/files/a/b%20c.txt", url);
        Assert.assertEquals("files", matched.getEndpoint());
        Assert.assertEquals(adapter.build(matched.getEndpoint(), matched.getValues()), url);
    }

    @Test
    public void testEndpointExpecting() {
        final UrlMap map = createMap();
        Assert.assertTrue(map.isEndpointExpecting("page", "id"));
        Assert.assertTrue(map.isEndpointExpecting("list", "page"));
        Assert.assertFalse(map.isEndpointExpecting("foo", "id"));
        Assert.assertFalse(map.isEndpointExpecting("missing", "id"));
    }
}
