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

import java.util.Map;

@Category(UnitTest.class)
public class HostMatchingTestCase {

    private static UrlMap createHostMap() {
        return UrlMap.builder()
                .setOption(SignpostOptions.HOST_MATCHING, true)
                .addRule(Rule.builder("/").endpoint("index").host("example.com").build())
                .addRule(Rule.builder("/").endpoint("user").host("<user>.example.org").build())
                .addRule(Rule.builder("/files/<path:file>").endpoint("files").host("static.example.org").build())
                .build();
    }

    private static UrlMap createSubdomainMap() {
        return UrlMap.builder()
                .setOption(SignpostOptions.SUBDOMAIN_MATCHING, true)
                .setOption(SignpostOptions.DEFAULT_SUBDOMAIN, "www")
                .addRule(Rule.builder("/").endpoint("index").build())
                .addRule(new Subdomain("<user>",
                        Rule.builder("/").endpoint("user.home").build(),
                        Rule.builder("/about").endpoint("user.about").build()))
                .build();
    }

    @Test
    public void testHostMatching() {
        final UrlMap map = createHostMap();
        final MatchResult.Matched index = map.bind("example.com").match("/").getOrThrow();
        Assert.assertEquals("index", index.getEndpoint());

        final MatchResult.Matched user = map.bind("bob.example.org").match("/").getOrThrow();
        Assert.assertEquals("user", user.getEndpoint());
        Assert.assertEquals(Map.of("user", "bob"), user.getValues());

        final MatchResult.Matched files = map.bind("static.example.org").match("/files/a.css").getOrThrow();
        Assert.assertEquals("files", files.getEndpoint());

        Assert.assertEquals(MatchResult.Type.NOT_FOUND, map.bind("example.net").match("/").getType());
    }

    @Test
    public void testHostBuilding() {
        final UrlMapAdapter adapter = createHostMap().bind("example.com");
        Assert.assertEquals("/", adapter.build("index"));
        Assert.assertEquals("http://bob.example.org/", adapter.build("user", Map.of("user", "bob")));
        Assert.assertEquals("http://static.example.org/files/a.css", adapter.build("files", Map.of("file", "a.css")));
        Assert.assertEquals("http://example.com/", adapter.build("index", Map.of(), true));

        final UrlMapAdapter other = createHostMap().bind("bob.example.org");
        Assert.assertEquals("/", other.build("user", Map.of("user", "bob")));
        Assert.assertEquals("http://alice.example.org/", other.build("user", Map.of("user", "alice")));
    }

    @Test
    public void testHostRedirect() {
        final UrlMapAdapter adapter = createHostMap().bind("static.example.org");
        final MatchResult result = adapter.match("/files//a.css");
        Assert.assertEquals(MatchResult.Type.REDIRECT, result.getType());
        Assert.assertEquals("http://static.example.org/files/a.css", ((MatchResult.Redirect) result).getNewUrl());
    }

    @Test
    public void testSubdomainMatching() {
        final UrlMap map = createSubdomainMap();
        Assert.assertEquals("index", map.bind("example.com").match("/").getOrThrow().getEndpoint());

        final UrlMapAdapter alice = map.bind("example.com", null, "alice", null, null, null, null);
        final MatchResult.Matched home = alice.match("/").getOrThrow();
        Assert.assertEquals("user.home", home.getEndpoint());
        Assert.assertEquals(Map.of("user", "alice"), home.getValues());
        Assert.assertEquals("user.about", alice.match("/about").getOrThrow().getEndpoint());
        final MatchResult.Matched www = map.bind("example.com").match("/about").getOrThrow();
        Assert.assertEquals("user.about", www.getEndpoint());
        Assert.assertEquals(Map.of("user", "www"), www.getValues());
    }

    @Test
    public void testStaticSubdomainNotFound() {
        final UrlMap map = UrlMap.builder()
                .setOption(SignpostOptions.SUBDOMAIN_MATCHING, true)
                .setOption(SignpostOptions.DEFAULT_SUBDOMAIN, "www")
                .addRule(Rule.builder("/").endpoint("index").build())
                .addRule(new Subdomain("api", Rule.builder("/about").endpoint("api.about").build()))
                .build();
        Assert.assertEquals(MatchResult.Type.NOT_FOUND, map.bind("example.com").match("/about").getType());
        final UrlMapAdapter api = map.bind("example.com", null, "api", null, null, null, null);
        Assert.assertEquals("api.about", api.match("/about").getOrThrow().getEndpoint());
    }

    @Test
    public void testSubdomainBuilding() {
        final UrlMap map = createSubdomainMap();
        final UrlMapAdapter www = map.bind("example.com");
        Assert.assertEquals("/", www.build("index"));
        Assert.assertEquals("http://bob.example.com/about", www.build("user.about", Map.of("user", "bob")));

        final UrlMapAdapter alice = map.bind("example.com", null, "alice", null, null, null, null);
        Assert.assertEquals("/about", alice.build("user.about", Map.of("user", "alice")));
        Assert.assertEquals("http://www.example.com/", alice.build("index"));
        Assert.assertEquals("http://alice.example.com/about", alice.build("user.about", Map.of("user", "alice"), true));
    }

    @Test
    public void testRedirectKeepsSubdomain() {
        final UrlMapAdapter alice = createSubdomainMap().bind("example.com", null, "alice", null, null, null, null);
        final MatchResult result = alice.match("/about/");
        Assert.assertEquals(MatchResult.Type.REDIRECT, result.getType());
        Assert.assertEquals("http://alice.example.com/about", ((MatchResult.Redirect) result).getNewUrl());
    }

    @Test
    public void testBindToHost() {
        final UrlMap map = createSubdomainMap();
        Assert.assertEquals("alice", map.bindToHost("alice.example.com", "example.com").getSubdomain());
        Assert.assertEquals("alice", map.bindToHost("Alice.Example.com:80", "example.com").getSubdomain());
        Assert.assertEquals("a.b", map.bindToHost("a.b.example.com", "example.com").getSubdomain());
        Assert.assertEquals("", map.bindToHost("example.com", "example.com").getSubdomain());
        Assert.assertEquals("", map.bindToHost("example.com:8080", null).getSubdomain());

        final UrlMapAdapter secure = map.bindToHost("alice.example.com:443", "example.com:443", null, "https", null, null, null);
        Assert.assertEquals("alice", secure.getSubdomain());
        Assert.assertEquals("example.com", secure.getServerName());
        Assert.assertEquals("user.home", secure.match("/").getOrThrow().getEndpoint());

        final UrlMapAdapter keepsPort = map.bindToHost("alice.example.com:8443", "example.com:8443", null, "https", null, null, null);
        Assert.assertEquals("alice", keepsPort.getSubdomain());
        Assert.assertEquals("example.com:8443", keepsPort.getServerName());
    }

    @Test
    public void testBindToMismatchedHost() {
        final UrlMap map = createSubdomainMap();
        Assert.assertEquals("<invalid>", map.bindToHost("10.0.0.1", "example.com").getSubdomain());
        Assert.assertEquals("<invalid>", map.bindToHost("example.com", "www.example.com").getSubdomain());
        Assert.assertEquals("<invalid>", map.bindToHost("alice.example.net", "example.com").getSubdomain());
    }

    @Test
    public void testBindToHostWithHostMatching() {
        final UrlMapAdapter adapter = createHostMap().bindToHost("bob.example.org", null);
        Assert.assertEquals("", adapter.getSubdomain());
        Assert.assertEquals("bob.example.org", adapter.getServerName());
        Assert.assertEquals("user", adapter.match("/").getOrThrow().getEndpoint());
    }

    @Test
    public void testInvalidConfiguration() {
        Assert.assertThrows(IllegalArgumentException.class, () -> UrlMap.builder()
                .setOption(SignpostOptions.HOST_MATCHING, true)
                .setOption(SignpostOptions.SUBDOMAIN_MATCHING, true)
                .build());
        Assert.assertThrows(IllegalArgumentException.class,
                () -> createHostMap().bind("example.com", null, "www", null, null, null, null));
        Assert.assertThrows(RuleSyntaxException.class, () -> UrlMap.builder()
                .addRule(Rule.builder("/").endpoint("index").subdomain("www").build())
                .build());
        Assert.assertThrows(RuleSyntaxException.class, () -> UrlMap.builder()
                .addRule(Rule.builder("/").endpoint("index").host("example.com").build())
                .build());
        Assert.assertThrows(RuleSyntaxException.class, () -> UrlMap.builder()
                .setOption(SignpostOptions.HOST_MATCHING, true)
                .addRule(Rule.builder("/").endpoint("index").host("a/b").build())
                .build());
    }
}
