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

package io.signpost;

import org.xnio.Option;

/**
 * Configuration options for {@link io.signpost.routing.UrlMap}. Options are collected in an {@link org.xnio.OptionMap}
 * through {@link io.signpost.routing.UrlMap.Builder#setOption(Option, Object)}.
 */
public class SignpostOptions {

    /**
     * If a rule ending with a slash should redirect requests that lack the slash, and a rule not ending with a slash
     * should redirect requests that carry one. Rules can override this. Defaults to true.
     */
    public static final Option<Boolean> STRICT_SLASHES = Option.simple(SignpostOptions.class, "STRICT_SLASHES", Boolean.class);

    public static final boolean DEFAULT_STRICT_SLASHES = true;

    /**
     * If runs of slashes in a requested path should be collapsed and the request redirected to the collapsed URL. Rules
     * can override this. Defaults to true.
     */
    public static final Option<Boolean> MERGE_SLASHES = Option.simple(SignpostOptions.class, "MERGE_SLASHES", Boolean.class);

    public static final boolean DEFAULT_MERGE_SLASHES = true;

    /**
     * If a request for a URL that is reachable through a rule with defaults, or through an alias rule, should be
     * redirected to the canonical URL. Defaults to true.
     */
    public static final Option<Boolean> REDIRECT_DEFAULTS = Option.simple(SignpostOptions.class, "REDIRECT_DEFAULTS", Boolean.class);

    public static final boolean DEFAULT_REDIRECT_DEFAULTS = true;

    /**
     * Match rules against the full host rather than the subdomain. Mutually exclusive with {@link #SUBDOMAIN_MATCHING}.
     */
    public static final Option<Boolean> HOST_MATCHING = Option.simple(SignpostOptions.class, "HOST_MATCHING", Boolean.class);

    /**
     * Match rules against the subdomain of the bound server name. Mutually exclusive with {@link #HOST_MATCHING}.
     */
    public static final Option<Boolean> SUBDOMAIN_MATCHING = Option.simple(SignpostOptions.class, "SUBDOMAIN_MATCHING", Boolean.class);

    /**
     * The subdomain used by rules that do not name one, and by adapters bound without one.
     */
    public static final Option<String> DEFAULT_SUBDOMAIN = Option.simple(SignpostOptions.class, "DEFAULT_SUBDOMAIN", String.class);

    /**
     * If query parameters appended to built URLs should be sorted.
     */
    public static final Option<Boolean> SORT_PARAMETERS = Option.simple(SignpostOptions.class, "SORT_PARAMETERS", Boolean.class);

    /**
     * The charset used to percent encode built URLs.
     */
    public static final Option<String> URL_CHARSET = Option.simple(SignpostOptions.class, "URL_CHARSET", String.class);

    public static final String DEFAULT_URL_CHARSET = "UTF-8";

    private SignpostOptions() {

    }
}
