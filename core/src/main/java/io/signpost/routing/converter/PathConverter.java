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
 * Like the default converter, but it also matches slashes. Useful for wikis and similar applications.
 * <pre>
 * /&lt;path:wikipage&gt;
 * /&lt;path:wikipage&gt;/edit
 * </pre>
 */
public class PathConverter extends AbstractConverter {

    public static final int WEIGHT = 200;

    public PathConverter(final ConverterArguments arguments) {
        super("[^/].*?", WEIGHT, arguments);
        arguments.allowOnly("path");
    }

    @Override
    public boolean isPartIsolating() {
        return false;
    }
}
