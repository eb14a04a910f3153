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

import io.signpost.SignpostMessages;

import java.nio.ByteBuffer;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;

/**
 * Utilities for percent encoding and normalizing URL paths.
 */
public class URLUtils {

    /**
     * Characters allowed unencoded in a path segment besides the unreserved ones, RFC 3986 {@code pchar}.
     */
    public static final String PATH_SAFE = "!$&'()*+,/:;=@";

    private static final char PATH_SEPARATOR = '/';
    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private URLUtils() {

    }

    public static Charset charset(final String name) {
        try {
            return Charset.forName(name);
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            throw SignpostMessages.MESSAGES.unsupportedCharset(name);
        }
    }

    private static boolean isUnreserved(final char c) {
        return (c >= 'a' && c <= 'z')
                || (c >= 'A' && c <= 'Z')
                || (c >= '0' && c <= '9')
                || c == '-' || c == '.' || c == '_' || c == '~';
    }

    /**
     * Percent encodes a string. Unreserved characters and the characters in {@code safe} are left as they are.
     *
     * @param s       The string to encode
     * @param charset The charset used to turn characters into bytes
     * @param safe    Additional characters that should not be encoded
     * @return The encoded string
     */
    public static String quote(final String s, final Charset charset, final String safe) {
        int i = 0;
        final int len = s.length();
        while (i < len) {
            final char c = s.charAt(i);
            if (!isUnreserved(c) && safe.indexOf(c) == -1) {
                break;
            }
            ++i;
        }
        if (i == len) {
            return s;
        }

        final StringBuilder sb = new StringBuilder(len + 16);
        sb.append(s, 0, i);
        while (i < len) {
            final char c = s.charAt(i);
            if (c < 0x80 && (isUnreserved(c) || safe.indexOf(c) != -1)) {
                sb.append(c);
                ++i;
                continue;
            }
            int end = i + 1;
            while (end < len) {
                final char n = s.charAt(end);
                if (n < 0x80 && (isUnreserved(n) || safe.indexOf(n) != -1)) {
                    break;
                }
                ++end;
            }
            final ByteBuffer bytes = charset.encode(s.substring(i, end));
            while (bytes.hasRemaining()) {
                final int b = bytes.get() & 0xFF;
                sb.append('%');
                sb.append(HEX[b >> 4]);
                sb.append(HEX[b & 0xF]);
            }
            i = end;
        }
        return sb.toString();
    }

    /**
     * Collapses every run of '/' characters into a single '/'.
     *
     * @param path the path to normalize
     * @return the path with merged slashes, or the same instance if there was nothing to merge
     */
    public static String mergeSlashes(final String path) {
        if (path.indexOf("//") == -1) {
            return path;
        }
        final StringBuilder builder = new StringBuilder(path.length());
        char last = 0;
        for (int i = 0; i < path.length(); ++i) {
            final char c = path.charAt(i);
            if (c == PATH_SEPARATOR && last == PATH_SEPARATOR) {
                continue;
            }
            builder.append(c);
            last = c;
        }
        return builder.toString();
    }

    /**
     * Replaces any number of leading '/' characters with exactly one. An empty path stays empty.
     *
     * @param path the path
     * @return the normalized path
     */
    public static String singleLeadingSlash(final String path) {
        if (path == null || path.isEmpty()) {
            return "";
        }
        int i = 0;
        while (i < path.length() && path.charAt(i) == PATH_SEPARATOR) {
            ++i;
        }
        if (i == 1) {
            return path;
        }
        return PATH_SEPARATOR + path.substring(i);
    }

    /**
     * Joins a script name and a path with exactly one '/' between them.
     *
     * @param scriptName the script name, for example {@code /app/}
     * @param path       the path, for example {@code /foo}
     * @return the joined path, always starting with '/'
     */
    public static String joinPath(final String scriptName, final String path) {
        int end = scriptName.length();
        while (end > 0 && scriptName.charAt(end - 1) == PATH_SEPARATOR) {
            --end;
        }
        int start = 0;
        while (start < path.length() && path.charAt(start) == PATH_SEPARATOR) {
            ++start;
        }
        final StringBuilder sb = new StringBuilder(end + path.length() + 2);
        if (end > 0 && scriptName.charAt(0) != PATH_SEPARATOR) {
            sb.append(PATH_SEPARATOR);
        }
        sb.append(scriptName, 0, end);
        sb.append(PATH_SEPARATOR);
        sb.append(path, start, path.length());
        return sb.toString();
    }
}
