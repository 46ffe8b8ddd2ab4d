/*
 * Copyright 2025 AxonOps
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.axonops.libnfa.api;

import java.util.Collection;
import java.util.List;

/**
 * Main entry point for libnfa regex operations.
 *
 * <p>Every method compiles through the global cache, so repeated calls with the same pattern
 * compile it once.
 *
 * Thread-safe: All methods can be called concurrently from multiple threads.
 *
 * @since 1.0.0
 */
public final class Regex {

    private Regex() {
        // Utility class
    }

    public static Pattern compile(String pattern) {
        return Pattern.compile(pattern);
    }

    // ========== String Matching Operations ==========

    /**
     * Tests if the entire input matches the pattern (full match).
     *
     * @param pattern regex pattern
     * @param input input string
     * @return true if entire input matches, false otherwise
     */
    public static boolean matches(String pattern, CharSequence input) {
        return compile(pattern).matches(input);
    }

    /**
     * Tests if some substring of the input matches the pattern.
     *
     * @param pattern regex pattern
     * @param input input string
     * @return true if a match is found anywhere in the input
     */
    public static boolean find(String pattern, CharSequence input) {
        return compile(pattern).find(input);
    }

    // ========== Bulk Operations ==========

    /**
     * Tests multiple inputs against pattern (bulk full match).
     *
     * @return boolean array (parallel to inputs)
     */
    public static boolean[] matchAll(String pattern, String[] inputs) {
        return compile(pattern).matchAll(inputs);
    }

    /**
     * Tests multiple inputs against pattern (bulk full match).
     *
     * @return boolean array (parallel to inputs)
     */
    public static boolean[] matchAll(String pattern, Collection<String> inputs) {
        return compile(pattern).matchAll(inputs);
    }

    /** Returns the inputs that fully match the pattern. */
    public static List<String> filter(String pattern, Collection<String> inputs) {
        return compile(pattern).filter(inputs);
    }

    /** Returns the inputs that do not fully match the pattern. */
    public static List<String> filterNot(String pattern, Collection<String> inputs) {
        return compile(pattern).filterNot(inputs);
    }

    /**
     * Escapes metacharacters so the result matches {@code text} literally.
     *
     * @see Pattern#quote(String)
     */
    public static String quote(String text) {
        return Pattern.quote(text);
    }
}
