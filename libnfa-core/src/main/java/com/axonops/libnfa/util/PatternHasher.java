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

package com.axonops.libnfa.util;

/**
 * Hashes pattern strings for log lines.
 *
 * <p>Pattern text is never logged: it may contain sensitive literals and long patterns clutter
 * the output. The same pattern always yields the same hash, so log lines for one pattern can
 * still be correlated.
 *
 * @since 1.0.0
 */
public final class PatternHasher {

    private PatternHasher() {
        // Utility class
    }

    /**
     * Returns a compact hex hash of the pattern, based on {@link String#hashCode()}.
     *
     * @param pattern the regex pattern string
     * @return hex string, or {@code "null"} for a null pattern
     */
    public static String hash(String pattern) {
        if (pattern == null) {
            return "null";
        }
        return Integer.toHexString(pattern.hashCode());
    }

    /**
     * Hash plus the compiled automaton's state count, e.g. {@code 7a3f2b1c[42]}.
     */
    public static String hashWithSize(String pattern, int states) {
        return hash(pattern) + "[" + states + "]";
    }
}
