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

import com.axonops.libnfa.cache.CacheStatistics;
import com.axonops.libnfa.cache.PatternCache;
import com.axonops.libnfa.cache.RegexConfig;
import com.axonops.libnfa.metrics.MetricNames;
import com.axonops.libnfa.metrics.RegexMetricsRegistry;
import com.axonops.libnfa.nfa.Automaton;
import com.axonops.libnfa.nfa.Optimizer;
import com.axonops.libnfa.regex.RegexCompiler;
import com.axonops.libnfa.util.PatternHasher;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A compiled regular expression.
 *
 * <p>Thread-Safe: the automaton is read-only after compilation, so one pattern may be matched
 * from any number of threads. Each {@link Matcher} is confined to one thread.
 *
 * <pre>{@code
 * Pattern digits = Pattern.compile("\\d{3}-\\d{4}");
 * digits.matches("555-1234");     // true, whole string
 * digits.find("call 555-1234");   // true, substring
 * }</pre>
 *
 * @since 1.0.0
 */
public final class Pattern {
    private static final Logger logger = LoggerFactory.getLogger(Pattern.class);

    private static final String META_CHARACTERS = "\\.^$|?*+()[]{}";

    // Global pattern cache (mutable for testing only)
    private static volatile PatternCache cache = new PatternCache(RegexConfig.DEFAULT);

    private final String patternString;
    private final Automaton automaton;
    private final int statesRemoved;

    Pattern(String patternString, Automaton automaton, int statesRemoved) {
        this.patternString = Objects.requireNonNull(patternString);
        this.automaton = Objects.requireNonNull(automaton);
        this.statesRemoved = statesRemoved;
    }

    /**
     * Compiles a pattern, returning the cached instance if one exists.
     *
     * @param pattern regex pattern
     * @return compiled pattern
     * @throws PatternCompilationException if the pattern is malformed
     */
    public static Pattern compile(String pattern) {
        Objects.requireNonNull(pattern, "pattern cannot be null");
        return cache.getOrCompile(pattern, () -> doCompile(pattern));
    }

    /**
     * Compiles a pattern without consulting or populating the cache.
     *
     * @param pattern regex pattern
     * @return a new compiled pattern
     * @throws PatternCompilationException if the pattern is malformed
     */
    public static Pattern compileWithoutCache(String pattern) {
        Objects.requireNonNull(pattern, "pattern cannot be null");
        return doCompile(pattern);
    }

    private static Pattern doCompile(String pattern) {
        RegexConfig config = cache.getConfig();
        RegexMetricsRegistry metrics = config.metricsRegistry();
        String hash = PatternHasher.hash(pattern);

        long startNanos = System.nanoTime();
        Automaton automaton;
        try {
            automaton = RegexCompiler.compile(pattern);
        } catch (PatternCompilationException e) {
            metrics.incrementCounter(MetricNames.ERRORS_COMPILATION_FAILED);
            logger.debug("NFA: Pattern compilation failed - hash: {}, error: {}", hash, e.getMessage());
            throw e;
        }

        int removed = 0;
        if (config.optimizeAutomata()) {
            removed = new Optimizer(automaton).optimize();
            metrics.incrementCounter(MetricNames.PATTERNS_OPTIMIZER_STATES_REMOVED, removed);
        }

        long durationNanos = System.nanoTime() - startNanos;
        metrics.recordTimer(MetricNames.PATTERNS_COMPILATION_LATENCY, durationNanos);
        metrics.incrementCounter(MetricNames.PATTERNS_COMPILED);

        logger.trace("NFA: Pattern compiled - hash: {}, length: {}, states: {}, removed: {}, timeNs: {}",
            hash, pattern.length(), automaton.size(), removed, durationNanos);
        return new Pattern(pattern, automaton, removed);
    }

    /**
     * Creates a matcher over the input. The matcher is not thread-safe.
     */
    public Matcher matcher(CharSequence input) {
        return new Matcher(this, input);
    }

    /**
     * Tests whether the entire input matches.
     *
     * @throws MatchBudgetExceededException if the configured step budget runs out
     */
    public boolean matches(CharSequence input) {
        return matcher(input).matches();
    }

    /**
     * Tests whether some substring of the input matches.
     *
     * @throws MatchBudgetExceededException if the configured step budget runs out
     */
    public boolean find(CharSequence input) {
        return matcher(input).find();
    }

    // ========== Bulk Matching Operations ==========

    /**
     * Matches every input against this pattern.
     *
     * <pre>{@code
     * Pattern phone = Pattern.compile("\\d{3}-\\d{4}");
     * boolean[] results = phone.matchAll(new String[] {"123-4567", "invalid", "999-8888"});
     * // results = [true, false, true]
     * }</pre>
     *
     * @param inputs strings to match
     * @return results parallel to inputs
     * @throws NullPointerException if inputs is null
     */
    public boolean[] matchAll(String[] inputs) {
        Objects.requireNonNull(inputs, "inputs cannot be null");
        if (inputs.length == 0) {
            return new boolean[0];
        }

        boolean[] results = new boolean[inputs.length];
        Matcher matcher = new Matcher(this, "");
        long steps = 0;

        long startNanos = System.nanoTime();
        for (int i = 0; i < inputs.length; i++) {
            matcher.reset(Objects.requireNonNull(inputs[i], "inputs cannot contain null"));
            results[i] = matcher.runFullMatch();
            steps += matcher.steps();
        }
        long durationNanos = System.nanoTime() - startNanos;

        RegexMetricsRegistry metrics = cache.getConfig().metricsRegistry();
        long perItemNanos = durationNanos / inputs.length;
        metrics.incrementCounter(MetricNames.MATCHING_OPERATIONS, inputs.length);
        metrics.recordTimer(MetricNames.MATCHING_LATENCY, perItemNanos);
        metrics.recordTimer(MetricNames.MATCHING_FULL_MATCH_LATENCY, perItemNanos);
        metrics.incrementCounter(MetricNames.MATCHING_BULK_OPERATIONS);
        metrics.incrementCounter(MetricNames.MATCHING_BULK_ITEMS, inputs.length);
        metrics.incrementCounter(MetricNames.MATCHING_STEPS, steps);

        return results;
    }

    /**
     * Collection variant of {@link #matchAll(String[])}.
     *
     * @param inputs strings to match
     * @return results in iteration order of inputs
     */
    public boolean[] matchAll(Collection<String> inputs) {
        Objects.requireNonNull(inputs, "inputs cannot be null");
        return matchAll(toArray(inputs));
    }

    /**
     * Returns the inputs that match, in input order. The collection is not modified.
     *
     * <pre>{@code
     * Pattern keys = Pattern.compile("prod_\\w+");
     * keys.filter(List.of("test_key1", "prod_key1")); // ["prod_key1"]
     * }</pre>
     */
    public List<String> filter(Collection<String> inputs) {
        return select(inputs, true);
    }

    /**
     * Returns the inputs that do not match, in input order. Inverse of {@link #filter}.
     */
    public List<String> filterNot(Collection<String> inputs) {
        return select(inputs, false);
    }

    private List<String> select(Collection<String> inputs, boolean keepMatches) {
        Objects.requireNonNull(inputs, "inputs cannot be null");
        List<String> result = new ArrayList<>();
        if (inputs.isEmpty()) {
            return result;
        }

        String[] array = toArray(inputs);
        boolean[] matches = matchAll(array);
        for (int i = 0; i < array.length; i++) {
            if (matches[i] == keepMatches) {
                result.add(array[i]);
            }
        }
        return result;
    }

    private static String[] toArray(Collection<String> inputs) {
        try {
            return inputs.toArray(new String[0]);
        } catch (ArrayStoreException e) {
            throw new IllegalArgumentException(
                "Collection contains non-String elements. Use stream().map(Object::toString).toList() to convert.", e);
        }
    }

    /**
     * Escapes every metacharacter so the result matches {@code text} literally.
     *
     * @param text literal text
     * @return pattern matching exactly {@code text}
     */
    public static String quote(String text) {
        Objects.requireNonNull(text, "text cannot be null");
        StringBuilder quoted = new StringBuilder(text.length() * 2);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (META_CHARACTERS.indexOf(c) >= 0) {
                quoted.append('\\');
            }
            quoted.append(c);
        }
        return quoted.toString();
    }

    public String pattern() {
        return patternString;
    }

    /**
     * The compiled automaton. Shared by every user of this pattern; it must not be modified.
     */
    public Automaton automaton() {
        return automaton;
    }

    public int stateCount() {
        return automaton.size();
    }

    /** States removed by the optimizer when this pattern was compiled. */
    public int statesRemoved() {
        return statesRemoved;
    }

    @Override
    public String toString() {
        return "Pattern[" + PatternHasher.hashWithSize(patternString, automaton.size()) + "]";
    }

    // ========== Global Cache ==========

    /**
     * Gets the global pattern cache.
     */
    public static PatternCache getGlobalCache() {
        return cache;
    }

    /**
     * Gets cache statistics (for monitoring).
     */
    public static CacheStatistics getCacheStatistics() {
        return cache.getStatistics();
    }

    /**
     * Clears the pattern cache.
     */
    public static void clearCache() {
        cache.clear();
    }

    /**
     * Clears the cache and its statistics (for testing).
     */
    public static void resetCache() {
        cache.reset();
    }

    /**
     * Reconfigures the global cache. All cached patterns are discarded.
     *
     * @param config the new configuration
     */
    public static void configureCache(RegexConfig config) {
        cache.reconfigure(config);
    }

    /**
     * Replaces the global cache (for testing, or to install a cache with metrics).
     *
     * @param newCache the new cache to use globally
     */
    public static void setGlobalCache(PatternCache newCache) {
        cache = Objects.requireNonNull(newCache, "newCache cannot be null");
    }

    /**
     * Gets the current cache configuration.
     */
    public static RegexConfig getCacheConfig() {
        return cache.getConfig();
    }
}
