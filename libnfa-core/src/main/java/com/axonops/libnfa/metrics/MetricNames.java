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

package com.axonops.libnfa.metrics;

/**
 * Metric name constants for libnfa instrumentation.
 *
 * <h2>Pattern Cache</h2>
 *
 * <p>{@link com.axonops.libnfa.api.Pattern#compile(String)} looks the pattern up in the global
 * {@link com.axonops.libnfa.cache.PatternCache}:
 *
 * <ol>
 *   <li><b>Cache Hit</b> - compiled automaton returned immediately
 *   <li><b>Cache Miss</b> - pattern parsed, reduced to an automaton, optimized and stored
 * </ol>
 *
 * <p>When the cache grows past {@code maxCacheSize} the least recently used entries are evicted,
 * except entries used within {@code evictionProtectionMs}.
 *
 * <h2>Matching</h2>
 *
 * <p>Each match attempt walks the automaton one visit at a time. The number of visits is counted
 * in {@link #MATCHING_STEPS}; attempts that run out of the configured step budget are counted in
 * {@link #ERRORS_MATCH_BUDGET_EXCEEDED}.
 *
 * <h2>Metric Types</h2>
 *
 * <ul>
 *   <li><b>Counter</b> - monotonically increasing count (suffix: {@code .total.count})
 *   <li><b>Timer</b> - latency histogram with percentiles (suffix: {@code .latency})
 *   <li><b>Gauge</b> - current value (suffix: {@code .current.*})
 * </ul>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * MetricRegistry registry = new MetricRegistry();
 * RegexConfig config = RegexMetricsConfig.withMetrics(registry, "myapp.nfa", true);
 * Pattern.setGlobalCache(new PatternCache(config));
 *
 * Pattern.compile("[a-z]+@[a-z]+\\.com").matches("user@example.com");
 *
 * Counter compilations = registry.counter(
 *     MetricRegistry.name("myapp.nfa", MetricNames.PATTERNS_COMPILED));
 * }</pre>
 *
 * @since 1.0.0
 * @see com.axonops.libnfa.cache.PatternCache
 * @see com.axonops.libnfa.api.Pattern
 */
public final class MetricNames {
  private MetricNames() {}

  // ========================================
  // Pattern Compilation Metrics
  // ========================================

  /**
   * Total patterns compiled.
   *
   * <p><b>Type:</b> Counter
   *
   * <p><b>Incremented:</b> Each time a pattern is compiled, cached or not
   */
  public static final String PATTERNS_COMPILED = "patterns.compiled.total.count";

  /**
   * Total cache hits.
   *
   * <p><b>Type:</b> Counter
   *
   * <p><b>Interpretation:</b> hits / (hits + misses) is the cache hit rate
   */
  public static final String PATTERNS_CACHE_HITS = "patterns.cache.hits.total.count";

  /**
   * Total cache misses (pattern had to be compiled).
   *
   * <p><b>Type:</b> Counter
   */
  public static final String PATTERNS_CACHE_MISSES = "patterns.cache.misses.total.count";

  /**
   * Pattern compilation latency, parse through optimization.
   *
   * <p><b>Type:</b> Timer (nanoseconds)
   */
  public static final String PATTERNS_COMPILATION_LATENCY = "patterns.compilation.latency";

  /**
   * Epsilon states removed by the optimizer.
   *
   * <p><b>Type:</b> Counter
   *
   * <p><b>Incremented:</b> By the number of states each optimized compilation removed
   */
  public static final String PATTERNS_OPTIMIZER_STATES_REMOVED =
      "patterns.optimizer.states_removed.total.count";

  // ========================================
  // Cache Metrics
  // ========================================

  /**
   * Current number of patterns in cache.
   *
   * <p><b>Type:</b> Gauge (count)
   *
   * <p><b>Interpretation:</b> Should stay at or below maxCacheSize
   */
  public static final String CACHE_PATTERNS_COUNT = "cache.patterns.current.count";

  /**
   * Patterns evicted because the cache outgrew maxCacheSize.
   *
   * <p><b>Type:</b> Counter
   *
   * <p><b>Interpretation:</b> High values indicate the working set exceeds the cache
   */
  public static final String CACHE_EVICTIONS_LRU = "cache.evictions.lru.total.count";

  // ========================================
  // Matching Metrics
  // ========================================

  /**
   * Total match operations (matches, find, and each item of bulk operations).
   *
   * <p><b>Type:</b> Counter
   */
  public static final String MATCHING_OPERATIONS = "matching.operations.total.count";

  /**
   * Latency of all match operations.
   *
   * <p><b>Type:</b> Timer (nanoseconds)
   */
  public static final String MATCHING_LATENCY = "matching.latency";

  /**
   * Latency of whole-string matches.
   *
   * <p><b>Type:</b> Timer (nanoseconds)
   */
  public static final String MATCHING_FULL_MATCH_LATENCY = "matching.full_match.latency";

  /**
   * Latency of substring searches ({@code find}).
   *
   * <p><b>Type:</b> Timer (nanoseconds)
   */
  public static final String MATCHING_PARTIAL_MATCH_LATENCY = "matching.partial_match.latency";

  /**
   * Bulk operations ({@code matchAll}, {@code filter}, {@code filterNot}).
   *
   * <p><b>Type:</b> Counter
   */
  public static final String MATCHING_BULK_OPERATIONS = "matching.bulk.operations.total.count";

  /**
   * Items processed by bulk operations.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String MATCHING_BULK_ITEMS = "matching.bulk.items.total.count";

  /**
   * Executor steps taken by match operations.
   *
   * <p><b>Type:</b> Counter
   *
   * <p><b>Interpretation:</b> Steps per operation approximates matching cost; a sudden rise
   * points at patterns with heavy backtracking over the input
   */
  public static final String MATCHING_STEPS = "matching.steps.total.count";

  // ========================================
  // Error Metrics
  // ========================================

  /**
   * Patterns that failed to compile.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String ERRORS_COMPILATION_FAILED = "errors.compilation.failed.total.count";

  /**
   * Match attempts aborted because they exceeded maxMatchSteps.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String ERRORS_MATCH_BUDGET_EXCEEDED =
      "errors.match_budget.exceeded.total.count";
}
