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

package com.axonops.libnfa.cache;

import com.axonops.libnfa.metrics.NoOpMetricsRegistry;
import com.axonops.libnfa.metrics.RegexMetricsRegistry;
import java.util.Objects;

/**
 * Configuration for libnfa: pattern caching, automaton optimization, match budgets and metrics.
 *
 * <h2>Pattern Cache</h2>
 *
 * <p>{@link com.axonops.libnfa.api.Pattern#compile(String)} caches compiled automata keyed by
 * pattern text. When the cache grows past {@code maxCacheSize}, least-recently-used entries are
 * evicted synchronously by the thread that inserted the new entry. Entries used within the last
 * {@code evictionProtectionMs} are never evicted, so a pattern cannot disappear between being
 * compiled and being used.
 *
 * <h2>Match Budget</h2>
 *
 * <p>Matching explores the automaton one (state, position) visit at a time. The number of visits
 * is bounded by states &times; input length, but for large automata on long inputs that can still
 * be a lot of work. {@code maxMatchSteps} caps the visits of one match attempt;
 * exceeding it throws {@link com.axonops.libnfa.api.MatchBudgetExceededException}. 0 means
 * unlimited.
 *
 * <h2>Configuration Examples</h2>
 *
 * <pre>{@code
 * // Defaults: 50K cache, optimizer on, no budget, metrics disabled
 * Pattern.setGlobalCache(new PatternCache(RegexConfig.DEFAULT));
 *
 * // Untrusted input: bounded work per match, metrics enabled
 * RegexConfig config = RegexConfig.builder()
 *     .maxCacheSize(10_000)
 *     .maxMatchSteps(1_000_000)
 *     .metricsRegistry(new DropwizardMetricsAdapter(registry, "myapp.nfa"))
 *     .build();
 * }</pre>
 *
 * @param cacheEnabled cache compiled patterns
 * @param maxCacheSize maximum cached patterns before LRU eviction (must be > 0 if cache enabled)
 * @param evictionProtectionMs entries used within this many milliseconds are not evicted
 * @param optimizeAutomata run epsilon elision on every compiled automaton
 * @param maxMatchSteps step budget per match attempt, 0 for unlimited
 * @param metricsRegistry metrics implementation
 * @since 1.0.0
 * @see com.axonops.libnfa.cache.PatternCache
 * @see com.axonops.libnfa.metrics.MetricNames
 */
public record RegexConfig(
    boolean cacheEnabled,
    int maxCacheSize,
    long evictionProtectionMs,
    boolean optimizeAutomata,
    long maxMatchSteps,
    RegexMetricsRegistry metricsRegistry) {

  /** Default configuration: 50K cache, 1 second eviction protection, optimizer on, no budget. */
  public static final RegexConfig DEFAULT =
      new RegexConfig(
          true, // Cache enabled
          50000, // Max 50K cached patterns
          1000, // 1 second eviction protection
          true, // Optimize automata
          0, // Unlimited match steps
          NoOpMetricsRegistry.INSTANCE // Metrics disabled
          );

  /** Configuration with caching disabled. Every compile builds a new automaton. */
  public static final RegexConfig NO_CACHE =
      new RegexConfig(
          false, // Cache disabled
          0, // Ignored when cache disabled
          0, // Ignored when cache disabled
          true, // Still optimize
          0, // Unlimited match steps
          NoOpMetricsRegistry.INSTANCE // Metrics disabled
          );

  /** Compact constructor with validation. */
  public RegexConfig {
    Objects.requireNonNull(metricsRegistry, "metricsRegistry cannot be null");
    if (maxMatchSteps < 0) {
      throw new IllegalArgumentException("maxMatchSteps must be non-negative (0 = unlimited)");
    }

    if (cacheEnabled) {
      if (maxCacheSize <= 0) {
        throw new IllegalArgumentException("maxCacheSize must be positive when cache enabled");
      }
      if (evictionProtectionMs < 0) {
        throw new IllegalArgumentException(
            "evictionProtectionMs must be non-negative when cache enabled");
      }
    }
  }

  /** True if match attempts are step-limited. */
  public boolean hasMatchBudget() {
    return maxMatchSteps > 0;
  }

  /**
   * Creates a builder starting from {@link #DEFAULT}.
   *
   * @return new builder with default values
   */
  public static Builder builder() {
    return new Builder();
  }

  /** Builder for custom configuration. All fields start with the values of {@link #DEFAULT}. */
  public static class Builder {
    private boolean cacheEnabled = true;
    private int maxCacheSize = 50000;
    private long evictionProtectionMs = 1000;
    private boolean optimizeAutomata = true;
    private long maxMatchSteps = 0;
    private RegexMetricsRegistry metricsRegistry = NoOpMetricsRegistry.INSTANCE;

    /**
     * Enable or disable pattern caching.
     *
     * @param enabled true to enable caching (default)
     * @return this builder
     */
    public Builder cacheEnabled(boolean enabled) {
      this.cacheEnabled = enabled;
      return this;
    }

    /**
     * Set maximum number of patterns in cache before LRU eviction.
     *
     * <p><b>Default: 50,000</b>
     *
     * @param size maximum cached patterns (must be > 0)
     * @return this builder
     */
    public Builder maxCacheSize(int size) {
      this.maxCacheSize = size;
      return this;
    }

    /**
     * Set the period during which a recently used entry is protected from eviction.
     *
     * <p><b>Default: 1000ms</b>. Set to 0 to evict purely by recency.
     *
     * @param ms protection period in milliseconds (must be ≥ 0)
     * @return this builder
     */
    public Builder evictionProtectionMs(long ms) {
      this.evictionProtectionMs = ms;
      return this;
    }

    /**
     * Enable or disable epsilon elision on compiled automata.
     *
     * <p><b>Default: enabled</b>. Disabling only helps when inspecting the raw builder output.
     *
     * @param optimize true to optimize (default)
     * @return this builder
     */
    public Builder optimizeAutomata(boolean optimize) {
      this.optimizeAutomata = optimize;
      return this;
    }

    /**
     * Set the step budget for a single match attempt.
     *
     * @param steps maximum executor steps, 0 for unlimited (default)
     * @return this builder
     */
    public Builder maxMatchSteps(long steps) {
      this.maxMatchSteps = steps;
      return this;
    }

    /**
     * Set metrics registry for instrumentation.
     *
     * <p><b>Default: {@link NoOpMetricsRegistry}</b>
     *
     * @param metricsRegistry metrics implementation (must not be null)
     * @return this builder
     * @throws NullPointerException if metricsRegistry is null
     */
    public Builder metricsRegistry(RegexMetricsRegistry metricsRegistry) {
      this.metricsRegistry =
          Objects.requireNonNull(metricsRegistry, "metricsRegistry cannot be null");
      return this;
    }

    /**
     * Build immutable configuration.
     *
     * @return validated configuration
     * @throws IllegalArgumentException if configuration is invalid
     */
    public RegexConfig build() {
      return new RegexConfig(
          cacheEnabled,
          maxCacheSize,
          evictionProtectionMs,
          optimizeAutomata,
          maxMatchSteps,
          metricsRegistry);
    }
  }
}
