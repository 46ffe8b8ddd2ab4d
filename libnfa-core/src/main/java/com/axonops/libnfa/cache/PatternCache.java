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

import com.axonops.libnfa.api.Pattern;
import com.axonops.libnfa.metrics.MetricNames;
import com.axonops.libnfa.metrics.RegexMetricsRegistry;
import com.axonops.libnfa.util.PatternHasher;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thread-safe cache of compiled patterns keyed by pattern text.
 *
 * <p>Reads are lock-free ({@link ConcurrentHashMap}); each distinct pattern is compiled at most
 * once via {@code computeIfAbsent}. Compiled patterns are immutable and hold no external
 * resources, so an evicted pattern simply becomes garbage once callers drop it.
 *
 * <p>Eviction is synchronous: the thread whose insert pushes the cache past {@code maxCacheSize}
 * evicts the least recently used entries. It samples up to {@value #LRU_SAMPLE_SIZE} entries
 * rather than scanning the whole map, and skips entries used within {@code evictionProtectionMs},
 * so the cache may briefly stay above its limit while every entry is protected.
 *
 * @since 1.0.0
 */
public final class PatternCache {
  private static final Logger logger = LoggerFactory.getLogger(PatternCache.class);

  static final int LRU_SAMPLE_SIZE = 500;

  private volatile RegexConfig config;

  // Null when caching is disabled
  private volatile ConcurrentHashMap<String, CachedPattern> cache;

  private final AtomicLong hits = new AtomicLong(0);
  private final AtomicLong misses = new AtomicLong(0);
  private final AtomicLong evictionsLRU = new AtomicLong(0);
  private final AtomicInteger peakSize = new AtomicInteger(0);

  /**
   * Creates a new pattern cache with the given configuration.
   *
   * @param config the cache configuration
   */
  public PatternCache(RegexConfig config) {
    this.config = Objects.requireNonNull(config, "config cannot be null");
    initialize(config);
  }

  public RegexConfig getConfig() {
    return config;
  }

  /**
   * Returns the cached pattern for {@code patternString}, compiling it on a miss.
   *
   * @param patternString regex pattern
   * @param compiler compiles the pattern on a cache miss
   * @return cached or newly compiled pattern
   */
  public Pattern getOrCompile(String patternString, Supplier<Pattern> compiler) {
    RegexConfig current = config;
    RegexMetricsRegistry metrics = current.metricsRegistry();
    ConcurrentHashMap<String, CachedPattern> map = cache;

    if (!current.cacheEnabled() || map == null) {
      misses.incrementAndGet();
      metrics.incrementCounter(MetricNames.PATTERNS_CACHE_MISSES);
      return compiler.get();
    }

    CachedPattern cached = map.get(patternString);
    if (cached != null) {
      cached.touch();
      hits.incrementAndGet();
      metrics.incrementCounter(MetricNames.PATTERNS_CACHE_HITS);
      logger.trace("NFA: Cache hit - hash: {}", PatternHasher.hash(patternString));
      return cached.pattern();
    }

    misses.incrementAndGet();
    metrics.incrementCounter(MetricNames.PATTERNS_CACHE_MISSES);
    logger.trace("NFA: Cache miss - hash: {}, compiling", PatternHasher.hash(patternString));

    // A failed compile throws out of computeIfAbsent and leaves no entry
    CachedPattern created = map.computeIfAbsent(patternString, k -> new CachedPattern(compiler.get()));

    int currentSize = map.size();
    updatePeakSize(currentSize);
    if (currentSize > current.maxCacheSize()) {
      evictLRUBatch(map, current, currentSize - current.maxCacheSize());
    }

    return created.pattern();
  }

  /**
   * Evicts least-recently-used patterns.
   *
   * <p>Sample-based: considers at most {@value #LRU_SAMPLE_SIZE} unprotected entries and evicts the
   * oldest of them.
   */
  private void evictLRUBatch(
      ConcurrentHashMap<String, CachedPattern> map, RegexConfig current, int toEvict) {
    long cutoffTime = System.nanoTime() - current.evictionProtectionMs() * 1_000_000L;

    List<Map.Entry<String, CachedPattern>> candidates =
        map.entrySet().stream()
            .filter(e -> e.getValue().lastAccessTimeNanos() <= cutoffTime)
            .limit(LRU_SAMPLE_SIZE)
            .sorted(Comparator.comparingLong(e -> e.getValue().lastAccessTimeNanos()))
            .limit(toEvict)
            .collect(Collectors.toList());

    int evicted = 0;
    for (Map.Entry<String, CachedPattern> entry : candidates) {
      if (map.remove(entry.getKey(), entry.getValue())) {
        evictionsLRU.incrementAndGet();
        current.metricsRegistry().incrementCounter(MetricNames.CACHE_EVICTIONS_LRU);
        logger.trace("NFA: LRU evicting pattern - hash: {}", PatternHasher.hash(entry.getKey()));
        evicted++;
      }
    }

    if (evicted > 0) {
      logger.debug(
          "NFA: LRU eviction completed - evicted: {}, cacheSize: {}/{}",
          evicted,
          map.size(),
          current.maxCacheSize());
    }
  }

  /** Returns true if the pattern is currently cached. */
  public boolean contains(String patternString) {
    ConcurrentHashMap<String, CachedPattern> map = cache;
    return map != null && map.containsKey(patternString);
  }

  /** Current number of cached patterns. */
  public int size() {
    ConcurrentHashMap<String, CachedPattern> map = cache;
    return map != null ? map.size() : 0;
  }

  /** Snapshot of the cache counters. */
  public CacheStatistics getStatistics() {
    return new CacheStatistics(
        hits.get(), misses.get(), evictionsLRU.get(), size(), config.maxCacheSize(), peakSize.get());
  }

  /** Removes every cached pattern. Statistics are kept. */
  public void clear() {
    ConcurrentHashMap<String, CachedPattern> map = cache;
    if (map == null) {
      return;
    }
    logger.debug("NFA: Clearing cache - {} cached patterns", map.size());
    map.clear();
  }

  /** Resets cache statistics. */
  public void resetStatistics() {
    hits.set(0);
    misses.set(0);
    evictionsLRU.set(0);
    peakSize.set(size());
    logger.trace("NFA: Cache statistics reset");
  }

  /** Clears the cache and resets statistics. */
  public void reset() {
    clear();
    resetStatistics();
  }

  /**
   * Replaces the configuration, discarding every cached pattern.
   *
   * @param newConfig the new configuration
   */
  public synchronized void reconfigure(RegexConfig newConfig) {
    Objects.requireNonNull(newConfig, "newConfig cannot be null");
    logger.info("NFA: Reconfiguring cache with new settings");

    config.metricsRegistry().removeGauge(MetricNames.CACHE_PATTERNS_COUNT);
    clear();
    resetStatistics();
    this.config = newConfig;
    initialize(newConfig);
  }

  /** Clears the cache and unregisters its gauge. */
  public void shutdown() {
    logger.info("NFA: Shutting down cache");
    config.metricsRegistry().removeGauge(MetricNames.CACHE_PATTERNS_COUNT);
    clear();
  }

  private void initialize(RegexConfig newConfig) {
    if (newConfig.cacheEnabled()) {
      this.cache = new ConcurrentHashMap<>(Math.min(newConfig.maxCacheSize(), 1024));
      newConfig.metricsRegistry().registerGauge(MetricNames.CACHE_PATTERNS_COUNT, this::size);
      logger.info(
          "NFA: Pattern cache initialized - maxSize: {}, evictionProtection: {}ms",
          newConfig.maxCacheSize(),
          newConfig.evictionProtectionMs());
    } else {
      this.cache = null;
      logger.info("NFA: Pattern caching disabled");
    }
  }

  private void updatePeakSize(int current) {
    int peak;
    do {
      peak = peakSize.get();
    } while (current > peak && !peakSize.compareAndSet(peak, current));
  }

  /** Cached pattern with atomic access time tracking. */
  private static class CachedPattern {
    private final Pattern pattern;
    private final AtomicLong lastAccessTimeNanos;

    CachedPattern(Pattern pattern) {
      this.pattern = pattern;
      this.lastAccessTimeNanos = new AtomicLong(System.nanoTime());
    }

    Pattern pattern() {
      return pattern;
    }

    long lastAccessTimeNanos() {
      return lastAccessTimeNanos.get();
    }

    void touch() {
      lastAccessTimeNanos.set(System.nanoTime());
    }
  }
}
