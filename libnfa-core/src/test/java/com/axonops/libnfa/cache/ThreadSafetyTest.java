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

import com.axonops.libnfa.api.Matcher;
import com.axonops.libnfa.api.Pattern;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import static org.assertj.core.api.Assertions.*;

/**
 * Thread safety verification tests.
 */
class ThreadSafetyTest {

    @BeforeEach
    void setUp() {
        Pattern.resetCache();
    }

    @AfterEach
    void tearDown() {
        Pattern.resetCache();
    }

    @Test
    @Timeout(value = 60, unit = TimeUnit.SECONDS)
    void testConcurrentCacheMapAccess_100Threads() throws InterruptedException {
        int threadCount = 100;
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threadCount);
        AtomicInteger errors = new AtomicInteger(0);

        // Pre-populate "existing"
        Pattern.compile("existing");

        for (int i = 0; i < threadCount; i++) {
            int threadId = i;
            new Thread(() -> {
                try {
                    start.await();

                    int op = threadId % 10;
                    if (op < 3) {
                        // 30%: Insert new
                        Pattern.compile("new" + threadId);
                    } else if (op < 7) {
                        // 40%: Get (cache hit)
                        Pattern.compile("existing");
                    } else {
                        // 30%: Statistics snapshot
                        Pattern.getCacheStatistics();
                    }
                } catch (Exception e) {
                    errors.incrementAndGet();
                } finally {
                    done.countDown();
                }
            }).start();
        }

        start.countDown();
        done.await();

        assertThat(errors.get()).isEqualTo(0);

        CacheStatistics stats = Pattern.getCacheStatistics();
        assertThat(stats.hits()).isEqualTo(40);
        assertThat(stats.misses()).isEqualTo(31);
        assertThat(stats.currentSize()).isEqualTo(31);
    }

    @Test
    @Timeout(value = 60, unit = TimeUnit.SECONDS)
    void testSamePatternCompiledOnceUnderContention() throws Exception {
        int threadCount = 50;
        ExecutorService pool = Executors.newFixedThreadPool(threadCount);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Pattern>> futures = new ArrayList<>();

        try {
            for (int i = 0; i < threadCount; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return Pattern.compile("(a|b)*c{2,5}");
                }));
            }
            start.countDown();

            Pattern first = futures.get(0).get();
            for (Future<Pattern> future : futures) {
                assertThat(future.get()).isSameAs(first);
            }
        } finally {
            pool.shutdownNow();
        }
        assertThat(Pattern.getGlobalCache().size()).isEqualTo(1);
    }

    @Test
    @Timeout(value = 60, unit = TimeUnit.SECONDS)
    void testSharedPatternMatchedConcurrently() throws InterruptedException {
        Pattern pattern = Pattern.compile("[\\w.]+@[\\w]+\\.com");
        int threadCount = 20;
        int opsPerThread = 500;
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threadCount);
        AtomicInteger errors = new AtomicInteger(0);

        for (int i = 0; i < threadCount; i++) {
            int threadId = i;
            new Thread(() -> {
                try {
                    start.await();
                    for (int j = 0; j < opsPerThread; j++) {
                        boolean expected = (threadId + j) % 2 == 0;
                        String input = expected ? "user" + j + "@example.com" : "user" + j + "@example";
                        Matcher matcher = pattern.matcher(input);
                        if (matcher.matches() != expected || pattern.find(input) != expected) {
                            errors.incrementAndGet();
                        }
                    }
                } catch (Exception e) {
                    errors.incrementAndGet();
                } finally {
                    done.countDown();
                }
            }).start();
        }

        start.countDown();
        done.await();

        assertThat(errors.get()).isEqualTo(0);
    }

    @Test
    @Timeout(value = 60, unit = TimeUnit.SECONDS)
    void testConcurrentEvictionKeepsCacheBounded() throws InterruptedException {
        PatternCache cache = new PatternCache(RegexConfig.builder()
            .maxCacheSize(50)
            .evictionProtectionMs(0)
            .build());
        int threadCount = 10;
        CountDownLatch done = new CountDownLatch(threadCount);
        AtomicInteger errors = new AtomicInteger(0);

        for (int i = 0; i < threadCount; i++) {
            int threadId = i;
            new Thread(() -> {
                try {
                    for (int j = 0; j < 200; j++) {
                        String regex = "t" + threadId + "_" + j;
                        cache.getOrCompile(regex, () -> Pattern.compileWithoutCache(regex));
                    }
                } catch (Exception e) {
                    errors.incrementAndGet();
                } finally {
                    done.countDown();
                }
            }).start();
        }
        done.await();

        assertThat(errors.get()).isEqualTo(0);

        // A final single-threaded insert trims any overshoot left by racing evictions
        cache.getOrCompile("last", () -> Pattern.compileWithoutCache("last"));

        // Every inserted pattern is either still cached or was evicted exactly once
        assertThat(cache.size()).isLessThanOrEqualTo(50);
        assertThat(cache.getStatistics().evictionsLRU()).isEqualTo(threadCount * 200 + 1 - cache.size());
    }
}
