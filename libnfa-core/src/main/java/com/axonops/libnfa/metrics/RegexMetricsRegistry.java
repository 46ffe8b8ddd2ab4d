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

import java.util.function.Supplier;

/**
 * Metrics sink used by libnfa.
 *
 * <p>Keeps the core free of a hard dependency on a metrics library. The default is
 * {@link NoOpMetricsRegistry}; {@link DropwizardMetricsAdapter} forwards to Dropwizard Metrics.
 *
 * <p>Implementations must be thread-safe.
 *
 * @since 1.0.0
 */
public interface RegexMetricsRegistry {

    /**
     * Increment a counter by 1.
     *
     * @param name metric name, see {@link MetricNames}
     */
    void incrementCounter(String name);

    /**
     * Increment a counter by a non-negative delta.
     */
    void incrementCounter(String name, long delta);

    /**
     * Record a timer measurement.
     *
     * @param name metric name
     * @param durationNanos duration in nanoseconds
     */
    void recordTimer(String name, long durationNanos);

    /**
     * Register a gauge computed on read. Replaces any gauge already registered under the name.
     * The supplier must be fast and must not block.
     */
    void registerGauge(String name, Supplier<Number> valueSupplier);

    /**
     * Remove a gauge. No-op if none is registered under the name.
     */
    void removeGauge(String name);
}
