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

package com.axonops.libnfa.dropwizard;

import com.axonops.libnfa.cache.RegexConfig;
import com.axonops.libnfa.metrics.DropwizardMetricsAdapter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.jmx.JmxReporter;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a {@link RegexConfig} that reports to a Dropwizard {@link MetricRegistry}, optionally
 * exposing the registry over JMX.
 *
 * <pre>{@code
 * MetricRegistry registry = new MetricRegistry();
 * RegexConfig config = RegexMetricsConfig.withMetrics(registry, "com.myapp.nfa");
 * Pattern.setGlobalCache(new PatternCache(config));
 * }</pre>
 *
 * <p>At most one {@link JmxReporter} is started per JVM; it reports the registry passed to the
 * first call that enabled JMX. Call {@link #shutdown()} to stop it.
 *
 * @since 1.0.0
 */
public final class RegexMetricsConfig {
    private static final Logger logger = LoggerFactory.getLogger(RegexMetricsConfig.class);

    private static JmxReporter jmxReporter;
    private static MetricRegistry jmxRegistry;

    private RegexMetricsConfig() {
        // Utility class
    }

    /**
     * Creates a config with Dropwizard metrics under the default prefix and JMX enabled.
     */
    public static RegexConfig withMetrics(MetricRegistry registry) {
        return withMetrics(registry, DropwizardMetricsAdapter.DEFAULT_PREFIX, true);
    }

    /**
     * Creates a config with Dropwizard metrics and JMX enabled.
     *
     * @param registry the registry to report to
     * @param metricPrefix the metric namespace prefix, e.g. {@code com.myapp.nfa}
     */
    public static RegexConfig withMetrics(MetricRegistry registry, String metricPrefix) {
        return withMetrics(registry, metricPrefix, true);
    }

    /**
     * Creates a config with Dropwizard metrics; every other setting is the default.
     *
     * @param registry the registry to report to
     * @param metricPrefix the metric namespace prefix
     * @param enableJmx whether to expose the registry via JMX
     */
    public static RegexConfig withMetrics(MetricRegistry registry, String metricPrefix, boolean enableJmx) {
        return withMetrics(RegexConfig.builder(), registry, metricPrefix, enableJmx);
    }

    /**
     * Completes a partially configured builder with Dropwizard metrics.
     *
     * <pre>{@code
     * RegexConfig config = RegexMetricsConfig.withMetrics(
     *     RegexConfig.builder().maxCacheSize(1_000).maxMatchSteps(100_000),
     *     registry, "com.myapp.nfa", false);
     * }</pre>
     */
    public static RegexConfig withMetrics(
            RegexConfig.Builder builder, MetricRegistry registry, String metricPrefix, boolean enableJmx) {
        Objects.requireNonNull(builder, "builder cannot be null");
        Objects.requireNonNull(registry, "registry cannot be null");
        Objects.requireNonNull(metricPrefix, "metricPrefix cannot be null");

        if (enableJmx) {
            ensureJmxReporter(registry);
        }

        return builder
            .metricsRegistry(new DropwizardMetricsAdapter(registry, metricPrefix))
            .build();
    }

    /** True while a JmxReporter started by this class is running. */
    public static synchronized boolean isJmxReporterRunning() {
        return jmxReporter != null;
    }

    private static synchronized void ensureJmxReporter(MetricRegistry registry) {
        if (jmxReporter != null) {
            if (jmxRegistry != registry) {
                logger.warn("NFA: JmxReporter already running for another MetricRegistry, not starting a second one");
            }
            return;
        }
        try {
            jmxReporter = JmxReporter.forRegistry(registry).build();
            jmxReporter.start();
            jmxRegistry = registry;
            logger.info("NFA: JmxReporter started - metrics available via JMX");
        } catch (RuntimeException e) {
            // Not fatal: the registry may already be exposed by the host application
            jmxReporter = null;
            logger.warn("NFA: Failed to start JmxReporter", e);
        }
    }

    /**
     * Stops the JmxReporter, if one was started.
     */
    public static synchronized void shutdown() {
        if (jmxReporter != null) {
            logger.info("NFA: Stopping JmxReporter");
            jmxReporter.stop();
            jmxReporter = null;
            jmxRegistry = null;
        }
    }
}
