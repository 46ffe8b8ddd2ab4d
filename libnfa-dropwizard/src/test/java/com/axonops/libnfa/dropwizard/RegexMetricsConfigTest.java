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

import com.axonops.libnfa.api.Pattern;
import com.axonops.libnfa.cache.PatternCache;
import com.axonops.libnfa.cache.RegexConfig;
import com.axonops.libnfa.metrics.DropwizardMetricsAdapter;
import com.codahale.metrics.MetricRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("RegexMetricsConfig")
class RegexMetricsConfigTest {

    @AfterEach
    void cleanup() {
        RegexMetricsConfig.shutdown();
    }

    @Test
    @DisplayName("Default prefix is used when none is given")
    void defaultPrefix() {
        RegexConfig config = RegexMetricsConfig.withMetrics(new MetricRegistry());

        assertThat(config.metricsRegistry()).isInstanceOf(DropwizardMetricsAdapter.class);
        assertThat(((DropwizardMetricsAdapter) config.metricsRegistry()).prefix())
            .isEqualTo("com.axonops.libnfa");
        assertThat(RegexMetricsConfig.isJmxReporterRunning()).isTrue();
    }

    @Test
    @DisplayName("Custom prefix is applied to every metric")
    void customPrefix() {
        MetricRegistry registry = new MetricRegistry();
        RegexConfig config = RegexMetricsConfig.withMetrics(registry, "com.myapp.nfa", false);

        PatternCache original = Pattern.getGlobalCache();
        Pattern.setGlobalCache(new PatternCache(config));
        try {
            Pattern.compile("a+b").matches("aab");
        } finally {
            Pattern.getGlobalCache().shutdown();
            Pattern.setGlobalCache(original);
        }

        assertThat(registry.counter("com.myapp.nfa.patterns.compiled.total.count").getCount()).isEqualTo(1);
        assertThat(registry.counter("com.myapp.nfa.matching.operations.total.count").getCount()).isEqualTo(1);
        assertThat(registry.getNames()).allMatch(name -> name.startsWith("com.myapp.nfa."));
    }

    @Test
    @DisplayName("Other settings keep their defaults")
    void otherSettingsDefault() {
        RegexConfig config = RegexMetricsConfig.withMetrics(new MetricRegistry(), "x", false);

        assertThat(config.cacheEnabled()).isTrue();
        assertThat(config.maxCacheSize()).isEqualTo(RegexConfig.DEFAULT.maxCacheSize());
        assertThat(config.maxMatchSteps()).isZero();
    }

    @Test
    @DisplayName("A partially configured builder is completed")
    void builderVariant() {
        RegexConfig config = RegexMetricsConfig.withMetrics(
            RegexConfig.builder().maxCacheSize(10).maxMatchSteps(1_000),
            new MetricRegistry(), "x", false);

        assertThat(config.maxCacheSize()).isEqualTo(10);
        assertThat(config.maxMatchSteps()).isEqualTo(1_000);
        assertThat(config.metricsRegistry()).isInstanceOf(DropwizardMetricsAdapter.class);
    }

    @Test
    @DisplayName("JMX is off when disabled")
    void jmxDisabled() {
        RegexMetricsConfig.withMetrics(new MetricRegistry(), "x", false);

        assertThat(RegexMetricsConfig.isJmxReporterRunning()).isFalse();
    }

    @Test
    @DisplayName("Only one JmxReporter is started and shutdown() stops it")
    void singleJmxReporter() {
        MetricRegistry first = new MetricRegistry();
        MetricRegistry second = new MetricRegistry();

        RegexMetricsConfig.withMetrics(first, "first");
        RegexMetricsConfig.withMetrics(first, "first.again");
        RegexMetricsConfig.withMetrics(second, "second");
        assertThat(RegexMetricsConfig.isJmxReporterRunning()).isTrue();

        RegexMetricsConfig.shutdown();
        assertThat(RegexMetricsConfig.isJmxReporterRunning()).isFalse();

        // Idempotent
        RegexMetricsConfig.shutdown();
        assertThat(RegexMetricsConfig.isJmxReporterRunning()).isFalse();
    }

    @Test
    @DisplayName("Null arguments are rejected")
    void nullArguments() {
        assertThatNullPointerException()
            .isThrownBy(() -> RegexMetricsConfig.withMetrics(null, "x", false));
        assertThatNullPointerException()
            .isThrownBy(() -> RegexMetricsConfig.withMetrics(new MetricRegistry(), null, false));
        assertThatNullPointerException()
            .isThrownBy(() -> RegexMetricsConfig.withMetrics(null, new MetricRegistry(), "x", false));
    }
}
