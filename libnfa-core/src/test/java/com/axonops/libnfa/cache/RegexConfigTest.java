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
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class RegexConfigTest {

    @Test
    void testDefaults() {
        RegexConfig config = RegexConfig.DEFAULT;

        assertThat(config.cacheEnabled()).isTrue();
        assertThat(config.maxCacheSize()).isEqualTo(50000);
        assertThat(config.evictionProtectionMs()).isEqualTo(1000);
        assertThat(config.optimizeAutomata()).isTrue();
        assertThat(config.maxMatchSteps()).isZero();
        assertThat(config.hasMatchBudget()).isFalse();
        assertThat(config.metricsRegistry()).isSameAs(NoOpMetricsRegistry.INSTANCE);
    }

    @Test
    void testBuilderDefaultsEqualDefaultConfig() {
        assertThat(RegexConfig.builder().build()).isEqualTo(RegexConfig.DEFAULT);
    }

    @Test
    void testNoCache() {
        assertThat(RegexConfig.NO_CACHE.cacheEnabled()).isFalse();
        assertThat(RegexConfig.NO_CACHE.optimizeAutomata()).isTrue();
    }

    @Test
    void testBuilder() {
        RegexConfig config = RegexConfig.builder()
            .maxCacheSize(10)
            .evictionProtectionMs(0)
            .optimizeAutomata(false)
            .maxMatchSteps(500)
            .build();

        assertThat(config.maxCacheSize()).isEqualTo(10);
        assertThat(config.evictionProtectionMs()).isZero();
        assertThat(config.optimizeAutomata()).isFalse();
        assertThat(config.maxMatchSteps()).isEqualTo(500);
        assertThat(config.hasMatchBudget()).isTrue();
    }

    @Test
    void testValidation() {
        assertThatIllegalArgumentException()
            .isThrownBy(() -> RegexConfig.builder().maxCacheSize(0).build())
            .withMessageContaining("maxCacheSize");
        assertThatIllegalArgumentException()
            .isThrownBy(() -> RegexConfig.builder().evictionProtectionMs(-1).build())
            .withMessageContaining("evictionProtectionMs");
        assertThatIllegalArgumentException()
            .isThrownBy(() -> RegexConfig.builder().maxMatchSteps(-1).build())
            .withMessageContaining("maxMatchSteps");
        assertThatNullPointerException()
            .isThrownBy(() -> RegexConfig.builder().metricsRegistry(null));
    }

    @Test
    void testCacheSettingsIgnoredWhenDisabled() {
        RegexConfig config = RegexConfig.builder()
            .cacheEnabled(false)
            .maxCacheSize(0)
            .evictionProtectionMs(-1)
            .build();

        assertThat(config.cacheEnabled()).isFalse();
    }
}
