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

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class PatternHasherTest {

    @Test
    void testHashIsStableHex() {
        String hash = PatternHasher.hash("user-\\d+");

        assertThat(hash).isEqualTo(PatternHasher.hash("user-\\d+"));
        assertThat(hash).matches("[0-9a-f]+");
        assertThat(hash).isEqualTo(Integer.toHexString("user-\\d+".hashCode()));
    }

    @Test
    void testNullPattern() {
        assertThat(PatternHasher.hash(null)).isEqualTo("null");
    }

    @Test
    void testHashWithSize() {
        assertThat(PatternHasher.hashWithSize("abc", 5)).isEqualTo(PatternHasher.hash("abc") + "[5]");
    }
}
