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

package com.axonops.libnfa.nfa;

/**
 * Consumes one symbol in the inclusive range {@code [min, max]}, e.g. {@code a-z}.
 *
 * @since 1.0.0
 */
public final class RangeState extends State {

    private final char min;
    private final char max;

    /**
     * @param min lowest accepted symbol
     * @param max highest accepted symbol
     * @throws IllegalArgumentException if {@code min > max}
     */
    public RangeState(char min, char max) {
        if (min > max) {
            throw new IllegalArgumentException("Range out of order: " + min + "-" + max);
        }
        this.min = min;
        this.max = max;
    }

    public char min() {
        return min;
    }

    public char max() {
        return max;
    }

    @Override
    public int enter(Input input, int consumed) {
        if (input.isEof()) {
            return REJECTED;
        }
        char symbol = input.peek();
        return symbol >= min && symbol <= max ? 1 : REJECTED;
    }

    @Override
    protected String label() {
        return "Range<" + min + "-" + max + ">";
    }
}
