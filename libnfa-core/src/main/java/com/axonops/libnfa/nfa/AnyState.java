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
 * Consumes any one symbol other than the terminal symbol.
 *
 * @since 1.0.0
 */
public final class AnyState extends State {

    @Override
    public int enter(Input input, int consumed) {
        return !input.isEof() && input.peek() != Input.TERMINAL ? 1 : REJECTED;
    }

    @Override
    protected String label() {
        return "Any";
    }
}
