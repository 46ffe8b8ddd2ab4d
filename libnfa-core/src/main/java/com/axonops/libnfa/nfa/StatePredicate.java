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
 * Condition evaluated by a {@link LambdaState}.
 *
 * <p>Implementations must be stateless: a compiled automaton may be matched from several threads
 * at once.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface StatePredicate {

    /**
     * @param input cursor at the next unread symbol
     * @param consumed symbols already consumed by the current match attempt
     * @return symbols consumed (0 or 1), or {@link State#REJECTED}
     */
    int test(Input input, int consumed);
}
