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

package com.axonops.libnfa.regex;

import com.axonops.libnfa.nfa.State;
import java.util.List;
import java.util.function.Supplier;

/**
 * Syntax tree produced by {@link RegexParser}.
 *
 * <p>Leaves carry a state factory rather than a state: a node may be emitted several times
 * (e.g. {@code a{3}}) and every emission needs fresh states.
 */
sealed interface RegexNode {

    /** Matches one atom: a symbol, a class or an assertion. */
    record Atom(Supplier<State> factory, String description) implements RegexNode {
    }

    record Concat(List<RegexNode> items) implements RegexNode {
    }

    record Alternation(List<RegexNode> alternatives) implements RegexNode {
    }

    record Group(RegexNode body) implements RegexNode {
    }

    record Lookahead(RegexNode body, boolean negative) implements RegexNode {
    }

    /**
     * Repeats {@code element} between {@code min} and {@code max} times; {@code max} is
     * {@link #UNBOUNDED} for no upper limit.
     */
    record Repeat(RegexNode element, int min, int max) implements RegexNode {
        static final int UNBOUNDED = -1;
    }
}
