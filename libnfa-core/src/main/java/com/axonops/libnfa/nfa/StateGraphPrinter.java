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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * Renders the graph reachable from a start state as an indented depth-first tree.
 *
 * <pre>
 * Epsilon#1 [Start]
 *   Symbol&lt;a&gt;#4
 *     Symbol&lt;a&gt;#4 (repeated)
 *     Epsilon#2 [Accept]
 * </pre>
 *
 * @since 1.0.0
 */
public final class StateGraphPrinter {

    private StateGraphPrinter() {
    }

    public static String print(State start, State accept) {
        StringBuilder out = new StringBuilder();
        Set<State> seen = new HashSet<>();
        Deque<Line> stack = new ArrayDeque<>();
        stack.push(new Line(start, 0));

        while (!stack.isEmpty()) {
            Line line = stack.pop();
            State state = line.state();

            out.append("  ".repeat(line.depth())).append(state.displayName());
            if (state == start) {
                out.append(" [Start]");
            }
            if (state == accept) {
                out.append(" [Accept]");
            }
            if (!seen.add(state)) {
                out.append(" (repeated)\n");
                continue;
            }
            out.append('\n');

            // Reverse so successors print in id order
            for (State successor : state.next().descendingSet()) {
                stack.push(new Line(successor, line.depth() + 1));
            }
        }
        return out.toString();
    }

    private record Line(State state, int depth) {
    }
}
