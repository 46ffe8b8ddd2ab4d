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

import java.util.ArrayList;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Epsilon elision.
 *
 * <p>Removes epsilon states that add nothing to the graph: an unpinned epsilon without a
 * self-loop is merged into its single predecessor, or failing that into its single successor.
 * Accepted language is unchanged. Sub-automata of {@link MacroState}s are optimized as well.
 *
 * @since 1.0.0
 */
public final class Optimizer {

    private static final Logger logger = LoggerFactory.getLogger(Optimizer.class);

    private final Automaton automaton;

    public Optimizer(Automaton automaton) {
        this.automaton = Objects.requireNonNull(automaton, "automaton cannot be null");
    }

    /**
     * Runs a single elision pass over a snapshot of the states.
     *
     * @return number of states removed
     */
    public int removeEpsilons() {
        return removeEpsilons(automaton);
    }

    /**
     * Repeats {@link #removeEpsilons()} until a pass removes nothing.
     *
     * @return total number of states removed
     */
    public int optimize() {
        int total = 0;
        int removed;
        do {
            removed = removeEpsilons();
            total += removed;
        } while (removed > 0);

        logger.trace("NFA: Optimizer removed {} states, {} remain", total, automaton.size());
        return total;
    }

    private static int removeEpsilons(Automaton automaton) {
        int removed = 0;
        for (State state : new ArrayList<>(automaton.states())) {
            if (state instanceof MacroState) {
                removed += removeEpsilons(((MacroState) state).automaton());
                continue;
            }
            if (!(state instanceof EpsilonState) || automaton.isPinned(state) || state.hasSelfLoop()) {
                continue;
            }

            if (state.prev().size() == 1) {
                state.mergeIntoPrev();
            } else if (state.next().size() == 1) {
                state.mergeIntoNext();
            } else {
                continue;
            }
            automaton.removeState(state);
            removed++;
        }
        return removed;
    }
}
