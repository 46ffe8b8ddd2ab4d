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

import java.util.Objects;

/**
 * Base class for states that evaluate a nested sub-automaton, such as lookahead.
 *
 * <p>The sub-automaton is owned by this state and is disjoint from the outer graph; only its
 * start and accept states are referenced. Entering the state never consumes outer input: a
 * private {@link Executor} runs over the sub-graph from the current position and the subclass
 * turns its outcome into a yes/no answer.
 *
 * @since 1.0.0
 */
public abstract class MacroState extends State {

    private final Automaton automaton;

    protected MacroState(Automaton automaton) {
        this.automaton = Objects.requireNonNull(automaton, "automaton cannot be null");
    }

    /**
     * Returns the nested automaton evaluated by this state.
     */
    public final Automaton automaton() {
        return automaton;
    }

    public final State subStart() {
        return automaton.start();
    }

    public final State subAccept() {
        return automaton.accept();
    }

    @Override
    public final int enter(Input input, int consumed) {
        Executor executor = new Executor(subStart(), subAccept(), MatchMode.PREFIX, input, consumed);
        return execute(executor) ? 0 : REJECTED;
    }

    /**
     * Drives the nested executor and decides whether this state is entered.
     *
     * @param executor executor positioned at the sub-automaton's start
     * @return true to enter the state
     */
    protected abstract boolean execute(Executor executor);

    /**
     * Steps the executor until it is done.
     *
     * @return true if the sub-automaton reached its accept state
     */
    protected static boolean drive(Executor executor) {
        boolean done;
        do {
            done = executor.step();
        } while (!done);
        return executor.isAccepted();
    }

    @Override
    public String displayName() {
        return label() + "<\n" + StateGraphPrinter.print(subStart(), subAccept()) + ">#" + id();
    }
}
