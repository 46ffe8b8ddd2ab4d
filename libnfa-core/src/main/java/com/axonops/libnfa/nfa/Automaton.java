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
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A non-deterministic finite automaton: a set of owned states plus fixed start and accept
 * states.
 *
 * <p>Start and accept are epsilon states created by the constructor. They are never reassigned
 * and are always pinned, so the {@link Optimizer} cannot merge them away. Other states may be
 * pinned explicitly with {@link #pin(State)}.
 *
 * <p>A state belongs to at most one automaton. The graph is normally assembled with an
 * {@link AutomatonBuilder}; once complete it is read-only and {@link #accepts(CharSequence)} and
 * {@link #executor(CharSequence)} may be used from many threads.
 *
 * @since 1.0.0
 */
public final class Automaton {

    private final Set<State> states = new LinkedHashSet<>();
    private final Set<State> pinned = new HashSet<>();
    private final State start;
    private final State accept;

    public Automaton() {
        this.start = addState(new EpsilonState());
        this.accept = addState(new EpsilonState());
        pinned.add(start);
        pinned.add(accept);
    }

    /**
     * Returns a builder that appends to this automaton, starting at {@link #start()}.
     */
    public AutomatonBuilder builder() {
        return new AutomatonBuilder(this);
    }

    public State start() {
        return start;
    }

    public State accept() {
        return accept;
    }

    /**
     * Takes ownership of a state. Adding a state this automaton already owns is a no-op.
     *
     * @param state state to add
     * @return the same state
     * @throws IllegalArgumentException if the state belongs to another automaton, or is a
     *     {@link MacroState} wrapping this automaton
     */
    public <T extends State> T addState(T state) {
        Objects.requireNonNull(state, "state cannot be null");
        if (state.owner() == this) {
            return state;
        }
        if (state.owner() != null) {
            throw new IllegalArgumentException("NFA: State " + state.displayName()
                + " already belongs to another automaton");
        }
        if (state instanceof MacroState && ((MacroState) state).automaton() == this) {
            throw new IllegalArgumentException("NFA: A macro state cannot wrap its own automaton");
        }
        state.setOwner(this);
        states.add(state);
        return state;
    }

    /**
     * Removes an owned state together with every edge touching it.
     *
     * @throws IllegalArgumentException if the state is not owned by this automaton
     * @throws IllegalStateException if the state is pinned
     */
    public void removeState(State state) {
        Objects.requireNonNull(state, "state cannot be null");
        if (state.owner() != this) {
            throw new IllegalArgumentException("NFA: State " + state.displayName()
                + " does not belong to this automaton");
        }
        if (pinned.contains(state)) {
            throw new IllegalStateException("NFA: Cannot remove pinned state " + state.displayName());
        }
        state.detach();
        states.remove(state);
        state.setOwner(null);
    }

    /**
     * Protects an owned state from removal by the optimizer.
     */
    public void pin(State state) {
        Objects.requireNonNull(state, "state cannot be null");
        if (state.owner() != this) {
            throw new IllegalArgumentException("NFA: State " + state.displayName()
                + " does not belong to this automaton");
        }
        pinned.add(state);
    }

    public boolean isPinned(State state) {
        return pinned.contains(state);
    }

    /** Read-only view of the owned states, in insertion order. */
    public Set<State> states() {
        return Collections.unmodifiableSet(states);
    }

    public int size() {
        return states.size();
    }

    /**
     * Tests whether the whole input is accepted.
     *
     * <p>Depth-first search over (state, cursor) pairs. A pair is scheduled at most once, so
     * cycles that consume nothing terminate.
     *
     * @param input text to match
     * @return true iff some path from start reaches accept with every symbol consumed
     */
    public boolean accepts(CharSequence input) {
        Objects.requireNonNull(input, "input cannot be null");

        Deque<Frame> stack = new ArrayDeque<>();
        Set<VisitKey> visited = new HashSet<>();

        Input origin = Input.of(input);
        stack.push(new Frame(start, origin));
        visited.add(VisitKey.of(start, origin));

        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            if (frame.state() == accept && frame.input().isEof()) {
                return true;
            }

            int consumed = frame.state().enter(frame.input(), frame.input().position());
            if (consumed == State.REJECTED) {
                continue;
            }

            Input advanced = frame.input().advance(consumed);
            for (State successor : frame.state().next()) {
                if (visited.add(VisitKey.of(successor, advanced))) {
                    stack.push(new Frame(successor, advanced));
                }
            }
        }
        return false;
    }

    /**
     * Creates a whole-string executor over this automaton.
     */
    public Executor executor(CharSequence input) {
        return new Executor(start, accept, MatchMode.FULL, Input.of(input), 0);
    }

    @Override
    public String toString() {
        return StateGraphPrinter.print(start, accept);
    }

    private record Frame(State state, Input input) {
    }
}
