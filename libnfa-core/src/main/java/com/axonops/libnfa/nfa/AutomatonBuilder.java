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
import java.util.Objects;

/**
 * Incrementally assembles an {@link Automaton} through a cursor protocol.
 *
 * <p>The builder keeps a cursor (the state new elements are appended after), a stack of open
 * groups and the "last element": the {@code (start, end)} pair most recently completed at the
 * current depth. Repetition operators ({@link #jump()}, {@link #skip()}) apply to the last
 * element. An implicit group 0 spans the automaton's start and accept states; at most
 * {@value #MAX_GROUP_DEPTH} explicit groups may be open above it.
 *
 * <p>Typical sequence for {@code (ab|c)+}:
 * <pre>{@code
 * Automaton nfa = new AutomatonBuilder()
 *     .beginGroup()
 *     .pushState(new SymbolState('a'))
 *     .pushState(new SymbolState('b'))
 *     .branch()
 *     .pushState(new SymbolState('c'))
 *     .endGroup()
 *     .jump()
 *     .finish();
 * }</pre>
 *
 * <p>NOT Thread-Safe.
 *
 * @since 1.0.0
 */
public final class AutomatonBuilder {

    /** Maximum number of explicit groups open at once. */
    public static final int MAX_GROUP_DEPTH = 127;

    private final Automaton automaton;
    private final Group root;
    private final Deque<Group> groups = new ArrayDeque<>();

    private State cursor;
    private Group last;
    private boolean finished;

    public AutomatonBuilder() {
        this(new Automaton());
    }

    public AutomatonBuilder(Automaton automaton) {
        this.automaton = Objects.requireNonNull(automaton, "automaton cannot be null");
        this.root = new Group(automaton.start(), automaton.accept());
        this.cursor = automaton.start();
    }

    /**
     * Appends a state after the cursor.
     *
     * <p>A scaffold epsilon is placed in front of the state so the pair can later be looped or
     * bypassed as a unit. The pair becomes the last element and the state becomes the cursor.
     *
     * @param state state to append; must not belong to another automaton
     * @return this builder
     */
    public AutomatonBuilder pushState(State state) {
        ensureNotFinished();
        Objects.requireNonNull(state, "state cannot be null");

        State scaffold = automaton.addState(new EpsilonState());
        automaton.addState(state);
        cursor.link(scaffold).link(state);

        cursor = state;
        last = new Group(scaffold, state);
        return this;
    }

    /**
     * Opens a group after the cursor and moves the cursor to its start.
     *
     * @throws BuilderException if {@value #MAX_GROUP_DEPTH} groups are already open
     */
    public AutomatonBuilder beginGroup() {
        ensureNotFinished();
        if (groups.size() >= MAX_GROUP_DEPTH) {
            throw new BuilderException("group nesting exceeds " + MAX_GROUP_DEPTH + " levels");
        }

        State start = automaton.addState(new EpsilonState());
        State end = automaton.addState(new EpsilonState());
        cursor.link(start);
        groups.push(new Group(start, end));

        cursor = start;
        last = null;
        return this;
    }

    /**
     * Closes the innermost group. The closed group becomes the last element.
     *
     * @throws BuilderException if no explicit group is open
     */
    public AutomatonBuilder endGroup() {
        ensureNotFinished();
        if (groups.isEmpty()) {
            throw new BuilderException("endGroup without matching beginGroup");
        }

        Group group = groups.pop();
        cursor.link(group.end());

        cursor = group.end();
        last = group;
        return this;
    }

    /**
     * Ends the current alternative and starts a new one at the innermost group's start.
     * At depth 0 the alternative ends at the accept state.
     */
    public AutomatonBuilder branch() {
        ensureNotFinished();
        Group group = currentGroup();
        cursor.link(group.end());

        cursor = group.start();
        last = null;
        return this;
    }

    /**
     * Makes the last element repeatable (one or more times) with a back edge from its end to
     * its start.
     *
     * @throws BuilderException if there is no last element
     */
    public AutomatonBuilder jump() {
        ensureNotFinished();
        if (last == null) {
            throw new BuilderException("nothing to repeat");
        }
        last.end().link(last.start());
        return this;
    }

    /**
     * Makes the last element optional.
     *
     * <p>Adds a join state reached both from the element's end and, bypassing it, from its
     * start. The join becomes the cursor and the end of the last element.
     *
     * @throws BuilderException if there is no last element
     */
    public AutomatonBuilder skip() {
        ensureNotFinished();
        if (last == null) {
            throw new BuilderException("nothing to make optional");
        }

        State join = automaton.addState(new EpsilonState());
        last.end().link(join);
        last.start().link(join);

        cursor = join;
        last = new Group(last.start(), join);
        return this;
    }

    /**
     * Links the cursor to the accept state and returns the finished automaton.
     *
     * @throws BuilderException if groups are still open
     */
    public Automaton finish() {
        ensureNotFinished();
        if (!groups.isEmpty()) {
            throw new BuilderException(groups.size() + " group(s) still open");
        }
        cursor.link(automaton.accept());
        finished = true;
        return automaton;
    }

    public Automaton automaton() {
        return automaton;
    }

    public State cursor() {
        return cursor;
    }

    /** Number of open explicit groups. */
    public int depth() {
        return groups.size();
    }

    public boolean isFinished() {
        return finished;
    }

    private Group currentGroup() {
        Group group = groups.peek();
        return group != null ? group : root;
    }

    private void ensureNotFinished() {
        if (finished) {
            throw new BuilderException("builder already finished");
        }
    }

    private record Group(State start, State end) {
    }
}
