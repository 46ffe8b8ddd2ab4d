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
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A vertex of the automaton graph.
 *
 * <p>Every state has a unique id and two edge sets ordered by id: the states it may
 * transition into ({@link #next()}) and the states that may transition into it
 * ({@link #prev()}). The two sets are kept as exact inverses by every graph edit: for any edge
 * A&rarr;B, B is in A.next and A is in B.prev.
 *
 * <p>Subclasses define what it takes to enter the state via {@link #enter(Input, int)}.
 *
 * <p>NOT Thread-Safe during construction. Once the owning automaton is complete the graph is
 * read-only and may be matched from many threads.
 *
 * @since 1.0.0
 */
public abstract class State {

    /** Returned by {@link #enter(Input, int)} when the state's condition is not satisfied. */
    public static final int REJECTED = -1;

    /** Orders states by id; used for the edge sets. */
    public static final Comparator<State> BY_ID = Comparator.comparingLong(State::id);

    private static final AtomicLong ID_GENERATOR = new AtomicLong();

    private final long id;
    private final NavigableSet<State> next = new TreeSet<>(BY_ID);
    private final NavigableSet<State> prev = new TreeSet<>(BY_ID);

    // Set once by Automaton.addState
    private Automaton owner;

    protected State() {
        this.id = ID_GENERATOR.incrementAndGet();
    }

    /**
     * Attempts to enter this state.
     *
     * @param input cursor at the next unread symbol
     * @param consumed symbols already consumed by the current match attempt
     * @return number of symbols consumed by this state (0 or 1), or {@link #REJECTED}
     */
    public abstract int enter(Input input, int consumed);

    /**
     * Short debug name, e.g. {@code Symbol<a>}.
     */
    protected abstract String label();

    public final long id() {
        return id;
    }

    /**
     * Returns a display name including the id, e.g. {@code Symbol<a>#12}.
     */
    public String displayName() {
        return label() + "#" + id;
    }

    /** Read-only view of the successor set. */
    public final NavigableSet<State> next() {
        return Collections.unmodifiableNavigableSet(next);
    }

    /** Read-only view of the predecessor set. */
    public final NavigableSet<State> prev() {
        return Collections.unmodifiableNavigableSet(prev);
    }

    /**
     * Returns the automaton this state was added to, or null.
     */
    public final Automaton owner() {
        return owner;
    }

    final void setOwner(Automaton automaton) {
        this.owner = automaton;
    }

    /**
     * Adds the edge this&rarr;other. Idempotent.
     *
     * @param other successor
     * @return {@code other}, so links can be chained
     */
    public final State link(State other) {
        Objects.requireNonNull(other, "other cannot be null");
        next.add(other);
        other.prev.add(this);
        return other;
    }

    /**
     * Removes the edge this&rarr;other if present.
     *
     * @param other successor
     * @return true if an edge was removed
     */
    public final boolean unlink(State other) {
        boolean removed = next.remove(other);
        other.prev.remove(this);
        return removed;
    }

    /**
     * Returns true if this state links to itself.
     */
    public final boolean hasSelfLoop() {
        return next.contains(this);
    }

    /**
     * Splices this state out of the graph, redirecting every incoming edge to its single
     * successor.
     *
     * <p>Afterwards this state has no edges. The caller must not merge a state that is still
     * referenced from outside the graph (start, accept, lookahead boundaries); this method does
     * not check.
     *
     * @return the successor
     * @throws IllegalStateException if this state does not have exactly one successor other than
     *     itself
     */
    public final State mergeIntoNext() {
        if (next.size() != 1 || hasSelfLoop()) {
            throw new IllegalStateException("NFA: Cannot merge " + displayName()
                + " into next state, it has " + next.size() + " successors");
        }

        State successor = next.first();
        unlink(successor);

        for (State predecessor : new ArrayList<>(prev)) {
            predecessor.unlink(this);
            predecessor.link(successor);
        }

        return successor;
    }

    /**
     * Splices this state out of the graph, moving every outgoing edge onto its single
     * predecessor.
     *
     * @return the predecessor
     * @throws IllegalStateException if this state does not have exactly one predecessor other
     *     than itself
     * @see #mergeIntoNext()
     */
    public final State mergeIntoPrev() {
        if (prev.size() != 1 || hasSelfLoop()) {
            throw new IllegalStateException("NFA: Cannot merge " + displayName()
                + " into previous state, it has " + prev.size() + " predecessors");
        }

        State predecessor = prev.first();
        predecessor.unlink(this);

        List<State> successors = new ArrayList<>(next);
        for (State successor : successors) {
            unlink(successor);
            predecessor.link(successor);
        }

        return predecessor;
    }

    /**
     * Removes every edge touching this state.
     */
    final void detach() {
        for (State successor : new ArrayList<>(next)) {
            unlink(successor);
        }
        for (State predecessor : new ArrayList<>(prev)) {
            predecessor.unlink(this);
        }
    }

    @Override
    public String toString() {
        return displayName();
    }
}
