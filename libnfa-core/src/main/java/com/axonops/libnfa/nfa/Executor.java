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
import java.util.Objects;
import java.util.Set;

/**
 * Resumable, single-stepping matcher over an automaton graph.
 *
 * <p>Keeps a LIFO stack of pending visits and the current visit. Each {@link #step()} enters the
 * current state, schedules its successors at the advanced cursor, then pops the next visit and
 * checks whether it is the accept state. A (state, position) pair is scheduled at most once per
 * attempt, so cycles of zero-consumption states terminate.
 *
 * <p>In {@link MatchMode#FULL} the accept state only counts at end of input; in
 * {@link MatchMode#PREFIX} reaching it is enough.
 *
 * <p>NOT Thread-Safe. The graph it walks may be shared; the executor may not.
 *
 * @since 1.0.0
 */
public final class Executor {

    private final State start;
    private final State accept;
    private final MatchMode mode;
    private final Deque<Visit> pending = new ArrayDeque<>();
    private final Set<VisitKey> visited = new HashSet<>();

    private Input origin;
    private int initialConsumed;
    private Visit current;
    private boolean done;
    private boolean accepted;
    private int matchEnd;
    private long steps;

    /**
     * @param start state to begin at
     * @param accept state that ends the match
     * @param mode whether input must be exhausted at accept
     * @param input cursor to begin at
     * @param initialConsumed symbols already consumed before {@code input}
     */
    public Executor(State start, State accept, MatchMode mode, Input input, int initialConsumed) {
        this.start = Objects.requireNonNull(start, "start cannot be null");
        this.accept = Objects.requireNonNull(accept, "accept cannot be null");
        this.mode = Objects.requireNonNull(mode, "mode cannot be null");
        reset(input, initialConsumed);
    }

    /**
     * Advances the match by one visit.
     *
     * @return true once the executor is done (accepted or rejected); further calls are no-ops
     */
    public boolean step() {
        if (done) {
            return true;
        }

        State state = current.state();
        int consumed = state.enter(current.input(), current.consumed());
        if (consumed != State.REJECTED) {
            Input advanced = current.input().advance(consumed);
            int total = current.consumed() + consumed;
            for (State successor : state.next()) {
                if (visited.add(VisitKey.of(successor, advanced))) {
                    pending.push(new Visit(successor, advanced, total));
                }
            }
        }

        if (pending.isEmpty()) {
            done = true;
            accepted = false;
            return true;
        }

        current = pending.pop();
        steps++;

        if (current.state() == accept && (mode == MatchMode.PREFIX || current.input().isEof())) {
            done = true;
            accepted = true;
            matchEnd = current.input().position();
        }
        return done;
    }

    /**
     * Steps until done.
     *
     * @return true if accepted
     */
    public boolean run() {
        boolean finished;
        do {
            finished = step();
        } while (!finished);
        return accepted;
    }

    /**
     * Steps until done or until {@code maxSteps} further steps have been taken.
     *
     * @param maxSteps positive step budget
     * @return outcome, or {@link MatchStatus#BUDGET_EXHAUSTED} if the budget ran out first
     */
    public MatchStatus run(long maxSteps) {
        if (maxSteps <= 0) {
            throw new IllegalArgumentException("maxSteps must be positive, got " + maxSteps);
        }
        for (long i = 0; i < maxSteps; i++) {
            if (step()) {
                return accepted ? MatchStatus.ACCEPTED : MatchStatus.REJECTED;
            }
        }
        return MatchStatus.BUDGET_EXHAUSTED;
    }

    /**
     * Restarts the attempt from its starting cursor, keeping the allocated collections.
     */
    public void reset() {
        reset(origin, initialConsumed);
    }

    /**
     * Restarts the attempt over new text from offset 0.
     */
    public void reset(CharSequence text) {
        reset(Input.of(text), 0);
    }

    /**
     * Restarts the attempt at the given cursor.
     */
    public void reset(Input input, int initialConsumed) {
        Objects.requireNonNull(input, "input cannot be null");
        if (initialConsumed < 0) {
            throw new IllegalArgumentException("initialConsumed must be non-negative, got " + initialConsumed);
        }
        this.origin = input;
        this.initialConsumed = initialConsumed;

        pending.clear();
        visited.clear();
        current = new Visit(start, input, initialConsumed);
        visited.add(VisitKey.of(start, input));
        done = false;
        accepted = false;
        matchEnd = -1;
        steps = 0;
    }

    public boolean isDone() {
        return done;
    }

    /** True if the executor finished and reached the accept state. */
    public boolean isAccepted() {
        return accepted;
    }

    /**
     * Input position at which accept was reached, or -1 if not accepted.
     */
    public int matchEnd() {
        return matchEnd;
    }

    /** Visits popped since the last reset. */
    public long steps() {
        return steps;
    }

    public int pendingCount() {
        return pending.size();
    }

    public MatchMode mode() {
        return mode;
    }

    private record Visit(State state, Input input, int consumed) {
    }
}
