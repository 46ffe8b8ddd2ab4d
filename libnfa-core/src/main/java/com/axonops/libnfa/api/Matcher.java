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

package com.axonops.libnfa.api;

import com.axonops.libnfa.metrics.MetricNames;
import com.axonops.libnfa.metrics.RegexMetricsRegistry;
import com.axonops.libnfa.nfa.Executor;
import com.axonops.libnfa.nfa.Input;
import com.axonops.libnfa.nfa.MatchMode;
import com.axonops.libnfa.nfa.MatchStatus;
import java.util.Objects;

/**
 * Performs match operations of one {@link Pattern} over one input.
 *
 * NOT Thread-Safe: Each Matcher instance must be confined to a single thread.
 * The underlying Pattern CAN be safely shared - only the Matcher cannot.
 *
 * <p>Besides {@link #matches()} and {@link #find()}, the whole-string match can be driven one
 * visit at a time with {@link #step()}, e.g. to interleave matching with other work:
 * <pre>{@code
 * Matcher m = pattern.matcher(input);
 * while (!m.step()) {
 *     // other work
 * }
 * boolean matched = m.isAccepted();
 * }</pre>
 *
 * <p>{@link #matches()} and {@link #find()} honour the global
 * {@link com.axonops.libnfa.cache.RegexConfig#maxMatchSteps() step budget}; {@link #step()} is
 * driven by the caller and is not budgeted.
 *
 * @since 1.0.0
 */
public final class Matcher {

    private final Pattern pattern;
    private final Executor fullExecutor;
    private Executor searchExecutor;
    private CharSequence input;
    private long steps;
    private int matchStart = -1;

    Matcher(Pattern pattern, CharSequence input) {
        this.pattern = Objects.requireNonNull(pattern);
        this.input = Objects.requireNonNull(input, "input cannot be null");
        this.fullExecutor = pattern.automaton().executor(input);
    }

    /**
     * Tests whether the entire input matches.
     *
     * @throws MatchBudgetExceededException if the configured step budget runs out
     */
    public boolean matches() {
        long startNanos = System.nanoTime();
        boolean result = runFullMatch();
        long durationNanos = System.nanoTime() - startNanos;

        RegexMetricsRegistry metrics = Pattern.getGlobalCache().getConfig().metricsRegistry();
        metrics.incrementCounter(MetricNames.MATCHING_OPERATIONS);
        metrics.recordTimer(MetricNames.MATCHING_LATENCY, durationNanos);
        metrics.recordTimer(MetricNames.MATCHING_FULL_MATCH_LATENCY, durationNanos);
        metrics.incrementCounter(MetricNames.MATCHING_STEPS, steps);
        return result;
    }

    /**
     * Tests whether some substring of the input matches.
     *
     * <p>Tries each start offset from left to right; at each one the pattern only has to reach
     * its accept state, not consume the rest of the input. {@code ^} only holds at offset 0.
     * After a successful call {@link #start()} returns the leftmost offset at which a match
     * begins.
     *
     * @throws MatchBudgetExceededException if the configured step budget runs out
     */
    public boolean find() {
        long startNanos = System.nanoTime();
        boolean result = runSearch();
        long durationNanos = System.nanoTime() - startNanos;

        RegexMetricsRegistry metrics = Pattern.getGlobalCache().getConfig().metricsRegistry();
        metrics.incrementCounter(MetricNames.MATCHING_OPERATIONS);
        metrics.recordTimer(MetricNames.MATCHING_LATENCY, durationNanos);
        metrics.recordTimer(MetricNames.MATCHING_PARTIAL_MATCH_LATENCY, durationNanos);
        metrics.incrementCounter(MetricNames.MATCHING_STEPS, steps);
        return result;
    }

    /**
     * Advances the whole-string match by one visit.
     *
     * @return true once the outcome is known, see {@link #isAccepted()}
     */
    public boolean step() {
        boolean done = fullExecutor.step();
        steps = fullExecutor.steps();
        return done;
    }

    /** True if the stepped whole-string match has finished and accepted. */
    public boolean isAccepted() {
        return fullExecutor.isAccepted();
    }

    /** True if the stepped whole-string match has finished. */
    public boolean isDone() {
        return fullExecutor.isDone();
    }

    /**
     * Restarts matching over the same input.
     */
    public Matcher reset() {
        fullExecutor.reset();
        steps = 0;
        matchStart = -1;
        return this;
    }

    /**
     * Restarts matching over new input, reusing this matcher's buffers.
     */
    public Matcher reset(CharSequence newInput) {
        this.input = Objects.requireNonNull(newInput, "input cannot be null");
        fullExecutor.reset(newInput);
        steps = 0;
        matchStart = -1;
        return this;
    }

    /**
     * Offset at which the last successful {@link #find()} match begins.
     *
     * @throws IllegalStateException if the last find did not succeed
     */
    public int start() {
        if (matchStart < 0) {
            throw new IllegalStateException("NFA: No match available");
        }
        return matchStart;
    }

    /** Executor steps taken by the last operation. */
    public long steps() {
        return steps;
    }

    public Pattern pattern() {
        return pattern;
    }

    public CharSequence input() {
        return input;
    }

    /**
     * Runs a whole-string match from the beginning, without recording match metrics.
     */
    boolean runFullMatch() {
        fullExecutor.reset();
        matchStart = -1;
        long budget = Pattern.getGlobalCache().getConfig().maxMatchSteps();

        boolean accepted;
        if (budget > 0) {
            MatchStatus status = fullExecutor.run(budget);
            if (status == MatchStatus.BUDGET_EXHAUSTED) {
                steps = fullExecutor.steps();
                throw budgetExceeded(budget);
            }
            accepted = status == MatchStatus.ACCEPTED;
        } else {
            accepted = fullExecutor.run();
        }

        steps = fullExecutor.steps();
        if (accepted) {
            matchStart = 0;
        }
        return accepted;
    }

    private boolean runSearch() {
        matchStart = -1;
        steps = 0;
        long budget = Pattern.getGlobalCache().getConfig().maxMatchSteps();

        for (int offset = 0; offset <= input.length(); offset++) {
            Executor executor = searchExecutor(offset);
            boolean accepted;
            if (budget > 0) {
                long remaining = budget - steps;
                if (remaining <= 0) {
                    throw budgetExceeded(budget);
                }
                MatchStatus status = executor.run(remaining);
                steps += executor.steps();
                if (status == MatchStatus.BUDGET_EXHAUSTED) {
                    throw budgetExceeded(budget);
                }
                accepted = status == MatchStatus.ACCEPTED;
            } else {
                accepted = executor.run();
                steps += executor.steps();
            }

            if (accepted) {
                matchStart = offset;
                return true;
            }
        }
        return false;
    }

    private Executor searchExecutor(int offset) {
        Input start = Input.of(input, offset);
        if (searchExecutor == null) {
            searchExecutor = new Executor(
                pattern.automaton().start(), pattern.automaton().accept(), MatchMode.PREFIX, start, offset);
        } else {
            searchExecutor.reset(start, offset);
        }
        return searchExecutor;
    }

    private MatchBudgetExceededException budgetExceeded(long budget) {
        Pattern.getGlobalCache().getConfig().metricsRegistry()
            .incrementCounter(MetricNames.ERRORS_MATCH_BUDGET_EXCEEDED);
        return new MatchBudgetExceededException(budget);
    }
}
