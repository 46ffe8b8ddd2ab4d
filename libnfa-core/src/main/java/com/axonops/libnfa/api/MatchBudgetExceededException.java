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

/**
 * Thrown when a match attempt runs out of its configured step budget.
 *
 * @since 1.0.0
 */
public final class MatchBudgetExceededException extends RegexException {

    private final long maxSteps;

    public MatchBudgetExceededException(long maxSteps) {
        super("NFA: Match exceeded step budget of " + maxSteps + " steps");
        this.maxSteps = maxSteps;
    }

    public long getMaxSteps() {
        return maxSteps;
    }
}
