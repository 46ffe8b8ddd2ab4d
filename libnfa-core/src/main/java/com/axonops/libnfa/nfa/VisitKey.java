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

/**
 * Identity of a pending visit: a state at an input position.
 *
 * <p>Within one match attempt the consumed count is a fixed offset from the position, so this
 * pair fully determines what a visit can reach. Matchers record every key they schedule and never
 * schedule it twice, which bounds the work on cycles of zero-consumption states.
 */
record VisitKey(long stateId, int position) {

    static VisitKey of(State state, Input input) {
        return new VisitKey(state.id(), input.position());
    }
}
