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

package com.axonops.libnfa.regex;

import com.axonops.libnfa.nfa.Input;
import com.axonops.libnfa.nfa.LambdaState;
import com.axonops.libnfa.nfa.State;
import com.axonops.libnfa.nfa.StatePredicate;
import java.util.function.IntPredicate;

/**
 * ASCII character classes and zero-width assertions used by the regex compiler.
 *
 * @since 1.0.0
 */
public final class CharClasses {

    public static final IntPredicate DIGIT = c -> c >= '0' && c <= '9';

    public static final IntPredicate WORD =
        c -> (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || DIGIT.test(c) || c == '_';

    public static final IntPredicate SPACE =
        c -> c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f' || c == 0x0B;

    /** {@code ^}: nothing consumed yet. */
    public static final StatePredicate LINE_START = (input, consumed) -> consumed == 0 ? 0 : State.REJECTED;

    /** {@code $}: end of input. */
    public static final StatePredicate LINE_END = (input, consumed) -> input.isEof() ? 0 : State.REJECTED;

    /** {@code \b}. */
    public static final StatePredicate WORD_BOUNDARY =
        (input, consumed) -> atWordBoundary(input, consumed) ? 0 : State.REJECTED;

    /** {@code \B}: between two word characters. */
    public static final StatePredicate NOT_WORD_BOUNDARY =
        (input, consumed) -> betweenWordCharacters(input, consumed) ? 0 : State.REJECTED;

    private CharClasses() {
    }

    /**
     * Predicate consuming one symbol that satisfies {@code members}.
     */
    public static StatePredicate matching(IntPredicate members) {
        return (input, consumed) -> !input.isEof() && members.test(input.peek()) ? 1 : State.REJECTED;
    }

    /**
     * Predicate consuming one symbol that does not satisfy {@code members}. Never matches past
     * the end of input or the terminal symbol.
     */
    public static StatePredicate notMatching(IntPredicate members) {
        return (input, consumed) -> !input.isEof()
            && input.peek() != Input.TERMINAL
            && !members.test(input.peek()) ? 1 : State.REJECTED;
    }

    public static State digit() {
        return new LambdaState(matching(DIGIT), "Digit");
    }

    public static State notDigit() {
        return new LambdaState(notMatching(DIGIT), "NotDigit");
    }

    public static State word() {
        return new LambdaState(matching(WORD), "Word");
    }

    public static State notWord() {
        return new LambdaState(notMatching(WORD), "NotWord");
    }

    public static State space() {
        return new LambdaState(matching(SPACE), "Space");
    }

    public static State notSpace() {
        return new LambdaState(notMatching(SPACE), "NotSpace");
    }

    private static boolean atWordBoundary(Input input, int consumed) {
        boolean before = consumed > 0 && WORD.test(input.previous());
        boolean after = !input.isEof() && WORD.test(input.peek());
        return before != after;
    }

    private static boolean betweenWordCharacters(Input input, int consumed) {
        return consumed > 0 && WORD.test(input.previous()) && !input.isEof() && WORD.test(input.peek());
    }
}
