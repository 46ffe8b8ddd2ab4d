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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for graph ownership and the reference acceptance check.
 */
class AutomatonTest {

    @Test
    void testNewAutomatonHasPinnedStartAndAccept() {
        Automaton automaton = new Automaton();

        assertThat(automaton.size()).isEqualTo(2);
        assertThat(automaton.start()).isNotSameAs(automaton.accept());
        assertThat(automaton.isPinned(automaton.start())).isTrue();
        assertThat(automaton.isPinned(automaton.accept())).isTrue();
        assertThat(automaton.start().owner()).isSameAs(automaton);
        assertThat(automaton.states()).containsExactly(automaton.start(), automaton.accept());
    }

    @Test
    void testUnconnectedAutomatonAcceptsNothing() {
        Automaton automaton = new Automaton();

        assertThat(automaton.accepts("")).isFalse();
        assertThat(automaton.accepts("a")).isFalse();
    }

    @Test
    void testHandBuiltSequence() {
        Automaton automaton = new Automaton();
        State a = automaton.addState(new SymbolState('a'));
        State b = automaton.addState(new SymbolState('b'));
        automaton.start().link(a).link(b).link(automaton.accept());

        assertThat(automaton.accepts("ab")).isTrue();
        assertThat(automaton.accepts("a")).isFalse();
        assertThat(automaton.accepts("abc")).isFalse();
        assertThat(automaton.accepts("")).isFalse();
    }

    @Test
    void testAlternativePathsAreExplored() {
        Automaton automaton = new Automaton();
        State a = automaton.addState(new SymbolState('a'));
        State b = automaton.addState(new SymbolState('b'));
        automaton.start().link(a).link(automaton.accept());
        automaton.start().link(b).link(automaton.accept());

        assertThat(automaton.accepts("a")).isTrue();
        assertThat(automaton.accepts("b")).isTrue();
        assertThat(automaton.accepts("c")).isFalse();
    }

    @Test
    @Timeout(5)
    void testEpsilonCycleTerminates() {
        Automaton automaton = new Automaton();
        State e1 = automaton.addState(new EpsilonState());
        State e2 = automaton.addState(new EpsilonState());
        automaton.start().link(e1).link(e2).link(e1);

        assertThat(automaton.accepts("")).isFalse();
        assertThat(automaton.accepts("abc")).isFalse();

        e2.link(automaton.accept());
        assertThat(automaton.accepts("")).isTrue();
    }

    @Test
    void testAddStateIsIdempotent() {
        Automaton automaton = new Automaton();
        State a = new SymbolState('a');

        assertThat(automaton.addState(a)).isSameAs(a);
        assertThat(automaton.addState(a)).isSameAs(a);
        assertThat(automaton.size()).isEqualTo(3);
    }

    @Test
    void testStateBelongsToOneAutomaton() {
        Automaton first = new Automaton();
        Automaton second = new Automaton();
        State a = first.addState(new SymbolState('a'));

        assertThatIllegalArgumentException()
            .isThrownBy(() -> second.addState(a))
            .withMessageContaining("another automaton");
    }

    @Test
    void testMacroCannotWrapItsOwnAutomaton() {
        Automaton automaton = new Automaton();
        MacroState macro = new PositiveLookaheadState(automaton);

        assertThatIllegalArgumentException()
            .isThrownBy(() -> automaton.addState(macro))
            .withMessageContaining("own automaton");
    }

    @Test
    void testRemoveStateDetachesEdges() {
        Automaton automaton = new Automaton();
        State a = automaton.addState(new SymbolState('a'));
        automaton.start().link(a).link(automaton.accept());

        automaton.removeState(a);

        assertThat(automaton.states()).doesNotContain(a);
        assertThat(a.owner()).isNull();
        assertThat(automaton.start().next()).isEmpty();
        assertThat(automaton.accept().prev()).isEmpty();
    }

    @Test
    void testRemovedStateCanJoinAnotherAutomaton() {
        Automaton first = new Automaton();
        Automaton second = new Automaton();
        State a = first.addState(new SymbolState('a'));

        first.removeState(a);

        assertThat(second.addState(a).owner()).isSameAs(second);
    }

    @Test
    void testCannotRemovePinnedState() {
        Automaton automaton = new Automaton();

        assertThatIllegalStateException().isThrownBy(() -> automaton.removeState(automaton.start()));
        assertThatIllegalStateException().isThrownBy(() -> automaton.removeState(automaton.accept()));
    }

    @Test
    void testCannotRemoveForeignState() {
        Automaton automaton = new Automaton();

        assertThatIllegalArgumentException().isThrownBy(() -> automaton.removeState(new EpsilonState()));
    }

    @Test
    void testPinRequiresOwnership() {
        Automaton automaton = new Automaton();
        State owned = automaton.addState(new EpsilonState());

        automaton.pin(owned);

        assertThat(automaton.isPinned(owned)).isTrue();
        assertThatIllegalArgumentException().isThrownBy(() -> automaton.pin(new EpsilonState()));
    }

    @Test
    void testStatesViewIsReadOnly() {
        Automaton automaton = new Automaton();

        assertThatThrownBy(() -> automaton.states().clear())
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void testExecutorRunsInFullMode() {
        Automaton automaton = new AutomatonBuilder().pushState(new SymbolState('a')).finish();

        Executor executor = automaton.executor("a");

        assertThat(executor.mode()).isEqualTo(MatchMode.FULL);
        assertThat(executor.run()).isTrue();
        assertThat(automaton.executor("aa").run()).isFalse();
    }

    @Test
    void testToStringMarksStartAcceptAndRepeats() {
        Automaton automaton = new Automaton();
        State a = automaton.addState(new SymbolState('a'));
        automaton.start().link(a).link(automaton.accept());
        a.link(a);

        String printed = automaton.toString();

        assertThat(printed).contains("[Start]");
        assertThat(printed).contains("[Accept]");
        assertThat(printed).contains("(repeated)");
        assertThat(printed).contains("  Symbol<a>#" + a.id());
    }
}
