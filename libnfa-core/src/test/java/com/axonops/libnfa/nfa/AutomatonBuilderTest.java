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

import static org.assertj.core.api.Assertions.*;

class AutomatonBuilderTest {

    private static State sym(char c) {
        return new SymbolState(c);
    }

    @Test
    void testEmptyBuildAcceptsEmptyInput() {
        Automaton automaton = new AutomatonBuilder().finish();

        assertThat(automaton.accepts("")).isTrue();
        assertThat(automaton.accepts("a")).isFalse();
    }

    @Test
    void testSequence() {
        AutomatonBuilder builder = new AutomatonBuilder();
        State b = sym('b');
        builder.pushState(sym('a')).pushState(b);

        assertThat(builder.cursor()).isSameAs(b);
        Automaton automaton = builder.finish();

        assertThat(automaton.size()).isEqualTo(6);
        assertThat(automaton.accepts("ab")).isTrue();
        assertThat(automaton.accepts("a")).isFalse();
        assertThat(automaton.accepts("ba")).isFalse();
    }

    @Test
    void testBuilderOverExistingAutomaton() {
        Automaton automaton = new Automaton();
        AutomatonBuilder builder = automaton.builder();

        assertThat(builder.automaton()).isSameAs(automaton);
        assertThat(builder.pushState(sym('x')).finish()).isSameAs(automaton);
        assertThat(automaton.accepts("x")).isTrue();
    }

    @Test
    void testBranchAtTopLevel() {
        Automaton automaton = new AutomatonBuilder()
            .pushState(sym('a'))
            .branch()
            .pushState(sym('b'))
            .finish();

        assertThat(automaton.accepts("a")).isTrue();
        assertThat(automaton.accepts("b")).isTrue();
        assertThat(automaton.accepts("ab")).isFalse();
        assertThat(automaton.accepts("")).isFalse();
    }

    @Test
    void testBranchInsideGroup() {
        Automaton automaton = new AutomatonBuilder()
            .beginGroup()
            .pushState(sym('a'))
            .branch()
            .pushState(sym('b'))
            .endGroup()
            .pushState(sym('c'))
            .finish();

        assertThat(automaton.accepts("ac")).isTrue();
        assertThat(automaton.accepts("bc")).isTrue();
        assertThat(automaton.accepts("c")).isFalse();
        assertThat(automaton.accepts("a")).isFalse();
    }

    @Test
    void testEmptyAlternative() {
        Automaton automaton = new AutomatonBuilder()
            .pushState(sym('a'))
            .branch()
            .finish();

        assertThat(automaton.accepts("a")).isTrue();
        assertThat(automaton.accepts("")).isTrue();
    }

    @Test
    void testSkipMakesLastElementOptional() {
        Automaton automaton = new AutomatonBuilder()
            .pushState(sym('a'))
            .skip()
            .pushState(sym('b'))
            .finish();

        assertThat(automaton.accepts("ab")).isTrue();
        assertThat(automaton.accepts("b")).isTrue();
        assertThat(automaton.accepts("aab")).isFalse();
        assertThat(automaton.accepts("a")).isFalse();
    }

    @Test
    void testSkipDoesNotLeakIntoSiblingAlternative() {
        // (a?|b)c
        Automaton automaton = new AutomatonBuilder()
            .beginGroup()
            .pushState(sym('a'))
            .skip()
            .branch()
            .pushState(sym('b'))
            .endGroup()
            .pushState(sym('c'))
            .finish();

        assertThat(automaton.accepts("ac")).isTrue();
        assertThat(automaton.accepts("c")).isTrue();
        assertThat(automaton.accepts("bc")).isTrue();
        assertThat(automaton.accepts("abc")).isFalse();
    }

    @Test
    void testJumpRepeatsLastElement() {
        Automaton automaton = new AutomatonBuilder()
            .pushState(sym('a'))
            .jump()
            .finish();

        assertThat(automaton.accepts("a")).isTrue();
        assertThat(automaton.accepts("aaaa")).isTrue();
        assertThat(automaton.accepts("")).isFalse();
    }

    @Test
    void testJumpThenSkipIsKleeneStar() {
        Automaton automaton = new AutomatonBuilder()
            .pushState(sym('a'))
            .jump()
            .skip()
            .pushState(sym('b'))
            .finish();

        assertThat(automaton.accepts("b")).isTrue();
        assertThat(automaton.accepts("aaab")).isTrue();
        assertThat(automaton.accepts("aaa")).isFalse();
    }

    @Test
    void testRepeatedGroupWithAlternatives() {
        // (ab|c)+
        Automaton automaton = new AutomatonBuilder()
            .beginGroup()
            .pushState(sym('a'))
            .pushState(sym('b'))
            .branch()
            .pushState(sym('c'))
            .endGroup()
            .jump()
            .finish();

        assertThat(automaton.accepts("ab")).isTrue();
        assertThat(automaton.accepts("c")).isTrue();
        assertThat(automaton.accepts("abcab")).isTrue();
        assertThat(automaton.accepts("ccc")).isTrue();
        assertThat(automaton.accepts("")).isFalse();
        assertThat(automaton.accepts("abca")).isFalse();
        assertThat(automaton.accepts("b")).isFalse();
    }

    @Test
    void testEmptyGroup() {
        Automaton automaton = new AutomatonBuilder().beginGroup().endGroup().finish();

        assertThat(automaton.accepts("")).isTrue();
    }

    @Test
    void testGroupDepthLimit() {
        AutomatonBuilder builder = new AutomatonBuilder();
        for (int i = 0; i < AutomatonBuilder.MAX_GROUP_DEPTH; i++) {
            builder.beginGroup();
        }
        assertThat(builder.depth()).isEqualTo(127);

        assertThatThrownBy(builder::beginGroup)
            .isInstanceOf(BuilderException.class)
            .hasMessage("NFA: Builder error: group nesting exceeds 127 levels");
    }

    @Test
    void testDeepGroupsStillBuild() {
        AutomatonBuilder builder = new AutomatonBuilder();
        for (int i = 0; i < AutomatonBuilder.MAX_GROUP_DEPTH; i++) {
            builder.beginGroup();
        }
        builder.pushState(sym('a'));
        for (int i = 0; i < AutomatonBuilder.MAX_GROUP_DEPTH; i++) {
            builder.endGroup();
        }

        assertThat(builder.depth()).isZero();
        assertThat(builder.finish().accepts("a")).isTrue();
    }

    @Test
    void testEndGroupWithoutBegin() {
        assertThatThrownBy(() -> new AutomatonBuilder().endGroup())
            .isInstanceOf(BuilderException.class)
            .hasMessageContaining("without matching beginGroup");
    }

    @Test
    void testJumpNeedsSomethingToRepeat() {
        assertThatThrownBy(() -> new AutomatonBuilder().jump())
            .isInstanceOf(BuilderException.class)
            .hasMessageContaining("nothing to repeat");
        assertThatThrownBy(() -> new AutomatonBuilder().beginGroup().jump())
            .isInstanceOf(BuilderException.class);
        assertThatThrownBy(() -> new AutomatonBuilder().pushState(sym('a')).branch().jump())
            .isInstanceOf(BuilderException.class);
    }

    @Test
    void testSkipNeedsSomethingToMakeOptional() {
        assertThatThrownBy(() -> new AutomatonBuilder().skip())
            .isInstanceOf(BuilderException.class)
            .hasMessageContaining("nothing to make optional");
    }

    @Test
    void testFinishWithOpenGroups() {
        AutomatonBuilder builder = new AutomatonBuilder().beginGroup().pushState(sym('a'));

        assertThatThrownBy(builder::finish)
            .isInstanceOf(BuilderException.class)
            .hasMessageContaining("1 group(s) still open");
        assertThat(builder.isFinished()).isFalse();
    }

    @Test
    void testBuilderIsSingleUse() {
        AutomatonBuilder builder = new AutomatonBuilder().pushState(sym('a'));
        builder.finish();

        assertThat(builder.isFinished()).isTrue();
        assertThatThrownBy(() -> builder.pushState(sym('b')))
            .isInstanceOf(BuilderException.class)
            .hasMessageContaining("already finished");
        assertThatThrownBy(builder::finish).isInstanceOf(BuilderException.class);
    }

    @Test
    void testPushingForeignStateFails() {
        State owned = new Automaton().addState(sym('a'));

        assertThatIllegalArgumentException().isThrownBy(() -> new AutomatonBuilder().pushState(owned));
    }
}
