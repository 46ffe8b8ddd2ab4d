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

import com.axonops.libnfa.nfa.Automaton;
import com.axonops.libnfa.nfa.AutomatonBuilder;
import com.axonops.libnfa.nfa.NegativeLookaheadState;
import com.axonops.libnfa.nfa.PositiveLookaheadState;

/**
 * Reduces a {@link RegexNode} tree to {@link AutomatonBuilder} calls.
 *
 * <p>An atom is pushed directly; any compound element is wrapped in a group so repetition
 * operators apply to it as a unit. Lookahead bodies are emitted into a separate automaton.
 */
final class RegexEmitter {

    private RegexEmitter() {
    }

    static Automaton emit(RegexNode root) {
        AutomatonBuilder builder = new AutomatonBuilder();
        emitBody(builder, root);
        return builder.finish();
    }

    /** Emits the contents of a group (or of the whole pattern), branching between alternatives. */
    private static void emitBody(AutomatonBuilder builder, RegexNode node) {
        if (node instanceof RegexNode.Alternation) {
            RegexNode.Alternation alternation = (RegexNode.Alternation) node;
            for (int i = 0; i < alternation.alternatives().size(); i++) {
                if (i > 0) {
                    builder.branch();
                }
                emitSequence(builder, alternation.alternatives().get(i));
            }
        } else {
            emitSequence(builder, node);
        }
    }

    private static void emitSequence(AutomatonBuilder builder, RegexNode node) {
        if (node instanceof RegexNode.Concat) {
            for (RegexNode item : ((RegexNode.Concat) node).items()) {
                emitTerm(builder, item);
            }
        } else {
            emitTerm(builder, node);
        }
    }

    private static void emitTerm(AutomatonBuilder builder, RegexNode node) {
        if (node instanceof RegexNode.Repeat) {
            emitRepeat(builder, (RegexNode.Repeat) node);
        } else {
            emitElement(builder, node);
        }
    }

    private static void emitRepeat(AutomatonBuilder builder, RegexNode.Repeat repeat) {
        RegexNode element = repeat.element();
        int min = repeat.min();
        int max = repeat.max();

        if (max == RegexNode.Repeat.UNBOUNDED) {
            if (min == 0) {
                emitElement(builder, element);
                builder.jump().skip();
                return;
            }
            for (int i = 0; i < min - 1; i++) {
                emitElement(builder, element);
            }
            emitElement(builder, element);
            builder.jump();
            return;
        }

        for (int i = 0; i < min; i++) {
            emitElement(builder, element);
        }
        for (int i = 0; i < max - min; i++) {
            emitElement(builder, element);
            builder.skip();
        }
    }

    private static void emitElement(AutomatonBuilder builder, RegexNode node) {
        if (node instanceof RegexNode.Atom) {
            builder.pushState(((RegexNode.Atom) node).factory().get());
        } else if (node instanceof RegexNode.Lookahead) {
            RegexNode.Lookahead lookahead = (RegexNode.Lookahead) node;
            Automaton sub = emit(lookahead.body());
            builder.pushState(lookahead.negative()
                ? new NegativeLookaheadState(sub)
                : new PositiveLookaheadState(sub));
        } else if (node instanceof RegexNode.Group) {
            builder.beginGroup();
            emitBody(builder, ((RegexNode.Group) node).body());
            builder.endGroup();
        } else {
            builder.beginGroup();
            emitBody(builder, node);
            builder.endGroup();
        }
    }
}
