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

import com.axonops.libnfa.api.PatternCompilationException;
import com.axonops.libnfa.nfa.Automaton;
import com.axonops.libnfa.nfa.BuilderException;
import com.axonops.libnfa.nfa.Optimizer;
import com.axonops.libnfa.util.PatternHasher;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles regular-expression text into an {@link Automaton}.
 *
 * <p>Supported syntax:
 * <ul>
 *   <li>literals, {@code .}, escapes {@code \d \D \w \W \s \S \b \B \t \n \r \f \v \0}
 *       (any other escaped character is literal)</li>
 *   <li>anchors {@code ^} and {@code $}</li>
 *   <li>classes {@code [abc]}, {@code [a-z0-9_]}, {@code [^...]}, {@code [^]}</li>
 *   <li>groups {@code (...)} and {@code (?:...)}, alternation {@code |}</li>
 *   <li>lookahead {@code (?=...)} and {@code (?!...)}</li>
 *   <li>quantifiers {@code * + ? {n} {n,} {n,m}}, which may be stacked ({@code a{3}+});
 *       a trailing lazy {@code ?} is accepted and ignored</li>
 * </ul>
 *
 * <p>Classes are ASCII. Matching is whole-string; there are no capture groups.
 *
 * <p>Thread-Safe: stateless, each call uses its own parser.
 *
 * @since 1.0.0
 */
public final class RegexCompiler {

    private static final Logger logger = LoggerFactory.getLogger(RegexCompiler.class);

    private RegexCompiler() {
    }

    /**
     * Compiles a pattern without optimizing the result.
     *
     * @param pattern regex text
     * @return automaton accepting exactly the strings the pattern matches
     * @throws PatternCompilationException if the pattern is malformed
     */
    public static Automaton compile(String pattern) {
        Objects.requireNonNull(pattern, "pattern cannot be null");

        RegexNode tree = new RegexParser(pattern).parse();
        try {
            Automaton automaton = RegexEmitter.emit(tree);
            logger.trace("NFA: Compiled pattern - hash: {}, states: {}", PatternHasher.hash(pattern), automaton.size());
            return automaton;
        } catch (BuilderException e) {
            throw new PatternCompilationException(pattern, e.getMessage(), e);
        }
    }

    /**
     * Compiles a pattern, optionally running {@link Optimizer#optimize()} on the result.
     */
    public static Automaton compile(String pattern, boolean optimize) {
        Automaton automaton = compile(pattern);
        if (optimize) {
            new Optimizer(automaton).optimize();
        }
        return automaton;
    }
}
