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
import com.axonops.libnfa.nfa.AnyState;
import com.axonops.libnfa.nfa.LambdaState;
import com.axonops.libnfa.nfa.RangeState;
import com.axonops.libnfa.nfa.State;
import com.axonops.libnfa.nfa.SymbolState;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.IntPredicate;
import java.util.function.Supplier;

/**
 * Recursive-descent parser from pattern text to a {@link RegexNode} tree.
 *
 * <pre>
 * R := E ('|' E)*        alternation
 * E := T*                concatenation
 * T := F Q*              quantified factor
 * F := atom | '(' R ')' | '(?:' R ')' | '(?=' R ')' | '(?!' R ')' | class
 * Q := '*' | '+' | '?' | '{n}' | '{n,}' | '{n,m}'   (optionally followed by a lazy '?')
 * </pre>
 *
 * <p>One parser instance handles one pattern.
 */
final class RegexParser {

    /** Largest bound accepted in {@code {n,m}}. */
    static final int MAX_REPEAT = 1000;

    /** Parenthesis nesting at which parsing gives up rather than recurse further. */
    static final int MAX_NESTING = 256;

    /** Largest number of atoms a pattern may expand to once repetitions are unrolled. */
    static final long MAX_EXPANDED_ATOMS = 100_000;

    private final String pattern;
    private final Map<RegexNode, Long> weights = new IdentityHashMap<>();
    private int pos;
    private int nesting;

    RegexParser(String pattern) {
        this.pattern = pattern;
    }

    RegexNode parse() {
        RegexNode root = parseAlternation();
        if (pos < pattern.length()) {
            // parseSequence only stops early on ')'
            throw error("unbalanced parenthesis at offset " + pos);
        }
        return root;
    }

    private RegexNode parseAlternation() {
        List<RegexNode> alternatives = new ArrayList<>();
        alternatives.add(parseSequence());
        while (peekIs('|')) {
            pos++;
            alternatives.add(parseSequence());
        }
        return alternatives.size() == 1 ? alternatives.get(0) : track(new RegexNode.Alternation(alternatives));
    }

    private RegexNode parseSequence() {
        List<RegexNode> items = new ArrayList<>();
        while (pos < pattern.length() && !peekIs('|') && !peekIs(')')) {
            items.add(parseTerm());
        }
        return items.size() == 1 ? items.get(0) : track(new RegexNode.Concat(items));
    }

    private RegexNode parseTerm() {
        RegexNode node = parseFactor();
        while (pos < pattern.length()) {
            int[] bounds = parseQuantifier();
            if (bounds == null) {
                break;
            }
            node = track(new RegexNode.Repeat(node, bounds[0], bounds[1]));
            if (peekIs('?')) {
                // Lazy and greedy accept the same strings
                pos++;
            }
        }
        return node;
    }

    /**
     * Consumes a quantifier at the current position.
     *
     * @return {@code {min, max}} or null if there is no quantifier here
     */
    private int[] parseQuantifier() {
        char c = pattern.charAt(pos);
        switch (c) {
            case '*':
                pos++;
                return new int[] {0, RegexNode.Repeat.UNBOUNDED};
            case '+':
                pos++;
                return new int[] {1, RegexNode.Repeat.UNBOUNDED};
            case '?':
                pos++;
                return new int[] {0, 1};
            case '{':
                return parseBounds();
            default:
                return null;
        }
    }

    /**
     * Parses {@code {n}}, {@code {n,}} or {@code {n,m}} at the current position. Leaves the
     * position untouched and returns null if the text is not a valid bound, in which case the
     * brace is a literal.
     */
    private int[] parseBounds() {
        int start = pos;
        int cursor = pos + 1;

        int digitsStart = cursor;
        while (cursor < pattern.length() && Character.isDigit(pattern.charAt(cursor))) {
            cursor++;
        }
        if (cursor == digitsStart) {
            return null;
        }
        int min = parseCount(digitsStart, cursor);
        int max = min;

        if (cursor < pattern.length() && pattern.charAt(cursor) == ',') {
            cursor++;
            int maxStart = cursor;
            while (cursor < pattern.length() && Character.isDigit(pattern.charAt(cursor))) {
                cursor++;
            }
            max = cursor == maxStart ? RegexNode.Repeat.UNBOUNDED : parseCount(maxStart, cursor);
        }

        if (cursor >= pattern.length() || pattern.charAt(cursor) != '}') {
            return null;
        }
        if (max != RegexNode.Repeat.UNBOUNDED && max < min) {
            throw error("invalid repetition range " + pattern.substring(start, cursor + 1));
        }

        pos = cursor + 1;
        return new int[] {min, max};
    }

    private int parseCount(int from, int to) {
        while (from < to - 1 && pattern.charAt(from) == '0') {
            from++;
        }
        // Bounded length first so Integer.parseInt cannot overflow
        if (to - from > 4 || Integer.parseInt(pattern.substring(from, to)) > MAX_REPEAT) {
            throw error("repetition count exceeds " + MAX_REPEAT);
        }
        return Integer.parseInt(pattern.substring(from, to));
    }

    private RegexNode parseFactor() {
        char c = pattern.charAt(pos++);
        switch (c) {
            case '(':
                return parseGroup();
            case '[':
                return parseClass();
            case '.':
                return new RegexNode.Atom(AnyState::new, ".");
            case '^':
                return new RegexNode.Atom(() -> new LambdaState(CharClasses.LINE_START, "LineStart"), "^");
            case '$':
                return new RegexNode.Atom(() -> new LambdaState(CharClasses.LINE_END, "LineEnd"), "$");
            case '\\':
                return parseEscape();
            case '*':
            case '+':
            case '?':
                throw error("nothing to repeat at offset " + (pos - 1));
            case '{': {
                int brace = --pos;
                if (parseBounds() != null) {
                    throw error("nothing to repeat at offset " + brace);
                }
                pos++;
                return literal('{');
            }
            default:
                return literal(c);
        }
    }

    private RegexNode parseGroup() {
        int open = pos - 1;
        if (++nesting > MAX_NESTING) {
            throw error("parentheses nested deeper than " + MAX_NESTING);
        }

        boolean lookahead = false;
        boolean negative = false;
        if (peekIs('?')) {
            if (pos + 1 >= pattern.length()) {
                throw error("incomplete group construct at offset " + open);
            }
            char kind = pattern.charAt(pos + 1);
            switch (kind) {
                case ':':
                    break;
                case '=':
                    lookahead = true;
                    break;
                case '!':
                    lookahead = true;
                    negative = true;
                    break;
                default:
                    throw error("unsupported group construct (?" + kind + " at offset " + open);
            }
            pos += 2;
        }

        RegexNode body = parseAlternation();
        if (!peekIs(')')) {
            throw error("missing closing parenthesis for group at offset " + open);
        }
        pos++;
        nesting--;

        return track(lookahead ? new RegexNode.Lookahead(body, negative) : new RegexNode.Group(body));
    }

    private RegexNode parseEscape() {
        if (pos >= pattern.length()) {
            throw error("trailing backslash");
        }
        char c = pattern.charAt(pos++);
        switch (c) {
            case 'd':
                return new RegexNode.Atom(CharClasses::digit, "\\d");
            case 'D':
                return new RegexNode.Atom(CharClasses::notDigit, "\\D");
            case 'w':
                return new RegexNode.Atom(CharClasses::word, "\\w");
            case 'W':
                return new RegexNode.Atom(CharClasses::notWord, "\\W");
            case 's':
                return new RegexNode.Atom(CharClasses::space, "\\s");
            case 'S':
                return new RegexNode.Atom(CharClasses::notSpace, "\\S");
            case 'b':
                return new RegexNode.Atom(() -> new LambdaState(CharClasses.WORD_BOUNDARY, "WordBoundary"), "\\b");
            case 'B':
                return new RegexNode.Atom(
                    () -> new LambdaState(CharClasses.NOT_WORD_BOUNDARY, "NotWordBoundary"), "\\B");
            default:
                return literal(control(c));
        }
    }

    private RegexNode parseClass() {
        int open = pos - 1;
        boolean negated = false;
        if (peekIs('^')) {
            negated = true;
            pos++;
            if (peekIs(']')) {
                pos++;
                return new RegexNode.Atom(AnyState::new, "[^]");
            }
        }
        if (peekIs(']')) {
            throw error("empty character class at offset " + open);
        }

        List<ClassItem> items = new ArrayList<>();
        while (!peekIs(']')) {
            if (pos >= pattern.length()) {
                throw error("unterminated character class at offset " + open);
            }
            items.add(parseClassItem(open));
        }
        pos++;

        String description = pattern.substring(open, pos);
        if (negated) {
            IntPredicate members = anyOf(items);
            return new RegexNode.Atom(
                () -> new LambdaState(CharClasses.notMatching(members), description), description);
        }
        if (items.size() == 1) {
            return new RegexNode.Atom(items.get(0).factory(), description);
        }

        List<RegexNode> alternatives = new ArrayList<>();
        for (ClassItem item : items) {
            alternatives.add(new RegexNode.Atom(item.factory(), description));
        }
        return track(new RegexNode.Group(track(new RegexNode.Alternation(alternatives))));
    }

    private ClassItem parseClassItem(int open) {
        char c = pattern.charAt(pos++);
        char low;
        if (c == '\\') {
            if (pos >= pattern.length()) {
                throw error("unterminated character class at offset " + open);
            }
            char escaped = pattern.charAt(pos++);
            ClassItem named = namedClass(escaped);
            if (named != null) {
                return named;
            }
            low = control(escaped);
        } else {
            low = c;
        }

        // A '-' before ']' is a literal
        if (peekIs('-') && pos + 1 < pattern.length() && pattern.charAt(pos + 1) != ']') {
            pos++;
            char high = pattern.charAt(pos++);
            if (high == '\\') {
                if (pos >= pattern.length()) {
                    throw error("unterminated character class at offset " + open);
                }
                char escaped = pattern.charAt(pos++);
                if (namedClass(escaped) != null) {
                    throw error("invalid range end \\" + escaped + " at offset " + (pos - 2));
                }
                high = control(escaped);
            }
            if (low > high) {
                throw error("reversed range " + low + "-" + high + " at offset " + (pos - 3));
            }
            char min = low;
            char max = high;
            return new ClassItem(() -> new RangeState(min, max), ch -> ch >= min && ch <= max);
        }

        char symbol = low;
        return new ClassItem(() -> new SymbolState(symbol), ch -> ch == symbol);
    }

    private static ClassItem namedClass(char c) {
        switch (c) {
            case 'd':
                return new ClassItem(CharClasses::digit, CharClasses.DIGIT);
            case 'D':
                return new ClassItem(CharClasses::notDigit, CharClasses.DIGIT.negate());
            case 'w':
                return new ClassItem(CharClasses::word, CharClasses.WORD);
            case 'W':
                return new ClassItem(CharClasses::notWord, CharClasses.WORD.negate());
            case 's':
                return new ClassItem(CharClasses::space, CharClasses.SPACE);
            case 'S':
                return new ClassItem(CharClasses::notSpace, CharClasses.SPACE.negate());
            default:
                return null;
        }
    }

    private static IntPredicate anyOf(List<ClassItem> items) {
        IntPredicate result = items.get(0).members();
        for (int i = 1; i < items.size(); i++) {
            result = result.or(items.get(i).members());
        }
        return result;
    }

    private static char control(char c) {
        switch (c) {
            case 't':
                return '\t';
            case 'n':
                return '\n';
            case 'r':
                return '\r';
            case 'f':
                return '\f';
            case 'v':
                return 0x0B;
            case '0':
                return '\0';
            default:
                return c;
        }
    }

    private static RegexNode literal(char c) {
        return new RegexNode.Atom(() -> new SymbolState(c), String.valueOf(c));
    }

    private boolean peekIs(char c) {
        return pos < pattern.length() && pattern.charAt(pos) == c;
    }

    /**
     * Records how many atoms {@code node} unrolls to, given the already recorded weights of its
     * children. Untracked nodes are atoms and weigh 1.
     */
    private RegexNode track(RegexNode node) {
        long weight;
        if (node instanceof RegexNode.Concat) {
            weight = sum(((RegexNode.Concat) node).items());
        } else if (node instanceof RegexNode.Alternation) {
            weight = sum(((RegexNode.Alternation) node).alternatives());
        } else if (node instanceof RegexNode.Group) {
            weight = weightOf(((RegexNode.Group) node).body());
        } else if (node instanceof RegexNode.Lookahead) {
            weight = 1 + weightOf(((RegexNode.Lookahead) node).body());
        } else {
            RegexNode.Repeat repeat = (RegexNode.Repeat) node;
            int copies = repeat.max() == RegexNode.Repeat.UNBOUNDED ? Math.max(repeat.min(), 1) : repeat.max();
            weight = weightOf(repeat.element()) * copies;
        }
        // Children are each within the limit, so the product and sums stay far from overflow
        if (weight > MAX_EXPANDED_ATOMS) {
            throw error("repetition expands to too many states");
        }
        weights.put(node, weight);
        return node;
    }

    private long sum(List<RegexNode> nodes) {
        long total = 0;
        for (RegexNode node : nodes) {
            total += weightOf(node);
        }
        return total;
    }

    private long weightOf(RegexNode node) {
        return weights.getOrDefault(node, 1L);
    }

    private PatternCompilationException error(String message) {
        return new PatternCompilationException(pattern, message);
    }

    private record ClassItem(Supplier<State> factory, IntPredicate members) {
    }
}
