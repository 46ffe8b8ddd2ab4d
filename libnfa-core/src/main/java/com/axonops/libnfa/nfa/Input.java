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

import java.util.Objects;

/**
 * Immutable read cursor over a sequence of input symbols.
 *
 * <p>Advancing never mutates the cursor, it returns a new one. This lets the matchers keep one
 * cursor per pending visit without copying the underlying text.
 *
 * <p>Reading past the end yields {@link #TERMINAL}, the alphabet's end-of-input sentinel.
 *
 * @since 1.0.0
 */
public final class Input {

    /** Terminal symbol returned when reading past the end of the input. */
    public static final char TERMINAL = '\0';

    private final CharSequence text;
    private final int position;

    private Input(CharSequence text, int position) {
        this.text = text;
        this.position = position;
    }

    /**
     * Creates a cursor at the beginning of the given text.
     *
     * @param text input symbols
     * @return cursor at offset 0
     */
    public static Input of(CharSequence text) {
        return of(text, 0);
    }

    /**
     * Creates a cursor at the given offset.
     *
     * @param text input symbols
     * @param position offset in {@code [0, text.length()]}
     * @return cursor at {@code position}
     * @throws IndexOutOfBoundsException if position is out of range
     */
    public static Input of(CharSequence text, int position) {
        Objects.requireNonNull(text, "text cannot be null");
        Objects.checkFromToIndex(position, text.length(), text.length());
        return new Input(text, position);
    }

    /**
     * Returns the symbol under the cursor, or {@link #TERMINAL} at the end.
     */
    public char peek() {
        return position < text.length() ? text.charAt(position) : TERMINAL;
    }

    /**
     * Returns the symbol just before the cursor, or {@link #TERMINAL} at offset 0.
     */
    public char previous() {
        return position > 0 ? text.charAt(position - 1) : TERMINAL;
    }

    /**
     * Returns true if every symbol has been consumed.
     */
    public boolean isEof() {
        return position >= text.length();
    }

    /**
     * Returns a cursor moved forward by {@code count} symbols.
     *
     * @param count symbols to skip (0 returns this cursor)
     * @return advanced cursor
     */
    public Input advance(int count) {
        if (count == 0) {
            return this;
        }
        if (count < 0 || position + count > text.length()) {
            throw new IllegalArgumentException("Cannot advance " + count + " symbols from offset "
                + position + " of " + text.length());
        }
        return new Input(text, position + count);
    }

    public int position() {
        return position;
    }

    public int remaining() {
        return text.length() - position;
    }

    public CharSequence text() {
        return text;
    }

    @Override
    public String toString() {
        return "Input[" + position + "/" + text.length() + "]";
    }
}
