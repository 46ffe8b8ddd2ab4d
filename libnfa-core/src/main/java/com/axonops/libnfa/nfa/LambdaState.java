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
 * State whose condition is an arbitrary caller-supplied predicate.
 *
 * <p>Lets a pattern compiler express conditions the fixed variants cannot, such as {@code \d},
 * {@code \w} or word boundaries.
 *
 * @since 1.0.0
 */
public final class LambdaState extends State {

    private final StatePredicate predicate;
    private final String name;

    public LambdaState(StatePredicate predicate) {
        this(predicate, "");
    }

    /**
     * @param predicate condition to evaluate on enter
     * @param name name used in display output
     */
    public LambdaState(StatePredicate predicate, String name) {
        this.predicate = Objects.requireNonNull(predicate, "predicate cannot be null");
        this.name = Objects.requireNonNull(name, "name cannot be null");
    }

    public String name() {
        return name;
    }

    @Override
    public int enter(Input input, int consumed) {
        int read = predicate.test(input, consumed);
        if (read > 1 || (read == 1 && input.isEof())) {
            throw new IllegalStateException("NFA: Lambda " + displayName()
                + " reported " + read + " symbols consumed at offset " + input.position());
        }
        return read < 0 ? REJECTED : read;
    }

    @Override
    protected String label() {
        return "Lambda<" + name + ">";
    }
}
