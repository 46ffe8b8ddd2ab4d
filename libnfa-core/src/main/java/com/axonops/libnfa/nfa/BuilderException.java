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

import com.axonops.libnfa.api.RegexException;

/**
 * Thrown when the {@link AutomatonBuilder} protocol is misused, e.g. closing a group that was
 * never opened or repeating nothing.
 *
 * @since 1.0.0
 */
public final class BuilderException extends RegexException {

    public BuilderException(String message) {
        super("NFA: Builder error: " + message);
    }
}
