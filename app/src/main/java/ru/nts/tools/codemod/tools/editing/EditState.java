/*
 * Copyright 2025 Aristo
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
package ru.nts.tools.codemod.tools.editing;

/**
 * Stages of one structural edit of one file.
 * {@code PARSED -> LOCATED -> MUTATED -> SERIALIZED}; a delete without matches ends in {@link #NOT_FOUND},
 * a source or fragment that does not parse ends in {@link #MALFORMED}.
 */
public enum EditState {
    PARSED,
    LOCATED,
    MUTATED,
    SERIALIZED,
    NOT_FOUND,
    MALFORMED;

    public boolean isTerminal() {
        return this == SERIALIZED || this == NOT_FOUND || this == MALFORMED;
    }
}
