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
 * Outcome of a {@link DeclarationEditor} call.
 *
 * @param content    serialized module text (unchanged source for {@link EditState#NOT_FOUND})
 * @param state      terminal state of the edit
 * @param matchCount declarations found at the target path before the edit
 * @param replaced   true when existing declarations were substituted, false when the fragment was inserted
 * @param fallback   true when the delete-then-insert path produced the result
 */
public record EditResult(String content, EditState state, int matchCount, boolean replaced, boolean fallback) {

    public boolean isFound() {
        return state != EditState.NOT_FOUND;
    }

    static EditResult notFound(String source) {
        return new EditResult(source, EditState.NOT_FOUND, 0, false, false);
    }
}
