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
package ru.nts.tools.codemod.core.syntax;

/**
 * Replacement of the byte range {@code [start, end)} of a source with new text.
 */
public record SourceEdit(int start, int end, String replacement) {

    public SourceEdit {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid edit range: " + start + ".." + end);
        }
    }

    public static SourceEdit insert(int offset, String text) {
        return new SourceEdit(offset, offset, text);
    }

    public static SourceEdit delete(int start, int end) {
        return new SourceEdit(start, end, "");
    }
}
