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
 * Kind tag of a statement in the {@link SyntaxTree} arena.
 * {@link #CONTAINER}, {@link #CALLABLE} and {@link #BINDING} are declarations;
 * the remaining kinds only matter for header and insertion-point detection.
 */
public enum NodeKind {
    /** {@code class} definition. */
    CONTAINER,
    /** {@code def} / {@code async def} definition. */
    CALLABLE,
    /**
     * Assignment to a single name: {@code NAME = value} or {@code NAME: type = value}.
     * A chained assignment {@code a = b = 1} is one binding named after its first target ({@code a});
     * the other targets cannot be addressed.
     */
    BINDING,
    /** {@code import} / {@code from ... import}. */
    IMPORT,
    /** {@code if __name__ == "__main__":} entry-point block. */
    GUARD,
    /** Any other executable statement. */
    STATEMENT;

    public boolean isDeclaration() {
        return this == CONTAINER || this == CALLABLE || this == BINDING;
    }

    /**
     * Whether declarations can be nested inside a node of this kind.
     */
    public boolean isScope() {
        return this == CONTAINER || this == CALLABLE;
    }

    /**
     * Whether this node ends the module header region.
     */
    public boolean endsHeader() {
        return this == CONTAINER || this == CALLABLE || this == GUARD;
    }

    public String label() {
        return switch (this) {
            case CONTAINER -> "class";
            case CALLABLE -> "def";
            case BINDING -> "assignment";
            case IMPORT -> "import";
            case GUARD -> "guard";
            case STATEMENT -> "statement";
        };
    }
}
