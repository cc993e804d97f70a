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

import java.util.List;

/**
 * One statement of a parsed module, stored in the {@link SyntaxTree} arena.
 * Children and parent are arena indices; the module itself has no node and is addressed as {@link #MODULE}.
 * All offsets are byte offsets into the UTF-8 source.
 *
 * @param index       position in the arena
 * @param kind        statement kind
 * @param name        declared name, {@code null} for non-declarations
 * @param parent      index of the enclosing scope or {@link #MODULE}
 * @param block       start of the body block holding the statement, {@link #MODULE} at module level;
 *                    statements of one {@code if}/{@code else}/{@code try}/{@code with} branch share it
 * @param triviaStart start of the comment lines directly attached above the statement ({@code == startByte} when none)
 * @param startByte   start of the statement, decorators included
 * @param endByte     end of the statement
 * @param startRow    0-based row of {@code startByte}
 * @param indent      whitespace preceding the statement on its first line
 * @param bodyStart   start of the body block for scopes, -1 otherwise
 * @param bodyEnd     end of the body block for scopes, -1 otherwise
 * @param inlineBody  body written on the header line ({@code class A: pass})
 * @param children    statements of the body, in source order; for {@code if}/{@code try}/{@code with}/loop
 *                    statements the statements of all their branches
 */
public record SyntaxNode(int index, NodeKind kind, String name, int parent, int block,
                         int triviaStart, int startByte, int endByte, int startRow,
                         String indent, int bodyStart, int bodyEnd, boolean inlineBody,
                         List<Integer> children) {

    public static final int MODULE = -1;

    public boolean isDeclaration() {
        return kind.isDeclaration();
    }

    public boolean isModuleLevel() {
        return parent == MODULE;
    }

    @Override
    public String toString() {
        return kind.label() + (name != null ? " " + name : "") + " @" + (startRow + 1);
    }
}
