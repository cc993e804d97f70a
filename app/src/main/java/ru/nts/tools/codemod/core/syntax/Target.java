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
 * Declaration addressed by an edit.
 *
 * @param path dotted path of the declaration
 * @param kind expected kind; {@code null} means "infer from the fragment" (or any kind for deletes)
 */
public record Target(LexicalPath path, NodeKind kind) {

    public Target {
        if (kind != null && !kind.isDeclaration()) {
            throw new IllegalArgumentException("Target kind must be a declaration kind: " + kind);
        }
    }

    public static Target of(String dotted) {
        return new Target(LexicalPath.parse(dotted), null);
    }

    public String name() {
        return path.name();
    }

    public Target withKind(NodeKind inferred) {
        return new Target(path, inferred);
    }

    @Override
    public String toString() {
        return path.toString();
    }
}
