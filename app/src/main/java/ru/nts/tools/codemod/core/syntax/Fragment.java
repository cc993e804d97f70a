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

import ru.nts.tools.codemod.core.CodemodErrorCode;
import ru.nts.tools.codemod.core.CodemodException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Replacement or insertion payload: one or more sibling declarations written at column zero.
 * Comments in the fragment travel with the declaration that follows them.
 */
public final class Fragment {

    /**
     * One declaration of a fragment.
     *
     * @param kind     declaration kind
     * @param name     declared name
     * @param text     text including the comments that precede it in the fragment
     * @param coreText statement text alone, used to verify a replacement
     */
    public record Declaration(NodeKind kind, String name, String text, String coreText) {
    }

    private final List<Declaration> declarations;

    private Fragment(List<Declaration> declarations) {
        this.declarations = List.copyOf(declarations);
    }

    /**
     * Parses a fragment. Common indentation and surrounding blank lines are removed first.
     *
     * @throws CodemodException MALFORMED_FRAGMENT if the text does not parse or holds non-declaration statements,
     *                          AMBIGUOUS_KIND if it declares nothing
     */
    public static Fragment parse(String raw) {
        String text = raw == null ? "" : PythonText.canonical(raw);
        if (text.isBlank()) {
            throw new CodemodException(CodemodErrorCode.MALFORMED_FRAGMENT, "reason", "fragment is empty");
        }

        SyntaxTree tree = PythonTreeBuilder.build(text);
        if (tree.isMalformed()) {
            throw new CodemodException(CodemodErrorCode.MALFORMED_FRAGMENT, "reason", tree.syntax().firstError());
        }

        List<SyntaxNode> roots = tree.roots();
        if (roots.stream().noneMatch(SyntaxNode::isDeclaration)) {
            throw new CodemodException(CodemodErrorCode.AMBIGUOUS_KIND, "fragment", firstLine(text));
        }
        for (SyntaxNode node : roots) {
            if (!node.isDeclaration()) {
                throw new CodemodException(CodemodErrorCode.MALFORMED_FRAGMENT,
                        Map.of("reason", "fragment contains a non-declaration statement", "statement", firstLine(tree.text(node))));
            }
        }

        List<Declaration> declarations = new ArrayList<>();
        int segmentStart = 0;
        for (SyntaxNode node : roots) {
            String withComments = PythonText.trimBlankLines(tree.slice(Math.min(segmentStart, node.startByte()), node.endByte()));
            declarations.add(new Declaration(node.kind(), node.name(), withComments, tree.text(node)));
            segmentStart = Math.min(tree.lineEnd(node.endByte()) + 1, tree.length());
        }
        return new Fragment(declarations);
    }

    public List<Declaration> declarations() {
        return declarations;
    }

    public Declaration first() {
        return declarations.get(0);
    }

    /**
     * Declaration substituted for the target: the one named like the target (and of the requested kind),
     * or the only declaration of a single-declaration fragment.
     */
    public Optional<Declaration> primaryFor(String name, NodeKind kind) {
        for (Declaration declaration : declarations) {
            if (declaration.name().equals(name) && (kind == null || declaration.kind() == kind)) {
                return Optional.of(declaration);
            }
        }
        if (declarations.size() == 1 && (kind == null || declarations.get(0).kind() == kind)) {
            return Optional.of(declarations.get(0));
        }
        return Optional.empty();
    }

    /**
     * Full fragment text in declaration order.
     */
    public String text() {
        StringBuilder sb = new StringBuilder();
        for (Declaration declaration : declarations) {
            if (sb.length() > 0) sb.append("\n\n");
            sb.append(declaration.text());
        }
        return sb.toString();
    }

    private static String firstLine(String text) {
        int nl = text.indexOf('\n');
        return nl < 0 ? text : text.substring(0, nl);
    }
}
