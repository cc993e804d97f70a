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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Scoped lookup of declarations by lexical path.
 * Traversal is depth-first with a stack of enclosing class/def names; a node matches when its name
 * equals the target name and the stack equals the chain exactly. A module-level request therefore
 * never matches a nested declaration of the same name, and every match is reported.
 */
public final class LexicalLocator {

    private LexicalLocator() {}

    /**
     * Finds every declaration at exactly {@code path}.
     *
     * @param tree parsed module
     * @param path target path
     * @param kind required kind, or {@code null} for any declaration kind
     * @return matches in source order
     */
    public static List<SyntaxNode> findAll(SyntaxTree tree, LexicalPath path, NodeKind kind) {
        List<SyntaxNode> matches = new ArrayList<>();
        Deque<String> contextStack = new ArrayDeque<>();
        for (SyntaxNode root : tree.roots()) {
            walk(tree, root, path, kind, contextStack, matches);
        }
        return matches;
    }

    public static boolean exists(SyntaxTree tree, LexicalPath path, NodeKind kind) {
        return !findAll(tree, path, kind).isEmpty();
    }

    private static void walk(SyntaxTree tree, SyntaxNode node, LexicalPath path, NodeKind kind,
                             Deque<String> contextStack, List<SyntaxNode> matches) {
        if (node.isDeclaration()
                && node.name().equals(path.name())
                && (kind == null || node.kind() == kind)
                && sameChain(contextStack, path.chain())) {
            matches.add(node);
        }
        if (!node.kind().isScope()) {
            // Ветки if/try/with принадлежат той же области
            for (int child : node.children()) {
                walk(tree, tree.node(child), path, kind, contextStack, matches);
            }
            return;
        }
        if (contextStack.size() >= path.chain().size()) {
            // Глубже цепочки совпадений быть не может
            return;
        }
        contextStack.addLast(node.name());
        for (int child : node.children()) {
            walk(tree, tree.node(child), path, kind, contextStack, matches);
        }
        contextStack.removeLast();
    }

    private static boolean sameChain(Deque<String> contextStack, List<String> chain) {
        if (contextStack.size() != chain.size()) {
            return false;
        }
        int i = 0;
        for (String name : contextStack) {
            if (!name.equals(chain.get(i++))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Resolves a chain to the scope whose body holds the target.
     * Each segment picks the first class or def of that name in the current scope, branches of
     * {@code if}/{@code try}/{@code with} included.
     *
     * @return arena index of the scope, or {@link SyntaxNode#MODULE} for an empty chain
     * @throws CodemodException CONTAINER_NOT_FOUND if a segment does not resolve
     */
    public static int resolveScope(SyntaxTree tree, LexicalPath path) {
        int scope = SyntaxNode.MODULE;
        List<String> resolved = new ArrayList<>();
        for (String segment : path.chain()) {
            resolved.add(segment);
            int next = -2;
            for (SyntaxNode child : tree.members(scope)) {
                if (child.kind().isScope() && child.name().equals(segment)) {
                    next = child.index();
                    break;
                }
            }
            if (next == -2) {
                throw new CodemodException(CodemodErrorCode.CONTAINER_NOT_FOUND,
                        Map.of("container", String.join(".", resolved), "target", path.toString()));
            }
            scope = next;
        }
        return scope;
    }
}
