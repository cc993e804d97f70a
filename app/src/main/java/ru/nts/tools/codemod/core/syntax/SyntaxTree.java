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

import ru.nts.tools.codemod.core.treesitter.SyntaxChecker.SyntaxCheckResult;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Ordered, nested statement model of one Python module.
 * Nodes live in a flat arena; nesting is expressed through parent-owned child index lists.
 * A tree is built for a single edit and discarded after the edited text is serialized.
 */
public final class SyntaxTree {

    private final String source;
    private final byte[] bytes;
    private final List<SyntaxNode> arena;
    private final List<Integer> roots;
    private final SyntaxCheckResult syntax;

    SyntaxTree(String source, List<SyntaxNode> arena, List<Integer> roots, SyntaxCheckResult syntax) {
        this.source = source;
        this.bytes = source.getBytes(StandardCharsets.UTF_8);
        this.arena = List.copyOf(arena);
        this.roots = List.copyOf(roots);
        this.syntax = syntax;
    }

    public String source() {
        return source;
    }

    public SyntaxNode node(int index) {
        return arena.get(index);
    }

    public List<SyntaxNode> nodes() {
        return arena;
    }

    /**
     * Module-level statements in source order.
     */
    public List<SyntaxNode> roots() {
        return roots.stream().map(arena::get).toList();
    }

    /**
     * Statements of a scope body, or module-level statements for {@link SyntaxNode#MODULE}.
     */
    public List<SyntaxNode> children(int scope) {
        if (scope == SyntaxNode.MODULE) {
            return roots();
        }
        return arena.get(scope).children().stream().map(arena::get).toList();
    }

    /**
     * Statements of a scope body including those in the branches of its compound statements,
     * without descending into nested classes and defs.
     */
    public List<SyntaxNode> members(int scope) {
        List<SyntaxNode> result = new ArrayList<>();
        collectMembers(children(scope), result);
        return result;
    }

    private void collectMembers(List<SyntaxNode> statements, List<SyntaxNode> into) {
        for (SyntaxNode statement : statements) {
            into.add(statement);
            if (!statement.kind().isScope()) {
                collectMembers(children(statement.index()), into);
            }
        }
    }

    /**
     * Statements of the body block holding the node, the node itself included, in source order.
     */
    public List<SyntaxNode> siblings(SyntaxNode node) {
        return arena.stream().filter(n -> n.block() == node.block()).toList();
    }

    /**
     * Names of the scopes enclosing the node, outermost first.
     */
    public List<String> chainOf(SyntaxNode node) {
        List<String> chain = new ArrayList<>();
        int current = node.parent();
        while (current != SyntaxNode.MODULE) {
            SyntaxNode scope = arena.get(current);
            chain.add(0, scope.name());
            current = scope.parent();
        }
        return chain;
    }

    public SyntaxCheckResult syntax() {
        return syntax;
    }

    public boolean isMalformed() {
        return syntax.hasErrors();
    }

    public int length() {
        return bytes.length;
    }

    /**
     * Text between two byte offsets.
     */
    public String slice(int start, int end) {
        return new String(bytes, start, end - start, StandardCharsets.UTF_8);
    }

    /**
     * Statement text without attached comments, decorators included.
     */
    public String text(SyntaxNode node) {
        return slice(node.startByte(), node.endByte());
    }

    /**
     * Offset of the first byte of the line containing {@code offset}.
     */
    public int lineStart(int offset) {
        int i = Math.min(offset, bytes.length);
        while (i > 0 && bytes[i - 1] != '\n') {
            i--;
        }
        return i;
    }

    /**
     * Offset of the line break ending the line containing {@code offset}, or the end of the source.
     */
    public int lineEnd(int offset) {
        int i = offset;
        while (i < bytes.length && bytes[i] != '\n') {
            i++;
        }
        return i;
    }

    /**
     * Whether the statement is the only code on its lines (trailing comments allowed).
     */
    public boolean ownsLines(SyntaxNode node) {
        int start = lineStart(node.triviaStart());
        for (int i = start; i < node.triviaStart(); i++) {
            if (bytes[i] != ' ' && bytes[i] != '\t') {
                return false;
            }
        }
        int end = lineEnd(node.endByte());
        for (int i = node.endByte(); i < end; i++) {
            byte b = bytes[i];
            if (b == '#') {
                return true;
            }
            if (b != ' ' && b != '\t' && b != '\r' && b != ';') {
                return false;
            }
        }
        return true;
    }

    /**
     * Whether the byte range holds only whitespace.
     */
    public boolean isBlank(int start, int end) {
        for (int i = start; i < end; i++) {
            byte b = bytes[i];
            if (b != ' ' && b != '\t' && b != '\r' && b != '\n') {
                return false;
            }
        }
        return true;
    }

    /**
     * Applies non-overlapping byte-range edits and returns the resulting text.
     */
    public String apply(List<SourceEdit> edits) {
        List<SourceEdit> ordered = new ArrayList<>(edits);
        ordered.sort(Comparator.comparingInt(SourceEdit::start).reversed());
        byte[] result = bytes;
        int previousStart = Integer.MAX_VALUE;
        for (SourceEdit edit : ordered) {
            if (edit.end() > previousStart) {
                throw new IllegalStateException("Overlapping edits at offset " + edit.start());
            }
            byte[] replacement = edit.replacement().getBytes(StandardCharsets.UTF_8);
            byte[] next = new byte[result.length - (edit.end() - edit.start()) + replacement.length];
            System.arraycopy(result, 0, next, 0, edit.start());
            System.arraycopy(replacement, 0, next, edit.start(), replacement.length);
            System.arraycopy(result, edit.end(), next, edit.start() + replacement.length, result.length - edit.end());
            result = next;
            previousStart = edit.start();
        }
        return new String(result, StandardCharsets.UTF_8);
    }
}
