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

import org.treesitter.TSNode;
import org.treesitter.TSTree;
import ru.nts.tools.codemod.core.treesitter.SyntaxChecker;
import ru.nts.tools.codemod.core.treesitter.TreeSitterManager;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Builds a {@link SyntaxTree} from tree-sitter-python output.
 * Statement-level nodes of the module and of class/def bodies become arena nodes. Statements in the branches
 * of {@code if}/{@code try}/{@code with}/{@code for}/{@code while} become children of that statement but keep
 * the enclosing class/def as their scope. The body of the entry-point guard stays opaque.
 */
public final class PythonTreeBuilder {

    private static final Set<String> COMPOUND = Set.of(
            "if_statement", "try_statement", "with_statement", "for_statement", "while_statement");
    private static final Set<String> CLAUSES = Set.of(
            "elif_clause", "else_clause", "except_clause", "except_group_clause", "finally_clause");

    private final byte[] bytes;
    private final List<Draft> drafts = new ArrayList<>();

    private PythonTreeBuilder(String source) {
        this.bytes = source.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Parses a module. Syntax errors do not abort the build; callers check {@link SyntaxTree#isMalformed()}.
     */
    public static SyntaxTree build(String source) {
        TSTree tree = TreeSitterManager.getInstance().parsePython(source);
        PythonTreeBuilder builder = new PythonTreeBuilder(source);
        List<Integer> roots = builder.visitBody(tree.getRootNode(), SyntaxNode.MODULE, SyntaxNode.MODULE);

        List<SyntaxNode> arena = new ArrayList<>(builder.drafts.size());
        for (Draft d : builder.drafts) {
            arena.add(new SyntaxNode(d.index, d.kind, d.name, d.parent, d.block, d.triviaStart, d.startByte, d.endByte,
                    d.startRow, d.indent, d.bodyStart, d.bodyEnd, d.inlineBody, List.copyOf(d.children)));
        }
        return new SyntaxTree(source, arena, roots, SyntaxChecker.check(tree, source));
    }

    private List<Integer> visitBody(TSNode body, int parent, int block) {
        List<Integer> statements = new ArrayList<>();
        List<TSNode> pendingComments = new ArrayList<>();
        int lastStatementRow = -1;

        int childCount = body.getChildCount();
        for (int i = 0; i < childCount; i++) {
            TSNode child = body.getChild(i);
            if (child == null || child.isNull()) {
                continue;
            }
            String type = child.getType();

            if (type.equals("comment")) {
                int row = child.getStartPoint().getRow();
                if (row == lastStatementRow) {
                    // Комментарий в конце строки с кодом
                    continue;
                }
                if (!pendingComments.isEmpty()
                        && pendingComments.get(pendingComments.size() - 1).getEndPoint().getRow() != row - 1) {
                    pendingComments.clear();
                }
                pendingComments.add(child);
                continue;
            }
            if (!isStatement(type)) {
                continue;
            }

            int triviaStart = child.getStartByte();
            if (!pendingComments.isEmpty()
                    && pendingComments.get(pendingComments.size() - 1).getEndPoint().getRow() == child.getStartPoint().getRow() - 1) {
                triviaStart = pendingComments.get(0).getStartByte();
            }
            pendingComments.clear();

            statements.add(visitStatement(child, parent, block, triviaStart));
            lastStatementRow = child.getEndPoint().getRow();
        }
        return statements;
    }

    private int visitStatement(TSNode node, int parent, int block, int triviaStart) {
        Draft draft = new Draft();
        draft.index = drafts.size();
        draft.parent = parent;
        draft.block = block;
        draft.triviaStart = triviaStart;
        draft.startByte = node.getStartByte();
        draft.endByte = node.getEndByte();
        draft.startRow = node.getStartPoint().getRow();
        draft.indent = indentAt(draft.startByte);
        drafts.add(draft);

        TSNode definition = node;
        if (node.getType().equals("decorated_definition")) {
            definition = lastChildOfType(node, "function_definition", "class_definition");
        }

        switch (definition == null ? "" : definition.getType()) {
            case "function_definition" -> draft.kind = NodeKind.CALLABLE;
            case "class_definition" -> draft.kind = NodeKind.CONTAINER;
            case "expression_statement" -> draft.kind = classifyExpression(definition, draft);
            case "import_statement", "import_from_statement", "future_import_statement" -> draft.kind = NodeKind.IMPORT;
            case "if_statement" -> draft.kind = isMainGuard(definition) ? NodeKind.GUARD : NodeKind.STATEMENT;
            default -> draft.kind = NodeKind.STATEMENT;
        }

        if (draft.kind.isScope()) {
            TSNode nameNode = firstChildOfType(definition, "identifier");
            draft.name = nameNode != null ? text(nameNode) : "";
            TSNode body = firstChildOfType(definition, "block");
            if (body != null) {
                draft.bodyStart = body.getStartByte();
                draft.bodyEnd = body.getEndByte();
                draft.inlineBody = body.getStartPoint().getRow() == definition.getStartPoint().getRow();
                draft.children.addAll(visitBody(body, draft.index, body.getStartByte()));
            }
        } else if (draft.kind == NodeKind.STATEMENT && definition != null && COMPOUND.contains(definition.getType())) {
            visitBranches(definition, parent, draft.children);
        }
        return draft.index;
    }

    /**
     * Collects statements of every branch block; they stay in the scope {@code parent}.
     */
    private void visitBranches(TSNode compound, int parent, List<Integer> into) {
        int count = compound.getChildCount();
        for (int i = 0; i < count; i++) {
            TSNode child = compound.getChild(i);
            if (child == null || child.isNull()) {
                continue;
            }
            if (child.getType().equals("block")) {
                into.addAll(visitBody(child, parent, child.getStartByte()));
            } else if (CLAUSES.contains(child.getType())) {
                visitBranches(child, parent, into);
            }
        }
    }

    private NodeKind classifyExpression(TSNode statement, Draft draft) {
        if (statement.getChildCount() != 1) {
            return NodeKind.STATEMENT;
        }
        TSNode expression = statement.getChild(0);
        if (!expression.getType().equals("assignment") || expression.getChildCount() == 0) {
            return NodeKind.STATEMENT;
        }
        TSNode left = expression.getChild(0);
        if (!left.getType().equals("identifier")) {
            return NodeKind.STATEMENT;
        }
        draft.name = text(left);
        return NodeKind.BINDING;
    }

    private boolean isMainGuard(TSNode ifStatement) {
        if (ifStatement.getChildCount() < 2) {
            return false;
        }
        TSNode condition = ifStatement.getChild(1);
        if (!condition.getType().equals("comparison_operator")) {
            return false;
        }
        String normalized = text(condition).replaceAll("\\s+", "").replace('\'', '"');
        return normalized.equals("__name__==\"__main__\"") || normalized.equals("\"__main__\"==__name__");
    }

    private static boolean isStatement(String type) {
        return !type.isEmpty() && Character.isLetter(type.charAt(0)) && !type.equals("ERROR");
    }

    private String indentAt(int offset) {
        int start = offset;
        while (start > 0 && bytes[start - 1] != '\n') {
            start--;
        }
        int end = start;
        while (end < bytes.length && (bytes[end] == ' ' || bytes[end] == '\t')) {
            end++;
        }
        return new String(bytes, start, end - start, StandardCharsets.UTF_8);
    }

    private String text(TSNode node) {
        return new String(bytes, node.getStartByte(), node.getEndByte() - node.getStartByte(), StandardCharsets.UTF_8);
    }

    private static TSNode firstChildOfType(TSNode parent, String type) {
        int count = parent.getChildCount();
        for (int i = 0; i < count; i++) {
            TSNode child = parent.getChild(i);
            if (child != null && !child.isNull() && child.getType().equals(type)) {
                return child;
            }
        }
        return null;
    }

    private static TSNode lastChildOfType(TSNode parent, String... types) {
        TSNode found = null;
        int count = parent.getChildCount();
        for (int i = 0; i < count; i++) {
            TSNode child = parent.getChild(i);
            if (child == null || child.isNull()) {
                continue;
            }
            for (String type : types) {
                if (child.getType().equals(type)) {
                    found = child;
                }
            }
        }
        return found;
    }

    private static final class Draft {
        int index;
        NodeKind kind;
        String name;
        int parent;
        int block;
        int triviaStart;
        int startByte;
        int endByte;
        int startRow;
        String indent;
        int bodyStart = -1;
        int bodyEnd = -1;
        boolean inlineBody;
        final List<Integer> children = new ArrayList<>();
    }
}
