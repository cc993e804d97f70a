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
package ru.nts.tools.codemod.core.treesitter;

import org.treesitter.TSNode;
import org.treesitter.TSTree;

import java.util.ArrayList;
import java.util.List;

/**
 * Проверка синтаксиса через tree-sitter AST.
 * Ищет ERROR и MISSING узлы в дереве разбора.
 */
public final class SyntaxChecker {

    private static final int MAX_ERRORS = 5;

    private SyntaxChecker() {}

    public record SyntaxError(int line, int column, String message, String context) {

        @Override
        public String toString() {
            return line + ":" + column + " " + message + (context.isEmpty() ? "" : " [" + context + "]");
        }
    }

    public record SyntaxCheckResult(List<SyntaxError> errors) {
        public boolean hasErrors() { return !errors.isEmpty(); }
        public int errorCount() { return errors.size(); }

        /**
         * Первая ошибка в виде строки (для контекста исключений).
         */
        public String firstError() {
            return errors.isEmpty() ? "" : errors.get(0).toString();
        }
    }

    /**
     * Проверяет уже разобранное дерево.
     *
     * @param tree дерево разбора
     * @param content исходный текст, по которому построено дерево
     * @return результат проверки
     */
    public static SyntaxCheckResult check(TSTree tree, String content) {
        String[] lines = content.split("\n", -1);
        List<SyntaxError> errors = new ArrayList<>();
        collectErrors(tree.getRootNode(), lines, errors);
        return new SyntaxCheckResult(List.copyOf(errors));
    }

    /**
     * Разбирает и проверяет python-код.
     */
    public static SyntaxCheckResult checkPython(String content) {
        TSTree tree = TreeSitterManager.getInstance().parsePython(content);
        return check(tree, content);
    }

    private static void collectErrors(TSNode node, String[] lines, List<SyntaxError> errors) {
        if (errors.size() >= MAX_ERRORS) return;

        if (node.getType().equals("ERROR") || node.isMissing()) {
            int line = node.getStartPoint().getRow() + 1; // tree-sitter: 0-based -> 1-based
            int column = node.getStartPoint().getColumn() + 1;

            String message;
            if (node.isMissing()) {
                message = "Missing expected syntax: " + node.getType();
            } else {
                TSNode parent = node.getParent();
                String parentType = (parent != null && !parent.isNull()) ? parent.getType() : "unknown";
                message = "Syntax error in " + parentType;
            }

            String context = (line - 1 < lines.length) ? lines[line - 1].trim() : "";
            if (context.length() > 80) {
                context = context.substring(0, 80) + "...";
            }

            errors.add(new SyntaxError(line, column, message, context));
            return; // Не рекурсим в ERROR-узлы
        }

        int childCount = node.getChildCount();
        for (int i = 0; i < childCount && errors.size() < MAX_ERRORS; i++) {
            TSNode child = node.getChild(i);
            if (child != null && !child.isNull()) {
                collectErrors(child, lines, errors);
            }
        }
    }
}
