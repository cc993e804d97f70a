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
 * Текстовые утилиты для работы с отступами python-кода.
 */
public final class PythonText {

    private PythonText() {}

    /**
     * Приводит переводы строк к '\n'.
     */
    public static String normalizeNewlines(String text) {
        return text.replace("\r\n", "\n").replace('\r', '\n');
    }

    /**
     * Удаляет общий отступ всех непустых строк (аналог textwrap.dedent).
     */
    public static String dedent(String text) {
        String[] lines = text.split("\n", -1);
        int common = Integer.MAX_VALUE;
        for (String line : lines) {
            if (line.isBlank()) {
                continue;
            }
            int width = 0;
            while (width < line.length() && (line.charAt(width) == ' ' || line.charAt(width) == '\t')) {
                width++;
            }
            common = Math.min(common, width);
        }
        if (common == 0 || common == Integer.MAX_VALUE) {
            return text;
        }
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) sb.append('\n');
            String line = lines[i];
            sb.append(line.isBlank() ? "" : line.substring(common));
        }
        return sb.toString();
    }

    /**
     * Добавляет отступ ко всем непустым строкам.
     *
     * @param skipFirst не трогать первую строку (она вставляется после уже существующего отступа)
     */
    public static String indent(String text, String indent, boolean skipFirst) {
        if (indent.isEmpty()) {
            return text;
        }
        String[] lines = text.split("\n", -1);
        StringBuilder sb = new StringBuilder(text.length() + lines.length * indent.length());
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) sb.append('\n');
            String line = lines[i];
            if (!line.isBlank() && !(skipFirst && i == 0)) {
                sb.append(indent);
            }
            sb.append(line.isBlank() ? "" : line);
        }
        return sb.toString();
    }

    /**
     * Убирает пустые строки в начале и пробельные символы в конце, сохраняя отступ первой строки.
     */
    public static String trimBlankLines(String text) {
        String result = text.stripTrailing();
        int start = 0;
        int lineStart = 0;
        while (start < result.length()) {
            char c = result.charAt(start);
            if (c == '\n') {
                lineStart = start + 1;
            } else if (c != ' ' && c != '\t') {
                break;
            }
            start++;
        }
        return result.substring(lineStart);
    }

    /**
     * Нормализованный вид фрагмента для сравнения: без общего отступа и пустых краев.
     */
    public static String canonical(String text) {
        return trimBlankLines(dedent(normalizeNewlines(text)));
    }
}
