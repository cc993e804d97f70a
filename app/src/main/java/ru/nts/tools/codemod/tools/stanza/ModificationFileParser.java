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
package ru.nts.tools.codemod.tools.stanza;

import ru.nts.tools.codemod.core.CodemodErrorCode;
import ru.nts.tools.codemod.core.CodemodException;
import ru.nts.tools.codemod.core.EncodingUtils;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Разбор файла описания пакета.
 *
 * <pre>
 * MMM create_file MMM
 * src/app.py
 * &#64;&#64;&#64;&#64;&#64;&#64;
 * print("hello")
 * MMM move_file MMM
 * ...
 * </pre>
 *
 * Заголовок {@code MMM <operation> MMM} открывает блок; строка ровно {@code @@@@@@} разделяет секции
 * блока. Строка, начинающаяся с {@code \@@@@@@}, означает литерал без обратной косой черты.
 * У каждой секции снимается ровно один завершающий перевод строки. Текст до первого заголовка игнорируется.
 */
public final class ModificationFileParser {

    private static final Pattern HEADER = Pattern.compile("^MMM\\s+(\\w+)\\s+MMM\\s*$");
    private static final String SEPARATOR = "@@@@@@";
    private static final String ESCAPED_SEPARATOR = "\\" + SEPARATOR;

    /**
     * Один блок описания.
     *
     * @param operation имя операции из заголовка
     * @param sections  секции в исходном порядке
     * @param line      номер строки заголовка (с 1)
     */
    public record Stanza(String operation, List<String> sections, int line) {

        public Stanza {
            sections = List.copyOf(sections);
        }

        public String section(int index) {
            return sections.get(index);
        }

        public int size() {
            return sections.size();
        }
    }

    private ModificationFileParser() {}

    public static List<Stanza> parse(Path file) throws IOException {
        return parse(EncodingUtils.readTextFile(file).content());
    }

    /**
     * @throws CodemodException INVALID_STANZA, если в тексте нет ни одного блока
     */
    public static List<Stanza> parse(String text) {
        List<String> lines = splitKeepingNewlines(text.replace("\r\n", "\n"));
        List<Stanza> stanzas = new ArrayList<>();

        int i = 0;
        while (i < lines.size()) {
            Matcher header = HEADER.matcher(stripNewline(lines.get(i)));
            if (!header.matches()) {
                i++;
                continue;
            }
            String operation = header.group(1);
            int headerLine = i + 1;
            i++;

            List<String> block = new ArrayList<>();
            while (i < lines.size() && !HEADER.matcher(stripNewline(lines.get(i))).matches()) {
                block.add(lines.get(i));
                i++;
            }
            stanzas.add(new Stanza(operation, splitSections(block), headerLine));
        }

        if (stanzas.isEmpty()) {
            throw new CodemodException(CodemodErrorCode.INVALID_STANZA,
                    Map.of("operation", "(none)", "expected", "at least one 'MMM <operation> MMM' header"));
        }
        return stanzas;
    }

    static List<String> splitSections(List<String> block) {
        List<StringBuilder> sections = new ArrayList<>();
        sections.add(new StringBuilder());
        for (String line : block) {
            if (line.equals(SEPARATOR + "\n") || line.equals(SEPARATOR)) {
                sections.add(new StringBuilder());
                continue;
            }
            String content = line.startsWith(ESCAPED_SEPARATOR) ? line.substring(1) : line;
            sections.get(sections.size() - 1).append(content);
        }
        List<String> result = new ArrayList<>(sections.size());
        for (StringBuilder section : sections) {
            String text = section.toString();
            result.add(text.endsWith("\n") ? text.substring(0, text.length() - 1) : text);
        }
        return result;
    }

    /**
     * Принимает true/1/yes/y и false/0/no/n без учета регистра; прочий непустой текст считается true.
     */
    public static boolean parseBool(String value) {
        String s = value.strip().toLowerCase();
        switch (s) {
            case "true", "1", "yes", "y":
                return true;
            case "false", "0", "no", "n", "":
                return false;
            default:
                return true;
        }
    }

    private static List<String> splitKeepingNewlines(String text) {
        List<String> lines = new ArrayList<>();
        int start = 0;
        while (start < text.length()) {
            int nl = text.indexOf('\n', start);
            int end = nl < 0 ? text.length() : nl + 1;
            lines.add(text.substring(start, end));
            start = end;
        }
        return lines;
    }

    private static String stripNewline(String line) {
        return line.endsWith("\n") ? line.substring(0, line.length() - 1) : line;
    }
}
