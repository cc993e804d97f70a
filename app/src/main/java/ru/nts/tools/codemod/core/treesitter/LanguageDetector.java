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

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Определяет язык исходного файла по расширению или shebang.
 * Структурные правки поддерживаются только для python; остальные языки распознаются,
 * чтобы отказать в правке явно, а не разобрать файл чужой грамматикой.
 */
public final class LanguageDetector {

    public static final String PYTHON = "python";

    private LanguageDetector() {}

    private static final Map<String, String> EXTENSION_MAP = Map.ofEntries(
            Map.entry("py", PYTHON),
            Map.entry("pyi", PYTHON),
            Map.entry("pyw", PYTHON),

            Map.entry("java", "java"),
            Map.entry("kt", "kotlin"),
            Map.entry("js", "javascript"),
            Map.entry("ts", "typescript"),
            Map.entry("go", "go"),
            Map.entry("rs", "rust"),
            Map.entry("c", "c"),
            Map.entry("cpp", "cpp"),
            Map.entry("cs", "csharp"),
            Map.entry("php", "php"),
            Map.entry("rb", "ruby"),
            Map.entry("sh", "shell")
    );

    /**
     * Определяет язык по пути к файлу.
     *
     * @param path путь к файлу
     * @return идентификатор языка или empty, если расширение неизвестно
     */
    public static Optional<String> detect(Path path) {
        if (path == null || path.getFileName() == null) {
            return Optional.empty();
        }

        String fileName = path.getFileName().toString();
        int dotIndex = fileName.lastIndexOf('.');
        if (dotIndex < 0 || dotIndex == fileName.length() - 1) {
            return Optional.empty();
        }

        String extension = fileName.substring(dotIndex + 1).toLowerCase();
        return Optional.ofNullable(EXTENSION_MAP.get(extension));
    }

    /**
     * Определяет язык по пути к файлу и содержимому (для скриптов без расширения).
     *
     * @param path путь к файлу
     * @param content содержимое файла
     * @return идентификатор языка или empty
     */
    public static Optional<String> detect(Path path, String content) {
        Optional<String> byExtension = detect(path);
        if (byExtension.isPresent()) {
            return byExtension;
        }

        if (content != null && content.startsWith("#!")) {
            String firstLine = content.lines().findFirst().orElse("");
            if (firstLine.contains("python")) {
                return Optional.of(PYTHON);
            }
            if (firstLine.contains("sh")) {
                return Optional.of("shell");
            }
        }
        return Optional.empty();
    }

    /**
     * Проверяет, можно ли править файл структурно.
     * Файлы без расширения и без shebang считаются python-модулями.
     */
    public static boolean isEditable(Path path, String content) {
        return detect(path, content).map(PYTHON::equals).orElse(true);
    }
}
