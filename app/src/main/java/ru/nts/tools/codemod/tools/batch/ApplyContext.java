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
package ru.nts.tools.codemod.tools.batch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.nts.tools.codemod.core.CodemodErrorCode;
import ru.nts.tools.codemod.core.CodemodException;
import ru.nts.tools.codemod.core.EncodingUtils;
import ru.nts.tools.codemod.core.FileUtils;
import ru.nts.tools.codemod.core.PathSanitizer;
import ru.nts.tools.codemod.core.treesitter.LanguageDetector;
import ru.nts.tools.codemod.tools.editing.DeclarationEditor;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Контекст применения одного пакета.
 * Создается контроллером на время пакета и передается в каждую операцию; хранит
 * отслеживаемые пути (только они индексируются при коммите), пути, созданные пакетом
 * (они удаляются при автоматическом откате), и накопленное описание изменений.
 */
public class ApplyContext {

    private static final Logger log = LoggerFactory.getLogger(ApplyContext.class);

    private final PathSanitizer sanitizer;
    private final ApplyOptions options;

    private final Set<String> trackedFiles = new LinkedHashSet<>();
    private final Set<String> createdPaths = new LinkedHashSet<>();
    private final List<String> descriptions = new ArrayList<>();

    public ApplyContext(PathSanitizer sanitizer, ApplyOptions options) {
        this.sanitizer = sanitizer;
        this.options = options;
    }

    public ApplyOptions options() {
        return options;
    }

    public Path root() {
        return sanitizer.getRoot();
    }

    /**
     * Разрешает путь операции внутри корня.
     *
     * @throws CodemodException PATH_OUTSIDE_ROOT
     */
    public Path resolve(String path) {
        return sanitizer.sanitize(path);
    }

    public String relative(Path path) {
        return sanitizer.relativize(path);
    }

    /**
     * Добавляет путь в набор индексируемых при коммите.
     */
    public void track(Path path) {
        trackedFiles.add(relative(path));
    }

    /**
     * Запоминает путь, который сейчас будет создан. Запоминается самый верхний отсутствующий
     * предок, чтобы откат убрал и созданные вместе с файлом директории.
     */
    public void recordCreation(Path path) {
        if (Files.exists(path)) {
            return;
        }
        Path top = path;
        Path parent = path.getParent();
        while (parent != null && !parent.equals(root()) && !Files.exists(parent)) {
            top = parent;
            parent = parent.getParent();
        }
        createdPaths.add(relative(top));
    }

    public void describe(String text) {
        descriptions.add(text);
    }

    /**
     * Накопленное описание, строки описаний через перевод строки; пустая строка, если описаний не было.
     */
    public String description() {
        return String.join("\n", descriptions);
    }

    public Set<String> trackedFiles() {
        return Collections.unmodifiableSet(trackedFiles);
    }

    public Set<String> createdPaths() {
        return Collections.unmodifiableSet(createdPaths);
    }

    /**
     * Читает исходник с определением кодировки.
     *
     * @throws CodemodException FILE_NOT_FOUND, IO_ERROR
     */
    public EncodingUtils.TextFileContent readText(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new CodemodException(CodemodErrorCode.FILE_NOT_FOUND, "path", relative(file));
        }
        try {
            return EncodingUtils.readTextFile(file);
        } catch (NoSuchFileException e) {
            throw new CodemodException(CodemodErrorCode.FILE_NOT_FOUND, Map.of("path", relative(file)), e);
        } catch (IOException e) {
            throw ioError(file, e);
        }
    }

    /**
     * Записывает файл в указанной кодировке и отмечает его как отслеживаемый.
     */
    public void writeText(Path file, String content, Charset charset) {
        recordCreation(file);
        try {
            FileUtils.safeWrite(file, content, charset != null ? charset : StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw ioError(file, e);
        }
        track(file);
        log.debug("Wrote {}", relative(file));
    }

    /**
     * Редактор деклараций для python-файла.
     *
     * @throws CodemodException UNSUPPORTED_LANGUAGE для файлов других языков
     */
    public DeclarationEditor editor(Path file, String content) {
        if (!LanguageDetector.isEditable(file, content)) {
            throw new CodemodException(CodemodErrorCode.UNSUPPORTED_LANGUAGE, "path", relative(file));
        }
        return new DeclarationEditor(relative(file));
    }

    public CodemodException ioError(Path path, IOException e) {
        return new CodemodException(CodemodErrorCode.IO_ERROR,
                Map.of("path", relative(path), "reason", String.valueOf(e.getMessage())), e);
    }
}
