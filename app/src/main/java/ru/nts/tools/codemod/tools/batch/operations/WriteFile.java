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
package ru.nts.tools.codemod.tools.batch.operations;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.nts.tools.codemod.core.FileUtils;
import ru.nts.tools.codemod.tools.batch.ApplyContext;
import ru.nts.tools.codemod.tools.batch.Modification;
import ru.nts.tools.codemod.tools.batch.OperationOutcome;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * create_file / update_file: записывает файл целиком, создавая недостающие директории.
 * Существующий файл перезаписывается.
 */
public class WriteFile implements Modification {

    private static final Logger log = LoggerFactory.getLogger(WriteFile.class);

    private final String name;
    private final String path;
    private final String content;
    private final boolean executable;

    private WriteFile(String name, String path, String content, boolean executable) {
        this.name = name;
        this.path = path;
        this.content = content;
        this.executable = executable;
    }

    public static WriteFile create(String path, String content, boolean executable) {
        return new WriteFile("create_file", path, content, executable);
    }

    public static WriteFile update(String path, String content, boolean executable) {
        return new WriteFile("update_file", path, content, executable);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String target() {
        return path;
    }

    @Override
    public OperationOutcome apply(ApplyContext context) {
        Path file = context.resolve(path);
        boolean existed = Files.exists(file);
        context.writeText(file, content, StandardCharsets.UTF_8);
        if (executable) {
            try {
                FileUtils.makeExecutable(file);
            } catch (IOException e) {
                throw context.ioError(file, e);
            }
        }
        log.debug("{} {}{}", existed ? "Overwrote" : "Created", path, executable ? " (executable)" : "");
        return OperationOutcome.applied(name, path, (existed ? "overwritten" : "created") + (executable ? ", executable" : ""));
    }
}
