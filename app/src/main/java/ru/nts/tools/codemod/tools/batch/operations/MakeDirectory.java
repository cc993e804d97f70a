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
import ru.nts.tools.codemod.tools.batch.ApplyContext;
import ru.nts.tools.codemod.tools.batch.Modification;
import ru.nts.tools.codemod.tools.batch.OperationOutcome;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Создает директорию вместе с недостающими родителями; существующая директория не ошибка.
 */
public class MakeDirectory implements Modification {

    private static final Logger log = LoggerFactory.getLogger(MakeDirectory.class);

    private final String path;

    public MakeDirectory(String path) {
        this.path = path;
    }

    @Override
    public String getName() {
        return "make_directory";
    }

    @Override
    public String target() {
        return path;
    }

    @Override
    public OperationOutcome apply(ApplyContext context) {
        Path dir = context.resolve(path);
        boolean existed = Files.isDirectory(dir);
        context.recordCreation(dir);
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw context.ioError(dir, e);
        }
        log.debug("Created directory {}", path);
        return OperationOutcome.applied(getName(), path, existed ? "already present" : "created");
    }
}
