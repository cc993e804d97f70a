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
import ru.nts.tools.codemod.core.CodemodErrorCode;
import ru.nts.tools.codemod.core.CodemodException;
import ru.nts.tools.codemod.core.FileUtils;
import ru.nts.tools.codemod.tools.batch.ApplyContext;
import ru.nts.tools.codemod.tools.batch.Modification;
import ru.nts.tools.codemod.tools.batch.OperationOutcome;

import java.io.IOException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.Map;

/**
 * Удаляет файл или директорию. Отсутствующий путь не считается ошибкой.
 * Непустая директория удаляется только с {@code recursive}.
 */
public class RemoveFile implements Modification {

    private static final Logger log = LoggerFactory.getLogger(RemoveFile.class);

    private final String path;
    private final boolean recursive;

    public RemoveFile(String path, boolean recursive) {
        this.path = path;
        this.recursive = recursive;
    }

    @Override
    public String getName() {
        return "remove_file";
    }

    @Override
    public String target() {
        return path;
    }

    @Override
    public OperationOutcome apply(ApplyContext context) {
        Path file = context.resolve(path);
        context.track(file);
        if (!Files.exists(file, LinkOption.NOFOLLOW_LINKS)) {
            log.info("Path {} is already absent", path);
            return new OperationOutcome(getName(), path, OperationOutcome.Status.SKIPPED, "already absent");
        }

        try {
            if (Files.isDirectory(file, LinkOption.NOFOLLOW_LINKS) && recursive) {
                FileUtils.deleteRecursively(file);
                log.debug("Removed directory {} recursively", path);
                return OperationOutcome.applied(getName(), path, "directory removed recursively");
            }
            FileUtils.safeDelete(file);
        } catch (DirectoryNotEmptyException e) {
            throw new CodemodException(CodemodErrorCode.DIRECTORY_NOT_EMPTY, Map.of("path", path), e);
        } catch (IOException e) {
            throw context.ioError(file, e);
        }
        log.debug("Removed {}", path);
        return OperationOutcome.applied(getName(), path, null);
    }
}
