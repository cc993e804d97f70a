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
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Перемещение или переименование файла либо директории.
 * Если назначение - существующая директория, источник перемещается внутрь нее.
 * Отслеживаются оба пути, чтобы коммит содержал и удаление, и добавление.
 */
public class MoveFile implements Modification {

    private static final Logger log = LoggerFactory.getLogger(MoveFile.class);

    private final String source;
    private final String destination;

    public MoveFile(String source, String destination) {
        this.source = source;
        this.destination = destination;
    }

    @Override
    public String getName() {
        return "move_file";
    }

    @Override
    public String target() {
        return source + " -> " + destination;
    }

    @Override
    public OperationOutcome apply(ApplyContext context) {
        Path src = context.resolve(source);
        Path dst = context.resolve(destination);
        if (!Files.exists(src)) {
            throw new CodemodException(CodemodErrorCode.FILE_NOT_FOUND, "path", source);
        }
        if (Files.isDirectory(dst)) {
            dst = dst.resolve(src.getFileName());
        }

        context.track(src);
        context.track(dst);
        context.recordCreation(dst);
        try {
            FileUtils.safeMove(src, dst, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw context.ioError(src, e);
        }
        log.debug("Moved {} to {}", source, context.relative(dst));
        return OperationOutcome.applied(getName(), target(), null);
    }
}
