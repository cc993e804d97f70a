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

import ru.nts.tools.codemod.core.EncodingUtils;
import ru.nts.tools.codemod.tools.batch.ApplyContext;
import ru.nts.tools.codemod.tools.batch.OperationOutcome;
import ru.nts.tools.codemod.tools.editing.DeclarationEditor;
import ru.nts.tools.codemod.tools.editing.EditResult;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * module_header / update_header: заменяет заголовок модуля (все до первого class, def или guard-блока).
 * Отсутствующий файл создается с одним заголовком.
 */
public class UpdateModuleHeader extends SourceFileModification {

    private final String name;
    private final String header;

    public UpdateModuleHeader(String name, String file, String header) {
        super(file);
        this.name = name;
        this.header = header;
    }

    public UpdateModuleHeader(String file, String header) {
        this("module_header", file, header);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String target() {
        return file;
    }

    @Override
    protected EncodingUtils.TextFileContent read(ApplyContext context, Path path) {
        if (!Files.exists(path)) {
            return new EncodingUtils.TextFileContent("", StandardCharsets.UTF_8);
        }
        return super.read(context, path);
    }

    @Override
    protected EditResult edit(DeclarationEditor editor, String source, ApplyContext context) {
        return editor.replaceHeader(source, header);
    }

    @Override
    protected OperationOutcome outcome(EditResult result, ApplyContext context) {
        return OperationOutcome.applied(name, file, "header replaced");
    }
}
