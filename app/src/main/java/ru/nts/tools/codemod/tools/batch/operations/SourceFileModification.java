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
import ru.nts.tools.codemod.tools.batch.Modification;
import ru.nts.tools.codemod.tools.batch.OperationOutcome;
import ru.nts.tools.codemod.tools.editing.DeclarationEditor;
import ru.nts.tools.codemod.tools.editing.EditResult;

import java.nio.file.Path;

/**
 * Базовый класс структурных правок одного python-файла: чтение в исходной кодировке,
 * правка через {@link DeclarationEditor}, запись обратно только при изменении текста.
 */
abstract class SourceFileModification implements Modification {

    protected final String file;

    protected SourceFileModification(String file) {
        this.file = file;
    }

    @Override
    public OperationOutcome apply(ApplyContext context) {
        Path path = context.resolve(file);
        EncodingUtils.TextFileContent source = read(context, path);
        DeclarationEditor editor = context.editor(path, source.content());
        EditResult result = edit(editor, source.content(), context);
        if (result.isFound() && !result.content().equals(source.content())) {
            context.writeText(path, result.content(), source.charset());
        }
        return outcome(result, context);
    }

    /**
     * Чтение исходника; отсутствующий файл по умолчанию ошибка.
     */
    protected EncodingUtils.TextFileContent read(ApplyContext context, Path path) {
        return context.readText(path);
    }

    protected abstract EditResult edit(DeclarationEditor editor, String source, ApplyContext context);

    protected abstract OperationOutcome outcome(EditResult result, ApplyContext context);
}
