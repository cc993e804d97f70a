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
import ru.nts.tools.codemod.core.syntax.Target;
import ru.nts.tools.codemod.tools.batch.ApplyContext;
import ru.nts.tools.codemod.tools.batch.OperationOutcome;
import ru.nts.tools.codemod.tools.editing.DeclarationEditor;
import ru.nts.tools.codemod.tools.editing.EditResult;

import java.util.Map;

/**
 * remove_declaration (или declare с пустым фрагментом): удаляет все декларации по точному пути.
 * Отсутствие цели прерывает пакет, если не включен режим best-effort.
 */
public class DeleteDeclaration extends SourceFileModification {

    private static final Logger log = LoggerFactory.getLogger(DeleteDeclaration.class);

    private final String name;
    private final Target target;

    public DeleteDeclaration(String name, String file, Target target) {
        super(file);
        this.name = name;
        this.target = target;
    }

    public DeleteDeclaration(String file, Target target) {
        this("remove_declaration", file, target);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String target() {
        return file + "::" + target;
    }

    @Override
    protected EditResult edit(DeclarationEditor editor, String source, ApplyContext context) {
        return editor.delete(source, target);
    }

    @Override
    protected OperationOutcome outcome(EditResult result, ApplyContext context) {
        if (!result.isFound()) {
            if (!context.options().bestEffortDeletes()) {
                throw new CodemodException(CodemodErrorCode.TARGET_NOT_FOUND,
                        Map.of("target", target.toString(), "file", file));
            }
            log.warn("{} not found in {}, nothing deleted", target, file);
            return new OperationOutcome(name, target(), OperationOutcome.Status.NOT_FOUND, "nothing deleted");
        }
        log.debug("Deleted {} definition(s) of {} in {}", result.matchCount(), target, file);
        return new OperationOutcome(name, target(), OperationOutcome.Status.DELETED,
                result.matchCount() > 1 ? result.matchCount() + " definitions" : null);
    }
}
