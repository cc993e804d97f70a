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
import ru.nts.tools.codemod.core.syntax.Target;
import ru.nts.tools.codemod.tools.batch.ApplyContext;
import ru.nts.tools.codemod.tools.batch.OperationOutcome;
import ru.nts.tools.codemod.tools.editing.DeclarationEditor;
import ru.nts.tools.codemod.tools.editing.EditResult;

/**
 * declare / update_declaration: заменяет все декларации по пути фрагментом, а при их отсутствии вставляет его.
 */
public class ReplaceDeclaration extends SourceFileModification {

    private static final Logger log = LoggerFactory.getLogger(ReplaceDeclaration.class);

    private final String name;
    private final Target target;
    private final String fragment;

    public ReplaceDeclaration(String name, String file, Target target, String fragment) {
        super(file);
        this.name = name;
        this.target = target;
        this.fragment = fragment;
    }

    public ReplaceDeclaration(String file, Target target, String fragment) {
        this("declare", file, target, fragment);
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
        return editor.replace(source, target, fragment);
    }

    @Override
    protected OperationOutcome outcome(EditResult result, ApplyContext context) {
        log.debug("Declared {} in {} ({} previous match(es))", target, file, result.matchCount());
        if (!result.replaced()) {
            return new OperationOutcome(name, target(), OperationOutcome.Status.INSERTED, "not present before");
        }
        String detail = result.matchCount() > 1 ? result.matchCount() + " definitions collapsed" : null;
        if (result.fallback()) {
            detail = detail == null ? "delete-then-insert" : detail + ", delete-then-insert";
        }
        return new OperationOutcome(name, target(), OperationOutcome.Status.REPLACED, detail);
    }
}
