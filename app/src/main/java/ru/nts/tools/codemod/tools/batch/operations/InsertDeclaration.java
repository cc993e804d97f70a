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

import ru.nts.tools.codemod.core.syntax.Target;
import ru.nts.tools.codemod.tools.batch.ApplyContext;
import ru.nts.tools.codemod.tools.batch.OperationOutcome;
import ru.nts.tools.codemod.tools.editing.DeclarationEditor;
import ru.nts.tools.codemod.tools.editing.EditResult;

/**
 * insert_declaration: добавляет декларации фрагмента в область, заданную цепочкой пути.
 */
public class InsertDeclaration extends SourceFileModification {

    private final Target target;
    private final String fragment;

    public InsertDeclaration(String file, Target target, String fragment) {
        super(file);
        this.target = target;
        this.fragment = fragment;
    }

    @Override
    public String getName() {
        return "insert_declaration";
    }

    @Override
    public String target() {
        return file + "::" + target;
    }

    @Override
    protected EditResult edit(DeclarationEditor editor, String source, ApplyContext context) {
        return editor.insert(source, target, fragment);
    }

    @Override
    protected OperationOutcome outcome(EditResult result, ApplyContext context) {
        return new OperationOutcome(getName(), target(), OperationOutcome.Status.INSERTED, null);
    }
}
