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

/**
 * Описание изменений. Файлы не трогает, текст накапливается в сообщение итогового коммита.
 */
public class DescribeModification implements Modification {

    private static final Logger log = LoggerFactory.getLogger(DescribeModification.class);

    private final String text;

    public DescribeModification(String text) {
        this.text = text;
    }

    public String text() {
        return text;
    }

    @Override
    public String getName() {
        return "modification_description";
    }

    @Override
    public String target() {
        int nl = text.indexOf('\n');
        return nl < 0 ? text : text.substring(0, nl);
    }

    @Override
    public OperationOutcome apply(ApplyContext context) {
        context.describe(text);
        log.debug("Added modification description: {}", target());
        return OperationOutcome.applied(getName(), target(), "description");
    }
}
