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
import ru.nts.tools.codemod.core.EncodingUtils;
import ru.nts.tools.codemod.tools.batch.ApplyContext;
import ru.nts.tools.codemod.tools.batch.Modification;
import ru.nts.tools.codemod.tools.batch.OperationOutcome;

import java.nio.file.Path;

/**
 * Текстовая замена всех вхождений (многострочный поиск допустим). Язык файла не важен.
 */
public class SearchReplace implements Modification {

    private static final Logger log = LoggerFactory.getLogger(SearchReplace.class);

    private final String file;
    private final String search;
    private final String replacement;

    public SearchReplace(String file, String search, String replacement) {
        this.file = file;
        this.search = search;
        this.replacement = replacement;
    }

    @Override
    public String getName() {
        return "search_replace";
    }

    @Override
    public String target() {
        return file;
    }

    @Override
    public OperationOutcome apply(ApplyContext context) {
        Path path = context.resolve(file);
        EncodingUtils.TextFileContent source = context.readText(path);
        String content = source.content();
        int occurrences = count(content, search);
        if (search.isEmpty() || occurrences == 0) {
            throw new CodemodException(CodemodErrorCode.SEARCH_TEXT_NOT_FOUND, "path", file);
        }
        context.writeText(path, content.replace(search, replacement), source.charset());
        log.debug("Replaced {} occurrence(s) in {}", occurrences, file);
        return OperationOutcome.applied(getName(), file, occurrences + " occurrence(s)");
    }

    private static int count(String content, String search) {
        if (search.isEmpty()) {
            return 0;
        }
        int count = 0;
        int from = 0;
        while ((from = content.indexOf(search, from)) >= 0) {
            count++;
            from += search.length();
        }
        return count;
    }
}
