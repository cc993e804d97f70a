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
package ru.nts.tools.codemod.tools.stanza;

import ru.nts.tools.codemod.core.CodemodErrorCode;
import ru.nts.tools.codemod.core.CodemodException;
import ru.nts.tools.codemod.core.syntax.Target;
import ru.nts.tools.codemod.tools.batch.Modification;
import ru.nts.tools.codemod.tools.batch.ModificationSet;
import ru.nts.tools.codemod.tools.batch.operations.DeleteDeclaration;
import ru.nts.tools.codemod.tools.batch.operations.DescribeModification;
import ru.nts.tools.codemod.tools.batch.operations.InsertDeclaration;
import ru.nts.tools.codemod.tools.batch.operations.MakeDirectory;
import ru.nts.tools.codemod.tools.batch.operations.MoveFile;
import ru.nts.tools.codemod.tools.batch.operations.RemoveFile;
import ru.nts.tools.codemod.tools.batch.operations.ReplaceDeclaration;
import ru.nts.tools.codemod.tools.batch.operations.SearchReplace;
import ru.nts.tools.codemod.tools.batch.operations.UpdateModuleHeader;
import ru.nts.tools.codemod.tools.batch.operations.WriteFile;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Превращает блоки описания пакета в операции.
 * Пути и имена деклараций очищаются от пробелов по краям, содержимое файлов и фрагменты сохраняются как есть.
 */
public final class ModificationFactory {

    private static final Map<String, Function<ModificationFileParser.Stanza, Modification>> OPERATIONS = new LinkedHashMap<>();

    static {
        OPERATIONS.put("modification_description", s -> {
            require(s, 1, "description");
            return new DescribeModification(s.section(0));
        });
        OPERATIONS.put("create_file", s -> {
            require(s, 2, "path, content, [executable]");
            return WriteFile.create(s.section(0).strip(), s.section(1), flag(s, 2));
        });
        OPERATIONS.put("update_file", s -> {
            require(s, 2, "path, content, [executable]");
            return WriteFile.update(s.section(0).strip(), s.section(1), flag(s, 2));
        });
        OPERATIONS.put("move_file", s -> {
            require(s, 2, "source, destination");
            return new MoveFile(s.section(0).strip(), s.section(1).strip());
        });
        OPERATIONS.put("make_directory", s -> {
            require(s, 1, "path");
            return new MakeDirectory(s.section(0).strip());
        });
        OPERATIONS.put("remove_file", s -> {
            require(s, 1, "path, [recursive]");
            return new RemoveFile(s.section(0).strip(), flag(s, 1));
        });
        OPERATIONS.put("declare", s -> declaration(s, "declare"));
        OPERATIONS.put("update_declaration", s -> declaration(s, "update_declaration"));
        OPERATIONS.put("remove_declaration", s -> {
            require(s, 2, "file, dotted name, [ignored content]");
            return new DeleteDeclaration(s.section(0).strip(), target(s, 1));
        });
        OPERATIONS.put("insert_declaration", s -> {
            require(s, 3, "file, dotted name, content");
            return new InsertDeclaration(s.section(0).strip(), target(s, 1), s.section(2));
        });
        OPERATIONS.put("module_header", s -> header(s, "module_header"));
        OPERATIONS.put("update_header", s -> header(s, "update_header"));
        OPERATIONS.put("search_replace", s -> {
            require(s, 3, "file, search text, replacement text");
            return new SearchReplace(s.section(0).strip(), s.section(1), s.section(2));
        });
    }

    private ModificationFactory() {}

    public static ModificationSet create(List<ModificationFileParser.Stanza> stanzas) {
        List<Modification> modifications = new ArrayList<>(stanzas.size());
        for (ModificationFileParser.Stanza stanza : stanzas) {
            modifications.add(create(stanza));
        }
        return new ModificationSet(modifications);
    }

    /**
     * @throws CodemodException UNKNOWN_OPERATION, INVALID_STANZA
     */
    public static Modification create(ModificationFileParser.Stanza stanza) {
        Function<ModificationFileParser.Stanza, Modification> factory = OPERATIONS.get(stanza.operation());
        if (factory == null) {
            throw new CodemodException(CodemodErrorCode.UNKNOWN_OPERATION,
                    Map.of("operation", stanza.operation(), "line", stanza.line(), "supported", String.join(", ", OPERATIONS.keySet())));
        }
        return factory.apply(stanza);
    }

    public static List<String> supportedOperations() {
        return List.copyOf(OPERATIONS.keySet());
    }

    /**
     * Пустое содержимое означает удаление.
     */
    private static Modification declaration(ModificationFileParser.Stanza s, String name) {
        require(s, 3, "file, dotted name, content (empty content deletes)");
        String file = s.section(0).strip();
        Target target = target(s, 1);
        String content = s.section(2);
        if (content.isBlank()) {
            return new DeleteDeclaration(name, file, target);
        }
        return new ReplaceDeclaration(name, file, target, content);
    }

    private static Modification header(ModificationFileParser.Stanza s, String name) {
        require(s, 2, "file, header content");
        return new UpdateModuleHeader(name, s.section(0).strip(), s.section(1));
    }

    private static Target target(ModificationFileParser.Stanza s, int index) {
        String dotted = s.section(index).strip();
        try {
            return Target.of(dotted);
        } catch (IllegalArgumentException e) {
            throw new CodemodException(CodemodErrorCode.INVALID_STANZA,
                    Map.of("operation", s.operation(), "line", s.line(), "expected", "a dotted name, got '" + dotted + "'"), e);
        }
    }

    private static boolean flag(ModificationFileParser.Stanza s, int index) {
        return s.size() > index && ModificationFileParser.parseBool(s.section(index));
    }

    private static void require(ModificationFileParser.Stanza s, int count, String expected) {
        if (s.size() < count) {
            throw new CodemodException(CodemodErrorCode.INVALID_STANZA,
                    Map.of("operation", s.operation(), "line", s.line(), "expected", expected));
        }
    }
}
