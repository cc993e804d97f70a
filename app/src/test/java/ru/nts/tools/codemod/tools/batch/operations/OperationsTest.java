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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import ru.nts.tools.codemod.core.CodemodErrorCode;
import ru.nts.tools.codemod.core.CodemodException;
import ru.nts.tools.codemod.core.PathSanitizer;
import ru.nts.tools.codemod.core.syntax.Target;
import ru.nts.tools.codemod.tools.batch.ApplyContext;
import ru.nts.tools.codemod.tools.batch.ApplyOptions;
import ru.nts.tools.codemod.tools.batch.OperationOutcome;

import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Операции пакета без git: только файловая система и контекст.
 */
class OperationsTest {

    @TempDir
    Path tempDir;

    private ApplyContext context;

    @BeforeEach
    void setUp() {
        context = new ApplyContext(new PathSanitizer(tempDir), ApplyOptions.defaults());
    }

    @Test
    void createFileRecordsTopmostNewDirectory() throws Exception {
        OperationOutcome outcome = WriteFile.create("a/b/c.py", "X = 1\n", false).apply(context);
        assertEquals(OperationOutcome.Status.APPLIED, outcome.status());
        assertEquals("X = 1\n", Files.readString(tempDir.resolve("a/b/c.py")));
        assertEquals(Set.of("a"), context.createdPaths());
        assertEquals(Set.of("a/b/c.py"), context.trackedFiles());
    }

    @Test
    void createFileOverwritesExistingContent() throws Exception {
        Files.writeString(tempDir.resolve("a.txt"), "old");
        WriteFile.create("a.txt", "new", false).apply(context);
        assertEquals("new", Files.readString(tempDir.resolve("a.txt")));
        assertTrue(context.createdPaths().isEmpty());
    }

    @Test
    void executableFlagIsApplied() throws Exception {
        WriteFile.update("run.sh", "#!/bin/sh\necho hi\n", true).apply(context);
        assertTrue(Files.isExecutable(tempDir.resolve("run.sh")));
    }

    @Test
    void moveIntoExistingDirectoryKeepsFileName() throws Exception {
        Files.writeString(tempDir.resolve("a.txt"), "a");
        Files.createDirectories(tempDir.resolve("dest"));
        new MoveFile("a.txt", "dest").apply(context);
        assertTrue(Files.exists(tempDir.resolve("dest/a.txt")));
        assertTrue(context.trackedFiles().containsAll(Set.of("a.txt", "dest/a.txt")));
    }

    @Test
    void moveOfMissingSourceFails() {
        CodemodException e = assertThrows(CodemodException.class, () -> new MoveFile("missing.txt", "b.txt").apply(context));
        assertEquals(CodemodErrorCode.FILE_NOT_FOUND, e.getCode());
    }

    @Test
    void removeOfMissingPathIsSkipped() {
        OperationOutcome outcome = new RemoveFile("nothing.txt", false).apply(context);
        assertEquals(OperationOutcome.Status.SKIPPED, outcome.status());
    }

    @Test
    void nonEmptyDirectoryNeedsRecursiveFlag() throws Exception {
        Files.createDirectories(tempDir.resolve("dir"));
        Files.writeString(tempDir.resolve("dir/file.txt"), "x");

        CodemodException e = assertThrows(CodemodException.class, () -> new RemoveFile("dir", false).apply(context));
        assertEquals(CodemodErrorCode.DIRECTORY_NOT_EMPTY, e.getCode());

        new RemoveFile("dir", true).apply(context);
        assertFalse(Files.exists(tempDir.resolve("dir")));
    }

    @Test
    void makeDirectoryIsIdempotent() {
        assertEquals("created", new MakeDirectory("x/y").apply(context).detail());
        assertEquals("already present", new MakeDirectory("x/y").apply(context).detail());
        assertEquals(Set.of("x"), context.createdPaths());
    }

    @Test
    void gitDirectoryIsProtected() {
        CodemodException e = assertThrows(CodemodException.class,
                () -> WriteFile.create(".git/config", "x", false).apply(context));
        assertEquals(CodemodErrorCode.PATH_OUTSIDE_ROOT, e.getCode());
    }

    @Test
    void headerUpdateCreatesMissingModule() throws Exception {
        new UpdateModuleHeader("fresh.py", "import os").apply(context);
        assertEquals("import os\n", Files.readString(tempDir.resolve("fresh.py")));
        assertEquals(Set.of("fresh.py"), context.createdPaths());
    }

    @Test
    void declareOnMissingFileFails() {
        CodemodException e = assertThrows(CodemodException.class,
                () -> new ReplaceDeclaration("missing.py", Target.of("f"), "def f():\n    pass").apply(context));
        assertEquals(CodemodErrorCode.FILE_NOT_FOUND, e.getCode());
    }

    @Test
    void declareReportsInsertionAndReplacement() throws Exception {
        Files.writeString(tempDir.resolve("m.py"), "def a():\n    pass\n");
        assertEquals(OperationOutcome.Status.INSERTED,
                new ReplaceDeclaration("m.py", Target.of("b"), "def b():\n    pass").apply(context).status());
        assertEquals(OperationOutcome.Status.REPLACED,
                new ReplaceDeclaration("m.py", Target.of("b"), "def b():\n    return 1").apply(context).status());
    }

    @Test
    void unchangedModuleIsNotTracked() throws Exception {
        Files.writeString(tempDir.resolve("m.py"), "def a():\n    pass\n");
        new ReplaceDeclaration("m.py", Target.of("a"), "def a():\n    pass").apply(context);
        assertTrue(context.trackedFiles().isEmpty());
    }

    @Test
    void strictDeleteOfMissingDeclarationFails() throws Exception {
        Files.writeString(tempDir.resolve("m.py"), "def a():\n    pass\n");
        CodemodException e = assertThrows(CodemodException.class,
                () -> new DeleteDeclaration("m.py", Target.of("zzz")).apply(context));
        assertEquals(CodemodErrorCode.TARGET_NOT_FOUND, e.getCode());
    }

    @Test
    void declarationsInOtherLanguagesAreRejected() throws Exception {
        Files.writeString(tempDir.resolve("Main.java"), "class Main {}\n");
        CodemodException e = assertThrows(CodemodException.class,
                () -> new DeleteDeclaration("Main.java", Target.of("Main")).apply(context));
        assertEquals(CodemodErrorCode.UNSUPPORTED_LANGUAGE, e.getCode());
    }

    @Test
    void searchReplaceKeepsDetectedEncoding() throws Exception {
        Charset cp1251 = Charset.forName("windows-1251");
        Path file = tempDir.resolve("ru.py");
        Files.write(file, ("# Это русский текст. " + "Проверка кириллицы. ".repeat(20) + "\nNAME = 'старое значение'\n").getBytes(cp1251));

        new SearchReplace("ru.py", "старое", "новое").apply(context);

        String text = new String(Files.readAllBytes(file), cp1251);
        assertTrue(text.contains("NAME = 'новое значение'"));
    }

    @Test
    void searchTextMustExist() throws Exception {
        Files.writeString(tempDir.resolve("a.txt"), "abc");
        CodemodException e = assertThrows(CodemodException.class, () -> new SearchReplace("a.txt", "zzz", "y").apply(context));
        assertEquals(CodemodErrorCode.SEARCH_TEXT_NOT_FOUND, e.getCode());
    }

    @Test
    void descriptionsAccumulate() {
        new DescribeModification("one").apply(context);
        new DescribeModification("two").apply(context);
        assertEquals("one\ntwo", context.description());
    }
}
