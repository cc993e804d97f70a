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
package ru.nts.tools.codemod;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class CodemodCliTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

    private CodemodCli cli(String input, Map<String, String> env) {
        return new CodemodCli(new PrintStream(buffer, true, StandardCharsets.UTF_8),
                new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)), env, tempDir);
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void noArgumentsPrintsUsage() {
        assertEquals(CodemodCli.EXIT_USAGE, cli("", Map.of()).run(new String[0]));
        assertTrue(output().contains("Usage:"));
    }

    @Test
    void unknownCommandIsUsageError() {
        assertEquals(CodemodCli.EXIT_USAGE, cli("", Map.of()).run(new String[]{"frobnicate"}));
        assertTrue(output().contains("Unknown command: frobnicate"));
    }

    @Test
    void missingModificationFileIsUsageError() {
        assertEquals(CodemodCli.EXIT_USAGE, cli("", Map.of()).run(new String[]{"apply", "nope.txt"}));
        assertTrue(output().contains("Modification file not found"));
    }

    @Test
    void unknownOperationFailsBeforeTouchingRepository() throws Exception {
        Files.writeString(tempDir.resolve("changes.txt"), "MMM frobnicate MMM\nx\n");
        assertEquals(CodemodCli.EXIT_FAILED, cli("", Map.of()).run(new String[]{"apply", "changes.txt"}));
        assertTrue(output().contains("frobnicate"));
    }

    @Test
    void appliesModificationFileInRootFromEnvironment(@TempDir Path work) throws Exception {
        assumeTrue(GitRepoFixture.gitAvailable(), "git is not installed");
        GitRepoFixture repo = GitRepoFixture.init(work);
        Files.writeString(tempDir.resolve("changes.txt"), """
                MMM modification_description MMM
                Add hello
                MMM create_file MMM
                hello.py
                @@@@@@
                print("hello")
                """);

        int code = cli("", Map.of(CodemodCli.ROOT_ENV, work.toString())).run(new String[]{"apply", "changes.txt", "--json"});

        assertEquals(CodemodCli.EXIT_OK, code, output());
        assertTrue(output().contains("\"state\" : \"COMMITTED\""));
        assertEquals("Add hello", repo.lastMessage());
        assertTrue(repo.isTracked("hello.py"));
    }

    @Test
    void failedBatchExitsWithFailure() throws Exception {
        assumeTrue(GitRepoFixture.gitAvailable(), "git is not installed");
        GitRepoFixture.init(tempDir);
        Files.writeString(tempDir.resolve("changes.txt"), "MMM move_file MMM\nmissing.txt\n@@@@@@\nother.txt\n");

        assertEquals(CodemodCli.EXIT_FAILED, cli("", Map.of()).run(new String[]{"apply", "changes.txt"}));
        assertTrue(output().contains("State: ROLLED_BACK"));
    }

    @Test
    void rollbackWithoutLogReportsNoData() {
        assertEquals(CodemodCli.EXIT_FAILED, cli("", Map.of()).run(new String[]{"rollback"}));
        assertTrue(output().contains("No rollback data found"));
    }

    @Test
    void rollbackMenuHardReset() throws Exception {
        assumeTrue(GitRepoFixture.gitAvailable(), "git is not installed");
        GitRepoFixture repo = GitRepoFixture.init(tempDir);
        Files.writeString(tempDir.resolve("changes.txt"), "MMM create_file MMM\nnew.txt\n@@@@@@\nnew\n");
        assertEquals(CodemodCli.EXIT_OK, cli("", Map.of()).run(new String[]{"apply", "changes.txt"}));
        String applied = repo.head();

        int code = cli("7\n2\n", Map.of()).run(new String[]{"rollback"});

        assertEquals(CodemodCli.EXIT_OK, code);
        assertTrue(output().contains("Invalid choice"));
        assertNotEquals(applied, repo.head());
        assertFalse(Files.exists(tempDir.resolve("new.txt")));
    }

    @Test
    void forceResetNeedsConfirmation() throws Exception {
        assumeTrue(GitRepoFixture.gitAvailable(), "git is not installed");
        GitRepoFixture repo = GitRepoFixture.init(tempDir);
        Files.writeString(tempDir.resolve("changes.txt"), "MMM create_file MMM\nnew.txt\n@@@@@@\nnew\n");
        cli("", Map.of()).run(new String[]{"apply", "changes.txt"});
        String applied = repo.head();

        int code = cli("4\nno\nq\n", Map.of()).run(new String[]{"rollback"});

        assertEquals(CodemodCli.EXIT_OK, code);
        assertEquals(applied, repo.head());
    }
}
