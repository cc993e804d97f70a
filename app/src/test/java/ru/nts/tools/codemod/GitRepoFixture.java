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

import ru.nts.tools.codemod.core.ProcessExecutor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Временный git-репозиторий для тестов: локальная identity и один начальный коммит.
 */
public final class GitRepoFixture {

    private final Path root;

    private GitRepoFixture(Path root) {
        this.root = root;
    }

    public static boolean gitAvailable() {
        try {
            return ProcessExecutor.execute(List.of("git", "--version"), Path.of("."), 10).isSuccess();
        } catch (IOException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Инициализирует репозиторий в {@code root} и коммитит {@code README.md}.
     */
    public static GitRepoFixture init(Path root) throws Exception {
        GitRepoFixture repo = new GitRepoFixture(root);
        repo.git("init", "-q");
        repo.git("config", "user.name", "Test User");
        repo.git("config", "user.email", "test@example.com");
        repo.git("config", "commit.gpgsign", "false");
        Files.writeString(root.resolve("README.md"), "# test\n");
        repo.git("add", "README.md");
        repo.git("commit", "-q", "-m", "Initial commit");
        return repo;
    }

    public Path root() {
        return root;
    }

    public String git(String... args) throws Exception {
        List<String> command = new ArrayList<>();
        command.add("git");
        command.addAll(List.of(args));
        ProcessExecutor.ExecutionResult result = ProcessExecutor.execute(command, root, 30);
        if (!result.isSuccess()) {
            throw new IllegalStateException(String.join(" ", command) + " failed: " + result.output());
        }
        return result.output().trim();
    }

    public String head() throws Exception {
        return git("rev-parse", "HEAD");
    }

    public String lastMessage() throws Exception {
        return git("log", "-1", "--format=%B");
    }

    public boolean isTracked(String path) throws Exception {
        return !git("ls-files", "--", path).isBlank();
    }

    /**
     * Записывает файл и коммитит его.
     */
    public void commitFile(String path, String content) throws Exception {
        Path file = root.resolve(path);
        if (file.getParent() != null) {
            Files.createDirectories(file.getParent());
        }
        Files.writeString(file, content);
        git("add", "--", path);
        git("commit", "-q", "-m", "Add " + path);
    }
}
