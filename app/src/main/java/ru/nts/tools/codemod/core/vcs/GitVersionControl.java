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
package ru.nts.tools.codemod.core.vcs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.nts.tools.codemod.core.ProcessExecutor;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * {@link VersionControl} поверх консольного git.
 * Каждая команда выполняется в корне рабочего дерева через {@link ProcessExecutor};
 * ненулевой код выхода превращается в {@link IOException} с выводом git.
 */
public class GitVersionControl implements VersionControl {

    private static final Logger log = LoggerFactory.getLogger(GitVersionControl.class);

    /**
     * Таймаут быстрых информационных команд.
     */
    private static final long QUERY_TIMEOUT = 10;

    /**
     * Таймаут команд, меняющих репозиторий.
     */
    private static final long WRITE_TIMEOUT = 60;

    private final Path root;

    public GitVersionControl(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public boolean isRepository() {
        try {
            ProcessExecutor.ExecutionResult result = run(List.of("git", "rev-parse", "--is-inside-work-tree"), QUERY_TIMEOUT);
            return result.isSuccess() && result.output().trim().equals("true");
        } catch (IOException e) {
            log.debug("git is not usable in {}: {}", root, e.getMessage());
            return false;
        }
    }

    @Override
    public Optional<String> currentCommit() throws IOException {
        ProcessExecutor.ExecutionResult result = run(List.of("git", "rev-parse", "--verify", "-q", "HEAD"), QUERY_TIMEOUT);
        String hash = result.output().trim();
        return result.isSuccess() && !hash.isEmpty() ? Optional.of(hash) : Optional.empty();
    }

    @Override
    public Optional<String> currentBranch() throws IOException {
        String branch = require(List.of("git", "branch", "--show-current"), QUERY_TIMEOUT).trim();
        return branch.isEmpty() ? Optional.empty() : Optional.of(branch);
    }

    @Override
    public boolean isIdentityConfigured() throws IOException {
        return hasConfig("user.name") && hasConfig("user.email");
    }

    private boolean hasConfig(String key) throws IOException {
        ProcessExecutor.ExecutionResult result = run(List.of("git", "config", key), QUERY_TIMEOUT);
        return result.isSuccess() && !result.output().isBlank();
    }

    @Override
    public void stage(Collection<String> paths) throws IOException {
        List<String> stageable = new ArrayList<>();
        for (String path : paths) {
            // Путь, которого нет ни на диске, ни в индексе, git add отвергает
            if (Files.exists(root.resolve(path), LinkOption.NOFOLLOW_LINKS) || isKnown(path)) {
                stageable.add(path);
            } else {
                log.debug("Skipping {}: neither on disk nor known to git", path);
            }
        }
        if (stageable.isEmpty()) {
            return;
        }
        List<String> command = new ArrayList<>(List.of("git", "add", "-A", "--"));
        command.addAll(stageable);
        require(command, WRITE_TIMEOUT);
    }

    private boolean isKnown(String path) throws IOException {
        ProcessExecutor.ExecutionResult result = run(List.of("git", "ls-files", "--", path), QUERY_TIMEOUT);
        return result.isSuccess() && !result.output().isBlank();
    }

    @Override
    public boolean hasStagedChanges() throws IOException {
        return !require(List.of("git", "diff", "--cached", "--name-only"), QUERY_TIMEOUT).isBlank();
    }

    @Override
    public String commit(String message, boolean allowEmpty) throws IOException {
        List<String> command = new ArrayList<>(List.of("git", "commit", "-q", "-m", message));
        if (allowEmpty) {
            command.add("--allow-empty");
        }
        require(command, WRITE_TIMEOUT);
        return currentCommit().orElseThrow(() -> new IOException("HEAD is not resolvable after commit"));
    }

    @Override
    public void reset(ResetMode mode, String commitId) throws IOException {
        require(List.of("git", "reset", "-q", mode.flag(), commitId), WRITE_TIMEOUT);
    }

    @Override
    public void checkoutNewBranch(String branchName, String commitId) throws IOException {
        require(List.of("git", "checkout", "-q", "-b", branchName, commitId), WRITE_TIMEOUT);
    }

    @Override
    public void checkoutBranch(String branchName) throws IOException {
        require(List.of("git", "checkout", "-q", branchName), WRITE_TIMEOUT);
    }

    @Override
    public void removeUntracked(Collection<String> paths) throws IOException {
        if (paths.isEmpty()) {
            return;
        }
        List<String> command = new ArrayList<>(List.of("git", "clean", "-f", "-d", "-q", "--"));
        command.addAll(paths);
        require(command, WRITE_TIMEOUT);
    }

    private String require(List<String> command, long timeout) throws IOException {
        ProcessExecutor.ExecutionResult result = run(command, timeout);
        if (result.timedOut()) {
            throw new IOException(String.join(" ", command) + " timed out after " + timeout + "s");
        }
        if (!result.isSuccess()) {
            throw new IOException(String.join(" ", command.subList(0, 2)) + " failed (exit " + result.exitCode() + "): "
                    + result.output().trim());
        }
        return result.output();
    }

    private ProcessExecutor.ExecutionResult run(List<String> command, long timeout) throws IOException {
        try {
            return ProcessExecutor.execute(command, root, timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while running " + String.join(" ", command));
        }
    }
}
