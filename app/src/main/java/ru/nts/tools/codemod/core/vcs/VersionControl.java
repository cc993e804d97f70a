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

import java.io.IOException;
import java.util.Collection;
import java.util.Optional;

/**
 * Операции системы контроля версий, нужные для контрольных точек и отката.
 * Все пути относительны корня рабочего дерева.
 */
public interface VersionControl {

    boolean isRepository();

    /**
     * @return hash of HEAD, empty for a repository without commits
     */
    Optional<String> currentCommit() throws IOException;

    /**
     * @return current branch name, empty for a detached HEAD
     */
    Optional<String> currentBranch() throws IOException;

    boolean isIdentityConfigured() throws IOException;

    /**
     * Stages additions, modifications and removals of the given paths.
     */
    void stage(Collection<String> paths) throws IOException;

    boolean hasStagedChanges() throws IOException;

    /**
     * Commits the index.
     *
     * @return hash of the new commit
     */
    String commit(String message, boolean allowEmpty) throws IOException;

    void reset(ResetMode mode, String commitId) throws IOException;

    void checkoutNewBranch(String branchName, String commitId) throws IOException;

    void checkoutBranch(String branchName) throws IOException;

    /**
     * Removes the given paths if git does not track them. Tracked paths are left alone.
     */
    void removeUntracked(Collection<String> paths) throws IOException;
}
