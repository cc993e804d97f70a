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

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Восстановимое состояние рабочего дерева.
 *
 * @param snapshotId commit hash
 * @param branchName branch HEAD pointed to when the point was taken, {@code null} for a detached HEAD
 * @param timestamp  creation time, {@code yyyyMMdd_HHmmss}
 * @param message    commit message or, for a reused HEAD, a description of the point
 * @param wasClean   true when nothing was committed and HEAD itself became the snapshot
 */
public record RollbackPoint(
        @JsonProperty("commit_hash") String snapshotId,
        @JsonProperty("branch") String branchName,
        @JsonProperty("timestamp") String timestamp,
        @JsonProperty("message") String message,
        @JsonProperty("was_clean") boolean wasClean) {

    public String shortId() {
        return snapshotId.length() > 8 ? snapshotId.substring(0, 8) : snapshotId;
    }
}
