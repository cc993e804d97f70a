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
import ru.nts.tools.codemod.core.CodemodErrorCode;
import ru.nts.tools.codemod.core.CodemodException;

import java.io.IOException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Менеджер контрольных точек и откатов поверх {@link VersionControl}.
 *
 * <p>Контрольная точка - коммит (или текущий HEAD, если фиксировать нечего), записанный в {@link RollbackLog}.
 * Откат доступен в четырех вариантах по возрастанию разрушительности:
 * soft reset, hard reset, уход на новую ветку от точки и принудительный сброс ветки.</p>
 *
 * <p>Методы отката принимают {@code null} вместо идентификатора, тогда используется точка из журнала.</p>
 */
public class SnapshotManager {

    private static final Logger log = LoggerFactory.getLogger(SnapshotManager.class);

    static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final VersionControl vcs;
    private final RollbackLog rollbackLog;

    public SnapshotManager(VersionControl vcs, RollbackLog rollbackLog) {
        this.vcs = vcs;
        this.rollbackLog = rollbackLog;
    }

    public RollbackLog rollbackLog() {
        return rollbackLog;
    }

    /**
     * Проверяет, что контрольную точку можно создать: есть репозиторий, HEAD и настроенная identity.
     *
     * @throws CodemodException REPOSITORY_UNAVAILABLE
     */
    public void verifyRepository() {
        if (!vcs.isRepository()) {
            throw new CodemodException(CodemodErrorCode.REPOSITORY_UNAVAILABLE, "reason", "not a git working tree");
        }
        try {
            if (vcs.currentCommit().isEmpty()) {
                throw new CodemodException(CodemodErrorCode.REPOSITORY_UNAVAILABLE, "reason", "repository has no commits");
            }
            if (!vcs.isIdentityConfigured()) {
                throw new CodemodException(CodemodErrorCode.REPOSITORY_UNAVAILABLE, "reason", "user.name and user.email are not configured");
            }
        } catch (IOException e) {
            throw new CodemodException(CodemodErrorCode.REPOSITORY_UNAVAILABLE, Map.of("reason", String.valueOf(e.getMessage())), e);
        }
    }

    /**
     * Создает контрольную точку.
     * Отслеживаемые пути индексируются; если в индексе ничего нет и {@code force} не задан,
     * точкой становится текущий HEAD ({@link RollbackPoint#wasClean()}).
     *
     * @param message описание точки
     * @param force   создать коммит, даже пустой
     * @param tracked пути, которые нужно включить в коммит
     */
    public RollbackPoint createCheckpoint(String message, boolean force, Collection<String> tracked) {
        verifyRepository();
        String timestamp = LocalDateTime.now().format(TIMESTAMP);
        String text = message != null ? message : "Pre-modification snapshot " + timestamp;
        try {
            String branch = vcs.currentBranch().orElse(null);
            stage(tracked);

            RollbackPoint point;
            if (!vcs.hasStagedChanges() && !force) {
                String head = vcs.currentCommit().orElseThrow(() -> new IOException("HEAD is not resolvable"));
                log.info("No staged changes, using HEAD {} as rollback point", head);
                point = new RollbackPoint(head, branch, timestamp, "Rollback point (no changes): " + text, true);
            } else {
                String commit = vcs.commit(text, true);
                point = new RollbackPoint(commit, branch, timestamp, text, false);
            }
            rollbackLog.recordCheckpoint(point);
            log.info("Created rollback point {}", point.snapshotId());
            return point;
        } catch (IOException e) {
            throw new CodemodException(CodemodErrorCode.CHECKPOINT_FAILURE, Map.of("reason", String.valueOf(e.getMessage())), e);
        }
    }

    /**
     * Фиксирует изменения отслеживаемых путей после применения пакета.
     *
     * @return hash of the new commit
     * @throws CodemodException COMMIT_FAILURE, STAGING_FAILURE
     */
    public String commitChanges(String message, Collection<String> tracked, RollbackPoint checkpoint) {
        stage(tracked);
        try {
            String commit = vcs.commit(message, true);
            rollbackLog.recordAppliedCommit(commit);
            log.info("Committed modifications as {}", commit);
            return commit;
        } catch (IOException e) {
            throw new CodemodException(CodemodErrorCode.COMMIT_FAILURE,
                    Map.of("checkpoint", checkpoint.snapshotId(), "reason", String.valueOf(e.getMessage())), e);
        }
    }

    private void stage(Collection<String> tracked) {
        if (tracked.isEmpty()) {
            return;
        }
        try {
            vcs.stage(tracked);
        } catch (IOException e) {
            throw new CodemodException(CodemodErrorCode.STAGING_FAILURE,
                    Map.of("path", String.join(", ", tracked), "reason", String.valueOf(e.getMessage())), e);
        }
    }

    /**
     * git reset --soft: изменения после точки остаются в индексе.
     */
    public String softRollback(String commitId) {
        String id = resolve(commitId);
        try {
            vcs.reset(ResetMode.SOFT, id);
            log.info("Soft rollback to {}, changes kept staged", id);
            return id;
        } catch (IOException e) {
            throw rollbackFailure(id, e);
        }
    }

    /**
     * git reset --hard и удаление созданных пакетом неотслеживаемых путей.
     *
     * @param created пути, появившиеся в рабочем дереве после точки
     */
    public String hardRollback(String commitId, Collection<String> created) {
        String id = resolve(commitId);
        try {
            vcs.reset(ResetMode.HARD, id);
            vcs.removeUntracked(created);
            log.info("Hard rollback to {}, all changes discarded", id);
            return id;
        } catch (IOException e) {
            throw rollbackFailure(id, e);
        }
    }

    public String hardRollback(String commitId) {
        return hardRollback(commitId, List.of());
    }

    /**
     * Оставляет текущую ветку как есть и переключается на новую ветку от точки.
     *
     * @param branchName имя новой ветки, {@code null} - {@code abandoned-from-<branch>-<timestamp>}
     * @return имя созданной ветки
     */
    public String abandonToCheckpoint(String commitId, String branchName) {
        String id = resolve(commitId);
        try {
            String current = vcs.currentBranch().orElse("HEAD");
            String name = branchName != null && !branchName.isBlank()
                    ? branchName
                    : "abandoned-from-" + current + "-" + LocalDateTime.now().format(TIMESTAMP);
            vcs.checkoutNewBranch(name, id);
            rollbackLog.recordAbandon(current, name);
            log.info("Abandoned '{}': new branch '{}' created from {}", current, name, id);
            return name;
        } catch (IOException e) {
            throw rollbackFailure(id, e);
        }
    }

    /**
     * Принудительно сбрасывает ветку на точку. Коммиты после точки теряются.
     *
     * @param branchName ветка для сброса, {@code null} - текущая
     */
    public String forceResetBranch(String commitId, String branchName) {
        String id = resolve(commitId);
        try {
            String current = vcs.currentBranch().orElse(null);
            String target = branchName != null ? branchName : current;
            if (target != null && !target.equals(current)) {
                vcs.checkoutBranch(target);
            }
            vcs.reset(ResetMode.HARD, id);
            log.warn("DESTRUCTIVE: reset branch '{}' to {}, later commits are lost", target, id);
            return id;
        } catch (IOException e) {
            throw rollbackFailure(id, e);
        }
    }

    /**
     * Текст меню вариантов отката для точки из журнала.
     */
    public String rollbackOptions() {
        return rollbackOptions(lastCheckpoint());
    }

    public static String rollbackOptions(RollbackPoint point) {
        String id = point.snapshotId();
        StringBuilder sb = new StringBuilder();
        sb.append("=== ROLLBACK OPTIONS ===\n");
        sb.append("Rollback commit: ").append(id).append("\n");
        sb.append("Original branch: ").append(point.branchName() != null ? point.branchName() : "unknown").append("\n");
        sb.append("Created at: ").append(point.timestamp()).append("\n");
        sb.append("\nAvailable actions:\n");
        for (RollbackOption option : RollbackOption.values()) {
            sb.append(option.menuLine()).append("\n");
        }
        sb.append("\nManual commands:\n");
        sb.append("  git reset --soft ").append(id).append("\n");
        sb.append("  git reset --hard ").append(id).append("\n");
        sb.append("  git checkout -b new-branch-name ").append(id);
        return sb.toString();
    }

    /**
     * @throws CodemodException NO_ROLLBACK_POINT
     */
    public RollbackPoint lastCheckpoint() {
        try {
            return rollbackLog.checkpoint()
                    .orElseThrow(() -> new CodemodException(CodemodErrorCode.NO_ROLLBACK_POINT, "log", rollbackLog.file()));
        } catch (IOException e) {
            throw new CodemodException(CodemodErrorCode.NO_ROLLBACK_POINT, Map.of("log", rollbackLog.file().toString()), e);
        }
    }

    private String resolve(String commitId) {
        return commitId != null && !commitId.isBlank() ? commitId : lastCheckpoint().snapshotId();
    }

    private static CodemodException rollbackFailure(String commitId, IOException e) {
        return new CodemodException(CodemodErrorCode.ROLLBACK_FAILURE, Map.of("commit", commitId, "reason", String.valueOf(e.getMessage())), e);
    }
}
