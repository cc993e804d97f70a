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
package ru.nts.tools.codemod.tools.batch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.nts.tools.codemod.core.CodemodErrorCode;
import ru.nts.tools.codemod.core.CodemodException;
import ru.nts.tools.codemod.core.PathSanitizer;
import ru.nts.tools.codemod.core.vcs.GitVersionControl;
import ru.nts.tools.codemod.core.vcs.RollbackLog;
import ru.nts.tools.codemod.core.vcs.RollbackPoint;
import ru.nts.tools.codemod.core.vcs.SnapshotManager;
import ru.nts.tools.codemod.core.vcs.VersionControl;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Транзакционное применение пакета модификаций.
 *
 * <p>Порядок работы:</p>
 * <ol>
 *   <li>Создание контрольной точки. Если ее нельзя создать (нет репозитория, HEAD или identity),
 *       пакет отклоняется до любых изменений.</li>
 *   <li>Строго последовательное выполнение операций с общим {@link ApplyContext}.</li>
 *   <li>Коммит отслеживаемых путей с накопленным описанием в качестве сообщения.</li>
 *   <li>При ошибке операции - hard reset к точке и удаление созданных пакетом путей,
 *       либо, в ручном режиме, возврат точки вызывающему.</li>
 * </ol>
 *
 * <p>{@link #apply} не бросает исключений: результат и ошибка возвращаются в {@link ApplyResult}.</p>
 */
public class TransactionalApplyController {

    private static final Logger log = LoggerFactory.getLogger(TransactionalApplyController.class);

    private final PathSanitizer sanitizer;
    private final SnapshotManager snapshots;

    private volatile BatchState state = BatchState.IDLE;

    public TransactionalApplyController(Path root) {
        this(root, new GitVersionControl(root));
    }

    public TransactionalApplyController(Path root, VersionControl vcs) {
        this.sanitizer = new PathSanitizer(root);
        this.snapshots = new SnapshotManager(vcs, new RollbackLog(sanitizer.getRoot()));
    }

    public BatchState state() {
        return state;
    }

    public SnapshotManager snapshots() {
        return snapshots;
    }

    /**
     * Создает контрольную точку перед пакетом.
     *
     * @throws CodemodException REPOSITORY_UNAVAILABLE, CHECKPOINT_FAILURE
     */
    public RollbackPoint beginBatch(ApplyOptions options) {
        state = BatchState.IDLE;
        RollbackPoint checkpoint = snapshots.createCheckpoint(options.checkpointMessage(), false, List.of());
        state = BatchState.CHECKPOINT_ESTABLISHED;
        return checkpoint;
    }

    public ApplyResult apply(ModificationSet modifications) {
        return apply(modifications, ApplyOptions.defaults());
    }

    /**
     * Применяет пакет как одну транзакцию.
     */
    public ApplyResult apply(ModificationSet modifications, ApplyOptions options) {
        ApplyResult.Builder result = ApplyResult.builder();

        RollbackPoint checkpoint;
        try {
            checkpoint = beginBatch(options);
        } catch (CodemodException e) {
            log.error("Batch refused, no rollback point: {}", e.toLogMessage());
            state = BatchState.FAILED;
            return result.state(state).error(e).build();
        }
        result.checkpoint(checkpoint);
        log.info("Applying {} modification(s), rollback point {}", modifications.size(), checkpoint.shortId());

        ApplyContext context = new ApplyContext(sanitizer, options);
        state = BatchState.APPLYING;
        for (Modification modification : modifications.modifications()) {
            try {
                OperationOutcome outcome = modification.apply(context);
                result.addOutcome(outcome);
                log.info("{}", outcome);
            } catch (RuntimeException e) {
                CodemodException error = asCodemodException(e);
                result.failedOperation(modification.getName() + " " + modification.target());
                return fail(result, error, checkpoint, context, options);
            }
        }

        if (!options.autoCommit()) {
            log.info("Modifications applied, commit skipped by request");
            state = BatchState.AWAITING_MANUAL_DECISION;
            return result.state(state).rollbackOptions(SnapshotManager.rollbackOptions(checkpoint)).build();
        }

        if (!context.trackedFiles().isEmpty()) {
            String description = context.description();
            String message = description.isBlank() ? options.defaultCommitMessage() : description;
            try {
                result.appliedCommit(snapshots.commitChanges(message, context.trackedFiles(), checkpoint));
            } catch (CodemodException e) {
                // Изменения остаются в рабочем дереве, решение за пользователем
                log.error("Commit after modifications failed: {}", e.toLogMessage());
                state = BatchState.AWAITING_MANUAL_DECISION;
                return result.state(state).error(e).rollbackOptions(SnapshotManager.rollbackOptions(checkpoint)).build();
            }
        } else {
            log.info("No files touched, nothing to commit");
        }

        state = BatchState.COMMITTED;
        log.info("All modifications completed successfully");
        return result.state(state).rollbackOptions(SnapshotManager.rollbackOptions(checkpoint)).build();
    }

    private ApplyResult fail(ApplyResult.Builder result, CodemodException error, RollbackPoint checkpoint,
                             ApplyContext context, ApplyOptions options) {
        state = BatchState.FAILED;
        log.error("Modifications failed: {}", error.toLogMessage());
        result.error(error);

        if (!options.autoRollback()) {
            log.info("Manual rollback requested, working tree left as is");
            state = BatchState.AWAITING_MANUAL_DECISION;
            return result.state(state).rollbackOptions(SnapshotManager.rollbackOptions(checkpoint)).build();
        }

        try {
            snapshots.hardRollback(checkpoint.snapshotId(), context.createdPaths());
            state = BatchState.ROLLED_BACK;
            log.info("Rolled back to {}", checkpoint.shortId());
        } catch (CodemodException rollbackError) {
            log.error("Automatic rollback failed: {}", rollbackError.toLogMessage());
            result.rollbackError(rollbackError).rollbackOptions(SnapshotManager.rollbackOptions(checkpoint));
        }
        return result.state(state).build();
    }

    private static CodemodException asCodemodException(RuntimeException e) {
        if (e instanceof CodemodException codemodException) {
            return codemodException;
        }
        return new CodemodException(CodemodErrorCode.INTERNAL_ERROR,
                Map.of("reason", e.getClass().getSimpleName() + ": " + e.getMessage()), e);
    }
}
