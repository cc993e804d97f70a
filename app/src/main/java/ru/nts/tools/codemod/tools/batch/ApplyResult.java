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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import ru.nts.tools.codemod.core.CodemodException;
import ru.nts.tools.codemod.core.vcs.RollbackPoint;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Отчет о применении пакета.
 *
 * @param state           итоговое состояние
 * @param checkpoint      контрольная точка до пакета, {@code null} если она не была создана
 * @param appliedCommit   коммит с изменениями пакета, {@code null} если коммита не было
 * @param outcomes        итоги выполненных операций по порядку
 * @param failedOperation операция, на которой пакет остановился
 * @param error           ошибка пакета
 * @param rollbackError   ошибка автоматического отката
 * @param rollbackOptions текст меню отката
 */
public record ApplyResult(
        BatchState state,
        RollbackPoint checkpoint,
        String appliedCommit,
        List<OperationOutcome> outcomes,
        String failedOperation,
        CodemodException error,
        CodemodException rollbackError,
        String rollbackOptions
) {
    private static final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public boolean isSuccess() {
        return state.isSuccess();
    }

    /**
     * Человекочитаемый отчет.
     */
    public String toText() {
        StringBuilder sb = new StringBuilder();
        sb.append("State: ").append(state).append("\n");
        if (checkpoint != null) {
            sb.append("Checkpoint: ").append(checkpoint.snapshotId())
                    .append(checkpoint.wasClean() ? " (HEAD reused)" : "").append("\n");
        }
        if (appliedCommit != null) {
            sb.append("Applied commit: ").append(appliedCommit).append("\n");
        }
        if (!outcomes.isEmpty()) {
            sb.append("\nOperations:\n");
            for (OperationOutcome outcome : outcomes) {
                sb.append("  ").append(outcome).append("\n");
            }
        }
        if (error != null) {
            sb.append("\nFailed");
            if (failedOperation != null) {
                sb.append(" at ").append(failedOperation);
            }
            sb.append(":\n").append(error.toUserMessage()).append("\n");
            switch (state) {
                case ROLLED_BACK -> sb.append("\nWorking tree restored to ").append(checkpoint.snapshotId()).append("\n");
                case AWAITING_MANUAL_DECISION -> sb.append("\nNo automatic rollback performed.\n");
                default -> { }
            }
        }
        if (rollbackError != null) {
            sb.append("\nAutomatic rollback failed:\n").append(rollbackError.toUserMessage()).append("\n");
        }
        if (rollbackOptions != null) {
            sb.append("\n").append(rollbackOptions).append("\n");
        }
        return sb.toString();
    }

    /**
     * Отчет в JSON для машинной обработки.
     */
    public String toJson() {
        ObjectNode root = mapper.createObjectNode();
        root.put("state", state.name());
        root.put("success", isSuccess());
        if (checkpoint != null) {
            root.set("checkpoint", mapper.valueToTree(checkpoint));
        }
        if (appliedCommit != null) {
            root.put("appliedCommit", appliedCommit);
        }
        ArrayNode ops = root.putArray("operations");
        for (OperationOutcome outcome : outcomes) {
            ObjectNode op = ops.addObject();
            op.put("operation", outcome.operation());
            op.put("target", outcome.target());
            op.put("status", outcome.status().name());
            if (outcome.detail() != null) {
                op.put("detail", outcome.detail());
            }
        }
        if (error != null) {
            root.set("error", errorNode(error));
            if (failedOperation != null) {
                root.put("failedOperation", failedOperation);
            }
        }
        if (rollbackError != null) {
            root.set("rollbackError", errorNode(rollbackError));
        }
        if (rollbackOptions != null) {
            root.put("rollbackOptions", rollbackOptions);
        }
        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot render apply result", e);
        }
    }

    private static ObjectNode errorNode(CodemodException e) {
        ObjectNode node = mapper.createObjectNode();
        node.put("code", e.getCode().name());
        node.put("message", e.getCode().getMessage());
        ObjectNode context = node.putObject("context");
        for (Map.Entry<String, Object> entry : e.getContext().entrySet()) {
            context.put(entry.getKey(), String.valueOf(entry.getValue()));
        }
        return node;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private BatchState state = BatchState.IDLE;
        private RollbackPoint checkpoint;
        private String appliedCommit;
        private final List<OperationOutcome> outcomes = new ArrayList<>();
        private String failedOperation;
        private CodemodException error;
        private CodemodException rollbackError;
        private String rollbackOptions;

        public Builder state(BatchState state) {
            this.state = state;
            return this;
        }

        public Builder checkpoint(RollbackPoint checkpoint) {
            this.checkpoint = checkpoint;
            return this;
        }

        public Builder appliedCommit(String appliedCommit) {
            this.appliedCommit = appliedCommit;
            return this;
        }

        public Builder addOutcome(OperationOutcome outcome) {
            this.outcomes.add(outcome);
            return this;
        }

        public Builder failedOperation(String failedOperation) {
            this.failedOperation = failedOperation;
            return this;
        }

        public Builder error(CodemodException error) {
            this.error = error;
            return this;
        }

        public Builder rollbackError(CodemodException rollbackError) {
            this.rollbackError = rollbackError;
            return this;
        }

        public Builder rollbackOptions(String rollbackOptions) {
            this.rollbackOptions = rollbackOptions;
            return this;
        }

        public ApplyResult build() {
            return new ApplyResult(state, checkpoint, appliedCommit, List.copyOf(outcomes),
                    failedOperation, error, rollbackError, rollbackOptions);
        }
    }
}
