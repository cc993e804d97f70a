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

/**
 * Настройки применения пакета модификаций.
 *
 * @param autoRollback         откатывать рабочее дерево к контрольной точке при ошибке;
 *                             false - ручной режим, точка возвращается вызывающему
 * @param autoCommit           фиксировать изменения после успешного применения
 * @param bestEffortDeletes    не прерывать пакет, если удаляемая декларация не найдена
 * @param checkpointMessage    сообщение коммита контрольной точки
 * @param defaultCommitMessage сообщение итогового коммита, если в пакете нет описания
 */
public record ApplyOptions(boolean autoRollback,
                           boolean autoCommit,
                           boolean bestEffortDeletes,
                           String checkpointMessage,
                           String defaultCommitMessage) {

    public static final String DEFAULT_CHECKPOINT_MESSAGE = "Before modifications";
    public static final String DEFAULT_COMMIT_MESSAGE = "After modifications";

    public ApplyOptions {
        if (checkpointMessage == null || checkpointMessage.isBlank()) {
            checkpointMessage = DEFAULT_CHECKPOINT_MESSAGE;
        }
        if (defaultCommitMessage == null || defaultCommitMessage.isBlank()) {
            defaultCommitMessage = DEFAULT_COMMIT_MESSAGE;
        }
    }

    public static ApplyOptions defaults() {
        return new ApplyOptions(true, true, false, DEFAULT_CHECKPOINT_MESSAGE, DEFAULT_COMMIT_MESSAGE);
    }

    public ApplyOptions withAutoRollback(boolean value) {
        return new ApplyOptions(value, autoCommit, bestEffortDeletes, checkpointMessage, defaultCommitMessage);
    }

    public ApplyOptions withAutoCommit(boolean value) {
        return new ApplyOptions(autoRollback, value, bestEffortDeletes, checkpointMessage, defaultCommitMessage);
    }

    public ApplyOptions withBestEffortDeletes(boolean value) {
        return new ApplyOptions(autoRollback, autoCommit, value, checkpointMessage, defaultCommitMessage);
    }

    public ApplyOptions withDefaultCommitMessage(String message) {
        return new ApplyOptions(autoRollback, autoCommit, bestEffortDeletes, checkpointMessage, message);
    }
}
