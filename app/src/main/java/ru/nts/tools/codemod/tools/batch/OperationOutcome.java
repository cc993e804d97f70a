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
 * Итог одной операции пакета.
 *
 * @param operation имя операции в формате описания пакета
 * @param target    путь к файлу и, для структурных правок, лексический путь
 * @param status    результат
 * @param detail    пояснение для отчета
 */
public record OperationOutcome(String operation, String target, Status status, String detail) {

    public enum Status {
        APPLIED,
        REPLACED,
        INSERTED,
        DELETED,
        NOT_FOUND,
        SKIPPED
    }

    public static OperationOutcome applied(String operation, String target, String detail) {
        return new OperationOutcome(operation, target, Status.APPLIED, detail);
    }

    @Override
    public String toString() {
        return operation + " " + target + ": " + status + (detail != null && !detail.isEmpty() ? " (" + detail + ")" : "");
    }
}
