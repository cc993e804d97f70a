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
 * Одна операция пакета модификаций.
 * Операция получает все сервисы и состояние пакета через {@link ApplyContext}
 * и сообщает об ошибке исключением {@link ru.nts.tools.codemod.core.CodemodException}.
 */
public interface Modification {

    /**
     * Имя операции в формате описания пакета (create_file, declare, ...).
     */
    String getName();

    /**
     * Короткое описание цели для отчета.
     */
    String target();

    /**
     * Выполняет операцию.
     *
     * @param context контекст пакета
     * @return итог операции
     */
    OperationOutcome apply(ApplyContext context);
}
