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
package ru.nts.tools.codemod.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Утилита для синхронного выполнения внешних процессов (в первую очередь git).
 * 1. Изоляция: команда выполняется строго в указанной рабочей директории.
 * 2. Безопасность: прямой запуск через ProcessBuilder без shell, поэтому цепочки ';' и '|' невозможны.
 * 3. Стабильность: жесткий лимит на время выполнения и объем сохраняемого вывода.
 */
public final class ProcessExecutor {

    private static final Logger log = LoggerFactory.getLogger(ProcessExecutor.class);

    /**
     * Максимальное количество строк вывода, которое сохраняется для одной команды.
     */
    private static final int MAX_OUTPUT_LINES = 1000;

    private ProcessExecutor() {}

    /**
     * Выполняет внешнюю команду и дожидается ее завершения.
     * При превышении таймаута процесс принудительно завершается.
     *
     * @param command        Список аргументов команды. Первый элемент - исполняемый файл.
     * @param workingDir     Рабочая директория процесса.
     * @param timeoutSeconds Максимальное время ожидания в секундах.
     *
     * @return Объект {@link ExecutionResult} с кодом выхода и объединенным выводом stdout + stderr.
     *
     * @throws IOException          Если процесс не удалось запустить.
     * @throws InterruptedException Если поток был прерван во время ожидания.
     */
    public static ExecutionResult execute(List<String> command, Path workingDir, long timeoutSeconds)
            throws IOException, InterruptedException {
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.directory(workingDir.toFile());
        pb.redirectErrorStream(true);

        log.debug("exec {} in {}", command, workingDir);
        Process process = pb.start();
        StringBuilder outputAccumulator = new StringBuilder();

        Thread reader = new Thread(() -> drain(process, outputAccumulator), "process-output-reader");
        reader.setDaemon(true);
        reader.start();

        try {
            boolean finished = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);
            if (!finished) {
                process.destroyForcibly();
                reader.join(TimeUnit.SECONDS.toMillis(1));
                return new ExecutionResult(-1, "[TIMEOUT_REACHED] " + currentOutput(outputAccumulator), true);
            }
            // Дочитываем остаток вывода после завершения процесса
            reader.join(TimeUnit.SECONDS.toMillis(timeoutSeconds));
            return new ExecutionResult(process.exitValue(), currentOutput(outputAccumulator), false);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw e;
        }
    }

    private static void drain(Process process, StringBuilder outputAccumulator) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            int linesRead = 0;
            while ((line = reader.readLine()) != null) {
                synchronized (outputAccumulator) {
                    if (linesRead < MAX_OUTPUT_LINES) {
                        outputAccumulator.append(line).append("\n");
                    } else if (linesRead == MAX_OUTPUT_LINES) {
                        outputAccumulator.append("... [Output truncated due to limit] ...");
                    }
                    linesRead++;
                }
            }
        } catch (IOException e) {
            // Поток закрывается при принудительном завершении процесса
            if (process.isAlive()) {
                throw new UncheckedIOException(e);
            }
            log.debug("Output stream closed: {}", e.getMessage());
        }
    }

    private static String currentOutput(StringBuilder outputAccumulator) {
        synchronized (outputAccumulator) {
            return outputAccumulator.toString();
        }
    }

    /**
     * Результат выполнения внешней команды.
     *
     * @param exitCode Код выхода процесса (0 - успех, -1 - таймаут).
     * @param output   Текстовый вывод (stdout + stderr).
     * @param timedOut true, если процесс был остановлен по таймауту.
     */
    public record ExecutionResult(int exitCode, String output, boolean timedOut) {

        public boolean isSuccess() {
            return exitCode == 0 && !timedOut;
        }
    }
}
