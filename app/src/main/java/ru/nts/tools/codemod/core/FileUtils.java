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

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CodingErrorAction;
import java.nio.file.*;
import java.nio.file.attribute.PosixFilePermission;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Утилиты для безопасной работы с файловой системой.
 * Реализует Safe Swap (перезапись через временный файл)
 * и Retry Pattern для обхода кратковременных блокировок файлов.
 */
public final class FileUtils {

    private static final int MAX_RETRIES = 5;
    private static final long INITIAL_BACKOFF = 50; // ms

    private FileUtils() {}

    /**
     * Выполняет IO-операцию с механизмом повторов.
     */
    public static <T> T executeWithRetry(IORunnable<T> action) throws IOException {
        FileSystemException lastException = null;
        for (int i = 0; i < MAX_RETRIES; i++) {
            try {
                return action.run();
            } catch (NoSuchFileException | FileAlreadyExistsException | DirectoryNotEmptyException e) {
                // Повтор не изменит результат
                throw e;
            } catch (FileSystemException e) {
                lastException = e;
                long backoff = INITIAL_BACKOFF * (long) Math.pow(2, i);
                try {
                    TimeUnit.MILLISECONDS.sleep(backoff);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new IOException("Retry interrupted", ie);
                }
            }
        }
        throw lastException;
    }

    /**
     * Гарантирует существование родительской директории для указанного пути.
     */
    public static void ensureParentExists(Path path) throws IOException {
        Path parent = path.getParent();
        if (parent != null && !Files.exists(parent)) {
            Files.createDirectories(parent);
        }
    }

    /**
     * Безопасная запись контента в файл с использованием алгоритма Safe Swap.
     * Кодировка сохраняется той, в которой файл был прочитан.
     */
    public static void safeWrite(Path path, String content, Charset charset) throws IOException {
        ensureParentExists(path);
        Path tempFile = path.resolveSibling(path.getFileName() + ".tmp");
        Path backupFile = path.resolveSibling(path.getFileName() + ".old");
        byte[] bytes = encode(content, charset);

        executeWithRetry(() -> {
            Files.write(tempFile, bytes, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
            if (Files.exists(path)) {
                Files.move(path, backupFile, StandardCopyOption.REPLACE_EXISTING);
            }
            try {
                Files.move(tempFile, path, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException e) {
                if (Files.exists(backupFile)) {
                    Files.move(backupFile, path, StandardCopyOption.REPLACE_EXISTING);
                }
                throw e;
            }
            Files.deleteIfExists(backupFile);
            return null;
        });
    }

    private static byte[] encode(String content, Charset charset) throws IOException {
        CharsetEncoder encoder = charset.newEncoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        ByteBuffer buffer;
        try {
            buffer = encoder.encode(CharBuffer.wrap(content));
        } catch (CharacterCodingException e) {
            throw new IOException("Cannot write file in " + charset.name() + " encoding: "
                    + "content contains characters not representable in this encoding.", e);
        }
        byte[] bytes = new byte[buffer.remaining()];
        buffer.get(bytes);
        return bytes;
    }

    /**
     * Безопасное чтение всех байтов файла.
     */
    public static byte[] safeReadAllBytes(Path path) throws IOException {
        return executeWithRetry(() -> Files.readAllBytes(path));
    }

    /**
     * Безопасное перемещение/переименование файла или директории.
     */
    public static void safeMove(Path source, Path target, CopyOption... options) throws IOException {
        ensureParentExists(target);
        executeWithRetry(() -> {
            Files.move(source, target, options);
            return null;
        });
    }

    /**
     * Безопасное удаление файла или пустой директории.
     */
    public static void safeDelete(Path path) throws IOException {
        executeWithRetry(() -> {
            Files.deleteIfExists(path);
            return null;
        });
    }

    /**
     * Рекурсивно удаляет директорию вместе с содержимым (сначала самые глубокие элементы).
     */
    public static void deleteRecursively(Path directory) throws IOException {
        List<Path> entries;
        try (Stream<Path> walk = Files.walk(directory)) {
            entries = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
        }
        for (Path entry : entries) {
            safeDelete(entry);
        }
    }

    /**
     * Добавляет права на исполнение для владельца, группы и остальных.
     * На файловых системах без POSIX-атрибутов используется {@link java.io.File#setExecutable}.
     */
    public static void makeExecutable(Path path) throws IOException {
        try {
            Set<PosixFilePermission> permissions = Files.getPosixFilePermissions(path);
            permissions.add(PosixFilePermission.OWNER_EXECUTE);
            permissions.add(PosixFilePermission.GROUP_EXECUTE);
            permissions.add(PosixFilePermission.OTHERS_EXECUTE);
            Files.setPosixFilePermissions(path, permissions);
        } catch (UnsupportedOperationException e) {
            if (!path.toFile().setExecutable(true, false)) {
                throw new IOException("Cannot mark file as executable: " + path, e);
            }
        }
    }

    @FunctionalInterface
    public interface IORunnable<T> {
        T run() throws IOException;
    }
}
