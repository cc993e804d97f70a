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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Определение кодировки исходников перед структурной правкой.
 */
class EncodingUtilsTest {

    @Test
    void utf8IsDetected(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("utf8.py");
        String content = "GREETING = 'Привет, мир!'\n";
        Files.writeString(file, content, StandardCharsets.UTF_8);

        EncodingUtils.TextFileContent read = EncodingUtils.readTextFile(file);
        assertEquals(StandardCharsets.UTF_8, read.charset());
        assertEquals(content, read.content());
    }

    @Test
    void utf8BomIsStripped(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("bom.py");
        byte[] body = "X = 1\n".getBytes(StandardCharsets.UTF_8);
        byte[] withBom = new byte[body.length + 3];
        withBom[0] = (byte) 0xEF;
        withBom[1] = (byte) 0xBB;
        withBom[2] = (byte) 0xBF;
        System.arraycopy(body, 0, withBom, 3, body.length);
        Files.write(file, withBom);

        assertEquals("X = 1\n", EncodingUtils.readTextFile(file).content());
    }

    @Test
    void windows1251IsReadWithoutLoss(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("legacy.py");
        // Повторы дают детектору достаточную выборку
        String content = "# Это русский текст в кодировке Windows-1251. " + "Проверка кириллицы. ".repeat(20) + "\n";
        Files.write(file, content.getBytes(Charset.forName("windows-1251")));

        assertEquals(content, EncodingUtils.readTextFile(file).content());
    }

    @Test
    void asciiIsWidenedToUtf8(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("ascii.py");
        Files.writeString(file, "X = 1\n", StandardCharsets.US_ASCII);
        assertEquals(StandardCharsets.UTF_8, EncodingUtils.readTextFile(file).charset());
    }

    @Test
    void binaryFilesAreRefused(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("blob.bin");
        Files.write(file, new byte[]{'a', 0, 'b', 0, 0, 'c'});
        assertThrows(IOException.class, () -> EncodingUtils.readTextFile(file));
    }
}
