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

import org.mozilla.universalchardet.UniversalDetector;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Path;

/**
 * Утилиты для определения кодировки и чтения редактируемых исходников.
 * Использует UniversalDetector (juniversalchardet), чтобы файл был записан обратно
 * в той же кодировке, в которой был прочитан.
 */
public final class EncodingUtils {

    private EncodingUtils() {}

    /**
     * Результат чтения текстового файла с определенной кодировкой.
     *
     * @param content Содержимое файла в виде строки.
     * @param charset Кодировка, использованная для декодирования байтов.
     */
    public record TextFileContent(String content, Charset charset) {
    }

    /**
     * Считывает полный текст файла с принудительно указанной кодировкой.
     */
    public static TextFileContent readTextFile(Path path, Charset charset) throws IOException {
        byte[] allBytes = stripBom(FileUtils.safeReadAllBytes(path), charset);
        return new TextFileContent(new String(allBytes, charset), charset);
    }

    /**
     * Считывает полный текст файла с автоопределением кодировки.
     *
     * @param path Путь к целевому файлу.
     * @return Объект {@link TextFileContent} с текстом файла.
     * @throws IOException Если файл недоступен или является бинарным.
     */
    public static TextFileContent readTextFile(Path path) throws IOException {
        byte[] allBytes = FileUtils.safeReadAllBytes(path);
        Charset charset = detect(allBytes);
        allBytes = stripBom(allBytes, charset);

        // Проверка на бинарный файл (наличие NULL-байтов), кроме многобайтовых кодировок UTF
        if (!charset.name().startsWith("UTF-16") && !charset.name().startsWith("UTF-32")) {
            int checkLimit = Math.min(allBytes.length, 8192);
            for (int i = 0; i < checkLimit; i++) {
                if (allBytes[i] == 0) {
                    throw new IOException("Binary file detected (contains NULL bytes): " + path);
                }
            }
        }
        return new TextFileContent(new String(allBytes, charset), charset);
    }

    static Charset detect(byte[] allBytes) {
        if (allBytes.length == 0) {
            return StandardCharsets.UTF_8;
        }
        UniversalDetector detector = new UniversalDetector(null);
        detector.handleData(allBytes, 0, allBytes.length);
        detector.dataEnd();

        String encoding = detector.getDetectedCharset();
        Charset charset = StandardCharsets.UTF_8;
        if (encoding != null) {
            try {
                charset = Charset.forName(encoding);
            } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
                charset = StandardCharsets.UTF_8;
            }
        }

        // Детектор не уверен или выбрал UTF-8 на невалидных байтах: откат на windows-1251
        if ((encoding == null || charset.equals(StandardCharsets.UTF_8)) && !isValidUtf8(allBytes)) {
            charset = Charset.forName("windows-1251");
        }
        // ASCII-файл может получить не-ASCII текст из фрагмента
        if (charset.equals(StandardCharsets.US_ASCII)) {
            charset = StandardCharsets.UTF_8;
        }
        return charset;
    }

    private static byte[] stripBom(byte[] allBytes, Charset charset) {
        String name = charset.name().toUpperCase();
        int offset = 0;
        if (name.equals("UTF-8")) {
            if (allBytes.length >= 3 && (allBytes[0] & 0xFF) == 0xEF && (allBytes[1] & 0xFF) == 0xBB && (allBytes[2] & 0xFF) == 0xBF) {
                offset = 3;
            }
        } else if (name.startsWith("UTF-16") && allBytes.length >= 2) {
            int b0 = allBytes[0] & 0xFF;
            int b1 = allBytes[1] & 0xFF;
            if ((b0 == 0xFE && b1 == 0xFF) || (b0 == 0xFF && b1 == 0xFE)) offset = 2;
        }

        if (offset > 0) {
            byte[] withoutBom = new byte[allBytes.length - offset];
            System.arraycopy(allBytes, offset, withoutBom, 0, withoutBom.length);
            return withoutBom;
        }
        return allBytes;
    }

    /**
     * Проверяет, является ли массив байтов валидной последовательностью UTF-8.
     */
    private static boolean isValidUtf8(byte[] bytes) {
        int i = 0;
        while (i < bytes.length) {
            int b = bytes[i++] & 0xFF;
            if (b <= 0x7F) continue; // ASCII

            int count;
            if (b >= 0xC2 && b <= 0xDF) count = 1;
            else if (b >= 0xE0 && b <= 0xEF) count = 2;
            else if (b >= 0xF0 && b <= 0xF4) count = 3;
            else return false;

            if (i + count > bytes.length) return false;

            for (int j = 0; j < count; j++) {
                int next = bytes[i++] & 0xFF;
                if (next < 0x80 || next > 0xBF) return false;
            }
        }
        return true;
    }
}
