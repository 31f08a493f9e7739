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
package ru.nts.tools.codeast.core;

import org.mozilla.universalchardet.UniversalDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Утилиты для определения кодировки и чтения файлов исходного кода.
 * Использует UniversalDetector (juniversalchardet) для автоматического определения Charset.
 */
public final class EncodingUtils {

    private static final Logger log = LoggerFactory.getLogger(EncodingUtils.class);

    private static final Charset CYRILLIC_FALLBACK = Charset.forName("windows-1251");

    private static final int BINARY_CHECK_LIMIT = 8192;

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
     * Считывает полный текст файла с автоопределением кодировки.
     *
     * @param path Путь к файлу.
     * @return Объект {@link TextFileContent} с текстом файла.
     * @throws IOException Если файл недоступен.
     * @throws CodeAstFileException Если файл бинарный.
     */
    public static TextFileContent readTextFile(Path path) throws IOException {
        byte[] allBytes = Files.readAllBytes(path);
        Charset charset = detectCharset(allBytes);
        allBytes = stripBom(allBytes, charset);

        // NULL-байты допустимы только в многобайтовых UTF кодировках
        if (!charset.name().startsWith("UTF-16") && !charset.name().startsWith("UTF-32")) {
            int checkLimit = Math.min(allBytes.length, BINARY_CHECK_LIMIT);
            for (int i = 0; i < checkLimit; i++) {
                if (allBytes[i] == 0) {
                    throw CodeAstFileException.binary(path);
                }
            }
        }

        return new TextFileContent(new String(allBytes, charset), charset);
    }

    /**
     * Определяет кодировку по содержимому. Невалидный UTF-8 без явного результата детектора
     * считается windows-1251.
     */
    static Charset detectCharset(byte[] bytes) {
        UniversalDetector detector = new UniversalDetector(null);
        detector.handleData(bytes, 0, bytes.length);
        detector.dataEnd();

        String encoding = detector.getDetectedCharset();
        Charset charset = StandardCharsets.UTF_8;
        if (encoding != null) {
            try {
                charset = Charset.forName(encoding);
            } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
                log.debug("Detected charset {} is not available, falling back to UTF-8", encoding);
            }
        }

        if ((encoding == null || charset.equals(StandardCharsets.UTF_8)) && !isValidUtf8(bytes)) {
            charset = CYRILLIC_FALLBACK;
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
            if (((allBytes[0] & 0xFF) == 0xFE && (allBytes[1] & 0xFF) == 0xFF)
                    || ((allBytes[0] & 0xFF) == 0xFF && (allBytes[1] & 0xFF) == 0xFE)) {
                offset = 2;
            }
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
