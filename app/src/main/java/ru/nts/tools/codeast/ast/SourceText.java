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
package ru.nts.tools.codeast.ast;

import java.nio.charset.StandardCharsets;

/**
 * Нормализованный исходный код, на котором построено дерево.
 * Хранит строку и её UTF-8 представление: смещения узлов считаются в байтах.
 */
public final class SourceText {

    private final String text;
    private final byte[] bytes;

    public SourceText(String text) {
        this.text = text;
        this.bytes = text.getBytes(StandardCharsets.UTF_8);
    }

    public String text() {
        return text;
    }

    public int byteLength() {
        return bytes.length;
    }

    /**
     * Возвращает фрагмент исходника по байтовому диапазону.
     * Диапазон за пределами текста даёт пустую строку.
     */
    public String slice(int startByte, int endByte) {
        if (startByte >= 0 && endByte <= bytes.length && startByte < endByte) {
            return new String(bytes, startByte, endByte - startByte, StandardCharsets.UTF_8);
        }
        return "";
    }

    @Override
    public String toString() {
        return text;
    }
}
