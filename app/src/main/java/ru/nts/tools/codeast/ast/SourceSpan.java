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

/**
 * Позиция узла в исходном коде.
 * Строки и колонки 0-based, как их отдаёт парсер; колонки и смещения считаются в байтах UTF-8.
 * Значения не пересчитываются, чтобы сообщения об ошибках совпадали с координатами парсера.
 *
 * @param startLine   строка начала
 * @param startColumn колонка начала
 * @param endLine     строка конца
 * @param endColumn   колонка конца (исключительно)
 * @param startByte   смещение начала в байтах
 * @param endByte     смещение конца в байтах (исключительно)
 */
public record SourceSpan(int startLine, int startColumn, int endLine, int endColumn,
                         int startByte, int endByte) {

    public SourceSpan {
        if (startByte < 0 || endByte < startByte) {
            throw new IllegalArgumentException("Invalid byte range: " + startByte + ".." + endByte);
        }
    }

    public boolean isSingleLine() {
        return startLine == endLine;
    }

    /**
     * Проверяет, что этот диапазон целиком лежит внутри другого.
     */
    public boolean isWithin(SourceSpan other) {
        return startByte >= other.startByte && endByte <= other.endByte;
    }

    public int length() {
        return endByte - startByte;
    }

    @Override
    public String toString() {
        return "[" + startLine + ":" + startColumn + " - " + endLine + ":" + endColumn + "]";
    }
}
