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
package ru.nts.tools.codeast.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Конфигурация одного вызова разбора. Создаётся один раз на вызов и не изменяется.
 *
 * @param language          канонический идентификатор языка
 * @param syntaxErrorPolicy реакция на ERROR узлы
 * @param options           прозрачные опции языка
 */
public record ParserConfig(String language, SyntaxErrorPolicy syntaxErrorPolicy, Map<String, Object> options) {

    public ParserConfig {
        Objects.requireNonNull(language, "language");
        Objects.requireNonNull(syntaxErrorPolicy, "syntaxErrorPolicy");
        options = options == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(options));
    }

    public static ParserConfig of(String language, ParseOptions options) {
        ParseOptions effective = options != null ? options : ParseOptions.defaults();
        return new ParserConfig(language, effective.syntaxErrorPolicy(), effective.passthrough());
    }

    /**
     * Возвращает прозрачную опцию или значение по умолчанию.
     */
    public Object option(String key, Object defaultValue) {
        return options.getOrDefault(key, defaultValue);
    }
}
