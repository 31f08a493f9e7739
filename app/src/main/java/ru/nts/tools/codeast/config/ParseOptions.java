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
 * Опции вызова разбора: политика синтаксических ошибок и прозрачные опции языка.
 * Неизменяемый объект; методы {@code with*} возвращают новый экземпляр.
 *
 * @param syntaxErrorPolicy реакция на ERROR узлы
 * @param passthrough       остальные опции, передаются в {@link ParserConfig} как есть
 */
public record ParseOptions(SyntaxErrorPolicy syntaxErrorPolicy, Map<String, Object> passthrough) {

    /** Ключ опции политики ошибок. */
    public static final String SYNTAX_ERROR = "syntax_error";

    /** Альтернативный ключ политики ошибок. */
    public static final String SYNTAX_ERROR_POLICY = "syntaxErrorPolicy";

    private static final ParseOptions DEFAULTS = new ParseOptions(SyntaxErrorPolicy.DEFAULT, Map.of());

    public ParseOptions {
        Objects.requireNonNull(syntaxErrorPolicy, "syntaxErrorPolicy");
        passthrough = passthrough == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(passthrough));
    }

    public static ParseOptions defaults() {
        return DEFAULTS;
    }

    public static ParseOptions of(SyntaxErrorPolicy policy) {
        return new ParseOptions(policy, Map.of());
    }

    /**
     * Создаёт опции из карты ключ-значение.
     * Ключ {@code syntax_error} (или {@code syntaxErrorPolicy}) задаёт политику,
     * принимается строка или {@link SyntaxErrorPolicy}. Остальные ключи передаются дальше.
     */
    public static ParseOptions fromMap(Map<String, ?> options) {
        if (options == null || options.isEmpty()) {
            return DEFAULTS;
        }
        SyntaxErrorPolicy policy = SyntaxErrorPolicy.DEFAULT;
        Map<String, Object> rest = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : options.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            if (SYNTAX_ERROR.equals(key) || SYNTAX_ERROR_POLICY.equals(key)) {
                policy = value instanceof SyntaxErrorPolicy p ? p : SyntaxErrorPolicy.fromId(String.valueOf(value));
            } else {
                rest.put(key, value);
            }
        }
        return new ParseOptions(policy, rest);
    }

    public ParseOptions withSyntaxErrorPolicy(SyntaxErrorPolicy policy) {
        return new ParseOptions(policy, passthrough);
    }

    public ParseOptions withOption(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(passthrough);
        copy.put(key, value);
        return new ParseOptions(syntaxErrorPolicy, copy);
    }
}
