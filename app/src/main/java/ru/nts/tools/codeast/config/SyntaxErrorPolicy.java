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

import ru.nts.tools.codeast.core.InvalidOptionException;

import java.util.Locale;

/**
 * Реакция на ERROR узлы в разобранном дереве.
 */
public enum SyntaxErrorPolicy {

    /** Первая найденная ошибка прерывает разбор исключением. */
    RAISE("raise"),

    /** Каждая ошибка пишется в лог как предупреждение, разбор продолжается. */
    WARN("warn"),

    /** Проверка не выполняется. Удобно для разбора неполных фрагментов кода. */
    IGNORE("ignore");

    public static final SyntaxErrorPolicy DEFAULT = RAISE;

    private final String id;

    SyntaxErrorPolicy(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    /**
     * Разбирает значение опции ({@code raise}, {@code warn}, {@code ignore}) без учёта регистра.
     *
     * @throws InvalidOptionException если значение неизвестно
     */
    public static SyntaxErrorPolicy fromId(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (SyntaxErrorPolicy policy : values()) {
                if (policy.id.equals(normalized)) {
                    return policy;
                }
            }
        }
        throw InvalidOptionException.invalid(ParseOptions.SYNTAX_ERROR, value, "raise, warn, ignore");
    }
}
