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
package ru.nts.tools.codeast.treesitter;

import ru.nts.tools.codeast.core.UnsupportedLanguageException;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Реестр поддерживаемых языков и их псевдонимов.
 * Поддерживаемые языки: python, java, javascript.
 */
public final class LanguageRegistry {

    private LanguageRegistry() {}

    /**
     * Отображение псевдонимов на идентификаторы языков.
     */
    private static final Map<String, String> ALIASES = Map.ofEntries(
            // Python
            Map.entry("python", "python"),
            Map.entry("python3", "python"),
            Map.entry("py", "python"),

            // Java
            Map.entry("java", "java"),

            // JavaScript
            Map.entry("javascript", "javascript"),
            Map.entry("js", "javascript"),
            Map.entry("node", "javascript")
    );

    /**
     * Список поддерживаемых языков.
     */
    private static final List<String> SUPPORTED_LANGUAGES = List.of("python", "java", "javascript");

    /**
     * Находит канонический идентификатор языка без учёта регистра.
     *
     * @param language тег языка или псевдоним
     * @return идентификатор языка или empty если язык не поддерживается
     */
    public static Optional<String> lookup(String language) {
        if (language == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(ALIASES.get(language.trim().toLowerCase(Locale.ROOT)));
    }

    /**
     * Как {@link #lookup(String)}, но для неизвестного языка выбрасывает исключение.
     */
    public static String resolve(String language) {
        return lookup(language)
                .orElseThrow(() -> UnsupportedLanguageException.notSupported(language, SUPPORTED_LANGUAGES));
    }

    public static boolean isSupported(String language) {
        return lookup(language).isPresent();
    }

    /**
     * Возвращает список всех поддерживаемых языков.
     *
     * @return неизменяемый список идентификаторов языков
     */
    public static List<String> getSupportedLanguages() {
        return SUPPORTED_LANGUAGES;
    }
}
