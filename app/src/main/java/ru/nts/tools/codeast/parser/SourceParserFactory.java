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
package ru.nts.tools.codeast.parser;

import ru.nts.tools.codeast.core.UnsupportedLanguageException;

/**
 * Источник парсеров по языкам.
 */
public interface SourceParserFactory {

    /**
     * Приводит тег языка к каноническому идентификатору.
     *
     * @throws UnsupportedLanguageException если язык не поддерживается
     */
    String resolveLanguage(String language);

    /**
     * @param languageId канонический идентификатор, полученный из {@link #resolveLanguage(String)}
     */
    SourceParser forLanguage(String languageId);
}
