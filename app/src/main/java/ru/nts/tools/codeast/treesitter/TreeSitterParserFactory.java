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

import ru.nts.tools.codeast.parser.SourceParser;
import ru.nts.tools.codeast.parser.SourceParserFactory;

/**
 * Фабрика tree-sitter парсеров для языков из {@link LanguageRegistry}.
 */
public final class TreeSitterParserFactory implements SourceParserFactory {

    private static final TreeSitterParserFactory INSTANCE = new TreeSitterParserFactory();

    private final TreeSitterManager manager;

    private TreeSitterParserFactory() {
        this.manager = TreeSitterManager.getInstance();
    }

    public static TreeSitterParserFactory getInstance() {
        return INSTANCE;
    }

    @Override
    public String resolveLanguage(String language) {
        return LanguageRegistry.resolve(language);
    }

    @Override
    public SourceParser forLanguage(String languageId) {
        return new TreeSitterSourceParser(languageId, manager);
    }
}
