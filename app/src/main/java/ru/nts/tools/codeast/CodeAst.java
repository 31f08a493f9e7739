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
package ru.nts.tools.codeast;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.nts.tools.codeast.ast.AstNode;
import ru.nts.tools.codeast.ast.ComponentExtractor;
import ru.nts.tools.codeast.ast.ErrorVisitor;
import ru.nts.tools.codeast.ast.SourceCodeAst;
import ru.nts.tools.codeast.config.ParseOptions;
import ru.nts.tools.codeast.config.ParserConfig;
import ru.nts.tools.codeast.core.CodeAstFileException;
import ru.nts.tools.codeast.core.CodeSyntaxException;
import ru.nts.tools.codeast.core.EmptyInputException;
import ru.nts.tools.codeast.core.EncodingUtils;
import ru.nts.tools.codeast.core.UnsupportedLanguageException;
import ru.nts.tools.codeast.parser.ParsedSource;
import ru.nts.tools.codeast.parser.SourceParserFactory;
import ru.nts.tools.codeast.treesitter.TreeSitterParserFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Точка входа: разбор исходного кода в проверенное дерево и извлечение компонентов.
 *
 * <pre>
 * SourceCodeAst ast = CodeAst.defaultInstance().parseAst(code, "python");
 * List&lt;AstNode&gt; components = CodeAst.extractComponents(ast.root());
 * </pre>
 */
public final class CodeAst {

    private static final Logger log = LoggerFactory.getLogger(CodeAst.class);

    /** Тег языка, запрашивающий автоопределение (не поддерживается). */
    public static final String GUESS = "guess";

    private static final CodeAst DEFAULT = new CodeAst(TreeSitterParserFactory.getInstance());

    private final SourceParserFactory parserFactory;

    public CodeAst(SourceParserFactory parserFactory) {
        this.parserFactory = Objects.requireNonNull(parserFactory, "parserFactory");
    }

    /**
     * Экземпляр на базе tree-sitter.
     */
    public static CodeAst defaultInstance() {
        return DEFAULT;
    }

    public SourceCodeAst parseAst(String sourceCode) {
        return parseAst(sourceCode, GUESS, ParseOptions.defaults());
    }

    public SourceCodeAst parseAst(String sourceCode, String lang) {
        return parseAst(sourceCode, lang, ParseOptions.defaults());
    }

    /**
     * Разбирает исходный код и проверяет дерево на синтаксические ошибки.
     *
     * @param sourceCode исходный код; поддерживаются и неполные фрагменты при политике warn/ignore
     * @param lang       тег языка; {@code guess} не поддерживается
     * @param options    политика ошибок и прозрачные опции языка
     * @return проверенное дерево
     * @throws EmptyInputException          если код пуст после обрезки пробелов
     * @throws UnsupportedLanguageException если язык не задан явно или не поддерживается
     * @throws CodeSyntaxException          при политике raise и наличии ERROR узла
     */
    public SourceCodeAst parseAst(String sourceCode, String lang, ParseOptions options) {
        if (sourceCode == null || sourceCode.strip().isEmpty()) {
            throw new EmptyInputException(sourceCode);
        }

        if (lang == null || GUESS.equalsIgnoreCase(lang.trim())) {
            throw UnsupportedLanguageException.guessNotImplemented();
        }

        String langId = parserFactory.resolveLanguage(lang);
        log.debug("Parsing source code with parser for {}", langId);

        ParserConfig config = ParserConfig.of(langId, options);
        ParsedSource parsed = parserFactory.forLanguage(langId).parse(sourceCode);

        int warnings = ErrorVisitor.check(parsed.tree(), config.syntaxErrorPolicy());
        if (warnings > 0) {
            log.debug("Accepted {} source with {} syntax error(s) under policy {}",
                    langId, warnings, config.syntaxErrorPolicy().id());
        }

        return new SourceCodeAst(config, parsed.tree(), parsed.source());
    }

    /**
     * Читает файл с автоопределением кодировки и разбирает его.
     *
     * @throws CodeAstFileException если файл не читается или бинарный
     */
    public SourceCodeAst parseFile(Path file, String lang, ParseOptions options) {
        EncodingUtils.TextFileContent content;
        try {
            content = EncodingUtils.readTextFile(file);
        } catch (IOException e) {
            throw CodeAstFileException.notReadable(file, e);
        }
        log.debug("Read {} as {}", file, content.charset());
        return parseAst(content.content(), lang, options);
    }

    /**
     * Компоненты поддерева, см. {@link ComponentExtractor#extract(AstNode)}.
     * Применимо к любому узлу, не только к корню.
     */
    public static List<AstNode> extractComponents(AstNode node) {
        return ComponentExtractor.extract(node);
    }
}
