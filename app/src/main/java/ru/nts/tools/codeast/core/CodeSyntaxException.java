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

import ru.nts.tools.codeast.ast.SourceSpan;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Syntax error found in the parsed tree under the {@code raise} policy.
 * {@link #getMessage()} returns the positional message of the first ERROR node.
 */
public class CodeSyntaxException extends CodeAstException {

    private final SourceSpan span;
    private final String positionalMessage;

    public CodeSyntaxException(String positionalMessage, SourceSpan span) {
        super(CodeAstErrorCode.SYNTAX_ERROR, context(positionalMessage, span));
        this.span = span;
        this.positionalMessage = positionalMessage;
    }

    private static Map<String, Object> context(String positionalMessage, SourceSpan span) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("detail", positionalMessage);
        ctx.put("startLine", span.startLine());
        ctx.put("startColumn", span.startColumn());
        ctx.put("endLine", span.endLine());
        ctx.put("endColumn", span.endColumn());
        return ctx;
    }

    /**
     * Позиция ERROR узла в координатах парсера (0-based).
     */
    public SourceSpan span() {
        return span;
    }

    @Override
    public String getMessage() {
        return positionalMessage;
    }
}
