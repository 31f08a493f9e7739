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

import java.util.Map;

/**
 * Structured error codes for code-ast.
 * Each error has a human-readable message and a solution hint.
 *
 * <p>Example rendering:
 * <pre>
 * [ERROR: LANGUAGE_NOT_SUPPORTED]
 * Message: Language not supported
 * Solution: Language 'ruby' has no registered grammar. Supported: python, java, javascript.
 * Context: language=ruby
 * </pre>
 */
public enum CodeAstErrorCode {

    // ============ Input Errors ============

    EMPTY_INPUT("The code string is empty",
            "Cannot tokenize anything empty. Pass non-blank source code."),

    // ============ Language Errors ============

    LANGUAGE_GUESS_UNSUPPORTED("Guessing the language automatically is currently not implemented",
            "Please specify a language explicitly, e.g. CodeAst.parseAst(code, \"python\")."),

    LANGUAGE_NOT_SUPPORTED("Language not supported",
            "Language '%language%' has no registered grammar. Supported: %supported%."),

    // ============ Option Errors ============

    OPTION_INVALID("Invalid option value",
            "Option '%option%' does not accept '%value%'. Expected: %expected%."),

    // ============ Syntax Errors ============

    SYNTAX_ERROR("Problem while parsing given code snippet",
            "Fix the reported position or use syntax_error=warn|ignore to parse incomplete snippets."),

    // ============ File Errors ============

    FILE_NOT_READABLE("File not readable",
            "Check that '%path%' exists and is readable."),

    FILE_IS_BINARY("Binary file detected",
            "Cannot parse binary content. '%path%' contains NULL bytes."),

    // ============ System Errors ============

    PARSER_FAILURE("Parser failure",
            "The underlying parser returned no tree for language '%language%'.");

    private final String message;
    private final String solution;

    CodeAstErrorCode(String message, String solution) {
        this.message = message;
        this.solution = solution;
    }

    public String getMessage() {
        return message;
    }

    public String getSolution() {
        return solution;
    }

    /**
     * Formats error message with optional context.
     *
     * @param context Optional context map (language, path, option, etc.)
     * @return Formatted error string
     */
    public String format(Map<String, Object> context) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("[ERROR: %s]\n", this.name()));
        sb.append(String.format("Message: %s\n", message));

        // Интерполяция %placeholder% в solution
        String resolvedSolution = solution;
        if (context != null) {
            for (Map.Entry<String, Object> entry : context.entrySet()) {
                resolvedSolution = resolvedSolution.replace(
                        "%" + entry.getKey() + "%", String.valueOf(entry.getValue()));
            }
        }
        resolvedSolution = resolvedSolution.replaceAll("%\\w+%", "...");
        sb.append(String.format("Solution: %s", resolvedSolution));

        if (context != null && !context.isEmpty()) {
            sb.append("\nContext: ");
            boolean first = true;
            for (Map.Entry<String, Object> entry : context.entrySet()) {
                if (!first) sb.append(", ");
                sb.append(entry.getKey()).append("=").append(entry.getValue());
                first = false;
            }
        }

        return sb.toString();
    }

    /**
     * Formats error message without context.
     */
    public String format() {
        return format(null);
    }
}
