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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Exception for language resolution errors: the caller asked for guessing,
 * or the language tag has no registered grammar.
 */
public class UnsupportedLanguageException extends CodeAstException {

    public UnsupportedLanguageException(CodeAstErrorCode code, Map<String, Object> context) {
        super(code, context);
    }

    /**
     * Factory: automatic language detection was requested
     */
    public static UnsupportedLanguageException guessNotImplemented() {
        return new UnsupportedLanguageException(CodeAstErrorCode.LANGUAGE_GUESS_UNSUPPORTED, Map.of());
    }

    /**
     * Factory: language tag is unknown
     */
    public static UnsupportedLanguageException notSupported(String language, List<String> supported) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("language", language);
        ctx.put("supported", String.join(", ", supported));
        return new UnsupportedLanguageException(CodeAstErrorCode.LANGUAGE_NOT_SUPPORTED, ctx);
    }
}
