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

import java.nio.file.Path;
import java.util.Map;

/**
 * Exception for source file read errors.
 */
public class CodeAstFileException extends CodeAstException {

    public CodeAstFileException(CodeAstErrorCode code, Path path, Throwable cause) {
        super(code, Map.of("path", path.toString()), cause);
    }

    /**
     * Factory: file missing or unreadable
     */
    public static CodeAstFileException notReadable(Path path, Throwable cause) {
        return new CodeAstFileException(CodeAstErrorCode.FILE_NOT_READABLE, path, cause);
    }

    /**
     * Factory: file contains binary content
     */
    public static CodeAstFileException binary(Path path) {
        return new CodeAstFileException(CodeAstErrorCode.FILE_IS_BINARY, path, null);
    }
}
