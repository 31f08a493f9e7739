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
import java.util.Map;

/**
 * Exception for parse option errors.
 */
public class InvalidOptionException extends CodeAstException {

    public InvalidOptionException(Map<String, Object> context) {
        super(CodeAstErrorCode.OPTION_INVALID, context);
    }

    /**
     * Factory: Invalid option value
     */
    public static InvalidOptionException invalid(String option, Object value, String expected) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("option", option);
        ctx.put("value", value);
        ctx.put("expected", expected);
        return new InvalidOptionException(ctx);
    }
}
