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
package ru.nts.tools.codeast.ast;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.nts.tools.codeast.config.SyntaxErrorPolicy;
import ru.nts.tools.codeast.core.CodeSyntaxException;

/**
 * Проверка дерева на ERROR узлы согласно {@link SyntaxErrorPolicy}.
 *
 * <ul>
 *     <li>{@code RAISE}: первый ERROR узел в порядке обхода прерывает проверку {@link CodeSyntaxException};</li>
 *     <li>{@code WARN}: каждый ERROR узел пишется в лог, обход продолжается;</li>
 *     <li>{@code IGNORE}: обход не выполняется.</li>
 * </ul>
 *
 * Реагирует только на узлы ровно с типом {@code ERROR}. Узлы внутри ошибочной области
 * и MISSING узлы отдельно не сообщаются.
 */
public final class ErrorVisitor extends AstVisitor {

    private static final Logger log = LoggerFactory.getLogger(ErrorVisitor.class);

    /** Тип узла, которым парсер помечает нераспознанный фрагмент. */
    public static final String ERROR_KIND = "ERROR";

    private static final String MESSAGE_PREFIX = "Problem while parsing given code snippet. Error occurred ";

    private final SyntaxErrorPolicy policy;
    private int reported;

    public ErrorVisitor(SyntaxErrorPolicy policy) {
        this.policy = policy;
        on(ERROR_KIND, this::visitError);
    }

    /**
     * Проверяет дерево. Для {@code IGNORE} возвращается сразу, без обхода.
     *
     * @return количество ERROR узлов, о которых выдано предупреждение (0 для RAISE и IGNORE)
     * @throws CodeSyntaxException для RAISE при первом ERROR узле
     */
    public static int check(SyntaxTree tree, SyntaxErrorPolicy policy) {
        if (policy == SyntaxErrorPolicy.IGNORE) {
            return 0;
        }
        ErrorVisitor visitor = new ErrorVisitor(policy);
        visitor.visit(tree);
        return visitor.reported();
    }

    private void visitError(AstNode node) {
        switch (policy) {
            case RAISE -> throw new CodeSyntaxException(constructErrorMessage(node.span()), node.span());
            case WARN -> {
                log.warn(constructErrorMessage(node.span()));
                reported++;
            }
            case IGNORE -> {
            }
        }
    }

    /**
     * Количество предупреждений, выданных этим экземпляром.
     */
    public int reported() {
        return reported;
    }

    /**
     * Формирует сообщение об ошибке с позицией в координатах парсера.
     * Однострочный узел: {@code in line L [pos. S - E]},
     * многострочный: {@code inbetween line L1 (start: S) to line L2 (end: E)}.
     */
    public static String constructErrorMessage(SourceSpan span) {
        return MESSAGE_PREFIX + describePosition(span);
    }

    static String describePosition(SourceSpan span) {
        if (span.isSingleLine()) {
            return String.format("in line %d [pos. %d - %d]",
                    span.startLine(), span.startColumn(), span.endColumn());
        }
        return String.format("inbetween line %d (start: %d) to line %d (end: %d)",
                span.startLine(), span.startColumn(), span.endLine(), span.endColumn());
    }
}
