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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Разбивает дерево на плоскую последовательность семантических компонентов:
 * инструкций, определений, комментариев и строк.
 *
 * <p>Алгоритм для узла:
 * <ol>
 *     <li>пока у узла ровно один потомок, узел заменяется этим потомком;</li>
 *     <li>узел типа из {@link #META_TYPES} или с суффиксом {@code _statement} атомарен и
 *         возвращается целиком, без разбора вложенных определений и комментариев;</li>
 *     <li>иначе каждый потомок по порядку: лист, META тип или {@code _statement} родитель
 *         дают сам потомок, остальные разбираются тем же алгоритмом.</li>
 * </ol>
 *
 * Узел без потомков, не прошедший проверку на атомарность, даёт пустой результат.
 * Текст между компонентами (пунктуация, пробелы) в результат не попадает.
 */
public final class ComponentExtractor {

    /** Типы узлов, которые всегда считаются атомарными компонентами. */
    public static final Set<String> META_TYPES = Set.of(
            "string", "docstring", "comment", "class_definition", "function_definition");

    public static final String STATEMENT_SUFFIX = "_statement";

    private ComponentExtractor() {}

    /**
     * Извлекает компоненты из поддерева. Чистая функция: дерево не меняется,
     * результат детерминирован и принадлежит вызывающему.
     *
     * @param root корень поддерева, может быть null
     * @return компоненты в порядке исходного кода
     */
    public static List<AstNode> extract(AstNode root) {
        List<AstNode> components = new ArrayList<>();
        if (root == null) {
            return components;
        }

        // Явный стек даёт тот же порядок, что и рекурсия, без ограничения на глубину
        Deque<Step> steps = new ArrayDeque<>();
        steps.push(new Step(root, true));

        while (!steps.isEmpty()) {
            Step step = steps.pop();
            if (!step.expand()) {
                components.add(step.node());
                continue;
            }

            AstNode node = collapse(step.node());
            if (isAtomicKind(node.kind())) {
                components.add(node);
                continue;
            }

            boolean statementParent = isStatementKind(node.kind());
            List<AstNode> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                AstNode child = children.get(i);
                boolean atomic = child.isLeaf() || isMetaType(child.kind()) || statementParent;
                steps.push(new Step(child, !atomic));
            }
        }
        return components;
    }

    /**
     * Пропускает цепочку узлов с единственным потомком.
     */
    static AstNode collapse(AstNode node) {
        AstNode current = node;
        while (current.childCount() == 1) {
            current = current.child(0);
        }
        return current;
    }

    public static boolean isMetaType(String kind) {
        return META_TYPES.contains(kind);
    }

    public static boolean isStatementKind(String kind) {
        return kind.endsWith(STATEMENT_SUFFIX);
    }

    /**
     * Узел такого типа не разбирается дальше.
     */
    public static boolean isAtomicKind(String kind) {
        return isMetaType(kind) || isStatementKind(kind);
    }

    private record Step(AstNode node, boolean expand) {}
}
