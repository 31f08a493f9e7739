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
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Обход дерева в глубину (pre-order): родитель раньше детей, дети слева направо.
 * Каждый узел посещается ровно один раз.
 *
 * <p>Наследники регистрируют обработчики по типу узла через {@link #on(String, Consumer)}.
 * Узлы без обработчика уходят в {@link #visitDefault(AstNode)}, который по умолчанию ничего не делает,
 * поэтому новые типы узлов грамматики не требуют изменений в обходе.
 * Обработчик может прервать обход, выбросив исключение.
 */
public abstract class AstVisitor {

    private final Map<String, Consumer<AstNode>> handlers = new HashMap<>();

    /**
     * Регистрирует обработчик для узлов указанного типа.
     */
    protected final void on(String kind, Consumer<AstNode> handler) {
        handlers.put(kind, handler);
    }

    public void visit(SyntaxTree tree) {
        visit(tree.root());
    }

    /**
     * Обходит поддерево. Явный стек вместо рекурсии: глубина дерева не ограничена стеком вызовов.
     */
    public void visit(AstNode root) {
        if (root == null) {
            return;
        }
        Deque<AstNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            AstNode node = stack.pop();
            dispatch(node);

            List<AstNode> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
    }

    private void dispatch(AstNode node) {
        Consumer<AstNode> handler = handlers.get(node.kind());
        if (handler != null) {
            handler.accept(node);
        } else {
            visitDefault(node);
        }
    }

    /**
     * Обработчик для узлов без зарегистрированного типа.
     */
    protected void visitDefault(AstNode node) {
    }
}
