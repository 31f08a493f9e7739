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

import ru.nts.tools.codeast.config.ParserConfig;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Проверенное синтаксическое дерево вместе с конфигурацией и исходным кодом.
 * Создаётся только после проверки на синтаксические ошибки. Неизменяем.
 * Экземпляры не взаимозаменяемы: каждый оборачивает ровно одно дерево, равенство по ссылке.
 */
public final class SourceCodeAst {

    /** Маркер в стеке обхода: закрывает скобку текущего узла. */
    private static final AstNode CLOSE = new AstNode(")", new SourceSpan(0, 0, 0, 0, 0, 0),
            false, false, List.of(), new SourceText(""));

    private final ParserConfig config;
    private final SyntaxTree tree;
    private final String source;

    /**
     * @param config конфигурация вызова
     * @param tree   проверенное дерево
     * @param source нормализованный исходный код, по которому построено дерево
     * @throws IllegalArgumentException если исходный код не совпадает с текстом дерева
     */
    public SourceCodeAst(ParserConfig config, SyntaxTree tree, String source) {
        this.config = Objects.requireNonNull(config, "config");
        this.tree = Objects.requireNonNull(tree, "tree");
        this.source = Objects.requireNonNull(source, "source");
        if (!source.equals(tree.source())) {
            throw new IllegalArgumentException("Source text does not match the text the tree was built from");
        }
    }

    public AstNode root() {
        return tree.root();
    }

    public String language() {
        return config.language();
    }

    public ParserConfig config() {
        return config;
    }

    public SyntaxTree tree() {
        return tree;
    }

    public String source() {
        return source;
    }

    /**
     * Компоненты всего дерева, см. {@link ComponentExtractor#extract(AstNode)}.
     */
    public List<AstNode> components() {
        return ComponentExtractor.extract(tree.root());
    }

    /**
     * S-выражение именованных узлов, в духе {@code ts_node_string}:
     * {@code (module (expression_statement (assignment (identifier) (integer))))}.
     */
    public String toSExpression() {
        StringBuilder sb = new StringBuilder();
        Deque<AstNode> stack = new ArrayDeque<>();
        stack.push(tree.root());
        boolean first = true;
        while (!stack.isEmpty()) {
            AstNode node = stack.pop();
            if (node == CLOSE) {
                sb.append(')');
                continue;
            }
            if (!first) {
                sb.append(' ');
            }
            first = false;
            sb.append('(');
            if (node.isMissing()) {
                sb.append("MISSING ");
            }
            sb.append(node.kind());
            stack.push(CLOSE);
            List<AstNode> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                AstNode child = children.get(i);
                if (child.isNamed() || ErrorVisitor.ERROR_KIND.equals(child.kind())) {
                    stack.push(child);
                }
            }
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "SourceCodeAst[language=" + language()
                + ", nodes=" + tree.nodeCount()
                + ", root=" + toSExpression() + "]";
    }
}
