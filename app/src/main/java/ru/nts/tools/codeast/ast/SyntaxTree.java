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

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Синтаксическое дерево: корневой узел и нормализованный исходный код, по которому оно построено.
 * Все узлы дерева ссылаются на один и тот же {@link SourceText}, поэтому позиции всегда
 * согласованы с текстом, который хранит дерево.
 */
public final class SyntaxTree {

    private final String language;
    private final SourceText source;
    private final AstNode root;
    private final int nodeCount;

    private SyntaxTree(String language, SourceText source, AstNode root, int nodeCount) {
        this.language = language;
        this.source = source;
        this.root = root;
        this.nodeCount = nodeCount;
    }

    public static Builder builder(String language, String source) {
        return new Builder(language, source);
    }

    public String language() {
        return language;
    }

    public AstNode root() {
        return root;
    }

    /**
     * Нормализованный исходный код.
     */
    public String source() {
        return source.text();
    }

    public int nodeCount() {
        return nodeCount;
    }

    @Override
    public String toString() {
        return "SyntaxTree[language=" + language + ", nodes=" + nodeCount + ", root=" + root + "]";
    }

    /**
     * Строит дерево снизу вверх: сначала дочерние узлы, затем родитель, в конце корень.
     */
    public static final class Builder {

        private final String language;
        private final SourceText source;

        private Builder(String language, String source) {
            this.language = Objects.requireNonNull(language, "language");
            this.source = new SourceText(Objects.requireNonNull(source, "source"));
        }

        public AstNode node(String kind, SourceSpan span, List<AstNode> children) {
            return node(kind, span, true, false, children);
        }

        public AstNode node(String kind, SourceSpan span, boolean named, boolean missing,
                            List<AstNode> children) {
            for (AstNode child : children) {
                requireOwned(child);
            }
            return new AstNode(kind, span, named, missing, children, source);
        }

        public AstNode leaf(String kind, SourceSpan span) {
            return node(kind, span, List.of());
        }

        /**
         * Вычисляет позицию по байтовому диапазону исходника: строки и колонки 0-based,
         * колонка в байтах от начала строки.
         */
        public SourceSpan spanOf(int startByte, int endByte) {
            byte[] bytes = source.text().getBytes(StandardCharsets.UTF_8);
            int[] start = point(bytes, startByte);
            int[] end = point(bytes, endByte);
            return new SourceSpan(start[0], start[1], end[0], end[1], startByte, endByte);
        }

        private static int[] point(byte[] bytes, int offset) {
            int line = 0;
            int lineStart = 0;
            int limit = Math.min(offset, bytes.length);
            for (int i = 0; i < limit; i++) {
                if (bytes[i] == '\n') {
                    line++;
                    lineStart = i + 1;
                }
            }
            return new int[]{line, offset - lineStart};
        }

        public SyntaxTree build(AstNode root) {
            requireOwned(root);
            return new SyntaxTree(language, source, root, count(root));
        }

        private void requireOwned(AstNode node) {
            if (node.source() != source) {
                throw new IllegalArgumentException("Node " + node + " belongs to another tree");
            }
        }

        private static int count(AstNode root) {
            int count = 0;
            Deque<AstNode> stack = new ArrayDeque<>();
            stack.push(root);
            while (!stack.isEmpty()) {
                AstNode node = stack.pop();
                count++;
                for (AstNode child : node.children()) {
                    stack.push(child);
                }
            }
            return count;
        }
    }
}
