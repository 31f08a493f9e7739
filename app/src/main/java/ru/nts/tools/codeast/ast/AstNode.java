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

import java.util.List;

/**
 * Узел синтаксического дерева: тип, позиция, упорядоченные дочерние узлы и текст.
 * Узлы принадлежат {@link SyntaxTree} и создаются только через {@link SyntaxTree.Builder}.
 * Равенство по ссылке: два узла равны, только если это один и тот же узел дерева.
 */
public final class AstNode {

    private final String kind;
    private final SourceSpan span;
    private final boolean named;
    private final boolean missing;
    private final List<AstNode> children;
    private final SourceText source;

    AstNode(String kind, SourceSpan span, boolean named, boolean missing,
            List<AstNode> children, SourceText source) {
        this.kind = kind;
        this.span = span;
        this.named = named;
        this.missing = missing;
        this.children = List.copyOf(children);
        this.source = source;
    }

    /**
     * Тип узла по грамматике (например {@code function_definition}, {@code ERROR}).
     */
    public String kind() {
        return kind;
    }

    public SourceSpan span() {
        return span;
    }

    /**
     * Именованный узел грамматики (не анонимный токен вроде {@code "="}).
     */
    public boolean isNamed() {
        return named;
    }

    /**
     * Узел вставлен парсером при восстановлении после ошибки и не имеет текста.
     */
    public boolean isMissing() {
        return missing;
    }

    public List<AstNode> children() {
        return children;
    }

    public int childCount() {
        return children.size();
    }

    public AstNode child(int index) {
        return children.get(index);
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    /**
     * Текст исходника, покрываемый узлом.
     */
    public String text() {
        return source.slice(span.startByte(), span.endByte());
    }

    SourceText source() {
        return source;
    }

    @Override
    public String toString() {
        return kind + span;
    }
}
