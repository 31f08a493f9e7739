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
package ru.nts.tools.codeast.treesitter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treesitter.TSNode;
import org.treesitter.TSPoint;
import org.treesitter.TSTree;
import ru.nts.tools.codeast.ast.AstNode;
import ru.nts.tools.codeast.ast.SourceSpan;
import ru.nts.tools.codeast.ast.SyntaxTree;
import ru.nts.tools.codeast.parser.ParsedSource;
import ru.nts.tools.codeast.parser.SourceParser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Парсер на базе tree-sitter.
 * Нормализует концы строк, разбирает текст и копирует нативное дерево в {@link SyntaxTree},
 * которое не держит нативных ресурсов и не зависит от времени жизни {@link TSTree}.
 */
public final class TreeSitterSourceParser implements SourceParser {

    private static final Logger log = LoggerFactory.getLogger(TreeSitterSourceParser.class);

    private final String langId;
    private final TreeSitterManager manager;

    public TreeSitterSourceParser(String langId) {
        this(langId, TreeSitterManager.getInstance());
    }

    public TreeSitterSourceParser(String langId, TreeSitterManager manager) {
        this.langId = langId;
        this.manager = manager;
    }

    public String languageId() {
        return langId;
    }

    @Override
    public ParsedSource parse(String source) {
        String normalized = normalizeLineEndings(source);
        TSTree tsTree = manager.parse(normalized, langId);
        SyntaxTree tree = convert(tsTree.getRootNode(), normalized);
        log.debug("Parsed {} bytes of {} into {} nodes", normalized.length(), langId, tree.nodeCount());
        return new ParsedSource(tree, normalized);
    }

    /**
     * Приводит CRLF и одиночный CR к LF.
     */
    static String normalizeLineEndings(String source) {
        if (source.indexOf('\r') < 0) {
            return source;
        }
        return source.replace("\r\n", "\n").replace('\r', '\n');
    }

    /**
     * Копирует дерево снизу вверх (post-order) без рекурсии.
     */
    private SyntaxTree convert(TSNode tsRoot, String source) {
        SyntaxTree.Builder builder = SyntaxTree.builder(langId, source);
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(tsRoot));
        AstNode root = null;

        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (frame.nextChild < frame.childCount) {
                TSNode child = frame.node.getChild(frame.nextChild++);
                if (child != null && !child.isNull()) {
                    stack.push(new Frame(child));
                }
                continue;
            }

            stack.pop();
            TSNode node = frame.node;
            AstNode built = builder.node(node.getType(), toSpan(node), node.isNamed(), node.isMissing(), frame.children);
            if (stack.isEmpty()) {
                root = built;
            } else {
                stack.peek().children.add(built);
            }
        }
        return builder.build(root);
    }

    private static SourceSpan toSpan(TSNode node) {
        TSPoint start = node.getStartPoint();
        TSPoint end = node.getEndPoint();
        return new SourceSpan(start.getRow(), start.getColumn(), end.getRow(), end.getColumn(),
                node.getStartByte(), node.getEndByte());
    }

    private static final class Frame {
        final TSNode node;
        final int childCount;
        final List<AstNode> children = new ArrayList<>();
        int nextChild;

        Frame(TSNode node) {
            this.node = node;
            this.childCount = node.getChildCount();
        }
    }
}
