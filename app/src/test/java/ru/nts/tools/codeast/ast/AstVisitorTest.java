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

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AstVisitorTest {

    /**
     * Записывает порядок посещения: узлы "mark" через обработчик, остальные через visitDefault.
     */
    private static final class RecordingVisitor extends AstVisitor {
        final List<String> handled = new ArrayList<>();
        final List<String> defaults = new ArrayList<>();

        RecordingVisitor() {
            on("mark", node -> handled.add(node.kind() + "@" + node.span().startByte()));
        }

        @Override
        protected void visitDefault(AstNode node) {
            defaults.add(node.kind());
        }
    }

    @Test
    void visitsParentBeforeChildren_leftToRight() {
        TestTrees t = new TestTrees();
        AstNode root = t.node("root",
                t.node("a", t.leaf("a1"), t.leaf("a2")),
                t.node("b", t.node("b1", t.leaf("b11"))),
                t.leaf("c"));

        RecordingVisitor visitor = new RecordingVisitor();
        visitor.visit(t.tree(root));

        assertEquals(List.of("root", "a", "a1", "a2", "b", "b1", "b11", "c"), visitor.defaults);
        assertTrue(visitor.handled.isEmpty());
    }

    @Test
    void registeredHandler_replacesDefault() {
        TestTrees t = new TestTrees();
        AstNode root = t.node("root", t.leaf("mark"), t.node("inner", t.leaf("mark")));

        RecordingVisitor visitor = new RecordingVisitor();
        visitor.visit(root);

        assertEquals(List.of("mark@0", "mark@1"), visitor.handled);
        assertEquals(List.of("root", "inner"), visitor.defaults);
    }

    @Test
    void everyNodeVisitedExactlyOnce() {
        TestTrees t = new TestTrees();
        AstNode root = t.node("root", t.node("x", t.leaf("y"), t.leaf("z")), t.leaf("w"));
        SyntaxTree tree = t.tree(root);

        RecordingVisitor visitor = new RecordingVisitor();
        visitor.visit(tree);

        assertEquals(tree.nodeCount(), visitor.defaults.size());
    }

    @Test
    void handlerException_abortsTraversal() {
        TestTrees t = new TestTrees();
        AstNode root = t.node("root", t.leaf("stop"), t.leaf("after"));

        List<String> seen = new ArrayList<>();
        AstVisitor visitor = new AstVisitor() {
            {
                on("stop", node -> {
                    throw new IllegalStateException("stop at " + node.span().startByte());
                });
            }

            @Override
            protected void visitDefault(AstNode node) {
                seen.add(node.kind());
            }
        };

        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> visitor.visit(root));
        assertEquals("stop at 0", ex.getMessage());
        assertEquals(List.of("root"), seen);
    }

    @Test
    void nullNode_isNoop() {
        RecordingVisitor visitor = new RecordingVisitor();
        visitor.visit((AstNode) null);
        assertTrue(visitor.defaults.isEmpty());
    }

    @Test
    void deepTree_isTraversedWithoutRecursion() {
        TestTrees t = new TestTrees();
        AstNode current = t.leaf("leaf");
        int depth = 100_000;
        for (int i = 0; i < depth; i++) {
            current = t.node("wrap", current);
        }

        RecordingVisitor visitor = new RecordingVisitor();
        visitor.visit(current);

        assertEquals(depth + 1, visitor.defaults.size());
        assertEquals("leaf", visitor.defaults.get(depth));
    }
}
