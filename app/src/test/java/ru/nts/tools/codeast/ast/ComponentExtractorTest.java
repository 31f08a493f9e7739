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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ComponentExtractorTest {

    private TestTrees t;

    @BeforeEach
    void setUp() {
        t = new TestTrees();
    }

    @Test
    void nullRoot_returnsEmptyList() {
        List<AstNode> components = ComponentExtractor.extract(null);
        assertNotNull(components);
        assertTrue(components.isEmpty());
    }

    @ParameterizedTest
    @ValueSource(strings = {"string", "docstring", "comment", "class_definition", "function_definition"})
    void metaTypeNode_isReturnedAsSingleComponent(String kind) {
        AstNode node = t.node(kind, t.leaf("a"), t.node("block", t.leaf("comment"), t.leaf("b")));

        assertEquals(List.of(node), ComponentExtractor.extract(node));
    }

    @Test
    void statementKind_isAtomicEvenWithNestedDefinitions() {
        AstNode statement = t.node("if_statement",
                t.leaf("if"),
                t.node("block", t.node("function_definition", t.leaf("def"), t.leaf("name")), t.leaf("comment")));

        assertEquals(List.of(statement), ComponentExtractor.extract(statement));
    }

    @Test
    void singleChildChain_isCollapsedBeforeClassification() {
        AstNode statement = t.node("return_statement", t.leaf("return"), t.leaf("integer"));
        AstNode root = t.node("module", t.node("wrapper", statement));

        List<AstNode> components = ComponentExtractor.extract(root);

        assertEquals(1, components.size());
        assertSame(statement, components.get(0));
    }

    @Test
    void collapseReachesLeaf_nonMetaLeafYieldsNothing() {
        AstNode root = t.node("module", t.node("expression", t.leaf("identifier")));

        assertTrue(ComponentExtractor.extract(root).isEmpty());
    }

    @Test
    void collapseReachesMetaLeaf_leafIsReturned() {
        AstNode comment = t.leaf("comment");
        AstNode root = t.node("module", comment);

        assertEquals(List.of(comment), ComponentExtractor.extract(root));
    }

    @Test
    void childlessNonMetaRoot_yieldsEmptySequence() {
        AstNode root = t.node("module");

        assertTrue(ComponentExtractor.extract(root).isEmpty());
    }

    @Test
    void leafChildren_areAppendedAsIs() {
        AstNode x = t.leaf("identifier");
        AstNode eq = t.leaf("=");
        AstNode one = t.leaf("integer");
        AstNode assignment = t.node("assignment", x, eq, one);
        AstNode root = t.node("module", t.node("expression_statement", assignment));

        assertEquals(List.of(x, eq, one), ComponentExtractor.extract(root));
    }

    @Test
    void nonMetaChildren_areDecomposedRecursively() {
        AstNode importStatement = t.node("import_statement", t.leaf("import"), t.leaf("dotted_name"));
        AstNode comment = t.leaf("comment");
        AstNode function = t.node("function_definition", t.leaf("def"), t.leaf("identifier"), t.node("block",
                t.leaf("comment"), t.node("return_statement", t.leaf("return"), t.leaf("integer"))));
        AstNode innerStatement = t.node("expression_statement", t.leaf("call"), t.leaf(";"));
        AstNode group = t.node("decorated_group", t.leaf("@"), innerStatement);
        AstNode root = t.node("module", importStatement, comment, function, group);

        List<AstNode> components = ComponentExtractor.extract(root);

        assertEquals(List.of(importStatement, comment, function, group.child(0), innerStatement), components);
    }

    @Test
    void statementChildOfNonStatement_isStillCollapsedWhenRecursing() {
        AstNode x = t.leaf("identifier");
        AstNode eq = t.leaf("=");
        AstNode one = t.leaf("integer");
        AstNode first = t.node("expression_statement", t.node("assignment", x, eq, one));
        AstNode second = t.node("pass_statement", t.leaf("pass"), t.leaf(";"));
        AstNode root = t.node("module", first, second);

        assertEquals(List.of(x, eq, one, second), ComponentExtractor.extract(root));
    }

    @Test
    void extractionIsIdempotent() {
        AstNode root = t.node("module",
                t.node("expression_statement", t.leaf("call"), t.leaf(";")),
                t.node("wrapper", t.node("inner", t.leaf("a"), t.leaf("string"))),
                t.leaf("comment"));

        List<AstNode> first = ComponentExtractor.extract(root);
        List<AstNode> second = ComponentExtractor.extract(root);

        assertEquals(first, second);
        assertNotSame(first, second, "Each call must return a fresh list");
    }

    @Test
    void resultIsIndependentlyOwned() {
        AstNode root = t.node("module", t.leaf("comment"), t.leaf("comment"));

        List<AstNode> components = ComponentExtractor.extract(root);
        components.clear();

        assertEquals(2, ComponentExtractor.extract(root).size());
    }

    @Test
    void componentsAreDisjointAndOrdered() {
        AstNode root = t.node("program",
                t.node("class_body", t.leaf("{"), t.node("field_declaration", t.leaf("int"), t.leaf("x"))),
                t.node("expression_statement", t.leaf("call"), t.leaf(";")),
                t.node("member", t.node("pair", t.leaf("key"), t.leaf("string")), t.leaf("}")));

        assertDisjointAndOrdered(ComponentExtractor.extract(root));
    }

    @Test
    void deepNesting_doesNotOverflowStack() {
        int depth = 100_000;
        AstNode current = t.leaf("identifier");
        for (int i = 0; i < depth; i++) {
            current = t.node("nested", current, t.leaf(","));
        }

        List<AstNode> components = ComponentExtractor.extract(current);

        assertEquals(depth + 1, components.size());
        assertEquals("identifier", components.get(0).kind());
        assertDisjointAndOrdered(components);
    }

    @Test
    void atomicKindPredicates() {
        assertTrue(ComponentExtractor.isAtomicKind("function_definition"));
        assertTrue(ComponentExtractor.isAtomicKind("while_statement"));
        assertFalse(ComponentExtractor.isAtomicKind("statement_block"));
        assertFalse(ComponentExtractor.isMetaType("expression_statement"));
        assertTrue(ComponentExtractor.isStatementKind("expression_statement"));
    }

    static void assertDisjointAndOrdered(List<AstNode> components) {
        for (int i = 1; i < components.size(); i++) {
            SourceSpan previous = components.get(i - 1).span();
            SourceSpan current = components.get(i).span();
            assertTrue(previous.endByte() <= current.startByte(),
                    "Components overlap or are out of order: " + components.get(i - 1) + " / " + components.get(i));
        }
    }
}
