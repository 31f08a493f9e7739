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
import ru.nts.tools.codeast.config.ParseOptions;
import ru.nts.tools.codeast.config.ParserConfig;
import ru.nts.tools.codeast.config.SyntaxErrorPolicy;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SourceCodeAstTest {

    private static SyntaxTree sampleTree() {
        String source = "x = 1";
        SyntaxTree.Builder b = SyntaxTree.builder("python", source);
        AstNode assignment = b.node("assignment", b.spanOf(0, 5), List.of(
                b.leaf("identifier", b.spanOf(0, 1)),
                b.node("=", b.spanOf(2, 3), false, false, List.of()),
                b.leaf("integer", b.spanOf(4, 5))));
        AstNode statement = b.node("expression_statement", b.spanOf(0, 5), List.of(assignment));
        return b.build(b.node("module", b.spanOf(0, 5), List.of(statement)));
    }

    @Test
    void exposesConfigTreeAndSource() {
        SyntaxTree tree = sampleTree();
        ParserConfig config = ParserConfig.of("python", ParseOptions.of(SyntaxErrorPolicy.WARN));

        SourceCodeAst ast = new SourceCodeAst(config, tree, "x = 1");

        assertSame(tree.root(), ast.root());
        assertSame(tree, ast.tree());
        assertEquals("python", ast.language());
        assertEquals(SyntaxErrorPolicy.WARN, ast.config().syntaxErrorPolicy());
        assertEquals("x = 1", ast.source());
    }

    @Test
    void sExpression_skipsAnonymousNodes() {
        SourceCodeAst ast = new SourceCodeAst(ParserConfig.of("python", null), sampleTree(), "x = 1");

        assertEquals("(module (expression_statement (assignment (identifier) (integer))))", ast.toSExpression());
        assertTrue(ast.toString().startsWith("SourceCodeAst[language=python, nodes=6, root=(module"));
    }

    @Test
    void components_delegateToExtractor() {
        SourceCodeAst ast = new SourceCodeAst(ParserConfig.of("python", null), sampleTree(), "x = 1");

        List<AstNode> components = ast.components();

        assertEquals(List.of("identifier", "=", "integer"), components.stream().map(AstNode::kind).toList());
        assertEquals(ComponentExtractor.extract(ast.root()), components);
    }

    @Test
    void sourceMustMatchTreeText() {
        SyntaxTree tree = sampleTree();
        ParserConfig config = ParserConfig.of("python", null);

        assertThrows(IllegalArgumentException.class, () -> new SourceCodeAst(config, tree, "x = 2"));
    }

    @Test
    void wrappersAreNotInterchangeable() {
        SyntaxTree tree = sampleTree();
        ParserConfig config = ParserConfig.of("python", null);

        SourceCodeAst first = new SourceCodeAst(config, tree, "x = 1");
        SourceCodeAst second = new SourceCodeAst(config, tree, "x = 1");

        assertNotEquals(first, second);
    }
}
