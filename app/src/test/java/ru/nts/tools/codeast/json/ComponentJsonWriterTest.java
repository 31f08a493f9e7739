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
package ru.nts.tools.codeast.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;
import ru.nts.tools.codeast.ast.AstNode;
import ru.nts.tools.codeast.ast.SourceCodeAst;
import ru.nts.tools.codeast.ast.SyntaxTree;
import ru.nts.tools.codeast.config.ParserConfig;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ComponentJsonWriterTest {

    private final ComponentJsonWriter writer = new ComponentJsonWriter();

    private static SourceCodeAst sample() {
        String source = "import os\n# c\n";
        SyntaxTree.Builder b = SyntaxTree.builder("python", source);
        AstNode importStatement = b.node("import_statement", b.spanOf(0, 9), List.of(
                b.node("import", b.spanOf(0, 6), false, false, List.of()),
                b.leaf("dotted_name", b.spanOf(7, 9))));
        AstNode comment = b.leaf("comment", b.spanOf(10, 13));
        SyntaxTree tree = b.build(b.node("module", b.spanOf(0, 14), List.of(importStatement, comment)));
        return new SourceCodeAst(ParserConfig.of("python", null), tree, source);
    }

    @Test
    void componentsDocument() throws Exception {
        SourceCodeAst ast = sample();

        ObjectNode document = writer.componentsToJson(ast.language(), ast.components());
        JsonNode parsed = new ObjectMapper().readTree(writer.write(document));

        assertEquals("python", parsed.get("language").asText());
        JsonNode components = parsed.get("components");
        assertEquals(2, components.size());
        assertEquals("import_statement", components.get(0).get("kind").asText());
        assertEquals("import os", components.get(0).get("text").asText());
        assertEquals("comment", components.get(1).get("kind").asText());
        assertEquals(1, components.get(1).get("startLine").asInt());
        assertEquals(0, components.get(1).get("startColumn").asInt());
        assertEquals(10, components.get(1).get("startByte").asInt());
        assertFalse(components.get(0).has("children"));
    }

    @Test
    void treeDocument_skipsAnonymousNodes() {
        ObjectNode document = writer.treeToJson(sample());

        assertEquals(5, document.get("nodeCount").asInt());
        JsonNode root = document.get("root");
        assertEquals("module", root.get("kind").asText());
        JsonNode importNode = root.get("children").get(0);
        assertEquals(1, importNode.get("children").size(), "Anonymous 'import' keyword is omitted");
        assertEquals("os", importNode.get("children").get(0).get("text").asText());
        assertFalse(root.has("text"));
    }
}
