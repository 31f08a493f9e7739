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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import ru.nts.tools.codeast.ast.AstNode;
import ru.nts.tools.codeast.ast.ErrorVisitor;
import ru.nts.tools.codeast.ast.SourceCodeAst;
import ru.nts.tools.codeast.ast.SourceSpan;

import java.io.UncheckedIOException;
import java.util.List;

/**
 * JSON представление компонентов и деревьев.
 *
 * <pre>
 * {"language":"python","components":[{"kind":"function_definition","startLine":0,...,"text":"def f(): ..."}]}
 * </pre>
 */
public final class ComponentJsonWriter {

    private final ObjectMapper mapper;

    public ComponentJsonWriter() {
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Документ с языком и списком компонентов.
     */
    public ObjectNode componentsToJson(String language, List<AstNode> components) {
        ObjectNode root = mapper.createObjectNode();
        root.put("language", language);
        ArrayNode array = root.putArray("components");
        for (AstNode component : components) {
            array.add(nodeToJson(component, false));
        }
        return root;
    }

    /**
     * Документ с языком и полным деревом (только именованные узлы и ERROR).
     */
    public ObjectNode treeToJson(SourceCodeAst ast) {
        ObjectNode root = mapper.createObjectNode();
        root.put("language", ast.language());
        root.put("nodeCount", ast.tree().nodeCount());
        root.set("root", nodeToJson(ast.root(), true));
        return root;
    }

    private ObjectNode nodeToJson(AstNode node, boolean withChildren) {
        ObjectNode json = mapper.createObjectNode();
        SourceSpan span = node.span();
        json.put("kind", node.kind());
        json.put("startLine", span.startLine());
        json.put("startColumn", span.startColumn());
        json.put("endLine", span.endLine());
        json.put("endColumn", span.endColumn());
        json.put("startByte", span.startByte());
        json.put("endByte", span.endByte());
        if (node.isMissing()) {
            json.put("missing", true);
        }
        if (!withChildren || node.isLeaf()) {
            json.put("text", node.text());
        }
        if (withChildren && !node.isLeaf()) {
            ArrayNode children = json.putArray("children");
            for (AstNode child : node.children()) {
                if (child.isNamed() || ErrorVisitor.ERROR_KIND.equals(child.kind())) {
                    children.add(nodeToJson(child, true));
                }
            }
        }
        return json;
    }

    public String write(ObjectNode document) {
        try {
            return mapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
