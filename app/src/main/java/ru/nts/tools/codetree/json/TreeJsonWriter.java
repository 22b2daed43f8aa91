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
package ru.nts.tools.codetree.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import ru.nts.tools.codetree.tree.Node;
import ru.nts.tools.codetree.tree.NodeList;
import ru.nts.tools.codetree.tree.Trivia;

import java.util.List;

/**
 * Renders nodes as JSON for tooling that consumes trees out of process.
 *
 * <p>Example of one node:
 * <pre>
 * {
 *   "kind": "FIELD", "keyword": "field", "name": "x", "role": "",
 *   "start": 42, "end": 49, "source": "int x;",
 *   "path": "namespace/class/field", "alternativePath": "namespace[N]/class[C]/field[x]",
 *   "leadingTrivia": [{"kind": "LINE_COMMENT", "text": "// counter"}],
 *   "children": [ ... ]
 * }
 * </pre>
 */
public final class TreeJsonWriter {

    private final ObjectMapper mapper;
    private final boolean recursive;

    /**
     * @param mapper mapper used to create and print nodes
     * @param recursive whether to include children
     */
    public TreeJsonWriter(ObjectMapper mapper, boolean recursive) {
        this.mapper = mapper;
        this.recursive = recursive;
    }

    public TreeJsonWriter() {
        this(new ObjectMapper(), true);
    }

    public ObjectNode toJson(Node node) {
        ObjectNode json = mapper.createObjectNode();
        json.put("kind", node.getKind().name());
        json.put("keyword", node.getKind().getKeyword());
        json.put("name", node.getName());
        json.put("role", node.getRole());
        json.put("start", node.getStartPosition());
        json.put("end", node.getEndPosition());
        json.put("source", node.getSource());
        json.put("path", node.getFullPath());
        json.put("alternativePath", node.getPossibleAlternativePath());
        if (!node.getLeadingTrivia().isEmpty()) {
            json.set("leadingTrivia", triviaJson(node.getLeadingTrivia()));
        }
        if (!node.getTrailingTrivia().isEmpty()) {
            json.set("trailingTrivia", triviaJson(node.getTrailingTrivia()));
        }
        if (recursive && node.getChildCount() > 0) {
            json.set("children", toJson(node.getChildren()));
        }
        return json;
    }

    public ArrayNode toJson(NodeList nodes) {
        ArrayNode array = mapper.createArrayNode();
        for (Node node : nodes) {
            array.add(toJson(node));
        }
        return array;
    }

    /**
     * Pretty-printed JSON array of the nodes.
     */
    public String write(NodeList nodes) throws JsonProcessingException {
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(nodes));
    }

    private ArrayNode triviaJson(List<Trivia> trivia) {
        ArrayNode array = mapper.createArrayNode();
        for (Trivia t : trivia) {
            ObjectNode item = array.addObject();
            item.put("kind", t.kind().name());
            item.put("text", t.text());
        }
        return array;
    }
}
