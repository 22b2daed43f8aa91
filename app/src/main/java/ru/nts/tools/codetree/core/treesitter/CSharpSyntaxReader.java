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
package ru.nts.tools.codetree.core.treesitter;

import org.treesitter.TSNode;
import ru.nts.tools.codetree.core.CodeTreeConfig;
import ru.nts.tools.codetree.tree.RawNode;
import ru.nts.tools.codetree.tree.RawTrivia;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Reads a tree-sitter C# tree into {@link RawNode}s shaped like a compiler syntax tree.
 *
 * <ul>
 *   <li>Only named grammar nodes are kept; keywords and punctuation are dropped.</li>
 *   <li>Wrapper nodes without a counterpart in a compiler tree are spliced into their
 *       enclosing scope (see {@link #SPLICED}).</li>
 *   <li>Extras (comments and line directives) become trivia. A run that starts on the row
 *       where the previous sibling ends trails that sibling, anything else leads the next one.</li>
 *   <li>Conditional compilation blocks turn into marker trivia around their spliced content.</li>
 *   <li>Regions the parser could not match become {@code ERROR} nodes with their named
 *       content read as children. Zero-width nodes inserted by error recovery are skipped.</li>
 * </ul>
 */
public final class CSharpSyntaxReader {

    static final Set<String> SPLICED = Set.of(
            "declaration_list",
            "enum_member_declaration_list",
            "switch_body",
            "variable_declarator"
    );

    static final String ENDIF_TOKEN = "#endif";
    static final String CONDITION_FIELD = "condition";

    private final SourceText source;
    private final CodeTreeConfig config;

    private CSharpSyntaxReader(SourceText source, CodeTreeConfig config) {
        this.source = source;
        this.config = config;
    }

    /**
     * Top-level constructs of a parsed compilation unit.
     *
     * @param root root node of the tree
     * @param content the exact text that was parsed
     */
    public static List<RawNode> read(TSNode root, String content, CodeTreeConfig config) {
        return new CSharpSyntaxReader(new SourceText(content), config).readScope(root);
    }

    private List<RawNode> readScope(TSNode parent) {
        List<Item> items = new ArrayList<>();
        collect(parent, items);
        return attach(items);
    }

    private void collect(TSNode parent, List<Item> items) {
        boolean conditional = conditionalTag(parent.getType()) != null;
        int childCount = parent.getChildCount();
        for (int i = 0; i < childCount; i++) {
            TSNode child = parent.getChild(i);
            if (child == null || child.isNull()) continue;

            String type = child.getType();
            // error recovery marks ERROR regions as extras, they still hold code
            if (child.isExtra() && !child.isError()) {
                items.add(trivia(type, child, false));
            } else if (!child.isNamed()) {
                if (conditional && ENDIF_TOKEN.equals(type)) {
                    items.add(trivia("preproc_endif", child, false));
                }
            } else if (child.isMissing() || child.getStartByte() >= child.getEndByte()) {
                config.debug("Skipped zero-width '" + type + "' at byte " + child.getStartByte());
            } else if (conditional && CONDITION_FIELD.equals(parent.getFieldNameForChild(i))) {
                // part of the directive line
            } else if (SPLICED.contains(type)) {
                collect(child, items);
            } else if (conditionalTag(type) != null) {
                items.add(trivia(conditionalTag(type), child, true));
                collect(child, items);
            } else {
                String role = parent.getFieldNameForChild(i);
                items.add(new NodeItem(child, role != null ? role : ""));
            }
        }
    }

    private List<RawNode> attach(List<Item> items) {
        List<Pending> nodes = new ArrayList<>();
        List<TriviaItem> leading = new ArrayList<>();
        Pending previous = null;

        for (Item item : items) {
            if (item instanceof TriviaItem trivia) {
                if (previous != null && leading.isEmpty() && trivia.startRow() == previous.endRow()) {
                    previous.trailing().add(trivia);
                } else {
                    leading.add(trivia);
                }
            } else {
                previous = new Pending((NodeItem) item, new ArrayList<>(leading), new ArrayList<>());
                leading.clear();
                nodes.add(previous);
            }
        }
        if (!leading.isEmpty()) {
            if (previous != null) {
                previous.trailing().addAll(leading);
            } else {
                config.debug("Dropped " + leading.size() + " trivia run(s) in a scope without nodes");
            }
        }

        List<RawNode> result = new ArrayList<>(nodes.size());
        for (Pending pending : nodes) {
            result.add(toRawNode(pending));
        }
        return result;
    }

    private RawNode toRawNode(Pending pending) {
        TSNode node = pending.item().node();
        int startByte = node.getStartByte();
        int endByte = node.getEndByte();
        int fullStart = pending.leading().isEmpty()
                ? startByte : Math.min(startByte, pending.leading().get(0).startByte());
        int fullEnd = pending.trailing().isEmpty()
                ? endByte : Math.max(endByte, pending.trailing().get(pending.trailing().size() - 1).endByte());

        return new TreeSitterRawNode(
                node.getType(),
                source.text(startByte, endByte),
                source.charOffset(fullStart),
                source.charOffset(fullEnd),
                pending.item().role(),
                readScope(node),
                toRawTrivia(pending.leading()),
                toRawTrivia(pending.trailing()));
    }

    private TriviaItem trivia(String tag, TSNode node, boolean firstLineOnly) {
        int startByte = node.getStartByte();
        int endByte = node.getEndByte();
        String text = source.text(startByte, endByte);
        if (firstLineOnly) {
            int newline = text.indexOf('\n');
            if (newline >= 0) {
                text = text.substring(0, newline);
                endByte = startByte + text.getBytes(StandardCharsets.UTF_8).length;
            }
        }
        return new TriviaItem(tag, text, startByte, endByte, node.getStartPoint().getRow());
    }

    private static List<RawTrivia> toRawTrivia(List<TriviaItem> items) {
        if (items.isEmpty()) {
            return List.of();
        }
        List<RawTrivia> result = new ArrayList<>(items.size());
        for (TriviaItem item : items) {
            result.add(new RawTrivia(item.tag(), item.text()));
        }
        return result;
    }

    /**
     * Trivia tag for a conditional compilation node, {@code null} for other nodes.
     */
    static String conditionalTag(String type) {
        if (type.startsWith("preproc_if")) return "preproc_if";
        if (type.startsWith("preproc_elif")) return "preproc_elif";
        if (type.startsWith("preproc_else")) return "preproc_else";
        return null;
    }

    private interface Item {}

    private record NodeItem(TSNode node, String role) implements Item {}

    private record TriviaItem(String tag, String text, int startByte, int endByte, int startRow) implements Item {}

    private record Pending(NodeItem item, List<TriviaItem> leading, List<TriviaItem> trailing) {
        int endRow() {
            return item.node().getEndPoint().getRow();
        }
    }
}
