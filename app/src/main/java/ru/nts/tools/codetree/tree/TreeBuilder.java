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
package ru.nts.tools.codetree.tree;

import ru.nts.tools.codetree.core.CodeTreeConfig;

import java.util.ArrayList;
import java.util.List;

/**
 * Mirrors raw parser constructs into an owned tree of {@link Node}s.
 *
 * <p>The first pass classifies every construct and its trivia and links each node to its
 * owner; the second pass ({@link NameResolver}) assigns names once all nodes exist.
 * A builder holds no per-build state and can be reused.
 */
public final class TreeBuilder {

    private final CodeTreeConfig config;
    private final KindClassifier kindClassifier;
    private final TriviaClassifier triviaClassifier;

    public TreeBuilder(CodeTreeConfig config) {
        this.config = config;
        this.kindClassifier = new KindClassifier(config);
        this.triviaClassifier = new TriviaClassifier(config);
    }

    /**
     * Builds the tree for the top-level constructs of one source input.
     *
     * @param topLevel raw constructs in source order
     * @return the root list, owned by the calling thread until it is handed off
     *         (see {@link Node} on publication)
     * @throws ru.nts.tools.codetree.core.CodeTreeException on a classification gap in strict mode
     */
    public NodeList build(List<? extends RawNode> topLevel) {
        NodeList root = new NodeList();
        Location atRoot = new Location.AtRoot(root);
        for (RawNode raw : topLevel) {
            root.add(create(raw, atRoot));
        }
        NameResolver.resolve(root);
        config.debug("Built tree with " + root.size() + " top-level nodes");
        return root;
    }

    private Node create(RawNode raw, Location location) {
        NodeKind kind = kindClassifier.classify(raw.tag(), raw.text());
        Node node = new Node(kind, raw.text(), raw.fullStart(), raw.fullEnd(), raw.role(),
                classify(raw.leadingTrivia()), classify(raw.trailingTrivia()), location);
        Location inTree = new Location.InTree(node);
        for (RawNode child : raw.children()) {
            node.getChildren().add(create(child, inTree));
        }
        return node;
    }

    private List<Trivia> classify(List<RawTrivia> runs) {
        if (runs.isEmpty()) {
            return List.of();
        }
        List<Trivia> result = new ArrayList<>(runs.size());
        for (RawTrivia run : runs) {
            Trivia trivia = triviaClassifier.classify(run);
            if (trivia != null) {
                result.add(trivia);
            }
        }
        return result;
    }
}
