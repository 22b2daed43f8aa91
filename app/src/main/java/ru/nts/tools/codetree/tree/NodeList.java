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

import ru.nts.tools.codetree.query.Guard;
import ru.nts.tools.codetree.query.QueryParser;
import ru.nts.tools.codetree.query.SearchSegment;
import ru.nts.tools.codetree.query.StructuralQuery;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Ordered list of sibling nodes: the children of a node, or the root list of a tree.
 * Read-only once the tree is built.
 */
public final class NodeList implements Iterable<Node> {

    private static final NodeList EMPTY = new NodeList(List.of());

    private final List<Node> nodes;

    NodeList() {
        this.nodes = new ArrayList<>();
    }

    private NodeList(List<Node> nodes) {
        this.nodes = nodes;
    }

    public static NodeList empty() {
        return EMPTY;
    }

    static NodeList copyOf(List<Node> nodes) {
        return nodes.isEmpty() ? EMPTY : new NodeList(List.copyOf(nodes));
    }

    void add(Node node) {
        nodes.add(node);
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public Node get(int index) {
        return nodes.get(index);
    }

    /**
     * First node, or {@code null} if the list is empty.
     */
    public Node first() {
        return nodes.isEmpty() ? null : nodes.get(0);
    }

    /**
     * Position of the node in this list by identity, -1 if absent.
     */
    public int indexOf(Node node) {
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i) == node) {
                return i;
            }
        }
        return -1;
    }

    public List<Node> asList() {
        return Collections.unmodifiableList(nodes);
    }

    public Stream<Node> stream() {
        return nodes.stream();
    }

    @Override
    public Iterator<Node> iterator() {
        return asList().iterator();
    }

    // ==================== Filtering ====================

    /**
     * All nodes of the kind, in source order.
     */
    public NodeList filterByKind(NodeKind kind) {
        List<Node> result = new ArrayList<>();
        for (Node node : nodes) {
            if (node.getKind() == kind) {
                result.add(node);
            }
        }
        return copyOf(result);
    }

    /**
     * The single node selected by a segment: the ordinal-th node of the kind, the first node
     * of the kind with the guard's name, or the first node of the kind when unguarded.
     *
     * @return the node, or {@code null} if none matches
     */
    public Node filterByGuard(SearchSegment segment) {
        Guard guard = segment.guard();
        int ordinal = guard instanceof Guard.Ordinal o ? o.index() : 0;
        int seen = 0;
        for (Node node : nodes) {
            if (node.getKind() != segment.kind()) {
                continue;
            }
            if (guard instanceof Guard.Name n) {
                if (node.getName().equals(n.name())) {
                    return node;
                }
            } else if (seen++ == ordinal) {
                return node;
            }
        }
        return null;
    }

    /**
     * Nodes matching a segment: every node of the kind when unguarded, at most one otherwise.
     */
    public NodeList filter(SearchSegment segment) {
        if (!segment.hasGuard()) {
            return filterByKind(segment.kind());
        }
        Node node = filterByGuard(segment);
        return node == null ? EMPTY : copyOf(List.of(node));
    }

    /**
     * Zero-based position of the node among the nodes of its kind in this list, -1 if absent.
     */
    public int ordinalOf(Node node) {
        int ordinal = 0;
        for (Node candidate : nodes) {
            if (candidate == node) {
                return ordinal;
            }
            if (candidate.getKind() == node.getKind()) {
                ordinal++;
            }
        }
        return -1;
    }

    // ==================== Siblings ====================

    public Node getNextSibling(Node node) {
        int index = indexOf(node);
        return index >= 0 && index + 1 < nodes.size() ? nodes.get(index + 1) : null;
    }

    public Node getPreviousSibling(Node node) {
        int index = indexOf(node);
        return index > 0 ? nodes.get(index - 1) : null;
    }

    // ==================== Structural queries ====================

    /**
     * Follows the first match of every kind but the last, and returns every match of the last.
     */
    public NodeList getChildren(NodeKind... kinds) {
        if (kinds.length == 0) {
            return EMPTY;
        }
        return StructuralQuery.evaluate(this, Arrays.stream(kinds).map(SearchSegment::of).toList());
    }

    public Node getChild(NodeKind... kinds) {
        return getChildren(kinds).first();
    }

    /**
     * Follows one guarded match per segment, including the last.
     */
    public Node getChild(SearchSegment... segments) {
        if (segments.length == 0) {
            return null;
        }
        return StructuralQuery.first(this, Arrays.asList(segments));
    }

    /**
     * Evaluates a query and returns the first match.
     *
     * @throws ru.nts.tools.codetree.core.CodeTreeException if the query is malformed
     */
    public Node getChild(String query) {
        return StructuralQuery.first(this, QueryParser.standard().parse(query));
    }

    /**
     * Evaluates a query and returns every match of its last segment.
     *
     * @throws ru.nts.tools.codetree.core.CodeTreeException if the query is malformed
     */
    public NodeList query(String query) {
        return StructuralQuery.evaluate(this, QueryParser.standard().parse(query));
    }

    /**
     * Every node of this list and their descendants, in pre-order.
     */
    public List<Node> descendants() {
        List<Node> result = new ArrayList<>();
        for (Node node : nodes) {
            node.collectSubtree(result);
        }
        return result;
    }

    @Override
    public String toString() {
        return nodes.toString();
    }
}
