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

import ru.nts.tools.codetree.query.KeywordVocabulary;
import ru.nts.tools.codetree.query.SearchSegment;

import java.util.List;
import java.util.Objects;

/**
 * One construct of a built tree.
 *
 * <p>Nodes are created by {@link TreeBuilder} and never change afterwards, except for the
 * name, which the builder assigns in a second pass once the whole tree exists.
 * Positions are {@code char} offsets of the full span, which includes the attached
 * leading and trailing trivia; {@link #getSource()} is the construct's own text.
 *
 * <p>The name and the child list are plain fields filled while the tree is built, so a node
 * is not safely published by construction. A tree built on one thread may be read from others
 * only after a happens-before hand-off (a {@code Future}, a concurrent collection, a
 * {@code volatile} field). Once handed off it is read-only and needs no locking.
 */
public final class Node {

    private final NodeKind kind;
    private final String source;
    private final int startPosition;
    private final int endPosition;
    private final String role;
    private final List<Trivia> leadingTrivia;
    private final List<Trivia> trailingTrivia;
    private final Location location;
    private final NodeList children = new NodeList();
    private String name = "";

    Node(NodeKind kind, String source, int startPosition, int endPosition, String role,
         List<Trivia> leadingTrivia, List<Trivia> trailingTrivia, Location location) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.source = Objects.requireNonNull(source, "source");
        this.startPosition = startPosition;
        this.endPosition = endPosition;
        this.role = role != null ? role : "";
        this.leadingTrivia = List.copyOf(leadingTrivia);
        this.trailingTrivia = List.copyOf(trailingTrivia);
        this.location = Objects.requireNonNull(location, "location");
    }

    public NodeKind getKind() {
        return kind;
    }

    public String getSource() {
        return source;
    }

    public int getStartPosition() {
        return startPosition;
    }

    public int getEndPosition() {
        return endPosition;
    }

    public int getLength() {
        return source.length();
    }

    /**
     * Grammar field the construct fills in its parent ({@code name}, {@code type}, ...),
     * empty when it fills none.
     */
    public String getRole() {
        return role;
    }

    /**
     * Name or identifier of the node, empty when the kind has none.
     */
    public String getName() {
        return name;
    }

    void setName(String name) {
        this.name = name == null || name.isBlank() ? "" : name;
    }

    public NodeList getChildren() {
        return children;
    }

    public int getChildCount() {
        return children.size();
    }

    public List<Trivia> getLeadingTrivia() {
        return leadingTrivia;
    }

    public List<Trivia> getTrailingTrivia() {
        return trailingTrivia;
    }

    public String getLeadingTriviaString() {
        return joinTrivia(leadingTrivia);
    }

    public String getTrailingTriviaString() {
        return joinTrivia(trailingTrivia);
    }

    // ==================== Relatives ====================

    public Location getLocation() {
        return location;
    }

    /**
     * Parent node, or {@code null} for nodes of the root list.
     */
    public Node getParent() {
        return location instanceof Location.InTree inTree ? inTree.parent() : null;
    }

    public NodeKind getParentKind() {
        Node parent = getParent();
        return parent != null ? parent.getKind() : NodeKind.UNKNOWN;
    }

    public Node getNextSibling() {
        return location.owner().getNextSibling(this);
    }

    public Node getPreviousSibling() {
        return location.owner().getPreviousSibling(this);
    }

    // ==================== Addressing ====================

    /**
     * Query that locates this node from the root list, using ordinals to tell siblings apart.
     */
    public String getFullPath() {
        return NodePaths.fullPath(this, KeywordVocabulary.standard());
    }

    /**
     * Query that locates this node from the root list, using names where they are unambiguous.
     */
    public String getPossibleAlternativePath() {
        return NodePaths.alternativePath(this, KeywordVocabulary.standard());
    }

    // ==================== Structural queries ====================

    public NodeList getChildren(NodeKind... kinds) {
        return children.getChildren(kinds);
    }

    public Node getChild(NodeKind... kinds) {
        return children.getChild(kinds);
    }

    public Node getChild(SearchSegment... segments) {
        return children.getChild(segments);
    }

    /**
     * Evaluates a query relative to this node's children and returns the first match.
     *
     * @throws ru.nts.tools.codetree.core.CodeTreeException if the query is malformed
     */
    public Node getChild(String query) {
        return children.getChild(query);
    }

    public NodeList query(String query) {
        return children.query(query);
    }

    void collectSubtree(List<Node> into) {
        into.add(this);
        for (Node child : children) {
            child.collectSubtree(into);
        }
    }

    private static String joinTrivia(List<Trivia> trivia) {
        StringBuilder sb = new StringBuilder();
        trivia.forEach(t -> sb.append(t.text()));
        return sb.toString();
    }

    @Override
    public String toString() {
        return name.isEmpty() ? kind.toString() : kind + "[" + name + "]";
    }
}
