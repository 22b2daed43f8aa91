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
import ru.nts.tools.codetree.query.QueryParser;

/**
 * Derives query strings that locate a node from the root list of its tree.
 * Paths are computed on every call and never cached.
 */
public final class NodePaths {

    private NodePaths() {}

    /**
     * Keyword per step, suffixed with {@code [i]} when the node is the i-th (i &gt; 0)
     * node of its kind among its siblings.
     */
    public static String fullPath(Node node, KeywordVocabulary vocabulary) {
        return walk(node, vocabulary, false);
    }

    /**
     * Like {@link #fullPath}, but a step uses {@code keyword[name]} when the node has a name
     * that can be written as a guard and no earlier sibling of the same kind shares it.
     */
    public static String alternativePath(Node node, KeywordVocabulary vocabulary) {
        return walk(node, vocabulary, true);
    }

    private static String walk(Node node, KeywordVocabulary vocabulary, boolean preferNames) {
        StringBuilder path = new StringBuilder();
        for (Node current = node; current != null; current = current.getParent()) {
            String segment = segment(current, vocabulary, preferNames);
            if (path.length() > 0) {
                path.insert(0, QueryParser.SEPARATOR);
            }
            path.insert(0, segment);
        }
        return path.toString();
    }

    private static String segment(Node node, KeywordVocabulary vocabulary, boolean preferNames) {
        String keyword = vocabulary.keywordOf(node.getKind());
        NodeList owner = node.getLocation().owner();
        if (preferNames && isUsableName(node, owner)) {
            return keyword + QueryParser.GUARD_OPEN + node.getName() + QueryParser.GUARD_CLOSE;
        }
        int ordinal = owner.ordinalOf(node);
        return ordinal <= 0 ? keyword : keyword + QueryParser.GUARD_OPEN + ordinal + QueryParser.GUARD_CLOSE;
    }

    private static boolean isUsableName(Node node, NodeList owner) {
        String name = node.getName();
        if (!QueryParser.isValidName(name)) {
            return false;
        }
        for (Node sibling : owner) {
            if (sibling == node) {
                return true;
            }
            if (sibling.getKind() == node.getKind() && sibling.getName().equals(name)) {
                return false;
            }
        }
        return false;
    }
}
