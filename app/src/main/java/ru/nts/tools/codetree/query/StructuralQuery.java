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
package ru.nts.tools.codetree.query;

import ru.nts.tools.codetree.tree.Node;
import ru.nts.tools.codetree.tree.NodeList;

import java.util.List;

/**
 * Evaluates parsed queries against a list of sibling nodes.
 *
 * <p>Every segment but the last narrows the scope to the children of the single node it
 * selects; the last segment is applied to the final scope.
 */
public final class StructuralQuery {

    private StructuralQuery() {}

    /**
     * All nodes matched by the last segment, empty when any earlier step finds nothing.
     */
    public static NodeList evaluate(NodeList scope, List<SearchSegment> segments) {
        NodeList last = scopeOfLast(scope, segments);
        return last == null ? NodeList.empty() : last.filter(segments.get(segments.size() - 1));
    }

    /**
     * The single node selected by the last segment, or {@code null}.
     */
    public static Node first(NodeList scope, List<SearchSegment> segments) {
        NodeList last = scopeOfLast(scope, segments);
        return last == null ? null : last.filterByGuard(segments.get(segments.size() - 1));
    }

    private static NodeList scopeOfLast(NodeList scope, List<SearchSegment> segments) {
        if (segments.isEmpty()) {
            return null;
        }
        NodeList current = scope;
        for (int i = 0; i < segments.size() - 1; i++) {
            Node step = current.filterByGuard(segments.get(i));
            if (step == null) {
                return null;
            }
            current = step.getChildren();
        }
        return current;
    }
}
