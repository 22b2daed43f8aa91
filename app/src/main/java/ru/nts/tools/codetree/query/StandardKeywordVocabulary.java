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

import ru.nts.tools.codetree.tree.NodeKind;

import java.util.HashMap;
import java.util.Map;

final class StandardKeywordVocabulary implements KeywordVocabulary {

    static final StandardKeywordVocabulary INSTANCE = new StandardKeywordVocabulary();

    private final Map<String, NodeKind> kinds;

    private StandardKeywordVocabulary() {
        Map<String, NodeKind> map = new HashMap<>();
        for (NodeKind kind : NodeKind.values()) {
            NodeKind previous = map.put(kind.getKeyword(), kind);
            if (previous != null) {
                throw new IllegalStateException("Keyword '" + kind.getKeyword()
                        + "' is bound to both " + previous + " and " + kind);
            }
        }
        this.kinds = Map.copyOf(map);
    }

    @Override
    public String keywordOf(NodeKind kind) {
        return kind.getKeyword();
    }

    @Override
    public NodeKind kindOf(String keyword) {
        return keyword == null ? null : kinds.get(keyword);
    }
}
