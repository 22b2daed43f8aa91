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

/**
 * Binding between node kinds and the keywords that name them in queries and paths.
 * Implementations must be total over {@link NodeKind} and free of collisions.
 */
public interface KeywordVocabulary {

    /**
     * Keyword for a kind. Never {@code null}.
     */
    String keywordOf(NodeKind kind);

    /**
     * Kind named by a keyword, or {@code null} if the keyword is unknown.
     */
    NodeKind kindOf(String keyword);

    /**
     * Vocabulary built from {@link NodeKind#getKeyword()}.
     */
    static KeywordVocabulary standard() {
        return StandardKeywordVocabulary.INSTANCE;
    }
}
