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

import java.util.Objects;

/**
 * One step of a structural query: a node kind with an optional guard.
 *
 * @param kind kind to match
 * @param guard ordinal or name qualifier, {@code null} to match every node of the kind
 */
public record SearchSegment(NodeKind kind, Guard guard) {

    public SearchSegment {
        Objects.requireNonNull(kind, "kind");
    }

    public static SearchSegment of(NodeKind kind) {
        return new SearchSegment(kind, null);
    }

    public static SearchSegment of(NodeKind kind, int ordinal) {
        return new SearchSegment(kind, new Guard.Ordinal(ordinal));
    }

    public static SearchSegment of(NodeKind kind, String name) {
        return new SearchSegment(kind, new Guard.Name(name));
    }

    public boolean hasGuard() {
        return guard != null;
    }

    /**
     * Renders the segment in query syntax using the given vocabulary.
     */
    public String toQuery(KeywordVocabulary vocabulary) {
        String keyword = vocabulary.keywordOf(kind);
        return guard == null ? keyword : keyword + "[" + guard + "]";
    }

    @Override
    public String toString() {
        return toQuery(KeywordVocabulary.standard());
    }
}
