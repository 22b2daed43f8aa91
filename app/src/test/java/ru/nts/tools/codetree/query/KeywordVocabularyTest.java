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

import org.junit.jupiter.api.Test;
import ru.nts.tools.codetree.tree.NodeKind;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class KeywordVocabularyTest {

    private final KeywordVocabulary vocabulary = KeywordVocabulary.standard();

    @Test
    void everyKindHasADistinctKeyword() {
        Set<String> seen = new HashSet<>();
        for (NodeKind kind : NodeKind.values()) {
            String keyword = vocabulary.keywordOf(kind);
            assertNotNull(keyword);
            assertFalse(keyword.isBlank(), kind.name());
            assertTrue(seen.add(keyword), "Duplicate keyword " + keyword);
        }
    }

    @Test
    void keywordsMapBackToTheirKind() {
        for (NodeKind kind : NodeKind.values()) {
            assertEquals(kind, vocabulary.kindOf(vocabulary.keywordOf(kind)));
        }
    }

    @Test
    void keywordsAreUsableInQueries() {
        for (NodeKind kind : NodeKind.values()) {
            String keyword = vocabulary.keywordOf(kind);
            assertTrue(keyword.chars().allMatch(c -> Character.isLetterOrDigit(c)), keyword);
            assertEquals(kind, QueryParser.standard().parse(keyword).get(0).kind());
        }
    }

    @Test
    void wellKnownKeywords() {
        assertEquals("namespace", vocabulary.keywordOf(NodeKind.NAMESPACE));
        assertEquals("class", vocabulary.keywordOf(NodeKind.CLASS));
        assertEquals("field", vocabulary.keywordOf(NodeKind.FIELD));
        assertEquals("vardeclaration", vocabulary.keywordOf(NodeKind.VARIABLE_DECLARATION));
        assertEquals("id", vocabulary.keywordOf(NodeKind.IDENTIFIER));
    }

    @Test
    void unknownKeyword() {
        assertNull(vocabulary.kindOf("klass"));
        assertNull(vocabulary.kindOf(null));
        assertNull(vocabulary.kindOf("CLASS"));
    }
}
