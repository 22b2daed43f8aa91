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

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import ru.nts.tools.codetree.core.CodeTreeErrorCode;
import ru.nts.tools.codetree.core.CodeTreeException;
import ru.nts.tools.codetree.tree.NodeKind;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QueryParserTest {

    private final QueryParser parser = QueryParser.standard();

    @Nested
    class ValidQueries {

        @Test
        void singleKeyword() {
            assertEquals(List.of(SearchSegment.of(NodeKind.CLASS)), parser.parse("class"));
        }

        @Test
        void pathOfSegments() {
            List<SearchSegment> segments = parser.parse("namespace/class/field/vardeclaration/id");
            assertEquals(List.of(NodeKind.NAMESPACE, NodeKind.CLASS, NodeKind.FIELD,
                            NodeKind.VARIABLE_DECLARATION, NodeKind.IDENTIFIER),
                    segments.stream().map(SearchSegment::kind).toList());
            assertTrue(segments.stream().noneMatch(SearchSegment::hasGuard));
        }

        @Test
        void ordinalGuard() {
            assertEquals(List.of(SearchSegment.of(NodeKind.CLASS, 2), SearchSegment.of(NodeKind.FIELD, 0)),
                    parser.parse("class[2]/field[0]"));
        }

        @Test
        void nameGuard() {
            assertEquals(List.of(SearchSegment.of(NodeKind.NAMESPACE, "System.Text"),
                            SearchSegment.of(NodeKind.CLASS, "_Builder")),
                    parser.parse("namespace[System.Text]/class[_Builder]"));
        }

        @Test
        void verbatimIdentifierGuard() {
            assertEquals(new Guard.Name("@class"), parser.parse("param[@class]").get(0).guard());
        }

        @Test
        void tryParseReportsSuccess() {
            QueryParseResult result = parser.tryParse("class[C]/method[1]");
            assertTrue(result.success());
            assertNull(result.error());
            assertEquals(-1, result.position());
            assertEquals(2, result.segments().size());
        }

        @Test
        void segmentRendersBackToQuery() {
            List<SearchSegment> segments = parser.parse("namespace[N]/class[1]/field");
            String rendered = String.join("/",
                    segments.stream().map(s -> s.toQuery(parser.getVocabulary())).toList());
            assertEquals("namespace[N]/class[1]/field", rendered);
        }
    }

    @Nested
    class Failures {

        @ParameterizedTest
        @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
                "class[0/field       | unclosed guard            | 5",
                "class//field        | empty segment             | 6",
                "class/              | empty segment             | 6",
                "/class              | empty segment             | 0",
                "klass               | unknown keyword 'klass'   | 0",
                "class/fieldz        | unknown keyword 'fieldz'  | 6",
                "[0]                 | segment has no keyword    | 0",
                "class]              | ']' without '['           | 5",
                "class[]             | empty guard               | 5",
                "class[a[b]          | nested '[' in guard       | 7",
                "class[a]x           | unexpected text after guard | 8",
                "class[1 a]          | neither an ordinal nor a name | 6",
                "class[-1]           | neither an ordinal nor a name | 6",
                "class[99999999999]  | ordinal out of range      | 6"
        })
        void reportsReasonAndPosition(String query, String reason, int position) {
            QueryParseResult result = parser.tryParse(query);

            assertFalse(result.success(), query);
            assertTrue(result.segments().isEmpty());
            assertTrue(result.error().contains(reason), result.error());
            assertEquals(position, result.position(), query);
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "   "})
        void emptyQuery(String query) {
            QueryParseResult result = parser.tryParse(query);
            assertFalse(result.success());
            assertEquals("query is empty", result.error());
            assertEquals(0, result.position());
        }

        @Test
        void nullQuery() {
            assertFalse(parser.tryParse(null).success());
        }

        @Test
        void parseThrowsQuerySyntax() {
            CodeTreeException e = assertThrows(CodeTreeException.class, () -> parser.parse("class[0/field"));
            assertEquals(CodeTreeErrorCode.QUERY_SYNTAX, e.getCode());
            assertEquals("class[0/field", e.getContext().get("query"));
            assertEquals(5, e.getContext().get("position"));
            assertTrue(e.getMessage().contains("unclosed guard"));
        }
    }

    @Nested
    class Names {

        @ParameterizedTest
        @ValueSource(strings = {"x", "_private", "@event", "System.Text", "Ünïcode", "List`1"})
        void validNames(String name) {
            assertTrue(QueryParser.isValidName(name));
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "1st", "a b", "a/b", "a[0]", "b]", "-x", "operator +"})
        void invalidNames(String name) {
            assertFalse(QueryParser.isValidName(name));
        }

        @Test
        void nullIsNotAName() {
            assertFalse(QueryParser.isValidName(null));
        }
    }
}
