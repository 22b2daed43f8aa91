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

import ru.nts.tools.codetree.core.CodeTreeErrorCode;
import ru.nts.tools.codetree.core.CodeTreeException;
import ru.nts.tools.codetree.tree.NodeKind;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parser of structural queries.
 *
 * <pre>
 * path    := segment ("/" segment)*
 * segment := keyword ("[" guard "]")?
 * guard   := integer | name
 * </pre>
 *
 * A name starts with a letter, {@code _} or {@code @} and may not contain whitespace,
 * {@code /}, {@code [} or {@code ]}. Qualified names such as {@code System.Text} are names.
 */
public final class QueryParser {

    public static final char SEPARATOR = '/';
    public static final char GUARD_OPEN = '[';
    public static final char GUARD_CLOSE = ']';

    private static final QueryParser STANDARD = new QueryParser(KeywordVocabulary.standard());

    private final KeywordVocabulary vocabulary;

    public QueryParser(KeywordVocabulary vocabulary) {
        this.vocabulary = vocabulary;
    }

    public static QueryParser standard() {
        return STANDARD;
    }

    public KeywordVocabulary getVocabulary() {
        return vocabulary;
    }

    /**
     * Parses a query, reporting malformed input through the result instead of throwing.
     */
    public QueryParseResult tryParse(String query) {
        try {
            return QueryParseResult.ok(parse(query));
        } catch (CodeTreeException e) {
            Map<String, Object> context = e.getContext();
            return QueryParseResult.failure((String) context.get("reason"), (Integer) context.get("position"));
        }
    }

    /**
     * Parses a query.
     *
     * @throws CodeTreeException with {@link CodeTreeErrorCode#QUERY_SYNTAX} if the query is malformed
     */
    public List<SearchSegment> parse(String query) {
        if (query == null || query.isBlank()) {
            throw syntaxError(query, "query is empty", 0);
        }
        List<SearchSegment> segments = new ArrayList<>();
        int start = 0;
        while (true) {
            int end = query.indexOf(SEPARATOR, start);
            if (end < 0) {
                end = query.length();
            }
            segments.add(parseSegment(query, start, end));
            if (end == query.length()) {
                return segments;
            }
            start = end + 1;
        }
    }

    private SearchSegment parseSegment(String query, int start, int end) {
        if (start == end) {
            throw syntaxError(query, "empty segment", start);
        }
        int open = indexOf(query, GUARD_OPEN, start, end);
        int stray = indexOf(query, GUARD_CLOSE, start, open < 0 ? end : open);
        if (stray >= 0) {
            throw syntaxError(query, "']' without '['", stray);
        }
        int keywordEnd = open < 0 ? end : open;

        String keyword = query.substring(start, keywordEnd);
        if (keyword.isEmpty()) {
            throw syntaxError(query, "segment has no keyword", start);
        }
        NodeKind kind = vocabulary.kindOf(keyword);
        if (kind == null) {
            throw syntaxError(query, "unknown keyword '" + keyword + "'", start);
        }
        if (open < 0) {
            return SearchSegment.of(kind);
        }

        int close = indexOf(query, GUARD_CLOSE, open + 1, end);
        if (close < 0) {
            throw syntaxError(query, "unclosed guard", open);
        }
        if (close != end - 1) {
            throw syntaxError(query, "unexpected text after guard", close + 1);
        }
        String text = query.substring(open + 1, close);
        if (text.isEmpty()) {
            throw syntaxError(query, "empty guard", open);
        }
        int nested = text.indexOf(GUARD_OPEN);
        if (nested >= 0) {
            throw syntaxError(query, "nested '[' in guard", open + 1 + nested);
        }
        if (isOrdinal(text)) {
            try {
                return SearchSegment.of(kind, Integer.parseInt(text));
            } catch (NumberFormatException e) {
                throw syntaxError(query, "ordinal out of range: " + text, open + 1);
            }
        }
        if (!isValidName(text)) {
            throw syntaxError(query, "guard '" + text + "' is neither an ordinal nor a name", open + 1);
        }
        return SearchSegment.of(kind, text);
    }

    private static CodeTreeException syntaxError(String query, String reason, int position) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("query", String.valueOf(query));
        context.put("position", position);
        context.put("reason", reason);
        return new CodeTreeException(CodeTreeErrorCode.QUERY_SYNTAX, context);
    }

    /**
     * Whether a node name can be written as a name guard and read back unchanged.
     */
    public static boolean isValidName(String name) {
        if (name == null || name.isEmpty()) {
            return false;
        }
        char first = name.charAt(0);
        if (!Character.isLetter(first) && first != '_' && first != '@') {
            return false;
        }
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isWhitespace(c) || c == SEPARATOR || c == GUARD_OPEN || c == GUARD_CLOSE) {
                return false;
            }
        }
        return true;
    }

    private static boolean isOrdinal(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }

    private static int indexOf(String s, char c, int from, int to) {
        int i = s.indexOf(c, from);
        return i >= 0 && i < to ? i : -1;
    }
}
