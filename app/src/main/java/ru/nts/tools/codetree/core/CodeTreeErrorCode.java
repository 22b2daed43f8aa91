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
package ru.nts.tools.codetree.core;

import java.util.Map;
import java.util.StringJoiner;
import java.util.regex.Pattern;

/**
 * Structured error codes for code-tree operations.
 * Each error has a human-readable message and a solution hint.
 *
 * <p>Example of a formatted error:
 * <pre>
 * [ERROR: UNMAPPED_NODE_KIND]
 * Message: Parser construct has no node kind
 * Solution: Add 'field_keyword_expression' to the kind table or build in lenient mode.
 * Context: tag=field_keyword_expression, excerpt=field ?? 0
 * </pre>
 */
public enum CodeTreeErrorCode {

    // ============ Classification Errors ============

    UNMAPPED_NODE_KIND("Parser construct has no node kind",
            "Add '%tag%' to the kind table or build in lenient mode."),

    UNMAPPED_TRIVIA_KIND("Trivia run has no trivia kind",
            "Add '%tag%' to the trivia table or build in lenient mode."),

    // ============ Query Errors ============

    QUERY_SYNTAX("Malformed structural query",
            "Use keyword[guard]/keyword[guard] where guard is an ordinal or a name. Problem: %reason%"),

    // ============ Parser Errors ============

    PARSE_FAILED("Source could not be parsed",
            "The parser failed or returned no tree. Check that the input is C# source text.");

    private static final Pattern UNFILLED_PLACEHOLDER = Pattern.compile("%\\w+%");
    private static final String NL = System.lineSeparator();

    private final String message;
    private final String solution;

    CodeTreeErrorCode(String message, String solution) {
        this.message = message;
        this.solution = solution;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Multi-line message for users: code, message, the solution hint with {@code %key%}
     * placeholders filled from the context, and the context itself.
     * Placeholders without a context entry are shown as {@code ...}.
     */
    public String format(Map<String, Object> context) {
        String hint = solution;
        for (Map.Entry<String, Object> entry : context.entrySet()) {
            hint = hint.replace("%" + entry.getKey() + "%", String.valueOf(entry.getValue()));
        }
        hint = UNFILLED_PLACEHOLDER.matcher(hint).replaceAll("...");

        String text = "[ERROR: " + name() + "]" + NL + "Message: " + message + NL + "Solution: " + hint;
        return context.isEmpty() ? text : text + NL + "Context: " + describe(context);
    }

    /**
     * Context as {@code key=value} pairs in insertion order.
     */
    static String describe(Map<String, Object> context) {
        StringJoiner joiner = new StringJoiner(", ");
        context.forEach((key, value) -> joiner.add(key + "=" + value));
        return joiner.toString();
    }
}
