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

import ru.nts.tools.codetree.core.CodeTreeConfig;
import ru.nts.tools.codetree.core.CodeTreeErrorCode;
import ru.nts.tools.codetree.core.CodeTreeException;

import java.util.LinkedHashMap;
import java.util.Map;

import static java.util.Map.entry;

/**
 * Maps parser trivia runs to {@link TriviaKind}.
 *
 * <p>The C# grammar reports every comment as {@code comment}; those are told apart by
 * their opening delimiter.
 */
public final class TriviaClassifier {

    static final int EXCERPT_LENGTH = 50;

    static final String COMMENT_TAG = "comment";

    private static final Map<String, TriviaKind> TABLE = Map.ofEntries(
            entry("preproc_region", TriviaKind.REGION_DIRECTIVE),
            entry("preproc_endregion", TriviaKind.END_REGION_DIRECTIVE),
            entry("preproc_if", TriviaKind.IF_DIRECTIVE),
            entry("preproc_elif", TriviaKind.ELIF_DIRECTIVE),
            entry("preproc_else", TriviaKind.ELSE_DIRECTIVE),
            entry("preproc_endif", TriviaKind.END_IF_DIRECTIVE),
            entry("disabled_text", TriviaKind.DISABLED_TEXT),
            entry("preproc_pragma", TriviaKind.PRAGMA_DIRECTIVE),
            entry("preproc_line", TriviaKind.LINE_DIRECTIVE),
            entry("preproc_define", TriviaKind.DEFINE_DIRECTIVE),
            entry("preproc_undef", TriviaKind.UNDEF_DIRECTIVE),
            entry("preproc_nullable", TriviaKind.NULLABLE_DIRECTIVE),
            entry("preproc_error", TriviaKind.ERROR_DIRECTIVE),
            entry("preproc_warning", TriviaKind.WARNING_DIRECTIVE)
    );

    private final CodeTreeConfig config;

    public TriviaClassifier(CodeTreeConfig config) {
        this.config = config;
    }

    /**
     * Classifies a raw run into stored trivia.
     *
     * @return the trivia, or {@code null} when the run's trimmed text is empty
     * @throws CodeTreeException with {@link CodeTreeErrorCode#UNMAPPED_TRIVIA_KIND} for
     *         unmapped runs in strict mode
     */
    public Trivia classify(RawTrivia raw) {
        String text = raw.text() == null ? "" : raw.text().trim();
        if (text.isEmpty()) {
            return null;
        }
        return new Trivia(kindOf(raw.tag(), text), text);
    }

    private TriviaKind kindOf(String tag, String text) {
        TriviaKind kind = COMMENT_TAG.equals(tag) ? commentKind(text) : TABLE.get(tag);
        if (kind != null) {
            return kind;
        }
        String excerpt = KindClassifier.excerpt(text, EXCERPT_LENGTH);
        if (config.isStrict()) {
            Map<String, Object> context = new LinkedHashMap<>();
            context.put("tag", tag);
            context.put("excerpt", excerpt);
            throw new CodeTreeException(CodeTreeErrorCode.UNMAPPED_TRIVIA_KIND, context);
        }
        config.debug("Unmapped trivia '" + tag + "' classified as UNKNOWN: " + excerpt);
        return TriviaKind.UNKNOWN;
    }

    private static TriviaKind commentKind(String text) {
        if (text.startsWith("///") || (text.startsWith("/**") && !text.equals("/**/"))) {
            return TriviaKind.DOCUMENTATION_COMMENT;
        }
        if (text.startsWith("//")) {
            return TriviaKind.LINE_COMMENT;
        }
        if (text.startsWith("/*")) {
            return TriviaKind.BLOCK_COMMENT;
        }
        return null;
    }

    /**
     * Raw tags known to the table, excluding {@code comment}.
     */
    public static Map<String, TriviaKind> table() {
        return TABLE;
    }
}
