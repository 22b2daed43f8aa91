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
package ru.nts.tools.codetree.core.treesitter;

import org.treesitter.TSLanguage;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterCSharp;
import ru.nts.tools.codetree.core.CodeTreeErrorCode;
import ru.nts.tools.codetree.core.CodeTreeException;

import java.util.Map;

/**
 * Holder of the tree-sitter C# parser.
 * TSParser is not thread-safe, so every thread gets its own parser; the language object is shared.
 */
public final class TreeSitterManager {

    private static final TreeSitterManager INSTANCE = new TreeSitterManager();

    /**
     * Loaded lazily on first use.
     */
    private volatile TSLanguage language;

    private final ThreadLocal<TSParser> parsers = ThreadLocal.withInitial(() -> {
        TSParser parser = new TSParser();
        parser.setLanguage(getLanguage());
        return parser;
    });

    private TreeSitterManager() {}

    public static TreeSitterManager getInstance() {
        return INSTANCE;
    }

    public TSLanguage getLanguage() {
        TSLanguage loaded = language;
        if (loaded == null) {
            synchronized (this) {
                loaded = language;
                if (loaded == null) {
                    loaded = new TreeSitterCSharp();
                    language = loaded;
                }
            }
        }
        return loaded;
    }

    /**
     * Parses C# source text.
     *
     * @param content source code
     * @return syntax tree; byte offsets in it refer to the UTF-8 encoding of {@code content}
     * @throws CodeTreeException with {@link CodeTreeErrorCode#PARSE_FAILED} if the parser fails
     *         or returns no tree
     */
    public TSTree parse(String content) {
        return parse(parsers.get(), content);
    }

    static TSTree parse(TSParser parser, String content) {
        Map<String, Object> context = Map.of("length", content.length());
        TSTree tree;
        try {
            tree = parser.parseString(null, content);
        } catch (RuntimeException e) {
            throw new CodeTreeException(CodeTreeErrorCode.PARSE_FAILED, context, e);
        }
        if (tree == null) {
            throw new CodeTreeException(CodeTreeErrorCode.PARSE_FAILED, context);
        }
        return tree;
    }
}
