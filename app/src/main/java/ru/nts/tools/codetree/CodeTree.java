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
package ru.nts.tools.codetree;

import org.treesitter.TSTree;
import ru.nts.tools.codetree.core.CodeTreeConfig;
import ru.nts.tools.codetree.core.treesitter.CSharpSyntaxReader;
import ru.nts.tools.codetree.core.treesitter.TreeSitterManager;
import ru.nts.tools.codetree.tree.NodeList;
import ru.nts.tools.codetree.tree.RawNode;
import ru.nts.tools.codetree.tree.TreeBuilder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Entry point: builds addressable trees from C# source.
 * Every call returns a new, independent tree.
 */
public final class CodeTree {

    private CodeTree() {}

    /**
     * Builds the tree of a source text using {@link CodeTreeConfig#defaults()}.
     */
    public static NodeList fromText(String code) {
        return fromText(code, CodeTreeConfig.defaults());
    }

    /**
     * Builds the tree of a source text.
     *
     * @return root list holding the top-level constructs
     * @throws ru.nts.tools.codetree.core.CodeTreeException on a parser failure or a classification gap
     *         in strict mode
     */
    public static NodeList fromText(String code, CodeTreeConfig config) {
        TSTree tree = TreeSitterManager.getInstance().parse(code);
        List<RawNode> topLevel = CSharpSyntaxReader.read(tree.getRootNode(), code, config);
        return new TreeBuilder(config).build(topLevel);
    }

    public static NodeList fromFile(Path path) throws IOException {
        return fromFile(path, CodeTreeConfig.defaults());
    }

    /**
     * Reads a UTF-8 file and builds its tree.
     *
     * @throws IOException if the file cannot be read
     */
    public static NodeList fromFile(Path path, CodeTreeConfig config) throws IOException {
        String code = Files.readString(path, StandardCharsets.UTF_8);
        return fromText(code, config);
    }
}
