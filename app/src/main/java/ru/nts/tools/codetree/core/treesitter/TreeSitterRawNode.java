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

import ru.nts.tools.codetree.tree.RawNode;
import ru.nts.tools.codetree.tree.RawTrivia;

import java.util.List;

/**
 * Raw construct read from a tree-sitter tree. Detached from the native tree once created.
 */
record TreeSitterRawNode(String tag,
                         String text,
                         int fullStart,
                         int fullEnd,
                         String role,
                         List<RawNode> children,
                         List<RawTrivia> leadingTrivia,
                         List<RawTrivia> trailingTrivia) implements RawNode {

    TreeSitterRawNode {
        children = List.copyOf(children);
        leadingTrivia = List.copyOf(leadingTrivia);
        trailingTrivia = List.copyOf(trailingTrivia);
    }
}
