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

import java.util.List;

/**
 * View of one parser construct, as consumed by {@link TreeBuilder}.
 * Offsets are {@code char} offsets into the parsed text.
 */
public interface RawNode {

    /**
     * Construct tag, looked up by {@link KindClassifier}.
     */
    String tag();

    /**
     * Text of the construct itself, without surrounding trivia.
     */
    String text();

    /**
     * Start of the full span, including leading trivia.
     */
    int fullStart();

    /**
     * End of the full span, including trailing trivia.
     */
    int fullEnd();

    /**
     * Grammar field label inside the raw parent, empty when the construct has none.
     */
    String role();

    List<RawNode> children();

    List<RawTrivia> leadingTrivia();

    List<RawTrivia> trailingTrivia();
}
