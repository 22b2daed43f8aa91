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
 * Hand-made parser construct for building trees without a parser.
 */
public record FakeRawNode(String tag,
                          String text,
                          int fullStart,
                          int fullEnd,
                          String role,
                          List<RawNode> children,
                          List<RawTrivia> leadingTrivia,
                          List<RawTrivia> trailingTrivia) implements RawNode {

    public static FakeRawNode of(String tag, String text, RawNode... children) {
        return new FakeRawNode(tag, text, 0, text.length(), "", List.of(children), List.of(), List.of());
    }

    public static FakeRawNode id(String name) {
        return of("identifier", name).withRole("name");
    }

    public static FakeRawNode type(String name) {
        return of("predefined_type", name).withRole("type");
    }

    public FakeRawNode withRole(String newRole) {
        return new FakeRawNode(tag, text, fullStart, fullEnd, newRole, children, leadingTrivia, trailingTrivia);
    }

    public FakeRawNode at(int start, int end) {
        return new FakeRawNode(tag, text, start, end, role, children, leadingTrivia, trailingTrivia);
    }

    public FakeRawNode withLeading(RawTrivia... trivia) {
        return new FakeRawNode(tag, text, fullStart, fullEnd, role, children, List.of(trivia), trailingTrivia);
    }

    public FakeRawNode withTrailing(RawTrivia... trivia) {
        return new FakeRawNode(tag, text, fullStart, fullEnd, role, children, leadingTrivia, List.of(trivia));
    }
}
