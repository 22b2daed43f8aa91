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

import java.util.Objects;

/**
 * A comment or directive attached before or after a node. The text is trimmed and never blank.
 */
public record Trivia(TriviaKind kind, String text) {

    public Trivia {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(text, "text");
        text = text.trim();
        if (text.isEmpty()) {
            throw new IllegalArgumentException("Trivia text must not be blank");
        }
    }

    @Override
    public String toString() {
        return kind + ": " + text;
    }
}
