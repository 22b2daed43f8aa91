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

import java.util.Objects;

/**
 * Qualifier of a query segment that picks one node among same-kind siblings.
 */
public sealed interface Guard permits Guard.Ordinal, Guard.Name {

    /**
     * Selects the ordinal-th same-kind sibling, zero-based.
     */
    record Ordinal(int index) implements Guard {
        public Ordinal {
            if (index < 0) {
                throw new IllegalArgumentException("Ordinal guard must not be negative: " + index);
            }
        }

        @Override
        public String toString() {
            return Integer.toString(index);
        }
    }

    /**
     * Selects the first same-kind sibling with this name.
     */
    record Name(String name) implements Guard {
        public Name {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public String toString() {
            return name;
        }
    }
}
