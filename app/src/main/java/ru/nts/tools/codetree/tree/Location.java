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
 * Where a node is owned: inside its parent's children, or in the root list of a tree.
 */
public sealed interface Location permits Location.InTree, Location.AtRoot {

    /**
     * The list that holds the node.
     */
    NodeList owner();

    record InTree(Node parent) implements Location {
        public InTree {
            Objects.requireNonNull(parent, "parent");
        }

        @Override
        public NodeList owner() {
            return parent.getChildren();
        }

        @Override
        public String toString() {
            return "InTree[" + parent + "]";
        }
    }

    record AtRoot(NodeList list) implements Location {
        public AtRoot {
            Objects.requireNonNull(list, "list");
        }

        @Override
        public NodeList owner() {
            return list;
        }

        @Override
        public String toString() {
            return "AtRoot[" + list.size() + " nodes]";
        }
    }
}
