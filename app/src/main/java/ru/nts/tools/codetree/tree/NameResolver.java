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

import ru.nts.tools.codetree.query.SearchSegment;

/**
 * Second build pass: assigns {@link Node#getName()} from already built children.
 * Runs in pre-order; a rule only reads the structure below the node, never resolved names.
 */
final class NameResolver {

    static final String NAME_ROLE = "name";

    private NameResolver() {}

    static void resolve(NodeList nodes) {
        for (Node node : nodes) {
            node.setName(nameOf(node));
            resolve(node.getChildren());
        }
    }

    static String nameOf(Node node) {
        return switch (node.getKind()) {
            case IDENTIFIER -> node.getSource();
            case CLASS, STRUCT, INTERFACE, RECORD, ENUM, ENUM_MEMBER, TYPE_PARAMETER ->
                    textOf(declaredIdentifier(node, false));
            case METHOD, CONSTRUCTOR, DESTRUCTOR, DELEGATE, EVENT, PROPERTY, LOCAL_FUNCTION ->
                    textOf(declaredIdentifier(node, true));
            // an implicitly typed lambda parameter is a bare identifier leaf
            case PARAMETER -> node.getChildren().isEmpty()
                    ? node.getSource() : textOf(declaredIdentifier(node, true));
            case NAMESPACE, FILE_SCOPED_NAMESPACE -> textOf(namespaceName(node));
            case VARIABLE_DECLARATION -> textOf(declaredVariable(node));
            case FIELD, EVENT_FIELD, LOCAL_DECLARATION ->
                    textOf(declaredVariable(firstOfKind(node, NodeKind.VARIABLE_DECLARATION)));
            case USING_DIRECTIVE -> {
                Node name = firstOfKind(node, NodeKind.QUALIFIED_NAME);
                yield textOf(name != null ? name : firstOfKind(node, NodeKind.IDENTIFIER));
            }
            default -> "";
        };
    }

    /**
     * The identifier filling the grammar's name field. Without field information the name is
     * the first identifier child, or the last one for members that start with a type.
     */
    private static Node declaredIdentifier(Node node, boolean typeFirst) {
        Node byRole = withRole(node, NodeKind.IDENTIFIER);
        if (byRole != null) {
            return byRole;
        }
        NodeList identifiers = node.getChildren().filterByKind(NodeKind.IDENTIFIER);
        if (identifiers.isEmpty()) {
            return null;
        }
        return typeFirst ? identifiers.get(identifiers.size() - 1) : identifiers.first();
    }

    private static Node namespaceName(Node node) {
        for (Node child : node.getChildren()) {
            if (NAME_ROLE.equals(child.getRole())) {
                return child;
            }
        }
        Node qualified = firstOfKind(node, NodeKind.QUALIFIED_NAME);
        return qualified != null ? qualified : firstOfKind(node, NodeKind.IDENTIFIER);
    }

    /**
     * First declared variable of a variable declaration; the leading child is its type.
     */
    private static Node declaredVariable(Node declaration) {
        if (declaration == null) {
            return null;
        }
        Node byRole = withRole(declaration, NodeKind.IDENTIFIER);
        if (byRole != null) {
            return byRole;
        }
        NodeList children = declaration.getChildren();
        for (int i = 1; i < children.size(); i++) {
            if (children.get(i).getKind() == NodeKind.IDENTIFIER) {
                return children.get(i);
            }
        }
        return null;
    }

    private static Node withRole(Node node, NodeKind kind) {
        for (Node child : node.getChildren()) {
            if (child.getKind() == kind && NAME_ROLE.equals(child.getRole())) {
                return child;
            }
        }
        return null;
    }

    private static Node firstOfKind(Node node, NodeKind kind) {
        return node == null ? null : node.getChildren().filterByGuard(SearchSegment.of(kind));
    }

    private static String textOf(Node node) {
        return node == null ? "" : node.getSource().trim();
    }
}
