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

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import ru.nts.tools.codetree.core.CodeTreeErrorCode;
import ru.nts.tools.codetree.core.CodeTreeException;
import ru.nts.tools.codetree.query.SearchSegment;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NodeListTest {

    private final NodeList root = SampleTrees.sample();
    private final Node classC = root.get(1).getChildren().get(1);
    private final NodeList members = classC.getChildren();

    @Nested
    class Filtering {

        @Test
        void filterByKindKeepsOrder() {
            NodeList fields = members.filterByKind(NodeKind.FIELD);
            assertEquals(List.of("x", "y", "z"), fields.stream().map(Node::getName).toList());
        }

        @Test
        void filterByGuardPicksOrdinal() {
            assertEquals("z", members.filterByGuard(SearchSegment.of(NodeKind.FIELD, 2)).getName());
            assertNull(members.filterByGuard(SearchSegment.of(NodeKind.FIELD, 3)));
        }

        @Test
        void filterByGuardPicksFirstWithName() {
            Node first = members.filterByGuard(SearchSegment.of(NodeKind.METHOD, "M"));
            assertSame(members.get(4), first);
            assertNull(members.filterByGuard(SearchSegment.of(NodeKind.METHOD, "Missing")));
        }

        @Test
        void unguardedFilterByGuardPicksFirst() {
            assertSame(members.get(1), members.filterByGuard(SearchSegment.of(NodeKind.FIELD)));
        }

        @Test
        void filterReturnsAllWhenUnguarded() {
            assertEquals(3, members.filter(SearchSegment.of(NodeKind.FIELD)).size());
            assertEquals(1, members.filter(SearchSegment.of(NodeKind.FIELD, "y")).size());
            assertTrue(members.filter(SearchSegment.of(NodeKind.CLASS)).isEmpty());
        }

        @Test
        void ordinalOfCountsSameKindOnly() {
            assertEquals(0, members.ordinalOf(members.get(4)));
            assertEquals(1, members.ordinalOf(members.get(5)));
            assertEquals(-1, members.ordinalOf(root.get(0)));
        }
    }

    @Nested
    class Queries {

        @Test
        void getChildrenFollowsFirstMatchesThenReturnsAll() {
            NodeList fields = root.get(1).getChildren(NodeKind.CLASS, NodeKind.FIELD);
            assertEquals(3, fields.size());
        }

        @Test
        void getChildByKinds() {
            Node variable = root.getChild(NodeKind.NAMESPACE, NodeKind.CLASS, NodeKind.FIELD,
                    NodeKind.VARIABLE_DECLARATION, NodeKind.IDENTIFIER);
            assertEquals("x", variable.getName());
        }

        @Test
        void getChildBySegments() {
            Node parameter = classC.getChild(
                    SearchSegment.of(NodeKind.METHOD, 1),
                    SearchSegment.of(NodeKind.PARAMETER_LIST),
                    SearchSegment.of(NodeKind.PARAMETER));
            assertEquals("b", parameter.getName());
        }

        @Test
        void getChildByQuery() {
            assertEquals("y", root.getChild("namespace/class[C]/field[1]").getName());
            assertSame(root.get(1).getChildren().get(2), root.getChild("namespace[N]/class[D]"));
            assertNull(root.getChild("namespace/class[Missing]/field"));
        }

        @Test
        void queryReturnsEveryMatchOfLastSegment() {
            assertEquals(2, root.query("namespace/class").size());
            assertEquals(2, root.query("namespace/class/method").size());
            assertEquals(1, root.query("namespace/class/method[1]").size());
        }

        @Test
        void malformedQueryThrows() {
            CodeTreeException e = assertThrows(CodeTreeException.class, () -> root.getChild("class[0/field"));
            assertEquals(CodeTreeErrorCode.QUERY_SYNTAX, e.getCode());
        }

        @Test
        void emptyArgumentsMatchNothing() {
            assertTrue(root.getChildren().isEmpty());
            assertNull(root.getChild(new NodeKind[0]));
            assertNull(root.getChild(new SearchSegment[0]));
        }
    }

    @Nested
    class Siblings {

        @Test
        void nextAndPrevious() {
            assertSame(members.get(2), members.getNextSibling(members.get(1)));
            assertSame(members.get(0), members.getPreviousSibling(members.get(1)));
            assertNull(members.getNextSibling(members.get(5)));
            assertNull(members.getPreviousSibling(members.get(0)));
        }

        @Test
        void foreignNodeHasNoSiblings() {
            assertNull(members.getNextSibling(root.get(0)));
            assertEquals(-1, members.indexOf(root.get(0)));
        }
    }

    @Test
    void descendantsArePreOrder() {
        List<Node> all = root.descendants();
        assertSame(root.get(0), all.get(0));
        assertEquals(NodeKind.IDENTIFIER, all.get(1).getKind());
        assertSame(root.get(1), all.get(2));
    }

    @Test
    void listIsReadOnly() {
        assertThrows(UnsupportedOperationException.class, () -> members.asList().remove(0));
    }
}
