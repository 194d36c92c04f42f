/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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

package dev.mars.flowaudit.core;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link CanonicalGraph} and its parts.
 */
@DisplayName("CanonicalGraph Tests")
class CanonicalGraphTest {

    private static CanonicalNode node(String id, String type) {
        return new CanonicalNode(id, NodeKind.fromRawType(type), type, id, null, NodeKind.isRecognized(type));
    }

    @Nested
    @DisplayName("Graph structure")
    class StructureTests {

        @Test
        @DisplayName("Should index edges by source and target")
        void testAdjacency() {
            CanonicalGraph graph = new CanonicalGraph(
                    List.of(node("t", "form_submit"), node("a", "email"), node("b", "sms")),
                    List.of(new CanonicalEdge("e1", "t", "a"), new CanonicalEdge("e2", "a", "b"),
                            new CanonicalEdge("e3", "t", "b")));

            assertThat(graph.nodeCount()).isEqualTo(3);
            assertThat(graph.edgeCount()).isEqualTo(3);
            assertThat(graph.outgoingEdges("t")).extracting(CanonicalEdge::target).containsExactly("a", "b");
            assertThat(graph.incomingEdges("b")).extracting(CanonicalEdge::source).containsExactly("a", "t");
            assertThat(graph.outgoingEdges("missing")).isEmpty();
            assertThat(graph.triggers()).extracting(CanonicalNode::id).containsExactly("t");
            assertThat(graph.branchEstimate()).isEqualTo(2);
        }

        @Test
        @DisplayName("Should keep edges whose endpoints name no node")
        void testDanglingEdge() {
            CanonicalGraph graph = new CanonicalGraph(List.of(node("a", "email")),
                    List.of(new CanonicalEdge("e1", "a", "ghost")));

            assertThat(graph.containsNode("ghost")).isFalse();
            assertThat(graph.incomingEdges("ghost")).hasSize(1);
        }

        @Test
        @DisplayName("Should reject repeated node ids")
        void testDuplicateIds() {
            assertThatThrownBy(() -> new CanonicalGraph(List.of(node("a", "email"), node("a", "sms")), List.of()))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("a");
        }

        @Test
        @DisplayName("Should expose an empty graph")
        void testEmpty() {
            assertThat(CanonicalGraph.empty().isEmpty()).isTrue();
            assertThat(CanonicalGraph.empty().getEdges()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Nodes and edges")
    class PartTests {

        @Test
        @DisplayName("Should copy node configuration in and out")
        void testConfigIsolation() {
            ObjectNode config = JsonNodeFactory.instance.objectNode().put("url", "https://example.com");
            CanonicalNode node = new CanonicalNode("w", NodeKind.ACTION, "webhook", "Hook", config, true);

            config.put("url", "changed");
            ((ObjectNode) node.config()).put("url", "changed again");

            assertThat(node.config().get("url").asText()).isEqualTo("https://example.com");
        }

        @Test
        @DisplayName("Should default missing node fields")
        void testNodeDefaults() {
            CanonicalNode node = new CanonicalNode("n", NodeKind.ACTION, null, null, null, false);

            assertThat(node.rawType()).isEmpty();
            assertThat(node.label()).isEqualTo("n");
            assertThat(node.config().isObject()).isTrue();
        }

        @Test
        @DisplayName("Should describe loops as arrows")
        void testLoopPath() {
            Loop loop = new Loop(List.of("a", "b", "a"), false);
            assertThat(loop.describePath()).isEqualTo("a → b → a");
        }

        @Test
        @DisplayName("Should report whether an edge is labeled")
        void testEdgeLabel() {
            assertThat(new CanonicalEdge("e", "a", "b").hasLabel()).isFalse();
            assertThat(new CanonicalEdge("e", "a", "b", "on_error").hasLabel()).isTrue();
        }
    }
}
