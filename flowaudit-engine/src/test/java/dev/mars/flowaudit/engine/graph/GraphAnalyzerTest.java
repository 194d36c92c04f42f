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

package dev.mars.flowaudit.engine.graph;

import dev.mars.flowaudit.core.CanonicalEdge;
import dev.mars.flowaudit.core.CanonicalGraph;
import dev.mars.flowaudit.core.CanonicalNode;
import dev.mars.flowaudit.core.Loop;
import dev.mars.flowaudit.core.NodeKind;
import dev.mars.flowaudit.core.TriggerConflict;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link GraphAnalyzer}.
 */
@DisplayName("GraphAnalyzer Tests")
class GraphAnalyzerTest {

    private GraphAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new GraphAnalyzer();
    }

    private static CanonicalNode node(String id, String type) {
        return new CanonicalNode(id, NodeKind.fromRawType(type), type, id, null, true);
    }

    private static CanonicalNode action(String id) {
        return node(id, "email");
    }

    private static CanonicalEdge edge(String source, String target) {
        return new CanonicalEdge("edge_" + source + "_" + target, source, target);
    }

    @Nested
    @DisplayName("Loop detection")
    class LoopTests {

        @Test
        @DisplayName("Should report a closed cycle without exit")
        void testClosedCycle() {
            CanonicalGraph graph = new CanonicalGraph(
                    List.of(action("A"), action("B"), action("C")),
                    List.of(edge("A", "B"), edge("B", "C"), edge("C", "A")));

            List<Loop> loops = analyzer.detectLoops(graph);

            assertThat(loops).singleElement().satisfies(loop -> {
                assertThat(loop.nodes()).containsExactly("A", "B", "C", "A");
                assertThat(loop.hasExitCondition()).isFalse();
            });
        }

        @Test
        @DisplayName("Should recognize a cycle with an exit edge")
        void testCycleWithExit() {
            CanonicalGraph graph = new CanonicalGraph(
                    List.of(action("A"), action("B"), action("D")),
                    List.of(edge("A", "B"), edge("B", "A"), edge("B", "D")));

            assertThat(analyzer.detectLoops(graph)).singleElement()
                    .extracting(Loop::hasExitCondition).isEqualTo(true);
        }

        @Test
        @DisplayName("Should only count loops without an exit as unresolved")
        void testUnresolvedLoops() {
            GraphAnalysis withExit = analyzer.analyze(new CanonicalGraph(
                    List.of(action("A"), action("B"), action("D")),
                    List.of(edge("A", "B"), edge("B", "A"), edge("B", "D"))));
            GraphAnalysis closed = analyzer.analyze(new CanonicalGraph(
                    List.of(action("A"), action("B")),
                    List.of(edge("A", "B"), edge("B", "A"))));

            assertThat(withExit.hasLoops()).isTrue();
            assertThat(withExit.hasUnresolvedLoops()).isFalse();
            assertThat(closed.hasUnresolvedLoops()).isTrue();
        }

        @Test
        @DisplayName("Should report self loops")
        void testSelfLoop() {
            CanonicalGraph graph = new CanonicalGraph(List.of(action("A")), List.of(edge("A", "A")));

            assertThat(analyzer.detectLoops(graph)).singleElement()
                    .extracting(Loop::nodes).isEqualTo(List.of("A", "A"));
        }

        @Test
        @DisplayName("Should see cycles through ids that name no node")
        void testCycleThroughDanglingId() {
            CanonicalGraph graph = new CanonicalGraph(List.of(action("A")),
                    List.of(edge("A", "ghost"), edge("ghost", "A")));

            assertThat(analyzer.detectLoops(graph)).hasSize(1);
        }

        @Test
        @DisplayName("Should follow parallel edges once")
        void testParallelEdges() {
            CanonicalGraph graph = new CanonicalGraph(List.of(action("A"), action("B")),
                    List.of(new CanonicalEdge("e1", "A", "B"), new CanonicalEdge("e2", "A", "B"), edge("B", "A")));

            assertThat(analyzer.detectLoops(graph)).hasSize(1);
        }

        @Test
        @DisplayName("Should handle deep chains without recursion")
        void testDeepChain() {
            List<CanonicalNode> nodes = new ArrayList<>();
            List<CanonicalEdge> edges = new ArrayList<>();
            for (int i = 0; i < 20_000; i++) {
                nodes.add(action("n" + i));
                if (i > 0) {
                    edges.add(edge("n" + (i - 1), "n" + i));
                }
            }
            CanonicalGraph graph = new CanonicalGraph(nodes, edges);

            assertThat(analyzer.detectLoops(graph)).isEmpty();
            assertThat(analyzer.topologicalOrder(graph)).hasValueSatisfying(order -> assertThat(order).hasSize(20_000));
        }
    }

    @Nested
    @DisplayName("Topological order")
    class TopologicalOrderTests {

        @Test
        @DisplayName("Should order a diamond")
        void testDiamond() {
            CanonicalGraph graph = new CanonicalGraph(
                    List.of(action("A"), action("B"), action("C"), action("D")),
                    List.of(edge("A", "B"), edge("A", "C"), edge("B", "D"), edge("C", "D")));

            assertThat(analyzer.topologicalOrder(graph)).contains(List.of("A", "B", "C", "D"));
        }

        @Test
        @DisplayName("Should be absent when any cycle exists")
        void testCycle() {
            CanonicalGraph graph = new CanonicalGraph(
                    List.of(action("A"), action("B"), action("D")),
                    List.of(edge("A", "B"), edge("B", "A"), edge("B", "D")));

            assertThat(analyzer.topologicalOrder(graph)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Trigger conflicts")
    class TriggerConflictTests {

        @ParameterizedTest
        @CsvSource({
                "form_submit, form_submit, true",
                "contact_tag_added, contact_updated, true",
                "contact_updated, contact_tag_added, true",
                "form_submit, webhook, true",
                "contact_created, contact_tag_added, true",
                "form_submit, contact_created, false"
        })
        @DisplayName("Should recognize conflicting type pairs")
        void testPairs(String first, String second, boolean expected) {
            assertThat(GraphAnalyzer.triggersConflict(first, second)).isEqualTo(expected);
        }

        @Test
        @DisplayName("Should compare every pair of triggers in document order")
        void testPairwise() {
            CanonicalGraph graph = new CanonicalGraph(
                    List.of(node("t1", "form_submit"), node("t2", "FormSubmitted"), node("t3", "form_submit"),
                            action("a")),
                    List.of());

            List<TriggerConflict> conflicts = analyzer.detectTriggerConflicts(graph);

            assertThat(conflicts).extracting(TriggerConflict::triggerIds)
                    .containsExactly(List.of("t1", "t2"), List.of("t1", "t3"), List.of("t2", "t3"));
            assertThat(conflicts.get(0).description()).isEqualTo("Triggers \"t1\" and \"t2\" may fire simultaneously");
        }
    }

    @Nested
    @DisplayName("Longest paths and reachability")
    class PathTests {

        @Test
        @DisplayName("Should find the longest path through a diamond")
        void testDiamond() {
            CanonicalGraph graph = new CanonicalGraph(
                    List.of(node("T", "form_submit"), action("A"), action("B"), action("C"), action("D")),
                    List.of(edge("T", "A"), edge("A", "B"), edge("A", "D"), edge("B", "C"), edge("C", "D")));

            LongestPath path = analyzer.longestPathFrom(graph, "T");

            assertThat(path.nodes()).containsExactly("T", "A", "B", "C", "D");
            assertThat(path.length()).isEqualTo(5);
            assertThat(path.unbounded()).isFalse();
        }

        @Test
        @DisplayName("Should end paths at loop members and mark them unbounded")
        void testLoopEndsPath() {
            CanonicalGraph graph = new CanonicalGraph(
                    List.of(node("T", "form_submit"), action("A"), action("B"), action("C")),
                    List.of(edge("T", "A"), edge("A", "B"), edge("B", "C"), edge("C", "B")));

            LongestPath path = analyzer.longestPathFrom(graph, "T");

            assertThat(path.nodes()).containsExactly("T", "A", "B");
            assertThat(path.unbounded()).isTrue();
        }

        @Test
        @DisplayName("Should compute paths for every trigger in the full analysis")
        void testAnalyze() {
            CanonicalGraph graph = new CanonicalGraph(
                    List.of(node("T1", "form_submit"), node("T2", "contact_created"), action("A"), action("B"),
                            action("orphan")),
                    List.of(edge("T1", "A"), edge("A", "B"), edge("T2", "B")));

            GraphAnalysis analysis = analyzer.analyze(graph);

            assertThat(analysis.longestPaths()).containsOnlyKeys("T1", "T2");
            assertThat(analysis.longestPaths().get("T1").length()).isEqualTo(3);
            assertThat(analysis.longestPaths().get("T2").length()).isEqualTo(2);
            assertThat(analysis.reachableFromTriggers()).containsExactlyInAnyOrder("T1", "T2", "A", "B");
            assertThat(analysis.hasUnresolvedLoops()).isFalse();
            assertThat(analysis.hasLoops()).isFalse();
            assertThat(analysis.hasTriggerConflicts()).isFalse();
        }

        @Test
        @DisplayName("Should return a single node path for an isolated start")
        void testIsolated() {
            CanonicalGraph graph = new CanonicalGraph(List.of(node("T", "form_submit")), List.of());

            assertThat(analyzer.longestPathFrom(graph, "T").nodes()).containsExactly("T");
        }
    }
}
