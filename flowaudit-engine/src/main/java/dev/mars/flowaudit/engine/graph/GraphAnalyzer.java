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
import dev.mars.flowaudit.core.TriggerConflict;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;

/**
 * Graph algorithms over the canonical workflow graph.
 *
 * <p>All traversals are iterative, so arbitrarily deep chains cannot exhaust the stack. The vertex
 * set is every node id in document order followed by any edge endpoint that names no node, so a
 * cycle through a dangling id is still seen. Parallel edges between the same pair of vertices are
 * followed once.</p>
 *
 * <p>The analyzer is stateless and safe to share between threads.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-12
 * @version 1.0
 */
public class GraphAnalyzer {

    private static final List<Set<String>> CONFLICTING_TRIGGER_TYPES = List.of(
            Set.of("contact_tag_added", "contact_updated"),
            Set.of("form_submit", "webhook"),
            Set.of("contact_created", "contact_tag_added")
    );

    /**
     * Runs every structural check once and bundles the results.
     */
    public GraphAnalysis analyze(CanonicalGraph graph) {
        Objects.requireNonNull(graph, "Graph cannot be null");
        Adjacency adjacency = Adjacency.of(graph);
        List<Loop> loops = detectLoops(graph, adjacency);
        return new GraphAnalysis(
                loops,
                detectTriggerConflicts(graph),
                longestPaths(graph, adjacency, loops),
                reachableFromTriggers(graph, adjacency));
    }

    /**
     * Depth-first cycle detection. Every back edge into a vertex still on the traversal path
     * yields one loop: the path from that vertex to the current one, closed by repeating the
     * first id. A fresh traversal starts from every vertex not yet visited.
     */
    public List<Loop> detectLoops(CanonicalGraph graph) {
        Objects.requireNonNull(graph, "Graph cannot be null");
        return detectLoops(graph, Adjacency.of(graph));
    }

    /**
     * Kahn's algorithm over the full edge set.
     *
     * @return the sorted vertex ids, or empty when any cycle exists, whether or not it has an exit
     */
    public Optional<List<String>> topologicalOrder(CanonicalGraph graph) {
        Objects.requireNonNull(graph, "Graph cannot be null");
        return topologicalOrder(Adjacency.of(graph));
    }

    /**
     * Pairwise comparison of all trigger nodes in document order.
     */
    public List<TriggerConflict> detectTriggerConflicts(CanonicalGraph graph) {
        Objects.requireNonNull(graph, "Graph cannot be null");
        List<CanonicalNode> triggers = graph.triggers();
        List<TriggerConflict> conflicts = new ArrayList<>();
        for (int i = 0; i < triggers.size(); i++) {
            for (int j = i + 1; j < triggers.size(); j++) {
                CanonicalNode first = triggers.get(i);
                CanonicalNode second = triggers.get(j);
                if (triggersConflict(first.normalizedType(), second.normalizedType())) {
                    conflicts.add(new TriggerConflict(first.id(), second.id(),
                            "Triggers \"" + first.label() + "\" and \"" + second.label()
                                    + "\" may fire simultaneously"));
                }
            }
        }
        return conflicts;
    }

    /**
     * Two trigger types conflict when they are equal or form a known ambiguous pair.
     */
    public static boolean triggersConflict(String firstType, String secondType) {
        if (firstType.equals(secondType)) {
            return true;
        }
        Set<String> pair = Set.of(firstType, secondType);
        return CONFLICTING_TRIGGER_TYPES.contains(pair);
    }

    /**
     * Longest simple path starting at {@code startId}.
     */
    public LongestPath longestPathFrom(CanonicalGraph graph, String startId) {
        Objects.requireNonNull(graph, "Graph cannot be null");
        Adjacency adjacency = Adjacency.of(graph);
        PathTable table = PathTable.build(adjacency, loopMembers(detectLoops(graph, adjacency)));
        return table.pathFrom(startId);
    }

    /**
     * Breadth-first reachability from every trigger node.
     */
    public Set<String> reachableFromTriggers(CanonicalGraph graph) {
        Objects.requireNonNull(graph, "Graph cannot be null");
        return reachableFromTriggers(graph, Adjacency.of(graph));
    }

    private List<Loop> detectLoops(CanonicalGraph graph, Adjacency adjacency) {
        List<Loop> loops = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        Set<String> onPath = new HashSet<>();
        List<String> path = new ArrayList<>();
        Deque<Frame> stack = new ArrayDeque<>();

        for (String root : adjacency.vertices()) {
            if (visited.contains(root)) {
                continue;
            }
            visited.add(root);
            onPath.add(root);
            path.add(root);
            stack.push(new Frame(root, adjacency.successors(root)));

            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                if (frame.next < frame.successors.size()) {
                    String neighbor = frame.successors.get(frame.next++);
                    if (!visited.contains(neighbor)) {
                        visited.add(neighbor);
                        onPath.add(neighbor);
                        path.add(neighbor);
                        stack.push(new Frame(neighbor, adjacency.successors(neighbor)));
                    } else if (onPath.contains(neighbor)) {
                        List<String> cycle = new ArrayList<>(path.subList(path.indexOf(neighbor), path.size()));
                        cycle.add(neighbor);
                        loops.add(new Loop(cycle, hasExit(graph, cycle)));
                    }
                } else {
                    stack.pop();
                    onPath.remove(frame.vertex);
                    path.remove(path.size() - 1);
                }
            }
        }
        return loops;
    }

    private static boolean hasExit(CanonicalGraph graph, List<String> cycle) {
        Set<String> members = new HashSet<>(cycle);
        for (String member : members) {
            for (CanonicalEdge edge : graph.outgoingEdges(member)) {
                if (!members.contains(edge.target())) {
                    return true;
                }
            }
        }
        return false;
    }

    private static Optional<List<String>> topologicalOrder(Adjacency adjacency) {
        List<String> sorted = kahn(adjacency, adjacency.vertices(), Collections.emptySet());
        if (sorted.size() < adjacency.vertices().size()) {
            return Optional.empty();
        }
        return Optional.of(sorted);
    }

    /**
     * Kahn's algorithm restricted to {@code vertices}, ignoring any vertex in {@code excluded}.
     */
    private static List<String> kahn(Adjacency adjacency, List<String> vertices, Set<String> excluded) {
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        for (String vertex : vertices) {
            if (!excluded.contains(vertex)) {
                inDegree.put(vertex, 0);
            }
        }
        for (String vertex : inDegree.keySet()) {
            for (String successor : adjacency.successors(vertex)) {
                inDegree.computeIfPresent(successor, (k, degree) -> degree + 1);
            }
        }

        Queue<String> queue = new ArrayDeque<>();
        for (Map.Entry<String, Integer> entry : inDegree.entrySet()) {
            if (entry.getValue() == 0) {
                queue.offer(entry.getKey());
            }
        }

        List<String> sorted = new ArrayList<>(inDegree.size());
        while (!queue.isEmpty()) {
            String current = queue.poll();
            sorted.add(current);
            for (String successor : adjacency.successors(current)) {
                Integer degree = inDegree.computeIfPresent(successor, (k, d) -> d - 1);
                if (degree != null && degree == 0) {
                    queue.offer(successor);
                }
            }
        }
        return sorted;
    }

    private static Map<String, LongestPath> longestPaths(CanonicalGraph graph, Adjacency adjacency, List<Loop> loops) {
        PathTable table = PathTable.build(adjacency, loopMembers(loops));
        Map<String, LongestPath> paths = new LinkedHashMap<>();
        for (CanonicalNode trigger : graph.triggers()) {
            paths.put(trigger.id(), table.pathFrom(trigger.id()));
        }
        return paths;
    }

    private static Set<String> loopMembers(List<Loop> loops) {
        Set<String> members = new HashSet<>();
        for (Loop loop : loops) {
            members.addAll(loop.nodes());
        }
        return members;
    }

    private static Set<String> reachableFromTriggers(CanonicalGraph graph, Adjacency adjacency) {
        Set<String> reachable = new LinkedHashSet<>();
        Queue<String> queue = new ArrayDeque<>();
        for (CanonicalNode trigger : graph.triggers()) {
            if (reachable.add(trigger.id())) {
                queue.offer(trigger.id());
            }
        }
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String successor : adjacency.successors(current)) {
                if (reachable.add(successor)) {
                    queue.offer(successor);
                }
            }
        }
        return reachable;
    }

    private static final class Frame {
        private final String vertex;
        private final List<String> successors;
        private int next;

        private Frame(String vertex, List<String> successors) {
            this.vertex = vertex;
            this.successors = successors;
        }
    }

    /**
     * De-duplicated successor lists over the full vertex set.
     */
    private static final class Adjacency {
        private final List<String> vertices;
        private final Map<String, List<String>> successors;

        private Adjacency(List<String> vertices, Map<String, List<String>> successors) {
            this.vertices = vertices;
            this.successors = successors;
        }

        static Adjacency of(CanonicalGraph graph) {
            Set<String> vertices = new LinkedHashSet<>();
            for (CanonicalNode node : graph.getNodes()) {
                vertices.add(node.id());
            }
            Map<String, Set<String>> targets = new LinkedHashMap<>();
            for (CanonicalEdge edge : graph.getEdges()) {
                vertices.add(edge.source());
                vertices.add(edge.target());
                targets.computeIfAbsent(edge.source(), k -> new LinkedHashSet<>()).add(edge.target());
            }
            Map<String, List<String>> successors = new HashMap<>();
            targets.forEach((source, set) -> successors.put(source, List.copyOf(set)));
            return new Adjacency(List.copyOf(vertices), successors);
        }

        List<String> vertices() {
            return vertices;
        }

        List<String> successors(String vertex) {
            return successors.getOrDefault(vertex, List.of());
        }
    }

    /**
     * Longest path from every vertex outside a loop, memoized over a topological order of the
     * loop-free part of the graph. A loop vertex may end a path but is never expanded.
     */
    private static final class PathTable {
        private final Map<String, Integer> length = new HashMap<>();
        private final Map<String, String> next = new HashMap<>();
        private final Map<String, Boolean> unbounded = new HashMap<>();
        private final Set<String> loopMembers;

        private PathTable(Set<String> loopMembers) {
            this.loopMembers = loopMembers;
        }

        static PathTable build(Adjacency adjacency, Set<String> loopMembers) {
            PathTable table = new PathTable(loopMembers);
            List<String> order = kahn(adjacency, adjacency.vertices(), loopMembers);
            for (int i = order.size() - 1; i >= 0; i--) {
                String vertex = order.get(i);
                int best = 1;
                String bestNext = null;
                boolean reachesLoop = false;
                for (String successor : adjacency.successors(vertex)) {
                    Integer successorLength = table.length.get(successor);
                    int candidate;
                    if (successorLength == null) {
                        reachesLoop = true;
                        candidate = 2;
                    } else {
                        reachesLoop |= table.unbounded.get(successor);
                        candidate = successorLength + 1;
                    }
                    if (candidate > best) {
                        best = candidate;
                        bestNext = successor;
                    }
                }
                table.length.put(vertex, best);
                table.unbounded.put(vertex, reachesLoop);
                if (bestNext != null) {
                    table.next.put(vertex, bestNext);
                }
            }
            return table;
        }

        LongestPath pathFrom(String start) {
            if (!length.containsKey(start)) {
                return new LongestPath(List.of(start), loopMembers.contains(start));
            }
            List<String> nodes = new ArrayList<>(length.get(start));
            String current = start;
            while (current != null) {
                nodes.add(current);
                current = length.containsKey(current) ? next.get(current) : null;
            }
            return new LongestPath(nodes, unbounded.get(start));
        }
    }
}
