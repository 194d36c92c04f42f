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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable canonical node/edge graph produced once per analysis.
 *
 * <p>Node ids are unique; constructing a graph with a repeated id is a programming error and
 * fails fast. Edges are kept in document order and may reference unknown node ids.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-12
 * @version 1.0
 */
public final class CanonicalGraph {

    private static final CanonicalGraph EMPTY = new CanonicalGraph(List.of(), List.of());

    private final List<CanonicalNode> nodes;
    private final List<CanonicalEdge> edges;
    private final Map<String, CanonicalNode> nodesById;
    private final Map<String, List<CanonicalEdge>> outgoing;
    private final Map<String, List<CanonicalEdge>> incoming;

    public CanonicalGraph(List<CanonicalNode> nodes, List<CanonicalEdge> edges) {
        this.nodes = List.copyOf(Objects.requireNonNull(nodes, "Nodes cannot be null"));
        this.edges = List.copyOf(Objects.requireNonNull(edges, "Edges cannot be null"));
        this.nodesById = new LinkedHashMap<>();
        this.outgoing = new LinkedHashMap<>();
        this.incoming = new LinkedHashMap<>();

        for (CanonicalNode node : this.nodes) {
            if (nodesById.putIfAbsent(node.id(), node) != null) {
                throw new IllegalArgumentException("Duplicate node id: " + node.id());
            }
        }
        for (CanonicalEdge edge : this.edges) {
            outgoing.computeIfAbsent(edge.source(), k -> new ArrayList<>()).add(edge);
            incoming.computeIfAbsent(edge.target(), k -> new ArrayList<>()).add(edge);
        }
    }

    public static CanonicalGraph empty() {
        return EMPTY;
    }

    public List<CanonicalNode> getNodes() {
        return nodes;
    }

    public List<CanonicalEdge> getEdges() {
        return edges;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty() && edges.isEmpty();
    }

    public Optional<CanonicalNode> findNode(String id) {
        return Optional.ofNullable(nodesById.get(id));
    }

    public boolean containsNode(String id) {
        return nodesById.containsKey(id);
    }

    public List<CanonicalEdge> outgoingEdges(String nodeId) {
        return Collections.unmodifiableList(outgoing.getOrDefault(nodeId, List.of()));
    }

    public List<CanonicalEdge> incomingEdges(String nodeId) {
        return Collections.unmodifiableList(incoming.getOrDefault(nodeId, List.of()));
    }

    public List<CanonicalNode> triggers() {
        return nodes.stream().filter(CanonicalNode::isTrigger).toList();
    }

    /**
     * Cyclomatic branch approximation, {@code edges - nodes + 2}, not clamped.
     */
    public int branchEstimate() {
        return edges.size() - nodes.size() + 2;
    }

    @Override
    public String toString() {
        return "CanonicalGraph{" +
               "nodes=" + nodes.size() +
               ", edges=" + edges.size() +
               '}';
    }
}
