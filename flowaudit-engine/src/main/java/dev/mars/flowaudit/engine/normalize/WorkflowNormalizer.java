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

package dev.mars.flowaudit.engine.normalize;

import dev.mars.flowaudit.core.CanonicalEdge;
import dev.mars.flowaudit.core.CanonicalGraph;
import dev.mars.flowaudit.core.CanonicalNode;
import dev.mars.flowaudit.core.NodeKind;
import dev.mars.flowaudit.core.document.LegacyWorkflowDocument;
import dev.mars.flowaudit.core.document.ModernWorkflowDocument;
import dev.mars.flowaudit.core.document.WorkflowConnection;
import dev.mars.flowaudit.core.document.WorkflowDocument;
import dev.mars.flowaudit.core.document.WorkflowStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Converts a workflow document of any supported shape into the canonical graph.
 *
 * <p>Normalization never throws for a well-formed JSON tree. Entries that cannot be anchored
 * (a connection without {@code from} or {@code to}) are dropped, and a repeated node id keeps
 * its first occurrence. Edges naming unknown nodes are kept so the rule catalog can report them.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-12
 * @version 1.0
 */
public class WorkflowNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowNormalizer.class);

    /**
     * Produces the canonical graph of the document.
     *
     * @param document the classified workflow document
     * @return an immutable graph, empty for unstructured documents
     */
    public CanonicalGraph normalize(WorkflowDocument document) {
        Objects.requireNonNull(document, "Workflow document cannot be null");

        if (document instanceof ModernWorkflowDocument modern) {
            return normalizeModern(modern);
        } else if (document instanceof LegacyWorkflowDocument legacy) {
            return normalizeLegacy(legacy);
        }
        logger.debug("Document {} has no recognized shape, using empty graph", document);
        return CanonicalGraph.empty();
    }

    private CanonicalGraph normalizeModern(ModernWorkflowDocument document) {
        Map<String, CanonicalNode> nodes = new LinkedHashMap<>();
        for (WorkflowStep step : document.nodes()) {
            addNode(nodes, toNode(step, step.getKind(), NodeKind.isRecognized(step.getType())));
        }
        List<CanonicalEdge> edges = toEdges(document.connections());
        return new CanonicalGraph(new ArrayList<>(nodes.values()), edges);
    }

    private CanonicalGraph normalizeLegacy(LegacyWorkflowDocument document) {
        List<WorkflowStep> triggers = document.triggers();
        List<WorkflowStep> actions = document.actions();
        if (triggers.isEmpty() && actions.isEmpty()) {
            return CanonicalGraph.empty();
        }

        Map<String, CanonicalNode> nodes = new LinkedHashMap<>();
        List<String> triggerIds = new ArrayList<>();
        for (WorkflowStep trigger : triggers) {
            // legacy triggers are entry points whatever their type says
            CanonicalNode node = new CanonicalNode(trigger.getId(), NodeKind.TRIGGER,
                    trigger.getType().isEmpty() ? "unknown" : trigger.getType(),
                    trigger.getLabel(), trigger.getConfig(), true);
            addNode(nodes, node);
            triggerIds.add(trigger.getId());
        }
        List<String> actionIds = new ArrayList<>();
        for (WorkflowStep action : actions) {
            addNode(nodes, toNode(action, action.getKind(), NodeKind.isRecognized(action.getType())));
            actionIds.add(action.getId());
        }

        List<CanonicalEdge> edges = document.hasExplicitConnections()
                ? toEdges(document.connections())
                : ImplicitChainSynthesizer.chain(triggerIds, actionIds);
        return new CanonicalGraph(new ArrayList<>(nodes.values()), edges);
    }

    private static CanonicalNode toNode(WorkflowStep step, NodeKind kind, boolean recognized) {
        return new CanonicalNode(step.getId(), kind, step.getType(), step.getLabel(), step.getConfig(), recognized);
    }

    private static void addNode(Map<String, CanonicalNode> nodes, CanonicalNode node) {
        if (nodes.putIfAbsent(node.id(), node) != null) {
            logger.debug("Ignoring repeated node id '{}'", node.id());
        }
    }

    private static List<CanonicalEdge> toEdges(List<WorkflowConnection> connections) {
        List<CanonicalEdge> edges = new ArrayList<>(connections.size());
        for (WorkflowConnection connection : connections) {
            if (!connection.isAnchored()) {
                logger.debug("Dropping connection #{} without both endpoints", connection.index());
                continue;
            }
            String id = "edge_" + connection.from() + "_" + connection.to() + "_" + connection.index();
            edges.add(new CanonicalEdge(id, connection.from(), connection.to(), connection.branch()));
        }
        return edges;
    }
}
