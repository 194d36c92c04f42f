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

package dev.mars.flowaudit.engine.rules;

import dev.mars.flowaudit.core.CanonicalGraph;
import dev.mars.flowaudit.core.CanonicalNode;
import dev.mars.flowaudit.core.config.FlowAuditConfiguration;
import dev.mars.flowaudit.core.document.WebhookEntry;
import dev.mars.flowaudit.core.document.WorkflowDocument;
import dev.mars.flowaudit.core.document.WorkflowStep;
import dev.mars.flowaudit.engine.graph.GraphAnalysis;

import java.util.List;
import java.util.Objects;

/**
 * Everything a rule may inspect for one analysis: the classified document, its canonical graph,
 * the structural facts computed over that graph and the analyzer configuration.
 *
 * <p>All views are immutable, so one context is handed to every rule.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-12
 * @version 1.0
 */
public final class RuleContext {

    private final WorkflowDocument document;
    private final CanonicalGraph graph;
    private final GraphAnalysis graphAnalysis;
    private final FlowAuditConfiguration configuration;
    private final List<WorkflowStep> steps;
    private final List<WebhookEntry> webhooks;

    public RuleContext(WorkflowDocument document, CanonicalGraph graph, GraphAnalysis graphAnalysis,
                       FlowAuditConfiguration configuration) {
        this.document = Objects.requireNonNull(document, "Document cannot be null");
        this.graph = Objects.requireNonNull(graph, "Graph cannot be null");
        this.graphAnalysis = Objects.requireNonNull(graphAnalysis, "Graph analysis cannot be null");
        this.configuration = Objects.requireNonNull(configuration, "Configuration cannot be null");
        this.steps = List.copyOf(document.steps());
        this.webhooks = List.copyOf(document.webhooks());
    }

    public WorkflowDocument getDocument() {
        return document;
    }

    public CanonicalGraph getGraph() {
        return graph;
    }

    public GraphAnalysis getGraphAnalysis() {
        return graphAnalysis;
    }

    public FlowAuditConfiguration getConfiguration() {
        return configuration;
    }

    /**
     * The document's action-like entries in document order.
     */
    public List<WorkflowStep> steps() {
        return steps;
    }

    public List<WebhookEntry> webhooks() {
        return webhooks;
    }

    public String labelOf(String nodeId) {
        return graph.findNode(nodeId).map(CanonicalNode::label).orElse(nodeId);
    }
}
