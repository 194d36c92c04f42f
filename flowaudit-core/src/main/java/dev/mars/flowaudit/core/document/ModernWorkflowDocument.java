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

package dev.mars.flowaudit.core.document;

import com.fasterxml.jackson.databind.JsonNode;
import dev.mars.flowaudit.core.NodeKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Workflow with explicit {@code nodes[]} and {@code connections[]}.
 */
public final class ModernWorkflowDocument extends WorkflowDocument {

    ModernWorkflowDocument(JsonNode root) {
        super(root);
    }

    /**
     * All nodes, triggers included, in document order.
     */
    public List<WorkflowStep> nodes() {
        List<JsonNode> raw = JsonFields.array(root(), "nodes");
        List<WorkflowStep> nodes = new ArrayList<>(raw.size());
        for (int i = 0; i < raw.size(); i++) {
            nodes.add(WorkflowStep.node(i, raw.get(i)));
        }
        return nodes;
    }

    @Override
    public List<WorkflowStep> steps() {
        List<WorkflowStep> steps = new ArrayList<>();
        for (WorkflowStep node : nodes()) {
            if (node.getKind() != NodeKind.TRIGGER) {
                steps.add(node);
            }
        }
        return steps;
    }
}
