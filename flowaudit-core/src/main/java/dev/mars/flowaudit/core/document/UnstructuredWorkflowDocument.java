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

import java.util.List;

/**
 * A document in no recognized shape. It has no steps and normalizes to the empty graph, but its
 * {@code webhooks[]} are still inspected.
 */
public final class UnstructuredWorkflowDocument extends WorkflowDocument {

    UnstructuredWorkflowDocument(JsonNode root) {
        super(root);
    }

    @Override
    public List<WorkflowStep> steps() {
        return List.of();
    }

    @Override
    public List<WorkflowConnection> connections() {
        return List.of();
    }
}
