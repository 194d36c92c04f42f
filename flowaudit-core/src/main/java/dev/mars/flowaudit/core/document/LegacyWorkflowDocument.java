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

import java.util.ArrayList;
import java.util.List;

/**
 * Workflow expressed as an ordered {@code actions[]} list with optional {@code triggers[]}.
 *
 * <p>Without a non-empty {@code connections[]} array the actions run in array order, entered from
 * the first trigger.</p>
 */
public final class LegacyWorkflowDocument extends WorkflowDocument {

    LegacyWorkflowDocument(JsonNode root) {
        super(root);
    }

    public List<WorkflowStep> triggers() {
        List<JsonNode> raw = JsonFields.array(root(), "triggers");
        List<WorkflowStep> triggers = new ArrayList<>(raw.size());
        for (int i = 0; i < raw.size(); i++) {
            triggers.add(WorkflowStep.trigger(i, raw.get(i)));
        }
        return triggers;
    }

    public List<WorkflowStep> actions() {
        List<JsonNode> raw = JsonFields.array(root(), "actions");
        List<WorkflowStep> actions = new ArrayList<>(raw.size());
        for (int i = 0; i < raw.size(); i++) {
            actions.add(WorkflowStep.action(i, raw.get(i)));
        }
        return actions;
    }

    @Override
    public List<WorkflowStep> steps() {
        return actions();
    }

    public boolean hasExplicitConnections() {
        return !connections().isEmpty();
    }
}
