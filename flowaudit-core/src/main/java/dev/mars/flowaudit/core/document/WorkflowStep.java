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
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import dev.mars.flowaudit.core.NodeKind;
import dev.mars.flowaudit.core.RawTypes;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only view of one entry of a workflow document: a legacy trigger or action, or a modern node.
 *
 * <p>The id is resolved once here, from the entry itself or synthesized from its position, so that
 * issues raised against a step and nodes of the canonical graph refer to the same id.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-12
 * @version 1.0
 */
public final class WorkflowStep {

    private final int index;
    private final String id;
    private final String type;
    private final String label;
    private final JsonNode raw;

    WorkflowStep(int index, JsonNode raw, String fallbackId, String fallbackLabel) {
        this.index = index;
        this.raw = raw != null ? raw : JsonNodeFactory.instance.objectNode();
        this.id = JsonFields.firstText(this.raw, "id").orElse(fallbackId);
        this.type = JsonFields.text(this.raw, "type").orElse("");
        this.label = JsonFields.firstText(this.raw, "name").orElse(fallbackLabel);
    }

    static WorkflowStep action(int index, JsonNode raw) {
        String type = JsonFields.text(raw, "type").orElse("");
        return new WorkflowStep(index, raw, "action_" + index, type + " " + (index + 1));
    }

    static WorkflowStep trigger(int index, JsonNode raw) {
        return new WorkflowStep(index, raw, "trigger_" + index, "Trigger " + (index + 1));
    }

    static WorkflowStep node(int index, JsonNode raw) {
        String type = JsonFields.text(raw, "type").orElse("");
        return new WorkflowStep(index, raw, "node_" + index, type + " " + (index + 1));
    }

    /**
     * Position of the entry within its source array.
     */
    public int getIndex() {
        return index;
    }

    public String getId() {
        return id;
    }

    /**
     * Type exactly as written in the document, empty when absent.
     */
    public String getType() {
        return type;
    }

    public String getNormalizedType() {
        return RawTypes.normalize(type);
    }

    public NodeKind getKind() {
        return NodeKind.fromRawType(type);
    }

    /**
     * Label for graph display: the name, or the type and position.
     */
    public String getLabel() {
        return label;
    }

    /**
     * Name used in issue descriptions: the name, or the id.
     */
    public String getDisplayName() {
        return JsonFields.firstText(raw, "name").orElse(id);
    }

    public Optional<String> getDescription() {
        return JsonFields.text(raw, "description");
    }

    /**
     * Configuration object of the entry, an empty object when absent or malformed.
     */
    public JsonNode getConfig() {
        return JsonFields.object(raw, "config")
                .map(node -> (JsonNode) node.deepCopy())
                .orElseGet(JsonNodeFactory.instance::objectNode);
    }

    public Optional<String> getFallbackActionId() {
        return JsonFields.text(raw, "fallbackActionId");
    }

    public List<JsonNode> getBranches() {
        return JsonFields.array(raw, "branches");
    }

    public List<JsonNode> getConditions() {
        return JsonFields.array(raw, "conditions");
    }

    public boolean isDeprecated() {
        return JsonFields.isTruthy(raw, "deprecated");
    }

    /**
     * True when the entry itself sets the field to a truthy value (outside of {@code config}).
     */
    public boolean hasTruthy(String field) {
        return JsonFields.isTruthy(raw, field);
    }

    public JsonNode getRaw() {
        return raw.deepCopy();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowStep that = (WorkflowStep) o;
        return index == that.index && id.equals(that.id) && raw.equals(that.raw);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, id, raw);
    }

    @Override
    public String toString() {
        return "WorkflowStep{" +
               "id='" + id + '\'' +
               ", type='" + type + '\'' +
               ", index=" + index +
               '}';
    }
}
