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
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * An automation workflow definition as supplied by the platform, in one of its known shapes.
 *
 * <p>The shape is decided once by {@link #of(JsonNode)}:</p>
 * <ul>
 *   <li>{@link ModernWorkflowDocument}: {@code nodes[]} plus explicit {@code connections[]}</li>
 *   <li>{@link LegacyWorkflowDocument}: ordered {@code actions[]} with optional {@code triggers[]}</li>
 *   <li>{@link UnstructuredWorkflowDocument}: anything else, including a top-level array</li>
 * </ul>
 *
 * <p>A document wraps a private deep copy of the tree it was built from, so neither the caller nor
 * the analysis can change what the other sees.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-12
 * @version 1.0
 */
public abstract sealed class WorkflowDocument
        permits ModernWorkflowDocument, LegacyWorkflowDocument, UnstructuredWorkflowDocument {

    private final JsonNode root;

    WorkflowDocument(JsonNode root) {
        this.root = root.deepCopy();
    }

    /**
     * Classifies a parsed document by shape. Never throws for a non-null tree.
     */
    public static WorkflowDocument of(JsonNode root) {
        Objects.requireNonNull(root, "Workflow document cannot be null");
        if (root.isObject()) {
            if (JsonFields.isArray(root, "nodes") && JsonFields.isArray(root, "connections")) {
                return new ModernWorkflowDocument(root);
            }
            if (JsonFields.isArray(root, "actions")) {
                return new LegacyWorkflowDocument(root);
            }
        }
        return new UnstructuredWorkflowDocument(root);
    }

    protected JsonNode root() {
        return root;
    }

    public Optional<String> getId() {
        return JsonFields.text(root, "id");
    }

    public Optional<String> getName() {
        return JsonFields.text(root, "name");
    }

    public Optional<String> getStatus() {
        return JsonFields.text(root, "status");
    }

    /**
     * A workflow is live when its status is {@code active} or {@code published}.
     */
    public boolean isActive() {
        return getStatus()
                .map(s -> s.toLowerCase(Locale.ROOT))
                .filter(s -> s.equals("active") || s.equals("published"))
                .isPresent();
    }

    public List<WebhookEntry> webhooks() {
        List<JsonNode> raw = JsonFields.array(root, "webhooks");
        List<WebhookEntry> entries = new ArrayList<>(raw.size());
        for (int i = 0; i < raw.size(); i++) {
            entries.add(WebhookEntry.of(i, raw.get(i)));
        }
        return entries;
    }

    /**
     * The ordered action-like entries the configuration rules inspect.
     */
    public abstract List<WorkflowStep> steps();

    /**
     * Explicit connections declared by the document, in array order.
     */
    public List<WorkflowConnection> connections() {
        List<JsonNode> raw = JsonFields.array(root, "connections");
        List<WorkflowConnection> connections = new ArrayList<>(raw.size());
        for (int i = 0; i < raw.size(); i++) {
            connections.add(WorkflowConnection.of(i, raw.get(i)));
        }
        return connections;
    }

    /**
     * Returns a copy of the tree this document was built from.
     */
    public JsonNode getRoot() {
        return root.deepCopy();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{id=" + getId().orElse("<none>") + "}";
    }
}
