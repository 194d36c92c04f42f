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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.Objects;

/**
 * A node of the canonical workflow graph.
 *
 * <p>The raw type is preserved exactly as the document spelled it so rules can match on it;
 * {@link #kind()} is the closed category derived from it. The configuration is copied on the
 * way in and on the way out, so a node can be shared between rules without any of them being
 * able to change what the others see.</p>
 *
 * @param id unique node id within its graph
 * @param kind derived node category
 * @param rawType type as written in the document, never null
 * @param label human readable label
 * @param config node configuration object, never null
 * @param recognized whether the raw type was found in the kind lookup table
 */
public record CanonicalNode(String id, NodeKind kind, String rawType, String label,
                            JsonNode config, boolean recognized) {

    public CanonicalNode {
        Objects.requireNonNull(id, "Node id cannot be null");
        Objects.requireNonNull(kind, "Node kind cannot be null");
        rawType = rawType != null ? rawType : "";
        label = label != null ? label : id;
        config = config != null && config.isObject()
                ? config.deepCopy()
                : JsonNodeFactory.instance.objectNode();
    }

    @Override
    public JsonNode config() {
        return config.deepCopy();
    }

    /**
     * Returns the raw type in normalized form, for table lookups.
     */
    public String normalizedType() {
        return RawTypes.normalize(rawType);
    }

    public boolean isTrigger() {
        return kind == NodeKind.TRIGGER;
    }

    public boolean isCondition() {
        return kind == NodeKind.CONDITION;
    }
}
