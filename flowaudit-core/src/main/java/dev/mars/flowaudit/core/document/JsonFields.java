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
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Lenient field access over untrusted JSON trees.
 *
 * <p>None of these methods throw. A field that is missing, {@code null} or of the wrong JSON type
 * is reported as absent, so rules can treat a malformed field exactly like a missing one.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-12
 * @version 1.0
 */
public final class JsonFields {

    private JsonFields() {
    }

    /**
     * Follows a path of object field names.
     *
     * @return the node at the end of the path, or empty if any step is missing or not an object
     */
    public static Optional<JsonNode> at(JsonNode node, String... path) {
        JsonNode current = node;
        for (String field : path) {
            if (current == null || !current.isObject()) {
                return Optional.empty();
            }
            current = current.get(field);
        }
        return Optional.ofNullable(current);
    }

    /**
     * Returns the value of a string field.
     */
    public static Optional<String> text(JsonNode node, String... path) {
        return at(node, path).filter(JsonNode::isTextual).map(JsonNode::asText);
    }

    /**
     * Returns the first non-empty string among the given fields of {@code node}.
     */
    public static Optional<String> firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            Optional<String> value = text(node, field).filter(v -> !v.isEmpty());
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    /**
     * Evaluates a field the way a loosely typed workflow platform does: absent, {@code null},
     * {@code false}, zero and the empty string are false, everything else is true.
     */
    public static boolean isTruthy(JsonNode node, String... path) {
        return at(node, path).map(JsonFields::isTruthyValue).orElse(false);
    }

    static boolean isTruthyValue(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return false;
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isNumber()) {
            double number = value.doubleValue();
            return number != 0.0 && !Double.isNaN(number);
        }
        if (value.isTextual()) {
            return !value.textValue().isEmpty();
        }
        return true;
    }

    /**
     * True when the field is present at all, even if its value is {@code null}.
     */
    public static boolean isDefined(JsonNode node, String... path) {
        return at(node, path).filter(v -> !v.isMissingNode()).isPresent();
    }

    /**
     * Returns the elements of an array field, or an empty list.
     */
    public static List<JsonNode> array(JsonNode node, String field) {
        Optional<JsonNode> value = at(node, field).filter(JsonNode::isArray);
        if (value.isEmpty()) {
            return Collections.emptyList();
        }
        List<JsonNode> elements = new ArrayList<>(value.get().size());
        value.get().forEach(elements::add);
        return elements;
    }

    public static boolean isArray(JsonNode node, String field) {
        return at(node, field).filter(JsonNode::isArray).isPresent();
    }

    /**
     * Returns an object field, or empty when the field is missing or not an object.
     */
    public static Optional<JsonNode> object(JsonNode node, String field) {
        return at(node, field).filter(JsonNode::isObject);
    }
}
