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

import java.util.Optional;

/**
 * One entry of a document's {@code connections[]} array.
 *
 * @param index position within the array
 * @param from source id, may be null when the entry omits it
 * @param to target id, may be null when the entry omits it
 * @param branch branch label, may be null
 */
public record WorkflowConnection(int index, String from, String to, String branch) {

    static WorkflowConnection of(int index, JsonNode raw) {
        return new WorkflowConnection(index,
                JsonFields.firstText(raw, "from").orElse(null),
                JsonFields.firstText(raw, "to").orElse(null),
                JsonFields.text(raw, "branch").orElse(null));
    }

    public boolean isAnchored() {
        return from != null && to != null;
    }

    public Optional<String> branchLabel() {
        return Optional.ofNullable(branch);
    }
}
