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

import java.util.Objects;

/**
 * A directed control-flow edge. Parallel edges between the same pair of nodes are allowed,
 * typically one per branch label of a condition. An edge may name a node that does not exist
 * in the graph; that is reported as an issue, not rejected here.
 *
 * @param id edge id
 * @param source id of the node control flows from
 * @param target id of the node control flows to
 * @param label optional branch label, null when absent
 */
public record CanonicalEdge(String id, String source, String target, String label) {

    public CanonicalEdge {
        Objects.requireNonNull(id, "Edge id cannot be null");
        Objects.requireNonNull(source, "Edge source cannot be null");
        Objects.requireNonNull(target, "Edge target cannot be null");
    }

    public CanonicalEdge(String id, String source, String target) {
        this(id, source, target, null);
    }

    public boolean hasLabel() {
        return label != null && !label.isBlank();
    }
}
