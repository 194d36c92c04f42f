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

import java.util.List;
import java.util.Objects;

/**
 * A closed path found by cycle detection. The node list starts and ends with the same id.
 *
 * @param nodes the cycle path, closed
 * @param hasExitCondition whether any node on the cycle has an edge leaving it
 */
public record Loop(List<String> nodes, boolean hasExitCondition) {

    public Loop {
        nodes = List.copyOf(Objects.requireNonNull(nodes, "Loop nodes cannot be null"));
    }

    public String describePath() {
        return String.join(" → ", nodes);
    }
}
