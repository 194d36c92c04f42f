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

package dev.mars.flowaudit.engine.graph;

import java.util.List;

/**
 * Longest simple path found from a start node.
 *
 * @param nodes node ids along the path, starting with the start node
 * @param unbounded true when the path can run into a loop, so real executions may be longer
 */
public record LongestPath(List<String> nodes, boolean unbounded) {

    public LongestPath {
        nodes = List.copyOf(nodes);
    }

    /**
     * Number of nodes on the path.
     */
    public int length() {
        return nodes.size();
    }
}
