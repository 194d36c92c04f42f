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

import dev.mars.flowaudit.core.Loop;
import dev.mars.flowaudit.core.TriggerConflict;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structural facts computed once per canonical graph and shared by every rule.
 *
 * @param loops loops found by cycle detection, in discovery order
 * @param triggerConflicts conflicting trigger pairs
 * @param longestPaths longest path from each trigger, keyed by trigger id in document order
 * @param reachableFromTriggers ids reachable from at least one trigger, triggers included
 */
public record GraphAnalysis(List<Loop> loops,
                            List<TriggerConflict> triggerConflicts,
                            Map<String, LongestPath> longestPaths,
                            Set<String> reachableFromTriggers) {

    public GraphAnalysis {
        loops = List.copyOf(loops);
        triggerConflicts = List.copyOf(triggerConflicts);
        longestPaths = Collections.unmodifiableMap(new LinkedHashMap<>(longestPaths));
        reachableFromTriggers = Set.copyOf(reachableFromTriggers);
    }

    public boolean hasLoops() {
        return !loops.isEmpty();
    }

    /**
     * True when at least one loop has no edge leaving it.
     */
    public boolean hasUnresolvedLoops() {
        return loops.stream().anyMatch(loop -> !loop.hasExitCondition());
    }

    public boolean hasTriggerConflicts() {
        return !triggerConflicts.isEmpty();
    }
}
