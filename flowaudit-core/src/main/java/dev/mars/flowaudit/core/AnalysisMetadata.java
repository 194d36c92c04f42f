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

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Facts about the analysis itself rather than about individual issues.
 *
 * @param isActive whether the workflow is live (status active or published)
 * @param analyzedNodes nodes whose type the analyzer recognized
 * @param totalNodes all nodes in the canonical graph
 * @param hasLoops whether cycle detection found at least one loop without an exit
 * @param hasTriggerConflicts whether at least one trigger pair conflicts
 * @param failedRules ids of rules that failed and were skipped
 */
public record AnalysisMetadata(@JsonProperty("isActive") boolean isActive,
                               @JsonProperty("analyzedNodes") int analyzedNodes,
                               @JsonProperty("totalNodes") int totalNodes,
                               @JsonProperty("hasLoops") boolean hasLoops,
                               @JsonProperty("hasTriggerConflicts") boolean hasTriggerConflicts,
                               @JsonProperty("failedRules") List<String> failedRules) {

    public AnalysisMetadata {
        failedRules = failedRules != null ? List.copyOf(failedRules) : List.of();
    }
}
