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
 * Rough execution profile of a workflow.
 *
 * @param estimatedSteps number of nodes a run may touch
 * @param estimatedTime formatted total time, e.g. {@code 2.5h}
 * @param complexity complexity bucket
 * @param bottlenecks labels of the slowest steps, at most five by default
 */
public record PerformanceEstimate(int estimatedSteps, String estimatedTime, Complexity complexity,
                                  List<String> bottlenecks) {

    public PerformanceEstimate {
        Objects.requireNonNull(estimatedTime, "Estimated time cannot be null");
        Objects.requireNonNull(complexity, "Complexity cannot be null");
        bottlenecks = bottlenecks != null ? List.copyOf(bottlenecks) : List.of();
    }
}
