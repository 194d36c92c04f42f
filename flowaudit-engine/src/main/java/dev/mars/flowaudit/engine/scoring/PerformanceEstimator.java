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

package dev.mars.flowaudit.engine.scoring;

import dev.mars.flowaudit.core.ActionCapabilities;
import dev.mars.flowaudit.core.ActionCapabilities.Capability;
import dev.mars.flowaudit.core.CanonicalGraph;
import dev.mars.flowaudit.core.CanonicalNode;
import dev.mars.flowaudit.core.Complexity;
import dev.mars.flowaudit.core.NodeKind;
import dev.mars.flowaudit.core.PerformanceEstimate;
import dev.mars.flowaudit.core.config.FlowAuditConfiguration;
import dev.mars.flowaudit.engine.util.Durations;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Rough execution profile of a canonical graph, independent of the rule catalog.
 *
 * <p>Every node contributes a fixed time by what it does: a delay its parsed wait, an API or
 * webhook call two seconds, a bulk send five seconds and anything else a tenth of a second.
 * External calls, bulk sends and long waits are listed as bottlenecks in node order.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-12
 * @version 1.0
 */
public class PerformanceEstimator {

    private static final double API_CALL_SECONDS = 2.0;
    private static final double BULK_SECONDS = 5.0;
    private static final double DEFAULT_SECONDS = 0.1;

    private final int bottleneckLimit;
    private final long bottleneckDelaySeconds;

    public PerformanceEstimator(FlowAuditConfiguration configuration) {
        Objects.requireNonNull(configuration, "Configuration cannot be null");
        this.bottleneckLimit = configuration.getBottleneckLimit();
        this.bottleneckDelaySeconds = configuration.getBottleneckDelaySeconds();
    }

    public PerformanceEstimate estimate(CanonicalGraph graph) {
        Objects.requireNonNull(graph, "Graph cannot be null");
        double totalSeconds = 0;
        List<String> bottlenecks = new ArrayList<>();

        for (CanonicalNode node : graph.getNodes()) {
            Set<Capability> capabilities = ActionCapabilities.of(node.rawType());
            if (node.kind() == NodeKind.DELAY) {
                double wait = Durations.delaySeconds(node.config());
                totalSeconds += wait;
                if (wait > bottleneckDelaySeconds) {
                    bottlenecks.add(node.label() + " (" + Durations.format(wait) + " wait)");
                }
            } else if (capabilities.contains(Capability.API_ENDPOINT) || capabilities.contains(Capability.WEBHOOK_CALL)) {
                totalSeconds += API_CALL_SECONDS;
                bottlenecks.add(node.label() + " (API call)");
            } else if (capabilities.contains(Capability.BULK)) {
                totalSeconds += BULK_SECONDS;
                bottlenecks.add(node.label() + " (bulk operation)");
            } else {
                totalSeconds += DEFAULT_SECONDS;
            }
        }

        return new PerformanceEstimate(
                graph.nodeCount(),
                Durations.format(totalSeconds),
                complexity(graph.nodeCount(), graph.edgeCount()),
                bottlenecks.subList(0, Math.min(Math.max(0, bottleneckLimit), bottlenecks.size())));
    }

    static Complexity complexity(int nodes, int edges) {
        int branches = Math.max(0, edges - nodes + 2);
        if (nodes < 10 && branches < 3) {
            return Complexity.LOW;
        }
        if (nodes < 25 && branches < 8) {
            return Complexity.MEDIUM;
        }
        if (nodes < 50 && branches < 15) {
            return Complexity.HIGH;
        }
        return Complexity.VERY_HIGH;
    }
}
