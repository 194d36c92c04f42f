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

package dev.mars.flowaudit.engine.rules;

import dev.mars.flowaudit.core.CanonicalGraph;
import dev.mars.flowaudit.core.CanonicalNode;
import dev.mars.flowaudit.core.Issue;
import dev.mars.flowaudit.core.Severity;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Connected nodes that no trigger can reach. Without triggers reachability is undefined and
 * nothing is reported; nodes with no connections at all are left to {@link DisconnectedNodeRule}.
 */
public class UnreachableNodeRule extends AbstractIssueRule {

    public UnreachableNodeRule() {
        super("unreachable-node", Severity.MEDIUM, "Graph Structure");
    }

    @Override
    public List<Issue> evaluate(RuleContext context) {
        CanonicalGraph graph = context.getGraph();
        if (graph.triggers().isEmpty()) {
            return List.of();
        }
        Set<String> reachable = context.getGraphAnalysis().reachableFromTriggers();
        List<Issue> issues = new ArrayList<>();
        for (CanonicalNode node : graph.getNodes()) {
            boolean connected = !graph.incomingEdges(node.id()).isEmpty() || !graph.outgoingEdges(node.id()).isEmpty();
            if (!node.isTrigger() && connected && !reachable.contains(node.id())) {
                issues.add(issue("Unreachable Node")
                        .description("Node \"" + node.label() + "\" cannot be reached from any trigger and will never execute")
                        .nodeRef(node.id())
                        .fixSuggestion("Connect this node to the workflow or remove it")
                        .build());
            }
        }
        return issues;
    }
}
