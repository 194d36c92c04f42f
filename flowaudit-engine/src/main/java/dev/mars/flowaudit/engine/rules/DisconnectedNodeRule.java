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

public class DisconnectedNodeRule extends AbstractIssueRule {

    public DisconnectedNodeRule() {
        super("disconnected-node", Severity.LOW, "Code Quality");
    }

    @Override
    public List<Issue> evaluate(RuleContext context) {
        CanonicalGraph graph = context.getGraph();
        List<Issue> issues = new ArrayList<>();
        for (CanonicalNode node : graph.getNodes()) {
            if (!node.isTrigger()
                    && graph.incomingEdges(node.id()).isEmpty()
                    && graph.outgoingEdges(node.id()).isEmpty()) {
                issues.add(issue("Disconnected Node")
                        .description("Node \"" + node.label() + "\" is not connected to the workflow")
                        .nodeRef(node.id())
                        .fixSuggestion("Connect this node to the workflow or remove it")
                        .build());
            }
        }
        return issues;
    }
}
