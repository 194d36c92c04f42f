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

import dev.mars.flowaudit.core.CanonicalEdge;
import dev.mars.flowaudit.core.CanonicalGraph;
import dev.mars.flowaudit.core.Issue;
import dev.mars.flowaudit.core.Severity;

import java.util.ArrayList;
import java.util.List;

/**
 * Connections that name a node the workflow does not define.
 */
public class DanglingConnectionRule extends AbstractIssueRule {

    public DanglingConnectionRule() {
        super("dangling-connection", Severity.MEDIUM, "Graph Structure");
    }

    @Override
    public List<Issue> evaluate(RuleContext context) {
        CanonicalGraph graph = context.getGraph();
        List<Issue> issues = new ArrayList<>();
        for (CanonicalEdge edge : graph.getEdges()) {
            List<String> missing = new ArrayList<>(2);
            if (!graph.containsNode(edge.source())) {
                missing.add(edge.source());
            }
            if (!graph.containsNode(edge.target()) && !edge.target().equals(edge.source())) {
                missing.add(edge.target());
            }
            if (missing.isEmpty()) {
                continue;
            }
            issues.add(issue("Dangling Connection")
                    .description("Connection from \"" + edge.source() + "\" to \"" + edge.target()
                            + "\" references missing node(s): " + String.join(", ", missing))
                    .nodeRefs(edge.source().equals(edge.target())
                            ? List.of(edge.source())
                            : List.of(edge.source(), edge.target()))
                    .fixSuggestion("Remove the connection or restore the missing node")
                    .build());
        }
        return issues;
    }
}
