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

import dev.mars.flowaudit.core.CanonicalNode;
import dev.mars.flowaudit.core.Issue;
import dev.mars.flowaudit.core.Severity;
import dev.mars.flowaudit.engine.graph.LongestPath;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reports a trigger whose longest reachable chain is longer than the threshold without passing
 * through a single condition node.
 */
public class LongChainRule extends AbstractIssueRule {

    private final int threshold;

    public LongChainRule(int threshold) {
        super("long-chain", Severity.MEDIUM, "Complexity");
        this.threshold = threshold;
    }

    @Override
    public List<Issue> evaluate(RuleContext context) {
        List<Issue> issues = new ArrayList<>();
        for (Map.Entry<String, LongestPath> entry : context.getGraphAnalysis().longestPaths().entrySet()) {
            LongestPath path = entry.getValue();
            if (path.length() <= threshold) {
                continue;
            }
            boolean hasCheckpoint = path.nodes().stream()
                    .map(id -> context.getGraph().findNode(id))
                    .anyMatch(node -> node.filter(CanonicalNode::isCondition).isPresent());
            if (!hasCheckpoint) {
                // an unbounded path stops where it enters a loop, so its length is a lower bound
                String steps = path.unbounded()
                        ? "at least " + path.length() + " sequential steps, then enters a loop,"
                        : path.length() + " sequential steps";
                issues.add(issue("Long Chain Without Checkpoints")
                        .description("Flow has " + steps + " from \""
                                + context.labelOf(entry.getKey())
                                + "\" with no condition checkpoints. Difficult to debug and maintain.")
                        .nodeRefs(path.nodes())
                        .fixSuggestion("Add condition nodes to validate data at key points, or break into smaller sub-workflows")
                        .build());
            }
        }
        return issues;
    }
}
