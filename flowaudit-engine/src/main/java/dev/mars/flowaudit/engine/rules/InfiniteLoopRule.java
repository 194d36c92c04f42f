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

import dev.mars.flowaudit.core.Issue;
import dev.mars.flowaudit.core.Loop;
import dev.mars.flowaudit.core.Severity;

import java.util.ArrayList;
import java.util.List;

/**
 * Reports every detected loop that has no edge leaving it. Loops with an exit are considered
 * intentional and are not reported.
 */
public class InfiniteLoopRule extends AbstractIssueRule {

    public InfiniteLoopRule() {
        super("infinite-loop", Severity.CRITICAL, "Graph Structure");
    }

    @Override
    public List<Issue> evaluate(RuleContext context) {
        List<Issue> issues = new ArrayList<>();
        for (Loop loop : context.getGraphAnalysis().loops()) {
            if (!loop.hasExitCondition()) {
                issues.add(issue("Infinite Loop Detected")
                        .description("Circular path found with no exit condition: " + loop.describePath()
                                + ". This will cause the workflow to run indefinitely.")
                        .nodeRefs(loop.nodes())
                        .fixSuggestion("Add a condition node with an exit path, or implement a counter/limit to break the loop")
                        .build());
            }
        }
        return issues;
    }
}
