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
import dev.mars.flowaudit.core.Severity;

import java.util.List;

/**
 * Reports a graph whose branch estimate ({@code edges - nodes + 2}) exceeds the maximum.
 */
public class HighComplexityRule extends AbstractIssueRule {

    private final int maxBranches;

    public HighComplexityRule(int maxBranches) {
        super("high-complexity", Severity.MEDIUM, "Complexity");
        this.maxBranches = maxBranches;
    }

    @Override
    public List<Issue> evaluate(RuleContext context) {
        int branches = context.getGraph().branchEstimate();
        if (branches <= maxBranches) {
            return List.of();
        }
        return List.of(issue("High Complexity")
                .description("Workflow has " + branches + " branches, making it difficult to maintain and debug")
                .fixSuggestion("Consider breaking into smaller sub-workflows")
                .build());
    }
}
