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

import java.util.ArrayList;
import java.util.List;

/**
 * Condition nodes with fewer than two outgoing connections decide nothing.
 */
public class ConditionBranchesRule extends AbstractIssueRule {

    public ConditionBranchesRule() {
        super("condition-branches", Severity.LOW, "Code Quality");
    }

    @Override
    public List<Issue> evaluate(RuleContext context) {
        List<Issue> issues = new ArrayList<>();
        for (CanonicalNode node : context.getGraph().getNodes()) {
            if (node.isCondition() && context.getGraph().outgoingEdges(node.id()).size() < 2) {
                issues.add(issue("Condition With Single Branch")
                        .description("Condition \"" + node.label() + "\" only has one branch. The condition is unnecessary.")
                        .nodeRef(node.id())
                        .fixSuggestion("Either add an else branch or remove the condition")
                        .build());
            }
        }
        return issues;
    }
}
