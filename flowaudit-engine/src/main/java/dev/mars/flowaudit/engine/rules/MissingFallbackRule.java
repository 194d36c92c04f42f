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

import dev.mars.flowaudit.core.ActionCapabilities;
import dev.mars.flowaudit.core.ActionCapabilities.Capability;
import dev.mars.flowaudit.core.Issue;
import dev.mars.flowaudit.core.Severity;
import dev.mars.flowaudit.core.document.JsonFields;
import dev.mars.flowaudit.core.document.WorkflowStep;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Business critical actions (payments, API calls, webhooks, integrations) need an alternative
 * path for when they fail.
 */
public class MissingFallbackRule extends AbstractIssueRule {

    private static final Set<String> FALLBACK_BRANCHES = Set.of("on_error", "else");
    private static final Set<String> FALLBACK_EDGE_LABELS = Set.of("on_error", "on_failure", "error", "else", "fallback");

    public MissingFallbackRule() {
        super("missing-fallback", Severity.MEDIUM, "Resilience");
    }

    @Override
    public List<Issue> evaluate(RuleContext context) {
        List<Issue> issues = new ArrayList<>();
        for (WorkflowStep step : context.steps()) {
            if (!ActionCapabilities.has(step.getType(), Capability.NEEDS_FALLBACK)) {
                continue;
            }
            boolean hasFallback = step.hasTruthy("fallbackActionId")
                    || JsonFields.isTruthy(step.getConfig(), "fallback")
                    || hasBranch(step, FALLBACK_BRANCHES)
                    || hasLabeledEdge(context, step, FALLBACK_EDGE_LABELS);
            if (!hasFallback) {
                issues.add(issue("Critical Action Without Fallback", step)
                        .description("Action \"" + step.getDisplayName() + "\" has no fallback plan if it fails")
                        .fixSuggestion("Add a fallback action or alternative path for failure scenarios")
                        .build());
            }
        }
        return issues;
    }
}
