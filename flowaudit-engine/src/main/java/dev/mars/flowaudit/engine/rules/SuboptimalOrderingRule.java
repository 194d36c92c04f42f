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
import dev.mars.flowaudit.core.document.WorkflowStep;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * An email or SMS sent before any step that enriches contact data, while such a step follows
 * later. The send probably goes out with incomplete merge fields.
 */
public class SuboptimalOrderingRule extends AbstractIssueRule {

    public SuboptimalOrderingRule() {
        super("suboptimal-ordering", Severity.LOW, "Optimization");
    }

    @Override
    public List<Issue> evaluate(RuleContext context) {
        List<WorkflowStep> steps = context.steps();
        List<Issue> issues = new ArrayList<>();
        for (int i = 0; i < steps.size(); i++) {
            WorkflowStep step = steps.get(i);
            Set<Capability> capabilities = ActionCapabilities.of(step.getType());
            if (!capabilities.contains(Capability.EMAIL) && !capabilities.contains(Capability.SMS)) {
                continue;
            }
            boolean enrichedBefore = anyHas(steps.subList(0, i), Capability.ENRICHES_DATA);
            boolean enrichedAfter = anyHas(steps.subList(i + 1, steps.size()), Capability.ENRICHES_DATA_LATE);
            if (!enrichedBefore && enrichedAfter) {
                issues.add(issue("Suboptimal Action Ordering", step)
                        .description("Action \"" + step.getDisplayName() + "\" sends " + step.getType()
                                + " before contact data is enriched")
                        .fixSuggestion("Move data enrichment actions before sending communications")
                        .build());
            }
        }
        return issues;
    }

    private static boolean anyHas(List<WorkflowStep> steps, Capability capability) {
        return steps.stream().anyMatch(s -> ActionCapabilities.has(s.getType(), capability));
    }
}
