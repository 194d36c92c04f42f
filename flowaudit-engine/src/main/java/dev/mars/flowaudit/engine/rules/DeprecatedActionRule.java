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
import dev.mars.flowaudit.core.document.WorkflowStep;

import java.util.ArrayList;
import java.util.List;

/**
 * Steps the platform itself has marked {@code deprecated}.
 */
public class DeprecatedActionRule extends AbstractIssueRule {

    public DeprecatedActionRule() {
        super("deprecated-action", Severity.LOW, "Maintenance");
    }

    @Override
    public List<Issue> evaluate(RuleContext context) {
        List<Issue> issues = new ArrayList<>();
        for (WorkflowStep step : context.steps()) {
            if (step.isDeprecated()) {
                issues.add(issue("Deprecated Action Type", step)
                        .description("Action type \"" + step.getType() + "\" is deprecated")
                        .fixSuggestion("Update to the recommended replacement")
                        .build());
            }
        }
        return issues;
    }
}
