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

public class BulkThrottlingRule extends AbstractIssueRule {

    public BulkThrottlingRule() {
        super("bulk-throttling", Severity.HIGH, "Performance");
    }

    @Override
    public List<Issue> evaluate(RuleContext context) {
        List<Issue> issues = new ArrayList<>();
        for (WorkflowStep step : context.steps()) {
            if (ActionCapabilities.has(step.getType(), Capability.BULK)
                    && !JsonFields.isTruthy(step.getConfig(), "throttling")) {
                issues.add(issue("Bulk Operation Without Throttling", step)
                        .description("Bulk action \"" + step.getDisplayName() + "\" could hit provider rate limits and fail")
                        .fixSuggestion("Add throttling or batch processing")
                        .build());
            }
        }
        return issues;
    }
}
