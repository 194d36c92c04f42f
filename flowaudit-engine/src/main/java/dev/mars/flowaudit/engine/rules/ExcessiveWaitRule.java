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
import dev.mars.flowaudit.core.NodeKind;
import dev.mars.flowaudit.core.Severity;
import dev.mars.flowaudit.core.document.WorkflowStep;
import dev.mars.flowaudit.engine.util.Durations;

import java.util.ArrayList;
import java.util.List;

/**
 * Delay steps longer than the configured maximum, one week by default.
 */
public class ExcessiveWaitRule extends AbstractIssueRule {

    private final long maxWaitSeconds;

    public ExcessiveWaitRule(long maxWaitSeconds) {
        super("excessive-wait", Severity.MEDIUM, "Performance");
        this.maxWaitSeconds = maxWaitSeconds;
    }

    @Override
    public List<Issue> evaluate(RuleContext context) {
        List<Issue> issues = new ArrayList<>();
        for (WorkflowStep step : context.steps()) {
            if (step.getKind() != NodeKind.DELAY) {
                continue;
            }
            double seconds = Durations.delaySeconds(step.getConfig());
            if (seconds > maxWaitSeconds) {
                issues.add(issue("Excessive Wait Time", step)
                        .description("Wait time of " + Durations.format(seconds) + " in \"" + step.getDisplayName()
                                + "\" may cause the workflow to expire")
                        .fixSuggestion("Consider splitting into multiple workflows or reducing wait time")
                        .build());
            }
        }
        return issues;
    }
}
