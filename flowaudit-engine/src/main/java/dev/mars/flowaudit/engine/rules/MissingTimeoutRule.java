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

import com.fasterxml.jackson.databind.JsonNode;
import dev.mars.flowaudit.core.ActionCapabilities;
import dev.mars.flowaudit.core.ActionCapabilities.Capability;
import dev.mars.flowaudit.core.Issue;
import dev.mars.flowaudit.core.Severity;
import dev.mars.flowaudit.core.document.JsonFields;
import dev.mars.flowaudit.core.document.WorkflowStep;

import java.util.ArrayList;
import java.util.List;

/**
 * External calls without {@code timeout}, {@code timeoutSeconds} or {@code timeoutMs}. Any
 * defined value counts, even zero.
 */
public class MissingTimeoutRule extends AbstractIssueRule {

    public MissingTimeoutRule() {
        super("missing-timeout", Severity.MEDIUM, "Resilience");
    }

    @Override
    public List<Issue> evaluate(RuleContext context) {
        List<Issue> issues = new ArrayList<>();
        for (WorkflowStep step : context.steps()) {
            if (!ActionCapabilities.has(step.getType(), Capability.NEEDS_TIMEOUT)) {
                continue;
            }
            JsonNode config = step.getConfig();
            boolean hasTimeout = JsonFields.isDefined(config, "timeout")
                    || JsonFields.isDefined(config, "timeoutSeconds")
                    || JsonFields.isDefined(config, "timeoutMs");
            if (!hasTimeout) {
                issues.add(issue("External Call Without Timeout", step)
                        .description("Action \"" + step.getDisplayName()
                                + "\" could hang indefinitely if external service is slow or unresponsive")
                        .fixSuggestion("Set a reasonable timeout (e.g., 30 seconds for webhooks, 10 seconds for APIs)")
                        .build());
            }
        }
        return issues;
    }
}
