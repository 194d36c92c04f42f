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
import java.util.Set;

/**
 * External calls must say what happens when they fail.
 *
 * <p>Any of these counts as error handling: {@code config.onError}, {@code config.errorHandling},
 * {@code config.fallback}, a {@code fallbackActionId}, an {@code on_error} or {@code on_failure}
 * branch, or an outgoing connection labelled as an error path.</p>
 */
public class ErrorHandlingRule extends AbstractIssueRule {

    static final Set<String> ERROR_BRANCHES = Set.of("on_error", "on_failure");
    static final Set<String> ERROR_EDGE_LABELS = Set.of("on_error", "on_failure", "error");

    public ErrorHandlingRule() {
        super("error-handling", Severity.HIGH, "Error Handling");
    }

    @Override
    public List<Issue> evaluate(RuleContext context) {
        List<Issue> issues = new ArrayList<>();
        for (WorkflowStep step : context.steps()) {
            if (!ActionCapabilities.has(step.getType(), Capability.EXTERNAL_CALL)) {
                continue;
            }
            JsonNode config = step.getConfig();
            boolean handled = JsonFields.isTruthy(config, "onError")
                    || JsonFields.isTruthy(config, "errorHandling")
                    || JsonFields.isTruthy(config, "fallback")
                    || step.hasTruthy("fallbackActionId")
                    || hasBranch(step, ERROR_BRANCHES)
                    || hasLabeledEdge(context, step, ERROR_EDGE_LABELS);
            if (!handled) {
                issues.add(issue("External API Call Without Error Handling", step)
                        .description("Action \"" + step.getDisplayName()
                                + "\" calls external service but has no error handling. Failures will break the entire workflow.")
                        .fixSuggestion("Add error handling branch or fallback action to gracefully handle API failures")
                        .build());
            }
        }
        return issues;
    }
}
