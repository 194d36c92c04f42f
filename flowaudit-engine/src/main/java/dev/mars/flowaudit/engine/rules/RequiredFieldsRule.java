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
 * Sends that cannot work because they have nobody to send to.
 */
public class RequiredFieldsRule extends AbstractIssueRule {

    public RequiredFieldsRule() {
        super("required-fields", Severity.CRITICAL, "Configuration");
    }

    @Override
    public List<Issue> evaluate(RuleContext context) {
        List<Issue> issues = new ArrayList<>();
        for (WorkflowStep step : context.steps()) {
            JsonNode config = step.getConfig();
            if (ActionCapabilities.has(step.getType(), Capability.EMAIL)
                    && !anyTruthy(config, "recipient", "to")) {
                issues.add(issue("Email Action Missing Recipient", step)
                        .description("Email action \"" + step.getDisplayName() + "\" will fail without a recipient")
                        .fixSuggestion("Add a recipient email address or merge field")
                        .build());
            }
            if (ActionCapabilities.has(step.getType(), Capability.SMS)
                    && !anyTruthy(config, "phoneNumber", "recipient", "phoneField", "to")) {
                issues.add(issue("SMS Action Missing Phone Number", step)
                        .description("SMS action \"" + step.getDisplayName() + "\" cannot be sent without a phone number")
                        .fixSuggestion("Add a phone number or select a contact field")
                        .build());
            }
        }
        return issues;
    }

    private static boolean anyTruthy(JsonNode config, String... fields) {
        for (String field : fields) {
            if (JsonFields.isTruthy(config, field)) {
                return true;
            }
        }
        return false;
    }
}
