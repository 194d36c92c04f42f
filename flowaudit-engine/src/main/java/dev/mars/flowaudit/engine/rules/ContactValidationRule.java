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
 * Sends addressed through a contact merge field must first check the field is filled in, either
 * with {@code validateEmail}/{@code validatePhone} or an {@code is_not_empty} condition on it.
 */
public class ContactValidationRule extends AbstractIssueRule {

    private static final String CONTACT_FIELD = "{{contact.";
    private static final String NOT_EMPTY = "is_not_empty";

    public ContactValidationRule() {
        super("contact-validation", Severity.MEDIUM, "Data Quality");
    }

    @Override
    public List<Issue> evaluate(RuleContext context) {
        List<Issue> issues = new ArrayList<>();
        for (WorkflowStep step : context.steps()) {
            JsonNode config = step.getConfig();

            if (ActionCapabilities.has(step.getType(), Capability.EMAIL)) {
                boolean usesContactField = containsContactField(config, "recipient");
                boolean validated = JsonFields.isTruthy(config, "validateEmail") || hasNotEmptyCondition(step, "email");
                if (usesContactField && !validated) {
                    issues.add(issue("Email Sent Without Contact Validation", step)
                            .description("Email action \"" + step.getDisplayName()
                                    + "\" could send to invalid or empty email addresses")
                            .fixSuggestion("Add condition to check email field is not empty and valid")
                            .build());
                }
            }

            if (ActionCapabilities.has(step.getType(), Capability.SMS)) {
                boolean usesContactField = containsContactField(config, "phoneNumber")
                        || containsContactField(config, "recipient")
                        || JsonFields.isTruthy(config, "phoneField");
                boolean validated = JsonFields.isTruthy(config, "validatePhone") || hasNotEmptyCondition(step, "phone");
                if (usesContactField && !validated) {
                    issues.add(issue("SMS Sent Without Phone Validation", step)
                            .description("SMS action \"" + step.getDisplayName()
                                    + "\" could send to invalid or empty phone numbers")
                            .fixSuggestion("Add condition to check phone field is not empty and valid")
                            .build());
                }
            }
        }
        return issues;
    }

    private static boolean containsContactField(JsonNode config, String field) {
        return JsonFields.text(config, field).filter(v -> v.contains(CONTACT_FIELD)).isPresent();
    }

    private static boolean hasNotEmptyCondition(WorkflowStep step, String fieldFragment) {
        for (JsonNode condition : step.getConditions()) {
            boolean matchesField = JsonFields.text(condition, "field").filter(f -> f.contains(fieldFragment)).isPresent();
            boolean notEmpty = JsonFields.text(condition, "operator").filter(NOT_EMPTY::equals).isPresent();
            if (matchesField && notEmpty) {
                return true;
            }
        }
        return false;
    }
}
