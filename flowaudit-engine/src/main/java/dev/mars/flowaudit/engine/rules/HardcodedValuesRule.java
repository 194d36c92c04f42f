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
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Literal recipients and credentials where a {@code {{...}}} placeholder belongs.
 */
public class HardcodedValuesRule extends AbstractIssueRule {

    private static final Pattern PHONE_NUMBER = Pattern.compile("^\\+?\\d{10,}$");
    private static final int MIN_KEY_LENGTH = 10;

    public HardcodedValuesRule() {
        super("hardcoded-values", Severity.HIGH, "Best Practices");
    }

    @Override
    public List<Issue> evaluate(RuleContext context) {
        List<Issue> issues = new ArrayList<>();
        for (WorkflowStep step : context.steps()) {
            JsonNode config = step.getConfig();

            if (ActionCapabilities.has(step.getType(), Capability.EMAIL)) {
                Optional<String> recipient = JsonFields.firstText(config, "to", "recipient");
                if (recipient.isPresent() && !isTemplated(recipient.get()) && recipient.get().contains("@")) {
                    issues.add(issue("Hardcoded Email Recipient", step)
                            .description("Email action \"" + step.getDisplayName() + "\" sends to hardcoded address \""
                                    + recipient.get() + "\". Should use contact field.")
                            .fixSuggestion("Replace hardcoded email with {{contact.email}} or custom field")
                            .build());
                }
            }

            if (ActionCapabilities.has(step.getType(), Capability.SMS)) {
                Optional<String> phone = JsonFields.firstText(config, "to", "phoneNumber");
                if (phone.isPresent() && !isTemplated(phone.get()) && PHONE_NUMBER.matcher(phone.get()).matches()) {
                    issues.add(issue("Hardcoded Phone Number", step)
                            .description("SMS action \"" + step.getDisplayName() + "\" sends to hardcoded number \""
                                    + phone.get() + "\". Should use contact field.")
                            .fixSuggestion("Replace hardcoded number with {{contact.phone}} or custom field")
                            .build());
                }
            }

            Optional<String> apiKey = JsonFields.text(config, "apiKey");
            if (apiKey.isPresent() && !isTemplated(apiKey.get()) && apiKey.get().length() > MIN_KEY_LENGTH) {
                issues.add(issue("Hardcoded API Key", step)
                        .category("Security")
                        .description("Action \"" + step.getDisplayName() + "\" contains hardcoded API key. Security risk.")
                        .fixSuggestion("Move API key to environment variable or platform secrets")
                        .build());
            }
        }
        return issues;
    }

    private static boolean isTemplated(String value) {
        return value.contains("{{");
    }
}
