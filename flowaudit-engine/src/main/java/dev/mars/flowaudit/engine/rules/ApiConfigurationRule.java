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
import dev.mars.flowaudit.engine.util.Urls;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Checks that API and integration actions can actually reach their service.
 *
 * <ul>
 *   <li>API actions need a {@code url} or {@code endpoint}, which must be a public absolute URL</li>
 *   <li>API actions flagged {@code requiresAuth} need an {@code apiKey}, {@code authToken} or an
 *       {@code Authorization} header</li>
 *   <li>integration actions need an {@code integrationId} or {@code connectionId}</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-12
 * @version 1.0
 */
public class ApiConfigurationRule extends AbstractIssueRule {

    public ApiConfigurationRule() {
        super("api-config", Severity.CRITICAL, "Configuration");
    }

    @Override
    public List<Issue> evaluate(RuleContext context) {
        List<Issue> issues = new ArrayList<>();
        for (WorkflowStep step : context.steps()) {
            Set<Capability> capabilities = ActionCapabilities.of(step.getType());
            JsonNode config = step.getConfig();

            if (capabilities.contains(Capability.API_ENDPOINT)) {
                checkEndpoint(issues, step, config);
                checkAuthentication(issues, step, config);
            }

            if (capabilities.contains(Capability.INTEGRATION)
                    && !JsonFields.isTruthy(config, "integrationId")
                    && !JsonFields.isTruthy(config, "connectionId")) {
                issues.add(issue("Integration Not Connected", step)
                        .category("Integration")
                        .description("Integration action \"" + step.getDisplayName() + "\" has no active connection")
                        .fixSuggestion("Connect the integration in the platform settings")
                        .build());
            }
        }
        return issues;
    }

    private void checkEndpoint(List<Issue> issues, WorkflowStep step, JsonNode config) {
        Optional<String> endpoint = JsonFields.firstText(config, "url", "endpoint");
        if (endpoint.isEmpty()) {
            if (!JsonFields.isTruthy(config, "url") && !JsonFields.isTruthy(config, "endpoint")) {
                issues.add(issue("API Action Missing Endpoint", step)
                        .description("API action \"" + step.getDisplayName() + "\" has no URL/endpoint configured")
                        .fixSuggestion("Configure the API endpoint URL")
                        .build());
            }
            return;
        }
        String url = endpoint.get();
        if (Urls.isTemplated(url)) {
            return;
        }
        if (Urls.isLoopback(url)) {
            issues.add(issue("API Endpoint Points to Localhost", step)
                    .description("API action \"" + step.getDisplayName() + "\" calls " + url
                            + ", which is not accessible from the platform")
                    .fixSuggestion("Use a publicly accessible endpoint")
                    .build());
        } else if (!Urls.isValid(url)) {
            issues.add(issue("Invalid API Endpoint", step)
                    .description("API action \"" + step.getDisplayName() + "\" has malformed endpoint: " + url)
                    .fixSuggestion("Provide a valid HTTP/HTTPS URL")
                    .build());
        }
    }

    private void checkAuthentication(List<Issue> issues, WorkflowStep step, JsonNode config) {
        boolean hasCredentials = JsonFields.isTruthy(config, "apiKey")
                || JsonFields.isTruthy(config, "authToken")
                || JsonFields.isTruthy(config, "headers", "Authorization");
        if (JsonFields.isTruthy(config, "requiresAuth") && !hasCredentials) {
            issues.add(issue("API Action Missing Authentication", step)
                    .category("Security")
                    .description("API action \"" + step.getDisplayName()
                            + "\" requires authentication but credentials are not configured")
                    .fixSuggestion("Add API key, auth token, or authorization headers")
                    .build());
        }
    }
}
