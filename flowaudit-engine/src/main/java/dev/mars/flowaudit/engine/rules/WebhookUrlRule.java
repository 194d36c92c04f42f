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
import dev.mars.flowaudit.core.document.WebhookEntry;
import dev.mars.flowaudit.core.document.WorkflowStep;
import dev.mars.flowaudit.engine.util.Urls;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Checks the destination of every webhook, both the entries of the document's {@code webhooks[]}
 * array and webhook actions. A URL must be present, must not point at the local machine and must
 * parse as an absolute URL with a host. Templated URLs are only checked for presence.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-12
 * @version 1.0
 */
public class WebhookUrlRule extends AbstractIssueRule {

    public WebhookUrlRule() {
        super("webhook-url", Severity.CRITICAL, "Configuration");
    }

    @Override
    public List<Issue> evaluate(RuleContext context) {
        List<Issue> issues = new ArrayList<>();
        for (WebhookEntry webhook : context.webhooks()) {
            check(issues, webhook.id(), webhook.displayName(), webhook.urlValue());
        }
        for (WorkflowStep step : context.steps()) {
            if (ActionCapabilities.has(step.getType(), Capability.WEBHOOK_CALL)) {
                Optional<String> url = JsonFields.firstText(step.getConfig(), "url");
                check(issues, step.getId(), step.getDisplayName(), url);
            }
        }
        return issues;
    }

    private void check(List<Issue> issues, String id, String name, Optional<String> url) {
        if (url.isEmpty()) {
            issues.add(issue("Webhook Missing URL")
                    .description("Webhook \"" + name + "\" has no destination URL configured")
                    .nodeRef(id)
                    .fixSuggestion("Configure a valid webhook URL")
                    .build());
            return;
        }
        String value = url.get();
        if (Urls.isTemplated(value)) {
            return;
        }
        if (Urls.isLoopback(value)) {
            issues.add(issue("Webhook Points to Localhost")
                    .description("Webhook \"" + name + "\" points to " + value
                            + ", which is not accessible from external services")
                    .nodeRef(id)
                    .fixSuggestion("Replace the localhost URL with a publicly accessible endpoint")
                    .build());
        }
        if (!Urls.isValid(value)) {
            issues.add(issue("Invalid Webhook URL")
                    .description("Webhook \"" + name + "\" has malformed URL: " + value)
                    .nodeRef(id)
                    .fixSuggestion("Provide a valid HTTP/HTTPS URL")
                    .build());
        }
    }
}
