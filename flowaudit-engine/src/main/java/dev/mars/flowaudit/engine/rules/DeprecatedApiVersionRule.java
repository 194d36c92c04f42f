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
import dev.mars.flowaudit.core.document.JsonFields;
import dev.mars.flowaudit.core.document.WorkflowStep;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Flags API versions the platform has retired, either in a URL path segment or in an explicit
 * {@code apiVersion} field.
 */
public class DeprecatedApiVersionRule extends AbstractIssueRule {

    static final List<String> DEPRECATED_VERSIONS = List.of("v1", "v2", "beta", "alpha");

    public DeprecatedApiVersionRule() {
        super("deprecated-api", Severity.MEDIUM, "Maintenance");
    }

    @Override
    public List<Issue> evaluate(RuleContext context) {
        List<Issue> issues = new ArrayList<>();
        for (WorkflowStep step : context.steps()) {
            Optional<String> url = JsonFields.firstText(step.getConfig(), "url", "endpoint");
            if (url.isPresent() && hasDeprecatedSegment(url.get())) {
                issues.add(issue("Using Deprecated API Version", step)
                        .description("Action \"" + step.getDisplayName() + "\" uses deprecated API version in URL: " + url.get())
                        .fixSuggestion("Update to the latest stable API version")
                        .build());
            }

            Optional<String> apiVersion = JsonFields.text(step.getConfig(), "apiVersion");
            if (apiVersion.isPresent() && DEPRECATED_VERSIONS.contains(apiVersion.get())) {
                issues.add(issue("Deprecated API Version Configured", step)
                        .description("Action \"" + step.getDisplayName() + "\" explicitly uses deprecated version: " + apiVersion.get())
                        .fixSuggestion("Update apiVersion to latest stable release")
                        .build());
            }
        }
        return issues;
    }

    static boolean hasDeprecatedSegment(String url) {
        for (String version : DEPRECATED_VERSIONS) {
            if (url.contains("/" + version + "/") || url.endsWith("/" + version)) {
                return true;
            }
        }
        return false;
    }
}
