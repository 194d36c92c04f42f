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
 * Payment actions must configure retries ({@code retry}, {@code retryLogic} or {@code maxRetries}).
 */
public class PaymentRetryRule extends AbstractIssueRule {

    public PaymentRetryRule() {
        super("payment-retry", Severity.CRITICAL, "Payment");
    }

    @Override
    public List<Issue> evaluate(RuleContext context) {
        List<Issue> issues = new ArrayList<>();
        for (WorkflowStep step : context.steps()) {
            if (!ActionCapabilities.has(step.getType(), Capability.PAYMENT)) {
                continue;
            }
            JsonNode config = step.getConfig();
            boolean hasRetry = JsonFields.isTruthy(config, "retry")
                    || JsonFields.isTruthy(config, "retryLogic")
                    || JsonFields.isTruthy(config, "maxRetries");
            if (!hasRetry) {
                issues.add(issue("Payment Action Without Retry Logic", step)
                        .description("Payment action \"" + step.getDisplayName()
                                + "\" lacks retry logic. Failed payments will result in lost revenue.")
                        .fixSuggestion("Add retry configuration (e.g., 3 retries with exponential backoff) to handle temporary payment failures")
                        .build());
            }
        }
        return issues;
    }
}
