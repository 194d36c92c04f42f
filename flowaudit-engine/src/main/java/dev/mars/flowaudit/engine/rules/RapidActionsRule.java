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
import dev.mars.flowaudit.core.CanonicalEdge;
import dev.mars.flowaudit.core.CanonicalNode;
import dev.mars.flowaudit.core.Issue;
import dev.mars.flowaudit.core.Severity;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Two rate limited actions connected directly, with no delay node between them. Reported once
 * per connected pair, against the first action.
 */
public class RapidActionsRule extends AbstractIssueRule {

    public RapidActionsRule() {
        super("rapid-actions", Severity.HIGH, "Performance");
    }

    @Override
    public List<Issue> evaluate(RuleContext context) {
        List<Issue> issues = new ArrayList<>();
        Set<String> seenPairs = new HashSet<>();
        for (CanonicalEdge edge : context.getGraph().getEdges()) {
            Optional<CanonicalNode> source = context.getGraph().findNode(edge.source());
            Optional<CanonicalNode> target = context.getGraph().findNode(edge.target());
            if (source.isEmpty() || target.isEmpty()) {
                continue;
            }
            if (isRateLimited(source.get()) && isRateLimited(target.get())
                    && seenPairs.add(edge.source() + "\u0000" + edge.target())) {
                issues.add(issue("Rapid Actions Without Delay")
                        .description("Actions \"" + source.get().label() + "\" and \"" + target.get().label()
                                + "\" execute back-to-back without delay. Risk of hitting rate limits.")
                        .nodeRef(edge.source())
                        .fixSuggestion("Add a 1-2 second delay between actions to prevent rate limiting")
                        .build());
            }
        }
        return issues;
    }

    private static boolean isRateLimited(CanonicalNode node) {
        return !node.isTrigger() && ActionCapabilities.has(node.rawType(), Capability.RATE_LIMITED);
    }
}
