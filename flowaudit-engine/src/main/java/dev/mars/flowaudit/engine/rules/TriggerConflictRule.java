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
import dev.mars.flowaudit.core.TriggerConflict;

import java.util.List;

public class TriggerConflictRule extends AbstractIssueRule {

    public TriggerConflictRule() {
        super("trigger-conflict", Severity.HIGH, "Triggers");
    }

    @Override
    public List<Issue> evaluate(RuleContext context) {
        return context.getGraphAnalysis().triggerConflicts().stream()
                .map(this::toIssue)
                .toList();
    }

    private Issue toIssue(TriggerConflict conflict) {
        return issue("Trigger Conflict Detected")
                .description(conflict.description())
                .nodeRefs(conflict.triggerIds())
                .fixSuggestion("Add conditions to prevent simultaneous trigger execution, or merge triggers into a single entry point with branching logic")
                .build();
    }
}
