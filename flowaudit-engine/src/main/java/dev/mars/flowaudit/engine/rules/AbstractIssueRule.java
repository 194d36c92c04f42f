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
import dev.mars.flowaudit.core.CanonicalEdge;
import dev.mars.flowaudit.core.Issue;
import dev.mars.flowaudit.core.Severity;
import dev.mars.flowaudit.core.document.JsonFields;
import dev.mars.flowaudit.core.document.WorkflowStep;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Base class carrying a rule's id, severity and default category, with helpers shared by the
 * concrete rules.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-12
 * @version 1.0
 */
public abstract class AbstractIssueRule implements IssueRule {

    private final String id;
    private final Severity severity;
    private final String category;

    protected AbstractIssueRule(String id, Severity severity, String category) {
        this.id = Objects.requireNonNull(id, "Rule id cannot be null");
        this.severity = Objects.requireNonNull(severity, "Severity cannot be null");
        this.category = Objects.requireNonNull(category, "Category cannot be null");
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public Severity severity() {
        return severity;
    }

    public String category() {
        return category;
    }

    /**
     * Starts an issue pre-filled with this rule's id, severity and default category.
     */
    protected Issue.Builder issue(String title) {
        return Issue.builder()
                .ruleId(id)
                .severity(severity)
                .category(category)
                .title(title);
    }

    /**
     * Starts an issue against a single step.
     */
    protected Issue.Builder issue(String title, WorkflowStep step) {
        return issue(title).nodeRef(step.getId());
    }

    /**
     * True when one of the step's {@code branches[]} has a {@code condition} in {@code conditions}.
     */
    protected static boolean hasBranch(WorkflowStep step, Set<String> conditions) {
        for (JsonNode branch : step.getBranches()) {
            String condition = JsonFields.text(branch, "condition").orElse(null);
            if (condition != null && conditions.contains(condition)) {
                return true;
            }
        }
        return false;
    }

    /**
     * True when the graph has an edge out of the step whose label is in {@code labels},
     * compared case-insensitively.
     */
    protected static boolean hasLabeledEdge(RuleContext context, WorkflowStep step, Set<String> labels) {
        for (CanonicalEdge edge : context.getGraph().outgoingEdges(step.getId())) {
            if (edge.hasLabel() && labels.contains(edge.label().trim().toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{id='" + id + "', severity=" + severity + '}';
    }
}
