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

package dev.mars.flowaudit.core;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Objects;

/**
 * A single finding produced by one rule.
 *
 * <p>Issues are never merged: two rules that notice the same defect each report it, and each
 * report carries its own penalty. Instances are immutable and built through {@link #builder()}.</p>
 *
 * <pre>{@code
 * Issue issue = Issue.builder()
 *     .ruleId("payment-retry")
 *     .severity(Severity.CRITICAL)
 *     .category("Payment")
 *     .title("Payment Action Without Retry Logic")
 *     .description("Payment action \"Charge\" lacks retry logic.")
 *     .nodeRefs(List.of("charge_1"))
 *     .fixSuggestion("Add retry configuration")
 *     .build();
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-12
 * @version 1.0
 */
public final class Issue {

    private final String ruleId;
    private final Severity severity;
    private final String category;
    private final String title;
    private final String description;
    private final List<String> nodeRefs;
    private final String fixSuggestion;

    private Issue(Builder builder) {
        this.ruleId = Objects.requireNonNull(builder.ruleId, "Rule id is required");
        this.severity = Objects.requireNonNull(builder.severity, "Severity is required");
        this.category = Objects.requireNonNull(builder.category, "Category is required");
        this.title = Objects.requireNonNull(builder.title, "Title is required");
        this.description = builder.description != null ? builder.description : "";
        this.nodeRefs = builder.nodeRefs != null ? List.copyOf(builder.nodeRefs) : List.of();
        this.fixSuggestion = builder.fixSuggestion != null ? builder.fixSuggestion : "";
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getRuleId() {
        return ruleId;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getCategory() {
        return category;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public List<String> getNodeRefs() {
        return nodeRefs;
    }

    public String getFixSuggestion() {
        return fixSuggestion;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Issue issue = (Issue) o;
        return ruleId.equals(issue.ruleId) &&
               severity == issue.severity &&
               category.equals(issue.category) &&
               title.equals(issue.title) &&
               description.equals(issue.description) &&
               nodeRefs.equals(issue.nodeRefs) &&
               fixSuggestion.equals(issue.fixSuggestion);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ruleId, severity, category, title, description, nodeRefs, fixSuggestion);
    }

    @Override
    public String toString() {
        return "Issue{" +
               "severity=" + severity +
               ", title='" + title + '\'' +
               ", nodeRefs=" + nodeRefs +
               '}';
    }

    public static final class Builder {
        private String ruleId;
        private Severity severity;
        private String category;
        private String title;
        private String description;
        private List<String> nodeRefs;
        private String fixSuggestion;

        private Builder() {
        }

        public Builder ruleId(String ruleId) {
            this.ruleId = ruleId;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder nodeRefs(List<String> nodeRefs) {
            this.nodeRefs = nodeRefs;
            return this;
        }

        public Builder nodeRef(String nodeRef) {
            this.nodeRefs = nodeRef != null ? List.of(nodeRef) : null;
            return this;
        }

        public Builder fixSuggestion(String fixSuggestion) {
            this.fixSuggestion = fixSuggestion;
            return this;
        }

        public Issue build() {
            return new Issue(this);
        }
    }
}
