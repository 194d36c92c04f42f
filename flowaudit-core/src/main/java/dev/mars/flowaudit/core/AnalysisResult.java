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

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Complete outcome of analyzing one workflow document.
 *
 * <p>Everything except {@link #getTimestamp()} is a pure function of the input document and the
 * analyzer configuration, so two analyses of the same document compare equal once the timestamp
 * is ignored.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-12
 * @version 1.0
 */
@JsonPropertyOrder({"workflowId", "workflowName", "healthScore", "grade", "confidence", "issues",
        "issuesSummary", "recommendations", "performance", "metadata", "timestamp"})
public final class AnalysisResult {

    private final String workflowId;
    private final String workflowName;
    private final int healthScore;
    private final HealthGrade grade;
    private final Confidence confidence;
    private final List<Issue> issues;
    private final IssuesSummary issuesSummary;
    private final List<String> recommendations;
    private final PerformanceEstimate performance;
    private final AnalysisMetadata metadata;
    private final Instant timestamp;

    private AnalysisResult(Builder builder) {
        this.workflowId = builder.workflowId;
        this.workflowName = builder.workflowName;
        this.healthScore = builder.healthScore;
        this.grade = Objects.requireNonNull(builder.grade, "Grade is required");
        this.confidence = Objects.requireNonNull(builder.confidence, "Confidence is required");
        this.issues = builder.issues != null ? List.copyOf(builder.issues) : List.of();
        this.issuesSummary = IssuesSummary.of(this.issues);
        this.recommendations = builder.recommendations != null ? List.copyOf(builder.recommendations) : List.of();
        this.performance = Objects.requireNonNull(builder.performance, "Performance estimate is required");
        this.metadata = Objects.requireNonNull(builder.metadata, "Metadata is required");
        this.timestamp = builder.timestamp != null ? builder.timestamp : Instant.now();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public String getWorkflowName() {
        return workflowName;
    }

    public int getHealthScore() {
        return healthScore;
    }

    public HealthGrade getGrade() {
        return grade;
    }

    public Confidence getConfidence() {
        return confidence;
    }

    public List<Issue> getIssues() {
        return issues;
    }

    public IssuesSummary getIssuesSummary() {
        return issuesSummary;
    }

    public List<String> getRecommendations() {
        return recommendations;
    }

    public PerformanceEstimate getPerformance() {
        return performance;
    }

    public AnalysisMetadata getMetadata() {
        return metadata;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public boolean hasIssues() {
        return !issues.isEmpty();
    }

    public long countIssues(Severity severity) {
        return issuesSummary.count(severity);
    }

    @Override
    public String toString() {
        return "AnalysisResult{" +
               "workflowId='" + workflowId + '\'' +
               ", healthScore=" + healthScore +
               ", grade=" + grade +
               ", confidence=" + confidence +
               ", issues=" + issues.size() +
               '}';
    }

    public static final class Builder {
        private String workflowId;
        private String workflowName;
        private int healthScore;
        private HealthGrade grade;
        private Confidence confidence;
        private List<Issue> issues;
        private List<String> recommendations;
        private PerformanceEstimate performance;
        private AnalysisMetadata metadata;
        private Instant timestamp;

        private Builder() {
        }

        public Builder workflowId(String workflowId) {
            this.workflowId = workflowId;
            return this;
        }

        public Builder workflowName(String workflowName) {
            this.workflowName = workflowName;
            return this;
        }

        public Builder healthScore(int healthScore) {
            if (healthScore < 0 || healthScore > 100) {
                throw new IllegalArgumentException("Health score must be within 0..100: " + healthScore);
            }
            this.healthScore = healthScore;
            return this;
        }

        public Builder grade(HealthGrade grade) {
            this.grade = grade;
            return this;
        }

        public Builder confidence(Confidence confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder issues(List<Issue> issues) {
            this.issues = issues;
            return this;
        }

        public Builder recommendations(List<String> recommendations) {
            this.recommendations = recommendations;
            return this;
        }

        public Builder performance(PerformanceEstimate performance) {
            this.performance = performance;
            return this;
        }

        public Builder metadata(AnalysisMetadata metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public AnalysisResult build() {
            return new AnalysisResult(this);
        }
    }
}
