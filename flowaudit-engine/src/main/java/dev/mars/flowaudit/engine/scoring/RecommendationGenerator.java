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

package dev.mars.flowaudit.engine.scoring;

import dev.mars.flowaudit.core.AnalysisMetadata;
import dev.mars.flowaudit.core.Issue;
import dev.mars.flowaudit.core.IssuesSummary;
import dev.mars.flowaudit.core.config.FlowAuditConfiguration;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Derives a short, ordered list of next steps from the issues and analysis metadata.
 *
 * <p>Messages always appear in the same order: the urgent critical notice, one message per
 * issue category group present, the medium volume notice, the active workflow caution and the
 * decomposition suggestion. Each message appears at most once.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-12
 * @version 1.0
 */
public class RecommendationGenerator {

    static final String STRUCTURE =
            "Review workflow structure for infinite loops and ensure all loops have clear exit conditions";
    static final String ERROR_HANDLING =
            "Implement comprehensive error handling for all external API calls and integrations";
    static final String CONFIGURATION =
            "Verify all webhook URLs and API configurations are correct and publicly accessible";
    static final String SECURITY =
            "Move sensitive credentials to environment variables and avoid hardcoded values";
    static final String PERFORMANCE =
            "Add delays between rapid actions to prevent rate limiting";
    static final String ACTIVE_WORKFLOW =
            "This workflow is ACTIVE - test all fixes in a duplicate workflow first";
    static final String DECOMPOSITION =
            "Consider breaking this complex workflow into smaller, manageable sub-workflows";

    private final int mediumIssueThreshold;
    private final int decompositionNodeThreshold;

    public RecommendationGenerator(FlowAuditConfiguration configuration) {
        Objects.requireNonNull(configuration, "Configuration cannot be null");
        this.mediumIssueThreshold = configuration.getMediumIssueThreshold();
        this.decompositionNodeThreshold = configuration.getDecompositionNodeThreshold();
    }

    public List<String> generate(List<Issue> issues, AnalysisMetadata metadata) {
        Objects.requireNonNull(issues, "Issues cannot be null");
        Objects.requireNonNull(metadata, "Metadata cannot be null");

        IssuesSummary summary = IssuesSummary.of(issues);
        Set<String> categories = new HashSet<>();
        for (Issue issue : issues) {
            categories.add(issue.getCategory());
        }

        Set<String> recommendations = new LinkedHashSet<>();
        if (summary.critical() > 0) {
            recommendations.add("URGENT: Fix " + summary.critical() + " critical issue"
                    + (summary.critical() > 1 ? "s" : "") + " immediately to prevent workflow failures");
        }
        if (categories.contains("Graph Structure") || metadata.hasLoops()) {
            recommendations.add(STRUCTURE);
        }
        if (categories.contains("Error Handling")) {
            recommendations.add(ERROR_HANDLING);
        }
        if (categories.contains("Configuration")) {
            recommendations.add(CONFIGURATION);
        }
        if (categories.contains("Security")) {
            recommendations.add(SECURITY);
        }
        if (categories.contains("Performance")) {
            recommendations.add(PERFORMANCE);
        }
        if (summary.medium() > mediumIssueThreshold) {
            recommendations.add("Address " + summary.medium()
                    + " medium-priority issues to improve workflow reliability");
        }
        if (metadata.isActive() && !issues.isEmpty()) {
            recommendations.add(ACTIVE_WORKFLOW);
        }
        if (metadata.totalNodes() > decompositionNodeThreshold) {
            recommendations.add(DECOMPOSITION);
        }
        return new ArrayList<>(recommendations);
    }
}
