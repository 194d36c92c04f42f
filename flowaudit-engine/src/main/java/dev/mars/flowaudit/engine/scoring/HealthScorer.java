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

import dev.mars.flowaudit.core.Confidence;
import dev.mars.flowaudit.core.HealthGrade;
import dev.mars.flowaudit.core.Issue;
import dev.mars.flowaudit.core.IssuesSummary;
import dev.mars.flowaudit.core.Severity;

import java.util.List;

/**
 * Turns an issue list into a health score, grade and confidence label.
 *
 * <p>The score formula and weights are a compatibility contract shared with stored results and
 * report renderers:</p>
 * <pre>
 * score = clamp(100 - (critical*25 + high*15 + medium*5 + low*2), 0, 100)
 * </pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-12
 * @version 1.0
 */
public final class HealthScorer {

    private static final int PERFECT_SCORE = 100;
    private static final double HIGH_COVERAGE = 0.8;
    private static final double MEDIUM_COVERAGE = 0.5;
    private static final int SMALL_WORKFLOW_NODES = 5;

    private HealthScorer() {
    }

    public static int score(List<Issue> issues) {
        IssuesSummary summary = IssuesSummary.of(issues);
        long penalty = 0;
        for (Severity severity : Severity.values()) {
            penalty += penaltyOf(severity, summary.count(severity));
        }
        long score = PERFECT_SCORE - penalty;
        return (int) Math.max(0, Math.min(PERFECT_SCORE, score));
    }

    public static int penaltyOf(Severity severity, int count) {
        return severity.getPenalty() * count;
    }

    public static HealthGrade grade(int score) {
        return HealthGrade.fromScore(score);
    }

    /**
     * Confidence from the share of nodes whose type the analyzer recognized. An empty graph gives
     * nothing to be confident about and is always {@link Confidence#LOW}.
     */
    public static Confidence confidence(int analyzedNodes, int totalNodes) {
        if (totalNodes == 0) {
            return Confidence.LOW;
        }
        double coverage = (double) analyzedNodes / totalNodes;
        if (coverage >= HIGH_COVERAGE && totalNodes >= SMALL_WORKFLOW_NODES) {
            return Confidence.HIGH;
        }
        if (coverage >= MEDIUM_COVERAGE || totalNodes < SMALL_WORKFLOW_NODES) {
            return Confidence.MEDIUM;
        }
        return Confidence.LOW;
    }
}
