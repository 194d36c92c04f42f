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

package dev.mars.flowaudit.cli.observability;

import dev.mars.flowaudit.core.AnalysisResult;
import dev.mars.flowaudit.core.Issue;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * OpenTelemetry metrics for the audit CLI.
 *
 * Provides 5 metrics:
 * - flowaudit.analysis.total (counter) - Documents analyzed
 * - flowaudit.analysis.failed (counter) - Documents that could not be read
 * - flowaudit.issues.total (counter) - Issues found, by severity
 * - flowaudit.health.score (histogram) - Health score distribution
 * - flowaudit.analysis.duration.seconds (histogram) - Time spent per document
 *
 * Without a registered SDK the global instance is a no-op.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-12
 * @version 1.0 (OpenTelemetry)
 */
public class AnalysisMetrics {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisMetrics.class);
    private static final String METER_NAME = "flowaudit-cli";

    private static AnalysisMetrics instance;

    private final LongCounter analysesTotal;
    private final LongCounter analysesFailed;
    private final LongCounter issuesTotal;
    private final LongHistogram healthScore;
    private final DoubleHistogram analysisDuration;

    private static final AttributeKey<String> GRADE_KEY = AttributeKey.stringKey("health.grade");
    private static final AttributeKey<String> SEVERITY_KEY = AttributeKey.stringKey("issue.severity");
    private static final AttributeKey<String> RULE_KEY = AttributeKey.stringKey("issue.rule");
    private static final AttributeKey<String> FAILURE_REASON_KEY = AttributeKey.stringKey("failure.reason");

    public AnalysisMetrics(OpenTelemetry openTelemetry) {
        Meter meter = openTelemetry.getMeter(METER_NAME);

        analysesTotal = meter.counterBuilder("flowaudit.analysis.total")
                .setDescription("Number of workflow documents analyzed")
                .setUnit("1")
                .build();

        analysesFailed = meter.counterBuilder("flowaudit.analysis.failed")
                .setDescription("Number of workflow documents that could not be read")
                .setUnit("1")
                .build();

        issuesTotal = meter.counterBuilder("flowaudit.issues.total")
                .setDescription("Number of issues found")
                .setUnit("1")
                .build();

        healthScore = meter.histogramBuilder("flowaudit.health.score")
                .setDescription("Workflow health score")
                .setUnit("1")
                .ofLongs()
                .build();

        analysisDuration = meter.histogramBuilder("flowaudit.analysis.duration.seconds")
                .setDescription("Time spent reading and analyzing one document")
                .setUnit("s")
                .build();

        logger.debug("AnalysisMetrics initialized");
    }

    /**
     * Get the instance bound to the global OpenTelemetry.
     */
    public static synchronized AnalysisMetrics getInstance() {
        if (instance == null) {
            instance = new AnalysisMetrics(GlobalOpenTelemetry.get());
        }
        return instance;
    }

    public void recordAnalysis(AnalysisResult result, double durationSeconds) {
        Attributes attrs = Attributes.of(GRADE_KEY, result.getGrade().getLabel());
        analysesTotal.add(1, attrs);
        healthScore.record(result.getHealthScore(), attrs);
        analysisDuration.record(durationSeconds, attrs);

        for (Issue issue : result.getIssues()) {
            issuesTotal.add(1, Attributes.builder()
                    .put(SEVERITY_KEY, issue.getSeverity().getLabel())
                    .put(RULE_KEY, issue.getRuleId())
                    .build());
        }
    }

    public void recordFailure(String failureReason) {
        analysesFailed.add(1, Attributes.of(FAILURE_REASON_KEY,
                failureReason != null ? failureReason : "unknown"));
    }
}
