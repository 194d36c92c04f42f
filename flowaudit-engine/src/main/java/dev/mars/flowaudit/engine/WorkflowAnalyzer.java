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

package dev.mars.flowaudit.engine;

import com.fasterxml.jackson.databind.JsonNode;
import dev.mars.flowaudit.core.AnalysisMetadata;
import dev.mars.flowaudit.core.AnalysisResult;
import dev.mars.flowaudit.core.CanonicalGraph;
import dev.mars.flowaudit.core.CanonicalNode;
import dev.mars.flowaudit.core.Issue;
import dev.mars.flowaudit.core.config.FlowAuditConfiguration;
import dev.mars.flowaudit.core.document.WorkflowDocument;
import dev.mars.flowaudit.engine.graph.GraphAnalysis;
import dev.mars.flowaudit.engine.graph.GraphAnalyzer;
import dev.mars.flowaudit.engine.normalize.WorkflowNormalizer;
import dev.mars.flowaudit.engine.rules.RuleCatalog;
import dev.mars.flowaudit.engine.rules.RuleContext;
import dev.mars.flowaudit.engine.scoring.HealthScorer;
import dev.mars.flowaudit.engine.scoring.PerformanceEstimator;
import dev.mars.flowaudit.engine.scoring.RecommendationGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Static analyzer for automation workflow definitions.
 *
 * <p>One call runs the whole pipeline: the document is normalized into a canonical graph, the
 * graph analyzer and the rule catalog inspect it, and the findings are aggregated into a single
 * {@link AnalysisResult} with a health score, grade, recommendations and a performance
 * estimate.</p>
 *
 * <p>The analyzer never executes the workflow and performs no I/O. It holds no mutable state, so
 * one instance may analyze different documents from many threads at once. For the same document
 * and configuration the result is always the same apart from its timestamp.</p>
 *
 * <pre>{@code
 * WorkflowAnalyzer analyzer = new WorkflowAnalyzer();
 * AnalysisResult result = analyzer.analyze(objectMapper.readTree(json));
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-12
 * @version 1.0
 */
public class WorkflowAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowAnalyzer.class);

    private final WorkflowNormalizer normalizer;
    private final GraphAnalyzer graphAnalyzer;
    private final RuleCatalog ruleCatalog;
    private final RecommendationGenerator recommendationGenerator;
    private final PerformanceEstimator performanceEstimator;
    private final FlowAuditConfiguration configuration;
    private final Clock clock;

    /**
     * Creates an analyzer with built-in defaults.
     */
    public WorkflowAnalyzer() {
        this(FlowAuditConfiguration.defaults());
    }

    public WorkflowAnalyzer(FlowAuditConfiguration configuration) {
        this(configuration, RuleCatalog.defaultCatalog(configuration), Clock.systemUTC());
    }

    public WorkflowAnalyzer(FlowAuditConfiguration configuration, RuleCatalog ruleCatalog, Clock clock) {
        this.configuration = Objects.requireNonNull(configuration, "Configuration cannot be null");
        this.ruleCatalog = Objects.requireNonNull(ruleCatalog, "Rule catalog cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        this.normalizer = new WorkflowNormalizer();
        this.graphAnalyzer = new GraphAnalyzer();
        this.recommendationGenerator = new RecommendationGenerator(configuration);
        this.performanceEstimator = new PerformanceEstimator(configuration);
    }

    /**
     * Classifies and analyzes a parsed document.
     *
     * @param root parsed JSON tree, an object or an array
     * @return the analysis result
     */
    public AnalysisResult analyze(JsonNode root) {
        Objects.requireNonNull(root, "Workflow document cannot be null");
        return analyze(WorkflowDocument.of(root));
    }

    /**
     * Analyzes a classified document. Never throws for a non-null document; malformed content is
     * reported as issues.
     */
    public AnalysisResult analyze(WorkflowDocument document) {
        Objects.requireNonNull(document, "Workflow document cannot be null");
        long start = System.nanoTime();

        CanonicalGraph graph = normalizer.normalize(document);
        GraphAnalysis graphAnalysis = graphAnalyzer.analyze(graph);
        logger.debug("Normalized {} into {} with {} loop(s) and {} trigger conflict(s)",
                document, graph, graphAnalysis.loops().size(), graphAnalysis.triggerConflicts().size());

        RuleContext context = new RuleContext(document, graph, graphAnalysis, configuration);
        RuleCatalog.Outcome outcome = ruleCatalog.evaluate(context);
        List<Issue> issues = outcome.issues();

        int analyzedNodes = (int) graph.getNodes().stream().filter(CanonicalNode::recognized).count();
        AnalysisMetadata metadata = new AnalysisMetadata(
                document.isActive(),
                analyzedNodes,
                graph.nodeCount(),
                graphAnalysis.hasUnresolvedLoops(),
                graphAnalysis.hasTriggerConflicts(),
                outcome.failedRules());

        int score = HealthScorer.score(issues);
        AnalysisResult result = AnalysisResult.builder()
                .workflowId(document.getId().orElse(null))
                .workflowName(document.getName().orElse(null))
                .healthScore(score)
                .grade(HealthScorer.grade(score))
                .confidence(HealthScorer.confidence(analyzedNodes, graph.nodeCount()))
                .issues(issues)
                .recommendations(recommendationGenerator.generate(issues, metadata))
                .performance(performanceEstimator.estimate(graph))
                .metadata(metadata)
                .timestamp(Instant.now(clock))
                .build();

        if (logger.isDebugEnabled()) {
            logger.debug("Analyzed {} in {} ms: score={}, grade={}, issues={}", document,
                    (System.nanoTime() - start) / 1_000_000, score, result.getGrade(), issues.size());
        }
        return result;
    }

    public FlowAuditConfiguration getConfiguration() {
        return configuration;
    }

    public RuleCatalog getRuleCatalog() {
        return ruleCatalog;
    }
}
