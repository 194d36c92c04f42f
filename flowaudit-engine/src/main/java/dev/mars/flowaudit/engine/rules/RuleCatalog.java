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
import dev.mars.flowaudit.core.config.FlowAuditConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Ordered collection of rules, evaluated one at a time with failure isolation.
 *
 * <p>Issues are concatenated in rule order and never merged: two rules reporting the same defect
 * produce two issues. A rule that throws a runtime exception is logged, recorded in
 * {@link Outcome#failedRules()} and skipped; the remaining rules still run.</p>
 *
 * <pre>{@code
 * RuleCatalog catalog = RuleCatalog.defaultCatalog(configuration);
 * RuleCatalog.Outcome outcome = catalog.evaluate(context);
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-12
 * @version 1.0
 */
public class RuleCatalog {

    private static final Logger logger = LoggerFactory.getLogger(RuleCatalog.class);

    private final List<IssueRule> rules;

    public RuleCatalog(List<IssueRule> rules) {
        Objects.requireNonNull(rules, "Rules cannot be null");
        Set<String> ids = new HashSet<>();
        for (IssueRule rule : rules) {
            if (!ids.add(rule.id())) {
                throw new IllegalArgumentException("Duplicate rule id: " + rule.id());
            }
        }
        this.rules = List.copyOf(rules);
    }

    /**
     * The built-in rules in catalog order, minus any disabled by configuration.
     */
    public static RuleCatalog defaultCatalog(FlowAuditConfiguration configuration) {
        Objects.requireNonNull(configuration, "Configuration cannot be null");
        List<IssueRule> all = List.of(
                // critical
                new InfiniteLoopRule(),
                new WebhookUrlRule(),
                new PaymentRetryRule(),
                new ApiConfigurationRule(),
                new RequiredFieldsRule(),
                // high
                new ErrorHandlingRule(),
                new TriggerConflictRule(),
                new RapidActionsRule(),
                new HardcodedValuesRule(),
                new BulkThrottlingRule(),
                // medium
                new LongChainRule(configuration.getLongChainThreshold()),
                new MissingFallbackRule(),
                new DeprecatedApiVersionRule(),
                new MissingTimeoutRule(),
                new ContactValidationRule(),
                new ExcessiveWaitRule(configuration.getExcessiveWaitSeconds()),
                new HighComplexityRule(configuration.getMaxBranches()),
                new UnreachableNodeRule(),
                new DanglingConnectionRule(),
                // low
                new MissingDescriptionRule(),
                new SuboptimalOrderingRule(),
                new ConditionBranchesRule(),
                new DisconnectedNodeRule(),
                new DeprecatedActionRule()
        );

        Set<String> disabled = configuration.getDisabledRules();
        List<IssueRule> enabled = new ArrayList<>(all.size());
        for (IssueRule rule : all) {
            if (disabled.contains(rule.id())) {
                logger.debug("Rule '{}' disabled by configuration", rule.id());
            } else {
                enabled.add(rule);
            }
        }
        return new RuleCatalog(enabled);
    }

    public List<IssueRule> getRules() {
        return rules;
    }

    public List<String> ruleIds() {
        return rules.stream().map(IssueRule::id).toList();
    }

    /**
     * Returns a catalog with one more rule appended.
     */
    public RuleCatalog with(IssueRule rule) {
        List<IssueRule> extended = new ArrayList<>(rules);
        extended.add(Objects.requireNonNull(rule, "Rule cannot be null"));
        return new RuleCatalog(extended);
    }

    /**
     * Runs every rule against the context.
     */
    public Outcome evaluate(RuleContext context) {
        Objects.requireNonNull(context, "Rule context cannot be null");
        List<Issue> issues = new ArrayList<>();
        List<String> failedRules = new ArrayList<>();

        for (IssueRule rule : rules) {
            try {
                List<Issue> found = rule.evaluate(context);
                if (found != null) {
                    issues.addAll(found);
                }
                logger.trace("Rule '{}' reported {} issue(s)", rule.id(), found == null ? 0 : found.size());
            } catch (RuntimeException e) {
                logger.warn("Rule '{}' failed and was skipped: {}", rule.id(), e.getMessage(), e);
                failedRules.add(rule.id());
            }
        }
        return new Outcome(issues, failedRules);
    }

    /**
     * Issues found by the catalog and the ids of the rules that failed.
     */
    public record Outcome(List<Issue> issues, List<String> failedRules) {

        public Outcome {
            issues = List.copyOf(issues);
            failedRules = List.copyOf(failedRules);
        }
    }
}
