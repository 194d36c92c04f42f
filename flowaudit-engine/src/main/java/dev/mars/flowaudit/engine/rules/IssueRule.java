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

import java.util.List;

/**
 * One independent check of the rule catalog.
 *
 * <p>A rule reads the document and graph through its {@link RuleContext} and returns the issues
 * it found, possibly none. Rules must not depend on each other or on evaluation order; the
 * catalog runs each one in isolation and a rule that throws is skipped without affecting the
 * rest.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-12
 * @version 1.0
 */
public interface IssueRule {

    /**
     * Stable kebab-case identifier, used for configuration and failure reporting.
     */
    String id();

    /**
     * Severity of every issue this rule reports.
     */
    Severity severity();

    /**
     * Evaluates the rule.
     *
     * @param context read-only views of the document under analysis
     * @return the issues found, never null
     */
    List<Issue> evaluate(RuleContext context);
}
