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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link AnalysisResult}, {@link Issue} and the grading enums.
 */
@DisplayName("AnalysisResult Tests")
class AnalysisResultTest {

    private static Issue issue(Severity severity) {
        return Issue.builder()
                .ruleId("rule-" + severity.getLabel())
                .severity(severity)
                .category("Test")
                .title("Title")
                .build();
    }

    private static AnalysisResult.Builder minimal() {
        return AnalysisResult.builder()
                .healthScore(100)
                .grade(HealthGrade.EXCELLENT)
                .confidence(Confidence.LOW)
                .performance(new PerformanceEstimate(0, "0.0s", Complexity.LOW, List.of()))
                .metadata(new AnalysisMetadata(false, 0, 0, false, false, List.of()));
    }

    @Nested
    @DisplayName("Issue")
    class IssueTests {

        @Test
        @DisplayName("Should default optional text fields")
        void testDefaults() {
            Issue issue = issue(Severity.LOW);

            assertThat(issue.getDescription()).isEmpty();
            assertThat(issue.getFixSuggestion()).isEmpty();
            assertThat(issue.getNodeRefs()).isEmpty();
        }

        @Test
        @DisplayName("Should require rule id, severity, category and title")
        void testRequiredFields() {
            assertThatThrownBy(() -> Issue.builder().severity(Severity.LOW).category("c").title("t").build())
                    .isInstanceOf(NullPointerException.class)
                    .hasMessageContaining("Rule id");
            assertThatThrownBy(() -> Issue.builder().ruleId("r").category("c").title("t").build())
                    .isInstanceOf(NullPointerException.class)
                    .hasMessageContaining("Severity");
        }

        @Test
        @DisplayName("Should compare by value")
        void testEquality() {
            Issue first = Issue.builder().ruleId("r").severity(Severity.HIGH).category("c").title("t")
                    .nodeRef("a").build();
            Issue second = Issue.builder().ruleId("r").severity(Severity.HIGH).category("c").title("t")
                    .nodeRefs(List.of("a")).build();

            assertThat(first).isEqualTo(second).hasSameHashCodeAs(second);
        }
    }

    @Nested
    @DisplayName("Result")
    class ResultTests {

        @Test
        @DisplayName("Should compute the issue summary from the issues")
        void testSummary() {
            AnalysisResult result = minimal()
                    .healthScore(43)
                    .grade(HealthGrade.HIGH_RISK)
                    .issues(List.of(issue(Severity.CRITICAL), issue(Severity.HIGH), issue(Severity.HIGH),
                            issue(Severity.LOW)))
                    .build();

            assertThat(result.getIssuesSummary()).isEqualTo(new IssuesSummary(1, 2, 0, 1, 4));
            assertThat(result.countIssues(Severity.HIGH)).isEqualTo(2);
            assertThat(result.hasIssues()).isTrue();
        }

        @ParameterizedTest
        @CsvSource({"-1", "101"})
        @DisplayName("Should reject scores outside 0..100")
        void testScoreRange(int score) {
            assertThatThrownBy(() -> minimal().healthScore(score))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Should keep the given timestamp")
        void testTimestamp() {
            Instant instant = Instant.parse("2026-10-12T09:30:00Z");
            assertThat(minimal().timestamp(instant).build().getTimestamp()).isEqualTo(instant);
            assertThat(minimal().build().getTimestamp()).isNotNull();
        }

        @Test
        @DisplayName("Should not expose mutable issue lists")
        void testImmutability() {
            AnalysisResult result = minimal().issues(new ArrayList<>(List.of(issue(Severity.LOW)))).build();
            assertThatThrownBy(() -> result.getIssues().clear())
                    .isInstanceOf(UnsupportedOperationException.class);
        }
    }

    @Nested
    @DisplayName("Grades")
    class GradeTests {

        @ParameterizedTest
        @CsvSource({
                "100, EXCELLENT",
                "90, EXCELLENT",
                "89, GOOD",
                "70, GOOD",
                "69, NEEDS_ATTENTION",
                "50, NEEDS_ATTENTION",
                "49, HIGH_RISK",
                "30, HIGH_RISK",
                "29, CRITICAL",
                "0, CRITICAL"
        })
        @DisplayName("Should map scores to grade bands")
        void testBands(int score, HealthGrade expected) {
            assertThat(HealthGrade.fromScore(score)).isEqualTo(expected);
        }

        @Test
        @DisplayName("Should carry the configured penalties")
        void testPenalties() {
            assertThat(Severity.CRITICAL.getPenalty()).isEqualTo(25);
            assertThat(Severity.HIGH.getPenalty()).isEqualTo(15);
            assertThat(Severity.MEDIUM.getPenalty()).isEqualTo(5);
            assertThat(Severity.LOW.getPenalty()).isEqualTo(2);
        }
    }
}
