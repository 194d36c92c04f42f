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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.StringJoiner;

import static dev.mars.flowaudit.engine.WorkflowFixtures.context;
import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for the medium severity rules.
 */
@DisplayName("Medium Severity Rules Tests")
class MediumSeverityRulesTest {

    private static List<Issue> run(IssueRule rule, String json) {
        return rule.evaluate(context(json));
    }

    private static String chainOf(int actions, String type) {
        StringJoiner joiner = new StringJoiner(",", "{\"triggers\": [{\"id\": \"t\", \"type\": \"form_submit\"}], \"actions\": [", "]}");
        for (int i = 0; i < actions; i++) {
            joiner.add("{\"id\": \"a" + i + "\", \"type\": \"" + (i == 5 ? type : "add_tag") + "\"}");
        }
        return joiner.toString();
    }

    @Nested
    @DisplayName("Long chain")
    class LongChainTests {

        @Test
        @DisplayName("Should report chains longer than the threshold without a condition")
        void testLongChain() {
            List<Issue> issues = run(new LongChainRule(10), chainOf(12, "add_tag"));

            assertThat(issues).singleElement().satisfies(issue -> {
                assertThat(issue.getSeverity()).isEqualTo(Severity.MEDIUM);
                assertThat(issue.getTitle()).isEqualTo("Long Chain Without Checkpoints");
                assertThat(issue.getNodeRefs()).hasSize(13).startsWith("t", "a0");
                assertThat(issue.getDescription()).startsWith("Flow has 13 sequential steps from \"Trigger 1\"");
            });
        }

        @Test
        @DisplayName("Should report a long chain that runs into a loop as a lower bound")
        void testChainIntoLoop() {
            StringJoiner actions = new StringJoiner(",");
            StringJoiner connections = new StringJoiner(",");
            String previous = "t";
            for (int i = 0; i < 12; i++) {
                actions.add("{\"id\": \"a" + i + "\", \"type\": \"add_tag\"}");
                connections.add("{\"from\": \"" + previous + "\", \"to\": \"a" + i + "\"}");
                previous = "a" + i;
            }
            actions.add("{\"id\": \"x\", \"type\": \"add_tag\"}").add("{\"id\": \"y\", \"type\": \"wait\"}");
            connections.add("{\"from\": \"a11\", \"to\": \"x\"}")
                    .add("{\"from\": \"x\", \"to\": \"y\"}")
                    .add("{\"from\": \"y\", \"to\": \"x\"}");
            String document = "{\"triggers\": [{\"id\": \"t\", \"type\": \"form_submit\"}], \"actions\": ["
                    + actions + "], \"connections\": [" + connections + "]}";

            List<Issue> issues = run(new LongChainRule(10), document);

            assertThat(issues).singleElement().satisfies(issue -> {
                assertThat(issue.getDescription()).startsWith("Flow has at least ");
                assertThat(issue.getDescription()).contains("then enters a loop");
                assertThat(issue.getNodeRefs()).startsWith("t", "a0");
            });
        }

        @Test
        @DisplayName("Should accept long chains with a condition checkpoint")
        void testCheckpoint() {
            assertThat(run(new LongChainRule(10), chainOf(12, "if_else"))).isEmpty();
        }

        @Test
        @DisplayName("Should accept chains at the threshold")
        void testAtThreshold() {
            assertThat(run(new LongChainRule(10), chainOf(9, "add_tag"))).isEmpty();
        }
    }

    @Nested
    @DisplayName("Missing fallback")
    class MissingFallbackTests {

        @Test
        @DisplayName("Should report critical actions without fallback")
        void testNoFallback() {
            List<Issue> issues = run(new MissingFallbackRule(), """
                    {"actions": [{"id": "p", "type": "payment"},
                                 {"id": "w", "type": "webhook", "branches": [{"condition": "else"}]}]}
                    """);

            assertThat(issues).singleElement().satisfies(issue -> {
                assertThat(issue.getTitle()).isEqualTo("Critical Action Without Fallback");
                assertThat(issue.getCategory()).isEqualTo("Resilience");
                assertThat(issue.getNodeRefs()).containsExactly("p");
            });
        }
    }

    @Nested
    @DisplayName("Deprecated API version")
    class DeprecatedApiTests {

        @ParameterizedTest
        @ValueSource(strings = {"https://api.example.com/v1/contacts", "https://api.example.com/beta"})
        @DisplayName("Should report deprecated version segments")
        void testDeprecatedSegment(String url) {
            assertThat(run(new DeprecatedApiVersionRule(),
                    "{\"actions\": [{\"type\": \"api\", \"config\": {\"url\": \"" + url + "\"}}]}"))
                    .extracting(Issue::getTitle).containsExactly("Using Deprecated API Version");
        }

        @Test
        @DisplayName("Should report configured deprecated versions")
        void testApiVersion() {
            assertThat(run(new DeprecatedApiVersionRule(), """
                    {"actions": [{"type": "api", "config": {"endpoint": "https://api.example.com/v3/x", "apiVersion": "alpha"}}]}
                    """)).extracting(Issue::getTitle).containsExactly("Deprecated API Version Configured");
        }

        @Test
        @DisplayName("Should not match version text inside other segments")
        void testNoFalsePositive() {
            assertThat(DeprecatedApiVersionRule.hasDeprecatedSegment("https://example.com/v10/x")).isFalse();
            assertThat(DeprecatedApiVersionRule.hasDeprecatedSegment("https://example.com/alphabet")).isFalse();
        }
    }

    @Nested
    @DisplayName("Missing timeout")
    class MissingTimeoutTests {

        @Test
        @DisplayName("Should report external calls without a timeout field")
        void testMissing() {
            List<Issue> issues = run(new MissingTimeoutRule(), """
                    {"actions": [{"id": "w", "type": "webhook"},
                                 {"id": "h", "type": "http_request", "config": {"timeoutMs": 0}},
                                 {"id": "i", "type": "integration", "config": {"timeout": null}}]}
                    """);

            assertThat(issues).singleElement()
                    .extracting(Issue::getNodeRefs).isEqualTo(List.of("w"));
        }
    }

    @Nested
    @DisplayName("Contact validation")
    class ContactValidationTests {

        @Test
        @DisplayName("Should report sends to contact fields without validation")
        void testUnvalidated() {
            List<Issue> issues = run(new ContactValidationRule(), """
                    {"actions": [
                      {"id": "e", "type": "email", "config": {"recipient": "{{contact.email}}"}},
                      {"id": "s", "type": "sms", "config": {"phoneField": "mobile"}}
                    ]}
                    """);

            assertThat(issues).extracting(Issue::getTitle)
                    .containsExactly("Email Sent Without Contact Validation", "SMS Sent Without Phone Validation");
        }

        @Test
        @DisplayName("Should accept validation flags and not-empty conditions")
        void testValidated() {
            assertThat(run(new ContactValidationRule(), """
                    {"actions": [
                      {"type": "email", "config": {"recipient": "{{contact.email}}", "validateEmail": true}},
                      {"type": "sms", "config": {"phoneNumber": "{{contact.phone}}"},
                       "conditions": [{"field": "contact.phone", "operator": "is_not_empty"}]}
                    ]}
                    """)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Excessive wait")
    class ExcessiveWaitTests {

        @Test
        @DisplayName("Should report waits longer than the limit")
        void testLongWait() {
            List<Issue> issues = run(new ExcessiveWaitRule(7 * 24 * 3600), """
                    {"actions": [{"id": "w1", "type": "wait", "config": {"delay": "10d"}},
                                 {"id": "w2", "type": "delay", "config": {"duration": 3600}},
                                 {"id": "w3", "type": "Wait", "config": {"delay": "7d"}}]}
                    """);

            assertThat(issues).singleElement().satisfies(issue -> {
                assertThat(issue.getNodeRefs()).containsExactly("w1");
                assertThat(issue.getDescription()).startsWith("Wait time of 10.0d");
            });
        }
    }

    @Nested
    @DisplayName("High complexity")
    class HighComplexityTests {

        @Test
        @DisplayName("Should report graphs with more branches than allowed")
        void testComplex() {
            String json = """
                    {"nodes": [{"id": "a", "type": "condition"}, {"id": "b", "type": "email"}],
                     "connections": [{"from": "a", "to": "b"}, {"from": "a", "to": "b"}, {"from": "b", "to": "a"},
                                     {"from": "b", "to": "b"}]}
                    """;

            assertThat(run(new HighComplexityRule(3), json)).singleElement()
                    .extracting(Issue::getDescription).asString().startsWith("Workflow has 4 branches");
            assertThat(run(new HighComplexityRule(4), json)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Graph structure")
    class GraphStructureTests {

        @Test
        @DisplayName("Should report connected nodes no trigger reaches")
        void testUnreachable() {
            List<Issue> issues = run(new UnreachableNodeRule(), """
                    {"nodes": [{"id": "t", "type": "form_submit"}, {"id": "a", "type": "email"},
                               {"id": "x", "type": "sms"}, {"id": "y", "type": "email"}, {"id": "lonely", "type": "email"}],
                     "connections": [{"from": "t", "to": "a"}, {"from": "x", "to": "y"}]}
                    """);

            assertThat(issues).extracting(i -> i.getNodeRefs().get(0)).containsExactly("x", "y");
            assertThat(issues.get(0).getTitle()).isEqualTo("Unreachable Node");
        }

        @Test
        @DisplayName("Should skip reachability when there are no triggers")
        void testNoTriggers() {
            assertThat(run(new UnreachableNodeRule(), """
                    {"nodes": [{"id": "x", "type": "sms"}, {"id": "y", "type": "email"}],
                     "connections": [{"from": "x", "to": "y"}]}
                    """)).isEmpty();
        }

        @Test
        @DisplayName("Should report one issue per dangling connection")
        void testDangling() {
            List<Issue> issues = run(new DanglingConnectionRule(), """
                    {"nodes": [{"id": "a", "type": "email"}],
                     "connections": [{"from": "a", "to": "ghost"}, {"from": "ghost", "to": "ghost"},
                                     {"from": "a", "to": "a"}]}
                    """);

            assertThat(issues).hasSize(2);
            assertThat(issues.get(0).getNodeRefs()).containsExactly("a", "ghost");
            assertThat(issues.get(0).getDescription()).endsWith("references missing node(s): ghost");
            assertThat(issues.get(1).getNodeRefs()).containsExactly("ghost");
        }
    }
}
