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

import static dev.mars.flowaudit.engine.WorkflowFixtures.context;
import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for the high severity rules.
 */
@DisplayName("High Severity Rules Tests")
class HighSeverityRulesTest {

    private static List<Issue> run(IssueRule rule, String json) {
        return rule.evaluate(context(json));
    }

    @Nested
    @DisplayName("Error handling")
    class ErrorHandlingTests {

        @Test
        @DisplayName("Should report external calls without error handling")
        void testUnhandled() {
            List<Issue> issues = run(new ErrorHandlingRule(), """
                    {"actions": [{"id": "z", "type": "zapier", "name": "Zap"}]}
                    """);

            assertThat(issues).singleElement().satisfies(issue -> {
                assertThat(issue.getSeverity()).isEqualTo(Severity.HIGH);
                assertThat(issue.getTitle()).isEqualTo("External API Call Without Error Handling");
                assertThat(issue.getCategory()).isEqualTo("Error Handling");
                assertThat(issue.getDescription()).contains("\"Zap\"");
            });
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "{\"type\": \"webhook\", \"config\": {\"onError\": \"notify\"}}",
                "{\"type\": \"webhook\", \"config\": {\"fallback\": true}}",
                "{\"type\": \"webhook\", \"fallbackActionId\": \"b\"}",
                "{\"type\": \"webhook\", \"branches\": [{\"condition\": \"on_failure\"}]}"
        })
        @DisplayName("Should accept any form of error handling on the entry")
        void testHandled(String action) {
            assertThat(run(new ErrorHandlingRule(), "{\"actions\": [" + action + "]}")).isEmpty();
        }

        @Test
        @DisplayName("Should accept an error labeled connection")
        void testErrorEdge() {
            assertThat(run(new ErrorHandlingRule(), """
                    {"nodes": [{"id": "api", "type": "api"}, {"id": "alert", "type": "email"}],
                     "connections": [{"from": "api", "to": "alert", "branch": "Error"}]}
                    """)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Trigger conflicts")
    class TriggerConflictTests {

        @Test
        @DisplayName("Should report one issue per conflicting pair")
        void testConflicts() {
            List<Issue> issues = run(new TriggerConflictRule(), """
                    {"triggers": [{"id": "t1", "type": "contact_tag_added"}, {"id": "t2", "type": "contact_updated"}],
                     "actions": []}
                    """);

            assertThat(issues).singleElement().satisfies(issue -> {
                assertThat(issue.getTitle()).isEqualTo("Trigger Conflict Detected");
                assertThat(issue.getNodeRefs()).containsExactly("t1", "t2");
                assertThat(issue.getDescription()).isEqualTo("Triggers \"Trigger 1\" and \"Trigger 2\" may fire simultaneously");
            });
        }
    }

    @Nested
    @DisplayName("Rapid actions")
    class RapidActionsTests {

        @Test
        @DisplayName("Should report back-to-back rate limited actions")
        void testBackToBack() {
            List<Issue> issues = run(new RapidActionsRule(), """
                    {"triggers": [{"id": "t", "type": "sms"}],
                     "actions": [{"id": "a", "type": "email", "name": "Welcome"},
                                 {"id": "b", "type": "sms", "name": "Text"},
                                 {"id": "w", "type": "wait"},
                                 {"id": "c", "type": "email"}]}
                    """);

            assertThat(issues).singleElement().satisfies(issue -> {
                assertThat(issue.getNodeRefs()).containsExactly("a");
                assertThat(issue.getDescription()).startsWith("Actions \"Welcome\" and \"Text\" execute back-to-back");
            });
        }

        @Test
        @DisplayName("Should report parallel connections once")
        void testParallelEdges() {
            assertThat(run(new RapidActionsRule(), """
                    {"nodes": [{"id": "a", "type": "email"}, {"id": "b", "type": "bulk_sms"}],
                     "connections": [{"from": "a", "to": "b"}, {"from": "a", "to": "b", "branch": "yes"}]}
                    """)).hasSize(1);
        }
    }

    @Nested
    @DisplayName("Hardcoded values")
    class HardcodedValuesTests {

        @Test
        @DisplayName("Should report hardcoded recipients and keys")
        void testHardcoded() {
            List<Issue> issues = run(new HardcodedValuesRule(), """
                    {"actions": [
                      {"id": "e", "type": "email", "config": {"to": "owner@example.com"}},
                      {"id": "s", "type": "sms", "config": {"phoneNumber": "+15551234567"}},
                      {"id": "a", "type": "api", "config": {"apiKey": "sk_live_1234567890"}}
                    ]}
                    """);

            assertThat(issues).extracting(Issue::getTitle)
                    .containsExactly("Hardcoded Email Recipient", "Hardcoded Phone Number", "Hardcoded API Key");
            assertThat(issues.get(2).getCategory()).isEqualTo("Security");
        }

        @Test
        @DisplayName("Should accept merge fields and short values")
        void testTemplated() {
            assertThat(run(new HardcodedValuesRule(), """
                    {"actions": [
                      {"type": "email", "config": {"to": "{{contact.email}}"}},
                      {"type": "sms", "config": {"to": "555-1234"}},
                      {"type": "api", "config": {"apiKey": "{{secrets.api_key_for_crm}}"}},
                      {"type": "api", "config": {"apiKey": "short"}}
                    ]}
                    """)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Bulk throttling")
    class BulkThrottlingTests {

        @Test
        @DisplayName("Should report bulk sends without throttling")
        void testBulk() {
            List<Issue> issues = run(new BulkThrottlingRule(), """
                    {"actions": [{"id": "b1", "type": "bulk_email"},
                                 {"id": "b2", "type": "bulk_sms", "config": {"throttling": {"perMinute": 60}}}]}
                    """);

            assertThat(issues).singleElement()
                    .extracting(Issue::getNodeRefs).isEqualTo(List.of("b1"));
        }
    }
}
