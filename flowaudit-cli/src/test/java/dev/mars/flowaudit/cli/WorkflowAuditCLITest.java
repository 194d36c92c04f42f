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

package dev.mars.flowaudit.cli;

import dev.mars.flowaudit.cli.observability.AnalysisMetrics;
import dev.mars.flowaudit.core.config.FlowAuditConfiguration;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link WorkflowAuditCLI}, run in-process against files in a temporary directory.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-12
 * @version 1.0
 */
@DisplayName("Workflow Audit CLI")
class WorkflowAuditCLITest {

    private static final String PAYMENT_ONLY = """
            {"id": "wf-pay", "name": "Checkout",
             "actions": [{"id": "pay", "type": "payment", "name": "Charge"}]}
            """;

    private static final String PAYMENT_ONLY_YAML = """
            id: wf-pay
            name: Checkout
            actions:
              - id: pay
                type: payment
                name: Charge
            """;

    private static final String EMPTY = "{\"id\": \"wf-empty\", \"actions\": []}";

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream outBuffer;
    private ByteArrayOutputStream errBuffer;
    private WorkflowAuditCLI cli;

    @BeforeEach
    void setUp() {
        outBuffer = new ByteArrayOutputStream();
        errBuffer = new ByteArrayOutputStream();
        cli = new WorkflowAuditCLI(
                new PrintStream(outBuffer, true, StandardCharsets.UTF_8),
                new PrintStream(errBuffer, true, StandardCharsets.UTF_8),
                FlowAuditConfiguration.defaults(),
                new AnalysisMetrics(OpenTelemetry.noop()));
    }

    private String out() {
        return outBuffer.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return errBuffer.toString(StandardCharsets.UTF_8);
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }

    @Nested
    @DisplayName("Arguments")
    class Arguments {

        @Test
        @DisplayName("Should print usage and fail without arguments")
        void testNoArguments() {
            assertThat(cli.run(new String[0])).isEqualTo(WorkflowAuditCLI.EXIT_USAGE);
            assertThat(err()).contains("No files specified").contains("USAGE:");
        }

        @ParameterizedTest
        @ValueSource(strings = {"--help", "-h"})
        @DisplayName("Should print usage on request")
        void testHelp(String flag) {
            assertThat(cli.run(new String[]{flag})).isEqualTo(WorkflowAuditCLI.EXIT_OK);
            assertThat(out()).contains("--fail-under N").contains("EXIT CODES:");
        }

        @Test
        @DisplayName("Should print the version")
        void testVersion() {
            assertThat(cli.run(new String[]{"--version"})).isEqualTo(WorkflowAuditCLI.EXIT_OK);
            assertThat(out()).contains("v1.0.0");
        }

        @ParameterizedTest
        @ValueSource(strings = {"abc", "-1", "101"})
        @DisplayName("Should reject an invalid threshold")
        void testInvalidFailUnder(String value) throws IOException {
            Path file = write("checkout.json", PAYMENT_ONLY);

            assertThat(cli.run(new String[]{"--fail-under", value, file.toString()}))
                    .isEqualTo(WorkflowAuditCLI.EXIT_USAGE);
            assertThat(err()).contains("--fail-under");
        }

        @Test
        @DisplayName("Should reject an option without its value")
        void testMissingValue() {
            assertThat(cli.run(new String[]{"--directory"})).isEqualTo(WorkflowAuditCLI.EXIT_USAGE);
            assertThat(err()).contains("--directory requires a value");
        }

        @Test
        @DisplayName("Should reject unknown options")
        void testUnknownOption() {
            assertThat(cli.run(new String[]{"--verbose", "a.json"})).isEqualTo(WorkflowAuditCLI.EXIT_USAGE);
            assertThat(err()).contains("Unknown option --verbose");
        }

        @Test
        @DisplayName("Should reject a directory combined with files")
        void testDirectoryWithFiles() {
            assertThat(cli.run(new String[]{"--directory", tempDir.toString(), "a.json"}))
                    .isEqualTo(WorkflowAuditCLI.EXIT_USAGE);
        }

        @Test
        @DisplayName("Should require at least one file when only flags are given")
        void testOnlyFlags() {
            assertThat(cli.run(new String[]{"--summary"})).isEqualTo(WorkflowAuditCLI.EXIT_USAGE);
            assertThat(err()).contains("No files to audit");
        }
    }

    @Nested
    @DisplayName("Files")
    class FileAudits {

        @Test
        @DisplayName("Should print the JSON result for a file")
        void testJsonOutput() throws IOException {
            Path file = write("checkout.json", PAYMENT_ONLY);

            assertThat(cli.run(new String[]{file.toString()})).isEqualTo(WorkflowAuditCLI.EXIT_OK);
            assertThat(out())
                    .contains("\"workflowId\" : \"wf-pay\"")
                    .contains("\"healthScore\" : 66")
                    .contains("\"ruleId\" : \"payment-retry\"");
        }

        @Test
        @DisplayName("Should print compact JSON on one line")
        void testCompactOutput() throws IOException {
            Path file = write("checkout.json", PAYMENT_ONLY);

            assertThat(cli.run(new String[]{"--compact", file.toString()})).isEqualTo(WorkflowAuditCLI.EXIT_OK);
            assertThat(out().strip()).doesNotContain("\n").contains("\"healthScore\":66");
        }

        @Test
        @DisplayName("Should audit YAML the same as JSON")
        void testYamlFile() throws IOException {
            Path file = write("checkout.yaml", PAYMENT_ONLY_YAML);

            assertThat(cli.run(new String[]{"--summary", file.toString()})).isEqualTo(WorkflowAuditCLI.EXIT_OK);
            assertThat(out()).contains(file + ": 66/100 Needs Attention (1 critical, 0 high, 1 medium, 2 low)");
        }

        @Test
        @DisplayName("Should print one line per file and a summary block")
        void testSummary() throws IOException {
            Path pay = write("checkout.json", PAYMENT_ONLY);
            Path empty = write("empty.json", EMPTY);

            int exit = cli.run(new String[]{"--summary", pay.toString(), empty.toString()});

            assertThat(exit).isEqualTo(WorkflowAuditCLI.EXIT_OK);
            assertThat(out())
                    .contains(pay + ": 66/100 Needs Attention (1 critical, 0 high, 1 medium, 2 low)")
                    .contains(empty + ": 100/100 Excellent (0 critical, 0 high, 0 medium, 0 low)")
                    .contains("AUDIT SUMMARY")
                    .contains("Total files:      2");
        }

        @Test
        @DisplayName("Should exit with 1 when a score is below the threshold")
        void testFailUnder() throws IOException {
            Path pay = write("checkout.json", PAYMENT_ONLY);
            Path empty = write("empty.json", EMPTY);

            assertThat(cli.run(new String[]{"--fail-under", "90", "--summary", pay.toString(), empty.toString()}))
                    .isEqualTo(WorkflowAuditCLI.EXIT_BELOW_THRESHOLD);
            assertThat(out()).contains("Below threshold:  1");
        }

        @Test
        @DisplayName("Should pass a threshold the score meets")
        void testFailUnderMet() throws IOException {
            Path pay = write("checkout.json", PAYMENT_ONLY);

            assertThat(cli.run(new String[]{"--fail-under", "66", pay.toString()}))
                    .isEqualTo(WorkflowAuditCLI.EXIT_OK);
        }

        @Test
        @DisplayName("Should exit with 3 for a missing file and keep auditing the rest")
        void testMissingFile() throws IOException {
            Path pay = write("checkout.json", PAYMENT_ONLY);
            Path missing = tempDir.resolve("missing.json");

            int exit = cli.run(new String[]{"--summary", missing.toString(), pay.toString()});

            assertThat(exit).isEqualTo(WorkflowAuditCLI.EXIT_IO_ERROR);
            assertThat(err()).contains("✗ " + missing + " - Error: File does not exist");
            assertThat(out()).contains(pay + ": 66/100");
        }

        @Test
        @DisplayName("Should exit with 3 for a malformed file")
        void testMalformedFile() throws IOException {
            Path broken = write("broken.json", "{\"actions\": [");

            assertThat(cli.run(new String[]{broken.toString()})).isEqualTo(WorkflowAuditCLI.EXIT_IO_ERROR);
            assertThat(err()).contains("✗ " + broken).contains("Malformed JSON");
        }
    }

    @Nested
    @DisplayName("Directories")
    class Directories {

        @Test
        @DisplayName("Should audit every workflow file under a directory")
        void testDirectory() throws IOException {
            Path pay = write("flows/checkout.json", PAYMENT_ONLY);
            Path nested = write("flows/nested/checkout.yml", PAYMENT_ONLY_YAML);
            write("flows/README.md", "# not a workflow");

            int exit = cli.run(new String[]{"--summary", "--directory", tempDir.resolve("flows").toString()});

            assertThat(exit).isEqualTo(WorkflowAuditCLI.EXIT_OK);
            assertThat(out())
                    .contains(pay + ": 66/100")
                    .contains(nested + ": 66/100")
                    .contains("Total files:      2")
                    .doesNotContain("README");
        }

        @Test
        @DisplayName("Should succeed when a directory holds no workflow files")
        void testEmptyDirectory() throws IOException {
            write("docs/notes.txt", "nothing here");

            assertThat(cli.run(new String[]{"--directory", tempDir.resolve("docs").toString()}))
                    .isEqualTo(WorkflowAuditCLI.EXIT_OK);
            assertThat(err()).contains("No workflow files found");
        }

        @Test
        @DisplayName("Should exit with 3 for a directory that does not exist")
        void testMissingDirectory() {
            assertThat(cli.run(new String[]{"--directory", tempDir.resolve("nope").toString()}))
                    .isEqualTo(WorkflowAuditCLI.EXIT_IO_ERROR);
            assertThat(err()).contains("Directory does not exist");
        }

        @Test
        @DisplayName("Should exit with 3 when the path is a file")
        void testNotADirectory() throws IOException {
            Path file = write("checkout.json", PAYMENT_ONLY);

            assertThat(cli.run(new String[]{"--directory", file.toString()}))
                    .isEqualTo(WorkflowAuditCLI.EXIT_IO_ERROR);
            assertThat(err()).contains("Path is not a directory");
        }
    }

    @Test
    @DisplayName("Should recognize workflow file extensions")
    void testIsWorkflowFile() {
        assertThat(WorkflowAuditCLI.isWorkflowFile(Paths.get("a.json"))).isTrue();
        assertThat(WorkflowAuditCLI.isWorkflowFile(Paths.get("a.YAML"))).isTrue();
        assertThat(WorkflowAuditCLI.isWorkflowFile(Paths.get("dir", "a.yml"))).isTrue();
        assertThat(WorkflowAuditCLI.isWorkflowFile(Paths.get("a.txt"))).isFalse();
    }
}
