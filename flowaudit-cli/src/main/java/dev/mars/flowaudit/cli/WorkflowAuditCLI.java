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
import dev.mars.flowaudit.core.AnalysisResult;
import dev.mars.flowaudit.core.config.FlowAuditConfiguration;
import dev.mars.flowaudit.core.document.WorkflowDocument;
import dev.mars.flowaudit.core.exceptions.WorkflowDocumentException;
import dev.mars.flowaudit.engine.WorkflowAnalyzer;
import dev.mars.flowaudit.engine.io.AnalysisResultWriter;
import dev.mars.flowaudit.engine.io.WorkflowDocumentReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Command-line tool for auditing workflow definition files.
 * Analyzes each JSON or YAML document and prints its analysis result.
 *
 * Usage:
 *   java WorkflowAuditCLI <file1.json> [file2.yaml] [...]
 *   java WorkflowAuditCLI --directory <directory>
 *   java WorkflowAuditCLI --help
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-12
 */
public class WorkflowAuditCLI {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowAuditCLI.class);

    static final int EXIT_OK = 0;
    static final int EXIT_BELOW_THRESHOLD = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_IO_ERROR = 3;

    private static final String VERSION = "1.0.0";
    private static final String USAGE = """
            FlowAudit Workflow Audit CLI v%s

            USAGE:
              java WorkflowAuditCLI <file1.json> [file2.yaml] [...]
              java WorkflowAuditCLI --directory <directory>
              java WorkflowAuditCLI --help
              java WorkflowAuditCLI --version

            OPTIONS:
              --help                Show this help message
              --version             Show version information
              --directory DIR       Audit all .json, .yaml and .yml files in directory
              --fail-under N        Exit with 1 when any health score is below N (0-100)
              --summary             Print one line per file instead of the JSON result
              --compact             Print the JSON result on a single line

            EXAMPLES:
              # Audit a single workflow export
              java WorkflowAuditCLI workflow.json

              # Audit a directory and fail the build on unhealthy workflows
              java WorkflowAuditCLI --directory ./workflows/ --fail-under 70 --summary

            EXIT CODES:
              0  All files analyzed and at or above the threshold
              1  At least one health score below --fail-under
              2  Invalid command line arguments
              3  File not found, unreadable or malformed
            """.formatted(VERSION);

    private final PrintStream out;
    private final PrintStream err;
    private final FlowAuditConfiguration configuration;
    private final AnalysisMetrics metrics;

    private boolean summary = false;
    private boolean compact = false;
    private int failUnder;

    public WorkflowAuditCLI() {
        this(System.out, System.err, new FlowAuditConfiguration(), AnalysisMetrics.getInstance());
    }

    public WorkflowAuditCLI(PrintStream out, PrintStream err, FlowAuditConfiguration configuration,
                            AnalysisMetrics metrics) {
        this.out = out;
        this.err = err;
        this.configuration = configuration;
        this.metrics = metrics;
        this.failUnder = configuration.getCliFailUnder();
    }

    public static void main(String[] args) {
        WorkflowAuditCLI cli = new WorkflowAuditCLI();
        System.exit(cli.run(args));
    }

    public int run(String[] args) {
        if (args.length == 0) {
            err.println("Error: No files specified");
            err.println();
            err.println(USAGE);
            return EXIT_USAGE;
        }

        try {
            return processArguments(args);
        } catch (IOException e) {
            logger.error("Audit aborted", e);
            err.println("Error: " + e.getMessage());
            return EXIT_IO_ERROR;
        }
    }

    private int processArguments(String[] args) throws IOException {
        List<String> files = new ArrayList<>();
        String directory = null;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--help", "-h" -> {
                    out.println(USAGE);
                    return EXIT_OK;
                }
                case "--version", "-v" -> {
                    out.println("FlowAudit Workflow Audit CLI v" + VERSION);
                    return EXIT_OK;
                }
                case "--summary" -> summary = true;
                case "--compact" -> compact = true;
                case "--directory", "--fail-under" -> {
                    if (i + 1 >= args.length) {
                        err.println("Error: " + arg + " requires a value");
                        return EXIT_USAGE;
                    }
                    String value = args[++i];
                    if (arg.equals("--directory")) {
                        directory = value;
                    } else if (!parseFailUnder(value)) {
                        return EXIT_USAGE;
                    }
                }
                default -> {
                    if (arg.startsWith("--")) {
                        err.println("Error: Unknown option " + arg);
                        return EXIT_USAGE;
                    }
                    files.add(arg);
                }
            }
        }

        if (directory != null) {
            if (!files.isEmpty()) {
                err.println("Error: --directory cannot be combined with file arguments");
                return EXIT_USAGE;
            }
            return auditDirectory(directory);
        }

        if (files.isEmpty()) {
            err.println("Error: No files to audit");
            return EXIT_USAGE;
        }
        return auditFiles(files.stream().map(Paths::get).toList());
    }

    private boolean parseFailUnder(String value) {
        try {
            int threshold = Integer.parseInt(value.trim());
            if (threshold < 0 || threshold > 100) {
                err.println("Error: --fail-under must be between 0 and 100, got " + threshold);
                return false;
            }
            failUnder = threshold;
            return true;
        } catch (NumberFormatException e) {
            err.println("Error: --fail-under requires an integer, got '" + value + "'");
            return false;
        }
    }

    private int auditDirectory(String directoryPath) throws IOException {
        Path dir = Paths.get(directoryPath);

        if (!Files.exists(dir)) {
            err.println("Error: Directory does not exist: " + directoryPath);
            return EXIT_IO_ERROR;
        }

        if (!Files.isDirectory(dir)) {
            err.println("Error: Path is not a directory: " + directoryPath);
            return EXIT_IO_ERROR;
        }

        List<Path> workflowFiles;
        try (Stream<Path> paths = Files.walk(dir)) {
            workflowFiles = paths
                    .filter(Files::isRegularFile)
                    .filter(WorkflowAuditCLI::isWorkflowFile)
                    .sorted()
                    .toList();
        }

        if (workflowFiles.isEmpty()) {
            err.println("No workflow files found in directory: " + directoryPath);
            return EXIT_OK;
        }

        logger.info("Auditing {} workflow files in {}", workflowFiles.size(), directoryPath);
        return auditFiles(workflowFiles);
    }

    private int auditFiles(List<Path> paths) {
        WorkflowDocumentReader reader = new WorkflowDocumentReader();
        WorkflowAnalyzer analyzer = new WorkflowAnalyzer(configuration);
        AnalysisResultWriter writer = new AnalysisResultWriter(!compact);

        int errorFiles = 0;
        int belowThreshold = 0;

        for (Path path : paths) {
            long start = System.nanoTime();
            if (!Files.isRegularFile(path)) {
                err.println("✗ " + path + " - Error: File does not exist");
                metrics.recordFailure("not_found");
                errorFiles++;
                continue;
            }
            try {
                WorkflowDocument document = reader.read(path);
                AnalysisResult result = analyzer.analyze(document);
                metrics.recordAnalysis(result, (System.nanoTime() - start) / 1_000_000_000.0);

                if (summary) {
                    out.println(summaryLine(path, result));
                } else {
                    out.println(writer.write(result));
                }
                if (result.getHealthScore() < failUnder) {
                    belowThreshold++;
                }
            } catch (WorkflowDocumentException e) {
                logger.debug("Unable to read {}", path, e);
                err.println("✗ " + path + " - Error: " + e.getMessage());
                metrics.recordFailure("unreadable");
                errorFiles++;
            }
        }

        if (summary) {
            out.println();
            out.println("=".repeat(60));
            out.println("AUDIT SUMMARY");
            out.println("=".repeat(60));
            out.println("Total files:      " + paths.size());
            out.println("Analyzed files:   " + (paths.size() - errorFiles));
            out.println("Below threshold:  " + belowThreshold);
            out.println("Error files:      " + errorFiles);
        }

        if (errorFiles > 0) {
            return EXIT_IO_ERROR;
        } else if (belowThreshold > 0) {
            return EXIT_BELOW_THRESHOLD;
        } else {
            return EXIT_OK;
        }
    }

    static String summaryLine(Path path, AnalysisResult result) {
        return String.format(Locale.ROOT, "%s: %d/100 %s (%d critical, %d high, %d medium, %d low)",
                path, result.getHealthScore(), result.getGrade().getLabel(),
                result.getIssuesSummary().critical(), result.getIssuesSummary().high(),
                result.getIssuesSummary().medium(), result.getIssuesSummary().low());
    }

    static boolean isWorkflowFile(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".json") || name.endsWith(".yaml") || name.endsWith(".yml");
    }
}
