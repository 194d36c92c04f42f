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

package dev.mars.flowaudit.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Properties;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Tunable thresholds of the analyzer and its command line front end.
 *
 * <p>Values come from built-in defaults, then an optional {@code flowaudit.properties} file (the
 * first one found in the working directory, {@code config/}, {@code ~/.flowaudit/},
 * {@code /etc/flowaudit/}, or else the classpath), then any {@code flowaudit.*} system property.
 * Severity weights and grade bands are fixed and deliberately not configurable.</p>
 *
 * <p>Instances are immutable once constructed and may be shared between threads.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-12
 * @version 1.0
 */
public class FlowAuditConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(FlowAuditConfiguration.class);

    public static final String LONG_CHAIN_THRESHOLD = "flowaudit.rules.long-chain.threshold";
    public static final String EXCESSIVE_WAIT_SECONDS = "flowaudit.rules.excessive-wait.seconds";
    public static final String MAX_BRANCHES = "flowaudit.rules.complexity.max-branches";
    public static final String DISABLED_RULES = "flowaudit.rules.disabled";
    public static final String BOTTLENECK_LIMIT = "flowaudit.performance.bottleneck.limit";
    public static final String BOTTLENECK_DELAY_SECONDS = "flowaudit.performance.bottleneck.delay.seconds";
    public static final String MEDIUM_ISSUE_THRESHOLD = "flowaudit.recommendations.medium.threshold";
    public static final String DECOMPOSITION_NODES = "flowaudit.recommendations.decomposition.nodes";
    public static final String CLI_FAIL_UNDER = "flowaudit.cli.fail-under";

    // Default configuration values
    private static final int DEFAULT_LONG_CHAIN_THRESHOLD = 10;
    private static final long DEFAULT_EXCESSIVE_WAIT_SECONDS = 7L * 24 * 60 * 60;
    private static final int DEFAULT_MAX_BRANCHES = 20;
    private static final int DEFAULT_BOTTLENECK_LIMIT = 5;
    private static final long DEFAULT_BOTTLENECK_DELAY_SECONDS = 60;
    private static final int DEFAULT_MEDIUM_ISSUE_THRESHOLD = 5;
    private static final int DEFAULT_DECOMPOSITION_NODES = 30;
    private static final int DEFAULT_CLI_FAIL_UNDER = 0;

    private static final String PREFIX = "flowaudit.";
    private static final String FILE_NAME = "flowaudit.properties";

    private final Properties properties;

    /**
     * Loads defaults, the first configuration file found and system property overrides.
     */
    public FlowAuditConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }

    /**
     * Builds a configuration from defaults overlaid with the given properties only.
     */
    public FlowAuditConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    /**
     * Built-in defaults, ignoring files and system properties.
     */
    public static FlowAuditConfiguration defaults() {
        return new FlowAuditConfiguration(null);
    }

    // Rule thresholds
    public int getLongChainThreshold() {
        return getIntProperty(LONG_CHAIN_THRESHOLD, DEFAULT_LONG_CHAIN_THRESHOLD);
    }

    public long getExcessiveWaitSeconds() {
        return getLongProperty(EXCESSIVE_WAIT_SECONDS, DEFAULT_EXCESSIVE_WAIT_SECONDS);
    }

    public int getMaxBranches() {
        return getIntProperty(MAX_BRANCHES, DEFAULT_MAX_BRANCHES);
    }

    /**
     * Ids of rules to skip, from a comma separated list.
     */
    public Set<String> getDisabledRules() {
        String value = properties.getProperty(DISABLED_RULES, "");
        if (value.isBlank()) {
            return Collections.emptySet();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(id -> !id.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    // Performance estimate
    public int getBottleneckLimit() {
        return getIntProperty(BOTTLENECK_LIMIT, DEFAULT_BOTTLENECK_LIMIT);
    }

    public long getBottleneckDelaySeconds() {
        return getLongProperty(BOTTLENECK_DELAY_SECONDS, DEFAULT_BOTTLENECK_DELAY_SECONDS);
    }

    // Recommendations
    public int getMediumIssueThreshold() {
        return getIntProperty(MEDIUM_ISSUE_THRESHOLD, DEFAULT_MEDIUM_ISSUE_THRESHOLD);
    }

    public int getDecompositionNodeThreshold() {
        return getIntProperty(DECOMPOSITION_NODES, DEFAULT_DECOMPOSITION_NODES);
    }

    // Command line
    public int getCliFailUnder() {
        return getIntProperty(CLI_FAIL_UNDER, DEFAULT_CLI_FAIL_UNDER);
    }

    // Generic property access
    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    public String getProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    private int getIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid integer value for property {}: {}. Using default: {}",
                        key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private long getLongProperty(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid long value for property {}: {}. Using default: {}",
                        key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private void loadDefaultConfiguration() {
        properties.setProperty(LONG_CHAIN_THRESHOLD, String.valueOf(DEFAULT_LONG_CHAIN_THRESHOLD));
        properties.setProperty(EXCESSIVE_WAIT_SECONDS, String.valueOf(DEFAULT_EXCESSIVE_WAIT_SECONDS));
        properties.setProperty(MAX_BRANCHES, String.valueOf(DEFAULT_MAX_BRANCHES));
        properties.setProperty(DISABLED_RULES, "");
        properties.setProperty(BOTTLENECK_LIMIT, String.valueOf(DEFAULT_BOTTLENECK_LIMIT));
        properties.setProperty(BOTTLENECK_DELAY_SECONDS, String.valueOf(DEFAULT_BOTTLENECK_DELAY_SECONDS));
        properties.setProperty(MEDIUM_ISSUE_THRESHOLD, String.valueOf(DEFAULT_MEDIUM_ISSUE_THRESHOLD));
        properties.setProperty(DECOMPOSITION_NODES, String.valueOf(DEFAULT_DECOMPOSITION_NODES));
        properties.setProperty(CLI_FAIL_UNDER, String.valueOf(DEFAULT_CLI_FAIL_UNDER));
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                FILE_NAME,
                "config/" + FILE_NAME,
                System.getProperty("user.home") + "/.flowaudit/" + FILE_NAME,
                "/etc/flowaudit/" + FILE_NAME
        };

        for (String configFile : configFiles) {
            Path configPath = Paths.get(configFile);
            if (Files.exists(configPath) && Files.isReadable(configPath)) {
                try (InputStream input = Files.newInputStream(configPath)) {
                    properties.load(input);
                    logger.info("Loaded configuration from: {}", configPath);
                    return;
                } catch (IOException e) {
                    logger.warn("Failed to load configuration from {}: {}", configPath, e.getMessage());
                }
            }
        }

        try (InputStream input = getClass().getClassLoader().getResourceAsStream(FILE_NAME)) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from classpath");
            }
        } catch (IOException e) {
            logger.warn("Failed to load configuration from classpath: {}", e.getMessage());
        }
    }

    private void loadConfigurationFromSystemProperties() {
        System.getProperties().entrySet().stream()
                .filter(entry -> entry.getKey().toString().startsWith(PREFIX))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.debug("Override from system property: {}={}", entry.getKey(), entry.getValue());
                });
    }

    @Override
    public String toString() {
        return "FlowAuditConfiguration{" +
                "longChainThreshold=" + getLongChainThreshold() +
                ", excessiveWaitSeconds=" + getExcessiveWaitSeconds() +
                ", maxBranches=" + getMaxBranches() +
                ", disabledRules=" + getDisabledRules() +
                '}';
    }
}
