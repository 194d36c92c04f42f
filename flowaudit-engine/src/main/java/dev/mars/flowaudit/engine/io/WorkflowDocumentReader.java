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

package dev.mars.flowaudit.engine.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.flowaudit.core.document.WorkflowDocument;
import dev.mars.flowaudit.core.exceptions.WorkflowDocumentException;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.Mark;
import org.yaml.snakeyaml.error.MarkedYAMLException;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Reads workflow documents from JSON or YAML text.
 *
 * <p>YAML is loaded with SnakeYAML's safe constructor and converted to the same Jackson tree a
 * JSON document produces, so the analyzer never sees the difference. Only objects and arrays are
 * accepted at the top level; a bare scalar is rejected here rather than passed to the
 * analyzer.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-12
 * @version 1.0
 */
public class WorkflowDocumentReader {

    private final ObjectMapper objectMapper;
    private final Yaml yaml;

    public WorkflowDocumentReader() {
        this(new ObjectMapper());
    }

    public WorkflowDocumentReader(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "Object mapper cannot be null");
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new SafeConstructor(loaderOptions));
    }

    /**
     * Reads a file, choosing YAML for {@code .yaml}/{@code .yml} names and JSON otherwise.
     */
    public WorkflowDocument read(Path file) throws WorkflowDocumentException {
        Objects.requireNonNull(file, "File cannot be null");
        String content;
        try {
            content = Files.readString(file);
        } catch (IOException e) {
            throw new WorkflowDocumentException(file.toString(), "Failed to read workflow file", e);
        }
        String source = file.toString();
        return isYaml(file) ? readYaml(source, content) : readJson(source, content);
    }

    public WorkflowDocument readJson(String content) throws WorkflowDocumentException {
        return readJson(null, content);
    }

    public WorkflowDocument readYaml(String content) throws WorkflowDocumentException {
        return readYaml(null, content);
    }

    /**
     * Parses JSON text into a tree without classifying it.
     */
    public JsonNode readTree(String source, String content) throws WorkflowDocumentException {
        Objects.requireNonNull(content, "Content cannot be null");
        try {
            return requireContainer(source, objectMapper.readTree(content));
        } catch (JsonProcessingException e) {
            int line = e.getLocation() != null ? e.getLocation().getLineNr() : -1;
            throw new WorkflowDocumentException(source, line, null,
                    "Malformed JSON: " + e.getOriginalMessage(), e);
        }
    }

    private WorkflowDocument readJson(String source, String content) throws WorkflowDocumentException {
        return WorkflowDocument.of(readTree(source, content));
    }

    private WorkflowDocument readYaml(String source, String content) throws WorkflowDocumentException {
        Objects.requireNonNull(content, "Content cannot be null");
        Object data;
        try {
            data = yaml.load(content);
        } catch (MarkedYAMLException e) {
            Mark mark = e.getProblemMark();
            int line = mark != null ? mark.getLine() + 1 : -1;
            throw new WorkflowDocumentException(source, line, null, "Malformed YAML: " + e.getProblem(), e);
        } catch (YAMLException e) {
            throw new WorkflowDocumentException(source, "Malformed YAML: " + e.getMessage(), e);
        }
        JsonNode tree;
        try {
            tree = objectMapper.valueToTree(data);
        } catch (IllegalArgumentException e) {
            throw new WorkflowDocumentException(source, "YAML content cannot be represented as JSON", e);
        }
        return WorkflowDocument.of(requireContainer(source, tree));
    }

    private static JsonNode requireContainer(String source, JsonNode tree) throws WorkflowDocumentException {
        if (tree == null || tree.isMissingNode() || tree.isNull()) {
            throw new WorkflowDocumentException(source, -1, "$", "Document is empty", null);
        }
        if (!tree.isContainerNode()) {
            throw new WorkflowDocumentException(source, -1, "$",
                    "Top-level value must be an object or array, found " + tree.getNodeType(), null);
        }
        return tree;
    }

    static boolean isYaml(Path file) {
        Path name = file.getFileName();
        if (name == null) {
            return false;
        }
        String lower = name.toString().toLowerCase(Locale.ROOT);
        return lower.endsWith(".yaml") || lower.endsWith(".yml");
    }
}
