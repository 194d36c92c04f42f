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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.flowaudit.core.CanonicalGraph;
import dev.mars.flowaudit.core.config.FlowAuditConfiguration;
import dev.mars.flowaudit.core.document.WorkflowDocument;
import dev.mars.flowaudit.engine.graph.GraphAnalyzer;
import dev.mars.flowaudit.engine.normalize.WorkflowNormalizer;
import dev.mars.flowaudit.engine.rules.RuleContext;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * Shared helpers for building documents and rule contexts in tests.
 */
public final class WorkflowFixtures {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private WorkflowFixtures() {
    }

    public static JsonNode json(String text) {
        try {
            return MAPPER.readTree(text);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Bad test JSON: " + text, e);
        }
    }

    public static WorkflowDocument document(String text) {
        return WorkflowDocument.of(json(text));
    }

    /**
     * Loads a document from {@code src/test/resources/workflows}.
     */
    public static JsonNode resource(String name) {
        try (InputStream input = WorkflowFixtures.class.getResourceAsStream("/workflows/" + name)) {
            if (input == null) {
                throw new IllegalArgumentException("Missing test resource: " + name);
            }
            return MAPPER.readTree(input);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static CanonicalGraph graph(String text) {
        return new WorkflowNormalizer().normalize(document(text));
    }

    public static RuleContext context(String text) {
        return context(text, FlowAuditConfiguration.defaults());
    }

    public static RuleContext context(String text, FlowAuditConfiguration configuration) {
        WorkflowDocument document = document(text);
        CanonicalGraph graph = new WorkflowNormalizer().normalize(document);
        return new RuleContext(document, graph, new GraphAnalyzer().analyze(graph), configuration);
    }
}
