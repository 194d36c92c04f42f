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
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.mars.flowaudit.core.AnalysisResult;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.Objects;

/**
 * Serializes analysis results to JSON with ISO-8601 timestamps.
 */
public class AnalysisResultWriter {

    private final ObjectMapper objectMapper;
    private final boolean pretty;

    public AnalysisResultWriter() {
        this(true);
    }

    public AnalysisResultWriter(boolean pretty) {
        this.objectMapper = createObjectMapper();
        this.pretty = pretty;
    }

    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    public String write(AnalysisResult result) {
        Objects.requireNonNull(result, "Result cannot be null");
        try {
            return pretty
                    ? objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(result)
                    : objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize analysis result", e);
        }
    }

    public void write(AnalysisResult result, Writer writer) throws IOException {
        Objects.requireNonNull(writer, "Writer cannot be null");
        writer.write(write(result));
        writer.write(System.lineSeparator());
        writer.flush();
    }

    public JsonNode toTree(AnalysisResult result) {
        Objects.requireNonNull(result, "Result cannot be null");
        return objectMapper.valueToTree(result);
    }
}
