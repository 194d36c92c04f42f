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

package dev.mars.flowaudit.core.exceptions;

/**
 * Exception thrown when a workflow document cannot be read into a JSON tree the analyzer accepts.
 *
 * <p>This covers unreadable files, malformed JSON or YAML and documents whose top level is a
 * scalar. Semantic problems inside a well-formed document are never reported this way; they become
 * issues of the analysis result.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-12
 * @version 1.0
 */
public class WorkflowDocumentException extends FlowAuditException {

    private final String source;
    private final int lineNumber;
    private final String fieldPath;

    public WorkflowDocumentException(String message) {
        this(null, -1, null, message, null);
    }

    public WorkflowDocumentException(String message, Throwable cause) {
        this(null, -1, null, message, cause);
    }

    public WorkflowDocumentException(String source, String message, Throwable cause) {
        this(source, -1, null, message, cause);
    }

    public WorkflowDocumentException(String source, int lineNumber, String fieldPath, String message,
                                     Throwable cause) {
        super(message, cause);
        this.source = source;
        this.lineNumber = lineNumber;
        this.fieldPath = fieldPath;
    }

    /**
     * File name or other description of where the document came from, may be null.
     */
    public String getSource() {
        return source;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public String getFieldPath() {
        return fieldPath;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();

        if (source != null) {
            sb.append("Document '").append(source).append("': ");
        }

        if (lineNumber > 0) {
            sb.append("Line ").append(lineNumber).append(": ");
        }

        if (fieldPath != null) {
            sb.append("Field '").append(fieldPath).append("': ");
        }

        sb.append(super.getMessage());

        return sb.toString();
    }
}
