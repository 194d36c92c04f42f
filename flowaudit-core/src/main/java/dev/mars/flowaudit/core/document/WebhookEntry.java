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

package dev.mars.flowaudit.core.document;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * One entry of a document's top-level {@code webhooks[]} array.
 *
 * @param id webhook id, synthesized as {@code webhook_{index}} when absent
 * @param name webhook name, may be null
 * @param url destination URL from {@code url} or {@code config.url}, may be null
 */
public record WebhookEntry(String id, String name, String url) {

    static WebhookEntry of(int index, JsonNode raw) {
        String url = JsonFields.firstText(raw, "url")
                .or(() -> JsonFields.text(raw, "config", "url").filter(v -> !v.isEmpty()))
                .orElse(null);
        return new WebhookEntry(
                JsonFields.firstText(raw, "id").orElse("webhook_" + index),
                JsonFields.firstText(raw, "name").orElse(null),
                url);
    }

    public Optional<String> urlValue() {
        return Optional.ofNullable(url);
    }

    public String displayName() {
        return name != null ? name : id;
    }
}
