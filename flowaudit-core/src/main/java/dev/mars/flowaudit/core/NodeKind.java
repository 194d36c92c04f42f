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

package dev.mars.flowaudit.core;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Closed set of node categories in a canonical workflow graph.
 *
 * <p>The kind is derived from a node's raw type through a fixed lookup table. Types that are
 * not in the table default to {@link #ACTION}, except that anything shaped like a trigger
 * ({@code *_trigger} or {@code trigger_*}) is classified as {@link #TRIGGER}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-12
 * @version 1.0
 */
public enum NodeKind {

    TRIGGER("trigger"),
    ACTION("action"),
    CONDITION("condition"),
    DELAY("delay");

    private static final Map<String, NodeKind> RAW_TYPE_TABLE = new HashMap<>();

    static {
        register(TRIGGER, Set.of(
                "trigger", "contact_tag_added", "contact_created", "contact_updated",
                "form_submit", "form_trigger", "webhook_received", "inbound_webhook",
                "appointment_booked", "opportunity_status_changed", "customer_replied",
                "birthday_reminder", "payment_received"));
        register(ACTION, Set.of(
                "action", "email", "send_email", "sms", "send_sms", "api", "custom_api",
                "http_request", "webhook", "webhook_call", "bulk_email", "bulk_sms",
                "payment", "charge", "stripe_payment", "add_tag", "remove_tag",
                "update_contact", "enrich", "lookup", "create_task", "create_opportunity",
                "assign_user", "add_to_campaign", "notification", "integration",
                "zapier", "make"));
        register(CONDITION, Set.of("condition", "if", "branch", "if_else"));
        register(DELAY, Set.of("delay", "wait"));
    }

    private final String label;

    NodeKind(String label) {
        this.label = label;
    }

    private static void register(NodeKind kind, Set<String> rawTypes) {
        for (String rawType : rawTypes) {
            RAW_TYPE_TABLE.put(rawType, kind);
        }
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * Derives the node kind for a raw type. Unknown types default to {@link #ACTION}.
     */
    public static NodeKind fromRawType(String rawType) {
        String normalized = RawTypes.normalize(rawType);
        NodeKind kind = RAW_TYPE_TABLE.get(normalized);
        if (kind != null) {
            return kind;
        }
        if (isTriggerShaped(normalized)) {
            return TRIGGER;
        }
        return ACTION;
    }

    /**
     * Whether the raw type is known to the lookup table, as opposed to defaulted.
     */
    public static boolean isRecognized(String rawType) {
        String normalized = RawTypes.normalize(rawType);
        return RAW_TYPE_TABLE.containsKey(normalized) || isTriggerShaped(normalized);
    }

    private static boolean isTriggerShaped(String normalized) {
        return normalized.endsWith("_trigger") || normalized.startsWith("trigger_");
    }
}
