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

import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Capability table for action types, consulted by every rule that needs to know what an
 * action does. Keeping the type sets here means the rules cannot drift apart on which types
 * count as external calls, rate limited sends and so on.
 *
 * <p>Lookups are made on the normalized raw type (see {@link RawTypes}). Integration
 * actions are also matched structurally: any type containing {@code integration} or
 * {@code connect} is an integration.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-12
 * @version 1.0
 */
public final class ActionCapabilities {

    /**
     * What an action type is known to do.
     */
    public enum Capability {
        /** Calls a service outside the platform. */
        EXTERNAL_CALL,
        /** Subject to provider send or request limits. */
        RATE_LIMITED,
        /** Can hang on a slow remote and should carry a timeout. */
        NEEDS_TIMEOUT,
        /** Failure loses business value and should have a fallback path. */
        NEEDS_FALLBACK,
        /** Charges a customer. */
        PAYMENT,
        /** Requires an endpoint URL and optionally credentials. */
        API_ENDPOINT,
        /** Posts to a configured webhook URL. */
        WEBHOOK_CALL,
        /** Sends to many recipients at once. */
        BULK,
        /** Sends an email to a single recipient. */
        EMAIL,
        /** Sends a text message to a single recipient. */
        SMS,
        /** Populates contact data that later sends may rely on. */
        ENRICHES_DATA,
        /** Enrichment steps that are worth moving before communications. */
        ENRICHES_DATA_LATE,
        /** Depends on a connected third-party integration. */
        INTEGRATION
    }

    private static final Map<String, Set<Capability>> TABLE = new HashMap<>();

    static {
        grant(Capability.EXTERNAL_CALL, "api", "webhook", "http_request", "webhook_call",
                "integration", "custom_api", "zapier", "make");
        grant(Capability.RATE_LIMITED, "email", "sms", "api", "webhook", "bulk_email", "bulk_sms");
        grant(Capability.NEEDS_TIMEOUT, "webhook", "api", "http_request", "webhook_call", "integration");
        grant(Capability.NEEDS_FALLBACK, "payment", "charge", "api", "webhook", "integration");
        grant(Capability.PAYMENT, "payment", "charge", "stripe_payment");
        grant(Capability.API_ENDPOINT, "api", "http_request", "custom_api");
        grant(Capability.WEBHOOK_CALL, "webhook", "webhook_call");
        grant(Capability.BULK, "bulk_email", "bulk_sms");
        grant(Capability.EMAIL, "email", "send_email");
        grant(Capability.SMS, "sms", "send_sms");
        grant(Capability.ENRICHES_DATA, "update_contact", "enrich", "api", "lookup");
        grant(Capability.ENRICHES_DATA_LATE, "update_contact", "enrich");
    }

    private ActionCapabilities() {
    }

    private static void grant(Capability capability, String... rawTypes) {
        for (String rawType : rawTypes) {
            TABLE.computeIfAbsent(rawType, k -> EnumSet.noneOf(Capability.class)).add(capability);
        }
    }

    /**
     * Returns the capabilities of a raw type; empty for unknown types.
     */
    public static Set<Capability> of(String rawType) {
        String normalized = RawTypes.normalize(rawType);
        Set<Capability> granted = TABLE.get(normalized);
        EnumSet<Capability> result = granted == null
                ? EnumSet.noneOf(Capability.class)
                : EnumSet.copyOf(granted);
        if (normalized.contains("integration") || normalized.contains("connect")) {
            result.add(Capability.INTEGRATION);
        }
        return Collections.unmodifiableSet(result);
    }

    public static boolean has(String rawType, Capability capability) {
        return of(rawType).contains(capability);
    }
}
