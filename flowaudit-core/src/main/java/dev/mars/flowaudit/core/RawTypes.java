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

import java.util.Locale;
import java.util.Map;

/**
 * Normalizes free-form node and action type names to the internal snake_case vocabulary.
 *
 * <p>The automation platform reports built-in steps using PascalCase names (for example
 * {@code SendEmail} or {@code IfElse}), while hand-written and exported definitions use
 * lower-case tags such as {@code email} or {@code condition}. Every lookup table in the
 * analyzer is keyed by the normalized form, so callers never need to care which spelling a
 * document used.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-12
 * @version 1.0
 */
public final class RawTypes {

    private static final Map<String, String> PLATFORM_NAMES = Map.ofEntries(
            Map.entry("SendEmail", "email"),
            Map.entry("SendSMS", "sms"),
            Map.entry("CustomWebhook", "webhook"),
            Map.entry("ChargeCustomer", "payment"),
            Map.entry("AddTag", "add_tag"),
            Map.entry("RemoveTag", "remove_tag"),
            Map.entry("UpdateContact", "update_contact"),
            Map.entry("CreateTask", "create_task"),
            Map.entry("CreateOpportunity", "create_opportunity"),
            Map.entry("AssignToUser", "assign_user"),
            Map.entry("Wait", "wait"),
            Map.entry("IfElse", "condition"),
            Map.entry("AddToCampaign", "add_to_campaign"),
            Map.entry("SendNotification", "notification"),
            Map.entry("FormSubmitted", "form_submit"),
            Map.entry("ContactCreated", "contact_created"),
            Map.entry("ContactUpdated", "contact_updated"),
            Map.entry("TagAdded", "contact_tag_added")
    );

    private RawTypes() {
    }

    /**
     * Returns the normalized form of a raw type. Never returns null; a missing type
     * normalizes to the empty string.
     *
     * @param rawType the type as it appears in the document, may be null
     * @return the normalized lower-case type
     */
    public static String normalize(String rawType) {
        if (rawType == null) {
            return "";
        }
        String trimmed = rawType.trim();
        String platformName = PLATFORM_NAMES.get(trimmed);
        if (platformName != null) {
            return platformName;
        }
        return trimmed.toLowerCase(Locale.ROOT);
    }
}
