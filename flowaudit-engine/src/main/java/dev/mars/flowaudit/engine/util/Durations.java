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

package dev.mars.flowaudit.engine.util;

import com.fasterxml.jackson.databind.JsonNode;
import dev.mars.flowaudit.core.document.JsonFields;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsing and formatting of wait durations as workflow platforms write them.
 *
 * <p>A number is a count of seconds. A string is searched for the first {@code <digits><unit>}
 * token with unit {@code s}, {@code m}, {@code h} or {@code d}, so {@code "2h"} and
 * {@code "wait 30m"} both parse. Anything else is zero.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-12
 * @version 1.0
 */
public final class Durations {

    private static final Pattern DURATION = Pattern.compile("(\\d+)(s|m|h|d)");

    public static final long MINUTE = 60;
    public static final long HOUR = 60 * MINUTE;
    public static final long DAY = 24 * HOUR;

    private Durations() {
    }

    /**
     * Wait length of a delay step: {@code config.delay}, or {@code config.duration} when the
     * former is absent or falsy.
     */
    public static double delaySeconds(JsonNode config) {
        if (JsonFields.isTruthy(config, "delay")) {
            return parseSeconds(config.get("delay"));
        }
        return JsonFields.at(config, "duration").map(Durations::parseSeconds).orElse(0.0);
    }

    public static double parseSeconds(JsonNode value) {
        if (value == null) {
            return 0;
        }
        if (value.isNumber()) {
            return Math.max(0, value.doubleValue());
        }
        if (value.isTextual()) {
            return parseSeconds(value.textValue());
        }
        return 0;
    }

    public static double parseSeconds(String value) {
        if (value == null || value.isEmpty()) {
            return 0;
        }
        Matcher matcher = DURATION.matcher(value);
        if (!matcher.find()) {
            return 0;
        }
        double amount = Double.parseDouble(matcher.group(1));
        return switch (matcher.group(2)) {
            case "s" -> amount;
            case "m" -> amount * MINUTE;
            case "h" -> amount * HOUR;
            default -> amount * DAY;
        };
    }

    /**
     * Formats seconds with one decimal in the largest unit below the next one up, e.g.
     * {@code 45.0s}, {@code 2.5m}, {@code 1.0h}, {@code 8.0d}.
     */
    public static String format(double seconds) {
        if (seconds < MINUTE) {
            return String.format(Locale.ROOT, "%.1fs", seconds);
        }
        if (seconds < HOUR) {
            return String.format(Locale.ROOT, "%.1fm", seconds / MINUTE);
        }
        if (seconds < DAY) {
            return String.format(Locale.ROOT, "%.1fh", seconds / HOUR);
        }
        return String.format(Locale.ROOT, "%.1fd", seconds / DAY);
    }
}
