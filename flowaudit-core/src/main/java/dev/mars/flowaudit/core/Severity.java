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

/**
 * Issue severity with its fixed health score penalty.
 *
 * <p>The penalties are part of the published scoring contract:
 * {@code score = 100 - (critical*25 + high*15 + medium*5 + low*2)}, clamped to 0..100.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-12
 * @version 1.0
 */
public enum Severity {

    CRITICAL("critical", 25),
    HIGH("high", 15),
    MEDIUM("medium", 5),
    LOW("low", 2);

    private final String label;
    private final int penalty;

    Severity(String label, int penalty) {
        this.label = label;
        this.penalty = penalty;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public int getPenalty() {
        return penalty;
    }
}
