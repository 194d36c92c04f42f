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
 * Grade bands over the health score.
 */
public enum HealthGrade {

    EXCELLENT("Excellent", 90),
    GOOD("Good", 70),
    NEEDS_ATTENTION("Needs Attention", 50),
    HIGH_RISK("High Risk", 30),
    CRITICAL("Critical", 0);

    private final String label;
    private final int minimumScore;

    HealthGrade(String label, int minimumScore) {
        this.label = label;
        this.minimumScore = minimumScore;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public int getMinimumScore() {
        return minimumScore;
    }

    public static HealthGrade fromScore(int score) {
        for (HealthGrade grade : values()) {
            if (score >= grade.minimumScore) {
                return grade;
            }
        }
        return CRITICAL;
    }
}
