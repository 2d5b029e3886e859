package me.golemcore.mind.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import java.util.Locale;
import java.util.Map;

/**
 * Closed set of learning categories. Free-form labels coming from the
 * extraction backend are normalized with {@link #fromLabel(String)}.
 */
public enum LearningCategory {
    PREFERENCE, HABIT, RELATIONSHIP, WORK_PATTERN, HEALTH, INTEREST, ROUTINE, COMMUNICATION, DECISION_STYLE, VALUE, GOAL, SKILL, OTHER;

    private static final Map<String, LearningCategory> ALIASES = Map.ofEntries(
            Map.entry("pref", PREFERENCE),
            Map.entry("like", PREFERENCE),
            Map.entry("dislike", PREFERENCE),
            Map.entry("rel", RELATIONSHIP),
            Map.entry("social", RELATIONSHIP),
            Map.entry("work", WORK_PATTERN),
            Map.entry("professional", WORK_PATTERN),
            Map.entry("wellness", HEALTH),
            Map.entry("fitness", HEALTH),
            Map.entry("hobby", INTEREST),
            Map.entry("passion", INTEREST),
            Map.entry("comm", COMMUNICATION),
            Map.entry("decision", DECISION_STYLE),
            Map.entry("belief", VALUE),
            Map.entry("principle", VALUE),
            Map.entry("aspiration", GOAL),
            Map.entry("objective", GOAL),
            Map.entry("ability", SKILL),
            Map.entry("expertise", SKILL));

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static LearningCategory fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return OTHER;
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        for (LearningCategory category : values()) {
            if (category.value().equals(normalized)) {
                return category;
            }
        }
        return ALIASES.getOrDefault(normalized, OTHER);
    }
}
