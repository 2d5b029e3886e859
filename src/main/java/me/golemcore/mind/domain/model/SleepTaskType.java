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

import java.util.List;
import java.util.Locale;

/**
 * Sleep compute tasks, declared in execution order.
 */
public enum SleepTaskType {
    FEEDBACK_PROPAGATION, LEARNING_EXTRACTION, BELIEF_FORMATION, CONFIDENCE_DECAY, CONFLICT_RESOLUTION, ARCHIVAL, SESSION_PREP;

    public static final List<SleepTaskType> EXECUTION_ORDER = List.of(values());

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
