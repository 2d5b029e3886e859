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

import lombok.Builder;
import lombok.Value;

/**
 * Filter and paging options for learning listings. Results are ordered by
 * confidence, then by last reinforcement, both descending.
 */
@Value
@Builder
public class LearningQuery {

    @Builder.Default
    LearningStatus status = LearningStatus.ACTIVE;
    LearningCategory category;
    Strength strength;
    Double minConfidence;

    @Builder.Default
    int limit = 50;

    @Builder.Default
    int offset = 0;
}
