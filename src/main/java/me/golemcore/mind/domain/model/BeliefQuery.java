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

import java.time.Instant;
import java.util.Set;

/**
 * Filter, ordering and paging options for belief listings.
 */
@Value
@Builder
public class BeliefQuery {

    public enum OrderBy {
        CONFIDENCE, CREATED_AT, UPDATED_AT
    }

    String userId;
    Set<BeliefStatus> statuses;
    Set<BeliefType> beliefTypes;
    String domain;
    Double minConfidence;
    Instant validAt;

    @Builder.Default
    int limit = 50;

    @Builder.Default
    int offset = 0;

    @Builder.Default
    OrderBy orderBy = OrderBy.CREATED_AT;

    @Builder.Default
    boolean descending = true;
}
