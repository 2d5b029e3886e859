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
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Input for recording a new outcome together with its sources.
 */
@Value
@Builder
public class RecordOutcomeRequest {

    String userId;
    ActionType actionType;
    String actionContent;
    Map<String, String> actionContext;
    ReasoningTrace reasoningTrace;

    @Singular
    List<SourceRef> sources;

    /**
     * Source reference; a null weight means
     * {@link OutcomeSource#DEFAULT_WEIGHT}.
     */
    public record SourceRef(SourceType sourceType, String sourceId, Double contributionWeight) {

        public static SourceRef of(SourceType sourceType, String sourceId) {
            return new SourceRef(sourceType, sourceId, null);
        }
    }
}
