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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Record of one action taken by the assistant, the sources that informed it
 * and the feedback later received.
 *
 * <p>
 * {@link #feedbackPropagated} flips to true exactly once, after the feedback
 * has been applied to the contributing learnings and beliefs.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Outcome {

    private String id;
    private String userId;

    private ActionType actionType;
    private String actionContent;

    @Builder.Default
    private Map<String, String> actionContext = new LinkedHashMap<>();
    private ReasoningTrace reasoningTrace;

    @Builder.Default
    private OutcomeSignal outcomeSignal = OutcomeSignal.UNKNOWN;
    private FeedbackSource feedbackSource;

    @Builder.Default
    private Map<String, String> outcomeDetails = new LinkedHashMap<>();

    private Instant actionAt;
    private Instant outcomeAt;

    private boolean feedbackPropagated;
    private Instant propagatedAt;

    @Builder.Default
    private List<OutcomeSource> sources = new ArrayList<>();

    private Instant createdAt;
    private Instant updatedAt;
}
