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
 * Input for creating a belief. A source memory or learning, when given, is
 * linked as the first piece of evidence.
 */
@Value
@Builder
public class NewBelief {

    public static final double DEFAULT_PRIOR = 0.5;

    String userId;
    String proposition;
    BeliefType beliefType;
    String domain;

    @Builder.Default
    double priorConfidence = DEFAULT_PRIOR;

    Instant validFrom;
    Instant validTo;
    Set<String> dependsOn;
    String derivedFromLearning;
    String sourceMemoryId;
    String sourceLearningId;
}
