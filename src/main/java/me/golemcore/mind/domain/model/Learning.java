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

/**
 * A confidence-weighted statement about the user derived from observed
 * evidence ("User prefers morning meetings").
 *
 * <p>
 * {@link #strength} is always the value of
 * {@code ConfidenceModel.learningStrength(confidence, evidenceCount)} at the
 * time of the last write.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Learning {

    public static final String DEFAULT_CONTAINER = "default";

    private String id;
    private String userId;

    @Builder.Default
    private String containerTag = DEFAULT_CONTAINER;

    private LearningCategory category;
    private String statement;
    private String reasoning;

    private Strength strength;
    private double confidence;
    private int evidenceCount;

    @Builder.Default
    private LearningStatus status = LearningStatus.ACTIVE;
    private String invalidatedBy;
    private String supersededBy;

    private Instant firstObserved;
    private Instant lastReinforced;
    private Instant validFrom;
    private Instant validTo;
    private Instant createdAt;
    private Instant updatedAt;
}
