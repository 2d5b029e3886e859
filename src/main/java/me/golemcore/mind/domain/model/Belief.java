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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Higher-order proposition consolidated from one or more learnings, tracked
 * with a Bayesian confidence history.
 *
 * <p>
 * {@link #currentConfidence} always equals the confidence of the last entry in
 * {@link #confidenceHistory}. {@link #dependsOn} references other beliefs of
 * the same owner and never forms a cycle.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Belief {

    private String id;
    private String userId;
    private String proposition;
    private BeliefType beliefType;
    private String domain;

    private double priorConfidence;
    private double currentConfidence;

    @Builder.Default
    private List<ConfidenceHistoryEntry> confidenceHistory = new ArrayList<>();

    private int supportingCount;
    private int contradictingCount;

    private Instant validFrom;
    private Instant validTo;

    @Builder.Default
    private Set<String> dependsOn = new LinkedHashSet<>();

    private String derivedFromLearning;

    @Builder.Default
    private BeliefStatus status = BeliefStatus.ACTIVE;
    private String supersededBy;
    private String invalidationReason;

    private Instant lastReinforcedAt;
    private Instant createdAt;
    private Instant updatedAt;

    public boolean isValidAt(Instant instant) {
        return (validFrom == null || !validFrom.isAfter(instant))
                && (validTo == null || !validTo.isBefore(instant));
    }
}
