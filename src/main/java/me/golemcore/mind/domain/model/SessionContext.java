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
import java.util.List;

/**
 * Denormalized snapshot prepared at the end of each sleep job for fast reads
 * at the start of the next session. Replaced wholesale on every run.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SessionContext {

    private String userId;
    private String jobId;
    private Instant generatedAt;
    private Instant expiresAt;

    @Builder.Default
    private List<BeliefSummary> topBeliefs = new ArrayList<>();

    @Builder.Default
    private List<LearningSummary> topLearnings = new ArrayList<>();

    private OutcomeSummary recentOutcomes;
    private PendingItems pendingItems;

    public boolean isExpiredAt(Instant instant) {
        return expiresAt != null && !expiresAt.isAfter(instant);
    }

    public record BeliefSummary(String id, String proposition, double confidence, String domain) {
    }

    public record LearningSummary(String id, String statement, double confidence, LearningCategory category) {
    }

    public record OutcomeSummary(int total, double positiveRate, List<String> topEffectiveSources) {
    }

    public record PendingItems(int unresolvedConflicts, int weakenedBeliefs, int uncertainLearnings) {
    }
}
