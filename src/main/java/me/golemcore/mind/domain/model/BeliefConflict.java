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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Pairing of two beliefs that cannot both hold. The pair is stored in sorted
 * order; at most one unresolved record exists per pair. {@code beliefBId} is
 * null while the second belief is still being formed.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BeliefConflict {

    public enum Type {
        CONTRADICTION, OVERLAP, TEMPORAL
    }

    private String id;
    private String userId;
    private String beliefAId;
    private String beliefBId;
    private Type conflictType;
    private String description;
    private boolean resolved;
    private boolean escalated;
    private String resolution;
    private String winnerId;
    private Instant createdAt;
    private Instant resolvedAt;

    @JsonIgnore
    public boolean isPending() {
        return beliefAId == null || beliefBId == null;
    }

    public boolean involves(String beliefId) {
        return beliefId != null && (beliefId.equals(beliefAId) || beliefId.equals(beliefBId));
    }
}
