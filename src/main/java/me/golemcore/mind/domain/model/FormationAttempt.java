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

/**
 * Result of forming a belief from one learning: either the new belief with
 * the conflicts detected on the way, or the reason nothing was created.
 */
public record FormationAttempt(Belief belief, String skipReason, List<BeliefConflict> conflicts) {

    public static FormationAttempt formed(Belief belief, List<BeliefConflict> conflicts) {
        return new FormationAttempt(belief, null, List.copyOf(conflicts));
    }

    public static FormationAttempt skipped(String reason) {
        return new FormationAttempt(null, reason, List.of());
    }

    public boolean isFormed() {
        return belief != null;
    }
}
