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

/**
 * Result of consolidating one extracted fact.
 *
 * @param replaceSuggested
 *            the incoming fact was materially more confident than the
 *            learning it reinforced; callers may supersede the wording
 */
public record ConsolidationResult(Action action, Learning learning, PendingLearningConflict conflict,
        boolean replaceSuggested, String error) {

    public enum Action {
        CREATED, REINFORCED, CONTRADICTED, FAILED
    }

    public static ConsolidationResult created(Learning learning) {
        return new ConsolidationResult(Action.CREATED, learning, null, false, null);
    }

    public static ConsolidationResult reinforced(Learning learning, boolean replaceSuggested) {
        return new ConsolidationResult(Action.REINFORCED, learning, null, replaceSuggested, null);
    }

    public static ConsolidationResult contradicted(PendingLearningConflict conflict) {
        return new ConsolidationResult(Action.CONTRADICTED, null, conflict, false, null);
    }

    public static ConsolidationResult failed(String error) {
        return new ConsolidationResult(Action.FAILED, null, null, false, error);
    }
}
