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
 * Verdict of comparing a candidate proposition with an existing belief.
 */
public record ConflictCheck(Verdict verdict, BeliefConflict.Type conflictType, String description, double overlap) {

    public enum Verdict {
        NONE, DUPLICATE, CONFLICT
    }

    public static ConflictCheck none(double overlap) {
        return new ConflictCheck(Verdict.NONE, null, "", overlap);
    }

    public static ConflictCheck duplicate(double overlap) {
        return new ConflictCheck(Verdict.DUPLICATE, BeliefConflict.Type.OVERLAP, "Near-duplicate proposition",
                overlap);
    }

    public static ConflictCheck conflict(BeliefConflict.Type type, String description, double overlap) {
        return new ConflictCheck(Verdict.CONFLICT, type, description, overlap);
    }

    public boolean isDuplicate() {
        return verdict == Verdict.DUPLICATE;
    }

    public boolean isConflict() {
        return verdict == Verdict.CONFLICT;
    }
}
