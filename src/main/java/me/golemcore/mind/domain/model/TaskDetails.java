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
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Typed per-task counters recorded on a {@link TaskResult}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = TaskDetails.FeedbackPropagation.class, name = "feedback_propagation"),
        @JsonSubTypes.Type(value = TaskDetails.LearningExtraction.class, name = "learning_extraction"),
        @JsonSubTypes.Type(value = TaskDetails.BeliefFormation.class, name = "belief_formation"),
        @JsonSubTypes.Type(value = TaskDetails.ConfidenceDecay.class, name = "confidence_decay"),
        @JsonSubTypes.Type(value = TaskDetails.ConflictResolution.class, name = "conflict_resolution"),
        @JsonSubTypes.Type(value = TaskDetails.Archival.class, name = "archival"),
        @JsonSubTypes.Type(value = TaskDetails.SessionPrep.class, name = "session_prep"),
        @JsonSubTypes.Type(value = TaskDetails.Empty.class, name = "empty")
})
public interface TaskDetails {

    /**
     * True when the task changed nothing worth mentioning in the job summary.
     */
    @JsonIgnore
    boolean isTrivial();

    record FeedbackPropagation(int outcomesPropagated, int learningsUpdated, int beliefsUpdated,
            double totalConfidenceChanges) implements TaskDetails {

        @Override
        public boolean isTrivial() {
            return outcomesPropagated == 0;
        }
    }

    record LearningExtraction(int observationsProcessed, int observationsSkipped, int learningsExtracted,
            int learningsReinforced, int learningsContradicted) implements TaskDetails {

        @Override
        public boolean isTrivial() {
            return learningsExtracted == 0 && learningsReinforced == 0;
        }
    }

    record BeliefFormation(int learningsEvaluated, int beliefsFormed, int beliefsSkipped, int conflictsDetected)
            implements TaskDetails {

        @Override
        public boolean isTrivial() {
            return beliefsFormed == 0;
        }
    }

    record ConfidenceDecay(int learningsDecayed, int beliefsDecayed, int learningsWeakened, int beliefsWeakened)
            implements TaskDetails {

        @Override
        public boolean isTrivial() {
            return learningsDecayed + beliefsDecayed == 0;
        }
    }

    record ConflictResolution(int conflictsEvaluated, int conflictsAutoResolved, int conflictsEscalated)
            implements TaskDetails {

        @Override
        public boolean isTrivial() {
            return conflictsAutoResolved == 0;
        }
    }

    record Archival(int learningsArchived, int beliefsArchived, int outcomesArchived) implements TaskDetails {

        @Override
        public boolean isTrivial() {
            return learningsArchived + beliefsArchived + outcomesArchived == 0;
        }
    }

    record SessionPrep(int topBeliefs, int topLearnings, int recentOutcomes, boolean contextGenerated)
            implements TaskDetails {

        @Override
        public boolean isTrivial() {
            return !contextGenerated;
        }
    }

    /**
     * Placeholder for tasks that failed or never ran.
     */
    record Empty() implements TaskDetails {

        @Override
        public boolean isTrivial() {
            return true;
        }
    }
}
