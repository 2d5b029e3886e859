package me.golemcore.mind.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.mind.domain.component.SimilarityClassifier;
import me.golemcore.mind.domain.model.Belief;
import me.golemcore.mind.domain.model.BeliefConflict;
import me.golemcore.mind.domain.model.BeliefFormationResult;
import me.golemcore.mind.domain.model.BeliefType;
import me.golemcore.mind.domain.model.BeliefUpdateRequest;
import me.golemcore.mind.domain.model.ConflictCheck;
import me.golemcore.mind.domain.model.FormationAttempt;
import me.golemcore.mind.domain.model.FormationOptions;
import me.golemcore.mind.domain.model.Learning;
import me.golemcore.mind.domain.model.LearningCategory;
import me.golemcore.mind.domain.model.LearningQuery;
import me.golemcore.mind.domain.model.LearningStatus;
import me.golemcore.mind.domain.model.NewBelief;
import me.golemcore.mind.domain.store.BeliefStore;
import me.golemcore.mind.domain.store.LearningStore;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Promotes confident learnings into beliefs.
 *
 * <p>
 * Formation is idempotent per learning: a learning that already produced a
 * belief is skipped. A near-duplicate of an existing belief reinforces that
 * belief instead of creating a new one; contradicting or temporally
 * overlapping beliefs are recorded as conflicts against the new belief.
 */
@Service
@Slf4j
public class BeliefFormationService {

    public static final String ALREADY_FORMED = "Belief already exists for this learning";
    public static final int DEFAULT_BACKFILL_BATCH = 50;
    public static final int BACKFILL_SAFETY_LIMIT = 10_000;

    private static final Map<LearningCategory, BeliefType> TYPE_BY_CATEGORY = new EnumMap<>(LearningCategory.class);

    static {
        TYPE_BY_CATEGORY.put(LearningCategory.PREFERENCE, BeliefType.PREFERENCE);
        TYPE_BY_CATEGORY.put(LearningCategory.HABIT, BeliefType.STATE);
        TYPE_BY_CATEGORY.put(LearningCategory.RELATIONSHIP, BeliefType.RELATIONSHIP);
        TYPE_BY_CATEGORY.put(LearningCategory.WORK_PATTERN, BeliefType.STATE);
        TYPE_BY_CATEGORY.put(LearningCategory.HEALTH, BeliefType.STATE);
        TYPE_BY_CATEGORY.put(LearningCategory.INTEREST, BeliefType.PREFERENCE);
        TYPE_BY_CATEGORY.put(LearningCategory.ROUTINE, BeliefType.STATE);
        TYPE_BY_CATEGORY.put(LearningCategory.COMMUNICATION, BeliefType.PREFERENCE);
        TYPE_BY_CATEGORY.put(LearningCategory.DECISION_STYLE, BeliefType.IDENTITY);
        TYPE_BY_CATEGORY.put(LearningCategory.VALUE, BeliefType.IDENTITY);
        TYPE_BY_CATEGORY.put(LearningCategory.GOAL, BeliefType.INTENTION);
        TYPE_BY_CATEGORY.put(LearningCategory.SKILL, BeliefType.CAPABILITY);
        TYPE_BY_CATEGORY.put(LearningCategory.OTHER, BeliefType.FACT);
    }

    private final LearningStore learningStore;
    private final BeliefStore beliefStore;
    private final SimilarityClassifier similarityClassifier;
    private final Clock clock;

    public BeliefFormationService(LearningStore learningStore, BeliefStore beliefStore,
            SimilarityClassifier similarityClassifier, Clock clock) {
        this.learningStore = learningStore;
        this.beliefStore = beliefStore;
        this.similarityClassifier = similarityClassifier;
        this.clock = clock;
    }

    public static BeliefType beliefTypeFor(LearningCategory category) {
        return category != null ? TYPE_BY_CATEGORY.getOrDefault(category, BeliefType.FACT) : BeliefType.FACT;
    }

    /**
     * Trims the statement and terminates it with a period unless it already
     * ends with one or with an exclamation mark.
     */
    public static String toProposition(String statement) {
        String proposition = statement == null ? "" : statement.trim();
        if (!proposition.endsWith(".") && !proposition.endsWith("!")) {
            proposition = proposition + ".";
        }
        return proposition;
    }

    /**
     * Forms beliefs from one page of active learnings at or above the
     * confidence floor. A learning that fails is reported as skipped with the
     * error message.
     */
    public BeliefFormationResult formBeliefsFromLearnings(String userId, FormationOptions options) {
        long started = clock.millis();
        double minConfidence = options.getMinConfidence() != null ? options.getMinConfidence()
                : ConfidenceModel.FORMATION_MIN;

        List<Learning> learnings = learningStore.list(userId, LearningQuery.builder()
                .status(LearningStatus.ACTIVE)
                .category(options.getCategory())
                .minConfidence(minConfidence)
                .limit(options.getMaxLearnings())
                .offset(options.getOffset())
                .build()).items();

        List<Belief> formed = new ArrayList<>();
        List<BeliefFormationResult.SkippedLearning> skipped = new ArrayList<>();
        List<BeliefConflict> conflicts = new ArrayList<>();
        for (Learning learning : learnings) {
            try {
                FormationAttempt attempt = formBeliefFromLearning(userId, learning);
                if (attempt.isFormed()) {
                    formed.add(attempt.belief());
                    conflicts.addAll(attempt.conflicts());
                } else {
                    skipped.add(new BeliefFormationResult.SkippedLearning(learning.getId(), attempt.skipReason()));
                }
            } catch (RuntimeException e) {
                log.warn("[BeliefFormation] Failed to form belief from learning {}: {}", learning.getId(),
                        e.getMessage());
                skipped.add(new BeliefFormationResult.SkippedLearning(learning.getId(), e.getMessage()));
            }
        }
        return new BeliefFormationResult(formed, skipped, conflicts, clock.millis() - started);
    }

    /**
     * Forms a belief from a single learning, or explains why none was formed.
     */
    public FormationAttempt formBeliefFromLearning(String userId, Learning learning) {
        if (!beliefStore.findByDerivedLearning(userId, learning.getId()).isEmpty()) {
            return FormationAttempt.skipped(ALREADY_FORMED);
        }

        BeliefType beliefType = beliefTypeFor(learning.getCategory());
        String proposition = toProposition(learning.getStatement());

        List<BeliefConflict> pending = new ArrayList<>();
        for (Belief existing : beliefStore.findSimilarBeliefs(userId, proposition, beliefType)) {
            ConflictCheck check = similarityClassifier.checkConflict(proposition, existing.getProposition());
            if (check.isDuplicate()) {
                beliefStore.discardPendingConflicts(userId, pending.stream().map(BeliefConflict::getId).toList());
                beliefStore.applyBayesianUpdate(BeliefUpdateRequest.builder()
                        .beliefId(existing.getId())
                        .userId(userId)
                        .evidenceStrength(learning.getConfidence())
                        .supports(true)
                        .reason("Reinforced by learning: " + learning.getId())
                        .build());
                log.debug("[BeliefFormation] Learning {} merged into belief {}", learning.getId(), existing.getId());
                return FormationAttempt.skipped("Merged with existing belief: " + existing.getId());
            }
            if (check.isConflict()) {
                pending.add(beliefStore.recordPendingConflict(userId, existing.getId(), check.conflictType(),
                        check.description()));
            }
        }

        Belief belief = beliefStore.create(NewBelief.builder()
                .userId(userId)
                .proposition(proposition)
                .beliefType(beliefType)
                .domain(learning.getCategory() != null ? learning.getCategory().value() : null)
                .priorConfidence(learning.getConfidence())
                .derivedFromLearning(learning.getId())
                .sourceLearningId(learning.getId())
                .build());

        List<BeliefConflict> conflicts = new ArrayList<>(pending.size());
        for (BeliefConflict conflict : pending) {
            conflicts.add(beliefStore.attachConflictCounterpart(userId, conflict.getId(), belief.getId()));
        }
        if (!conflicts.isEmpty()) {
            log.info("[BeliefFormation] Belief {} formed with {} conflict(s)", belief.getId(), conflicts.size());
        }
        return FormationAttempt.formed(belief, conflicts);
    }

    public BeliefFormationResult runFormationBackfill(String userId) {
        return runFormationBackfill(userId, DEFAULT_BACKFILL_BATCH);
    }

    /**
     * Walks all eligible learnings page by page until a page comes back short
     * or {@link #BACKFILL_SAFETY_LIMIT} learnings have been visited. Rerunning
     * it is safe, already formed learnings are skipped.
     */
    public BeliefFormationResult runFormationBackfill(String userId, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
        }
        long started = clock.millis();
        List<Belief> formed = new ArrayList<>();
        List<BeliefFormationResult.SkippedLearning> skipped = new ArrayList<>();
        List<BeliefConflict> conflicts = new ArrayList<>();
        int offset = 0;
        while (true) {
            BeliefFormationResult page = formBeliefsFromLearnings(userId, FormationOptions.builder()
                    .minConfidence(ConfidenceModel.FORMATION_MIN)
                    .maxLearnings(batchSize)
                    .offset(offset)
                    .build());
            formed.addAll(page.formed());
            skipped.addAll(page.skipped());
            conflicts.addAll(page.conflicts());

            if (page.evaluated() < batchSize) {
                break;
            }
            offset += batchSize;
            if (offset > BACKFILL_SAFETY_LIMIT) {
                log.warn("[BeliefFormation] Backfill for {} hit the safety limit of {} learnings", userId,
                        BACKFILL_SAFETY_LIMIT);
                break;
            }
        }
        log.info("[BeliefFormation] Backfill for {}: {} formed, {} skipped, {} conflict(s)", userId, formed.size(),
                skipped.size(), conflicts.size());
        return new BeliefFormationResult(formed, skipped, conflicts, clock.millis() - started);
    }
}
