package me.golemcore.mind.domain.store;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.mind.domain.component.SimilarityClassifier;
import me.golemcore.mind.domain.model.ConfidenceChange;
import me.golemcore.mind.domain.model.DecayResult;
import me.golemcore.mind.domain.model.ExtractedFact;
import me.golemcore.mind.domain.model.Learning;
import me.golemcore.mind.domain.model.LearningCategory;
import me.golemcore.mind.domain.model.LearningEvidence;
import me.golemcore.mind.domain.model.LearningProfile;
import me.golemcore.mind.domain.model.LearningQuery;
import me.golemcore.mind.domain.model.LearningStatus;
import me.golemcore.mind.domain.model.Page;
import me.golemcore.mind.domain.model.Strength;
import me.golemcore.mind.domain.service.ConfidenceModel;
import me.golemcore.mind.infrastructure.config.MindProperties;
import me.golemcore.mind.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Learnings and their evidence links, per owner.
 *
 * <p>
 * Every write that touches confidence or evidence count recomputes
 * {@link Learning#getStrength()} with
 * {@link ConfidenceModel#learningStrength(double, int)}.
 */
@Service
@Slf4j
public class LearningStore extends OwnerScopedStore {

    static final String LEARNINGS = "learnings";
    static final String EVIDENCE = "learning-evidence";

    private static final String KIND = "Learning";
    private static final int PROFILE_ITEMS_PER_CATEGORY = 10;
    private static final Duration RECENT_WINDOW = Duration.ofDays(7);
    private static final Set<LearningCategory> PROFILE_CATEGORIES = Set.of(
            LearningCategory.PREFERENCE, LearningCategory.HABIT, LearningCategory.RELATIONSHIP,
            LearningCategory.WORK_PATTERN, LearningCategory.INTEREST, LearningCategory.VALUE, LearningCategory.GOAL);

    private static final Comparator<Learning> OLDEST_FIRST = Comparator
            .comparing(Learning::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()));

    private static final Comparator<Learning> BY_CONFIDENCE = Comparator
            .comparingDouble(Learning::getConfidence).reversed()
            .thenComparing(Learning::getLastReinforced, Comparator.nullsLast(Comparator.reverseOrder()));

    private final SimilarityClassifier similarityClassifier;

    public LearningStore(StoragePort storagePort, ObjectMapper objectMapper, Clock clock,
            SimilarityClassifier similarityClassifier, MindProperties properties) {
        super(storagePort, objectMapper, clock, properties.getStorage().getKnowledgeDirectory());
        this.similarityClassifier = similarityClassifier;
    }

    /**
     * Creates a learning backed by one source observation.
     */
    public Learning create(String userId, ExtractedFact fact, String sourceId) {
        return withOwnerLock(userId, () -> {
            Instant now = now();
            double confidence = ConfidenceModel.clampConfidence(fact.getConfidence());
            Learning learning = Learning.builder()
                    .id(newId())
                    .userId(userId)
                    .category(fact.getCategory() != null ? fact.getCategory() : LearningCategory.OTHER)
                    .statement(fact.getStatement())
                    .reasoning(fact.getReasoning())
                    .confidence(confidence)
                    .evidenceCount(1)
                    .strength(ConfidenceModel.learningStrength(confidence, 1))
                    .status(LearningStatus.ACTIVE)
                    .firstObserved(now)
                    .lastReinforced(now)
                    .validFrom(now)
                    .createdAt(now)
                    .updatedAt(now)
                    .build();

            List<Learning> learnings = readLearnings(userId);
            learnings.add(learning);
            writeCollection(userId, LEARNINGS, learnings);
            addEvidence(userId, learning.getId(), sourceId, LearningEvidence.Type.SUPPORTS, fact.getExcerpt(),
                    fact.getConfidence());
            log.debug("[KnowledgeStore] Created learning {} for {}", learning.getId(), userId);
            return learning;
        });
    }

    public Optional<Learning> find(String userId, String learningId) {
        return readLearnings(userId).stream()
                .filter(learning -> learning.getId().equals(learningId))
                .findFirst();
    }

    public Learning get(String userId, String learningId) {
        return find(userId, learningId).orElseThrow(() -> missingLearning(learningId));
    }

    public Page<Learning> list(String userId, LearningQuery query) {
        List<Learning> matches = readLearnings(userId).stream()
                .filter(learning -> query.getStatus() == null || learning.getStatus() == query.getStatus())
                .filter(learning -> query.getCategory() == null || learning.getCategory() == query.getCategory())
                .filter(learning -> query.getStrength() == null || learning.getStrength() == query.getStrength())
                .filter(learning -> query.getMinConfidence() == null
                        || learning.getConfidence() >= query.getMinConfidence())
                .sorted(BY_CONFIDENCE)
                .toList();
        return new Page<>(page(matches, query.getOffset(), query.getLimit()), matches.size());
    }

    public int count(String userId, LearningStatus status) {
        return (int) readLearnings(userId).stream().filter(learning -> learning.getStatus() == status).count();
    }

    public Map<LearningStatus, Integer> countByStatus(String userId) {
        Map<LearningStatus, Integer> counts = new EnumMap<>(LearningStatus.class);
        for (Learning learning : readLearnings(userId)) {
            counts.merge(learning.getStatus(), 1, Integer::sum);
        }
        return counts;
    }

    /**
     * Active learnings of the same owner and category that the similarity
     * heuristic considers candidates for {@code statement}, oldest first.
     */
    public List<Learning> findSimilarLearnings(String userId, LearningCategory category, String statement) {
        return readLearnings(userId).stream()
                .filter(learning -> learning.getStatus() == LearningStatus.ACTIVE)
                .filter(learning -> learning.getCategory() == category)
                .filter(learning -> similarityClassifier.isSimilarLearning(statement, learning.getStatement()))
                .sorted(OLDEST_FIRST)
                .toList();
    }

    /**
     * Adds one supporting observation: evidence count grows by one, confidence
     * is merged with the observation's, strength recomputed.
     */
    public Learning reinforce(String userId, String learningId, String sourceId, String excerpt,
            double confidence) {
        return withOwnerLock(userId, () -> {
            Learning reinforced = mutate(userId, learningId, learning -> {
                int evidenceCount = learning.getEvidenceCount() + 1;
                double merged = ConfidenceModel.recalculateLearningConfidence(learning.getConfidence(), confidence,
                        evidenceCount);
                Instant now = now();
                learning.setEvidenceCount(evidenceCount);
                learning.setConfidence(merged);
                learning.setStrength(ConfidenceModel.learningStrength(merged, evidenceCount));
                learning.setLastReinforced(now);
                learning.setUpdatedAt(now);
            });
            addEvidence(userId, learningId, sourceId, LearningEvidence.Type.SUPPORTS, excerpt, confidence);
            return reinforced;
        });
    }

    /**
     * Links a source observation to a learning. At most one link exists per
     * (learning, source); a repeated link replaces type, excerpt and
     * confidence.
     */
    public LearningEvidence addEvidence(String userId, String learningId, String sourceId,
            LearningEvidence.Type type, String excerpt, double confidence) {
        return withOwnerLock(userId, () -> {
            List<LearningEvidence> evidence = readCollection(userId, EVIDENCE, LearningEvidence.class);
            for (LearningEvidence existing : evidence) {
                if (existing.getLearningId().equals(learningId) && sourceId != null
                        && sourceId.equals(existing.getSourceId())) {
                    existing.setEvidenceType(type);
                    existing.setExcerpt(excerpt);
                    existing.setConfidence(confidence);
                    writeCollection(userId, EVIDENCE, evidence);
                    return existing;
                }
            }
            LearningEvidence created = LearningEvidence.builder()
                    .id(newId())
                    .learningId(learningId)
                    .sourceId(sourceId)
                    .evidenceType(type)
                    .excerpt(excerpt)
                    .confidence(confidence)
                    .createdAt(now())
                    .build();
            evidence.add(created);
            writeCollection(userId, EVIDENCE, evidence);
            return created;
        });
    }

    public List<LearningEvidence> listEvidence(String userId, String learningId) {
        get(userId, learningId);
        return readCollection(userId, EVIDENCE, LearningEvidence.class).stream()
                .filter(evidence -> evidence.getLearningId().equals(learningId))
                .sorted(Comparator.comparing(LearningEvidence::getCreatedAt,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .toList();
    }

    public Learning invalidate(String userId, String learningId, String invalidatedBy) {
        return withOwnerLock(userId, () -> mutate(userId, learningId, learning -> {
            Instant now = now();
            learning.setStatus(LearningStatus.INVALIDATED);
            learning.setInvalidatedBy(invalidatedBy);
            learning.setValidTo(now);
            learning.setUpdatedAt(now);
        }));
    }

    public Learning supersede(String userId, String learningId, String supersededBy) {
        return withOwnerLock(userId, () -> {
            get(userId, supersededBy);
            return mutate(userId, learningId, learning -> {
                Instant now = now();
                learning.setStatus(LearningStatus.SUPERSEDED);
                learning.setSupersededBy(supersededBy);
                learning.setValidTo(now);
                learning.setUpdatedAt(now);
            });
        });
    }

    /**
     * Shifts a learning's confidence by {@code delta} (clamped), recomputes
     * strength and touches {@code lastReinforced}. Empty when the learning
     * does not exist for this owner.
     */
    public Optional<ConfidenceChange> nudgeConfidence(String userId, String learningId, double delta) {
        return withOwnerLock(userId, () -> {
            List<Learning> learnings = readLearnings(userId);
            for (Learning learning : learnings) {
                if (learning.getId().equals(learningId)) {
                    double previous = learning.getConfidence();
                    double updated = ConfidenceModel.clampConfidence(previous + delta);
                    Instant now = now();
                    learning.setConfidence(updated);
                    learning.setStrength(ConfidenceModel.learningStrength(updated, learning.getEvidenceCount()));
                    learning.setLastReinforced(now);
                    learning.setUpdatedAt(now);
                    writeCollection(userId, LEARNINGS, learnings);
                    return Optional.of(new ConfidenceChange(learningId, previous, updated));
                }
            }
            return Optional.empty();
        });
    }

    /**
     * Decays active learnings not updated since {@code staleBefore}. Those
     * falling below {@code weakenBelow} become {@link LearningStatus#WEAKENED}.
     * Decay touches {@code updatedAt}, so a learning decays at most once per
     * staleness window. {@code lastReinforced} is left as is.
     */
    public DecayResult applyDecay(String userId, Instant staleBefore, double rate, double weakenBelow, int limit) {
        return withOwnerLock(userId, () -> {
            List<Learning> learnings = readLearnings(userId);
            int decayed = 0;
            int weakened = 0;
            Instant now = now();
            for (Learning learning : learnings) {
                if (decayed >= limit) {
                    break;
                }
                Instant lastTouched = learning.getUpdatedAt() != null ? learning.getUpdatedAt()
                        : learning.getLastReinforced();
                if (learning.getStatus() != LearningStatus.ACTIVE
                        || (lastTouched != null && lastTouched.isAfter(staleBefore))) {
                    continue;
                }
                double updated = ConfidenceModel.decay(learning.getConfidence(), rate);
                learning.setConfidence(updated);
                learning.setStrength(ConfidenceModel.learningStrength(updated, learning.getEvidenceCount()));
                learning.setUpdatedAt(now);
                if (updated < weakenBelow) {
                    learning.setStatus(LearningStatus.WEAKENED);
                    weakened++;
                }
                decayed++;
            }
            if (decayed > 0) {
                writeCollection(userId, LEARNINGS, learnings);
            }
            return new DecayResult(decayed, weakened);
        });
    }

    /**
     * Archives active or weakened learnings below {@code threshold} that have
     * not been reinforced since {@code staleBefore}.
     */
    public int archiveStale(String userId, double threshold, Instant staleBefore) {
        return withOwnerLock(userId, () -> {
            List<Learning> learnings = readLearnings(userId);
            int archived = 0;
            Instant now = now();
            for (Learning learning : learnings) {
                boolean archivable = learning.getStatus() == LearningStatus.ACTIVE
                        || learning.getStatus() == LearningStatus.WEAKENED;
                if (archivable && learning.getConfidence() < threshold
                        && learning.getLastReinforced() != null && learning.getLastReinforced().isBefore(staleBefore)) {
                    learning.setStatus(LearningStatus.ARCHIVED);
                    learning.setUpdatedAt(now);
                    archived++;
                }
            }
            if (archived > 0) {
                writeCollection(userId, LEARNINGS, learnings);
            }
            return archived;
        });
    }

    /**
     * Top active learnings per profile category plus totals.
     */
    public LearningProfile profile(String userId) {
        List<Learning> active = readLearnings(userId).stream()
                .filter(learning -> learning.getStatus() == LearningStatus.ACTIVE)
                .sorted(BY_CONFIDENCE)
                .toList();
        Map<LearningCategory, List<Learning>> byCategory = new LinkedHashMap<>();
        for (LearningCategory category : LearningCategory.values()) {
            if (PROFILE_CATEGORIES.contains(category)) {
                byCategory.put(category, active.stream()
                        .filter(learning -> learning.getCategory() == category)
                        .limit(PROFILE_ITEMS_PER_CATEGORY)
                        .toList());
            }
        }
        Instant now = now();
        Instant recentSince = now.minus(RECENT_WINDOW);
        int strong = (int) active.stream()
                .filter(learning -> learning.getStrength() != null && learning.getStrength().isAtLeast(Strength.STRONG))
                .count();
        int recent = (int) active.stream()
                .filter(learning -> learning.getLastReinforced() != null
                        && learning.getLastReinforced().isAfter(recentSince))
                .count();
        return new LearningProfile(userId, byCategory, active.size(), strong, recent, now);
    }

    private Learning mutate(String userId, String learningId, Consumer<Learning> change) {
        List<Learning> learnings = readLearnings(userId);
        for (Learning learning : learnings) {
            if (learning.getId().equals(learningId)) {
                change.accept(learning);
                writeCollection(userId, LEARNINGS, learnings);
                return learning;
            }
        }
        throw missingLearning(learningId);
    }

    private List<Learning> readLearnings(String userId) {
        return readCollection(userId, LEARNINGS, Learning.class);
    }

    private RuntimeException missingLearning(String learningId) {
        return missing(KIND, LEARNINGS, Learning.class, Learning::getId, learningId);
    }
}
