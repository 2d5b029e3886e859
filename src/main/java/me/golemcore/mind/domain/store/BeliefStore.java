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
import me.golemcore.mind.domain.model.BayesianUpdateResult;
import me.golemcore.mind.domain.model.Belief;
import me.golemcore.mind.domain.model.BeliefConflict;
import me.golemcore.mind.domain.model.BeliefEvidence;
import me.golemcore.mind.domain.model.BeliefQuery;
import me.golemcore.mind.domain.model.BeliefStats;
import me.golemcore.mind.domain.model.BeliefStatus;
import me.golemcore.mind.domain.model.BeliefType;
import me.golemcore.mind.domain.model.BeliefUpdateRequest;
import me.golemcore.mind.domain.model.ConfidenceHistoryEntry;
import me.golemcore.mind.domain.model.ConfidenceTrend;
import me.golemcore.mind.domain.model.DecayResult;
import me.golemcore.mind.domain.model.NewBelief;
import me.golemcore.mind.domain.model.Page;
import me.golemcore.mind.domain.model.StatusTransition;
import me.golemcore.mind.domain.service.ConfidenceModel;
import me.golemcore.mind.infrastructure.config.MindProperties;
import me.golemcore.mind.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Beliefs, their evidence and the conflicts between them, per owner.
 *
 * <p>
 * {@link #applyBayesianUpdate(BeliefUpdateRequest)} is the only way a belief's
 * confidence moves, apart from {@link #applyDecay}. Both append to the
 * confidence history so that the current confidence always equals its last
 * entry.
 *
 * <p>
 * Conflicts are stored with the pair in sorted order; at most one unresolved
 * conflict exists per pair.
 */
@Service
@Slf4j
public class BeliefStore extends OwnerScopedStore {

    static final String BELIEFS = "beliefs";
    static final String EVIDENCE = "belief-evidence";
    static final String CONFLICTS = "belief-conflicts";

    private static final String KIND = "Belief";
    private static final String CONFLICT_KIND = "Belief conflict";
    private static final String CREATED_REASON = "Belief created";
    private static final String DECAY_REASON = "Confidence decay (no recent evidence)";
    private static final double SOURCE_EVIDENCE_STRENGTH = 0.7;
    private static final int SIMILAR_LIMIT = 10;

    private final SimilarityClassifier similarityClassifier;

    public BeliefStore(StoragePort storagePort, ObjectMapper objectMapper, Clock clock,
            SimilarityClassifier similarityClassifier, MindProperties properties) {
        super(storagePort, objectMapper, clock, properties.getStorage().getKnowledgeDirectory());
        this.similarityClassifier = similarityClassifier;
    }

    // ==================== Beliefs ====================

    /**
     * Creates an active belief whose history starts with the prior. A source
     * learning or memory is linked as supporting evidence.
     */
    public Belief create(NewBelief input) {
        String userId = input.getUserId();
        return withOwnerLock(userId, () -> {
            List<Belief> beliefs = readBeliefs(userId);
            Set<String> dependsOn = input.getDependsOn() != null ? new LinkedHashSet<>(input.getDependsOn())
                    : new LinkedHashSet<>();
            Set<String> known = beliefs.stream().map(Belief::getId).collect(Collectors.toSet());
            for (String dependency : dependsOn) {
                if (!known.contains(dependency)) {
                    throw missingBelief(dependency);
                }
            }

            Instant now = now();
            double prior = ConfidenceModel.clampConfidence(input.getPriorConfidence());
            Belief belief = Belief.builder()
                    .id(newId())
                    .userId(userId)
                    .proposition(input.getProposition())
                    .beliefType(input.getBeliefType())
                    .domain(input.getDomain())
                    .priorConfidence(prior)
                    .currentConfidence(prior)
                    .confidenceHistory(List.of(new ConfidenceHistoryEntry(now, prior, CREATED_REASON, null)))
                    .validFrom(input.getValidFrom())
                    .validTo(input.getValidTo())
                    .dependsOn(dependsOn)
                    .derivedFromLearning(input.getDerivedFromLearning())
                    .status(BeliefStatus.ACTIVE)
                    .lastReinforcedAt(now)
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            beliefs.add(belief);
            writeCollection(userId, BELIEFS, beliefs);

            if (input.getSourceLearningId() != null || input.getSourceMemoryId() != null) {
                BeliefEvidence.Type type = input.getSourceLearningId() != null ? BeliefEvidence.Type.LEARNED
                        : BeliefEvidence.Type.DIRECT;
                addEvidence(userId, belief.getId(), BeliefEvidence.builder()
                        .evidenceType(type)
                        .supports(true)
                        .strength(SOURCE_EVIDENCE_STRENGTH)
                        .memoryId(input.getSourceMemoryId())
                        .learningId(input.getSourceLearningId())
                        .build());
            }
            log.debug("[KnowledgeStore] Created belief {} for {}", belief.getId(), userId);
            return belief;
        });
    }

    public Optional<Belief> find(String userId, String beliefId) {
        return readBeliefs(userId).stream().filter(belief -> belief.getId().equals(beliefId)).findFirst();
    }

    public Belief get(String userId, String beliefId) {
        return find(userId, beliefId).orElseThrow(() -> missingBelief(beliefId));
    }

    public Page<Belief> query(BeliefQuery query) {
        List<Belief> matches = readBeliefs(query.getUserId()).stream()
                .filter(belief -> isEmpty(query.getStatuses()) || query.getStatuses().contains(belief.getStatus()))
                .filter(belief -> isEmpty(query.getBeliefTypes())
                        || query.getBeliefTypes().contains(belief.getBeliefType()))
                .filter(belief -> query.getDomain() == null || query.getDomain().equals(belief.getDomain()))
                .filter(belief -> query.getMinConfidence() == null
                        || belief.getCurrentConfidence() >= query.getMinConfidence())
                .filter(belief -> query.getValidAt() == null || belief.isValidAt(query.getValidAt()))
                .sorted(ordering(query))
                .toList();
        return new Page<>(page(matches, query.getOffset(), query.getLimit()), matches.size());
    }

    /**
     * Active beliefs of the given type that the similarity heuristic considers
     * candidates for {@code proposition}, at most ten.
     */
    public List<Belief> findSimilarBeliefs(String userId, String proposition, BeliefType beliefType) {
        return readBeliefs(userId).stream()
                .filter(belief -> belief.getStatus() == BeliefStatus.ACTIVE)
                .filter(belief -> beliefType == null || belief.getBeliefType() == beliefType)
                .filter(belief -> similarityClassifier.isSimilarBelief(proposition, belief.getProposition()))
                .limit(SIMILAR_LIMIT)
                .toList();
    }

    public List<Belief> findByDerivedLearning(String userId, String learningId) {
        return readBeliefs(userId).stream()
                .filter(belief -> learningId.equals(belief.getDerivedFromLearning()))
                .sorted(Comparator.comparing(Belief::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder())))
                .toList();
    }

    /**
     * Moves a belief's confidence with one Bayesian update and commits
     * confidence, history, counters and status in a single write.
     *
     * @throws KnowledgeNotFoundException
     *             when no such belief exists
     * @throws KnowledgeAccessDeniedException
     *             when the belief belongs to another user
     */
    public Belief applyBayesianUpdate(BeliefUpdateRequest request) {
        String userId = request.getUserId();
        return withOwnerLock(userId, () -> mutate(userId, request.getBeliefId(), belief -> {
            BayesianUpdateResult result = ConfidenceModel.bayesianUpdate(belief.getCurrentConfidence(),
                    request.getEvidenceStrength(), request.isSupports());
            Instant now = now();
            int supporting = belief.getSupportingCount() + (request.isSupports() ? 1 : 0);
            int contradicting = belief.getContradictingCount() + (request.isSupports() ? 0 : 1);

            belief.setCurrentConfidence(result.posterior());
            belief.setConfidenceHistory(ConfidenceModel.appendHistory(belief.getConfidenceHistory(),
                    new ConfidenceHistoryEntry(now, result.posterior(), request.getReason(), request.getEvidenceId()),
                    ConfidenceModel.MAX_HISTORY));
            belief.setSupportingCount(supporting);
            belief.setContradictingCount(contradicting);
            ConfidenceModel.transitionStatus(belief.getStatus(), result.posterior(), supporting, contradicting)
                    .ifPresent(transition -> applyTransition(belief, transition));
            belief.setLastReinforcedAt(now);
            belief.setUpdatedAt(now);
        }));
    }

    /**
     * Decays active beliefs not updated since {@code staleBefore}. Each decay
     * is recorded in the history and touches {@code updatedAt}, so a belief
     * decays at most once per staleness window. Beliefs falling below
     * {@code weakenBelow} become {@link BeliefStatus#UNCERTAIN}.
     */
    public DecayResult applyDecay(String userId, Instant staleBefore, double rate, double weakenBelow, int limit) {
        return withOwnerLock(userId, () -> {
            List<Belief> beliefs = readBeliefs(userId);
            int decayed = 0;
            int weakened = 0;
            Instant now = now();
            for (Belief belief : beliefs) {
                if (decayed >= limit) {
                    break;
                }
                Instant lastTouched = belief.getUpdatedAt() != null ? belief.getUpdatedAt()
                        : belief.getLastReinforcedAt();
                if (belief.getStatus() != BeliefStatus.ACTIVE
                        || (lastTouched != null && lastTouched.isAfter(staleBefore))) {
                    continue;
                }
                double updated = ConfidenceModel.decay(belief.getCurrentConfidence(), rate);
                belief.setCurrentConfidence(updated);
                belief.setConfidenceHistory(ConfidenceModel.appendHistory(belief.getConfidenceHistory(),
                        new ConfidenceHistoryEntry(now, updated, DECAY_REASON, null), ConfidenceModel.MAX_HISTORY));
                belief.setUpdatedAt(now);
                if (updated < weakenBelow) {
                    belief.setStatus(BeliefStatus.UNCERTAIN);
                    weakened++;
                }
                decayed++;
            }
            if (decayed > 0) {
                writeCollection(userId, BELIEFS, beliefs);
            }
            return new DecayResult(decayed, weakened);
        });
    }

    /**
     * Sets a belief's status. A non-null reason or successor replaces the
     * stored one.
     */
    public Belief updateStatus(String userId, String beliefId, BeliefStatus status, String reason,
            String supersededBy) {
        return withOwnerLock(userId, () -> mutate(userId, beliefId, belief -> {
            belief.setStatus(status);
            if (reason != null) {
                belief.setInvalidationReason(reason);
            }
            if (supersededBy != null) {
                belief.setSupersededBy(supersededBy);
            }
            belief.setUpdatedAt(now());
        }));
    }

    /**
     * Archives active or uncertain beliefs below {@code threshold} without
     * evidence since {@code staleBefore}.
     */
    public int archiveStale(String userId, double threshold, Instant staleBefore) {
        return withOwnerLock(userId, () -> {
            List<Belief> beliefs = readBeliefs(userId);
            int archived = 0;
            Instant now = now();
            for (Belief belief : beliefs) {
                boolean archivable = belief.getStatus() == BeliefStatus.ACTIVE
                        || belief.getStatus() == BeliefStatus.UNCERTAIN;
                if (archivable && belief.getCurrentConfidence() < threshold
                        && belief.getLastReinforcedAt() != null && belief.getLastReinforcedAt().isBefore(staleBefore)) {
                    belief.setStatus(BeliefStatus.ARCHIVED);
                    belief.setUpdatedAt(now);
                    archived++;
                }
            }
            if (archived > 0) {
                writeCollection(userId, BELIEFS, beliefs);
            }
            return archived;
        });
    }

    public Optional<ConfidenceTrend> trend(String userId, String beliefId) {
        return ConfidenceModel.analyzeTrend(get(userId, beliefId).getConfidenceHistory());
    }

    public int count(String userId, BeliefStatus status) {
        return (int) readBeliefs(userId).stream().filter(belief -> belief.getStatus() == status).count();
    }

    public BeliefStats stats(String userId) {
        List<Belief> beliefs = readBeliefs(userId);
        Map<BeliefStatus, Integer> byStatus = new EnumMap<>(BeliefStatus.class);
        Map<BeliefType, Integer> byType = new EnumMap<>(BeliefType.class);
        double confidenceSum = 0;
        int active = 0;
        for (Belief belief : beliefs) {
            byStatus.merge(belief.getStatus(), 1, Integer::sum);
            if (belief.getStatus() == BeliefStatus.ACTIVE) {
                byType.merge(belief.getBeliefType(), 1, Integer::sum);
                confidenceSum += belief.getCurrentConfidence();
                active++;
            }
        }
        double average = active > 0 ? confidenceSum / active : 0;
        return new BeliefStats(beliefs.size(), byStatus, byType, average, listUnresolvedConflicts(userId).size());
    }

    // ==================== Dependencies ====================

    /**
     * Active beliefs that list {@code beliefId} among their dependencies.
     */
    public List<Belief> getDependentBeliefs(String userId, String beliefId) {
        return readBeliefs(userId).stream()
                .filter(belief -> belief.getStatus() == BeliefStatus.ACTIVE)
                .filter(belief -> belief.getDependsOn() != null && belief.getDependsOn().contains(beliefId))
                .toList();
    }

    /**
     * Records that {@code beliefId} depends on {@code dependsOnId}.
     *
     * @throws IllegalArgumentException
     *             when the edge would close a cycle
     */
    public Belief addDependency(String userId, String beliefId, String dependsOnId) {
        return withOwnerLock(userId, () -> {
            List<Belief> beliefs = readBeliefs(userId);
            Map<String, Belief> byId = beliefs.stream().collect(Collectors.toMap(Belief::getId, Function.identity()));
            if (!byId.containsKey(beliefId)) {
                throw missingBelief(beliefId);
            }
            if (!byId.containsKey(dependsOnId)) {
                throw missingBelief(dependsOnId);
            }
            if (beliefId.equals(dependsOnId) || reaches(byId, dependsOnId, beliefId)) {
                throw new IllegalArgumentException(
                        "Dependency " + beliefId + " -> " + dependsOnId + " would create a cycle");
            }
            Belief belief = byId.get(beliefId);
            if (belief.getDependsOn().add(dependsOnId)) {
                belief.setUpdatedAt(now());
                writeCollection(userId, BELIEFS, beliefs);
            }
            return belief;
        });
    }

    private boolean reaches(Map<String, Belief> byId, String from, String target) {
        Deque<String> stack = new ArrayDeque<>();
        Set<String> seen = new HashSet<>();
        stack.push(from);
        while (!stack.isEmpty()) {
            String current = stack.pop();
            if (current.equals(target)) {
                return true;
            }
            Belief belief = byId.get(current);
            if (belief == null || !seen.add(current) || belief.getDependsOn() == null) {
                continue;
            }
            belief.getDependsOn().forEach(stack::push);
        }
        return false;
    }

    // ==================== Evidence ====================

    /**
     * Attaches evidence to a belief. A missing or non-positive strength is
     * replaced by the default strength of the evidence type.
     */
    public BeliefEvidence addEvidence(String userId, String beliefId, BeliefEvidence evidence) {
        return withOwnerLock(userId, () -> {
            get(userId, beliefId);
            double strength = evidence.getStrength() > 0 ? Math.min(evidence.getStrength(), 1.0)
                    : ConfidenceModel.defaultEvidenceStrength(evidence.getEvidenceType());
            BeliefEvidence created = BeliefEvidence.builder()
                    .id(newId())
                    .beliefId(beliefId)
                    .memoryId(evidence.getMemoryId())
                    .learningId(evidence.getLearningId())
                    .evidenceType(evidence.getEvidenceType())
                    .supports(evidence.isSupports())
                    .strength(strength)
                    .notes(evidence.getNotes())
                    .createdAt(now())
                    .build();
            List<BeliefEvidence> all = readCollection(userId, EVIDENCE, BeliefEvidence.class);
            all.add(created);
            writeCollection(userId, EVIDENCE, all);
            return created;
        });
    }

    public List<BeliefEvidence> listEvidence(String userId, String beliefId) {
        get(userId, beliefId);
        return readCollection(userId, EVIDENCE, BeliefEvidence.class).stream()
                .filter(evidence -> evidence.getBeliefId().equals(beliefId))
                .sorted(Comparator.comparing(BeliefEvidence::getCreatedAt,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .toList();
    }

    // ==================== Conflicts ====================

    /**
     * Records a conflict between two beliefs. Recording the same pair again,
     * in either order, returns the existing unresolved conflict unchanged.
     */
    public BeliefConflict recordConflict(String userId, String beliefAId, String beliefBId,
            BeliefConflict.Type type, String description) {
        if (Objects.equals(beliefAId, beliefBId)) {
            throw new IllegalArgumentException("A belief cannot conflict with itself: " + beliefAId);
        }
        return withOwnerLock(userId, () -> {
            get(userId, beliefAId);
            get(userId, beliefBId);
            String first = beliefAId.compareTo(beliefBId) <= 0 ? beliefAId : beliefBId;
            String second = first.equals(beliefAId) ? beliefBId : beliefAId;

            List<BeliefConflict> conflicts = readConflicts(userId);
            Optional<BeliefConflict> existing = findUnresolvedPair(conflicts, first, second);
            if (existing.isPresent()) {
                return existing.get();
            }
            BeliefConflict conflict = newConflict(userId, first, second, type, description);
            conflicts.add(conflict);
            writeCollection(userId, CONFLICTS, conflicts);
            return conflict;
        });
    }

    /**
     * Records a conflict whose second belief does not exist yet. The
     * counterpart is attached with {@link #attachConflictCounterpart} or the
     * record dropped with {@link #discardPendingConflicts}.
     */
    public BeliefConflict recordPendingConflict(String userId, String existingBeliefId, BeliefConflict.Type type,
            String description) {
        return withOwnerLock(userId, () -> {
            get(userId, existingBeliefId);
            List<BeliefConflict> conflicts = readConflicts(userId);
            BeliefConflict conflict = newConflict(userId, existingBeliefId, null, type, description);
            conflicts.add(conflict);
            writeCollection(userId, CONFLICTS, conflicts);
            return conflict;
        });
    }

    /**
     * Completes a pending conflict with the newly created belief and puts the
     * pair in sorted order. When an unresolved conflict already exists for the
     * pair, the pending record is dropped and the existing one returned.
     */
    public BeliefConflict attachConflictCounterpart(String userId, String conflictId, String newBeliefId) {
        return withOwnerLock(userId, () -> {
            get(userId, newBeliefId);
            List<BeliefConflict> conflicts = readConflicts(userId);
            BeliefConflict pending = conflicts.stream()
                    .filter(conflict -> conflict.getId().equals(conflictId))
                    .findFirst()
                    .orElseThrow(() -> missingConflict(conflictId));
            if (!pending.isPending()) {
                return pending;
            }
            String other = pending.getBeliefAId();
            String first = other.compareTo(newBeliefId) <= 0 ? other : newBeliefId;
            String second = first.equals(other) ? newBeliefId : other;

            Optional<BeliefConflict> existing = findUnresolvedPair(conflicts, first, second);
            if (existing.isPresent()) {
                conflicts.remove(pending);
                writeCollection(userId, CONFLICTS, conflicts);
                return existing.get();
            }
            pending.setBeliefAId(first);
            pending.setBeliefBId(second);
            writeCollection(userId, CONFLICTS, conflicts);
            return pending;
        });
    }

    public void discardPendingConflicts(String userId, Collection<String> conflictIds) {
        if (conflictIds.isEmpty()) {
            return;
        }
        withOwnerLock(userId, () -> {
            List<BeliefConflict> conflicts = readConflicts(userId);
            boolean removed = conflicts.removeIf(
                    conflict -> conflict.isPending() && conflictIds.contains(conflict.getId()));
            if (removed) {
                writeCollection(userId, CONFLICTS, conflicts);
            }
            return null;
        });
    }

    public BeliefConflict getConflict(String userId, String conflictId) {
        return readConflicts(userId).stream()
                .filter(conflict -> conflict.getId().equals(conflictId))
                .findFirst()
                .orElseThrow(() -> missingConflict(conflictId));
    }

    /**
     * Unresolved conflicts, newest first, escalated ones included.
     */
    public List<BeliefConflict> listUnresolvedConflicts(String userId) {
        return readConflicts(userId).stream()
                .filter(conflict -> !conflict.isResolved())
                .sorted(Comparator.comparing(BeliefConflict::getCreatedAt,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .toList();
    }

    /**
     * Resolves a conflict. With a winner, the other belief is superseded by
     * it.
     */
    public BeliefConflict resolveConflict(String userId, String conflictId, String resolution, String winnerId) {
        return resolveConflict(userId, conflictId, resolution, winnerId, BeliefStatus.SUPERSEDED);
    }

    /**
     * Resolves a conflict and moves the losing belief to {@code loserStatus}.
     * A superseded loser records the winner as its successor.
     */
    public BeliefConflict resolveConflict(String userId, String conflictId, String resolution, String winnerId,
            BeliefStatus loserStatus) {
        return withOwnerLock(userId, () -> {
            List<BeliefConflict> conflicts = readConflicts(userId);
            BeliefConflict conflict = conflicts.stream()
                    .filter(candidate -> candidate.getId().equals(conflictId))
                    .findFirst()
                    .orElseThrow(() -> missingConflict(conflictId));
            if (winnerId != null && !conflict.involves(winnerId)) {
                throw new IllegalArgumentException("Belief " + winnerId + " is not part of conflict " + conflictId);
            }
            conflict.setResolved(true);
            conflict.setResolution(resolution);
            conflict.setWinnerId(winnerId);
            conflict.setResolvedAt(now());
            writeCollection(userId, CONFLICTS, conflicts);

            if (winnerId != null) {
                String loserId = winnerId.equals(conflict.getBeliefAId()) ? conflict.getBeliefBId()
                        : conflict.getBeliefAId();
                if (loserId != null && find(userId, loserId).isPresent()) {
                    boolean superseded = loserStatus == BeliefStatus.SUPERSEDED;
                    updateStatus(userId, loserId, loserStatus,
                            superseded ? "Superseded by belief " + winnerId : "Lost conflict to belief " + winnerId,
                            superseded ? winnerId : null);
                }
            }
            return conflict;
        });
    }

    /**
     * Flags an unresolved conflict for a human decision.
     */
    public BeliefConflict escalateConflict(String userId, String conflictId) {
        return withOwnerLock(userId, () -> {
            List<BeliefConflict> conflicts = readConflicts(userId);
            BeliefConflict conflict = conflicts.stream()
                    .filter(candidate -> candidate.getId().equals(conflictId))
                    .findFirst()
                    .orElseThrow(() -> missingConflict(conflictId));
            if (!conflict.isEscalated()) {
                conflict.setEscalated(true);
                writeCollection(userId, CONFLICTS, conflicts);
            }
            return conflict;
        });
    }

    // ==================== Internals ====================

    private BeliefConflict newConflict(String userId, String first, String second, BeliefConflict.Type type,
            String description) {
        return BeliefConflict.builder()
                .id(newId())
                .userId(userId)
                .beliefAId(first)
                .beliefBId(second)
                .conflictType(type)
                .description(description)
                .createdAt(now())
                .build();
    }

    private Optional<BeliefConflict> findUnresolvedPair(List<BeliefConflict> conflicts, String first, String second) {
        return conflicts.stream()
                .filter(conflict -> !conflict.isResolved())
                .filter(conflict -> first.equals(conflict.getBeliefAId()) && second.equals(conflict.getBeliefBId()))
                .findFirst();
    }

    private void applyTransition(Belief belief, StatusTransition transition) {
        belief.setStatus(transition.newStatus());
        if (transition.newStatus() == BeliefStatus.INVALIDATED) {
            belief.setInvalidationReason(transition.reason());
            belief.setValidTo(now());
        }
    }

    private Belief mutate(String userId, String beliefId, Consumer<Belief> change) {
        List<Belief> beliefs = readBeliefs(userId);
        for (Belief belief : beliefs) {
            if (belief.getId().equals(beliefId)) {
                change.accept(belief);
                writeCollection(userId, BELIEFS, beliefs);
                return belief;
            }
        }
        throw missingBelief(beliefId);
    }

    private static Comparator<Belief> ordering(BeliefQuery query) {
        Comparator<Belief> comparator = switch (query.getOrderBy()) {
        case CONFIDENCE -> Comparator.comparingDouble(Belief::getCurrentConfidence);
        case UPDATED_AT -> Comparator.comparing(Belief::getUpdatedAt, Comparator.nullsFirst(Comparator.naturalOrder()));
        case CREATED_AT -> Comparator.comparing(Belief::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder()));
        };
        return query.isDescending() ? comparator.reversed() : comparator;
    }

    private static boolean isEmpty(Collection<?> values) {
        return values == null || values.isEmpty();
    }

    private List<Belief> readBeliefs(String userId) {
        return readCollection(userId, BELIEFS, Belief.class);
    }

    private List<BeliefConflict> readConflicts(String userId) {
        return readCollection(userId, CONFLICTS, BeliefConflict.class);
    }

    private RuntimeException missingBelief(String beliefId) {
        return missing(KIND, BELIEFS, Belief.class, Belief::getId, beliefId);
    }

    private RuntimeException missingConflict(String conflictId) {
        return missing(CONFLICT_KIND, CONFLICTS, BeliefConflict.class, BeliefConflict::getId, conflictId);
    }
}
