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
import me.golemcore.mind.domain.model.ActionType;
import me.golemcore.mind.domain.model.FeedbackSource;
import me.golemcore.mind.domain.model.Outcome;
import me.golemcore.mind.domain.model.OutcomeQuery;
import me.golemcore.mind.domain.model.OutcomeSignal;
import me.golemcore.mind.domain.model.OutcomeSource;
import me.golemcore.mind.domain.model.OutcomeStats;
import me.golemcore.mind.domain.model.Page;
import me.golemcore.mind.domain.model.RecordOutcomeRequest;
import me.golemcore.mind.domain.model.SourceEffectiveness;
import me.golemcore.mind.domain.model.SourceType;
import me.golemcore.mind.infrastructure.config.MindProperties;
import me.golemcore.mind.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Outcomes and their contributing sources, per owner. Sources are stored
 * inside their outcome.
 */
@Service
@Slf4j
public class OutcomeStore extends OwnerScopedStore {

    static final String OUTCOMES = "outcomes";

    private static final String KIND = "Outcome";

    private static final Comparator<Outcome> OLDEST_FEEDBACK_FIRST = Comparator
            .comparing(Outcome::getOutcomeAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(Outcome::getActionAt, Comparator.nullsLast(Comparator.naturalOrder()));

    private static final Comparator<Outcome> NEWEST_ACTION_FIRST = Comparator
            .comparing(Outcome::getActionAt, Comparator.nullsLast(Comparator.reverseOrder()));

    public OutcomeStore(StoragePort storagePort, ObjectMapper objectMapper, Clock clock, MindProperties properties) {
        super(storagePort, objectMapper, clock, properties.getStorage().getKnowledgeDirectory());
    }

    /**
     * Persists a new outcome with an unknown signal together with its
     * sources.
     */
    public Outcome create(RecordOutcomeRequest request) {
        if (request.getActionType() == null) {
            throw new IllegalArgumentException("Action type is required");
        }
        String userId = request.getUserId();
        return withOwnerLock(userId, () -> {
            Instant now = now();
            List<OutcomeSource> sources = new ArrayList<>();
            for (RecordOutcomeRequest.SourceRef ref : request.getSources()) {
                double weight = ref.contributionWeight() != null ? ref.contributionWeight()
                        : OutcomeSource.DEFAULT_WEIGHT;
                if (weight < 0) {
                    throw new IllegalArgumentException("Contribution weight must not be negative: " + weight);
                }
                sources.add(OutcomeSource.builder()
                        .id(newId())
                        .sourceType(ref.sourceType())
                        .sourceId(ref.sourceId())
                        .contributionWeight(weight)
                        .createdAt(now)
                        .build());
            }
            Outcome outcome = Outcome.builder()
                    .id(newId())
                    .userId(userId)
                    .actionType(request.getActionType())
                    .actionContent(request.getActionContent())
                    .actionContext(request.getActionContext() != null ? new LinkedHashMap<>(request.getActionContext())
                            : new LinkedHashMap<>())
                    .reasoningTrace(request.getReasoningTrace())
                    .outcomeSignal(OutcomeSignal.UNKNOWN)
                    .actionAt(now)
                    .sources(sources)
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            List<Outcome> outcomes = readOutcomes(userId);
            outcomes.add(outcome);
            writeCollection(userId, OUTCOMES, outcomes);
            return outcome;
        });
    }

    public Optional<Outcome> find(String userId, String outcomeId) {
        return readOutcomes(userId).stream().filter(outcome -> outcome.getId().equals(outcomeId)).findFirst();
    }

    public Outcome get(String userId, String outcomeId) {
        return find(userId, outcomeId).orElseThrow(() -> missingOutcome(outcomeId));
    }

    /**
     * Attaches a feedback signal to an outcome.
     *
     * @throws IllegalStateException
     *             when the outcome's feedback has already been propagated
     */
    public Outcome recordFeedback(String userId, String outcomeId, OutcomeSignal signal, FeedbackSource source,
            Map<String, String> details) {
        return withOwnerLock(userId, () -> {
            List<Outcome> outcomes = readOutcomes(userId);
            Outcome outcome = outcomes.stream()
                    .filter(candidate -> candidate.getId().equals(outcomeId))
                    .findFirst()
                    .orElseThrow(() -> missingOutcome(outcomeId));
            if (outcome.isFeedbackPropagated()) {
                throw new IllegalStateException("Feedback for outcome " + outcomeId + " was already propagated");
            }
            Instant now = now();
            outcome.setOutcomeSignal(signal);
            outcome.setFeedbackSource(source);
            if (details != null) {
                outcome.setOutcomeDetails(new LinkedHashMap<>(details));
            }
            outcome.setOutcomeAt(now);
            outcome.setUpdatedAt(now);
            writeCollection(userId, OUTCOMES, outcomes);
            return outcome;
        });
    }

    /**
     * Flips {@code feedbackPropagated} to true. Returns false when it was
     * already set, so only one caller ever wins.
     */
    public boolean markPropagated(String userId, String outcomeId) {
        return withOwnerLock(userId, () -> {
            List<Outcome> outcomes = readOutcomes(userId);
            Outcome outcome = outcomes.stream()
                    .filter(candidate -> candidate.getId().equals(outcomeId))
                    .findFirst()
                    .orElseThrow(() -> missingOutcome(outcomeId));
            if (outcome.isFeedbackPropagated()) {
                return false;
            }
            Instant now = now();
            outcome.setFeedbackPropagated(true);
            outcome.setPropagatedAt(now);
            outcome.setUpdatedAt(now);
            writeCollection(userId, OUTCOMES, outcomes);
            return true;
        });
    }

    public Page<Outcome> query(String userId, OutcomeQuery query) {
        List<Outcome> matches = readOutcomes(userId).stream()
                .filter(outcome -> query.getActionTypes() == null || query.getActionTypes().isEmpty()
                        || query.getActionTypes().contains(outcome.getActionType()))
                .filter(outcome -> query.getSignals() == null || query.getSignals().isEmpty()
                        || query.getSignals().contains(outcome.getOutcomeSignal()))
                .filter(outcome -> query.getFrom() == null
                        || (outcome.getActionAt() != null && !outcome.getActionAt().isBefore(query.getFrom())))
                .filter(outcome -> query.getTo() == null
                        || (outcome.getActionAt() != null && outcome.getActionAt().isBefore(query.getTo())))
                .filter(outcome -> query.getFeedbackPropagated() == null
                        || outcome.isFeedbackPropagated() == query.getFeedbackPropagated())
                .sorted(NEWEST_ACTION_FIRST)
                .toList();
        return new Page<>(page(matches, query.getOffset(), query.getLimit()), matches.size());
    }

    /**
     * Outcomes with a positive or negative signal that have not been
     * propagated yet, oldest feedback first.
     */
    public List<Outcome> findPendingPropagation(String userId, int limit) {
        return readOutcomes(userId).stream()
                .filter(outcome -> !outcome.isFeedbackPropagated())
                .filter(outcome -> outcome.getOutcomeSignal() != null && outcome.getOutcomeSignal().isActionable())
                .sorted(OLDEST_FEEDBACK_FIRST)
                .limit(Math.max(limit, 0))
                .toList();
    }

    public List<Outcome> findBySource(String userId, SourceType sourceType, String sourceId) {
        return readOutcomes(userId).stream()
                .filter(outcome -> outcome.getSources().stream()
                        .anyMatch(source -> source.getSourceType() == sourceType
                                && source.getSourceId().equals(sourceId)))
                .sorted(NEWEST_ACTION_FIRST)
                .toList();
    }

    public OutcomeStats stats(String userId) {
        List<Outcome> outcomes = readOutcomes(userId);
        Map<OutcomeSignal, Integer> bySignal = new EnumMap<>(OutcomeSignal.class);
        Map<ActionType, Integer> byActionType = new EnumMap<>(ActionType.class);
        int sourceCount = 0;
        for (Outcome outcome : outcomes) {
            bySignal.merge(outcome.getOutcomeSignal(), 1, Integer::sum);
            byActionType.merge(outcome.getActionType(), 1, Integer::sum);
            sourceCount += outcome.getSources().size();
        }
        int total = outcomes.size();
        int withFeedback = total - bySignal.getOrDefault(OutcomeSignal.UNKNOWN, 0);
        int positive = bySignal.getOrDefault(OutcomeSignal.POSITIVE, 0);
        double feedbackRate = total > 0 ? (double) withFeedback / total : 0;
        double positiveRate = withFeedback > 0 ? (double) positive / withFeedback : 0;
        double avgSources = total > 0 ? (double) sourceCount / total : 0;
        return new OutcomeStats(total, bySignal, byActionType, feedbackRate, positiveRate, avgSources);
    }

    /**
     * Per source type: how many distinct sources were used, how often, and
     * the share of positive among positive and negative outcomes. Outcomes
     * without feedback are ignored. Sorted by effectiveness, best first.
     */
    public List<SourceEffectiveness> sourceEffectiveness(String userId) {
        Map<SourceType, Set<String>> unique = new EnumMap<>(SourceType.class);
        Map<SourceType, int[]> counters = new EnumMap<>(SourceType.class);
        for (Outcome outcome : readOutcomes(userId)) {
            if (outcome.getOutcomeSignal() == OutcomeSignal.UNKNOWN) {
                continue;
            }
            for (OutcomeSource source : outcome.getSources()) {
                unique.computeIfAbsent(source.getSourceType(), type -> new HashSet<>()).add(source.getSourceId());
                int[] counts = counters.computeIfAbsent(source.getSourceType(), type -> new int[3]);
                counts[0]++;
                if (outcome.getOutcomeSignal() == OutcomeSignal.POSITIVE) {
                    counts[1]++;
                } else if (outcome.getOutcomeSignal() == OutcomeSignal.NEGATIVE) {
                    counts[2]++;
                }
            }
        }
        List<SourceEffectiveness> result = new ArrayList<>();
        counters.forEach((type, counts) -> {
            int judged = counts[1] + counts[2];
            double rate = judged > 0 ? (double) counts[1] / judged : 0;
            result.add(new SourceEffectiveness(type, unique.get(type).size(), counts[0], counts[1], counts[2], rate));
        });
        result.sort(Comparator.comparingDouble(SourceEffectiveness::effectivenessRate).reversed());
        return result;
    }

    /**
     * Hard-deletes propagated outcomes whose action happened before
     * {@code cutoff}.
     */
    public int deletePropagatedBefore(String userId, Instant cutoff) {
        return withOwnerLock(userId, () -> {
            List<Outcome> outcomes = readOutcomes(userId);
            int before = outcomes.size();
            outcomes.removeIf(outcome -> outcome.isFeedbackPropagated()
                    && outcome.getActionAt() != null && outcome.getActionAt().isBefore(cutoff));
            int deleted = before - outcomes.size();
            if (deleted > 0) {
                writeCollection(userId, OUTCOMES, outcomes);
                log.debug("[KnowledgeStore] Deleted {} propagated outcome(s) for {}", deleted, userId);
            }
            return deleted;
        });
    }

    private List<Outcome> readOutcomes(String userId) {
        return readCollection(userId, OUTCOMES, Outcome.class);
    }

    private RuntimeException missingOutcome(String outcomeId) {
        return missing(KIND, OUTCOMES, Outcome.class, Outcome::getId, outcomeId);
    }
}
