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
import me.golemcore.mind.domain.model.Belief;
import me.golemcore.mind.domain.model.BeliefUpdateRequest;
import me.golemcore.mind.domain.model.ConfidenceChange;
import me.golemcore.mind.domain.model.Outcome;
import me.golemcore.mind.domain.model.OutcomeSignal;
import me.golemcore.mind.domain.model.OutcomeSource;
import me.golemcore.mind.domain.model.PropagationBatch;
import me.golemcore.mind.domain.model.PropagationResult;
import me.golemcore.mind.domain.model.PropagationWeights;
import me.golemcore.mind.domain.store.BeliefStore;
import me.golemcore.mind.domain.store.LearningStore;
import me.golemcore.mind.domain.store.OutcomeStore;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Applies an outcome's feedback signal to the learnings and beliefs that
 * informed the action.
 *
 * <p>
 * Each source receives the base change for the signal scaled by its
 * contribution weight, clamped to {@link PropagationWeights#maxChange()};
 * changes below {@link PropagationWeights#minChange()} are dropped. Learnings
 * are nudged directly, beliefs go through a Bayesian update. Memory sources
 * carry no confidence and are ignored. The outcome is marked propagated
 * before its sources are updated and is never touched again, so its feedback
 * is applied at most once even when a source update fails.
 */
@Service
@Slf4j
public class FeedbackPropagationService {

    static final String POSITIVE_REASON = "Positive outcome feedback";
    static final String NEGATIVE_REASON = "Negative outcome feedback";

    private final OutcomeStore outcomeStore;
    private final LearningStore learningStore;
    private final BeliefStore beliefStore;
    private final PropagationWeights weights;

    public FeedbackPropagationService(OutcomeStore outcomeStore, LearningStore learningStore,
            BeliefStore beliefStore, PropagationWeights weights) {
        this.outcomeStore = outcomeStore;
        this.learningStore = learningStore;
        this.beliefStore = beliefStore;
        this.weights = weights;
    }

    /**
     * Propagates the outcome's feedback. A no-op for outcomes without an
     * actionable signal and for outcomes that were already propagated.
     */
    public PropagationResult propagateOutcome(Outcome outcome) {
        String userId = outcome.getUserId();
        Outcome current = outcomeStore.get(userId, outcome.getId());
        OutcomeSignal signal = current.getOutcomeSignal();
        if (current.isFeedbackPropagated() || signal == null || !signal.isActionable()) {
            return PropagationResult.noop(current.getId(), signal);
        }

        // Claimed before any source is touched, so a concurrent or re-entrant
        // call for the same outcome cannot apply the feedback a second time.
        if (!outcomeStore.markPropagated(userId, current.getId())) {
            log.debug("[FeedbackPropagator] Outcome {} already claimed by another propagation", current.getId());
            return PropagationResult.noop(current.getId(), signal);
        }

        boolean positive = signal == OutcomeSignal.POSITIVE;
        double baseChange = positive ? weights.positiveChange() : weights.negativeChange();
        List<ConfidenceChange> learningsUpdated = new ArrayList<>();
        List<ConfidenceChange> beliefsUpdated = new ArrayList<>();

        for (OutcomeSource source : current.getSources()) {
            double scaled = baseChange * source.getContributionWeight();
            if (Math.abs(scaled) < weights.minChange()) {
                continue;
            }
            double change = Math.max(-weights.maxChange(), Math.min(weights.maxChange(), scaled));
            switch (source.getSourceType()) {
            case LEARNING -> learningStore.nudgeConfidence(userId, source.getSourceId(), change)
                    .ifPresent(learningsUpdated::add);
            case BELIEF -> updateBelief(userId, source.getSourceId(), change, positive)
                    .ifPresent(beliefsUpdated::add);
            case MEMORY -> {
                // informational only
            }
            }
        }

        log.debug("[FeedbackPropagator] Outcome {} ({}) propagated: {} learning(s), {} belief(s)", current.getId(),
                signal, learningsUpdated.size(), beliefsUpdated.size());
        return new PropagationResult(current.getId(), signal, learningsUpdated, beliefsUpdated, true);
    }

    /**
     * Propagates the user's oldest pending outcomes, at most {@code limit}, one
     * after the other. A failing outcome is logged and the batch moves on.
     */
    public PropagationBatch processPendingPropagations(String userId, int limit) {
        List<PropagationResult> results = new ArrayList<>();
        for (Outcome outcome : outcomeStore.findPendingPropagation(userId, limit)) {
            try {
                results.add(propagateOutcome(outcome));
            } catch (RuntimeException e) {
                log.warn("[FeedbackPropagator] Failed to propagate outcome {}: {}", outcome.getId(), e.getMessage());
            }
        }
        PropagationBatch batch = new PropagationBatch(results.size(), results);
        if (batch.processed() > 0) {
            log.info("[FeedbackPropagator] Propagated {} outcome(s) for {}: {} learning(s), {} belief(s) updated",
                    batch.processed(), userId, batch.learningsUpdated(), batch.beliefsUpdated());
        }
        return batch;
    }

    private Optional<ConfidenceChange> updateBelief(String userId, String beliefId, double change,
            boolean positive) {
        Optional<Belief> belief = beliefStore.find(userId, beliefId);
        if (belief.isEmpty()) {
            log.debug("[FeedbackPropagator] Belief source {} not found for {}", beliefId, userId);
            return Optional.empty();
        }
        double previous = belief.get().getCurrentConfidence();
        Belief updated = beliefStore.applyBayesianUpdate(BeliefUpdateRequest.builder()
                .beliefId(beliefId)
                .userId(userId)
                .evidenceStrength(Math.abs(change) * 2)
                .supports(positive)
                .reason(positive ? POSITIVE_REASON : NEGATIVE_REASON)
                .build());
        return Optional.of(new ConfidenceChange(beliefId, previous, updated.getCurrentConfidence()));
    }
}
