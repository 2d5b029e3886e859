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
import me.golemcore.mind.domain.model.FeedbackSource;
import me.golemcore.mind.domain.model.ImplicitFeedback;
import me.golemcore.mind.domain.model.Outcome;
import me.golemcore.mind.domain.model.OutcomeQuery;
import me.golemcore.mind.domain.model.OutcomeSignal;
import me.golemcore.mind.domain.model.OutcomeStats;
import me.golemcore.mind.domain.model.Page;
import me.golemcore.mind.domain.model.RecordOutcomeRequest;
import me.golemcore.mind.domain.model.SourceEffectiveness;
import me.golemcore.mind.domain.store.OutcomeStore;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Records actions and the feedback they received. Propagation is left to
 * {@link FeedbackPropagationService}, normally run by the sleep engine.
 */
@Service
@Slf4j
public class OutcomeService {

    private final OutcomeStore outcomeStore;

    public OutcomeService(OutcomeStore outcomeStore) {
        this.outcomeStore = outcomeStore;
    }

    public Outcome recordOutcome(RecordOutcomeRequest request) {
        Outcome outcome = outcomeStore.create(request);
        log.debug("[Outcomes] Recorded {} outcome {} with {} source(s)", outcome.getActionType(), outcome.getId(),
                outcome.getSources().size());
        return outcome;
    }

    public Outcome recordFeedback(String userId, String outcomeId, OutcomeSignal signal, FeedbackSource source) {
        return recordFeedback(userId, outcomeId, signal, source, null);
    }

    /**
     * Attaches a feedback signal to a recorded outcome.
     *
     * @throws IllegalStateException
     *             when the outcome's feedback was already propagated
     */
    public Outcome recordFeedback(String userId, String outcomeId, OutcomeSignal signal, FeedbackSource source,
            Map<String, String> details) {
        if (signal == null) {
            throw new IllegalArgumentException("Feedback signal is required");
        }
        return outcomeStore.recordFeedback(userId, outcomeId, signal, source, details);
    }

    /**
     * Derives a signal from behavioural cues: a correction or an abandoned
     * result is negative, a used or continued one positive, anything else
     * neutral. Negative cues win over positive ones.
     */
    public Outcome recordImplicitFeedback(ImplicitFeedback feedback) {
        OutcomeSignal signal;
        FeedbackSource source;
        if (feedback.isCorrected() || feedback.isAbandoned()) {
            signal = OutcomeSignal.NEGATIVE;
            source = FeedbackSource.IMPLICIT_NEGATIVE;
        } else if (feedback.isUsed() || feedback.isContinued()) {
            signal = OutcomeSignal.POSITIVE;
            source = FeedbackSource.IMPLICIT_POSITIVE;
        } else {
            signal = OutcomeSignal.NEUTRAL;
            source = FeedbackSource.INFERRED;
        }

        Map<String, String> details = new LinkedHashMap<>();
        details.put("continued", Boolean.toString(feedback.isContinued()));
        details.put("corrected", Boolean.toString(feedback.isCorrected()));
        details.put("used", Boolean.toString(feedback.isUsed()));
        details.put("abandoned", Boolean.toString(feedback.isAbandoned()));
        if (feedback.getFollowUpMessage() != null) {
            details.put("followUpMessage", feedback.getFollowUpMessage());
        }
        return outcomeStore.recordFeedback(feedback.getUserId(), feedback.getOutcomeId(), signal, source, details);
    }

    public Outcome get(String userId, String outcomeId) {
        return outcomeStore.get(userId, outcomeId);
    }

    public Page<Outcome> list(String userId, OutcomeQuery query) {
        return outcomeStore.query(userId, query);
    }

    public OutcomeStats stats(String userId) {
        return outcomeStore.stats(userId);
    }

    public List<SourceEffectiveness> sourceEffectiveness(String userId) {
        return outcomeStore.sourceEffectiveness(userId);
    }
}
