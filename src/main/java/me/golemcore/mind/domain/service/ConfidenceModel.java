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

import me.golemcore.mind.domain.model.BayesianUpdateResult;
import me.golemcore.mind.domain.model.BeliefEvidence;
import me.golemcore.mind.domain.model.BeliefStatus;
import me.golemcore.mind.domain.model.ConfidenceHistoryEntry;
import me.golemcore.mind.domain.model.ConfidenceTrend;
import me.golemcore.mind.domain.model.EvidenceInput;
import me.golemcore.mind.domain.model.StatusTransition;
import me.golemcore.mind.domain.model.Strength;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Pure confidence arithmetic shared by learnings and beliefs: Bayesian odds
 * update, strength labels, decay, staleness, trend analysis and the belief
 * status transition rule.
 *
 * <p>
 * Every confidence produced here lies in
 * [{@link #MIN_CONFIDENCE}, {@link #MAX_CONFIDENCE}].
 */
public final class ConfidenceModel {

    public static final double MIN_CONFIDENCE = 0.01;
    public static final double MAX_CONFIDENCE = 0.99;
    public static final double MIN_EVIDENCE_STRENGTH = 0.1;
    public static final double MAX_EVIDENCE_STRENGTH = 1.0;

    public static final double INVALIDATION = 0.10;
    public static final double UNCERTAIN = 0.30;
    public static final double BELIEF_MODERATE = 0.40;
    public static final double LEARNING_MODERATE = 0.30;
    public static final double STRONG = 0.70;
    public static final double DEFINITIVE = 0.85;
    public static final double FORMATION_MIN = 0.5;

    public static final double RE_EVALUATE_DELTA = 0.10;
    public static final double TREND_SLOPE = 0.01;
    public static final int MAX_HISTORY = 50;

    private static final double LEARNING_EVIDENCE_SATURATION = 1.5;
    private static final double REINFORCEMENT_BONUS = 0.1;
    private static final double MILLIS_PER_DAY = 24d * 60 * 60 * 1000;

    private ConfidenceModel() {
    }

    /**
     * Odds-form Bayesian update. Supporting evidence multiplies the prior odds
     * by {@code 1 + 2s}, contradicting evidence by {@code 1 / (1 + 2s)}.
     */
    public static BayesianUpdateResult bayesianUpdate(double prior, double evidenceStrength, boolean supports) {
        double p = clampConfidence(prior);
        double s = clamp(evidenceStrength, MIN_EVIDENCE_STRENGTH, MAX_EVIDENCE_STRENGTH);
        double likelihoodRatio = supports ? 1 + 2 * s : 1 / (1 + 2 * s);
        double odds = p / (1 - p) * likelihoodRatio;
        double posterior = clampConfidence(odds / (1 + odds));
        double delta = posterior - p;

        BeliefStatus suggested;
        if (posterior < INVALIDATION) {
            suggested = BeliefStatus.INVALIDATED;
        } else if (posterior < UNCERTAIN) {
            suggested = BeliefStatus.UNCERTAIN;
        } else {
            suggested = BeliefStatus.ACTIVE;
        }
        return new BayesianUpdateResult(p, posterior, delta, suggested, Math.abs(delta) > RE_EVALUATE_DELTA);
    }

    /**
     * Applies the evidence sequentially, in list order. Order matters.
     */
    public static double combineEvidence(double prior, List<EvidenceInput> evidence) {
        double confidence = prior;
        for (EvidenceInput item : evidence) {
            confidence = bayesianUpdate(confidence, item.strength(), item.supports()).posterior();
        }
        return confidence;
    }

    public static Strength beliefStrength(double confidence) {
        return classify(confidence, BELIEF_MODERATE);
    }

    /**
     * Learning strength scales confidence by evidence count, saturating at
     * 1.5x once 4.5 observations back it.
     */
    public static Strength learningStrength(double confidence, int evidenceCount) {
        double score = confidence * Math.min(evidenceCount / 3.0, LEARNING_EVIDENCE_SATURATION);
        return classify(score, LEARNING_MODERATE);
    }

    private static Strength classify(double score, double moderateThreshold) {
        if (score >= DEFINITIVE) {
            return Strength.DEFINITIVE;
        }
        if (score >= STRONG) {
            return Strength.STRONG;
        }
        if (score >= moderateThreshold) {
            return Strength.MODERATE;
        }
        return Strength.WEAK;
    }

    /**
     * Weighted merge of a learning's confidence with a new observation's,
     * biased upward as evidence accumulates.
     */
    public static double recalculateLearningConfidence(double current, double incoming, int evidenceCount) {
        double weight = Math.min(evidenceCount / 5.0, 1.0);
        double base = (current + incoming) / 2;
        return clampConfidence(base + REINFORCEMENT_BONUS * weight);
    }

    public static double decay(double confidence, double decayRate) {
        return clampConfidence(confidence * (1 - decayRate));
    }

    public static boolean isStale(Instant lastTouched, Instant now, int decayStartDays) {
        if (lastTouched == null) {
            return true;
        }
        return !lastTouched.isAfter(now.minus(Duration.ofDays(decayStartDays)));
    }

    public static double defaultEvidenceStrength(BeliefEvidence.Type type) {
        if (type == null) {
            return 0.5;
        }
        return switch (type) {
        case DIRECT -> 0.9;
        case INFERRED -> 0.6;
        case LEARNED -> 0.7;
        case VALIDATED -> 0.95;
        case CONTRADICTED -> 0.8;
        };
    }

    /**
     * Returns a new list with {@code entry} appended, dropping the oldest
     * entries beyond {@code maxEntries}.
     */
    public static List<ConfidenceHistoryEntry> appendHistory(List<ConfidenceHistoryEntry> history,
            ConfidenceHistoryEntry entry, int maxEntries) {
        List<ConfidenceHistoryEntry> appended = new ArrayList<>(history == null ? List.of() : history);
        appended.add(entry);
        if (appended.size() > maxEntries) {
            return new ArrayList<>(appended.subList(appended.size() - maxEntries, appended.size()));
        }
        return appended;
    }

    /**
     * Mean, population standard deviation and least-squares slope of the
     * history over its index. Empty for fewer than two points.
     */
    public static Optional<ConfidenceTrend> analyzeTrend(List<ConfidenceHistoryEntry> history) {
        if (history == null || history.size() < 2) {
            return Optional.empty();
        }
        int n = history.size();
        double mean = history.stream().mapToDouble(ConfidenceHistoryEntry::confidence).average().orElse(0);

        double squared = 0;
        double numerator = 0;
        double denominator = 0;
        double xMean = (n - 1) / 2.0;
        for (int i = 0; i < n; i++) {
            double diff = history.get(i).confidence() - mean;
            squared += diff * diff;
            numerator += (i - xMean) * diff;
            denominator += (i - xMean) * (i - xMean);
        }
        double stdDev = Math.sqrt(squared / n);
        double slope = denominator != 0 ? numerator / denominator : 0;

        ConfidenceTrend.Direction direction;
        if (slope > TREND_SLOPE) {
            direction = ConfidenceTrend.Direction.INCREASING;
        } else if (slope < -TREND_SLOPE) {
            direction = ConfidenceTrend.Direction.DECREASING;
        } else {
            direction = ConfidenceTrend.Direction.STABLE;
        }

        double timeSpanDays = 0;
        Instant first = history.get(0).timestamp();
        Instant last = history.get(n - 1).timestamp();
        if (first != null && last != null) {
            timeSpanDays = Duration.between(first, last).toMillis() / MILLIS_PER_DAY;
        }
        return Optional.of(new ConfidenceTrend(mean, stdDev, slope, direction, n, timeSpanDays));
    }

    /**
     * Belief status after a confidence change. Empty when the status stays.
     */
    public static Optional<StatusTransition> transitionStatus(BeliefStatus current, double confidence,
            int supportingCount, int contradictingCount) {
        if (confidence < INVALIDATION && contradictingCount > supportingCount
                && current != BeliefStatus.INVALIDATED) {
            return Optional.of(new StatusTransition(BeliefStatus.INVALIDATED,
                    "Confidence dropped below threshold with contradicting evidence"));
        }
        if (confidence < UNCERTAIN && current == BeliefStatus.ACTIVE) {
            return Optional.of(new StatusTransition(BeliefStatus.UNCERTAIN,
                    "Confidence dropped below " + UNCERTAIN));
        }
        if (confidence >= BELIEF_MODERATE && current == BeliefStatus.UNCERTAIN) {
            return Optional.of(new StatusTransition(BeliefStatus.ACTIVE, "Confidence recovered above threshold"));
        }
        return Optional.empty();
    }

    public static double clampConfidence(double value) {
        return clamp(value, MIN_CONFIDENCE, MAX_CONFIDENCE);
    }

    private static double clamp(double value, double min, double max) {
        if (Double.isNaN(value)) {
            return min;
        }
        return Math.max(min, Math.min(max, value));
    }
}
