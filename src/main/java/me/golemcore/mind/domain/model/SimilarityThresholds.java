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
 * Tuning of the keyword similarity heuristic.
 *
 * @param minTokenLength
 *            tokens must be strictly longer than this to count
 * @param duplicateOverlap
 *            overlap at or above which two propositions are duplicates
 * @param contradictionOverlap
 *            overlap above which opposite polarity means contradiction
 * @param temporalOverlap
 *            overlap above which two temporal statements conflict
 * @param learningKeywordMatches
 *            keyword hits needed for two learnings to be similar
 * @param beliefSearchKeywords
 *            number of leading keywords used for belief lookup
 */
public record SimilarityThresholds(int minTokenLength, double duplicateOverlap, double contradictionOverlap,
        double temporalOverlap, int learningKeywordMatches, int beliefSearchKeywords) {

    public static SimilarityThresholds defaults() {
        return new SimilarityThresholds(3, 0.8, 0.4, 0.5, 2, 5);
    }
}
