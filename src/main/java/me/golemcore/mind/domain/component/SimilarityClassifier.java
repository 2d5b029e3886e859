package me.golemcore.mind.domain.component;

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

import me.golemcore.mind.domain.model.ConflictCheck;

/**
 * Decides whether two short statements about a user talk about the same
 * thing, repeat each other or contradict each other.
 *
 * <p>
 * Knowledge stores use it for candidate lookup, consolidation and belief
 * formation use it for the final verdict. Implementations must be stateless
 * and thread-safe.
 */
public interface SimilarityClassifier {

    /**
     * Whether an existing learning is a candidate match for an incoming
     * statement in the same category.
     */
    boolean isSimilarLearning(String incoming, String existing);

    /**
     * Whether an incoming learning statement contradicts an existing one.
     */
    boolean contradictsLearning(String incoming, String existing);

    /**
     * Whether an existing belief proposition is a candidate match for a new
     * proposition of the same type.
     */
    boolean isSimilarBelief(String proposition, String existing);

    /**
     * Classifies a new proposition against an existing belief as duplicate,
     * conflict or unrelated.
     */
    ConflictCheck checkConflict(String proposition, String existing);
}
