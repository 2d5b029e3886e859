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
import me.golemcore.mind.domain.model.ConsolidationResult;
import me.golemcore.mind.domain.model.ExtractedFact;
import me.golemcore.mind.domain.model.ExtractionReport;
import me.golemcore.mind.domain.model.Learning;
import me.golemcore.mind.domain.model.LearningCategory;
import me.golemcore.mind.domain.model.Observation;
import me.golemcore.mind.domain.model.PendingLearningConflict;
import me.golemcore.mind.domain.store.LearningStore;
import me.golemcore.mind.infrastructure.config.MindProperties;
import me.golemcore.mind.port.outbound.FactExtractionException;
import me.golemcore.mind.port.outbound.FactExtractionPort;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Turns extracted facts into learnings: a fact either reinforces the oldest
 * matching learning, contradicts it, or becomes a new learning.
 *
 * <p>
 * Contradictions are reported, not written; the caller decides what to do
 * with them. Every fact is processed in isolation, a failing fact never stops
 * its siblings.
 */
@Service
@Slf4j
public class LearningConsolidationService {

    static final String SKIP_TOO_SHORT = "Content too short";
    static final String SKIP_NO_SIGNALS = "No learnable content";
    static final String SKIP_NO_FACTS = "No facts extracted";

    private static final List<String> LEARNING_SIGNALS = List.of(
            "prefer", "like", "love", "enjoy", "favorite", "favourite", "hate", "dislike", "avoid",
            "always", "usually", "typically", "often", "never", "tend to", "habit",
            "i'm", "i am", "i've", "i have", "my", "me",
            "important", "value", "believe", "priority", "matter",
            "want to", "plan to", "goal", "hope to", "aspire", "dream",
            "work", "job", "career", "project", "team", "colleague",
            "friend", "family", "partner", "wife", "husband", "kid", "child", "parent",
            "exercise", "diet", "sleep", "health", "workout",
            "good at", "skilled", "expert", "learning", "studying");

    private final LearningStore learningStore;
    private final SimilarityClassifier similarityClassifier;
    private final FactExtractionPort factExtractionPort;
    private final MindProperties.ConsolidationProperties settings;

    public LearningConsolidationService(LearningStore learningStore, SimilarityClassifier similarityClassifier,
            FactExtractionPort factExtractionPort, MindProperties properties) {
        this.learningStore = learningStore;
        this.similarityClassifier = similarityClassifier;
        this.factExtractionPort = factExtractionPort;
        this.settings = properties.getConsolidation();
    }

    /**
     * Consolidates one fact observed in {@code sourceId}. Only the oldest
     * matching active learning of the same category is considered.
     */
    public ConsolidationResult consolidate(String userId, ExtractedFact fact, String sourceId) {
        LearningCategory category = fact.getCategory() != null ? fact.getCategory() : LearningCategory.OTHER;
        List<Learning> similar = learningStore.findSimilarLearnings(userId, category, fact.getStatement());
        if (similar.isEmpty()) {
            Learning created = learningStore.create(userId, fact, sourceId);
            return ConsolidationResult.created(created);
        }

        Learning existing = similar.get(0);
        if (similarityClassifier.contradictsLearning(fact.getStatement(), existing.getStatement())) {
            log.debug("[LearningConsolidation] Fact contradicts learning {}: {}", existing.getId(),
                    fact.getStatement());
            return ConsolidationResult.contradicted(new PendingLearningConflict(fact, existing, sourceId));
        }

        boolean replaceSuggested = fact.getConfidence() > existing.getConfidence() + settings.getRefinementMargin();
        Learning reinforced = learningStore.reinforce(userId, existing.getId(), sourceId, fact.getExcerpt(),
                fact.getConfidence());
        return ConsolidationResult.reinforced(reinforced, replaceSuggested);
    }

    /**
     * Consolidates a batch of facts from one source. A failure is recorded as
     * a {@link ConsolidationResult.Action#FAILED} entry and the batch moves on.
     */
    public List<ConsolidationResult> consolidateAll(String userId, List<ExtractedFact> facts, String sourceId) {
        List<ConsolidationResult> results = new ArrayList<>(facts.size());
        for (ExtractedFact fact : facts) {
            try {
                results.add(consolidate(userId, fact, sourceId));
            } catch (RuntimeException e) {
                log.warn("[LearningConsolidation] Failed to consolidate fact from {}: {}", sourceId, e.getMessage());
                results.add(ConsolidationResult.failed(e.getMessage()));
            }
        }
        return results;
    }

    /**
     * Whether the observation is worth an extraction call at all.
     */
    public boolean hasLearnableContent(String content) {
        if (content == null || content.length() < settings.getMinContentLength()) {
            return false;
        }
        String lowered = content.toLowerCase(Locale.ROOT);
        return LEARNING_SIGNALS.stream().anyMatch(lowered::contains);
    }

    /**
     * Pre-filters the observation, extracts facts through the external
     * backend, drops low-confidence facts and consolidates the rest.
     *
     * @throws FactExtractionException
     *             when the backend call fails
     */
    public ExtractionReport extractAndConsolidate(String userId, Observation observation)
            throws FactExtractionException {
        String content = observation.getContent();
        if (content == null || content.length() < settings.getMinContentLength()) {
            return ExtractionReport.skipped(observation.getId(), SKIP_TOO_SHORT);
        }
        if (!hasLearnableContent(content)) {
            return ExtractionReport.skipped(observation.getId(), SKIP_NO_SIGNALS);
        }

        List<ExtractedFact> facts = extract(content).stream()
                .filter(fact -> fact.getStatement() != null && !fact.getStatement().isBlank())
                .filter(fact -> fact.getConfidence() >= settings.getMinFactConfidence())
                .toList();
        if (facts.isEmpty()) {
            return ExtractionReport.skipped(observation.getId(), SKIP_NO_FACTS);
        }

        int created = 0;
        int reinforced = 0;
        int contradicted = 0;
        int failed = 0;
        List<PendingLearningConflict> conflicts = new ArrayList<>();
        for (ConsolidationResult result : consolidateAll(userId, facts, observation.getId())) {
            switch (result.action()) {
            case CREATED -> created++;
            case REINFORCED -> reinforced++;
            case CONTRADICTED -> {
                contradicted++;
                conflicts.add(result.conflict());
            }
            case FAILED -> failed++;
            }
        }
        log.debug("[LearningConsolidation] Observation {}: {} created, {} reinforced, {} contradicted, {} failed",
                observation.getId(), created, reinforced, contradicted, failed);
        return new ExtractionReport(observation.getId(), null, facts.size(), created, reinforced, contradicted,
                failed, conflicts);
    }

    private List<ExtractedFact> extract(String content) throws FactExtractionException {
        try {
            List<ExtractedFact> facts = factExtractionPort.extract(content).get();
            return facts != null ? facts : List.of();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FactExtractionException("Fact extraction interrupted", true, e);
        } catch (ExecutionException | CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof FactExtractionException extractionException) {
                throw extractionException;
            }
            throw new FactExtractionException("Fact extraction failed: " + cause.getMessage(), true, cause);
        }
    }
}
