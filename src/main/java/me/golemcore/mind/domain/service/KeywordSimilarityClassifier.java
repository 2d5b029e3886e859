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

import me.golemcore.mind.domain.component.SimilarityClassifier;
import me.golemcore.mind.domain.model.BeliefConflict;
import me.golemcore.mind.domain.model.ConflictCheck;
import me.golemcore.mind.domain.model.SimilarityThresholds;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Keyword and negation heuristic implementation of
 * {@link SimilarityClassifier}.
 *
 * <p>
 * Statements are tokenized on whitespace, lowercased and stripped of leading
 * and trailing punctuation; only tokens longer than
 * {@link SimilarityThresholds#minTokenLength()} count as keywords. Overlap
 * between two statements is the size of the keyword intersection divided by
 * the size of the smaller keyword set.
 *
 * <p>
 * This is an approximation. It misses paraphrases and can flag unrelated
 * statements that share polarity words; an embedding-based classifier can
 * replace it behind the same interface.
 */
@Component
public class KeywordSimilarityClassifier implements SimilarityClassifier {

    private static final List<String> NEGATIONS = List.of(
            "not", "don't", "doesn't", "won't", "never", "avoid", "hate", "dislike");

    private static final List<PolarityPattern> POLARITY_PATTERNS = List.of(
            new PolarityPattern("likes?|loves?|enjoys?|prefers?", "hates?|dislikes?|avoids?"),
            new PolarityPattern("always|every|constantly", "never|rarely|seldom"),
            new PolarityPattern("can|able to|capable", "cannot|unable|incapable"),
            new PolarityPattern("is a|works as|employed", "is not|isn't|no longer"));

    private static final Pattern TEMPORAL_MARKERS = Pattern.compile(
            "\\b(now|currently|used to|before|previously|lately|recently)\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern EDGE_PUNCTUATION = Pattern.compile("^[\\p{Punct}]+|[\\p{Punct}]+$");

    private final SimilarityThresholds thresholds;

    public KeywordSimilarityClassifier(SimilarityThresholds thresholds) {
        this.thresholds = thresholds;
    }

    @Override
    public boolean isSimilarLearning(String incoming, String existing) {
        List<String> keywords = keywords(incoming);
        List<String> existingWords = words(existing);
        long matches = keywords.stream()
                .filter(keyword -> existingWords.stream().anyMatch(word -> word.contains(keyword)))
                .count();
        return matches >= thresholds.learningKeywordMatches();
    }

    @Override
    public boolean contradictsLearning(String incoming, String existing) {
        return hasNegation(incoming) != hasNegation(existing);
    }

    @Override
    public boolean isSimilarBelief(String proposition, String existing) {
        List<String> leading = words(proposition).stream()
                .limit(thresholds.beliefSearchKeywords())
                .filter(this::isKeyword)
                .toList();
        if (leading.isEmpty()) {
            return true;
        }
        String haystack = lower(existing);
        return leading.stream().anyMatch(haystack::contains);
    }

    @Override
    public ConflictCheck checkConflict(String proposition, String existing) {
        double overlap = overlap(proposition, existing);
        if (overlap >= thresholds.duplicateOverlap()) {
            return ConflictCheck.duplicate(overlap);
        }

        if (overlap > thresholds.contradictionOverlap()) {
            for (PolarityPattern pattern : POLARITY_PATTERNS) {
                if (pattern.opposes(proposition, existing)) {
                    return ConflictCheck.conflict(BeliefConflict.Type.CONTRADICTION,
                            "Potential contradiction: \"" + proposition + "\" vs \"" + existing + "\"", overlap);
                }
            }
        }

        if (overlap > thresholds.temporalOverlap()
                && TEMPORAL_MARKERS.matcher(proposition).find()
                && TEMPORAL_MARKERS.matcher(existing).find()) {
            return ConflictCheck.conflict(BeliefConflict.Type.TEMPORAL,
                    "Possible temporal conflict: beliefs may apply to different time periods", overlap);
        }
        return ConflictCheck.none(overlap);
    }

    /**
     * Keyword intersection over the smaller keyword set; 0 when either side
     * has no keywords.
     */
    double overlap(String first, String second) {
        Set<String> a = new LinkedHashSet<>(keywords(first));
        Set<String> b = new LinkedHashSet<>(keywords(second));
        if (a.isEmpty() || b.isEmpty()) {
            return 0;
        }
        long shared = a.stream().filter(b::contains).count();
        return (double) shared / Math.min(a.size(), b.size());
    }

    List<String> keywords(String text) {
        return words(text).stream().filter(this::isKeyword).toList();
    }

    private boolean isKeyword(String word) {
        return word.length() > thresholds.minTokenLength();
    }

    private List<String> words(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<String> words = new ArrayList<>();
        for (String raw : Arrays.asList(WHITESPACE.split(lower(text).trim()))) {
            String word = EDGE_PUNCTUATION.matcher(raw).replaceAll("");
            if (!word.isEmpty()) {
                words.add(word);
            }
        }
        return words;
    }

    private boolean hasNegation(String text) {
        String lowered = lower(text);
        return NEGATIONS.stream().anyMatch(lowered::contains);
    }

    private static String lower(String text) {
        return text == null ? "" : text.toLowerCase(Locale.ROOT);
    }

    private record PolarityPattern(Pattern positive, Pattern negative) {

        PolarityPattern(String positive, String negative) {
            this(Pattern.compile(positive, Pattern.CASE_INSENSITIVE), Pattern.compile(negative, Pattern.CASE_INSENSITIVE));
        }

        boolean opposes(String first, String second) {
            boolean firstPositive = positive.matcher(first).find();
            boolean firstNegative = negative.matcher(first).find();
            boolean secondPositive = positive.matcher(second).find();
            boolean secondNegative = negative.matcher(second).find();
            return (firstPositive && secondNegative) || (firstNegative && secondPositive);
        }
    }
}
