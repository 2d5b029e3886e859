package me.golemcore.mind.domain.service;

import me.golemcore.mind.domain.model.BeliefConflict;
import me.golemcore.mind.domain.model.ConflictCheck;
import me.golemcore.mind.domain.model.SimilarityThresholds;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class KeywordSimilarityClassifierTest {

    private KeywordSimilarityClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new KeywordSimilarityClassifier(SimilarityThresholds.defaults());
    }

    @Test
    void keywordsDropShortTokensAndEdgePunctuation() {
        List<String> keywords = classifier.keywords("The user, likes \"long\" walks at dawn!");

        assertEquals(List.of("user", "likes", "long", "walks", "dawn"), keywords);
    }

    @Test
    void overlapIsRelativeToSmallerKeywordSet() {
        assertEquals(1.0, classifier.overlap("morning meetings", "User prefers morning meetings"), 1e-9);
        assertEquals(0.0, classifier.overlap("a b c", "User prefers morning meetings"), 1e-9);
    }

    // ==================== Conflict check ====================

    @Test
    void nearIdenticalPropositionsAreDuplicates() {
        ConflictCheck check = classifier.checkConflict("User prefers morning meetings.",
                "User prefers morning meetings");

        assertTrue(check.isDuplicate());
        assertEquals(BeliefConflict.Type.OVERLAP, check.conflictType());
    }

    @Test
    void oppositePolarityIsContradiction() {
        ConflictCheck check = classifier.checkConflict("User likes spicy food", "User hates spicy food");

        assertTrue(check.isConflict());
        assertEquals(BeliefConflict.Type.CONTRADICTION, check.conflictType());
        assertTrue(check.description().startsWith("Potential contradiction"));
    }

    @Test
    void temporalMarkersOnBothSidesAreTemporalConflict() {
        ConflictCheck check = classifier.checkConflict("User currently works remotely from Berlin",
                "User previously works remotely from Lisbon");

        assertTrue(check.isConflict());
        assertEquals(BeliefConflict.Type.TEMPORAL, check.conflictType());
    }

    @Test
    void unrelatedPropositionsDoNotConflict() {
        ConflictCheck check = classifier.checkConflict("User enjoys hiking", "Meeting notes archived weekly");

        assertEquals(ConflictCheck.Verdict.NONE, check.verdict());
        assertEquals(0.0, check.overlap(), 1e-9);
    }

    // ==================== Candidate lookup ====================

    @Test
    void learningsSharingKeywordsAreSimilar() {
        assertTrue(classifier.isSimilarLearning("prefers dark mode editors", "User prefers dark themes in editors"));
        assertFalse(classifier.isSimilarLearning("enjoys jazz music", "User prefers dark themes"));
    }

    @Test
    void negationMismatchContradictsLearning() {
        assertTrue(classifier.contradictsLearning("User does not like coffee", "User likes coffee"));
        assertFalse(classifier.contradictsLearning("User likes tea", "User likes coffee"));
    }

    @Test
    void beliefLookupUsesLeadingKeywords() {
        assertTrue(classifier.isSimilarBelief("User prefers morning meetings.", "The user works late"));
        assertFalse(classifier.isSimilarBelief("Enjoys hiking outdoors", "Prefers tea"));
    }

    @Test
    void propositionWithoutKeywordsMatchesEverything() {
        assertTrue(classifier.isSimilarBelief("I am ok", "Anything at all"));
    }
}
