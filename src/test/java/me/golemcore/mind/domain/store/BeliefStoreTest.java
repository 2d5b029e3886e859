package me.golemcore.mind.domain.store;

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
import me.golemcore.mind.domain.model.SimilarityThresholds;
import me.golemcore.mind.domain.service.KeywordSimilarityClassifier;
import me.golemcore.mind.testsupport.MutableClock;
import me.golemcore.mind.testsupport.TestWorkspace;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class BeliefStoreTest {

    private static final String USER = "alice";
    private static final String OTHER_USER = "bob";
    private static final Instant START = Instant.parse("2026-03-01T09:00:00Z");

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private BeliefStore store;

    @BeforeEach
    void setUp() {
        TestWorkspace workspace = new TestWorkspace(tempDir);
        clock = new MutableClock(START);
        store = new BeliefStore(workspace.storage(), workspace.objectMapper(), clock,
                new KeywordSimilarityClassifier(SimilarityThresholds.defaults()), workspace.properties());
    }

    private Belief belief(String proposition, double prior) {
        return store.create(NewBelief.builder()
                .userId(USER)
                .proposition(proposition)
                .beliefType(BeliefType.PREFERENCE)
                .priorConfidence(prior)
                .build());
    }

    private Belief update(Belief belief, double strength, boolean supports) {
        return store.applyBayesianUpdate(BeliefUpdateRequest.builder()
                .userId(USER)
                .beliefId(belief.getId())
                .evidenceStrength(strength)
                .supports(supports)
                .reason(supports ? "confirmed" : "contradicted")
                .build());
    }

    // ==================== Creation ====================

    @Test
    void createStartsHistoryWithPrior() {
        Belief created = belief("User prefers morning meetings.", 0.6);

        Belief stored = store.get(USER, created.getId());
        assertEquals(BeliefStatus.ACTIVE, stored.getStatus());
        assertEquals(0.6, stored.getCurrentConfidence(), 1e-9);
        assertEquals(1, stored.getConfidenceHistory().size());
        assertEquals("Belief created", stored.getConfidenceHistory().get(0).reason());
        assertEquals(START, stored.getCreatedAt());
    }

    @Test
    void createLinksSourceLearningAsEvidence() {
        Belief created = store.create(NewBelief.builder()
                .userId(USER)
                .proposition("User values honesty.")
                .beliefType(BeliefType.IDENTITY)
                .derivedFromLearning("learning-1")
                .sourceLearningId("learning-1")
                .build());

        List<BeliefEvidence> evidence = store.listEvidence(USER, created.getId());
        assertEquals(1, evidence.size());
        assertEquals(BeliefEvidence.Type.LEARNED, evidence.get(0).getEvidenceType());
        assertEquals("learning-1", evidence.get(0).getLearningId());
        assertEquals(0.7, evidence.get(0).getStrength(), 1e-9);
        assertEquals(List.of(created.getId()), store.findByDerivedLearning(USER, "learning-1").stream()
                .map(Belief::getId).toList());
    }

    @Test
    void createRejectsUnknownDependency() {
        NewBelief input = NewBelief.builder()
                .userId(USER)
                .proposition("User likes jazz.")
                .beliefType(BeliefType.PREFERENCE)
                .dependsOn(Set.of("missing"))
                .build();

        assertThrows(KnowledgeNotFoundException.class, () -> store.create(input));
    }

    // ==================== Bayesian updates ====================

    @Test
    void supportingUpdateRaisesConfidenceAndAppendsHistory() {
        Belief created = belief("User likes jazz.", 0.5);

        Belief updated = update(created, 0.5, true);

        assertEquals(2.0 / 3.0, updated.getCurrentConfidence(), 1e-9);
        assertEquals(1, updated.getSupportingCount());
        assertEquals(0, updated.getContradictingCount());
        assertEquals(2, updated.getConfidenceHistory().size());
        assertEquals("confirmed", updated.getConfidenceHistory().get(1).reason());
    }

    @Test
    void contradictionsMakeBeliefUncertainThenInvalid() {
        Belief created = belief("User likes jazz.", 0.5);

        Belief uncertain = update(created, 1.0, false);
        assertEquals(BeliefStatus.UNCERTAIN, uncertain.getStatus());

        update(created, 1.0, false);
        Belief invalidated = update(created, 1.0, false);

        assertEquals(BeliefStatus.INVALIDATED, invalidated.getStatus());
        assertNotNull(invalidated.getInvalidationReason());
        assertEquals(START, invalidated.getValidTo());
    }

    @Test
    void historyIsCappedAndTracksCurrentConfidence() {
        Belief created = belief("User likes jazz.", 0.5);

        for (int i = 0; i < 60; i++) {
            clock.advance(Duration.ofMinutes(1));
            update(created, 0.2, i % 2 == 0);
        }

        Belief stored = store.get(USER, created.getId());
        List<ConfidenceHistoryEntry> history = stored.getConfidenceHistory();
        assertEquals(50, history.size());
        assertEquals(stored.getCurrentConfidence(), history.get(history.size() - 1).confidence(), 1e-12);
        assertEquals(60, stored.getSupportingCount() + stored.getContradictingCount());
    }

    @Test
    void updatingAnotherUsersBeliefIsDenied() {
        Belief created = belief("User likes jazz.", 0.5);

        BeliefUpdateRequest request = BeliefUpdateRequest.builder()
                .userId(OTHER_USER)
                .beliefId(created.getId())
                .evidenceStrength(0.5)
                .supports(true)
                .reason("sneaky")
                .build();

        assertThrows(KnowledgeAccessDeniedException.class, () -> store.applyBayesianUpdate(request));
        assertEquals(0.5, store.get(USER, created.getId()).getCurrentConfidence(), 1e-9);
    }

    @Test
    void trendFollowsHistory() {
        Belief created = belief("User likes jazz.", 0.5);
        update(created, 0.5, true);
        update(created, 0.5, true);

        ConfidenceTrend trend = store.trend(USER, created.getId()).orElseThrow();

        assertEquals(ConfidenceTrend.Direction.INCREASING, trend.direction());
        assertEquals(3, trend.updateCount());
    }

    // ==================== Decay and archival ====================

    @Test
    void decayRecordsHistoryAndMarksUncertain() {
        Belief weak = belief("User likes opera.", 0.31);
        Belief strong = belief("User likes jazz.", 0.9);
        clock.advance(Duration.ofDays(45));

        DecayResult result = store.applyDecay(USER, clock.instant().minus(Duration.ofDays(30)), 0.1, 0.3, 10);

        assertEquals(2, result.decayed());
        assertEquals(1, result.weakened());
        Belief decayed = store.get(USER, weak.getId());
        assertEquals(BeliefStatus.UNCERTAIN, decayed.getStatus());
        assertEquals("Confidence decay (no recent evidence)",
                decayed.getConfidenceHistory().get(decayed.getConfidenceHistory().size() - 1).reason());
        assertEquals(0.81, store.get(USER, strong.getId()).getCurrentConfidence(), 1e-9);
    }

    @Test
    void decayedBeliefIsNotDecayedAgainUntilStaleAgain() {
        Belief created = belief("User likes jazz.", 0.9);
        clock.advance(Duration.ofDays(45));
        Instant staleBefore = clock.instant().minus(Duration.ofDays(30));

        assertEquals(1, store.applyDecay(USER, staleBefore, 0.1, 0.3, 10).decayed());
        clock.advance(Duration.ofHours(6));
        DecayResult second = store.applyDecay(USER, clock.instant().minus(Duration.ofDays(30)), 0.1, 0.3, 10);

        assertEquals(0, second.decayed());
        assertEquals(0.81, store.get(USER, created.getId()).getCurrentConfidence(), 1e-9);
    }

    @Test
    void archiveStaleArchivesLowConfidenceBeliefs() {
        Belief weak = belief("User likes opera.", 0.1);
        belief("User likes jazz.", 0.9);
        clock.advance(Duration.ofDays(120));

        int archived = store.archiveStale(USER, 0.15, clock.instant().minus(Duration.ofDays(90)));

        assertEquals(1, archived);
        assertEquals(BeliefStatus.ARCHIVED, store.get(USER, weak.getId()).getStatus());
    }

    // ==================== Dependencies ====================

    @Test
    void dependencyCyclesAreRejected() {
        Belief a = belief("User works remotely.", 0.7);
        Belief b = belief("User avoids commuting.", 0.6);
        Belief c = belief("User lives far from the office.", 0.6);

        store.addDependency(USER, b.getId(), a.getId());
        store.addDependency(USER, c.getId(), b.getId());

        assertThrows(IllegalArgumentException.class, () -> store.addDependency(USER, a.getId(), c.getId()));
        assertThrows(IllegalArgumentException.class, () -> store.addDependency(USER, a.getId(), a.getId()));
        assertEquals(List.of(b.getId()), store.getDependentBeliefs(USER, a.getId()).stream()
                .map(Belief::getId).toList());
    }

    // ==================== Conflicts ====================

    @Test
    void conflictPairIsCanonicalAndRecordedOnce() {
        Belief a = belief("User likes spicy food.", 0.7);
        Belief b = belief("User hates spicy food.", 0.6);

        BeliefConflict first = store.recordConflict(USER, b.getId(), a.getId(), BeliefConflict.Type.CONTRADICTION,
                "contradiction");
        BeliefConflict second = store.recordConflict(USER, a.getId(), b.getId(), BeliefConflict.Type.CONTRADICTION,
                "contradiction");

        assertEquals(first.getId(), second.getId());
        assertTrue(first.getBeliefAId().compareTo(first.getBeliefBId()) < 0);
        assertEquals(1, store.listUnresolvedConflicts(USER).size());
    }

    @Test
    void beliefCannotConflictWithItself() {
        Belief a = belief("User likes spicy food.", 0.7);

        assertThrows(IllegalArgumentException.class,
                () -> store.recordConflict(USER, a.getId(), a.getId(), BeliefConflict.Type.OVERLAP, "self"));
    }

    @Test
    void pendingConflictIsCompletedWithCounterpart() {
        Belief existing = belief("User likes spicy food.", 0.7);
        BeliefConflict pending = store.recordPendingConflict(USER, existing.getId(),
                BeliefConflict.Type.CONTRADICTION, "contradiction");
        assertTrue(pending.isPending());

        Belief created = belief("User hates spicy food.", 0.6);
        BeliefConflict attached = store.attachConflictCounterpart(USER, pending.getId(), created.getId());

        assertFalse(attached.isPending());
        assertTrue(attached.involves(existing.getId()));
        assertTrue(attached.involves(created.getId()));
        assertTrue(attached.getBeliefAId().compareTo(attached.getBeliefBId()) < 0);
    }

    @Test
    void discardRemovesOnlyPendingConflicts() {
        Belief a = belief("User likes spicy food.", 0.7);
        Belief b = belief("User hates spicy food.", 0.6);
        BeliefConflict pending = store.recordPendingConflict(USER, a.getId(), BeliefConflict.Type.OVERLAP, "dup");
        BeliefConflict full = store.recordConflict(USER, a.getId(), b.getId(), BeliefConflict.Type.CONTRADICTION,
                "contradiction");

        store.discardPendingConflicts(USER, List.of(pending.getId(), full.getId()));

        List<BeliefConflict> remaining = store.listUnresolvedConflicts(USER);
        assertEquals(1, remaining.size());
        assertEquals(full.getId(), remaining.get(0).getId());
    }

    @Test
    void resolvingWithWinnerSupersedesLoser() {
        Belief a = belief("User likes spicy food.", 0.9);
        Belief b = belief("User hates spicy food.", 0.4);
        BeliefConflict conflict = store.recordConflict(USER, a.getId(), b.getId(),
                BeliefConflict.Type.CONTRADICTION, "contradiction");

        BeliefConflict resolved = store.resolveConflict(USER, conflict.getId(), "manual", a.getId());

        assertTrue(resolved.isResolved());
        assertEquals(a.getId(), resolved.getWinnerId());
        Belief loser = store.get(USER, b.getId());
        assertEquals(BeliefStatus.SUPERSEDED, loser.getStatus());
        assertEquals(a.getId(), loser.getSupersededBy());
        assertTrue(store.listUnresolvedConflicts(USER).isEmpty());
    }

    @Test
    void resolvingWithLoserStatusRecordsReason() {
        Belief a = belief("User likes spicy food.", 0.9);
        Belief b = belief("User hates spicy food.", 0.4);
        BeliefConflict conflict = store.recordConflict(USER, a.getId(), b.getId(),
                BeliefConflict.Type.CONTRADICTION, "contradiction");

        store.resolveConflict(USER, conflict.getId(), "auto", a.getId(), BeliefStatus.UNCERTAIN);

        Belief loser = store.get(USER, b.getId());
        assertEquals(BeliefStatus.UNCERTAIN, loser.getStatus());
        assertEquals("Lost conflict to belief " + a.getId(), loser.getInvalidationReason());
        assertNull(loser.getSupersededBy());
    }

    @Test
    void winnerMustBePartOfConflict() {
        Belief a = belief("User likes spicy food.", 0.9);
        Belief b = belief("User hates spicy food.", 0.4);
        Belief c = belief("User likes tea.", 0.4);
        BeliefConflict conflict = store.recordConflict(USER, a.getId(), b.getId(),
                BeliefConflict.Type.CONTRADICTION, "contradiction");

        assertThrows(IllegalArgumentException.class,
                () -> store.resolveConflict(USER, conflict.getId(), "manual", c.getId()));
    }

    @Test
    void escalationKeepsConflictUnresolved() {
        Belief a = belief("User likes spicy food.", 0.6);
        Belief b = belief("User hates spicy food.", 0.5);
        BeliefConflict conflict = store.recordConflict(USER, a.getId(), b.getId(),
                BeliefConflict.Type.CONTRADICTION, "contradiction");

        BeliefConflict escalated = store.escalateConflict(USER, conflict.getId());

        assertTrue(escalated.isEscalated());
        assertFalse(escalated.isResolved());
        assertEquals(1, store.listUnresolvedConflicts(USER).size());
    }

    // ==================== Queries ====================

    @Test
    void queryFiltersAndOrdersByConfidence() {
        belief("User likes jazz.", 0.6);
        belief("User likes tea.", 0.9);
        Belief invalid = belief("User likes opera.", 0.8);
        store.updateStatus(USER, invalid.getId(), BeliefStatus.INVALIDATED, "wrong", null);

        Page<Belief> page = store.query(BeliefQuery.builder()
                .userId(USER)
                .statuses(Set.of(BeliefStatus.ACTIVE))
                .orderBy(BeliefQuery.OrderBy.CONFIDENCE)
                .build());

        assertEquals(2, page.total());
        assertEquals("User likes tea.", page.items().get(0).getProposition());
    }

    @Test
    void statsCountStatusesAndConflicts() {
        Belief a = belief("User likes spicy food.", 0.6);
        Belief b = belief("User hates spicy food.", 0.4);
        store.recordConflict(USER, a.getId(), b.getId(), BeliefConflict.Type.CONTRADICTION, "contradiction");

        BeliefStats stats = store.stats(USER);

        assertEquals(2, stats.total());
        assertEquals(2, stats.byStatus().get(BeliefStatus.ACTIVE));
        assertEquals(0.5, stats.averageConfidence(), 1e-9);
        assertEquals(1, stats.unresolvedConflicts());
    }
}
