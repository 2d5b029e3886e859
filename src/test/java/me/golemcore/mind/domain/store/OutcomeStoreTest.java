package me.golemcore.mind.domain.store;

import me.golemcore.mind.domain.model.ActionType;
import me.golemcore.mind.domain.model.FeedbackSource;
import me.golemcore.mind.domain.model.Outcome;
import me.golemcore.mind.domain.model.OutcomeQuery;
import me.golemcore.mind.domain.model.OutcomeSignal;
import me.golemcore.mind.domain.model.OutcomeStats;
import me.golemcore.mind.domain.model.Page;
import me.golemcore.mind.domain.model.RecordOutcomeRequest;
import me.golemcore.mind.domain.model.RecordOutcomeRequest.SourceRef;
import me.golemcore.mind.domain.model.SourceEffectiveness;
import me.golemcore.mind.domain.model.SourceType;
import me.golemcore.mind.testsupport.MutableClock;
import me.golemcore.mind.testsupport.TestWorkspace;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class OutcomeStoreTest {

    private static final String USER = "alice";
    private static final Instant START = Instant.parse("2026-03-01T09:00:00Z");

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private OutcomeStore store;

    @BeforeEach
    void setUp() {
        TestWorkspace workspace = new TestWorkspace(tempDir);
        clock = new MutableClock(START);
        store = new OutcomeStore(workspace.storage(), workspace.objectMapper(), clock, workspace.properties());
    }

    private Outcome outcome(ActionType type, SourceRef... sources) {
        return store.create(RecordOutcomeRequest.builder()
                .userId(USER)
                .actionType(type)
                .actionContent("Suggested a morning slot")
                .sources(List.of(sources))
                .build());
    }

    @Test
    void createStoresSourcesWithDefaultWeight() {
        Outcome created = outcome(ActionType.SUGGESTION,
                SourceRef.of(SourceType.LEARNING, "l-1"),
                new SourceRef(SourceType.BELIEF, "b-1", 0.5));

        Outcome stored = store.get(USER, created.getId());
        assertEquals(OutcomeSignal.UNKNOWN, stored.getOutcomeSignal());
        assertFalse(stored.isFeedbackPropagated());
        assertEquals(2, stored.getSources().size());
        assertEquals(1.0, stored.getSources().get(0).getContributionWeight(), 1e-9);
        assertEquals(0.5, stored.getSources().get(1).getContributionWeight(), 1e-9);
        assertEquals(START, stored.getActionAt());
    }

    @Test
    void createRejectsMissingActionTypeAndNegativeWeight() {
        RecordOutcomeRequest noType = RecordOutcomeRequest.builder().userId(USER).build();
        RecordOutcomeRequest negative = RecordOutcomeRequest.builder()
                .userId(USER)
                .actionType(ActionType.ANSWER)
                .source(new SourceRef(SourceType.LEARNING, "l-1", -0.1))
                .build();

        assertThrows(IllegalArgumentException.class, () -> store.create(noType));
        assertThrows(IllegalArgumentException.class, () -> store.create(negative));
    }

    @Test
    void recordFeedbackSetsSignalAndTimestamp() {
        Outcome created = outcome(ActionType.ANSWER);
        clock.advance(Duration.ofMinutes(5));

        Outcome updated = store.recordFeedback(USER, created.getId(), OutcomeSignal.POSITIVE,
                FeedbackSource.EXPLICIT_FEEDBACK, Map.of("comment", "great"));

        assertEquals(OutcomeSignal.POSITIVE, updated.getOutcomeSignal());
        assertEquals(FeedbackSource.EXPLICIT_FEEDBACK, updated.getFeedbackSource());
        assertEquals("great", updated.getOutcomeDetails().get("comment"));
        assertEquals(START.plus(Duration.ofMinutes(5)), updated.getOutcomeAt());
    }

    @Test
    void markPropagatedSucceedsOnlyOnce() {
        Outcome created = outcome(ActionType.ANSWER);
        store.recordFeedback(USER, created.getId(), OutcomeSignal.NEGATIVE, FeedbackSource.FOLLOW_UP, null);

        assertTrue(store.markPropagated(USER, created.getId()));
        assertFalse(store.markPropagated(USER, created.getId()));
        assertTrue(store.get(USER, created.getId()).isFeedbackPropagated());
    }

    @Test
    void feedbackAfterPropagationIsRejected() {
        Outcome created = outcome(ActionType.ANSWER);
        store.recordFeedback(USER, created.getId(), OutcomeSignal.POSITIVE, FeedbackSource.EXPLICIT_FEEDBACK, null);
        store.markPropagated(USER, created.getId());

        assertThrows(IllegalStateException.class, () -> store.recordFeedback(USER, created.getId(),
                OutcomeSignal.NEGATIVE, FeedbackSource.EXPLICIT_FEEDBACK, null));
    }

    @Test
    void otherUsersOutcomeIsDenied() {
        Outcome created = outcome(ActionType.ANSWER);

        assertThrows(KnowledgeAccessDeniedException.class, () -> store.get("bob", created.getId()));
        assertThrows(KnowledgeNotFoundException.class, () -> store.get(USER, "missing"));
    }

    // ==================== Queries ====================

    @Test
    void pendingPropagationHasActionableSignalsOldestFirst() {
        Outcome first = outcome(ActionType.ANSWER);
        Outcome second = outcome(ActionType.RECALL);
        Outcome neutral = outcome(ActionType.SUGGESTION);
        outcome(ActionType.PREDICTION);

        store.recordFeedback(USER, second.getId(), OutcomeSignal.NEGATIVE, FeedbackSource.FOLLOW_UP, null);
        clock.advance(Duration.ofMinutes(1));
        store.recordFeedback(USER, first.getId(), OutcomeSignal.POSITIVE, FeedbackSource.EXPLICIT_FEEDBACK, null);
        store.recordFeedback(USER, neutral.getId(), OutcomeSignal.NEUTRAL, FeedbackSource.INFERRED, null);

        List<Outcome> pending = store.findPendingPropagation(USER, 10);

        assertEquals(List.of(second.getId(), first.getId()), pending.stream().map(Outcome::getId).toList());
        assertEquals(1, store.findPendingPropagation(USER, 1).size());
    }

    @Test
    void queryFiltersBySignalNewestFirst() {
        Outcome older = outcome(ActionType.ANSWER);
        clock.advance(Duration.ofHours(1));
        Outcome newer = outcome(ActionType.ANSWER);
        outcome(ActionType.RECALL);
        store.recordFeedback(USER, older.getId(), OutcomeSignal.POSITIVE, FeedbackSource.EXPLICIT_FEEDBACK, null);
        store.recordFeedback(USER, newer.getId(), OutcomeSignal.POSITIVE, FeedbackSource.EXPLICIT_FEEDBACK, null);

        Page<Outcome> page = store.query(USER, OutcomeQuery.builder()
                .signals(Set.of(OutcomeSignal.POSITIVE))
                .build());

        assertEquals(2, page.total());
        assertEquals(newer.getId(), page.items().get(0).getId());
    }

    @Test
    void findBySourceMatchesTypeAndId() {
        outcome(ActionType.ANSWER, SourceRef.of(SourceType.LEARNING, "l-1"));
        outcome(ActionType.ANSWER, SourceRef.of(SourceType.BELIEF, "l-1"));

        assertEquals(1, store.findBySource(USER, SourceType.LEARNING, "l-1").size());
    }

    @Test
    void statsAndSourceEffectiveness() {
        Outcome good = outcome(ActionType.ANSWER, SourceRef.of(SourceType.BELIEF, "b-1"),
                SourceRef.of(SourceType.LEARNING, "l-1"));
        Outcome bad = outcome(ActionType.ANSWER, SourceRef.of(SourceType.LEARNING, "l-2"));
        outcome(ActionType.RECALL, SourceRef.of(SourceType.MEMORY, "m-1"));
        store.recordFeedback(USER, good.getId(), OutcomeSignal.POSITIVE, FeedbackSource.EXPLICIT_FEEDBACK, null);
        store.recordFeedback(USER, bad.getId(), OutcomeSignal.NEGATIVE, FeedbackSource.EXPLICIT_FEEDBACK, null);

        OutcomeStats stats = store.stats(USER);
        assertEquals(3, stats.total());
        assertEquals(2.0 / 3.0, stats.feedbackRate(), 1e-9);
        assertEquals(0.5, stats.positiveRate(), 1e-9);
        assertEquals(4.0 / 3.0, stats.avgSourcesPerOutcome(), 1e-9);

        List<SourceEffectiveness> effectiveness = store.sourceEffectiveness(USER);
        assertEquals(2, effectiveness.size());
        assertEquals(SourceType.BELIEF, effectiveness.get(0).sourceType());
        assertEquals(1.0, effectiveness.get(0).effectivenessRate(), 1e-9);
        SourceEffectiveness learnings = effectiveness.get(1);
        assertEquals(2, learnings.uniqueSources());
        assertEquals(1, learnings.positiveOutcomes());
        assertEquals(1, learnings.negativeOutcomes());
        assertEquals(0.5, learnings.effectivenessRate(), 1e-9);
    }

    @Test
    void deletePropagatedBeforeKeepsRecentAndUnpropagated() {
        Outcome old = outcome(ActionType.ANSWER);
        Outcome oldUnpropagated = outcome(ActionType.ANSWER);
        store.recordFeedback(USER, old.getId(), OutcomeSignal.POSITIVE, FeedbackSource.EXPLICIT_FEEDBACK, null);
        store.markPropagated(USER, old.getId());
        clock.advance(Duration.ofDays(200));
        Outcome recent = outcome(ActionType.ANSWER);
        store.recordFeedback(USER, recent.getId(), OutcomeSignal.POSITIVE, FeedbackSource.EXPLICIT_FEEDBACK, null);
        store.markPropagated(USER, recent.getId());

        int deleted = store.deletePropagatedBefore(USER, clock.instant().minus(Duration.ofDays(180)));

        assertEquals(1, deleted);
        assertTrue(store.find(USER, old.getId()).isEmpty());
        assertTrue(store.find(USER, oldUnpropagated.getId()).isPresent());
        assertTrue(store.find(USER, recent.getId()).isPresent());
    }
}
