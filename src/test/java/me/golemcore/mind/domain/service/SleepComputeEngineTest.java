package me.golemcore.mind.domain.service;

import me.golemcore.mind.domain.model.Belief;
import me.golemcore.mind.domain.model.BeliefConflict;
import me.golemcore.mind.domain.model.BeliefStatus;
import me.golemcore.mind.domain.model.BeliefType;
import me.golemcore.mind.domain.model.ExtractedFact;
import me.golemcore.mind.domain.model.JobStatus;
import me.golemcore.mind.domain.model.LearningCategory;
import me.golemcore.mind.domain.model.LearningStatus;
import me.golemcore.mind.domain.model.NewBelief;
import me.golemcore.mind.domain.model.Observation;
import me.golemcore.mind.domain.model.PropagationWeights;
import me.golemcore.mind.domain.model.SessionContext;
import me.golemcore.mind.domain.model.SimilarityThresholds;
import me.golemcore.mind.domain.model.SleepComputeConfig;
import me.golemcore.mind.domain.model.SleepComputeResult;
import me.golemcore.mind.domain.model.SleepJob;
import me.golemcore.mind.domain.model.SleepTaskType;
import me.golemcore.mind.domain.model.TaskDetails;
import me.golemcore.mind.domain.model.TaskResult;
import me.golemcore.mind.domain.model.TriggerType;
import me.golemcore.mind.domain.store.BeliefStore;
import me.golemcore.mind.domain.store.LearningStore;
import me.golemcore.mind.domain.store.OutcomeStore;
import me.golemcore.mind.domain.store.SessionContextStore;
import me.golemcore.mind.domain.store.SleepJobStore;
import me.golemcore.mind.port.outbound.FactExtractionException;
import me.golemcore.mind.port.outbound.FactExtractionPort;
import me.golemcore.mind.port.outbound.ObservationPort;
import me.golemcore.mind.testsupport.MutableClock;
import me.golemcore.mind.testsupport.TestWorkspace;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SleepComputeEngineTest {

    private static final String USER = "alice";

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private TestWorkspace workspace;
    private KeywordSimilarityClassifier classifier;
    private LearningStore learningStore;
    private BeliefStore beliefStore;
    private OutcomeStore outcomeStore;
    private SleepJobStore sleepJobStore;
    private SessionContextStore sessionContextStore;
    private ObservationPort observationPort;
    private FactExtractionPort factExtractionPort;

    @BeforeEach
    void setUp() {
        workspace = new TestWorkspace(tempDir);
        clock = new MutableClock(Instant.parse("2026-03-01T03:00:00Z"));
        classifier = new KeywordSimilarityClassifier(SimilarityThresholds.defaults());
        learningStore = new LearningStore(workspace.storage(), workspace.objectMapper(), clock, classifier,
                workspace.properties());
        beliefStore = new BeliefStore(workspace.storage(), workspace.objectMapper(), clock, classifier,
                workspace.properties());
        outcomeStore = new OutcomeStore(workspace.storage(), workspace.objectMapper(), clock, workspace.properties());
        sleepJobStore = new SleepJobStore(workspace.storage(), workspace.objectMapper(), clock,
                workspace.properties());
        sessionContextStore = new SessionContextStore(workspace.storage(), workspace.objectMapper(), clock,
                workspace.properties());
        observationPort = mock(ObservationPort.class);
        factExtractionPort = mock(FactExtractionPort.class);
        when(factExtractionPort.isAvailable()).thenReturn(true);
    }

    private SleepComputeEngine engine(SleepComputeConfig config) {
        return new SleepComputeEngine(
                new FeedbackPropagationService(outcomeStore, learningStore, beliefStore,
                        PropagationWeights.defaults()),
                new LearningConsolidationService(learningStore, classifier, factExtractionPort,
                        workspace.properties()),
                new BeliefFormationService(learningStore, beliefStore, classifier, clock),
                learningStore, beliefStore, outcomeStore, sleepJobStore, sessionContextStore,
                observationPort, factExtractionPort, config, clock);
    }

    private static Observation observation(String id, String content) {
        return Observation.builder().id(id).userId(USER).content(content).build();
    }

    private Belief belief(String proposition, double prior) {
        return beliefStore.create(NewBelief.builder()
                .userId(USER)
                .proposition(proposition)
                .beliefType(BeliefType.PREFERENCE)
                .priorConfidence(prior)
                .build());
    }

    private static TaskResult task(SleepComputeResult result, SleepTaskType type) {
        return result.tasks().stream().filter(task -> task.getTaskType() == type).findFirst().orElseThrow();
    }

    // ==================== Full run ====================

    @Test
    void emptyUserRunsAllTasksAndPreparesSession() {
        SleepComputeResult result = engine(SleepComputeConfig.defaults()).runSleepCompute(USER, TriggerType.MANUAL);

        assertEquals(JobStatus.COMPLETED, result.status());
        assertEquals(SleepTaskType.EXECUTION_ORDER.size(), result.tasks().size());
        assertTrue(result.tasks().stream().allMatch(task -> task.getStatus() == JobStatus.COMPLETED));
        assertTrue(result.summary().contains("Session context prepared (0 beliefs, 0 learnings)"));

        SessionContext context = sessionContextStore.current(USER).orElseThrow();
        assertEquals(result.jobId(), context.getJobId());
        assertEquals(clock.instant().plus(Duration.ofHours(24)), context.getExpiresAt());

        SleepJob job = sleepJobStore.get(USER, result.jobId());
        assertEquals(JobStatus.COMPLETED, job.getStatus());
        assertEquals(TriggerType.MANUAL, job.getTriggerType());
        assertEquals(SleepTaskType.EXECUTION_ORDER.size(), job.getCompletedTasks());
    }

    @Test
    void observationsBecomeLearningsAndBeliefsInOneRun() {
        when(observationPort.findUnprocessed(USER, 200)).thenReturn(List.of(
                observation("o1", "I really prefer morning meetings, afternoons are always packed for me."),
                observation("o2", "Again I prefer the morning for meetings, my afternoons are usually full."),
                observation("o3", "As always I prefer morning meetings, I like to keep afternoons for focus.")));
        when(factExtractionPort.extract(anyString())).thenReturn(CompletableFuture.completedFuture(List.of(
                ExtractedFact.builder()
                        .category(LearningCategory.PREFERENCE)
                        .statement("User prefers morning meetings")
                        .confidence(0.85)
                        .build())));

        SleepComputeResult result = engine(SleepComputeConfig.defaults()).runSleepCompute(USER, TriggerType.SCHEDULED);

        TaskDetails.LearningExtraction extraction = (TaskDetails.LearningExtraction) task(result,
                SleepTaskType.LEARNING_EXTRACTION).getDetails();
        assertEquals(3, extraction.observationsProcessed());
        assertEquals(1, extraction.learningsExtracted());
        assertEquals(2, extraction.learningsReinforced());
        verify(observationPort, times(3)).markProcessed(anyString(), anyString());

        TaskDetails.BeliefFormation formation = (TaskDetails.BeliefFormation) task(result,
                SleepTaskType.BELIEF_FORMATION).getDetails();
        assertEquals(1, formation.beliefsFormed());
        assertEquals(1, beliefStore.count(USER, BeliefStatus.ACTIVE));
        assertEquals(1, learningStore.count(USER, LearningStatus.ACTIVE));
        assertTrue(result.summary().contains("Extracted 1 learnings from 3 observations"));
        assertTrue(result.summary().contains("Formed 1 new beliefs"));
    }

    // ==================== Extraction ====================

    @Test
    void tooFewObservationsSkipsExtraction() {
        when(observationPort.findUnprocessed(USER, 200)).thenReturn(List.of(
                observation("o1", "I really prefer morning meetings, afternoons are always packed for me.")));

        SleepComputeResult result = engine(SleepComputeConfig.defaults()).runSleepCompute(USER, TriggerType.MANUAL);

        TaskDetails.LearningExtraction extraction = (TaskDetails.LearningExtraction) task(result,
                SleepTaskType.LEARNING_EXTRACTION).getDetails();
        assertEquals(0, extraction.observationsProcessed());
        assertEquals(1, extraction.observationsSkipped());
        verify(factExtractionPort, never()).extract(anyString());
        verify(observationPort, never()).markProcessed(anyString(), anyString());
    }

    @Test
    void retryableFailureKeepsObservationQueued() {
        String retry = "I really prefer morning meetings, afternoons are always packed for me.";
        String reject = "I usually like to travel by train because I hate flying long distances.";
        when(observationPort.findUnprocessed(USER, 200)).thenReturn(List.of(
                observation("retry", retry), observation("reject", reject)));
        when(factExtractionPort.extract(retry)).thenReturn(
                CompletableFuture.failedFuture(new FactExtractionException("backend busy", true)));
        when(factExtractionPort.extract(reject)).thenReturn(
                CompletableFuture.failedFuture(new FactExtractionException("bad request", false)));

        SleepComputeConfig config = SleepComputeConfig.builder().minObservationsPerRun(1).build();
        SleepComputeResult result = engine(config).runSleepCompute(USER, TriggerType.MANUAL);

        TaskDetails.LearningExtraction extraction = (TaskDetails.LearningExtraction) task(result,
                SleepTaskType.LEARNING_EXTRACTION).getDetails();
        assertEquals(2, extraction.observationsSkipped());
        verify(observationPort, never()).markProcessed(USER, "retry");
        verify(observationPort).markProcessed(USER, "reject");
    }

    @Test
    void unavailableBackendSkipsExtraction() {
        when(factExtractionPort.isAvailable()).thenReturn(false);
        when(observationPort.findUnprocessed(USER, 200)).thenReturn(List.of(
                observation("o1", "a"), observation("o2", "b"), observation("o3", "c")));

        engine(SleepComputeConfig.defaults()).runSleepCompute(USER, TriggerType.MANUAL);

        verify(factExtractionPort, never()).extract(anyString());
        verify(observationPort, never()).markProcessed(anyString(), anyString());
    }

    // ==================== Conflicts ====================

    @Test
    void wideConfidenceGapResolvesConflictAutomatically() {
        Belief strong = belief("User likes spicy food.", 0.9);
        Belief weak = belief("User hates spicy food.", 0.5);
        BeliefConflict conflict = beliefStore.recordConflict(USER, strong.getId(), weak.getId(),
                BeliefConflict.Type.CONTRADICTION, "likes vs hates");

        SleepComputeResult result = engine(SleepComputeConfig.defaults()).runSleepCompute(USER, TriggerType.MANUAL);

        TaskDetails.ConflictResolution resolution = (TaskDetails.ConflictResolution) task(result,
                SleepTaskType.CONFLICT_RESOLUTION).getDetails();
        assertEquals(1, resolution.conflictsAutoResolved());
        BeliefConflict resolved = beliefStore.getConflict(USER, conflict.getId());
        assertTrue(resolved.isResolved());
        assertEquals(strong.getId(), resolved.getWinnerId());
        assertEquals("Auto-resolved: \"User likes spicy food.\" (90%) vs \"User hates spicy food.\" (50%)",
                resolved.getResolution());
        assertEquals(BeliefStatus.UNCERTAIN, beliefStore.get(USER, weak.getId()).getStatus());
        assertEquals(BeliefStatus.ACTIVE, beliefStore.get(USER, strong.getId()).getStatus());
    }

    @Test
    void narrowConfidenceGapIsEscalated() {
        Belief first = belief("User likes spicy food.", 0.6);
        Belief second = belief("User hates spicy food.", 0.5);
        BeliefConflict conflict = beliefStore.recordConflict(USER, first.getId(), second.getId(),
                BeliefConflict.Type.CONTRADICTION, "likes vs hates");

        SleepComputeResult result = engine(SleepComputeConfig.defaults()).runSleepCompute(USER, TriggerType.MANUAL);

        TaskDetails.ConflictResolution resolution = (TaskDetails.ConflictResolution) task(result,
                SleepTaskType.CONFLICT_RESOLUTION).getDetails();
        assertEquals(1, resolution.conflictsEscalated());
        BeliefConflict escalated = beliefStore.getConflict(USER, conflict.getId());
        assertTrue(escalated.isEscalated());
        assertFalse(escalated.isResolved());
    }

    // ==================== Budget and failures ====================

    @Test
    void exhaustedBudgetSkipsRemainingTasksButPreparesSession() {
        when(observationPort.findUnprocessed(USER, 200)).thenAnswer(invocation -> {
            clock.advance(Duration.ofSeconds(30));
            return List.of();
        });

        SleepComputeResult result = engine(SleepComputeConfig.defaults()).runSleepCompute(USER, TriggerType.MANUAL);

        assertEquals(JobStatus.COMPLETED, result.status());
        assertEquals(JobStatus.COMPLETED, task(result, SleepTaskType.LEARNING_EXTRACTION).getStatus());
        for (SleepTaskType type : List.of(SleepTaskType.BELIEF_FORMATION, SleepTaskType.CONFIDENCE_DECAY,
                SleepTaskType.CONFLICT_RESOLUTION, SleepTaskType.ARCHIVAL)) {
            TaskResult skipped = task(result, type);
            assertEquals(JobStatus.SKIPPED, skipped.getStatus());
            assertEquals(SleepComputeEngine.BUDGET_EXCEEDED, skipped.getError());
        }
        assertEquals(JobStatus.COMPLETED, task(result, SleepTaskType.SESSION_PREP).getStatus());
        assertTrue(sessionContextStore.current(USER).isPresent());
    }

    @Test
    void jobFailsWhenEveryTaskFails() {
        FeedbackPropagationService propagation = mock(FeedbackPropagationService.class);
        BeliefFormationService formation = mock(BeliefFormationService.class);
        LearningStore learnings = mock(LearningStore.class);
        BeliefStore beliefs = mock(BeliefStore.class);
        OutcomeStore outcomes = mock(OutcomeStore.class);
        IllegalStateException failure = new IllegalStateException("disk unavailable");
        when(propagation.processPendingPropagations(anyString(), anyInt())).thenThrow(failure);
        when(observationPort.findUnprocessed(anyString(), anyInt())).thenThrow(failure);
        when(formation.formBeliefsFromLearnings(anyString(), any())).thenThrow(failure);
        when(learnings.applyDecay(anyString(), any(), anyDouble(), anyDouble(), anyInt())).thenThrow(failure);
        when(beliefs.listUnresolvedConflicts(anyString())).thenThrow(failure);
        when(learnings.archiveStale(anyString(), anyDouble(), any())).thenThrow(failure);
        when(beliefs.query(any())).thenThrow(failure);

        SleepComputeEngine failing = new SleepComputeEngine(propagation,
                new LearningConsolidationService(learnings, classifier, factExtractionPort, workspace.properties()),
                formation, learnings, beliefs, outcomes, sleepJobStore, sessionContextStore, observationPort,
                factExtractionPort, SleepComputeConfig.defaults(), clock);

        SleepComputeResult result = failing.runSleepCompute(USER, TriggerType.MANUAL);

        assertEquals(JobStatus.FAILED, result.status());
        assertTrue(result.tasks().stream().allMatch(task -> task.getStatus() == JobStatus.FAILED));
        SleepJob job = sleepJobStore.get(USER, result.jobId());
        assertEquals(JobStatus.FAILED, job.getStatus());
        assertEquals(SleepTaskType.EXECUTION_ORDER.size(), job.getFailedTasks());
        assertTrue(job.getErrorMessage().startsWith("feedback_propagation: disk unavailable"));
    }

    // ==================== Summary ====================

    @Test
    void summaryListsFailuresAndSkipsTrivialTasks() {
        List<TaskResult> tasks = List.of(
                TaskResult.builder()
                        .taskType(SleepTaskType.FEEDBACK_PROPAGATION)
                        .status(JobStatus.COMPLETED)
                        .details(new TaskDetails.FeedbackPropagation(2, 1, 1, 0.1))
                        .build(),
                TaskResult.builder()
                        .taskType(SleepTaskType.BELIEF_FORMATION)
                        .status(JobStatus.COMPLETED)
                        .details(new TaskDetails.BeliefFormation(4, 0, 4, 0))
                        .build(),
                TaskResult.builder()
                        .taskType(SleepTaskType.ARCHIVAL)
                        .status(JobStatus.FAILED)
                        .error("boom")
                        .build(),
                TaskResult.skipped(SleepTaskType.CONFIDENCE_DECAY, SleepComputeEngine.BUDGET_EXCEEDED));

        String summary = SleepComputeEngine.buildSummary(tasks, 42);

        assertEquals("Sleep compute completed in 42ms. Propagated 2 feedback items [FAIL] archival: boom", summary);
    }

    @Test
    void summaryReportsOutcomeOnlyArchival() {
        List<TaskResult> tasks = List.of(TaskResult.builder()
                .taskType(SleepTaskType.ARCHIVAL)
                .status(JobStatus.COMPLETED)
                .details(new TaskDetails.Archival(0, 0, 3))
                .build());

        String summary = SleepComputeEngine.buildSummary(tasks, 7);

        assertEquals("Sleep compute completed in 7ms. Archived 0 learnings, 0 beliefs, 3 outcomes", summary);
    }
}
