package me.golemcore.mind.domain.store;

import me.golemcore.mind.domain.model.JobStatus;
import me.golemcore.mind.domain.model.SleepJob;
import me.golemcore.mind.domain.model.SleepJobStats;
import me.golemcore.mind.domain.model.SleepTaskType;
import me.golemcore.mind.domain.model.TaskDetails;
import me.golemcore.mind.domain.model.TaskResult;
import me.golemcore.mind.domain.model.TriggerType;
import me.golemcore.mind.testsupport.MutableClock;
import me.golemcore.mind.testsupport.TestWorkspace;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SleepJobStoreTest {

    private static final String USER = "alice";
    private static final Instant START = Instant.parse("2026-03-01T03:00:00Z");

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private SleepJobStore store;

    @BeforeEach
    void setUp() {
        TestWorkspace workspace = new TestWorkspace(tempDir);
        clock = new MutableClock(START);
        store = new SleepJobStore(workspace.storage(), workspace.objectMapper(), clock, workspace.properties());
    }

    @Test
    void recordStartCreatesRunningJob() {
        SleepJob job = store.recordStart(USER, TriggerType.MANUAL);

        assertEquals(JobStatus.RUNNING, job.getStatus());
        assertEquals(7, job.getTotalTasks());
        assertEquals(START, job.getStartedAt());
    }

    @Test
    void recordCompletePersistsTaskResultsWithDetails() {
        SleepJob job = store.recordStart(USER, TriggerType.SCHEDULED);
        clock.advance(Duration.ofSeconds(3));
        TaskResult decay = TaskResult.builder()
                .taskType(SleepTaskType.CONFIDENCE_DECAY)
                .status(JobStatus.COMPLETED)
                .durationMs(120)
                .details(new TaskDetails.ConfidenceDecay(4, 2, 1, 0))
                .build();
        TaskResult failed = TaskResult.builder()
                .taskType(SleepTaskType.ARCHIVAL)
                .status(JobStatus.FAILED)
                .details(new TaskDetails.Empty())
                .error("disk full")
                .build();

        store.recordComplete(USER, job.getId(), JobStatus.COMPLETED, List.of(decay), List.of(failed), null);

        SleepJob stored = store.get(USER, job.getId());
        assertEquals(JobStatus.COMPLETED, stored.getStatus());
        assertEquals(3000L, stored.getDurationMs());
        assertEquals(1, stored.getCompletedTasks());
        assertEquals(1, stored.getFailedTasks());
        assertEquals(new TaskDetails.ConfidenceDecay(4, 2, 1, 0), stored.getTasksCompleted().get(0).getDetails());
        assertEquals("disk full", stored.getTasksFailed().get(0).getError());
    }

    @Test
    void completingTwiceIsRejected() {
        SleepJob job = store.recordStart(USER, TriggerType.MANUAL);
        store.recordComplete(USER, job.getId(), JobStatus.COMPLETED, List.of(), List.of(), null);

        assertThrows(IllegalStateException.class,
                () -> store.recordComplete(USER, job.getId(), JobStatus.FAILED, List.of(), List.of(), "again"));
    }

    @Test
    void listIsNewestFirstAndStatsAggregate() {
        SleepJob first = store.recordStart(USER, TriggerType.SCHEDULED);
        clock.advance(Duration.ofSeconds(2));
        store.recordComplete(USER, first.getId(), JobStatus.COMPLETED, List.of(), List.of(), null);
        clock.advance(Duration.ofHours(6));
        SleepJob second = store.recordStart(USER, TriggerType.THRESHOLD);
        clock.advance(Duration.ofSeconds(4));
        store.recordComplete(USER, second.getId(), JobStatus.FAILED, List.of(), List.of(), "boom");

        List<SleepJob> jobs = store.list(USER, 10);
        SleepJobStats stats = store.stats(USER);

        assertEquals(second.getId(), jobs.get(0).getId());
        assertEquals(2, stats.totalJobs());
        assertEquals(1, stats.completedJobs());
        assertEquals(1, stats.failedJobs());
        assertEquals(3000.0, stats.avgDurationMs(), 1e-9);
        assertEquals(second.getStartedAt(), stats.lastRunAt());
    }
}
