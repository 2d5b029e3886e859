package me.golemcore.mind.adapter.outbound.observation;

import me.golemcore.mind.domain.model.Observation;
import me.golemcore.mind.testsupport.MutableClock;
import me.golemcore.mind.testsupport.TestWorkspace;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StorageObservationAdapterTest {

    private static final String USER = "alice";

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private StorageObservationAdapter adapter;

    @BeforeEach
    void setUp() {
        TestWorkspace workspace = new TestWorkspace(tempDir);
        clock = new MutableClock(Instant.parse("2026-03-01T09:00:00Z"));
        adapter = new StorageObservationAdapter(workspace.storage(), workspace.objectMapper(), clock,
                workspace.properties());
    }

    @Test
    void enqueueAppendsToUsersQueue() {
        Observation observation = adapter.enqueue(USER, "I prefer tea over coffee");

        assertNotNull(observation.getId());
        assertEquals(clock.instant(), observation.getCreatedAt());
        assertTrue(Files.exists(tempDir.resolve("observations/alice/" + StorageObservationAdapter.PENDING_FILE)));
        assertEquals(1, adapter.countUnprocessed(USER));
        assertEquals(0, adapter.countUnprocessed("bob"));
    }

    @Test
    void enqueueRejectsBlankContentAndBadUserId() {
        assertThrows(IllegalArgumentException.class, () -> adapter.enqueue(USER, " "));
        assertThrows(IllegalArgumentException.class, () -> adapter.enqueue("../bob", "text"));
        assertThrows(IllegalArgumentException.class, () -> adapter.enqueue("..", "text"));
    }

    @Test
    void findUnprocessedReturnsOldestFirstWithinLimit() {
        Observation first = adapter.enqueue(USER, "first");
        clock.advance(Duration.ofMinutes(1));
        Observation second = adapter.enqueue(USER, "second");
        clock.advance(Duration.ofMinutes(1));
        adapter.enqueue(USER, "third");

        List<Observation> oldest = adapter.findUnprocessed(USER, 2);

        assertEquals(List.of(first.getId(), second.getId()), oldest.stream().map(Observation::getId).toList());
        assertTrue(adapter.findUnprocessed(USER, 0).isEmpty());
    }

    @Test
    void markProcessedRemovesOnlyThatObservation() {
        Observation first = adapter.enqueue(USER, "first");
        Observation second = adapter.enqueue(USER, "second");

        adapter.markProcessed(USER, first.getId());
        adapter.markProcessed(USER, first.getId());

        List<Observation> remaining = adapter.findUnprocessed(USER, 10);
        assertEquals(1, remaining.size());
        assertEquals(second.getId(), remaining.get(0).getId());
        assertEquals("second", remaining.get(0).getContent());
    }

    @Test
    void unreadableQueueLinesAreSkipped() throws Exception {
        adapter.enqueue(USER, "valid");
        Path queue = tempDir.resolve("observations/alice/" + StorageObservationAdapter.PENDING_FILE);
        Files.writeString(queue, Files.readString(queue) + "{broken\n");

        assertEquals(1, adapter.countUnprocessed(USER));
    }
}
