package me.golemcore.mind.adapter.outbound.observation;

import me.golemcore.mind.testsupport.TestWorkspace;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StorageUserDirectoryAdapterTest {

    @TempDir
    Path tempDir;

    @Test
    void listsOwnersOfKnowledgeAndObservationsOnce() {
        TestWorkspace workspace = new TestWorkspace(tempDir);
        workspace.storage().putText("knowledge", "carol/learnings.jsonl", "{}\n").join();
        workspace.storage().putText("knowledge", "alice/beliefs.jsonl", "{}\n").join();
        workspace.storage().putText("observations", "alice/pending.jsonl", "{}\n").join();
        workspace.storage().putText("observations", "bob/pending.jsonl", "{}\n").join();
        workspace.storage().putText("knowledge", "stray.jsonl", "{}\n").join();

        StorageUserDirectoryAdapter adapter = new StorageUserDirectoryAdapter(workspace.storage(),
                workspace.properties());

        assertEquals(List.of("alice", "bob", "carol"), adapter.listUserIds());
    }

    @Test
    void emptyWorkspaceHasNoUsers() {
        TestWorkspace workspace = new TestWorkspace(tempDir);

        assertTrue(new StorageUserDirectoryAdapter(workspace.storage(), workspace.properties()).listUserIds()
                .isEmpty());
    }
}
