package com.vespasync.sync.checkpoint;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CheckpointStoreTest {
    private static final Instant STARTED = Instant.parse("2025-03-10T09:00:00Z");

    @TempDir
    Path tempDir;

    @Test
    void save_shouldPersistProgressForResume() throws Exception {
        CheckpointStore store = new CheckpointStore(tempDir.resolve("state/cp.json"));
        SyncCheckpoint checkpoint = new SyncCheckpoint(STARTED);
        checkpoint.markCompleted("institutions", STARTED.plusSeconds(5));
        checkpoint.markPage("persons", 3, List.of("p1", "p2", ""), STARTED.plusSeconds(9));

        store.save(checkpoint);
        SyncCheckpoint loaded = store.load().orElseThrow();

        assertEquals(STARTED, loaded.runStartedAt());
        assertEquals(STARTED.plusSeconds(9), loaded.updatedAt());
        assertTrue(loaded.isCompleted("institutions"));
        assertFalse(loaded.isCompleted("persons"));
        assertEquals(4, loaded.resumePage("persons"));
        assertEquals(1, loaded.resumePage("responses"));
        assertEquals(Set.of("p1", "p2"), loaded.processed("persons"));
        assertTrue(loaded.isProcessed("persons", "p1"));
        assertFalse(Files.exists(tempDir.resolve("state/cp.json.tmp")));
    }

    @Test
    void markCompleted_shouldDropProcessedIds() {
        SyncCheckpoint checkpoint = new SyncCheckpoint(STARTED);
        checkpoint.markPage("persons", 1, List.of("p1"), STARTED);

        checkpoint.markCompleted("persons", STARTED);

        assertTrue(checkpoint.processed("persons").isEmpty());
        assertEquals(1, checkpoint.lastPage("persons"));
    }

    @Test
    void reopen_shouldRestartFromFirstPageAndKeepProcessedIds() {
        SyncCheckpoint checkpoint = new SyncCheckpoint(STARTED);
        checkpoint.markPage("persons", 1, List.of("p1", "p2"), STARTED);
        checkpoint.markPage("persons", 3, List.of("p5"), STARTED);

        checkpoint.reopen("persons", STARTED.plusSeconds(30));

        assertFalse(checkpoint.isCompleted("persons"));
        assertEquals(1, checkpoint.resumePage("persons"));
        assertEquals(Set.of("p1", "p2", "p5"), checkpoint.processed("persons"));
        assertEquals(STARTED.plusSeconds(30), checkpoint.updatedAt());
    }

    @Test
    void markPage_shouldNeverMoveBackwards() {
        SyncCheckpoint checkpoint = new SyncCheckpoint(STARTED);
        checkpoint.markPage("persons", 5, null, STARTED);
        checkpoint.markPage("persons", 3, null, STARTED);

        assertEquals(5, checkpoint.lastPage("persons"));
    }

    @Test
    void load_shouldReturnEmptyWhenMissingOrUnreadable() throws Exception {
        Path path = tempDir.resolve("cp.json");
        CheckpointStore store = new CheckpointStore(path);
        assertTrue(store.load().isEmpty());

        Files.writeString(path, "{not json", StandardCharsets.UTF_8);
        assertTrue(store.load().isEmpty());

        Files.writeString(path, "{\"schema_version\":99,\"run_started_at\":\"2025-03-10T09:00:00Z\"}", StandardCharsets.UTF_8);
        assertTrue(store.load().isEmpty());
    }

    @Test
    void fromJson_shouldAcceptMissingUpdatedAt() {
        SyncCheckpoint checkpoint = SyncCheckpoint.fromJson(
                "{\"schema_version\":1,\"run_started_at\":\"2025-03-10T09:00:00Z\","
                        + "\"collections\":{\"persons\":{\"last_page\":2,\"completed\":false}}}");

        assertEquals(STARTED, checkpoint.updatedAt());
        assertEquals(3, checkpoint.resumePage("persons"));
    }

    @Test
    void fromJson_shouldRejectMissingStartTime() {
        assertThrows(IllegalArgumentException.class, () -> SyncCheckpoint.fromJson("{\"schema_version\":1}"));
    }

    @Test
    void delete_shouldRemoveFileAndReportWhetherItExisted() throws Exception {
        CheckpointStore store = new CheckpointStore(tempDir.resolve("cp.json"));
        store.save(new SyncCheckpoint(STARTED));

        assertTrue(store.delete());
        assertFalse(store.delete());
        assertTrue(store.load().isEmpty());
    }
}
