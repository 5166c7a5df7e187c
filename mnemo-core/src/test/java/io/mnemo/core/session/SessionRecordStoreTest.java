package io.mnemo.core.session;

import static org.assertj.core.api.Assertions.assertThat;

import io.mnemo.core.fs.AtomicFiles;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SessionRecordStoreTest {

    @TempDir
    Path workspace;

    @Test
    void shouldPersistAndClearActiveSession() throws Exception {
        SessionRecordStore store = new SessionRecordStore(workspace, new AtomicFiles());
        SessionRecord record = new SessionRecord(
            "20260101_000000_42",
            "project:alpha",
            Instant.parse("2026-01-01T00:00:00Z"),
            "/ws/.aipm/memory.json",
            "/ws/alpha/.memory/local_memory.json",
            "/ws/alpha/.memory/backup.json"
        );

        assertThat(store.load()).isEmpty();
        store.save(record);

        assertThat(store.file()).isEqualTo(workspace.resolve(".memory/session_active.json"));
        assertThat(Files.readString(store.file())).contains("\"startedAt\" : \"2026-01-01T00:00:00Z\"");
        assertThat(store.load()).contains(record);
        assertThat(store.load().get().sessionContext()).isEqualTo(SessionContext.project("alpha"));

        assertThat(store.delete()).isTrue();
        assertThat(store.load()).isEmpty();
    }
}
