package io.mnemo.core.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.mnemo.core.fs.AtomicFiles;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

public final class SessionRecordStore {
    public static final String FILE_NAME = "session_active.json";

    private final Path file;
    private final AtomicFiles atomicFiles;
    private final ObjectMapper mapper;

    public SessionRecordStore(Path workspace, AtomicFiles atomicFiles) {
        Objects.requireNonNull(workspace, "workspace must not be null");
        this.file = workspace.resolve(ContextPaths.MEMORY_DIR).resolve(FILE_NAME);
        this.atomicFiles = Objects.requireNonNull(atomicFiles, "atomicFiles must not be null");
        this.mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public Path file() {
        return file;
    }

    public synchronized Optional<SessionRecord> load() throws IOException {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        return Optional.of(mapper.readValue(file.toFile(), SessionRecord.class));
    }

    public synchronized void save(SessionRecord record) throws IOException {
        Objects.requireNonNull(record, "record must not be null");
        atomicFiles.writeString(file, mapper.writerWithDefaultPrettyPrinter().writeValueAsString(record) + "\n");
    }

    public synchronized boolean delete() throws IOException {
        return Files.deleteIfExists(file);
    }
}
