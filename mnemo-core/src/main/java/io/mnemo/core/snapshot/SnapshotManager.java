package io.mnemo.core.snapshot;

import io.mnemo.core.fs.AtomicFiles;
import io.mnemo.core.fs.StagedFile;
import io.mnemo.core.store.EntityRecord;
import io.mnemo.core.store.MemoryRecord;
import io.mnemo.core.store.RelationRecord;
import io.mnemo.core.store.StoreCodec;
import io.mnemo.core.store.StoreDecodeException;
import io.mnemo.core.store.StoreReader;
import io.mnemo.core.store.StoreWriter;
import io.mnemo.core.validation.NamingPolicy;
import io.mnemo.core.validation.StoreValidationException;
import io.mnemo.core.validation.StoreValidator;
import io.mnemo.core.validation.ValidationReport;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Backup, restore, load and save between the live store and context snapshots, plus timestamped
 * checkpoints of a snapshot and reverting to one.
 * <p>
 * Every write goes through {@link AtomicFiles}; a failed operation leaves its target as it was and
 * can be retried. An absent or empty live store is a normal starting point and is represented on
 * disk by the {@code {}} placeholder.
 */
public final class SnapshotManager {
    public static final String PLACEHOLDER = StoreCodec.EMPTY_STORE + "\n";

    private static final Logger LOG = LoggerFactory.getLogger(SnapshotManager.class);
    private static final DateTimeFormatter CHECKPOINT_SUFFIX = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private final AtomicFiles atomicFiles;
    private final StoreValidator validator;
    private final Clock clock;

    public SnapshotManager(AtomicFiles atomicFiles, StoreValidator validator, Clock clock) {
        this.atomicFiles = Objects.requireNonNull(atomicFiles, "atomicFiles must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public boolean backup(Path live, Path backup) throws IOException {
        if (isAbsentOrEmpty(live)) {
            atomicFiles.writeString(backup, PLACEHOLDER);
            LOG.info("Live store {} absent or empty; wrote empty backup {}", live, backup);
            return false;
        }
        validator.requireValid(live, NamingPolicy.structural());
        atomicFiles.copy(live, backup);
        LOG.info("Backed up {} to {}", live, backup);
        return true;
    }

    public void restore(Path backup, Path live, boolean deleteBackup) throws RestoreFailedException {
        if (!Files.exists(backup)) {
            throw new RestoreFailedException(backup, "No backup found at " + backup, null);
        }
        try {
            atomicFiles.copy(backup, live);
        } catch (IOException e) {
            LOG.error("Restore of {} into {} failed; backup preserved at {}", backup, live, backup, e);
            throw new RestoreFailedException(backup, "Failed to restore " + live + "; backup preserved at " + backup, e);
        }
        LOG.info("Restored {} from {}", live, backup);

        if (deleteBackup) {
            try {
                Files.deleteIfExists(backup);
            } catch (IOException e) {
                LOG.warn("Restored {} but could not delete backup {}", live, backup, e);
            }
        }
    }

    public void restore(Path backup, Path live) throws RestoreFailedException {
        restore(backup, live, true);
    }

    public ValidationReport load(Path snapshot, Path live, NamingPolicy policy) throws IOException {
        if (!Files.exists(snapshot)) {
            atomicFiles.writeString(live, PLACEHOLDER);
            LOG.info("No snapshot at {}; starting {} empty", snapshot, live);
            return ValidationReport.empty(snapshot);
        }
        ValidationReport report = validator.validate(snapshot, policy);
        if (!report.isValid()) {
            throw new StoreValidationException("Refusing to load snapshot " + snapshot, report);
        }
        atomicFiles.copy(snapshot, live);
        LOG.info("Loaded {} into {} ({} entities, {} relations)", snapshot, live, report.entityCount(), report.relationCount());
        return report;
    }

    public ValidationReport save(Path live, Path snapshot, NamingPolicy policy) throws IOException {
        if (!Files.exists(live)) {
            LOG.warn("No live store at {}; saving empty snapshot {}", live, snapshot);
            atomicFiles.writeString(snapshot, PLACEHOLDER);
            return ValidationReport.empty(snapshot);
        }

        try (StagedFile staged = atomicFiles.stage(snapshot)) {
            staged.write(out -> {
                try (InputStream in = Files.newInputStream(live)) {
                    in.transferTo(out);
                }
            });
            ValidationReport report = validator.validate(staged.path(), policy);
            if (!report.isValid()) {
                LOG.warn("Saved copy of {} failed validation, keeping previous {}", live, snapshot);
                throw new StoreValidationException("Refusing to save " + live + " to " + snapshot, report);
            }
            staged.commit();
            LOG.info("Saved {} to {} ({} entities, {} relations)", live, snapshot, report.entityCount(), report.relationCount());
            return new ValidationReport(
                snapshot,
                report.entityCount(),
                report.relationCount(),
                report.linesScanned(),
                report.errors(),
                report.warnings()
            );
        }
    }

    public Optional<Path> checkpoint(Path snapshot) throws IOException {
        if (!Files.exists(snapshot)) {
            return Optional.empty();
        }
        String suffix = LocalDateTime.now(clock).format(CHECKPOINT_SUFFIX);
        Path target = snapshot.resolveSibling(snapshot.getFileName() + ".backup-" + suffix);
        atomicFiles.copy(snapshot, target);
        LOG.info("Checkpointed {} to {}", snapshot, target.getFileName());
        return Optional.of(target);
    }

    public List<Path> checkpoints(Path snapshot) throws IOException {
        Path dir = snapshot.toAbsolutePath().getParent();
        if (dir == null || !Files.isDirectory(dir)) {
            return List.of();
        }
        String prefix = snapshot.getFileName() + ".backup-";
        try (Stream<Path> files = Files.list(dir)) {
            return files
                .filter(path -> path.getFileName().toString().startsWith(prefix))
                .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                .collect(Collectors.toList());
        }
    }

    public RevertResult revert(
        Path checkpoint,
        Path snapshot,
        Optional<Pattern> entityFilter,
        NamingPolicy policy
    ) throws IOException {
        if (!Files.exists(checkpoint)) {
            throw new NoSuchFileException(checkpoint.toString(), null, "checkpoint not found");
        }
        Set<String> kept = entityFilter.isPresent() ? keptEntityNames(checkpoint, entityFilter.get()) : null;
        RevertTally tally = new RevertTally();

        try (StagedFile staged = atomicFiles.stage(snapshot)) {
            staged.write(out -> {
                StoreWriter writer = new StoreWriter(out);
                try (StoreReader reader = StoreReader.open(checkpoint)) {
                    MemoryRecord record;
                    while ((record = reader.nextRecord()) != null) {
                        if (record instanceof EntityRecord entity) {
                            boolean keep = kept == null || kept.contains(entity.name());
                            if (keep) {
                                writer.write(entity);
                                tally.entitiesKept++;
                            } else {
                                tally.entitiesDropped++;
                            }
                        } else {
                            RelationRecord relation = (RelationRecord) record;
                            boolean keep = kept == null || kept.contains(relation.from()) && kept.contains(relation.to());
                            if (keep) {
                                writer.write(relation);
                                tally.relationsKept++;
                            } else {
                                tally.relationsDropped++;
                            }
                        }
                    }
                } catch (StoreDecodeException e) {
                    throw new IOException("Checkpoint " + checkpoint + " is not a valid store: " + e.getMessage(), e);
                }
                writer.flush();
            });
            ValidationReport report = validator.validate(staged.path(), policy);
            if (!report.isValid()) {
                LOG.warn("Revert of {} from {} failed validation, keeping current snapshot", snapshot, checkpoint);
                throw new StoreValidationException("Refusing to revert " + snapshot + " to " + checkpoint, report);
            }
            staged.commit();
            LOG.info(
                "Reverted {} to {} ({} entities kept, {} dropped)",
                snapshot,
                checkpoint.getFileName(),
                tally.entitiesKept,
                tally.entitiesDropped
            );
            return new RevertResult(
                checkpoint,
                snapshot,
                kept != null,
                tally.entitiesKept,
                tally.entitiesDropped,
                tally.relationsKept,
                tally.relationsDropped,
                new ValidationReport(
                    snapshot,
                    report.entityCount(),
                    report.relationCount(),
                    report.linesScanned(),
                    report.errors(),
                    report.warnings()
                )
            );
        }
    }

    private static Set<String> keptEntityNames(Path checkpoint, Pattern filter) throws IOException {
        Set<String> names = new HashSet<>();
        try (StoreReader reader = StoreReader.open(checkpoint)) {
            MemoryRecord record;
            while ((record = reader.nextRecord()) != null) {
                if (record instanceof EntityRecord entity && entity.name() != null && filter.matcher(entity.name()).find()) {
                    names.add(entity.name());
                }
            }
        } catch (StoreDecodeException e) {
            throw new IOException("Checkpoint " + checkpoint + " is not a valid store: " + e.getMessage(), e);
        }
        return names;
    }

    private static boolean isAbsentOrEmpty(Path path) throws IOException {
        return !Files.exists(path) || Files.size(path) == 0;
    }

    private static final class RevertTally {
        long entitiesKept;
        long entitiesDropped;
        long relationsKept;
        long relationsDropped;
    }
}
