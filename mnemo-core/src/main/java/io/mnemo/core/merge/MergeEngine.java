package io.mnemo.core.merge;

import io.mnemo.core.fs.AtomicFiles;
import io.mnemo.core.fs.StagedFile;
import io.mnemo.core.store.EntityRecord;
import io.mnemo.core.store.MemoryRecord;
import io.mnemo.core.store.RelationKey;
import io.mnemo.core.store.RelationRecord;
import io.mnemo.core.store.StoreDecodeException;
import io.mnemo.core.store.StoreReader;
import io.mnemo.core.store.StoreWriter;
import io.mnemo.core.validation.NamingPolicy;
import io.mnemo.core.validation.StoreValidator;
import io.mnemo.core.validation.ValidationReport;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Two-way merge of memory stores in time linear to the total record count.
 * <p>
 * Algorithm:
 * <ol>
 *   <li>Index local entities by name (first occurrence wins).</li>
 *   <li>Stream remote. An entity whose name is indexed goes through the {@link ConflictPolicy} and
 *       leaves the index; any other entity is emitted as is. A relation is emitted the first time
 *       its {@code (from, to, relationType)} key is seen.</li>
 *   <li>Emit the entities left in the index, in local order.</li>
 *   <li>Stream local again for relations whose key was not seen.</li>
 *   <li>Validate the staged output; only a valid result replaces {@code output}.</li>
 * </ol>
 * A missing local store counts as empty; the remote store must exist. A line in either input that
 * does not decode aborts the merge with {@link MergeInputException} before anything is committed.
 * Space is bounded by local entities plus distinct relation keys. An entity name is never written
 * twice, even if one input repeats it. Given the same inputs the output is identical byte for byte.
 */
public final class MergeEngine {
    private static final Logger LOG = LoggerFactory.getLogger(MergeEngine.class);

    private final AtomicFiles atomicFiles;
    private final StoreValidator validator;

    public MergeEngine(AtomicFiles atomicFiles, StoreValidator validator) {
        this.atomicFiles = Objects.requireNonNull(atomicFiles, "atomicFiles must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
    }

    public MergeResult merge(
        Path local,
        Path remote,
        Path output,
        ConflictPolicy policy,
        NamingPolicy naming
    ) throws IOException {
        Objects.requireNonNull(local, "local must not be null");
        requireExists(remote);
        Objects.requireNonNull(output, "output must not be null");
        ConflictPolicy conflictPolicy = policy == null ? ConflictPolicy.DEFAULT : policy;
        Objects.requireNonNull(naming, "naming must not be null");

        Map<String, EntityRecord> localIndex = indexEntities(local);
        Tally tally = new Tally();

        try (StagedFile staged = atomicFiles.stage(output)) {
            staged.write(out -> {
                StoreWriter writer = new StoreWriter(out);
                Set<RelationKey> seenRelations = new HashSet<>();
                Set<String> emittedNames = new HashSet<>();

                try (StoreReader reader = StoreReader.open(remote)) {
                    MemoryRecord record;
                    while ((record = next(reader, remote)) != null) {
                        if (record instanceof EntityRecord remoteEntity) {
                            EntityRecord chosen = remoteEntity;
                            EntityRecord localEntity = localIndex.remove(remoteEntity.name());
                            if (localEntity != null) {
                                chosen = conflictPolicy.resolve(localEntity, remoteEntity);
                                tally.conflicts++;
                            }
                            emitEntity(writer, chosen, emittedNames, tally);
                        } else {
                            emitRelation(writer, (RelationRecord) record, seenRelations, tally);
                        }
                    }
                }

                for (EntityRecord localOnly : localIndex.values()) {
                    emitEntity(writer, localOnly, emittedNames, tally);
                }

                try (StoreReader reader = StoreReader.openOrEmpty(local)) {
                    MemoryRecord record;
                    while ((record = next(reader, local)) != null) {
                        if (record instanceof RelationRecord relation) {
                            emitRelation(writer, relation, seenRelations, tally);
                        }
                    }
                }
                writer.flush();
            });

            ValidationReport report = validator.validate(staged.path(), naming);
            if (!report.isValid()) {
                LOG.warn("Discarding merge of {} and {}: {}", local, remote, report.summary());
                throw new MergeValidationFailedException("Merge result failed validation", report);
            }
            staged.commit();

            LOG.info(
                "Merged {} + {} into {} ({}): {} entities, {} relations, {} conflicts",
                local.getFileName(),
                remote.getFileName(),
                output,
                conflictPolicy.label(),
                tally.entities,
                tally.relations,
                tally.conflicts
            );
            return new MergeResult(
                output,
                conflictPolicy,
                tally.entities,
                tally.relations,
                tally.conflicts,
                tally.duplicateRelations,
                tally.duplicateEntities,
                report
            );
        }
    }

    private Map<String, EntityRecord> indexEntities(Path local) throws IOException {
        Map<String, EntityRecord> index = new LinkedHashMap<>();
        try (StoreReader reader = StoreReader.openOrEmpty(local)) {
            MemoryRecord record;
            while ((record = next(reader, local)) != null) {
                if (record instanceof EntityRecord entity) {
                    index.putIfAbsent(entity.name(), entity);
                }
            }
        }
        return index;
    }

    private static MemoryRecord next(StoreReader reader, Path input) throws IOException {
        try {
            return reader.nextRecord();
        } catch (StoreDecodeException e) {
            throw new MergeInputException(input, e);
        }
    }

    private static void emitEntity(
        StoreWriter writer,
        EntityRecord entity,
        Set<String> emittedNames,
        Tally tally
    ) throws IOException {
        if (!emittedNames.add(entity.name())) {
            tally.duplicateEntities++;
            return;
        }
        writer.write(entity);
        tally.entities++;
    }

    private static void emitRelation(
        StoreWriter writer,
        RelationRecord relation,
        Set<RelationKey> seen,
        Tally tally
    ) throws IOException {
        if (!seen.add(relation.key())) {
            tally.duplicateRelations++;
            return;
        }
        writer.write(relation);
        tally.relations++;
    }

    private static void requireExists(Path path) throws NoSuchFileException {
        Objects.requireNonNull(path, "remote must not be null");
        if (!Files.exists(path)) {
            throw new NoSuchFileException(path.toString());
        }
    }

    private static final class Tally {
        long entities;
        long relations;
        long conflicts;
        long duplicateRelations;
        long duplicateEntities;
    }
}
