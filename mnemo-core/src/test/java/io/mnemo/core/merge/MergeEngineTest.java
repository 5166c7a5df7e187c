package io.mnemo.core.merge;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.mnemo.core.fs.AtomicFiles;
import io.mnemo.core.store.EntityRecord;
import io.mnemo.core.store.MemoryRecord;
import io.mnemo.core.store.RelationKey;
import io.mnemo.core.store.RelationRecord;
import io.mnemo.core.store.StoreCodec;
import io.mnemo.core.store.StoreReader;
import io.mnemo.core.validation.NamingPolicy;
import io.mnemo.core.validation.StoreValidator;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MergeEngineTest {
    private static final NamingPolicy AIPM = NamingPolicy.prefix("AIPM_");

    @TempDir
    Path tempDir;

    private final MergeEngine engine = new MergeEngine(new AtomicFiles(), new StoreValidator());

    @Test
    void shouldProduceIdenticalBytesForIdenticalInputs() throws Exception {
        Path local = store("local.json",
            EntityRecord.of("AIPM_A", "concept", "local"),
            EntityRecord.of("AIPM_B", "concept"),
            RelationRecord.of("AIPM_A", "AIPM_B", "uses")
        );
        Path remote = store("remote.json",
            EntityRecord.of("AIPM_A", "concept", "remote"),
            EntityRecord.of("AIPM_C", "concept"),
            RelationRecord.of("AIPM_C", "AIPM_A", "extends")
        );

        engine.merge(local, remote, tempDir.resolve("out1.json"), ConflictPolicy.REMOTE_WINS, AIPM);
        engine.merge(local, remote, tempDir.resolve("out2.json"), ConflictPolicy.REMOTE_WINS, AIPM);

        assertThat(Files.readAllBytes(tempDir.resolve("out1.json")))
            .isEqualTo(Files.readAllBytes(tempDir.resolve("out2.json")));
        assertThat(Files.readAllLines(tempDir.resolve("out1.json"))).containsExactly(
            StoreCodec.encode(EntityRecord.of("AIPM_A", "concept", "remote")),
            StoreCodec.encode(EntityRecord.of("AIPM_C", "concept")),
            StoreCodec.encode(RelationRecord.of("AIPM_C", "AIPM_A", "extends")),
            StoreCodec.encode(EntityRecord.of("AIPM_B", "concept")),
            StoreCodec.encode(RelationRecord.of("AIPM_A", "AIPM_B", "uses"))
        );
    }

    @Test
    void shouldSumCountsOfDisjointStores() throws Exception {
        Path local = store("local.json",
            EntityRecord.of("AIPM_A", "concept"),
            EntityRecord.of("AIPM_B", "concept"),
            RelationRecord.of("AIPM_A", "AIPM_B", "uses")
        );
        Path remote = store("remote.json",
            EntityRecord.of("AIPM_C", "concept"),
            RelationRecord.of("AIPM_C", "AIPM_A", "uses"),
            RelationRecord.of("AIPM_C", "AIPM_B", "uses")
        );

        MergeResult result = engine.merge(local, remote, tempDir.resolve("out.json"), ConflictPolicy.REMOTE_WINS, AIPM);

        assertThat(result.entityCount()).isEqualTo(3);
        assertThat(result.relationCount()).isEqualTo(3);
        assertThat(result.conflictsResolved()).isZero();
        assertThat(result.report().isValid()).isTrue();
    }

    @Test
    void remoteWinsShouldKeepRemoteVersion() throws Exception {
        Path local = store("local.json", EntityRecord.of("AIPM_X", "concept", "local"));
        Path remote = store("remote.json", EntityRecord.of("AIPM_X", "concept", "remote"));
        Path output = tempDir.resolve("out.json");

        MergeResult result = engine.merge(local, remote, output, ConflictPolicy.REMOTE_WINS, AIPM);

        assertThat(records(output)).containsExactly(EntityRecord.of("AIPM_X", "concept", "remote"));
        assertThat(result.conflictsResolved()).isEqualTo(1);
    }

    @Test
    void localWinsShouldKeepLocalVersion() throws Exception {
        Path local = store("local.json", EntityRecord.of("AIPM_X", "concept", "local"));
        Path remote = store("remote.json", EntityRecord.of("AIPM_X", "concept", "remote"));
        Path output = tempDir.resolve("out.json");

        engine.merge(local, remote, output, ConflictPolicy.LOCAL_WINS, AIPM);

        assertThat(records(output)).containsExactly(EntityRecord.of("AIPM_X", "concept", "local"));
    }

    @Test
    void newestWinsShouldCompareTimestampsAndKeepLocalOnTie() throws Exception {
        Path local = store("local.json",
            EntityRecord.of("AIPM_OLD", "concept", "local").withTimestamp(100),
            EntityRecord.of("AIPM_NEW", "concept", "local").withTimestamp(300),
            EntityRecord.of("AIPM_TIE", "concept", "local", "timestamp:200")
        );
        Path remote = store("remote.json",
            EntityRecord.of("AIPM_OLD", "concept", "remote").withTimestamp(200),
            EntityRecord.of("AIPM_NEW", "concept", "remote").withTimestamp(250),
            EntityRecord.of("AIPM_TIE", "concept", "remote").withTimestamp(200)
        );
        Path output = tempDir.resolve("out.json");

        engine.merge(local, remote, output, ConflictPolicy.NEWEST_WINS, AIPM);

        assertThat(records(output)).containsExactly(
            EntityRecord.of("AIPM_OLD", "concept", "remote").withTimestamp(200),
            EntityRecord.of("AIPM_NEW", "concept", "local").withTimestamp(300),
            EntityRecord.of("AIPM_TIE", "concept", "local", "timestamp:200")
        );
    }

    @Test
    void shouldNeverEmitDuplicateRelationKeysOrEntityNames() throws Exception {
        Path local = store("local.json",
            EntityRecord.of("AIPM_A", "concept", "first"),
            EntityRecord.of("AIPM_A", "concept", "second"),
            EntityRecord.of("AIPM_B", "concept"),
            RelationRecord.of("AIPM_A", "AIPM_B", "uses"),
            RelationRecord.of("AIPM_A", "AIPM_B", "uses")
        );
        Path remote = store("remote.json",
            RelationRecord.of("AIPM_A", "AIPM_B", "uses"),
            RelationRecord.of("AIPM_B", "AIPM_A", "uses")
        );
        Path output = tempDir.resolve("out.json");

        MergeResult result = engine.merge(local, remote, output, ConflictPolicy.REMOTE_WINS, AIPM);

        List<MemoryRecord> merged = records(output);
        Set<RelationKey> keys = new HashSet<>();
        Set<String> names = new HashSet<>();
        for (MemoryRecord record : merged) {
            if (record instanceof RelationRecord relation) {
                assertThat(keys.add(relation.key())).isTrue();
            } else {
                assertThat(names.add(((EntityRecord) record).name())).isTrue();
            }
        }
        assertThat(merged).contains(EntityRecord.of("AIPM_A", "concept", "first"));
        assertThat(result.relationCount()).isEqualTo(2);
        assertThat(result.duplicateRelationsDropped()).isEqualTo(2);
    }

    @Test
    void shouldTreatMissingLocalAsEmpty() throws Exception {
        Path remote = store("remote.json", EntityRecord.of("AIPM_A", "concept"));
        Path output = tempDir.resolve("out.json");

        MergeResult result = engine.merge(tempDir.resolve("absent.json"), remote, output, null, AIPM);

        assertThat(result.policy()).isEqualTo(ConflictPolicy.REMOTE_WINS);
        assertThat(records(output)).containsExactly(EntityRecord.of("AIPM_A", "concept"));
    }

    @Test
    void shouldRequireRemoteStore() throws Exception {
        Path local = store("local.json", EntityRecord.of("AIPM_A", "concept"));

        assertThatThrownBy(() -> engine.merge(local, tempDir.resolve("missing.json"), local, ConflictPolicy.REMOTE_WINS, AIPM))
            .isInstanceOf(NoSuchFileException.class);
    }

    @Test
    void shouldDiscardInvalidResultAndKeepExistingOutput() throws Exception {
        Path local = store("local.json", EntityRecord.of("AIPM_A", "concept"));
        Path remote = store("remote.json", EntityRecord.of("FOREIGN_B", "concept"));
        Path output = tempDir.resolve("out.json");
        Files.writeString(output, "previous\n");

        assertThatThrownBy(() -> engine.merge(local, remote, output, ConflictPolicy.REMOTE_WINS, AIPM))
            .isInstanceOf(MergeValidationFailedException.class)
            .satisfies(e -> assertThat(((MergeValidationFailedException) e).report().isValid()).isFalse());

        assertThat(Files.readString(output)).isEqualTo("previous\n");
        try (Stream<Path> files = Files.list(tempDir)) {
            assertThat(files.map(path -> path.getFileName().toString()).collect(Collectors.toList()))
                .containsExactlyInAnyOrder("local.json", "remote.json", "out.json");
        }
    }

    @Test
    void shouldRejectUndecodableRemoteLineNamingFileAndLine() throws Exception {
        Path local = store("local.json", EntityRecord.of("AIPM_A", "concept"));
        Path remote = tempDir.resolve("remote.json");
        Files.writeString(remote, StoreCodec.encode(EntityRecord.of("AIPM_B", "concept")) + "\n{broken\n");
        Path output = tempDir.resolve("out.json");
        Files.writeString(output, "previous\n");

        assertThatThrownBy(() -> engine.merge(local, remote, output, ConflictPolicy.REMOTE_WINS, AIPM))
            .isInstanceOf(MergeInputException.class)
            .hasMessageContaining("remote.json")
            .satisfies(e -> {
                MergeInputException failure = (MergeInputException) e;
                assertThat(failure.input()).isEqualTo(remote);
                assertThat(failure.lineNumber()).isEqualTo(2);
            });

        assertThat(Files.readString(output)).isEqualTo("previous\n");
        try (Stream<Path> files = Files.list(tempDir)) {
            assertThat(files.map(path -> path.getFileName().toString()).collect(Collectors.toList()))
                .containsExactlyInAnyOrder("local.json", "remote.json", "out.json");
        }
    }

    @Test
    void shouldRejectUndecodableLocalLine() throws Exception {
        Path local = tempDir.resolve("local.json");
        Files.writeString(local, "{\"type\":\"note\"}\n");
        Path remote = store("remote.json", EntityRecord.of("AIPM_B", "concept"));

        assertThatThrownBy(() -> engine.merge(local, remote, local, ConflictPolicy.REMOTE_WINS, AIPM))
            .isInstanceOf(MergeInputException.class)
            .satisfies(e -> assertThat(((MergeInputException) e).input()).isEqualTo(local));
        assertThat(Files.readString(local)).isEqualTo("{\"type\":\"note\"}\n");
    }

    @Test
    void shouldMergeInPlaceOverLocal() throws Exception {
        Path local = store("local.json", EntityRecord.of("AIPM_A", "concept"));
        Path remote = store("remote.json", EntityRecord.of("AIPM_B", "concept"));

        engine.merge(local, remote, local, ConflictPolicy.REMOTE_WINS, AIPM);

        assertThat(records(local)).containsExactly(
            EntityRecord.of("AIPM_B", "concept"),
            EntityRecord.of("AIPM_A", "concept")
        );
    }

    private Path store(String name, MemoryRecord... records) throws IOException {
        Path path = tempDir.resolve(name);
        List<String> lines = Arrays.stream(records).map(StoreCodec::encode).collect(Collectors.toList());
        Files.write(path, lines, StandardCharsets.UTF_8);
        return path;
    }

    private static List<MemoryRecord> records(Path path) throws IOException {
        List<MemoryRecord> records = new ArrayList<>();
        try (StoreReader reader = StoreReader.open(path)) {
            MemoryRecord record;
            while ((record = reader.nextRecord()) != null) {
                records.add(record);
            }
        }
        return records;
    }
}
