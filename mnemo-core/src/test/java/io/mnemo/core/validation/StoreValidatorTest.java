package io.mnemo.core.validation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import io.mnemo.core.store.EntityRecord;
import io.mnemo.core.store.RelationRecord;
import io.mnemo.core.store.StoreCodec;
import java.io.BufferedWriter;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class StoreValidatorTest {

    @TempDir
    Path tempDir;

    private final StoreValidator validator = new StoreValidator();

    @Test
    void shouldCountRecordsOfValidStore() throws Exception {
        Path store = write("store.json",
            StoreCodec.encode(EntityRecord.of("AIPM_A", "concept", "x")),
            StoreCodec.encode(EntityRecord.of("AIPM_B", "concept")),
            StoreCodec.encode(RelationRecord.of("AIPM_A", "AIPM_B", "uses"))
        );

        ValidationReport report = validator.validate(store, NamingPolicy.prefix("AIPM_"));

        assertThat(report.isValid()).isTrue();
        assertThat(report.entityCount()).isEqualTo(2);
        assertThat(report.relationCount()).isEqualTo(1);
        assertThat(report.summary()).isEqualTo("valid: 2 entities, 1 relations");
    }

    @Test
    void shouldAcceptEmptyFileAndEmptyMarker() throws Exception {
        Path empty = write("empty.json");
        Path marker = write("marker.json", "{}");

        assertThat(validator.validate(empty, NamingPolicy.prefix("AIPM_")).isValid()).isTrue();
        ValidationReport report = validator.validate(marker, NamingPolicy.prefix("AIPM_"));
        assertThat(report.isValid()).isTrue();
        assertThat(report.entityCount()).isZero();
    }

    @Test
    void shouldAcceptEmptyObjectWithWhitespaceAsMarker() throws Exception {
        Path spaced = write("spaced.json", "{ }");
        Path multi = write("multi.json", "", "  {\t}  ", StoreCodec.encode(EntityRecord.of("AIPM_A", "concept")));

        assertThat(validator.validate(spaced, NamingPolicy.prefix("AIPM_")).isValid()).isTrue();
        ValidationReport report = validator.validate(multi, NamingPolicy.prefix("AIPM_"));
        assertThat(report.isValid()).isTrue();
        assertThat(report.entityCount()).isEqualTo(1);
    }

    @Test
    void emptyObjectAfterFirstRecordShouldStillFail() throws Exception {
        Path store = write("store.json", StoreCodec.encode(EntityRecord.of("AIPM_A", "concept")), "{ }");

        ValidationReport report = validator.validate(store, NamingPolicy.prefix("AIPM_"));

        assertThat(report.errors())
            .extracting(ValidationError::kind, ValidationError::lineNumber)
            .containsExactly(tuple(ValidationErrorKind.UNKNOWN_KIND, 2));
    }

    @Test
    void shouldRecordInvalidUtf8LineAsMalformedAndKeepScanning() throws Exception {
        Path store = tempDir.resolve("store.json");
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        bytes.write((StoreCodec.encode(EntityRecord.of("AIPM_A", "concept")) + "\n").getBytes(StandardCharsets.UTF_8));
        bytes.write("{\"type\":\"entity\",\"name\":\"AIPM_".getBytes(StandardCharsets.UTF_8));
        bytes.write(new byte[] {(byte) 0xC3, (byte) 0x28});
        bytes.write("\",\"entityType\":\"concept\",\"observations\":[]}\r\n".getBytes(StandardCharsets.UTF_8));
        bytes.write((StoreCodec.encode(EntityRecord.of("AIPM_B", "concept")) + "\n").getBytes(StandardCharsets.UTF_8));
        Files.write(store, bytes.toByteArray());

        ValidationReport report = validator.validate(store, NamingPolicy.prefix("AIPM_"));

        assertThat(report.isValid()).isFalse();
        assertThat(report.errors())
            .extracting(ValidationError::kind, ValidationError::lineNumber)
            .containsExactly(tuple(ValidationErrorKind.MALFORMED, 2));
        assertThat(report.errors().get(0).message()).contains("invalid UTF-8");
        assertThat(report.entityCount()).isEqualTo(2);
        assertThat(report.linesScanned()).isEqualTo(3);
    }

    @Test
    void shouldStopScanningOnceErrorCapIsExceeded() throws Exception {
        Path store = tempDir.resolve("big.json");
        try (BufferedWriter writer = Files.newBufferedWriter(store, StandardCharsets.UTF_8)) {
            for (int i = 0; i < 11; i++) {
                writer.write("not json " + i + "\n");
            }
            String valid = StoreCodec.encode(EntityRecord.of("AIPM_OK", "concept"));
            for (int i = 11; i < 10_000; i++) {
                writer.write(valid + "\n");
            }
        }

        ValidationReport report = validator.validate(store, NamingPolicy.structural());

        assertThat(report.isValid()).isFalse();
        assertThat(report.errors()).hasSize(11);
        assertThat(report.errors().subList(0, 10))
            .allMatch(error -> error.kind() == ValidationErrorKind.MALFORMED);
        assertThat(report.errors().get(10).kind()).isEqualTo(ValidationErrorKind.TOO_MANY_ERRORS);
        assertThat(report.truncated()).isTrue();
        assertThat(report.linesScanned()).isEqualTo(11);
        assertThat(report.entityCount()).isZero();
    }

    @Test
    void shouldReportLineNumbersForEachProblem() throws Exception {
        Path store = write("store.json",
            StoreCodec.encode(EntityRecord.of("AIPM_A", "concept")),
            "{\"type\":\"note\"}",
            "{\"type\":\"entity\",\"entityType\":\"concept\"}",
            StoreCodec.encode(EntityRecord.of("OTHER_B", "concept")),
            "{\"type\":\"relation\",\"from\":\"AIPM_A\",\"relationType\":\"uses\"}"
        );

        ValidationReport report = validator.validate(store, NamingPolicy.prefix("AIPM_"));

        assertThat(report.errors())
            .extracting(ValidationError::kind, ValidationError::lineNumber)
            .containsExactly(
                tuple(ValidationErrorKind.UNKNOWN_KIND, 2),
                tuple(ValidationErrorKind.MISSING_FIELD, 3),
                tuple(ValidationErrorKind.BAD_PREFIX, 4),
                tuple(ValidationErrorKind.MISSING_FIELD, 5)
            );
    }

    @Test
    void shouldHonorCaseInsensitivePrefix() throws Exception {
        Path store = write("store.json", StoreCodec.encode(EntityRecord.of("aipm_lower", "concept")));

        assertThat(validator.validate(store, NamingPolicy.prefix("AIPM_")).isValid()).isFalse();
        assertThat(validator.validate(store, new NamingPolicy("AIPM_", true, false)).isValid()).isTrue();
    }

    @Test
    void shouldFlagDuplicateEntitiesOnlyWhenStrict() throws Exception {
        String line = StoreCodec.encode(EntityRecord.of("AIPM_A", "concept"));
        Path store = write("store.json", line, line);

        ValidationReport lenient = validator.validate(store, NamingPolicy.prefix("AIPM_"));
        ValidationReport strict = validator.validate(store, NamingPolicy.prefix("AIPM_").withStrictDuplicates(true));

        assertThat(lenient.isValid()).isTrue();
        assertThat(lenient.entityCount()).isEqualTo(2);
        assertThat(strict.errors())
            .singleElement()
            .satisfies(error -> {
                assertThat(error.kind()).isEqualTo(ValidationErrorKind.DUPLICATE_ENTITY);
                assertThat(error.lineNumber()).isEqualTo(2);
            });
    }

    @Test
    void shouldWarnAboutSizeWithoutFailing() throws Exception {
        Path store = write("store.json", StoreCodec.encode(EntityRecord.of("AIPM_A", "concept", "x".repeat(200))));

        ValidationReport report = new StoreValidator(10, 100).validate(store, NamingPolicy.structural());

        assertThat(report.isValid()).isTrue();
        assertThat(report.warnings())
            .extracting(ValidationWarning::kind)
            .containsExactly(ValidationWarning.Kind.SIZE_PRESSURE);
    }

    @Test
    void shouldReportMissingFileAsIoError() throws Exception {
        ValidationReport report = validator.validate(tempDir.resolve("missing.json"), NamingPolicy.structural());

        assertThat(report.errors()).extracting(ValidationError::kind).containsExactly(ValidationErrorKind.IO);
    }

    @Test
    void requireValidShouldThrowWithReport() throws Exception {
        Path store = write("store.json", "garbage");

        assertThatThrownBy(() -> validator.requireValid(store, NamingPolicy.structural()))
            .isInstanceOf(StoreValidationException.class)
            .satisfies(e -> assertThat(((StoreValidationException) e).report().errors()).hasSize(1));
    }

    private Path write(String name, String... lines) throws Exception {
        Path path = tempDir.resolve(name);
        Files.write(path, List.of(lines), StandardCharsets.UTF_8);
        return path;
    }
}
