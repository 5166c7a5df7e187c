package io.mnemo.core.validation;

import io.mnemo.core.store.EntityRecord;
import io.mnemo.core.store.MemoryRecord;
import io.mnemo.core.store.RelationRecord;
import io.mnemo.core.store.StoreDecodeException;
import io.mnemo.core.store.StoreLine;
import io.mnemo.core.store.StoreReader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single streaming pass over a store file.
 * <p>
 * Line-level problems are recorded, not thrown. Once {@code maxErrors} errors are collected the
 * next error ends the pass with a {@link ValidationErrorKind#TOO_MANY_ERRORS} entry, so a corrupt
 * file costs at most a bounded scan. A file larger than {@code sizeWarningBytes} earns a warning
 * but is still validated in full.
 */
public final class StoreValidator {
    public static final int DEFAULT_MAX_ERRORS = 10;
    public static final long DEFAULT_SIZE_WARNING_BYTES = 10L * 1024 * 1024;

    private static final Logger LOG = LoggerFactory.getLogger(StoreValidator.class);

    private final int maxErrors;
    private final long sizeWarningBytes;

    public StoreValidator() {
        this(DEFAULT_MAX_ERRORS, DEFAULT_SIZE_WARNING_BYTES);
    }

    public StoreValidator(int maxErrors, long sizeWarningBytes) {
        if (maxErrors <= 0) {
            throw new IllegalArgumentException("maxErrors must be > 0");
        }
        this.maxErrors = maxErrors;
        this.sizeWarningBytes = sizeWarningBytes;
    }

    public ValidationReport validate(Path path, NamingPolicy policy) throws IOException {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(policy, "policy must not be null");

        if (!Files.exists(path)) {
            return new ValidationReport(
                path, 0, 0, 0,
                List.of(new ValidationError(ValidationErrorKind.IO, 0, "store file not found: " + path)),
                List.of()
            );
        }

        List<ValidationWarning> warnings = new ArrayList<>();
        long size = Files.size(path);
        if (sizeWarningBytes > 0 && size > sizeWarningBytes) {
            String message = "store is " + size + " bytes, above the " + sizeWarningBytes + " byte threshold";
            LOG.warn("{}: {}", path, message);
            warnings.add(new ValidationWarning(ValidationWarning.Kind.SIZE_PRESSURE, message));
        }

        ErrorCollector errors = new ErrorCollector(maxErrors);
        Set<String> names = policy.strictDuplicates() ? new HashSet<>() : null;
        long entities = 0;
        long relations = 0;
        int scanned = 0;

        try (StoreReader reader = StoreReader.open(path)) {
            StoreLine line;
            while ((line = reader.nextLine()) != null) {
                scanned = line.number();
                MemoryRecord record;
                try {
                    record = line.decode();
                } catch (StoreDecodeException e) {
                    ValidationErrorKind kind = e.kind() == StoreDecodeException.Kind.UNKNOWN_KIND
                        ? ValidationErrorKind.UNKNOWN_KIND
                        : ValidationErrorKind.MALFORMED;
                    if (!errors.add(kind, line.number(), e.getMessage())) {
                        break;
                    }
                    continue;
                }

                boolean keepGoing;
                if (record instanceof EntityRecord entity) {
                    entities++;
                    keepGoing = checkEntity(entity, line.number(), policy, names, errors);
                } else {
                    relations++;
                    keepGoing = checkRelation((RelationRecord) record, line.number(), errors);
                }
                if (!keepGoing) {
                    break;
                }
            }
            if (scanned == 0) {
                scanned = reader.lineNumber();
            }
        }

        ValidationReport report = new ValidationReport(path, entities, relations, scanned, errors.errors(), warnings);
        if (report.isValid()) {
            LOG.debug("Validated {}: {} entities, {} relations", path, entities, relations);
        } else {
            LOG.debug("Validation of {} failed: {}", path, report.summary());
        }
        return report;
    }

    public ValidationReport requireValid(Path path, NamingPolicy policy) throws IOException {
        ValidationReport report = validate(path, policy);
        if (!report.isValid()) {
            throw new StoreValidationException("Invalid memory store " + path, report);
        }
        return report;
    }

    private boolean checkEntity(
        EntityRecord entity,
        int line,
        NamingPolicy policy,
        Set<String> names,
        ErrorCollector errors
    ) {
        if (isBlank(entity.name())) {
            return errors.add(ValidationErrorKind.MISSING_FIELD, line, "entity is missing 'name'");
        }
        if (isBlank(entity.entityType())
            && !errors.add(ValidationErrorKind.MISSING_FIELD, line, "entity " + entity.name() + " is missing 'entityType'")) {
            return false;
        }
        if (!policy.matches(entity.name())
            && !errors.add(
                ValidationErrorKind.BAD_PREFIX,
                line,
                "entity " + entity.name() + " does not start with '" + policy.expectedPrefix() + "'"
            )) {
            return false;
        }
        if (names != null && !names.add(entity.name())) {
            return errors.add(ValidationErrorKind.DUPLICATE_ENTITY, line, "duplicate entity " + entity.name());
        }
        return true;
    }

    private boolean checkRelation(RelationRecord relation, int line, ErrorCollector errors) {
        if (isBlank(relation.from())
            && !errors.add(ValidationErrorKind.MISSING_FIELD, line, "relation is missing 'from'")) {
            return false;
        }
        if (isBlank(relation.to())
            && !errors.add(ValidationErrorKind.MISSING_FIELD, line, "relation is missing 'to'")) {
            return false;
        }
        if (isBlank(relation.relationType())) {
            return errors.add(ValidationErrorKind.MISSING_FIELD, line, "relation is missing 'relationType'");
        }
        return true;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static final class ErrorCollector {
        private final int cap;
        private final List<ValidationError> errors = new ArrayList<>();
        private boolean overflowed;

        ErrorCollector(int cap) {
            this.cap = cap;
        }

        boolean add(ValidationErrorKind kind, int line, String message) {
            if (overflowed) {
                return false;
            }
            if (errors.size() >= cap) {
                errors.add(new ValidationError(
                    ValidationErrorKind.TOO_MANY_ERRORS,
                    line,
                    "more than " + cap + " errors, validation stopped"
                ));
                overflowed = true;
                return false;
            }
            errors.add(new ValidationError(kind, line, message));
            return true;
        }

        List<ValidationError> errors() {
            return errors;
        }
    }
}
