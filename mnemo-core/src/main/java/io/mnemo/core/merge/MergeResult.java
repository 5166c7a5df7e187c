package io.mnemo.core.merge;

import io.mnemo.core.validation.ValidationReport;
import java.nio.file.Path;

public record MergeResult(
    Path output,
    ConflictPolicy policy,
    long entityCount,
    long relationCount,
    long conflictsResolved,
    long duplicateRelationsDropped,
    long duplicateEntitiesDropped,
    ValidationReport report
) {
}
