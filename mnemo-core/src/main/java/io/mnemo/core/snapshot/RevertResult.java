package io.mnemo.core.snapshot;

import io.mnemo.core.validation.ValidationReport;
import java.nio.file.Path;

public record RevertResult(
    Path checkpoint,
    Path snapshot,
    boolean partial,
    long entitiesKept,
    long entitiesDropped,
    long relationsKept,
    long relationsDropped,
    ValidationReport report
) {
}
