package io.mnemo.core.session;

import io.mnemo.core.merge.MergeResult;
import io.mnemo.core.validation.ValidationReport;
import java.nio.file.Path;
import java.util.Optional;

public record StartReport(
    SessionRecord record,
    boolean liveBackedUp,
    Optional<Path> checkpoint,
    Optional<MergeResult> merge,
    ValidationReport loaded
) {
}
