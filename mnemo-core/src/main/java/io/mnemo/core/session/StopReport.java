package io.mnemo.core.session;

import io.mnemo.core.handoff.ReleaseOutcome;
import io.mnemo.core.validation.ValidationReport;

public record StopReport(
    SessionRecord record,
    ReleaseOutcome release,
    ValidationReport saved,
    boolean restored
) {
}
