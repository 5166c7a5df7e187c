package io.mnemo.core.handoff;

public enum ReleaseOutcome {
    RELEASED,
    TIMED_OUT
}
