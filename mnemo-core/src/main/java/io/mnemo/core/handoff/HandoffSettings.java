package io.mnemo.core.handoff;

import java.time.Duration;

public record HandoffSettings(Duration settleDelay, Duration pollInterval, Duration releaseTimeout) {

    public HandoffSettings {
        if (settleDelay == null || settleDelay.isNegative()) {
            throw new IllegalArgumentException("settleDelay must be >= 0");
        }
        if (pollInterval == null || pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must be > 0");
        }
        if (releaseTimeout == null || releaseTimeout.isNegative()) {
            throw new IllegalArgumentException("releaseTimeout must be >= 0");
        }
    }

    public static HandoffSettings defaults() {
        return new HandoffSettings(Duration.ofMillis(500), Duration.ofMillis(250), Duration.ofSeconds(30));
    }
}
