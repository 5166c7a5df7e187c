package io.mnemo.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.mnemo.core.handoff.HandoffSettings;
import java.time.Duration;

@JsonIgnoreProperties(ignoreUnknown = true)
public record HandoffConfig(long settleMillis, long pollIntervalMillis, long releaseTimeoutMillis) {

    public static HandoffConfig defaults() {
        return new HandoffConfig(500, 250, 30_000);
    }

    public HandoffSettings toSettings() {
        return new HandoffSettings(
            Duration.ofMillis(settleMillis),
            Duration.ofMillis(pollIntervalMillis),
            Duration.ofMillis(releaseTimeoutMillis)
        );
    }
}
