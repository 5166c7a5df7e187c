package io.mnemo.core.handoff;

import java.time.Duration;

@FunctionalInterface
public interface Sleeper {
    Sleeper SYSTEM = duration -> Thread.sleep(Math.max(0L, duration.toMillis()));

    void sleep(Duration duration) throws InterruptedException;
}
