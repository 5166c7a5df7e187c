package io.mnemo.core.handoff;

import io.mnemo.core.store.StoreDecodeException;
import io.mnemo.core.store.StoreLine;
import io.mnemo.core.store.StoreReader;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sequences access to the live store with the external consumer process.
 * <p>
 * The consumer cannot be asked to honor a lock and there is no channel to it, so nothing here locks
 * the file or waits on a signal. Handing off means making our last write durable and pausing briefly;
 * taking the file back means polling until it is readable, writable and starts with a decodable
 * record, or until the timeout passes. A timeout is reported, never thrown: the session goes on.
 * <p>
 * One handoff per session; a new one starts only after {@link #complete()}.
 */
public final class HandoffCoordinator {
    private static final Logger LOG = LoggerFactory.getLogger(HandoffCoordinator.class);

    private final Path liveStore;
    private final HandoffSettings settings;
    private final Clock clock;
    private final Sleeper sleeper;
    private HandoffState state = HandoffState.IDLE;

    public HandoffCoordinator(Path liveStore, HandoffSettings settings) {
        this(liveStore, settings, Clock.systemUTC(), Sleeper.SYSTEM);
    }

    public HandoffCoordinator(Path liveStore, HandoffSettings settings, Clock clock, Sleeper sleeper) {
        this.liveStore = Objects.requireNonNull(liveStore, "liveStore must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    }

    public synchronized HandoffState state() {
        return state;
    }

    public synchronized void prepareForHandoff() {
        moveTo(HandoffState.PREPARING);
        flush();
        pause(settings.settleDelay());
        moveTo(HandoffState.HANDED_OFF);
        LOG.info("Live store {} handed off", liveStore);
    }

    public synchronized ReleaseOutcome awaitRelease() {
        return awaitRelease(settings.releaseTimeout());
    }

    public synchronized ReleaseOutcome awaitRelease(Duration timeout) {
        moveTo(HandoffState.AWAITING_RETURN);
        Instant deadline = clock.instant().plus(timeout);
        ReleaseOutcome outcome;
        while (true) {
            if (isUsable()) {
                outcome = ReleaseOutcome.RELEASED;
                break;
            }
            Duration remaining = Duration.between(clock.instant(), deadline);
            if (remaining.isZero() || remaining.isNegative()) {
                outcome = ReleaseOutcome.TIMED_OUT;
                break;
            }
            if (!pause(remaining.compareTo(settings.pollInterval()) < 0 ? remaining : settings.pollInterval())) {
                outcome = ReleaseOutcome.TIMED_OUT;
                break;
            }
        }
        moveTo(HandoffState.RECLAIMED);
        if (outcome == ReleaseOutcome.TIMED_OUT) {
            LOG.warn("Live store {} not usable after {} ms; reclaiming anyway", liveStore, timeout.toMillis());
        } else {
            LOG.info("Live store {} reclaimed", liveStore);
        }
        return outcome;
    }

    public synchronized void resumeHandedOff() {
        if (state != HandoffState.IDLE) {
            throw new IllegalStateException("Cannot resume handoff while " + state);
        }
        state = HandoffState.HANDED_OFF;
        LOG.info("Resumed handoff of {}", liveStore);
    }

    public synchronized void complete() {
        moveTo(HandoffState.IDLE);
    }

    boolean isUsable() {
        if (!Files.isReadable(liveStore) || !Files.isWritable(liveStore)) {
            return false;
        }
        try (StoreReader reader = StoreReader.open(liveStore)) {
            StoreLine first = reader.nextLine();
            if (first != null) {
                first.decode();
            }
            return true;
        } catch (IOException | StoreDecodeException e) {
            LOG.debug("Live store {} not usable yet: {}", liveStore, e.getMessage());
            return false;
        }
    }

    private void flush() {
        if (!Files.exists(liveStore)) {
            LOG.debug("Nothing to flush, {} does not exist", liveStore);
            return;
        }
        try (FileChannel channel = FileChannel.open(liveStore, StandardOpenOption.READ)) {
            channel.force(true);
        } catch (IOException e) {
            LOG.warn("Could not flush {} before handoff: {}", liveStore, e.getMessage());
        }
    }

    private boolean pause(Duration duration) {
        if (duration.isZero()) {
            return true;
        }
        try {
            sleeper.sleep(duration);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting on {}", liveStore);
            return false;
        }
    }

    private void moveTo(HandoffState next) {
        if (!state.canMoveTo(next)) {
            throw new IllegalStateException("Cannot move handoff from " + state + " to " + next);
        }
        LOG.debug("Handoff {} -> {}", state, next);
        state = next;
    }
}
