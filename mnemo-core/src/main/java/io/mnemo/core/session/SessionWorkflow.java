package io.mnemo.core.session;

import io.mnemo.core.handoff.HandoffCoordinator;
import io.mnemo.core.handoff.HandoffState;
import io.mnemo.core.handoff.ReleaseOutcome;
import io.mnemo.core.merge.ConflictPolicy;
import io.mnemo.core.merge.MergeEngine;
import io.mnemo.core.merge.MergeResult;
import io.mnemo.core.snapshot.SnapshotManager;
import io.mnemo.core.validation.NamingPolicy;
import io.mnemo.core.validation.ValidationReport;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a memory session: isolate the live store, load a context into it, hand it to the consumer,
 * then save the context back and put the original live store in place.
 * <p>
 * Session state lives in {@link SessionRecordStore}, so {@link #stop(Duration)} may run in a different
 * process than {@link #start}. At most one session is active per workspace.
 */
public final class SessionWorkflow {
    private static final Logger LOG = LoggerFactory.getLogger(SessionWorkflow.class);
    private static final DateTimeFormatter SESSION_ID = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Path workspace;
    private final Path liveStore;
    private final SnapshotManager snapshots;
    private final MergeEngine mergeEngine;
    private final SessionRecordStore records;
    private final ContextPolicies policies;
    private final HandoffCoordinator handoff;
    private final Clock clock;

    public SessionWorkflow(
        Path workspace,
        Path liveStore,
        SnapshotManager snapshots,
        MergeEngine mergeEngine,
        SessionRecordStore records,
        ContextPolicies policies,
        HandoffCoordinator handoff,
        Clock clock
    ) {
        this.workspace = Objects.requireNonNull(workspace, "workspace must not be null");
        this.liveStore = Objects.requireNonNull(liveStore, "liveStore must not be null");
        this.snapshots = Objects.requireNonNull(snapshots, "snapshots must not be null");
        this.mergeEngine = Objects.requireNonNull(mergeEngine, "mergeEngine must not be null");
        this.records = Objects.requireNonNull(records, "records must not be null");
        this.policies = Objects.requireNonNull(policies, "policies must not be null");
        this.handoff = Objects.requireNonNull(handoff, "handoff must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public Optional<SessionRecord> activeSession() throws IOException {
        return records.load();
    }

    public synchronized StartReport start(
        SessionContext context,
        Optional<Path> remoteSnapshot,
        ConflictPolicy policy
    ) throws IOException {
        Objects.requireNonNull(context, "context must not be null");
        Objects.requireNonNull(remoteSnapshot, "remoteSnapshot must not be null");
        Optional<SessionRecord> active = records.load();
        if (active.isPresent()) {
            throw new IllegalStateException(
                "Session " + active.get().id() + " on " + active.get().context() + " is already active"
            );
        }

        ContextPaths paths = ContextPaths.resolve(workspace, context);
        NamingPolicy naming = policies.forContext(context);
        Files.createDirectories(paths.memoryDir());

        boolean backedUp = snapshots.backup(liveStore, paths.backup());
        try {
            Optional<Path> checkpoint = Optional.empty();
            Optional<MergeResult> merge = Optional.empty();
            if (remoteSnapshot.isPresent()) {
                checkpoint = snapshots.checkpoint(paths.snapshot());
                merge = Optional.of(
                    mergeEngine.merge(paths.snapshot(), remoteSnapshot.get(), paths.snapshot(), policy, naming)
                );
            }
            ValidationReport loaded = snapshots.load(paths.snapshot(), liveStore, naming);

            SessionRecord record = new SessionRecord(
                newSessionId(),
                context.label(),
                clock.instant(),
                liveStore.toString(),
                paths.snapshot().toString(),
                paths.backup().toString()
            );
            records.save(record);
            handoff.prepareForHandoff();
            LOG.info("Session {} started on {}", record.id(), context);
            return new StartReport(record, backedUp, checkpoint, merge, loaded);
        } catch (IOException | RuntimeException e) {
            LOG.error("Starting session on {} failed; live store backup kept at {}", context, paths.backup(), e);
            throw new SessionException("Starting session on " + context + " failed: " + e.getMessage(), paths.backup(), e);
        }
    }

    public synchronized StopReport stop(Duration releaseTimeout) throws IOException {
        SessionRecord record = records.load()
            .orElseThrow(() -> new IllegalStateException("No active session"));
        SessionContext context = record.sessionContext();
        ContextPaths paths = ContextPaths.resolve(workspace, context);
        NamingPolicy naming = policies.forContext(context);

        if (handoff.state() == HandoffState.IDLE) {
            handoff.resumeHandedOff();
        }
        ReleaseOutcome release = releaseTimeout == null ? handoff.awaitRelease() : handoff.awaitRelease(releaseTimeout);

        try {
            ValidationReport saved;
            try {
                saved = snapshots.save(liveStore, paths.snapshot(), naming);
            } catch (IOException e) {
                // live store stays as the session left it; stop can be retried
                LOG.error("Saving session {} to {} failed; live store backup kept at {}", record.id(), paths.snapshot(), paths.backup(), e);
                throw new SessionException("Saving " + context + " failed: " + e.getMessage(), paths.backup(), e);
            }

            boolean restored = false;
            if (Files.exists(paths.backup())) {
                snapshots.restore(paths.backup(), liveStore);
                restored = true;
            } else {
                LOG.warn("No backup at {}; live store {} left with {} memory", paths.backup(), liveStore, context);
            }

            records.delete();
            LOG.info("Session {} on {} stopped", record.id(), context);
            return new StopReport(record, release, saved, restored);
        } finally {
            handoff.complete();
        }
    }

    private String newSessionId() {
        return LocalDateTime.now(clock).format(SESSION_ID) + "_" + ProcessHandle.current().pid();
    }
}
