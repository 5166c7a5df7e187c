package io.mnemo.core.runtime;

import io.mnemo.core.config.ConfigPaths;
import io.mnemo.core.config.model.MnemoConfig;
import io.mnemo.core.fs.AtomicFiles;
import io.mnemo.core.handoff.HandoffCoordinator;
import io.mnemo.core.handoff.HandoffSettings;
import io.mnemo.core.handoff.Sleeper;
import io.mnemo.core.merge.ConflictPolicy;
import io.mnemo.core.merge.MergeEngine;
import io.mnemo.core.session.ContextPolicies;
import io.mnemo.core.session.SessionRecordStore;
import io.mnemo.core.session.SessionWorkflow;
import io.mnemo.core.snapshot.SnapshotManager;
import io.mnemo.core.validation.StoreValidator;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Objects;

public record MnemoRuntime(
    MnemoConfig config,
    Path workspace,
    Path liveStore,
    AtomicFiles atomicFiles,
    StoreValidator validator,
    MergeEngine mergeEngine,
    SnapshotManager snapshots,
    ContextPolicies policies,
    SessionRecordStore sessionRecords,
    HandoffSettings handoffSettings,
    Clock clock,
    Sleeper sleeper
) {

    public static MnemoRuntime create(MnemoConfig config, Clock clock) {
        return create(config, clock, Sleeper.SYSTEM);
    }

    public static MnemoRuntime create(MnemoConfig config, Clock clock, Sleeper sleeper) {
        Objects.requireNonNull(config, "config must not be null");
        Path workspace = ConfigPaths.resolveWorkspace(config);
        Path liveStore = ConfigPaths.resolveLiveStore(config);
        AtomicFiles atomicFiles = new AtomicFiles();
        StoreValidator validator = new StoreValidator(
            config.validation().maxErrors(),
            config.validation().sizeWarningBytes()
        );
        return new MnemoRuntime(
            config,
            workspace,
            liveStore,
            atomicFiles,
            validator,
            new MergeEngine(atomicFiles, validator),
            new SnapshotManager(atomicFiles, validator, clock),
            new ContextPolicies(config.validation()),
            new SessionRecordStore(workspace, atomicFiles),
            config.handoff().toSettings(),
            clock,
            sleeper
        );
    }

    public ConflictPolicy defaultConflictPolicy() {
        return ConflictPolicy.fromLabel(config.merge().conflictPolicy());
    }

    public SessionWorkflow workflow() {
        HandoffCoordinator handoff = new HandoffCoordinator(liveStore, handoffSettings, clock, sleeper);
        return new SessionWorkflow(
            workspace,
            liveStore,
            snapshots,
            mergeEngine,
            sessionRecords,
            policies,
            handoff,
            clock
        );
    }
}
