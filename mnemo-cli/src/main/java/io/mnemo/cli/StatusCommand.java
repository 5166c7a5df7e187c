package io.mnemo.cli;

import io.mnemo.core.runtime.MnemoRuntime;
import io.mnemo.core.session.SessionRecord;
import io.mnemo.core.stats.MemoryStats;
import java.nio.file.Files;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration, live store and active session")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            MnemoRuntime runtime = context.runtime();
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Workspace: " + runtime.workspace());
            System.out.println("Live store: " + StatsCommand.describe(MemoryStats.of(runtime.liveStore())));
            System.out.println("Conflict policy: " + runtime.defaultConflictPolicy().label());
            Optional<SessionRecord> session = runtime.sessionRecords().load();
            if (session.isPresent()) {
                SessionRecord record = session.get();
                System.out.println("Active session: " + record.id() + " on " + record.context() + " since " + record.startedAt());
                System.out.println("Backup: " + record.backup());
            } else {
                System.out.println("Active session: none");
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
