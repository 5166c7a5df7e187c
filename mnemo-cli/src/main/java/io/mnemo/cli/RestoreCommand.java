package io.mnemo.cli;

import io.mnemo.core.runtime.MnemoRuntime;
import io.mnemo.core.session.ContextPaths;
import io.mnemo.core.session.SessionContext;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "restore", description = "Put a context's live store backup back in place")
public final class RestoreCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "framework or project:<name>")
    String contextLabel;

    @Option(names = "--keep-backup", description = "Leave the backup file after restoring")
    boolean keepBackup;

    public RestoreCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            MnemoRuntime runtime = context.runtime();
            ContextPaths paths = ContextPaths.resolve(runtime.workspace(), SessionContext.parse(contextLabel));
            runtime.snapshots().restore(paths.backup(), runtime.liveStore(), !keepBackup);
            System.out.println("Restored " + runtime.liveStore() + " from " + paths.backup());
            if (runtime.sessionRecords().load().isPresent()) {
                System.out.println("A session is still recorded as active; run stop or remove " + runtime.sessionRecords().file());
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Restore failed: " + e.getMessage());
            return 1;
        }
    }
}
