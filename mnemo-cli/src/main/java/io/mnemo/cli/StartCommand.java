package io.mnemo.cli;

import io.mnemo.core.merge.ConflictPolicy;
import io.mnemo.core.runtime.MnemoRuntime;
import io.mnemo.core.session.SessionContext;
import io.mnemo.core.session.SessionWorkflow;
import io.mnemo.core.session.StartReport;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "start", description = "Load a context into the live store and hand it to the assistant")
public final class StartCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "framework or project:<name>")
    String contextLabel;

    @Option(names = {"-r", "--remote"}, description = "Remote snapshot to merge into the context first")
    Path remote;

    @Option(names = {"-p", "--policy"}, description = "Conflict policy for the merge")
    String policy;

    public StartCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            MnemoRuntime runtime = context.runtime();
            StartReport report = start(runtime, runtime.workflow(), SessionContext.parse(contextLabel), remote, policy);
            print(report);
            return 0;
        } catch (Exception e) {
            System.err.println("Start failed: " + e.getMessage());
            return 1;
        }
    }

    static StartReport start(
        MnemoRuntime runtime,
        SessionWorkflow workflow,
        SessionContext sessionContext,
        Path remote,
        String policy
    ) throws IOException {
        ConflictPolicy conflictPolicy = policy != null ? ConflictPolicy.fromLabel(policy) : runtime.defaultConflictPolicy();
        return workflow.start(sessionContext, Optional.ofNullable(remote), conflictPolicy);
    }

    static void print(StartReport report) {
        System.out.println("Session " + report.record().id() + " started on " + report.record().context());
        report.checkpoint().ifPresent(path -> System.out.println("Checkpoint: " + path));
        report.merge().ifPresent(merge -> System.out.println(
            "Merged remote (" + merge.policy().label() + "): " + merge.conflictsResolved() + " conflicts resolved"
        ));
        System.out.println("Loaded: " + report.loaded().entityCount() + " entities, " + report.loaded().relationCount() + " relations");
        System.out.println("Live store backup: " + (report.liveBackedUp() ? report.record().backup() : "none (live store was empty)"));
    }
}
