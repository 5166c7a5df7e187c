package io.mnemo.cli;

import io.mnemo.core.handoff.ReleaseOutcome;
import io.mnemo.core.runtime.MnemoRuntime;
import io.mnemo.core.session.SessionWorkflow;
import io.mnemo.core.session.StopReport;
import io.mnemo.core.snapshot.RestoreFailedException;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "stop", description = "Save the live store to the session's context and put the original back")
public final class StopCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--timeout-ms", description = "How long to wait for the assistant to release the live store")
    Long timeoutMillis;

    public StopCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            MnemoRuntime runtime = context.runtime();
            print(stop(runtime.workflow(), timeoutMillis));
            return 0;
        } catch (RestoreFailedException e) {
            System.err.println("Stop failed: " + e.getMessage());
            System.err.println("Recover the live store from " + e.backupPath());
            return 1;
        } catch (Exception e) {
            System.err.println("Stop failed: " + e.getMessage());
            return 1;
        }
    }

    static StopReport stop(SessionWorkflow workflow, Long timeoutMillis) throws IOException {
        return workflow.stop(timeoutMillis == null ? null : Duration.ofMillis(timeoutMillis));
    }

    static void print(StopReport report) {
        if (report.release() == ReleaseOutcome.TIMED_OUT) {
            System.out.println("Warning: live store was not released in time; saved it anyway");
        }
        System.out.println("Saved " + report.record().context() + ": " + report.saved().entityCount() + " entities, "
            + report.saved().relationCount() + " relations");
        System.out.println(report.restored() ? "Live store restored" : "No backup to restore; live store left as is");
        System.out.println("Session " + report.record().id() + " stopped");
    }
}
