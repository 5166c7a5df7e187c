package io.mnemo.cli;

import io.mnemo.core.runtime.MnemoRuntime;
import io.mnemo.core.session.SessionContext;
import io.mnemo.core.session.SessionWorkflow;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "run", description = "Start a session, run the assistant command, then stop the session")
public final class RunCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "framework or project:<name>")
    String contextLabel;

    @Parameters(index = "1..*", arity = "1..*", description = "Assistant command and its arguments")
    List<String> command;

    @Option(names = {"-r", "--remote"}, description = "Remote snapshot to merge into the context first")
    Path remote;

    @Option(names = {"-p", "--policy"}, description = "Conflict policy for the merge")
    String policy;

    @Option(names = "--timeout-ms", description = "How long to wait for the assistant to release the live store")
    Long timeoutMillis;

    public RunCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        MnemoRuntime runtime;
        SessionWorkflow workflow;
        try {
            runtime = context.runtime();
            workflow = runtime.workflow();
            StartCommand.print(StartCommand.start(runtime, workflow, SessionContext.parse(contextLabel), remote, policy));
        } catch (Exception e) {
            System.err.println("Run failed: " + e.getMessage());
            return 1;
        }

        int exitCode;
        try {
            Process process = new ProcessBuilder(command)
                .directory(runtime.workspace().toFile())
                .inheritIO()
                .start();
            exitCode = process.waitFor();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            System.err.println("Run interrupted; stopping session");
            exitCode = 1;
        } catch (Exception e) {
            System.err.println("Could not launch " + String.join(" ", command) + ": " + e.getMessage());
            exitCode = 1;
        }

        try {
            StopCommand.print(StopCommand.stop(workflow, timeoutMillis));
            return exitCode;
        } catch (Exception e) {
            System.err.println("Run failed: " + e.getMessage());
            return 1;
        }
    }
}
