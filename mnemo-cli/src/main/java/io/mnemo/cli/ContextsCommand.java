package io.mnemo.cli;

import io.mnemo.core.runtime.MnemoRuntime;
import io.mnemo.core.session.ContextDiscovery;
import io.mnemo.core.session.ContextPaths;
import io.mnemo.core.session.SessionContext;
import io.mnemo.core.stats.MemoryStats;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "contexts", description = "List the contexts in the workspace that have a snapshot")
public final class ContextsCommand implements Callable<Integer> {
    private final CliContext context;

    public ContextsCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            MnemoRuntime runtime = context.runtime();
            List<SessionContext> contexts = ContextDiscovery.discover(runtime.workspace());
            if (contexts.isEmpty()) {
                System.out.println("No memory snapshots under " + runtime.workspace());
                return 0;
            }
            for (SessionContext sessionContext : contexts) {
                MemoryStats stats = MemoryStats.of(ContextPaths.resolve(runtime.workspace(), sessionContext).snapshot());
                System.out.println(sessionContext.label() + "  prefix=" + runtime.policies().prefixFor(sessionContext)
                    + "  " + stats.entities() + " entities, " + stats.relations() + " relations, " + stats.formattedSize());
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Contexts failed: " + e.getMessage());
            return 1;
        }
    }
}
