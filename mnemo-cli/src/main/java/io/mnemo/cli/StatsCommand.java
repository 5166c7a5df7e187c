package io.mnemo.cli;

import io.mnemo.core.runtime.MnemoRuntime;
import io.mnemo.core.stats.MemoryStats;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "stats", description = "Count entities and relations in store files")
public final class StatsCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(arity = "0..*", description = "Store files; defaults to the live store")
    List<Path> files;

    public StatsCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            MnemoRuntime runtime = context.runtime();
            List<Path> targets = files == null || files.isEmpty() ? List.of(runtime.liveStore()) : files;
            for (Path target : targets) {
                System.out.println(describe(MemoryStats.of(target)));
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Stats failed: " + e.getMessage());
            return 1;
        }
    }

    static String describe(MemoryStats stats) {
        String line = stats.path() + ": " + stats.entities() + " entities, " + stats.relations() + " relations, "
            + stats.formattedSize();
        if (stats.undecodable() > 0) {
            line += " (" + stats.undecodable() + " undecodable lines)";
        }
        return line;
    }
}
