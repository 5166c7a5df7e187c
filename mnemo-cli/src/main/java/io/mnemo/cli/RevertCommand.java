package io.mnemo.cli;

import io.mnemo.core.runtime.MnemoRuntime;
import io.mnemo.core.session.ContextPaths;
import io.mnemo.core.session.SessionContext;
import io.mnemo.core.session.SessionRecord;
import io.mnemo.core.snapshot.RevertResult;
import io.mnemo.core.stats.MemoryStats;
import io.mnemo.core.validation.StoreValidationException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.regex.Pattern;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "revert", description = "Put a context snapshot back to one of its checkpoints")
public final class RevertCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "framework or project:<name>")
    String contextLabel;

    @Parameters(index = "1", arity = "0..1", description = "Checkpoint file or its timestamp suffix; latest when omitted")
    String checkpoint;

    @Option(names = "--partial", paramLabel = "REGEX", description = "Only restore entities whose name matches")
    String partial;

    @Option(names = "--list", description = "List the context's checkpoints and exit")
    boolean list;

    public RevertCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            MnemoRuntime runtime = context.runtime();
            SessionContext ctx = SessionContext.parse(contextLabel);
            Path snapshot = ContextPaths.resolve(runtime.workspace(), ctx).snapshot();
            List<Path> checkpoints = runtime.snapshots().checkpoints(snapshot);

            if (list) {
                if (checkpoints.isEmpty()) {
                    System.out.println("No checkpoints for " + ctx.label());
                }
                for (Path path : checkpoints) {
                    System.out.println(path.getFileName() + "  " + StatsCommand.describe(MemoryStats.of(path)));
                }
                return 0;
            }

            Optional<SessionRecord> active = runtime.sessionRecords().load();
            if (active.isPresent()) {
                System.err.println("Revert failed: session " + active.get().id() + " is active on "
                    + active.get().context() + "; stop it first");
                return 1;
            }

            Path source = resolveCheckpoint(snapshot, checkpoints);
            Optional<Pattern> filter = partial == null ? Optional.empty() : Optional.of(Pattern.compile(partial));
            RevertResult result = runtime.snapshots().revert(source, snapshot, filter, runtime.policies().forContext(ctx));

            System.out.println("Reverted " + ctx.label() + " to " + source.getFileName()
                + (result.partial() ? " (entities matching " + partial + ")" : ""));
            System.out.println("Entities: " + result.entitiesKept() + " kept, " + result.entitiesDropped() + " dropped");
            System.out.println("Relations: " + result.relationsKept() + " kept, " + result.relationsDropped() + " dropped");
            return 0;
        } catch (StoreValidationException e) {
            System.err.println("Revert failed: " + e.getMessage() + "; snapshot left unchanged");
            e.report().errors().forEach(error -> System.err.println("  " + error));
            return 1;
        } catch (Exception e) {
            System.err.println("Revert failed: " + e.getMessage());
            return 1;
        }
    }

    private Path resolveCheckpoint(Path snapshot, List<Path> checkpoints) throws NoSuchFileException {
        if (checkpoint == null) {
            if (checkpoints.isEmpty()) {
                throw new NoSuchFileException(snapshot.toString(), null, "no checkpoints");
            }
            return checkpoints.get(checkpoints.size() - 1);
        }
        Path direct = Path.of(checkpoint);
        if (Files.exists(direct)) {
            return direct;
        }
        return snapshot.resolveSibling(snapshot.getFileName() + ".backup-" + checkpoint);
    }
}
