package io.mnemo.cli;

import io.mnemo.core.merge.ConflictPolicy;
import io.mnemo.core.merge.MergeResult;
import io.mnemo.core.merge.MergeValidationFailedException;
import io.mnemo.core.runtime.MnemoRuntime;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

@Command(name = "merge", description = "Merge a remote store into a local one")
public final class MergeCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"-l", "--local"}, required = true, description = "Local store")
    Path local;

    @Option(names = {"-r", "--remote"}, required = true, description = "Remote store")
    Path remote;

    @Option(names = {"-o", "--output"}, description = "Merged output; defaults to the local store")
    Path output;

    @Option(names = {"-p", "--policy"}, description = "Conflict policy: remote-wins, local-wins or newest-wins")
    String policy;

    @Mixin
    NamingOptions naming;

    public MergeCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            MnemoRuntime runtime = context.runtime();
            ConflictPolicy conflictPolicy = policy != null ? ConflictPolicy.fromLabel(policy) : runtime.defaultConflictPolicy();
            MergeResult result = runtime.mergeEngine().merge(
                local,
                remote,
                output != null ? output : local,
                conflictPolicy,
                naming.policy(runtime)
            );
            System.out.println("Merged into " + result.output() + " (" + result.policy().label() + ")");
            System.out.println("Entities: " + result.entityCount() + ", relations: " + result.relationCount());
            System.out.println("Conflicts resolved: " + result.conflictsResolved());
            System.out.println("Duplicates dropped: " + result.duplicateEntitiesDropped() + " entities, "
                + result.duplicateRelationsDropped() + " relations");
            return 0;
        } catch (MergeValidationFailedException e) {
            System.err.println("Merge failed: " + e.getMessage() + "; output left unchanged");
            e.report().errors().forEach(error -> System.err.println("  " + error));
            return 1;
        } catch (Exception e) {
            System.err.println("Merge failed: " + e.getMessage());
            return 1;
        }
    }
}
