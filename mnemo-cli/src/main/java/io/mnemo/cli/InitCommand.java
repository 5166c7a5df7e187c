package io.mnemo.cli;

import io.mnemo.core.config.InitResult;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "init", description = "Create or refresh config and workspace memory directories")
public final class InitCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--overwrite", description = "Overwrite existing config with defaults")
    boolean overwrite;

    public InitCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            InitResult result = context.configService().init(context.configPath(), overwrite);
            if (result.createdConfig()) {
                System.out.println("Created config: " + result.configPath());
            } else if (result.overwrittenConfig()) {
                System.out.println("Overwrote config with defaults: " + result.configPath());
            } else {
                System.out.println("Refreshed config with new defaults: " + result.configPath());
            }
            System.out.println("Workspace ready: " + result.workspacePath());
            return 0;
        } catch (Exception e) {
            System.err.println("Init failed: " + e.getMessage());
            return 1;
        }
    }
}
