package io.mnemo.app;

import io.mnemo.cli.CliContext;
import io.mnemo.cli.ContextsCommand;
import io.mnemo.cli.InitCommand;
import io.mnemo.cli.MergeCommand;
import io.mnemo.cli.MnemoCliCommand;
import io.mnemo.cli.RestoreCommand;
import io.mnemo.cli.RevertCommand;
import io.mnemo.cli.RunCommand;
import io.mnemo.cli.StartCommand;
import io.mnemo.cli.StatsCommand;
import io.mnemo.cli.StatusCommand;
import io.mnemo.cli.StopCommand;
import io.mnemo.cli.ValidateCommand;
import io.mnemo.core.config.ConfigPaths;
import io.mnemo.core.config.ConfigService;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;

public final class MnemoApplication {
    private static final String CONFIG_OPTION = "--config";

    private MnemoApplication() {
    }

    public static void main(String[] args) {
        List<String> remaining = new ArrayList<>();
        Path configPath = extractConfigPath(args, remaining);

        CliContext context = new CliContext(new ConfigService(), configPath);
        int exitCode = commandLine(context).execute(remaining.toArray(new String[0]));
        System.exit(exitCode);
    }

    static CommandLine commandLine(CliContext context) {
        CommandLine commandLine = new CommandLine(new MnemoCliCommand());
        commandLine.addSubcommand("init", new InitCommand(context));
        commandLine.addSubcommand("validate", new ValidateCommand(context));
        commandLine.addSubcommand("merge", new MergeCommand(context));
        commandLine.addSubcommand("stats", new StatsCommand(context));
        commandLine.addSubcommand("contexts", new ContextsCommand(context));
        commandLine.addSubcommand("start", new StartCommand(context));
        commandLine.addSubcommand("stop", new StopCommand(context));
        commandLine.addSubcommand("run", new RunCommand(context));
        commandLine.addSubcommand("restore", new RestoreCommand(context));
        commandLine.addSubcommand("revert", new RevertCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        return commandLine;
    }

    static Path extractConfigPath(String[] args, List<String> remaining) {
        Path configPath = ConfigPaths.defaultConfigPath();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("--".equals(arg)) {
                for (int j = i; j < args.length; j++) {
                    remaining.add(args[j]);
                }
                break;
            }
            if (CONFIG_OPTION.equals(arg) && i + 1 < args.length) {
                configPath = Path.of(args[++i]);
            } else if (arg.startsWith(CONFIG_OPTION + "=")) {
                configPath = Path.of(arg.substring(CONFIG_OPTION.length() + 1));
            } else {
                remaining.add(arg);
            }
        }
        return configPath;
    }
}
