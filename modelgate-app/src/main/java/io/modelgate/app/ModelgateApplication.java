package io.modelgate.app;

import io.modelgate.cli.ChatCommand;
import io.modelgate.cli.CliContext;
import io.modelgate.cli.InitCommand;
import io.modelgate.cli.ModelgateCliCommand;
import io.modelgate.cli.ModelsCommand;
import io.modelgate.cli.RouteCommand;
import io.modelgate.cli.StatusCommand;
import io.modelgate.core.config.ConfigPaths;
import io.modelgate.core.config.ConfigService;
import io.modelgate.core.runtime.ModelgateRuntime;
import picocli.CommandLine;

public final class ModelgateApplication {

    private ModelgateApplication() {
    }

    public static void main(String[] args) {
        CliContext context = new CliContext(
            new ConfigService(),
            ConfigPaths.resolve(System.getenv("MODELGATE_CONFIG")),
            ModelgateRuntime::fromConfig
        );

        CommandLine commandLine = new CommandLine(new ModelgateCliCommand());
        commandLine.addSubcommand("init", new InitCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("models", new ModelsCommand(context));
        commandLine.addSubcommand("route", new RouteCommand(context));
        commandLine.addSubcommand("chat", new ChatCommand(context));
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);

        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }
}
