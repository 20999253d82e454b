package io.modelgate.cli;

import io.modelgate.core.config.InitResult;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

@Command(name = "init", description = "Write a default config file, or refresh an existing one with new defaults")
public final class InitCommand implements Callable<Integer> {
    private final CliContext context;

    @ParentCommand
    ModelgateCliCommand root;

    @Option(names = "--overwrite", description = "Replace an existing config with the defaults")
    boolean overwrite;

    public InitCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            InitResult result = context.configService().init(context.resolveConfigPath(root), overwrite);
            if (result.createdConfig()) {
                System.out.println("Created config: " + result.configPath());
            } else if (result.overwrittenConfig()) {
                System.out.println("Overwrote config with defaults: " + result.configPath());
            } else {
                System.out.println("Refreshed config with new defaults: " + result.configPath());
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Init command failed: " + e.getMessage());
            return 1;
        }
    }
}
