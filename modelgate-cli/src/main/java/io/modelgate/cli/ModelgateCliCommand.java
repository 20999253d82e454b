package io.modelgate.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

@Command(name = "modelgate", mixinStandardHelpOptions = true, description = "Route and fail over chat completions across LLM backends")
public final class ModelgateCliCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Option(names = {"-c", "--config"}, description = "Config file (default: ~/.modelgate/config.json)")
    String configOverride;

    public String configOverride() {
        return configOverride;
    }

    @Override
    public void run() {
        spec.commandLine().usage(System.out);
    }
}
