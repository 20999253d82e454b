package io.modelgate.cli;

import io.modelgate.core.config.model.ModelgateConfig;
import io.modelgate.core.gateway.ModelValidationError;
import io.modelgate.core.gateway.ModelValidationResult;
import io.modelgate.core.routing.RouterStatus;
import io.modelgate.core.runtime.ModelgateRuntime;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

@Command(name = "status", description = "Show configuration, routing and model validation status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    @ParentCommand
    ModelgateCliCommand root;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            Path configPath = context.resolveConfigPath(root);
            ModelgateConfig config = context.configService().load(configPath);
            ModelgateRuntime runtime = context.buildRuntime(config);
            RouterStatus status = runtime.router().status();

            System.out.println("Config path: " + configPath);
            System.out.println("Config exists: " + Files.exists(configPath));
            System.out.println("Backends: " + runtime.registry().registrations().size());
            System.out.println("Default backend: " + config.gateway().defaultProvider());
            System.out.println("Failover enabled: " + config.gateway().fallbackEnabled());
            System.out.println("Auto routing: " + status.auto());
            System.out.println("Performance first: " + status.performanceFirst());
            System.out.println("Routing rules: " + status.rulesCount());
            System.out.println("Routable models: " + status.candidateCount());
            System.out.println("Chat model: " + status.chatModel());
            System.out.println("Intent model: " + status.intentModel());

            ModelValidationResult validation = runtime.validator().validate(runtime.router().settings());
            if (validation.valid()) {
                System.out.println("Model validation: ok");
            } else {
                System.out.println("Model validation: " + validation.errors().size() + " problem(s)");
                for (ModelValidationError error : validation.errors()) {
                    System.out.println("  - " + error.message());
                }
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
