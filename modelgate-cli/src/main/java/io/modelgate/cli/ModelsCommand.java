package io.modelgate.cli;

import io.modelgate.core.backend.ModelDescriptor;
import io.modelgate.core.gateway.BackendRegistration;
import io.modelgate.core.runtime.ModelgateRuntime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

@Command(name = "models", description = "List registered backends and their models")
public final class ModelsCommand implements Callable<Integer> {
    private final CliContext context;

    @ParentCommand
    ModelgateCliCommand root;

    @Option(names = "--live", description = "Also ask each backend which models it currently serves")
    boolean live;

    public ModelsCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            ModelgateRuntime runtime = context.buildRuntime(context.loadConfig(root));
            if (runtime.registry().isEmpty()) {
                System.out.println("No backends configured");
                return 0;
            }

            for (BackendRegistration registration : runtime.registry().byPriority()) {
                System.out.println(registration.name() + " (priority " + registration.priority()
                    + ", default " + registration.backend().defaultModel() + ")");
                for (String modelId : registration.concreteModelIds()) {
                    System.out.println("  - " + describe(registration.descriptorFor(modelId)));
                }
                if (registration.modelIds().contains(BackendRegistration.WILDCARD)) {
                    System.out.println("  - * (any model id)");
                }
                if (live) {
                    Optional<List<String>> listing = registration.backend().listModels();
                    System.out.println("  live: " + listing.map(ids -> ids.isEmpty() ? "none" : String.join(", ", ids)).orElse("unavailable"));
                }
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Models command failed: " + e.getMessage());
            return 1;
        }
    }

    private static String describe(ModelDescriptor descriptor) {
        List<String> flags = new ArrayList<>();
        if (descriptor.vision()) {
            flags.add("vision");
        }
        if (descriptor.reasoning()) {
            flags.add("reasoning");
        }
        if (descriptor.toolUse()) {
            flags.add("tools");
        }
        String suffix = flags.isEmpty() ? "" : " " + String.join(", ", flags);
        return descriptor.id() + " [" + descriptor.tier().value() + "]" + suffix;
    }
}
