package io.modelgate.cli;

import io.modelgate.core.config.model.ModelgateConfig;
import io.modelgate.core.model.ChatMessage;
import io.modelgate.core.routing.RouteResult;
import io.modelgate.core.routing.RoutingMode;
import io.modelgate.core.routing.RoutingRequest;
import io.modelgate.core.runtime.ModelgateRuntime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

/**
 * Dry run: prints which model a prompt would be routed to without calling it.
 */
@Command(name = "route", description = "Show the routing decision for a prompt")
public final class RouteCommand implements Callable<Integer> {
    private final CliContext context;

    @ParentCommand
    ModelgateCliCommand root;

    @Parameters(index = "0", arity = "1", description = "Prompt to route")
    String prompt;

    @Option(names = {"-i", "--image"}, description = "Image URL or data URI attached to the prompt (repeatable)")
    List<String> images = new ArrayList<>();

    @Option(names = "--mode", description = "Routing mode: ${COMPLETION-CANDIDATES} (default: from config)")
    RoutingMode mode;

    @Option(names = "--intent", description = "Ask the intent model instead of scoring locally")
    boolean intent;

    public RouteCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            ModelgateConfig config = context.loadConfig(root);
            ModelgateRuntime runtime = context.buildRuntime(config);
            RoutingRequest request = RoutingRequest.of(List.of(ChatMessage.user(prompt, images)), mode, null);

            RouteResult result = intent
                ? runtime.classifier().classify(request)
                : runtime.router().route(request);

            System.out.println("Model: " + result.qualifiedModel());
            System.out.println("Tier: " + result.descriptor().tier().value());
            System.out.println("Score: " + result.complexityScore());
            System.out.println("Reason: " + result.reason());
            return 0;
        } catch (Exception e) {
            System.err.println("Route command failed: " + e.getMessage());
            return 1;
        }
    }
}
