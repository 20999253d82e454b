package io.modelgate.cli;

import io.modelgate.core.backend.LlmResponse;
import io.modelgate.core.config.model.ModelgateConfig;
import io.modelgate.core.model.ChatMessage;
import io.modelgate.core.routing.RouteResult;
import io.modelgate.core.routing.RoutingRequest;
import io.modelgate.core.runtime.ModelgateRuntime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

@Command(name = "chat", description = "Send a prompt through the gateway")
public final class ChatCommand implements Callable<Integer> {
    private final CliContext context;

    @ParentCommand
    ModelgateCliCommand root;

    @Parameters(index = "0", arity = "1", description = "Prompt to send")
    String prompt;

    @Option(names = {"-m", "--model"}, description = "Model as backend/model or a bare model id; skips routing")
    String model;

    @Option(names = {"-s", "--system"}, description = "System prompt")
    String system;

    @Option(names = {"-i", "--image"}, description = "Image URL or data URI attached to the prompt (repeatable)")
    List<String> images = new ArrayList<>();

    @Option(names = "--intent", description = "Let the intent model pick the target model")
    boolean intent;

    @Option(names = {"-v", "--verbose"}, description = "Print which backend and model served the reply")
    boolean verbose;

    public ChatCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            ModelgateConfig config = context.loadConfig(root);
            ModelgateRuntime runtime = context.buildRuntime(config);

            List<ChatMessage> messages = new ArrayList<>();
            if (system != null && !system.isBlank()) {
                messages.add(ChatMessage.system(system));
            }
            messages.add(ChatMessage.user(prompt, images));

            String target = model;
            if ((target == null || target.isBlank()) && intent) {
                RouteResult route = runtime.classifier().classify(RoutingRequest.of(messages));
                target = route.qualifiedModel();
            }

            LlmResponse response = runtime.gateway().chat(messages, List.of(), target, null);
            System.out.println(response.content());
            if (verbose) {
                String tier = response.usedTier() == null ? "unknown" : response.usedTier().value();
                System.out.println("(served by " + response.usedBackend() + "/" + response.usedModel() + ", tier " + tier + ")");
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Chat command failed: " + e.getMessage());
            return 1;
        }
    }
}
