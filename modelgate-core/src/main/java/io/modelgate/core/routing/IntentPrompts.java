package io.modelgate.core.routing;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Prompt text for the intent model.
 */
public final class IntentPrompts {

    private IntentPrompts() {
    }

    public static String modelSelectionSystemPrompt(List<ModelCandidate> candidates) {
        String modelList = candidates.stream()
            .map(IntentPrompts::describe)
            .collect(Collectors.joining("\n"));

        return """
            You are a task analysis assistant. Pick the most suitable model for the user's request \
            from the available models.

            ## Available models
            %s

            ## Tiers
            - fast: greetings, confirmations, trivial questions
            - low: basic translation, formatting, short summaries, simple lookups
            - medium: general conversation, explaining code, small edits
            - high: refactoring, deeper analysis, multi-step reasoning
            - ultra: architecture, complex system analysis, hard reasoning

            ## Rules
            1. If the task needs system commands, file access or network requests, pick a model marked [tools].
            2. Code tasks need at least medium.
            3. Modifying or refactoring code needs at least high.
            4. Architecture, design patterns and optimisation analysis need ultra.
            5. Greetings and simple questions use fast or low.
            6. If the message contains an image, pick a model marked [vision].
            7. Prefer models marked [reasoning] for hard reasoning.
            8. Only pick a model from the list above.

            Reply with JSON only:
            {"model": "backend/model-id", "reason": "short justification"}
            """.formatted(modelList);
    }

    public static String taskTypeSystemPrompt(List<ModelCandidate> candidates) {
        String modelList = candidates.stream()
            .map(candidate -> "- " + candidate.qualifiedId())
            .collect(Collectors.joining("\n"));

        return """
            You classify a user's request into one task type.

            ## Available models
            %s

            ## Task types
            - vision: the request is about an image
            - coder: writing, reviewing, debugging or explaining code
            - chat: everything else

            Reply with JSON only:
            {"type": "vision|coder|chat", "reason": "short justification"}
            """.formatted(modelList);
    }

    public static String userPrompt(String content, boolean hasImage) {
        return "Analyse the following user request" + (hasImage ? " (includes an image)" : "")
            + " and choose accordingly:\n\n" + content;
    }

    private static String describe(ModelCandidate candidate) {
        List<String> capabilities = new ArrayList<>();
        if (candidate.descriptor().vision()) {
            capabilities.add("vision");
        }
        if (candidate.descriptor().reasoning()) {
            capabilities.add("reasoning");
        }
        if (candidate.descriptor().toolUse()) {
            capabilities.add("tools");
        }
        String suffix = capabilities.isEmpty() ? "" : " [" + String.join(", ", capabilities) + "]";
        return "- " + candidate.qualifiedId() + " (" + candidate.tier().value() + ")" + suffix;
    }
}
