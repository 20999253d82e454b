package io.modelgate.core.routing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelgate.core.backend.Backend;
import io.modelgate.core.backend.GenerationConfig;
import io.modelgate.core.backend.LlmResponse;
import io.modelgate.core.media.MediaReferences;
import io.modelgate.core.model.ChatMessage;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Asks a designated intent model which candidate should serve a request.
 *
 * <p>The classifier never throws. An unreachable backend, malformed JSON or a model that was not
 * offered all degrade to {@link ModelRouter#fallbackRoute(RoutingRequest)}: keyword rules first,
 * then the complexity score.
 */
public final class IntentClassifier {
    private static final Logger LOG = LoggerFactory.getLogger(IntentClassifier.class);
    private static final GenerationConfig CLASSIFICATION = new GenerationConfig(200, 0.3, null, null, null);

    private final Backend backend;
    private final ModelRouter router;
    private final ObjectMapper mapper = new ObjectMapper();

    /**
     * @param backend where the intent model is served, usually the gateway itself; may be {@code null}
     */
    public IntentClassifier(Backend backend, ModelRouter router) {
        this.backend = backend;
        this.router = router;
    }

    public RouteResult classify(RoutingRequest request) {
        if (backend == null) {
            return router.fallbackRoute(request);
        }

        boolean hasImage = MediaReferences.hasImage(request.media());
        List<ModelCandidate> offered = router.candidates(hasImage);
        if (offered.isEmpty()) {
            return router.fallbackRoute(request);
        }

        Optional<JsonNode> answer = ask(IntentPrompts.modelSelectionSystemPrompt(offered), request, hasImage);
        if (answer.isPresent()) {
            String model = answer.get().path("model").asText("");
            String reason = answer.get().path("reason").asText("");
            boolean listed = offered.stream().anyMatch(candidate -> candidate.qualifiedId().equals(model));
            if (listed) {
                LOG.info("Intent model picked {}: {}", model, reason);
                return router.routeTo(model, 0, "intent: " + reason);
            }
            LOG.warn("Intent model named {} which was not offered; falling back to rules", model);
        }
        return router.fallbackRoute(request);
    }

    /**
     * Classifies a request as vision, coder or chat. Images short-circuit to vision; anything
     * unusable from the intent model degrades to chat.
     */
    public TaskTypeResult classifyTaskType(RoutingRequest request) {
        if (MediaReferences.hasImage(request.media())) {
            return new TaskTypeResult(TaskType.VISION, "image attached");
        }
        if (backend != null) {
            Optional<JsonNode> answer = ask(IntentPrompts.taskTypeSystemPrompt(router.candidates(false)), request, false);
            if (answer.isPresent()) {
                Optional<TaskType> type = TaskType.parse(answer.get().path("type").asText(null));
                if (type.isPresent()) {
                    return new TaskTypeResult(type.get(), answer.get().path("reason").asText(""));
                }
                LOG.warn("Intent model returned an unknown task type; defaulting to chat");
            }
        }
        return new TaskTypeResult(TaskType.CHAT, "default task type");
    }

    private Optional<JsonNode> ask(String systemPrompt, RoutingRequest request, boolean hasImage) {
        String conversation = request.messages().stream()
            .map(message -> message.roleValue() + ": " + message.content())
            .collect(Collectors.joining("\n"));
        List<ChatMessage> prompt = List.of(
            ChatMessage.system(systemPrompt),
            ChatMessage.user(IntentPrompts.userPrompt(conversation, hasImage))
        );

        try {
            LlmResponse response = backend.chat(prompt, List.of(), router.settings().intentModel(), CLASSIFICATION);
            return extractJson(response.content());
        } catch (RuntimeException e) {
            LOG.warn("Intent classification failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Parses the outermost {@code {...}} block of a reply, ignoring any chatter around it.
     */
    Optional<JsonNode> extractJson(String content) {
        if (content == null) {
            return Optional.empty();
        }
        int start = content.indexOf('{');
        int end = content.lastIndexOf('}');
        if (start < 0 || end <= start) {
            LOG.warn("Intent model reply contained no JSON object");
            return Optional.empty();
        }
        try {
            JsonNode node = mapper.readTree(content.substring(start, end + 1));
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (JsonProcessingException e) {
            LOG.warn("Intent model reply was not valid JSON: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
