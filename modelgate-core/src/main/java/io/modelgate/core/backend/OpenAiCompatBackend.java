package io.modelgate.core.backend;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelgate.core.media.MediaReferences;
import io.modelgate.core.model.ChatMessage;
import io.modelgate.core.model.MessageRole;
import io.modelgate.core.model.ToolCall;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Backend for any endpoint speaking the OpenAI chat-completions protocol (OpenAI, OpenRouter,
 * DeepSeek, Ollama and friends). Local endpoints may run without an API key.
 */
public final class OpenAiCompatBackend implements Backend {
    private static final Logger LOG = LoggerFactory.getLogger(OpenAiCompatBackend.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

    private final String apiKey;
    private final HttpUrl baseUrl;
    private final String defaultModel;
    private final List<ModelDescriptor> descriptors;
    private final GenerationConfig generationDefaults;
    private final Map<String, String> extraHeaders;
    private final int maxAttempts;
    private final OkHttpClient client;
    private final ObjectMapper mapper;

    public OpenAiCompatBackend(String baseUrl, String apiKey, String defaultModel, List<ModelDescriptor> descriptors) {
        this(baseUrl, apiKey, defaultModel, descriptors, GenerationConfig.defaults(), Map.of(), DEFAULT_TIMEOUT, 1);
    }

    public OpenAiCompatBackend(
        String baseUrl,
        String apiKey,
        String defaultModel,
        List<ModelDescriptor> descriptors,
        GenerationConfig generationDefaults,
        Map<String, String> extraHeaders,
        Duration timeout,
        int maxAttempts
    ) {
        this.baseUrl = HttpUrl.get(Objects.requireNonNull(baseUrl, "baseUrl must not be null"));
        this.apiKey = apiKey == null ? "" : apiKey;
        this.defaultModel = Objects.requireNonNull(defaultModel, "defaultModel must not be null");
        this.descriptors = descriptors == null ? List.of() : List.copyOf(descriptors);
        this.generationDefaults = GenerationConfig.defaults().overlay(generationDefaults);
        this.extraHeaders = extraHeaders == null ? Map.of() : Map.copyOf(extraHeaders);
        this.maxAttempts = Math.max(1, maxAttempts);
        Duration deadline = timeout == null || timeout.isZero() || timeout.isNegative() ? DEFAULT_TIMEOUT : timeout;
        this.client = new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(20))
            .readTimeout(deadline)
            .writeTimeout(Duration.ofSeconds(20))
            .callTimeout(deadline)
            .build();
        this.mapper = new ObjectMapper();
    }

    @Override
    public LlmResponse chat(
        List<ChatMessage> messages,
        List<Map<String, Object>> tools,
        String modelId,
        GenerationConfig config
    ) {
        String model = modelId == null || modelId.isBlank() ? defaultModel : modelId;
        ModelDescriptor capabilities = capabilitiesOf(model);
        GenerationConfig generation = generationDefaults
            .overlay(capabilities.generationOrEmpty())
            .overlay(config);

        Request request;
        try {
            request = buildRequest(model, capabilities, messages, tools, generation);
        } catch (IOException e) {
            throw new BackendException("Failed to encode request for model " + model + ": " + e.getMessage(), e);
        }

        long delayMs = 250;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try (Response response = client.newCall(request).execute()) {
                if (!response.isSuccessful()) {
                    String errorBody = response.body() == null ? "" : response.body().string();
                    boolean retryable = response.code() == 429 || response.code() >= 500;
                    if (retryable && attempt < maxAttempts) {
                        sleep(delayMs);
                        delayMs = Math.min(delayMs * 2, 2000);
                        continue;
                    }
                    throw new BackendException("HTTP " + response.code() + ": " + errorBody, response.code());
                }

                ResponseBody body = response.body();
                if (body == null) {
                    return new LlmResponse("", List.of(), Map.of());
                }
                LlmResponse parsed = parseJson(body.string());
                LOG.debug(
                    "Model {} replied with {} chars and {} tool calls",
                    model,
                    parsed.content().length(),
                    parsed.toolCalls().size()
                );
                return parsed;
            } catch (IOException ioe) {
                if (attempt < maxAttempts) {
                    sleep(delayMs);
                    delayMs = Math.min(delayMs * 2, 2000);
                    continue;
                }
                throw new BackendException("Request to " + baseUrl + " failed: " + ioe.getMessage(), ioe);
            }
        }
        throw new BackendException("Exhausted " + maxAttempts + " attempts against " + baseUrl);
    }

    @Override
    public String defaultModel() {
        return defaultModel;
    }

    @Override
    public Optional<List<String>> listModels() {
        Request.Builder builder = new Request.Builder()
            .url(baseUrl.newBuilder().addPathSegment("models").build())
            .get()
            .header("Accept", "application/json");
        applyHeaders(builder);

        try (Response response = client.newCall(builder.build()).execute()) {
            if (!response.isSuccessful() || response.body() == null) {
                LOG.debug("Model listing at {} returned HTTP {}", baseUrl, response.code());
                return Optional.empty();
            }
            JsonNode data = mapper.readTree(response.body().string()).path("data");
            if (!data.isArray()) {
                return Optional.empty();
            }
            List<String> ids = new ArrayList<>();
            for (JsonNode item : data) {
                String id = item.path("id").asText("");
                if (!id.isBlank()) {
                    ids.add(id);
                }
            }
            return Optional.of(List.copyOf(ids));
        } catch (IOException | RuntimeException e) {
            LOG.debug("Model listing at {} failed: {}", baseUrl, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public ModelDescriptor capabilitiesOf(String modelId) {
        for (ModelDescriptor descriptor : descriptors) {
            if (descriptor.id().equals(modelId)) {
                return descriptor;
            }
        }
        return ModelDescriptor.defaults(modelId);
    }

    private Request buildRequest(
        String model,
        ModelDescriptor capabilities,
        List<ChatMessage> messages,
        List<Map<String, Object>> tools,
        GenerationConfig generation
    ) throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("messages", toWireMessages(messages, capabilities.vision()));
        putIfSet(payload, "max_tokens", generation.maxTokens());
        putIfSet(payload, "temperature", generation.temperature());
        putIfSet(payload, "top_p", generation.topP());
        putIfSet(payload, "frequency_penalty", generation.frequencyPenalty());
        // top_k is not part of the OpenAI protocol but most compatible servers honour it
        putIfSet(payload, "top_k", generation.topK());

        boolean sendTools = capabilities.toolUse() && tools != null && !tools.isEmpty();
        if (sendTools) {
            payload.put("tools", tools);
            payload.put("tool_choice", "auto");
        }
        LOG.debug(
            "Posting to model {} with {} tools (tool capable: {})",
            model,
            sendTools ? tools.size() : 0,
            capabilities.toolUse()
        );

        RequestBody body = RequestBody.create(mapper.writeValueAsString(payload), JSON);
        Request.Builder builder = new Request.Builder()
            .url(completionsUrl())
            .post(body)
            .header("Content-Type", "application/json")
            .header("Accept", "application/json");
        applyHeaders(builder);
        return builder.build();
    }

    private void applyHeaders(Request.Builder builder) {
        if (!apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
        for (Map.Entry<String, String> header : extraHeaders.entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }
    }

    private HttpUrl completionsUrl() {
        return baseUrl.newBuilder()
            .addPathSegment("chat")
            .addPathSegment("completions")
            .build();
    }

    private static void putIfSet(Map<String, Object> payload, String key, Object value) {
        if (value != null) {
            payload.put(key, value);
        }
    }

    private List<Map<String, Object>> toWireMessages(List<ChatMessage> messages, boolean vision) {
        List<Map<String, Object>> wire = new ArrayList<>();
        for (ChatMessage message : messages) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("role", message.roleValue());
            row.put("content", toWireContent(message, vision));
            if (message.role() == MessageRole.ASSISTANT && !message.toolCalls().isEmpty()) {
                row.put("tool_calls", toWireToolCalls(message.toolCalls()));
            }
            if (message.role() == MessageRole.TOOL && message.toolCallId() != null && !message.toolCallId().isBlank()) {
                row.put("tool_call_id", message.toolCallId());
            }
            wire.add(row);
        }
        return wire;
    }

    /**
     * Images go first, then the text, as OpenAI recommends. Models without vision get the plain
     * text only.
     */
    private Object toWireContent(ChatMessage message, boolean vision) {
        if (message.media().isEmpty()) {
            return message.content();
        }
        if (!vision) {
            return message.content();
        }

        List<Map<String, Object>> parts = new ArrayList<>();
        int rejected = 0;
        for (String reference : message.media().stream().limit(MediaReferences.MAX_MEDIA_COUNT).toList()) {
            if (!MediaReferences.isImageUrl(reference)) {
                continue;
            }
            if (!MediaReferences.isSafeImageUrl(reference)) {
                rejected++;
                continue;
            }
            parts.add(Map.of("type", "image_url", "image_url", Map.of("url", reference, "detail", "auto")));
        }

        if (parts.isEmpty()) {
            return rejected > 0
                ? message.content() + "\n\n[" + rejected + " invalid or restricted media links ignored]"
                : message.content();
        }
        if (!message.content().isEmpty()) {
            parts.add(Map.of("type", "text", "text", message.content()));
        }
        return parts;
    }

    private List<Map<String, Object>> toWireToolCalls(List<ToolCall> toolCalls) {
        List<Map<String, Object>> wire = new ArrayList<>();
        for (int i = 0; i < toolCalls.size(); i++) {
            ToolCall call = toolCalls.get(i);
            Map<String, Object> function = new LinkedHashMap<>();
            function.put("name", call.name());
            function.put("arguments", toArgumentsJson(call.arguments()));

            Map<String, Object> item = new LinkedHashMap<>();
            item.put("id", call.id() == null || call.id().isBlank() ? "call_" + i : call.id());
            item.put("type", "function");
            item.put("function", function);
            wire.add(item);
        }
        return wire;
    }

    private String toArgumentsJson(Map<String, Object> arguments) {
        try {
            return mapper.writeValueAsString(arguments == null ? Map.of() : arguments);
        } catch (IOException e) {
            throw new BackendException("Failed to encode tool call arguments: " + e.getMessage(), e);
        }
    }

    private LlmResponse parseJson(String body) {
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (IOException e) {
            throw new BackendException("Unreadable completion body from " + baseUrl + ": " + e.getMessage(), e);
        }
        JsonNode message = root.path("choices").path(0).path("message");
        String content = message.path("content").asText("");
        List<ToolCall> toolCalls = parseToolCalls(message.path("tool_calls"));
        Map<String, Object> usage = usageAsMap(root.path("usage"));
        return new LlmResponse(content, toolCalls, usage);
    }

    private List<ToolCall> parseToolCalls(JsonNode node) {
        if (node == null || !node.isArray()) {
            return List.of();
        }

        List<ToolCall> toolCalls = new ArrayList<>();
        for (JsonNode item : node) {
            String id = item.path("id").asText("");
            JsonNode function = item.path("function");
            String name = function.path("name").asText("");
            JsonNode argsNode = function.path("arguments");
            Map<String, Object> args;
            if (argsNode.isTextual()) {
                args = parseArguments(argsNode.asText("{}"));
            } else if (argsNode.isObject()) {
                args = mapper.convertValue(argsNode, new TypeReference<Map<String, Object>>() {
                });
            } else {
                args = Map.of();
            }
            toolCalls.add(new ToolCall(id, name, args));
        }
        return toolCalls;
    }

    private Map<String, Object> usageAsMap(JsonNode usage) {
        if (usage == null || usage.isMissingNode() || usage.isNull()) {
            return Map.of();
        }
        Map<String, Object> values = mapper.convertValue(usage, new TypeReference<LinkedHashMap<String, Object>>() {
        });
        values.values().removeIf(Objects::isNull);
        return values;
    }

    private Map<String, Object> parseArguments(String raw) {
        if (raw == null || raw.isBlank()) {
            return Map.of();
        }
        try {
            return mapper.readValue(raw, new TypeReference<Map<String, Object>>() {
            });
        } catch (IOException e) {
            LOG.warn("Discarding unparsable tool arguments: {}", raw.length() > 300 ? raw.substring(0, 300) + "..." : raw);
            return Map.of();
        }
    }

    private void sleep(long delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }
}
