package io.modelgate.core.runtime;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelgate.core.backend.LlmResponse;
import io.modelgate.core.config.ConfigService;
import io.modelgate.core.config.model.ModelgateConfig;
import io.modelgate.core.gateway.BackendRegistration;
import io.modelgate.core.gateway.ModelValidationResult;
import io.modelgate.core.model.ChatMessage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ModelgateRuntimeTest {

    @TempDir
    Path tempDir;

    private MockWebServer server;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void shouldBuildRegistryAndRouteThroughGateway() throws Exception {
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "agents": { "defaults": { "models": { "chat": "local/big" }, "temperature": 0.4 } },
              "providers": {
                "local": {
                  "baseUrl": "%s",
                  "priority": 1,
                  "models": [
                    { "id": "small", "tier": "fast" },
                    { "id": "big", "tier": "ultra", "reasoning": true }
                  ]
                },
                "unconfigured": { "models": ["ghost"] },
                "wildcard": { "baseUrl": "http://localhost:9/v1", "models": ["*"] }
              }
            }
            """.formatted(server.url("/v1")));
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("{\"choices\":[{\"message\":{\"content\":\"hi there\"}}]}"));

        ModelgateConfig config = new ConfigService().load(configPath);
        ModelgateRuntime runtime = ModelgateRuntime.fromConfig(config);

        assertThat(runtime.registry().registrations()).extracting(BackendRegistration::name).containsExactly("local");
        assertThat(runtime.router().status().candidateCount()).isEqualTo(2);
        assertThat(runtime.gateway().defaultModel()).isEqualTo("local/small");

        LlmResponse response = runtime.gateway().chat(List.of(ChatMessage.user("hello")), List.of(), null, null);

        assertThat(response.content()).isEqualTo("hi there");
        assertThat(response.usedModel()).isEqualTo("small");
        JsonNode body = new ObjectMapper().readTree(server.takeRequest().getBody().readUtf8());
        assertThat(body.path("model").asText()).isEqualTo("small");
        assertThat(body.path("temperature").asDouble()).isEqualTo(0.4);
    }

    @Test
    void shouldBuildRuntimeWithoutChatModelAndLeaveItToValidation() throws Exception {
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "agents": { "defaults": { "models": { "chat": null } } },
              "providers": { "local": { "baseUrl": "%s", "models": ["small"] } }
            }
            """.formatted(server.url("/v1")));

        ModelgateRuntime runtime = ModelgateRuntime.fromConfig(new ConfigService().load(configPath));
        ModelValidationResult result = runtime.validator().validate(runtime.router().settings());

        assertThat(runtime.router().settings().chatModel()).isNull();
        assertThat(result.valid()).isFalse();
        assertThat(result.errors().get(0).message()).isEqualTo("chat model must be configured");
    }
}
