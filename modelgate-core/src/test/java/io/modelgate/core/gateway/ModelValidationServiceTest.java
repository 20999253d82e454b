package io.modelgate.core.gateway;

import static org.assertj.core.api.Assertions.assertThat;

import io.modelgate.core.backend.Backend;
import io.modelgate.core.backend.GenerationConfig;
import io.modelgate.core.backend.LlmResponse;
import io.modelgate.core.backend.ModelDescriptor;
import io.modelgate.core.model.ChatMessage;
import io.modelgate.core.routing.RouterSettings;
import io.modelgate.core.routing.RoutingConfig;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ModelValidationServiceTest {

    private final BackendRegistry registry = BackendRegistry.builder()
        .registerBackend("local", new ListingBackend(Optional.of(List.of("qwen3", "llava:7b"))), List.of("qwen3"), 1, List.of())
        .registerBackend("remote", new ListingBackend(Optional.empty()), List.of("gpt-4o"), 2, List.of())
        .build();

    @Test
    void shouldAcceptModelsPresentInLiveListings() {
        RouterSettings settings = new RouterSettings("local/qwen3", null, "local/llava:7b", null, true, false, RoutingConfig.defaults());

        assertThat(new ModelValidationService(registry).validate(settings).valid()).isTrue();
    }

    @Test
    void shouldReportMissingModelsAndUnknownBackends() {
        RouterSettings settings = new RouterSettings(
            "local/qwen3",
            "local/phi3",
            "vision/llava",
            "remote/never-listed",
            true,
            false,
            RoutingConfig.defaults()
        );

        ModelValidationResult result = new ModelValidationService(registry).validate(settings);

        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).extracting(ModelValidationError::role).containsExactly("intent", "vision");
        assertThat(result.errors().get(0).message()).isEqualTo("intent model local/phi3 is not available");
        assertThat(result.errors().get(1).message()).isEqualTo("backend vision is not registered");
    }

    @Test
    void shouldReportMissingChatModelInsteadOfFailing() {
        RouterSettings settings = new RouterSettings(null, null, null, null, true, false, RoutingConfig.defaults());

        ModelValidationResult result = new ModelValidationService(registry).validate(settings);

        assertThat(settings.chatModel()).isNull();
        assertThat(settings.intentModel()).isNull();
        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).extracting(ModelValidationError::role).containsExactly("chat");
        assertThat(result.errors().get(0).message()).isEqualTo("chat model must be configured");
    }

    private record ListingBackend(Optional<List<String>> listing) implements Backend {
        @Override
        public LlmResponse chat(
            List<ChatMessage> messages,
            List<Map<String, Object>> tools,
            String modelId,
            GenerationConfig config
        ) {
            return new LlmResponse("ok", List.of(), Map.of());
        }

        @Override
        public String defaultModel() {
            return "default";
        }

        @Override
        public Optional<List<String>> listModels() {
            return listing;
        }

        @Override
        public ModelDescriptor capabilitiesOf(String modelId) {
            return ModelDescriptor.defaults(modelId);
        }
    }
}
