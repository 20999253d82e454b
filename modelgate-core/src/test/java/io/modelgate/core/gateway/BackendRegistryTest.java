package io.modelgate.core.gateway;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.modelgate.core.backend.Backend;
import io.modelgate.core.backend.GenerationConfig;
import io.modelgate.core.backend.LlmResponse;
import io.modelgate.core.backend.ModelDescriptor;
import io.modelgate.core.backend.Tier;
import io.modelgate.core.model.ChatMessage;
import io.modelgate.core.routing.ModelCandidate;
import io.modelgate.core.routing.ModelRouter;
import io.modelgate.core.routing.RouteResult;
import io.modelgate.core.routing.RouterSettings;
import io.modelgate.core.routing.RoutingConfig;
import io.modelgate.core.routing.RoutingRequest;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class BackendRegistryTest {

    @Test
    void shouldRejectDuplicateBackendNames() {
        BackendRegistry.Builder builder = BackendRegistry.builder()
            .registerBackend("local", new StubBackend("m"), List.of("m"), 1, List.of());

        assertThatThrownBy(() -> builder.registerBackend("local", new StubBackend("n"), List.of("n"), 2, List.of()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("local");
    }

    @Test
    void shouldOrderByPriorityAndKeepRegistrationOrderForTies() {
        BackendRegistry registry = BackendRegistry.builder()
            .registerBackend("c", new StubBackend("m"), List.of("m"), 5, List.of())
            .registerBackend("a", new StubBackend("m"), List.of("m"), 1, List.of())
            .registerBackend("b", new StubBackend("m"), List.of("m"), 5, List.of())
            .build();

        assertThat(registry.byPriority()).extracting(BackendRegistration::name).containsExactly("a", "c", "b");
        assertThat(registry.registrations()).extracting(BackendRegistration::name).containsExactly("c", "a", "b");
    }

    @Test
    void shouldExposeConcreteModelsAsCandidates() {
        ModelDescriptor eye = new ModelDescriptor("llava", true, false, false, Tier.LOW);
        BackendRegistry registry = BackendRegistry.builder()
            .registerBackend("local", new StubBackend("qwen3"), List.of("qwen3", "llava", "*"), 1, List.of(eye))
            .build();

        List<ModelCandidate> candidates = registry.candidates();

        assertThat(candidates).extracting(ModelCandidate::qualifiedId).containsExactly("local/qwen3", "local/llava");
        assertThat(candidates.get(0).tier()).isEqualTo(Tier.MEDIUM);
        assertThat(candidates.get(1).descriptor()).isEqualTo(eye);
        assertThat(registry.find("local").orElseThrow().serves("anything")).isTrue();
        assertThat(registry.find("missing")).isEmpty();
    }

    @Test
    void shouldPassThroughWhenOnlyWildcardBackendsAreRegistered() {
        BackendRegistry registry = BackendRegistry.builder()
            .registerBackend("openrouter", new StubBackend("gpt-4o"), List.of("*"), 1, List.of())
            .build();
        ModelRouter router = new ModelRouter(RouterSettings.auto("openrouter/gpt-4o", RoutingConfig.defaults()), registry.candidates());

        RouteResult result = router.route(RoutingRequest.of(List.of(ChatMessage.user("hello")), null, "mistral-large"));

        assertThat(registry.candidates()).isEmpty();
        assertThat(result.backendName()).isNull();
        assertThat(result.modelId()).isEqualTo("mistral-large");
        assertThat(result.reason()).isEqualTo("no routable models registered, passing through");
    }

    private record StubBackend(String defaultModel) implements Backend {
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
        public Optional<List<String>> listModels() {
            return Optional.of(List.of(defaultModel));
        }

        @Override
        public ModelDescriptor capabilitiesOf(String modelId) {
            return ModelDescriptor.defaults(modelId);
        }
    }
}
