package io.modelgate.core.runtime;

import io.modelgate.core.backend.Backend;
import io.modelgate.core.backend.GenerationConfig;
import io.modelgate.core.backend.ModelDescriptor;
import io.modelgate.core.backend.OpenAiCompatBackend;
import io.modelgate.core.config.model.AgentDefaults;
import io.modelgate.core.config.model.ModelgateConfig;
import io.modelgate.core.config.model.ProviderConfig;
import io.modelgate.core.gateway.BackendRegistration;
import io.modelgate.core.gateway.BackendRegistry;
import io.modelgate.core.gateway.LlmGateway;
import io.modelgate.core.gateway.ModelValidationService;
import io.modelgate.core.routing.IntentClassifier;
import io.modelgate.core.routing.ModelRouter;
import io.modelgate.core.routing.RouterSettings;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Everything built once at startup: the registration table, the router over its models, the
 * gateway, and the intent classifier that calls back into the gateway.
 */
public record ModelgateRuntime(
    BackendRegistry registry,
    ModelRouter router,
    LlmGateway gateway,
    IntentClassifier classifier,
    ModelValidationService validator
) {
    private static final Logger LOG = LoggerFactory.getLogger(ModelgateRuntime.class);

    public static ModelgateRuntime fromConfig(ModelgateConfig config) {
        BackendRegistry.Builder builder = BackendRegistry.builder();
        GenerationConfig generation = config.agents().defaults().generation();
        for (Map.Entry<String, ProviderConfig> entry : config.providers().entrySet()) {
            String name = entry.getKey();
            ProviderConfig provider = entry.getValue();
            if (provider == null || !provider.configured()) {
                LOG.warn("Skipping backend {}: no baseUrl configured", name);
                continue;
            }
            List<String> modelIds = provider.models().stream().map(ModelDescriptor::id).toList();
            String defaultModel = modelIds.stream()
                .filter(id -> !BackendRegistration.WILDCARD.equals(id))
                .findFirst()
                .orElse(null);
            if (defaultModel == null) {
                LOG.warn("Skipping backend {}: no concrete model configured", name);
                continue;
            }

            Backend backend = new OpenAiCompatBackend(
                provider.baseUrl(),
                provider.apiKey(),
                defaultModel,
                provider.models(),
                generation,
                provider.extraHeaders(),
                provider.timeoutSeconds() == null ? null : Duration.ofSeconds(provider.timeoutSeconds()),
                provider.maxAttempts() == null ? 1 : provider.maxAttempts()
            );
            builder.registerBackend(name, backend, modelIds, provider.priorityOrDefault(), provider.models());
            LOG.debug("Registered backend {} with {} models", name, modelIds.size());
        }
        return assemble(builder.build(), config, Clock.systemUTC());
    }

    /**
     * Wires router, gateway and classifier over an already-built registration table.
     */
    public static ModelgateRuntime assemble(BackendRegistry registry, ModelgateConfig config, Clock clock) {
        AgentDefaults defaults = config.agents().defaults();
        RouterSettings routerSettings = new RouterSettings(
            defaults.models().chat(),
            defaults.models().intent(),
            defaults.models().vision(),
            defaults.models().coder(),
            defaults.auto(),
            defaults.max(),
            config.routing()
        );
        ModelRouter router = new ModelRouter(routerSettings, registry.candidates());
        LlmGateway gateway = new LlmGateway(registry, config.gateway().toSettings(), router, clock);
        return new ModelgateRuntime(
            registry,
            router,
            gateway,
            new IntentClassifier(gateway, router),
            new ModelValidationService(registry)
        );
    }
}
