package io.modelgate.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.modelgate.core.routing.RoutingConfig;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ModelgateConfig(
    AgentsConfig agents,
    Map<String, ProviderConfig> providers,
    RoutingConfig routing,
    GatewayConfig gateway
) {

    public ModelgateConfig {
        providers = providers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(providers));
        routing = routing == null ? RoutingConfig.defaults() : routing;
        gateway = gateway == null ? GatewayConfig.defaults() : gateway;
    }

    public static ModelgateConfig defaults() {
        Map<String, ProviderConfig> providers = new LinkedHashMap<>();
        providers.put("ollama", ProviderConfig.local("http://localhost:11434/v1", "qwen3"));
        return new ModelgateConfig(
            AgentsConfig.defaultConfig(),
            providers,
            RoutingConfig.defaults(),
            GatewayConfig.defaults()
        );
    }
}
