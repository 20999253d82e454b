package io.modelgate.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.modelgate.core.gateway.GatewaySettings;
import java.time.Duration;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GatewayConfig(
    @JsonAlias({"default_provider"}) String defaultProvider,
    @JsonAlias({"fallback_enabled"}) boolean fallbackEnabled,
    @JsonAlias({"failover_budget_seconds"}) long failoverBudgetSeconds
) {

    public static GatewayConfig defaults() {
        return new GatewayConfig("ollama", true, 0);
    }

    public GatewaySettings toSettings() {
        return new GatewaySettings(defaultProvider, fallbackEnabled, Duration.ofSeconds(Math.max(0, failoverBudgetSeconds)));
    }
}
