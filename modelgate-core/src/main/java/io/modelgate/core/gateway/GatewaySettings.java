package io.modelgate.core.gateway;

import java.time.Duration;

public record GatewaySettings(String defaultBackend, boolean fallbackEnabled, Duration failoverBudget) {

    public GatewaySettings {
        failoverBudget = failoverBudget == null || failoverBudget.isNegative() ? Duration.ZERO : failoverBudget;
    }

    public static GatewaySettings defaults() {
        return new GatewaySettings(null, true, Duration.ZERO);
    }

    public boolean budgeted() {
        return !failoverBudget.isZero();
    }
}
