package io.modelgate.core.routing;

public enum RoutingMode {
    FIXED,
    AUTO,
    PERFORMANCE_FIRST
}
